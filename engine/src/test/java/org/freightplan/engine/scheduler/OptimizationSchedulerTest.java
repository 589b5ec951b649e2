package org.freightplan.engine.scheduler;

import org.freightplan.engine.domain.model.OptimizationResult;
import org.freightplan.engine.domain.service.OptimizationService;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OptimizationSchedulerTest {

    private final OptimizationService service = mock(OptimizationService.class);

    @Test
    void cycleRunsPendingOptimization() {
        when(service.optimizePending()).thenReturn(OptimizationResult.empty());
        OptimizationScheduler scheduler = new OptimizationScheduler(service, 60);

        scheduler.runOptimizationCycle();

        verify(service).optimizePending();
        assertEquals(1, scheduler.getCycleCount());
    }

    @Test
    void failingCycleDoesNotEscapeAndStillCounts() {
        when(service.optimizePending()).thenThrow(new IllegalStateException("order API down"));
        OptimizationScheduler scheduler = new OptimizationScheduler(service, 60);

        assertDoesNotThrow(scheduler::runOptimizationCycle);
        assertDoesNotThrow(scheduler::runOptimizationCycle);
        verify(service, times(2)).optimizePending();
        assertEquals(2, scheduler.getCycleCount());
    }

    @Test
    void startIsIdempotentAndStopEndsTheSchedule() {
        OptimizationScheduler scheduler = new OptimizationScheduler(service, 3600);

        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
        verifyNoInteractions(service);
    }

    @Test
    void stoppedSchedulerCannotRestart() {
        OptimizationScheduler scheduler = new OptimizationScheduler(service, 3600);
        scheduler.start();
        scheduler.stop();

        assertThrows(IllegalStateException.class, scheduler::start);
    }

    @Test
    void stopBeforeStartIsHarmless() {
        OptimizationScheduler scheduler = new OptimizationScheduler(service, 60);

        assertDoesNotThrow(scheduler::stop);
        assertFalse(scheduler.isRunning());
    }

    @Test
    void intervalMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new OptimizationScheduler(service, 0));
    }
}
