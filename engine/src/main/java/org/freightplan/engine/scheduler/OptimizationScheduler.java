package org.freightplan.engine.scheduler;

import org.freightplan.engine.domain.model.OptimizationResult;
import org.freightplan.engine.domain.service.OptimizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Re-optimizes the pending order backlog on a fixed delay.
 *
 * The delay is measured from the end of one batch to the start of the next, so a slow
 * solve never stacks batches. A failed batch is logged and the next one runs as usual.
 * Once stopped, an instance cannot be started again.
 */
public final class OptimizationScheduler {

    private static final Logger log = LoggerFactory.getLogger(OptimizationScheduler.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final OptimizationService optimizationService;
    private final long intervalSeconds;
    private final ScheduledExecutorService ticker;
    private final AtomicLong cycles = new AtomicLong();
    private ScheduledFuture<?> schedule;

    public OptimizationScheduler(OptimizationService optimizationService, int intervalSeconds) {
        this.optimizationService = Objects.requireNonNull(optimizationService, "optimizationService must not be null");
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be at least 1");
        }
        this.intervalSeconds = intervalSeconds;
        this.ticker = Executors.newSingleThreadScheduledExecutor(task -> {
            Thread thread = new Thread(task, "order-optimizer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * First batch runs one interval from now. Calling this while scheduled does nothing.
     *
     * @throws IllegalStateException after {@link #stop()}
     */
    public synchronized void start() {
        if (ticker.isShutdown()) {
            throw new IllegalStateException("Optimization scheduler was stopped");
        }
        if (schedule != null) {
            log.debug("Optimization already scheduled every {}s", intervalSeconds);
            return;
        }
        schedule = ticker.scheduleWithFixedDelay(this::runOptimizationCycle,
                intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Pending orders will be optimized every {}s", intervalSeconds);
    }

    public synchronized void stop() {
        if (schedule == null) {
            return;
        }
        schedule.cancel(false);
        schedule = null;
        ticker.shutdown();
        try {
            if (!ticker.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Batch still running after {}s, interrupting it", SHUTDOWN_GRACE_SECONDS);
                ticker.shutdownNow();
            }
        } catch (InterruptedException e) {
            ticker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Optimization scheduler stopped after {} cycles", cycles.get());
    }

    public synchronized boolean isRunning() {
        return schedule != null;
    }

    /**
     * Number of batches attempted so far, failed ones included.
     */
    public long getCycleCount() {
        return cycles.get();
    }

    void runOptimizationCycle() {
        long cycle = cycles.incrementAndGet();
        try {
            OptimizationResult result = optimizationService.optimizePending();
            if (result.isEmpty()) {
                log.debug("Cycle {}: no pending orders", cycle);
            } else {
                log.info("Cycle {}: {} orders assigned, {} left for manual handling",
                        cycle, result.getAssignments().size(), result.getUnassignedOrders().size());
            }
        } catch (RuntimeException e) {
            // Rethrowing would cancel every later run
            log.error("Cycle {} failed, next attempt in {}s", cycle, intervalSeconds, e);
        }
    }
}
