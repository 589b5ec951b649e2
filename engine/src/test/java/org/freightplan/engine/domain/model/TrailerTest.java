package org.freightplan.engine.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrailerTest {

    @Test
    void canCarryChecksBothMaximumAndRunningLoad() {
        Trailer trailer = new Trailer.Builder().id("TR1").warehouse("Winnipeg")
                .maxWeightKg(2000).currentWeightKg(1500).build();

        assertTrue(trailer.canCarry(500));
        assertFalse(trailer.canCarry(501));
        assertFalse(trailer.canCarry(2500));
        assertEquals(500, trailer.getRemainingCapacityKg(), 1e-9);
    }

    @Test
    void addLoadRefusesToOverfill() {
        Trailer trailer = new Trailer.Builder().id("TR1").warehouse("Winnipeg").maxWeightKg(2000).build();

        trailer.addLoad(1800);
        assertEquals(1800, trailer.getCurrentWeightKg(), 1e-9);
        assertThrows(IllegalStateException.class, () -> trailer.addLoad(500));
        assertEquals(1800, trailer.getCurrentWeightKg(), 1e-9);
    }

    @Test
    void truckRemainingDutyIsNeverNegative() {
        assertEquals(120, new Truck("T1", "Truck", "Winnipeg", 8, 10).getRemainingDutyMinutes());
        assertEquals(0, new Truck("T2", "Truck", "Winnipeg", 11, 10).getRemainingDutyMinutes());
    }
}
