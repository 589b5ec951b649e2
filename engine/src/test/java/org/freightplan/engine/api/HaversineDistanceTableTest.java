package org.freightplan.engine.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HaversineDistanceTableTest {

    private final HaversineDistanceTable table = new HaversineDistanceTable();

    @Test
    void calgaryToEdmontonIsAboutTwoHundredEightyKm() {
        double km = table.approximateDistanceKm("Calgary", "Edmonton");
        assertEquals(280, km, 10);
    }

    @Test
    void distanceIsSymmetricAndZeroOnSamePlace() {
        assertEquals(table.approximateDistanceKm("Winnipeg", "Regina"),
                table.approximateDistanceKm("Regina", "Winnipeg"), 1e-9);
        assertEquals(0.0, table.approximateDistanceKm("Toronto", "Toronto"), 1e-9);
    }

    @Test
    void namesMatchIgnoringCaseAndProvinceSuffix() {
        assertEquals(table.approximateDistanceKm("Toronto", "Montreal"),
                table.approximateDistanceKm("TORONTO, ON", " montreal "), 1e-9);
    }

    @Test
    void unknownPlaceIsUnreachable() {
        assertTrue(Double.isInfinite(table.approximateDistanceKm("Winnipeg", "Atlantis")));
    }
}
