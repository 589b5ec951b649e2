package org.freightplan.engine.cache;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BatchLookupCacheTest {

    @Test
    void weatherIsLoadedOncePerLocation() {
        BatchLookupCache cache = new BatchLookupCache();
        AtomicInteger calls = new AtomicInteger();

        double first = cache.weatherAdjustment("Calgary", location -> {
            calls.incrementAndGet();
            return 0.3;
        });
        double second = cache.weatherAdjustment("Calgary", location -> {
            calls.incrementAndGet();
            return 0.0;
        });

        assertEquals(0.3, first, 1e-9);
        assertEquals(0.3, second, 1e-9);
        assertEquals(1, calls.get());
        assertEquals(1, cache.weatherEntries());
    }

    @Test
    void fallbackDistanceIsSharedInBothDirections() {
        BatchLookupCache cache = new BatchLookupCache();
        AtomicInteger calls = new AtomicInteger();

        double there = cache.fallbackDistanceKm("Calgary", "Regina", () -> {
            calls.incrementAndGet();
            return 660.0;
        });
        double back = cache.fallbackDistanceKm("Regina", "Calgary", () -> {
            calls.incrementAndGet();
            return 1.0;
        });

        assertEquals(660.0, there, 1e-9);
        assertEquals(660.0, back, 1e-9);
        assertEquals(1, calls.get());
        assertEquals(1, cache.distanceEntries());
    }
}
