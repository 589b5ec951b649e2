package org.freightplan.engine.cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Memo of external lookups made while building one batch's travel matrix.
 * Created fresh for every optimization pass and discarded afterwards, so entries never go stale.
 * Weather lookups populate it from several threads at once.
 */
public final class BatchLookupCache {

    private final Map<String, Double> weatherAdjustments = new ConcurrentHashMap<>();
    private final Map<String, Double> fallbackDistances = new ConcurrentHashMap<>();

    /**
     * Get the weather adjustment for a location, computing it once.
     */
    public double weatherAdjustment(String location, Function<String, Double> loader) {
        Double cached = weatherAdjustments.get(location);
        if (cached != null) {
            return cached;
        }
        // Loaded outside the map lock: the loader makes a network call
        Double loaded = loader.apply(location);
        Double previous = weatherAdjustments.putIfAbsent(location, loaded);
        return previous != null ? previous : loaded;
    }

    /**
     * Get the fallback distance between two locations, computing it once per unordered pair.
     */
    public double fallbackDistanceKm(String from, String to, Supplier<Double> loader) {
        String key = from.compareTo(to) <= 0 ? from + "\u0000" + to : to + "\u0000" + from;
        return fallbackDistances.computeIfAbsent(key, k -> loader.get());
    }

    public int weatherEntries() {
        return weatherAdjustments.size();
    }

    public int distanceEntries() {
        return fallbackDistances.size();
    }
}
