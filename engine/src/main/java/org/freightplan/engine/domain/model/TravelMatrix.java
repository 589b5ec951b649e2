package org.freightplan.engine.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Distance (km) and travel time (minutes) between every pair of batch locations,
 * plus the service window of each location.
 */
public final class TravelMatrix {

    private final LocationIndex locations;
    private final double[][] distanceKm;
    private final double[][] timeMinutes;
    private final List<TimeWindow> timeWindows;
    private final boolean fallback;

    public TravelMatrix(LocationIndex locations, double[][] distanceKm, double[][] timeMinutes,
                        List<TimeWindow> timeWindows, boolean fallback) {
        this.locations = Objects.requireNonNull(locations, "locations must not be null");
        this.distanceKm = Objects.requireNonNull(distanceKm, "distanceKm must not be null");
        this.timeMinutes = Objects.requireNonNull(timeMinutes, "timeMinutes must not be null");
        this.timeWindows = Collections.unmodifiableList(Objects.requireNonNull(timeWindows, "timeWindows must not be null"));
        int n = locations.size();
        if (distanceKm.length != n || timeMinutes.length != n || timeWindows.size() != n) {
            throw new IllegalArgumentException("matrix dimensions do not match " + n + " locations");
        }
        this.fallback = fallback;
    }

    public LocationIndex getLocations() {
        return locations;
    }

    public int size() {
        return locations.size();
    }

    public double distanceKm(int from, int to) {
        return distanceKm[from][to];
    }

    public double timeMinutes(int from, int to) {
        return timeMinutes[from][to];
    }

    public TimeWindow timeWindow(int node) {
        return timeWindows.get(node);
    }

    public List<TimeWindow> getTimeWindows() {
        return timeWindows;
    }

    /**
     * True when the matrix was estimated from the fallback distance table
     * because the mapping service was unavailable.
     */
    public boolean isFallback() {
        return fallback;
    }
}
