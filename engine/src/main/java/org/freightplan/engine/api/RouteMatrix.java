package org.freightplan.engine.api;

import java.util.Objects;

/**
 * Square distance (km) and driving time (minutes) matrices returned by the mapping service.
 */
public final class RouteMatrix {

    private final double[][] distanceKm;
    private final double[][] timeMinutes;

    public RouteMatrix(double[][] distanceKm, double[][] timeMinutes) {
        this.distanceKm = Objects.requireNonNull(distanceKm, "distanceKm must not be null");
        this.timeMinutes = Objects.requireNonNull(timeMinutes, "timeMinutes must not be null");
        if (distanceKm.length != timeMinutes.length) {
            throw new IllegalArgumentException("distance and time matrices differ in size");
        }
    }

    public double[][] getDistanceKm() {
        return distanceKm;
    }

    public double[][] getTimeMinutes() {
        return timeMinutes;
    }

    public int size() {
        return distanceKm.length;
    }
}
