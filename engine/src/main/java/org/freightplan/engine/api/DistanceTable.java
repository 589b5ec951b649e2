package org.freightplan.engine.api;

/**
 * Approximate distances used when the mapping service is unavailable.
 */
public interface DistanceTable {

    /**
     * Straight-line estimate between two places.
     *
     * @return kilometres, or {@link Double#POSITIVE_INFINITY} when either place is unknown
     */
    double approximateDistanceKm(String from, String to);
}
