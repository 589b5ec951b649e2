package org.freightplan.engine.domain.service;

import org.freightplan.engine.cache.BatchLookupCache;
import org.freightplan.engine.domain.model.LocationIndex;
import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.TravelMatrix;

import java.util.Collection;
import java.util.List;

/**
 * Builds the distance, travel-time and time-window data a routing solve works on.
 */
public interface GeoTimeMatrixBuilder {

    /**
     * Build the travel matrix for one batch.
     * Never fails because a collaborator is down: the mapping service falls back to
     * approximate distances and weather falls back to no adjustment.
     *
     * @param locations index of every batch location
     * @param orders    orders of the batch, used for time windows
     * @param depots    truck warehouse locations
     * @param cache     lookup memo scoped to this batch
     * @return the matrix, flagged when the fallback estimate was used
     */
    TravelMatrix build(LocationIndex locations, List<Order> orders, Collection<String> depots, BatchLookupCache cache);
}
