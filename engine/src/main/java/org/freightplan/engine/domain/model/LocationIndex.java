package org.freightplan.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Deduplicated, order-preserving list of the locations in one batch.
 * Each location maps to exactly one node index used by the matrices and the solver.
 */
public final class LocationIndex {

    private final List<String> locations;
    private final Map<String, Integer> nodeByLocation;

    private LocationIndex(Map<String, Integer> nodeByLocation) {
        this.nodeByLocation = Collections.unmodifiableMap(nodeByLocation);
        this.locations = Collections.unmodifiableList(new ArrayList<>(nodeByLocation.keySet()));
    }

    /**
     * Build the index for a batch: truck warehouses first, then order origins, then destinations.
     */
    public static LocationIndex of(List<Truck> trucks, List<Order> orders) {
        Objects.requireNonNull(trucks, "trucks must not be null");
        Objects.requireNonNull(orders, "orders must not be null");

        List<String> all = new ArrayList<>();
        trucks.forEach(t -> all.add(t.getWarehouse()));
        orders.forEach(o -> all.add(o.getShipFrom()));
        orders.forEach(o -> all.add(o.getShipTo()));
        return ofLocations(all);
    }

    public static LocationIndex ofLocations(List<String> locations) {
        Map<String, Integer> nodes = new LinkedHashMap<>();
        for (String location : locations) {
            nodes.putIfAbsent(Objects.requireNonNull(location, "location must not be null"), nodes.size());
        }
        return new LocationIndex(nodes);
    }

    public List<String> getLocations() {
        return locations;
    }

    public int size() {
        return locations.size();
    }

    public String locationAt(int node) {
        return locations.get(node);
    }

    public OptionalInt nodeOf(String location) {
        Integer node = nodeByLocation.get(location);
        return node == null ? OptionalInt.empty() : OptionalInt.of(node);
    }

    /**
     * Node index of a location known to be part of the batch.
     *
     * @throws IllegalArgumentException if the location is not indexed
     */
    public int requireNode(String location) {
        Integer node = nodeByLocation.get(location);
        if (node == null) {
            throw new IllegalArgumentException("Location not in index: " + location);
        }
        return node;
    }

    @Override
    public String toString() {
        return "LocationIndex" + locations;
    }
}
