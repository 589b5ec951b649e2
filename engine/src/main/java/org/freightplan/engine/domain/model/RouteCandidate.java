package org.freightplan.engine.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One vehicle's proposed stop sequence, before economic acceptance.
 */
public final class RouteCandidate {

    private final int vehicleIndex;
    private final Truck truck;
    private final List<Order> orders;
    private final List<Integer> nodes;
    private final double totalDistanceKm;
    private final double totalTimeMinutes;

    public RouteCandidate(int vehicleIndex, Truck truck, List<Order> orders, List<Integer> nodes,
                          double totalDistanceKm, double totalTimeMinutes) {
        this.vehicleIndex = vehicleIndex;
        this.truck = Objects.requireNonNull(truck, "truck must not be null");
        this.orders = Collections.unmodifiableList(Objects.requireNonNull(orders, "orders must not be null"));
        this.nodes = Collections.unmodifiableList(Objects.requireNonNull(nodes, "nodes must not be null"));
        this.totalDistanceKm = totalDistanceKm;
        this.totalTimeMinutes = totalTimeMinutes;
    }

    public int getVehicleIndex() {
        return vehicleIndex;
    }

    public Truck getTruck() {
        return truck;
    }

    /**
     * Orders in visitation order. The position of an order in this list is its route sequence.
     */
    public List<Order> getOrders() {
        return orders;
    }

    public List<Integer> getNodes() {
        return nodes;
    }

    public double getTotalDistanceKm() {
        return totalDistanceKm;
    }

    public double getTotalTimeMinutes() {
        return totalTimeMinutes;
    }

    public double getTotalTimeHours() {
        return totalTimeMinutes / 60.0;
    }

    @Override
    public String toString() {
        return String.format("RouteCandidate{truck='%s', orders=%d, distance=%.1fkm, time=%.0fmin}",
                truck.getId(), orders.size(), totalDistanceKm, totalTimeMinutes);
    }
}
