package org.freightplan.engine.domain.service;

import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.RouteCandidate;
import org.freightplan.engine.domain.model.RoutePlan;
import org.freightplan.engine.domain.model.TravelMatrix;
import org.freightplan.engine.domain.model.Truck;
import org.freightplan.engine.domain.model.VehicleRoute;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns solver routes into route candidates carrying the orders they deliver.
 *
 * An order belongs to the vehicle the solver reports as delivering it; an id is claimed once
 * per plan. Orders whose origin and destination are the same place are never routed.
 */
public final class RouteCandidateExtractor {

    /**
     * @param plan   solved plan, one route per truck in {@code trucks} order
     * @param matrix matrix the plan was solved on
     * @param trucks vehicles, indexed like the plan
     * @param orders batch orders
     */
    public List<RouteCandidate> extract(RoutePlan plan, TravelMatrix matrix, List<Truck> trucks, List<Order> orders) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(trucks, "trucks must not be null");
        Objects.requireNonNull(orders, "orders must not be null");

        Map<String, Order> byId = new LinkedHashMap<>();
        for (Order order : orders) {
            if (isRoutable(order)) {
                byId.putIfAbsent(order.getId(), order);
            }
        }

        Set<String> claimed = new HashSet<>();
        List<RouteCandidate> candidates = new ArrayList<>();
        for (VehicleRoute route : plan.getRoutes()) {
            List<Integer> nodes = route.getNodes();
            if (nodes.size() < 2 || route.getVehicleIndex() >= trucks.size()) {
                continue;
            }

            List<Order> onRoute = new ArrayList<>();
            for (String orderId : route.getDeliveredOrderIds()) {
                Order order = byId.get(orderId);
                if (order != null && claimed.add(orderId)) {
                    onRoute.add(order);
                }
            }
            if (onRoute.isEmpty()) {
                continue;
            }

            double distance = 0.0;
            double time = 0.0;
            for (int i = 0; i + 1 < nodes.size(); i++) {
                distance += matrix.distanceKm(nodes.get(i), nodes.get(i + 1));
                time += matrix.timeMinutes(nodes.get(i), nodes.get(i + 1));
            }
            candidates.add(new RouteCandidate(route.getVehicleIndex(), trucks.get(route.getVehicleIndex()),
                    onRoute, nodes, distance, time));
        }
        return candidates;
    }

    static boolean isRoutable(Order order) {
        return !order.getShipFrom().equals(order.getShipTo());
    }
}
