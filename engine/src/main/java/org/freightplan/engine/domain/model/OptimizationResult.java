package org.freightplan.engine.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of one optimization batch.
 */
public final class OptimizationResult {

    private static final OptimizationResult EMPTY = new OptimizationResult(
            Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), "");

    private final List<OrderAssignment> assignments;
    private final List<UnassignedOrder> unassignedOrders;
    private final List<RouteMetrics> routeSummary;
    private final String summaryText;

    public OptimizationResult(List<OrderAssignment> assignments, List<UnassignedOrder> unassignedOrders,
                              List<RouteMetrics> routeSummary, String summaryText) {
        this.assignments = Collections.unmodifiableList(Objects.requireNonNull(assignments, "assignments must not be null"));
        this.unassignedOrders = Collections.unmodifiableList(Objects.requireNonNull(unassignedOrders, "unassignedOrders must not be null"));
        this.routeSummary = Collections.unmodifiableList(Objects.requireNonNull(routeSummary, "routeSummary must not be null"));
        this.summaryText = Objects.requireNonNull(summaryText, "summaryText must not be null");
    }

    public static OptimizationResult empty() {
        return EMPTY;
    }

    public List<OrderAssignment> getAssignments() {
        return assignments;
    }

    public List<UnassignedOrder> getUnassignedOrders() {
        return unassignedOrders;
    }

    public List<String> getUnassignedOrderIds() {
        return unassignedOrders.stream().map(UnassignedOrder::getOrderId).collect(Collectors.toList());
    }

    /**
     * Every evaluated route, accepted and rejected, in rank order.
     */
    public List<RouteMetrics> getRouteSummary() {
        return routeSummary;
    }

    public String getSummaryText() {
        return summaryText;
    }

    public boolean isEmpty() {
        return assignments.isEmpty() && unassignedOrders.isEmpty() && routeSummary.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("OptimizationResult{assignments=%d, unassigned=%d, routes=%d}",
                assignments.size(), unassignedOrders.size(), routeSummary.size());
    }
}
