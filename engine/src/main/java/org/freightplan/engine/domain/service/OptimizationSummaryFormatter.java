package org.freightplan.engine.domain.service;

import org.freightplan.engine.domain.model.OrderAssignment;
import org.freightplan.engine.domain.model.RouteEconomics;
import org.freightplan.engine.domain.model.RouteMetrics;
import org.freightplan.engine.domain.model.UnassignedOrder;

import java.util.List;
import java.util.Locale;

/**
 * Renders the human-readable summary of a batch. Totals cover accepted routes only;
 * the detail section lists every evaluated route.
 */
public final class OptimizationSummaryFormatter {

    public String format(List<RouteMetrics> routes, List<OrderAssignment> assignments,
                         List<UnassignedOrder> unassigned) {
        double revenue = 0.0;
        double cost = 0.0;
        double profit = 0.0;
        double distanceKm = 0.0;
        double timeHours = 0.0;
        int accepted = 0;
        for (RouteMetrics route : routes) {
            if (!route.isAccepted()) {
                continue;
            }
            accepted++;
            revenue += route.getEconomics().getRevenue();
            cost += route.getEconomics().getCost();
            profit += route.getEconomics().getProfit();
            distanceKm += route.getCandidate().getTotalDistanceKm();
            timeHours += route.getCandidate().getTotalTimeHours();
        }
        double margin = revenue > 0 ? profit / revenue : 0.0;

        StringBuilder sb = new StringBuilder();
        sb.append("===== ROUTE OPTIMIZATION SUMMARY =====\n");
        line(sb, "Routes: %d accepted / %d evaluated", accepted, routes.size());
        line(sb, "Assignments: %d", assignments.size());
        line(sb, "Unassigned: %d", unassigned.size());
        line(sb, "Total revenue: $%.2f", revenue);
        line(sb, "Total cost: $%.2f", cost);
        line(sb, "Total profit: $%.2f", profit);
        line(sb, "Overall profit margin: %.2f%%", margin * 100);
        line(sb, "Total distance: %.2f km", distanceKm);
        line(sb, "Total time: %.2f hours", timeHours);

        if (!routes.isEmpty()) {
            sb.append("\nRoute details:\n");
            int n = 1;
            for (RouteMetrics route : routes) {
                RouteEconomics e = route.getEconomics();
                line(sb, "  Route %d (Truck %s): %s", n++, route.getCandidate().getTruck().getId(),
                        route.isAccepted() ? "ACCEPTED" : "REJECTED - " + route.getRejectionReason());
                line(sb, "    Orders: %d", route.getCandidate().getOrders().size());
                line(sb, "    Distance: %.2f km", route.getCandidate().getTotalDistanceKm());
                line(sb, "    Time: %.2f hours", route.getCandidate().getTotalTimeHours());
                line(sb, "    Revenue: $%.2f", e.getRevenue());
                line(sb, "    Cost: $%.2f", e.getCost());
                line(sb, "    Profit: $%.2f", e.getProfit());
                line(sb, "    Profit margin: %.2f%%", e.getMargin() * 100);
            }
        }

        if (!unassigned.isEmpty()) {
            sb.append("\nNeeds manual assignment:\n");
            for (UnassignedOrder order : unassigned) {
                line(sb, "  %s: %s", order.getOrderId(), order.getReason());
            }
        }
        sb.append("======================================");
        return sb.toString();
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
