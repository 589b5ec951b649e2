package org.freightplan.engine.domain.service;

import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.RouteCandidate;
import org.freightplan.engine.domain.model.RouteEconomics;
import org.freightplan.engine.domain.model.RouteMetrics;
import org.freightplan.engine.domain.model.Truck;
import org.freightplan.engine.domain.model.UnassignedOrder;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertTrue;

class OptimizationSummaryFormatterTest {

    private static final Truck TRUCK = new Truck("T1", "Truck 1", "Winnipeg", 0, 10);

    @Test
    void totalsCountAcceptedRoutesOnly() {
        RouteMetrics accepted = RouteMetrics.accepted(candidate(), new RouteEconomics(300, 100, 50, 0, 0));
        RouteMetrics rejected = RouteMetrics.rejected(candidate(), new RouteEconomics(10, 100, 0, 0, 0), "unprofitable");

        String text = new OptimizationSummaryFormatter().format(Arrays.asList(accepted, rejected),
                Collections.emptyList(),
                Collections.singletonList(new UnassignedOrder("O2", UnassignedOrder.Reason.UNPROFITABLE_ROUTE)));

        assertTrue(text.startsWith("===== ROUTE OPTIMIZATION SUMMARY ====="));
        assertTrue(text.contains("Routes: 1 accepted / 2 evaluated"));
        assertTrue(text.contains("Total revenue: $300.00"));
        assertTrue(text.contains("Total profit: $150.00"));
        assertTrue(text.contains("Overall profit margin: 50.00%"));
        assertTrue(text.contains("Route 1 (Truck T1): ACCEPTED"));
        assertTrue(text.contains("Route 2 (Truck T1): REJECTED - unprofitable"));
        assertTrue(text.contains("Needs manual assignment:"));
        assertTrue(text.contains("O2: UNPROFITABLE_ROUTE"));
    }

    @Test
    void emptyBatchHasNoDetailSections() {
        String text = new OptimizationSummaryFormatter().format(Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList());

        assertTrue(text.contains("Routes: 0 accepted / 0 evaluated"));
        assertTrue(!text.contains("Route details:"));
        assertTrue(!text.contains("Needs manual assignment:"));
    }

    private static RouteCandidate candidate() {
        Order order = new Order.Builder().id("O1").shipFrom("Winnipeg").shipTo("Regina").weightKg(100).build();
        return new RouteCandidate(0, TRUCK, Collections.singletonList(order), Arrays.asList(0, 1, 0), 1140, 660);
    }
}
