package org.freightplan.engine.domain.service;

import org.freightplan.engine.domain.model.LocationIndex;
import org.freightplan.engine.domain.model.RoutePlan;
import org.freightplan.engine.domain.model.RoutingProblem;
import org.freightplan.engine.domain.model.Shipment;
import org.freightplan.engine.domain.model.TimeWindow;
import org.freightplan.engine.domain.model.TravelMatrix;
import org.freightplan.engine.domain.model.VehicleRoute;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrToolsRoutingSolverTest {

    private static final int HORIZON = 1440;

    private static final int WINNIPEG = 0;
    private static final int REGINA = 1;
    private static final int SASKATOON = 2;

    private final OrToolsRoutingSolver solver = new OrToolsRoutingSolver();

    @Test
    void deliversEveryReachableShipmentAndReturnsToDepot() {
        TravelMatrix matrix = prairieMatrix(open(), open(), open());
        List<Shipment> shipments = Arrays.asList(
                new Shipment("O1", WINNIPEG, REGINA),
                new Shipment("O2", WINNIPEG, SASKATOON));

        RoutePlan plan = solver.solve(problem(matrix, shipments, new int[]{WINNIPEG}, new long[]{HORIZON}));

        assertTrue(plan.isSolved());
        VehicleRoute route = plan.getRoutes().get(0);
        List<Integer> nodes = route.getNodes();
        assertEquals(WINNIPEG, nodes.get(0));
        assertEquals(WINNIPEG, nodes.get(nodes.size() - 1));
        assertTrue(nodes.contains(REGINA));
        assertTrue(nodes.contains(SASKATOON));
        assertTrue(route.getDeliveredOrderIds().containsAll(Arrays.asList("O1", "O2")));
        assertTrue(plan.getObjective() < OrToolsRoutingSolver.DROP_PENALTY);
    }

    @Test
    void shipmentAwayFromTheDepotIsPickedUpBeforeDelivery() {
        TravelMatrix matrix = prairieMatrix(open(), open(), open());

        RoutePlan plan = solver.solve(problem(matrix,
                Collections.singletonList(new Shipment("O1", SASKATOON, REGINA)),
                new int[]{WINNIPEG}, new long[]{HORIZON}));

        assertTrue(plan.isSolved());
        VehicleRoute route = plan.getRoutes().get(0);
        assertEquals(Collections.singletonList("O1"), route.getDeliveredOrderIds());
        assertEquals(Arrays.asList(WINNIPEG, SASKATOON, REGINA, WINNIPEG), route.getNodes());
        assertTrue(plan.getObjective() < OrToolsRoutingSolver.DROP_PENALTY);
    }

    @Test
    void pickupAtTheDepotDoesNotRepeatTheDepot() {
        TravelMatrix matrix = prairieMatrix(open(), open(), open());

        RoutePlan plan = solver.solve(problem(matrix,
                Collections.singletonList(new Shipment("O1", WINNIPEG, REGINA)),
                new int[]{WINNIPEG}, new long[]{HORIZON}));

        List<Integer> nodes = plan.getRoutes().get(0).getNodes();
        assertEquals(Arrays.asList(WINNIPEG, REGINA, WINNIPEG), nodes);
        for (int i = 0; i + 1 < nodes.size(); i++) {
            assertNotEquals(nodes.get(i), nodes.get(i + 1));
        }
    }

    @Test
    void shipmentWithUnreachableWindowIsDroppedWhole() {
        TravelMatrix matrix = prairieMatrix(open(), open(), new TimeWindow(0, 10));
        List<Shipment> shipments = Arrays.asList(
                new Shipment("O1", WINNIPEG, REGINA),
                new Shipment("O2", WINNIPEG, SASKATOON));

        RoutePlan plan = solver.solve(problem(matrix, shipments, new int[]{WINNIPEG}, new long[]{HORIZON}));

        assertTrue(plan.isSolved());
        VehicleRoute route = plan.getRoutes().get(0);
        assertEquals(Collections.singletonList("O1"), route.getDeliveredOrderIds());
        assertFalse(route.getNodes().contains(SASKATOON));
        assertTrue(plan.getObjective() >= OrToolsRoutingSolver.DROP_PENALTY);
    }

    @Test
    void exhaustedDutyKeepsTheTruckHome() {
        TravelMatrix matrix = prairieMatrix(open(), open(), open());

        RoutePlan plan = solver.solve(problem(matrix,
                Collections.singletonList(new Shipment("O1", WINNIPEG, REGINA)),
                new int[]{WINNIPEG}, new long[]{60}));

        assertTrue(plan.isSolved());
        VehicleRoute route = plan.getRoutes().get(0);
        assertTrue(route.isEmpty());
        assertEquals(Arrays.asList(WINNIPEG, WINNIPEG), route.getNodes());
    }

    @Test
    void eachShipmentRidesOneVehicleFromItsPickup() {
        // Truck 0 is based in Winnipeg, truck 1 in Regina; Regina is also a pickup point
        TravelMatrix matrix = prairieMatrix(open(), open(), open());
        List<Shipment> shipments = Arrays.asList(
                new Shipment("O1", WINNIPEG, SASKATOON),
                new Shipment("O2", REGINA, SASKATOON));

        RoutePlan plan = solver.solve(problem(matrix, shipments,
                new int[]{WINNIPEG, REGINA}, new long[]{HORIZON, HORIZON}));

        assertTrue(plan.isSolved());
        assertEquals(2, plan.getRoutes().size());
        assertEquals(REGINA, plan.getRoutes().get(1).getNodes().get(0));
        List<String> delivered = plan.getRoutes().stream()
                .flatMap(r -> r.getDeliveredOrderIds().stream())
                .sorted()
                .collect(Collectors.toList());
        assertEquals(Arrays.asList("O1", "O2"), delivered);
        for (VehicleRoute route : plan.getRoutes()) {
            for (Shipment shipment : shipments) {
                if (route.getDeliveredOrderIds().contains(shipment.getOrderId())) {
                    int pickupAt = route.getNodes().indexOf(shipment.getPickupNode());
                    int deliveryAt = route.getNodes().lastIndexOf(shipment.getDeliveryNode());
                    assertTrue(pickupAt >= 0 && pickupAt < deliveryAt, route.toString());
                }
            }
        }
    }

    @Test
    void unitConversionClampsUnusableValues() {
        assertEquals(570_000L, OrToolsRoutingSolver.toMetres(570.0));
        assertEquals(OrToolsRoutingSolver.UNREACHABLE_METRES, OrToolsRoutingSolver.toMetres(Double.POSITIVE_INFINITY));
        assertEquals(OrToolsRoutingSolver.UNREACHABLE_METRES, OrToolsRoutingSolver.toMetres(Double.NaN));
        assertEquals(331L, OrToolsRoutingSolver.toMinutes(330.6, HORIZON));
        assertEquals(HORIZON + 1L, OrToolsRoutingSolver.toMinutes(5000.0, HORIZON));
        assertEquals(HORIZON + 1L, OrToolsRoutingSolver.toMinutes(Double.NaN, HORIZON));
    }

    private static RoutingProblem problem(TravelMatrix matrix, List<Shipment> shipments, int[] depots, long[] latestEnd) {
        return new RoutingProblem(matrix, shipments, depots, latestEnd, HORIZON, HORIZON, 1);
    }

    private static TimeWindow open() {
        return new TimeWindow(0, HORIZON);
    }

    /**
     * Winnipeg, Regina, Saskatoon.
     */
    private static TravelMatrix prairieMatrix(TimeWindow... windows) {
        LocationIndex index = LocationIndex.ofLocations(Arrays.asList("Winnipeg", "Regina", "Saskatoon"));
        double[][] km = {{0, 570, 780}, {570, 0, 240}, {780, 240, 0}};
        double[][] min = {{0, 330, 460}, {330, 0, 150}, {460, 150, 0}};
        return new TravelMatrix(index, km, min, Arrays.asList(windows), false);
    }
}
