package org.freightplan.engine.domain.service;

import com.google.ortools.Loader;
import com.google.ortools.constraintsolver.Assignment;
import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingDimension;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.RoutingSearchParameters;
import com.google.ortools.constraintsolver.Solver;
import com.google.ortools.constraintsolver.main;
import com.google.protobuf.Duration;
import org.freightplan.engine.domain.model.RoutePlan;
import org.freightplan.engine.domain.model.RoutingProblem;
import org.freightplan.engine.domain.model.Shipment;
import org.freightplan.engine.domain.model.TimeWindow;
import org.freightplan.engine.domain.model.TravelMatrix;
import org.freightplan.engine.domain.model.VehicleRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RoutingSolver backed by the OR-Tools routing library.
 *
 * Solver nodes are one start/end node per distinct depot, then a pickup and a delivery node
 * for every shipment. Pickup and delivery must ride the same vehicle, pickup first; a shipment
 * is carried whole or dropped whole. Solver nodes are mapped back to matrix nodes in the plan.
 */
public final class OrToolsRoutingSolver implements RoutingSolver {

    private static final Logger log = LoggerFactory.getLogger(OrToolsRoutingSolver.class);

    static final String TIME_DIMENSION = "Time";

    /** Cost of leaving a pickup or delivery unvisited, far above any real route length in metres. */
    static final long DROP_PENALTY = 1_000_000_000L;

    /** Arc cost for unreachable pairs. */
    static final long UNREACHABLE_METRES = 100_000_000L;

    private static volatile boolean nativeLoaded;

    @Override
    public RoutePlan solve(RoutingProblem problem) {
        try {
            loadNativeLibraries();
            return doSolve(problem);
        } catch (RuntimeException | LinkageError e) {
            log.error("Routing solver failed", e);
            return RoutePlan.noSolution();
        }
    }

    private static void loadNativeLibraries() {
        if (!nativeLoaded) {
            synchronized (OrToolsRoutingSolver.class) {
                if (!nativeLoaded) {
                    Loader.loadNativeLibraries();
                    nativeLoaded = true;
                }
            }
        }
    }

    private RoutePlan doSolve(RoutingProblem problem) {
        TravelMatrix matrix = problem.getMatrix();
        List<Shipment> shipments = problem.getShipments();
        int vehicles = problem.getVehicleCount();
        long horizon = problem.getHorizonMinutes();

        Map<Integer, Integer> depotSolverNode = new LinkedHashMap<>();
        for (int v = 0; v < vehicles; v++) {
            depotSolverNode.putIfAbsent(problem.depotOf(v), depotSolverNode.size());
        }
        int firstStop = depotSolverNode.size();
        int solverNodes = firstStop + 2 * shipments.size();

        // Solver node -> matrix node
        int[] location = new int[solverNodes];
        depotSolverNode.forEach((depot, node) -> location[node] = depot);
        for (int k = 0; k < shipments.size(); k++) {
            location[pickupOf(firstStop, k)] = shipments.get(k).getPickupNode();
            location[deliveryOf(firstStop, k)] = shipments.get(k).getDeliveryNode();
        }

        int[] starts = new int[vehicles];
        for (int v = 0; v < vehicles; v++) {
            starts[v] = depotSolverNode.get(problem.depotOf(v));
        }

        long[][] metres = new long[solverNodes][solverNodes];
        long[][] minutes = new long[solverNodes][solverNodes];
        for (int i = 0; i < solverNodes; i++) {
            for (int j = 0; j < solverNodes; j++) {
                int from = location[i];
                int to = location[j];
                if (from == to) {
                    continue;
                }
                metres[i][j] = toMetres(matrix.distanceKm(from, to));
                minutes[i][j] = toMinutes(matrix.timeMinutes(from, to), horizon);
            }
        }

        RoutingIndexManager manager = new RoutingIndexManager(solverNodes, vehicles, starts, starts);
        RoutingModel routing = new RoutingModel(manager);
        Solver solver = routing.solver();

        int distanceCallback = routing.registerTransitCallback((long fromIndex, long toIndex) ->
                metres[manager.indexToNode(fromIndex)][manager.indexToNode(toIndex)]);
        routing.setArcCostEvaluatorOfAllVehicles(distanceCallback);

        int timeCallback = routing.registerTransitCallback((long fromIndex, long toIndex) ->
                minutes[manager.indexToNode(fromIndex)][manager.indexToNode(toIndex)]);
        routing.addDimension(timeCallback, problem.getMaxWaitMinutes(), horizon, true, TIME_DIMENSION);
        RoutingDimension time = routing.getMutableDimension(TIME_DIMENSION);

        for (int k = 0; k < shipments.size(); k++) {
            long pickup = manager.nodeToIndex(pickupOf(firstStop, k));
            long delivery = manager.nodeToIndex(deliveryOf(firstStop, k));
            for (long index : new long[]{pickup, delivery}) {
                TimeWindow window = matrix.timeWindow(location[manager.indexToNode(index)]);
                time.cumulVar(index).setRange(window.getEarliest(), Math.min(window.getLatest(), horizon));
                routing.addDisjunction(new long[]{index}, DROP_PENALTY);
            }
            routing.addPickupAndDelivery(pickup, delivery);
            solver.addConstraint(solver.makeEquality(routing.vehicleVar(pickup), routing.vehicleVar(delivery)));
            solver.addConstraint(solver.makeLessOrEqual(time.cumulVar(pickup), time.cumulVar(delivery)));
        }
        for (int v = 0; v < vehicles; v++) {
            long latestEnd = Math.max(0, Math.min(horizon, problem.latestEndOf(v)));
            time.cumulVar(routing.start(v)).setRange(0, horizon);
            time.cumulVar(routing.end(v)).setRange(0, latestEnd);
        }

        RoutingSearchParameters parameters = main.defaultRoutingSearchParameters()
                .toBuilder()
                .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
                .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.GUIDED_LOCAL_SEARCH)
                .setTimeLimit(Duration.newBuilder().setSeconds(problem.getTimeLimitSeconds()).build())
                .build();

        log.info("Solving routing model: {} vehicles, {} shipments, limit {}s",
                vehicles, shipments.size(), problem.getTimeLimitSeconds());
        long startedAt = System.currentTimeMillis();
        Assignment solution = routing.solveWithParameters(parameters);
        long elapsed = System.currentTimeMillis() - startedAt;

        if (solution == null) {
            log.warn("No feasible routing solution found within {}s", problem.getTimeLimitSeconds());
            return RoutePlan.noSolution();
        }

        List<VehicleRoute> routes = new ArrayList<>(vehicles);
        for (int v = 0; v < vehicles; v++) {
            List<Integer> nodes = new ArrayList<>();
            List<String> delivered = new ArrayList<>();
            long index = routing.start(v);
            nodes.add(location[manager.indexToNode(index)]);
            index = solution.value(routing.nextVar(index));
            while (!routing.isEnd(index)) {
                int node = manager.indexToNode(index);
                if (location[node] != nodes.get(nodes.size() - 1)) {
                    nodes.add(location[node]);
                }
                if (node >= firstStop && (node - firstStop) % 2 == 1) {
                    delivered.add(shipments.get((node - firstStop) / 2).getOrderId());
                }
                index = solution.value(routing.nextVar(index));
            }
            nodes.add(location[manager.indexToNode(index)]);
            routes.add(new VehicleRoute(v, nodes, delivered));
        }

        long objective = solution.objectiveValue();
        log.info("Routing solved in {} ms, objective {} m", elapsed, objective);
        return RoutePlan.solved(routes, objective);
    }

    private static int pickupOf(int firstStop, int shipment) {
        return firstStop + 2 * shipment;
    }

    private static int deliveryOf(int firstStop, int shipment) {
        return firstStop + 2 * shipment + 1;
    }

    static long toMetres(double km) {
        if (Double.isNaN(km) || Double.isInfinite(km) || km * 1000.0 > UNREACHABLE_METRES) {
            return UNREACHABLE_METRES;
        }
        return Math.round(km * 1000.0);
    }

    /**
     * Rounded minutes; anything unusable or beyond the horizon becomes horizon + 1 so the arc can never be taken.
     */
    static long toMinutes(double minutes, long horizon) {
        if (Double.isNaN(minutes) || Double.isInfinite(minutes) || minutes > horizon) {
            return horizon + 1;
        }
        return Math.round(minutes);
    }
}
