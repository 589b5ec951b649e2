package org.freightplan.engine.domain.service;

import org.freightplan.engine.api.FleetApiClient;
import org.freightplan.engine.api.OrderApiClient;
import org.freightplan.engine.cache.BatchLookupCache;
import org.freightplan.engine.domain.model.LocationIndex;
import org.freightplan.engine.domain.model.OptimizationResult;
import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.OrderAssignment;
import org.freightplan.engine.domain.model.OrderStatus;
import org.freightplan.engine.domain.model.RouteCandidate;
import org.freightplan.engine.domain.model.RouteMetrics;
import org.freightplan.engine.domain.model.RoutePlan;
import org.freightplan.engine.domain.model.RoutingProblem;
import org.freightplan.engine.domain.model.Shipment;
import org.freightplan.engine.domain.model.Trailer;
import org.freightplan.engine.domain.model.TravelMatrix;
import org.freightplan.engine.domain.model.Truck;
import org.freightplan.engine.domain.model.UnassignedOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Implementation of OptimizationService.
 *
 * Pipeline: fleet snapshot, travel matrix, routing solve, candidate extraction, economic
 * filter, trailer binding. Batches are serialized so two solves never run at once.
 */
public final class OptimizationServiceImpl implements OptimizationService {

    private static final Logger log = LoggerFactory.getLogger(OptimizationServiceImpl.class);

    private final FleetApiClient fleetApi;
    private final OrderApiClient orderApi;
    private final GeoTimeMatrixBuilder matrixBuilder;
    private final RoutingSolver solver;
    private final RouteCandidateExtractor extractor;
    private final RouteEconomicsEvaluator evaluator;
    private final AssignmentMaterializer materializer;
    private final OptimizationSummaryFormatter formatter;
    private final int horizonMinutes;
    private final int maxWaitMinutes;
    private final int timeLimitSeconds;

    private final ReentrantLock batchLock = new ReentrantLock();

    public OptimizationServiceImpl(FleetApiClient fleetApi, OrderApiClient orderApi,
                                   GeoTimeMatrixBuilder matrixBuilder, RoutingSolver solver,
                                   RouteCandidateExtractor extractor, RouteEconomicsEvaluator evaluator,
                                   AssignmentMaterializer materializer, OptimizationSummaryFormatter formatter,
                                   int horizonMinutes, int maxWaitMinutes, int timeLimitSeconds) {
        this.fleetApi = Objects.requireNonNull(fleetApi, "fleetApi must not be null");
        this.orderApi = Objects.requireNonNull(orderApi, "orderApi must not be null");
        this.matrixBuilder = Objects.requireNonNull(matrixBuilder, "matrixBuilder must not be null");
        this.solver = Objects.requireNonNull(solver, "solver must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.materializer = Objects.requireNonNull(materializer, "materializer must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.horizonMinutes = horizonMinutes;
        this.maxWaitMinutes = maxWaitMinutes;
        this.timeLimitSeconds = timeLimitSeconds;
    }

    @Override
    public OptimizationResult optimize(List<Order> orders) {
        Objects.requireNonNull(orders, "orders must not be null");
        if (orders.isEmpty()) {
            log.debug("No orders to optimize");
            return OptimizationResult.empty();
        }

        batchLock.lock();
        try {
            log.info("Optimizing batch of {} orders", orders.size());
            return runBatch(orders);
        } catch (Exception e) {
            log.error("Optimization batch failed, no orders were routed", e);
            return finish(Collections.emptyList(), Collections.emptyList(),
                    allUnassigned(orders, UnassignedOrder.Reason.NOT_ROUTED));
        } finally {
            batchLock.unlock();
        }
    }

    @Override
    public OptimizationResult optimizePending() {
        List<Order> pending = fetch(orderApi::getPendingOrders, "pending orders").stream()
                .filter(o -> o.getStatus() == OrderStatus.PENDING)
                .collect(Collectors.toList());
        if (pending.isEmpty()) {
            log.debug("No pending orders");
            return OptimizationResult.empty();
        }
        return optimize(pending);
    }

    @Override
    public OptimizationResult optimizeOrder(String orderId) {
        Optional<Order> order;
        try {
            order = orderApi.getOrder(orderId);
        } catch (Exception e) {
            log.warn("Could not fetch order {}", orderId, e);
            order = Optional.empty();
        }
        if (order.isEmpty()) {
            log.warn("Order {} not found", orderId);
            return OptimizationResult.empty();
        }
        if (order.get().getStatus() != OrderStatus.PENDING) {
            log.info("Order {} is {}, nothing to optimize", orderId, order.get().getStatus().toValue());
            return OptimizationResult.empty();
        }
        return optimize(Collections.singletonList(order.get()));
    }

    private OptimizationResult runBatch(List<Order> orders) {
        List<Truck> trucks = new ArrayList<>();
        for (Truck truck : fetch(fleetApi::getAvailableTrucks, "trucks")) {
            if (truck.getRemainingDutyMinutes() > 0) {
                trucks.add(truck);
            } else {
                log.info("Skipping truck {}: no duty hours left ({}/{})",
                        truck.getId(), truck.getCurrentHours(), truck.getMaxHours());
            }
        }
        List<Trailer> trailers = new ArrayList<>(fetch(fleetApi::getAvailableTrailers, "trailers"));
        if (trucks.isEmpty() || trailers.isEmpty()) {
            log.warn("No available fleet ({} trucks, {} trailers), {} orders left unassigned",
                    trucks.size(), trailers.size(), orders.size());
            return finish(Collections.emptyList(), Collections.emptyList(),
                    allUnassigned(orders, UnassignedOrder.Reason.NO_AVAILABLE_FLEET));
        }

        LocationIndex locations = LocationIndex.of(trucks, orders);
        Set<String> depots = trucks.stream().map(Truck::getWarehouse).collect(Collectors.toCollection(LinkedHashSet::new));
        TravelMatrix matrix = matrixBuilder.build(locations, orders, depots, new BatchLookupCache());

        List<Shipment> shipments = new ArrayList<>();
        for (Order order : orders) {
            if (RouteCandidateExtractor.isRoutable(order)) {
                shipments.add(new Shipment(order.getId(),
                        locations.requireNode(order.getShipFrom()), locations.requireNode(order.getShipTo())));
            }
        }
        if (shipments.isEmpty()) {
            log.warn("No routable orders in batch (origin equals destination)");
            return finish(Collections.emptyList(), Collections.emptyList(),
                    allUnassigned(orders, UnassignedOrder.Reason.NOT_ROUTED));
        }

        int[] depotNodes = new int[trucks.size()];
        long[] latestEnd = new long[trucks.size()];
        for (int v = 0; v < trucks.size(); v++) {
            depotNodes[v] = locations.requireNode(trucks.get(v).getWarehouse());
            latestEnd[v] = trucks.get(v).getRemainingDutyMinutes();
        }
        RoutingProblem problem = new RoutingProblem(matrix, shipments, depotNodes, latestEnd,
                horizonMinutes, maxWaitMinutes, timeLimitSeconds);

        RoutePlan plan = solver.solve(problem);
        if (!plan.isSolved()) {
            log.warn("No feasible routes for {} orders", orders.size());
            return finish(Collections.emptyList(), Collections.emptyList(),
                    allUnassigned(orders, UnassignedOrder.Reason.NOT_ROUTED));
        }

        List<RouteCandidate> candidates = extractor.extract(plan, matrix, trucks, orders);
        List<RouteMetrics> ranked = evaluator.evaluateAll(candidates);
        List<RouteMetrics> accepted = ranked.stream().filter(RouteMetrics::isAccepted).collect(Collectors.toList());
        AssignmentMaterializer.Result bound = materializer.materialize(accepted, trailers);

        Map<String, UnassignedOrder.Reason> reasons = new HashMap<>();
        for (RouteMetrics route : ranked) {
            if (!route.isAccepted()) {
                route.getCandidate().getOrders()
                        .forEach(o -> reasons.put(o.getId(), UnassignedOrder.Reason.UNPROFITABLE_ROUTE));
            }
        }
        bound.getUnassigned().forEach(u -> reasons.put(u.getOrderId(), u.getReason()));
        Set<String> assignedIds = bound.getAssignments().stream()
                .map(OrderAssignment::getOrderId)
                .collect(Collectors.toSet());

        List<UnassignedOrder> unassigned = new ArrayList<>();
        for (Order order : orders) {
            if (assignedIds.contains(order.getId())) {
                continue;
            }
            unassigned.add(new UnassignedOrder(order.getId(),
                    reasons.getOrDefault(order.getId(), UnassignedOrder.Reason.NOT_ROUTED)));
        }
        return finish(ranked, bound.getAssignments(), unassigned);
    }

    private OptimizationResult finish(List<RouteMetrics> routes, List<OrderAssignment> assignments,
                                      List<UnassignedOrder> unassigned) {
        String summary = formatter.format(routes, assignments, unassigned);
        log.info("\n{}", summary);
        return new OptimizationResult(assignments, unassigned, routes, summary);
    }

    private static List<UnassignedOrder> allUnassigned(List<Order> orders, UnassignedOrder.Reason reason) {
        List<UnassignedOrder> unassigned = new ArrayList<>(orders.size());
        for (Order order : orders) {
            unassigned.add(new UnassignedOrder(order.getId(), reason));
        }
        return unassigned;
    }

    private static <T> List<T> fetch(Supplier<List<T>> call, String what) {
        try {
            List<T> result = call.get();
            return result == null ? Collections.emptyList() : result;
        } catch (Exception e) {
            log.warn("Fetching {} failed", what, e);
            return Collections.emptyList();
        }
    }
}
