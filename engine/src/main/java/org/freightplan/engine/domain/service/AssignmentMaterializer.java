package org.freightplan.engine.domain.service;

import org.freightplan.engine.api.OrderApiClient;
import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.OrderAssignment;
import org.freightplan.engine.domain.model.OrderStatus;
import org.freightplan.engine.domain.model.RouteCandidate;
import org.freightplan.engine.domain.model.RouteMetrics;
import org.freightplan.engine.domain.model.SpecialRequirement;
import org.freightplan.engine.domain.model.Trailer;
import org.freightplan.engine.domain.model.UnassignedOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Binds a trailer to every order of the accepted routes and persists the assignments.
 *
 * Routes are processed in the given rank order. Inside a route the most valuable orders
 * pick trailers first. Trailer loads only grow during a pass, and only after the assignment
 * record has been stored.
 */
public final class AssignmentMaterializer {

    private static final Logger log = LoggerFactory.getLogger(AssignmentMaterializer.class);

    private final OrderApiClient orderApi;
    private final RouteEconomicsEvaluator evaluator;
    private final Clock clock;

    public AssignmentMaterializer(OrderApiClient orderApi, RouteEconomicsEvaluator evaluator, Clock clock) {
        this.orderApi = Objects.requireNonNull(orderApi, "orderApi must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param acceptedRoutes accepted routes, most profitable first
     * @param trailers       trailer snapshot in fleet registry order; loads are updated in place
     */
    public Result materialize(List<RouteMetrics> acceptedRoutes, List<Trailer> trailers) {
        Objects.requireNonNull(acceptedRoutes, "acceptedRoutes must not be null");
        Objects.requireNonNull(trailers, "trailers must not be null");

        Map<String, List<Trailer>> pools = new LinkedHashMap<>();
        for (Trailer trailer : trailers) {
            pools.computeIfAbsent(trailer.getWarehouse(), w -> new ArrayList<>()).add(trailer);
        }

        List<OrderAssignment> assignments = new ArrayList<>();
        List<UnassignedOrder> unassigned = new ArrayList<>();
        Set<String> handled = new HashSet<>();

        for (RouteMetrics route : acceptedRoutes) {
            if (!route.isAccepted()) {
                continue;
            }
            RouteCandidate candidate = route.getCandidate();
            List<Order> byValue = new ArrayList<>(candidate.getOrders());
            byValue.sort(Comparator.comparingDouble(
                    (Order o) -> evaluator.orderRevenue(o, candidate.getTotalDistanceKm())).reversed());

            for (Order order : byValue) {
                if (!handled.add(order.getId())) {
                    log.warn("Order {} appears on more than one route, keeping the first", order.getId());
                    continue;
                }
                int sequence = candidate.getOrders().indexOf(order);
                Optional<Trailer> trailer = findTrailer(order, pools.getOrDefault(order.getShipFrom(), Collections.emptyList()));
                if (trailer.isEmpty()) {
                    log.warn("No compatible trailer at {} for order {} ({} kg), needs manual assignment",
                            order.getShipFrom(), order.getId(), order.getWeightKg());
                    unassigned.add(new UnassignedOrder(order.getId(), UnassignedOrder.Reason.NO_COMPATIBLE_TRAILER));
                    continue;
                }
                OrderAssignment assignment = bind(order, candidate, trailer.get(), sequence);
                if (assignment == null) {
                    unassigned.add(new UnassignedOrder(order.getId(), UnassignedOrder.Reason.PERSISTENCE_FAILED));
                } else {
                    assignments.add(assignment);
                }
            }
        }
        return new Result(assignments, unassigned);
    }

    /**
     * First trailer in the pool that can take the weight and has the required equipment.
     */
    static Optional<Trailer> findTrailer(Order order, List<Trailer> pool) {
        boolean needsTemperature = order.needsTemperatureControl();
        boolean needsPalletJack = order.requires(SpecialRequirement.REQUIRES_PALLET_JACK);
        for (Trailer trailer : pool) {
            if (!trailer.canCarry(order.getWeightKg())) {
                continue;
            }
            if (needsTemperature && !trailer.isTemperatureControlled()) {
                continue;
            }
            if (needsPalletJack && !trailer.hasPalletJack()) {
                continue;
            }
            return Optional.of(trailer);
        }
        return Optional.empty();
    }

    private OrderAssignment bind(Order order, RouteCandidate candidate, Trailer trailer, int sequence) {
        String truckId = candidate.getTruck().getId();
        OrderAssignment assignment = new OrderAssignment(order.getId(), truckId, trailer.getId(), sequence,
                OrderAssignment.ASSIGNED_BY_ENGINE, clock.instant());

        boolean saved;
        try {
            saved = orderApi.saveAssignment(assignment);
        } catch (RuntimeException e) {
            log.warn("Saving assignment for order {} failed", order.getId(), e);
            saved = false;
        }
        if (!saved) {
            log.warn("Assignment for order {} was not stored, trailer {} left untouched", order.getId(), trailer.getId());
            return null;
        }

        trailer.addLoad(order.getWeightKg());
        boolean statusUpdated;
        try {
            statusUpdated = orderApi.updateOrderStatus(order.getId(), OrderStatus.ASSIGNED);
        } catch (RuntimeException e) {
            log.warn("Status update for order {} failed", order.getId(), e);
            statusUpdated = false;
        }
        if (!statusUpdated) {
            log.warn("Order {} is assigned but its status could not be updated", order.getId());
        }
        order.markAssigned(truckId, trailer.getId());

        log.info("Assigned order {} to truck {} / trailer {} (seq {}, trailer load {}/{} kg)",
                order.getId(), truckId, trailer.getId(), sequence,
                trailer.getCurrentWeightKg(), trailer.getMaxWeightKg());
        return assignment;
    }

    /**
     * Assignments made and orders left for manual handling.
     */
    public static final class Result {
        private final List<OrderAssignment> assignments;
        private final List<UnassignedOrder> unassigned;

        Result(List<OrderAssignment> assignments, List<UnassignedOrder> unassigned) {
            this.assignments = Collections.unmodifiableList(assignments);
            this.unassigned = Collections.unmodifiableList(unassigned);
        }

        public List<OrderAssignment> getAssignments() {
            return assignments;
        }

        public List<UnassignedOrder> getUnassigned() {
            return unassigned;
        }
    }
}
