package org.freightplan.engine.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A transportation order awaiting assignment.
 *
 * Shipment data is immutable. Status and the assigned truck/trailer are the only
 * mutable parts and are written by the assignment step once a trailer is bound.
 */
public final class Order {

    private final String id;
    private final String customerName;
    private final String shipFrom;
    private final String shipTo;
    private final double weightKg;
    private final Priority priority;
    private final Set<SpecialRequirement> specialRequirements;

    private volatile OrderStatus status;
    private volatile String assignedTruckId;
    private volatile String assignedTrailerId;

    private Order(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.shipFrom = Objects.requireNonNull(builder.shipFrom, "shipFrom must not be null");
        this.shipTo = Objects.requireNonNull(builder.shipTo, "shipTo must not be null");
        if (builder.weightKg < 0) {
            throw new IllegalArgumentException("weightKg must not be negative");
        }
        this.customerName = builder.customerName;
        this.weightKg = builder.weightKg;
        this.priority = builder.priority != null ? builder.priority : Priority.LOW;
        this.specialRequirements = builder.specialRequirements.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.specialRequirements));
        this.status = builder.status != null ? builder.status : OrderStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public String getCustomerName() {
        return customerName;
    }

    public String getShipFrom() {
        return shipFrom;
    }

    public String getShipTo() {
        return shipTo;
    }

    public double getWeightKg() {
        return weightKg;
    }

    public Priority getPriority() {
        return priority;
    }

    public Set<SpecialRequirement> getSpecialRequirements() {
        return specialRequirements;
    }

    public boolean requires(SpecialRequirement requirement) {
        return specialRequirements.contains(requirement);
    }

    /**
     * Check if the load must travel in a temperature-controlled trailer.
     */
    public boolean needsTemperatureControl() {
        return specialRequirements.stream().anyMatch(SpecialRequirement::needsTemperatureControl);
    }

    public OrderStatus getStatus() {
        return status;
    }

    public String getAssignedTruckId() {
        return assignedTruckId;
    }

    public String getAssignedTrailerId() {
        return assignedTrailerId;
    }

    /**
     * Mark the order as bound to a truck and trailer.
     */
    public void markAssigned(String truckId, String trailerId) {
        this.assignedTruckId = Objects.requireNonNull(truckId, "truckId must not be null");
        this.assignedTrailerId = Objects.requireNonNull(trailerId, "trailerId must not be null");
        this.status = OrderStatus.ASSIGNED;
    }

    @Override
    public String toString() {
        return String.format("Order{id='%s', %s -> %s, weight=%.1fkg, priority=%s, status=%s}",
                id, shipFrom, shipTo, weightKg, priority.toValue(), status.toValue());
    }

    /**
     * Builder for Order.
     */
    public static final class Builder {
        private String id;
        private String customerName;
        private String shipFrom;
        private String shipTo;
        private double weightKg;
        private Priority priority = Priority.MEDIUM;
        private final Set<SpecialRequirement> specialRequirements = EnumSet.noneOf(SpecialRequirement.class);
        private OrderStatus status = OrderStatus.PENDING;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder customerName(String customerName) {
            this.customerName = customerName;
            return this;
        }

        public Builder shipFrom(String shipFrom) {
            this.shipFrom = shipFrom;
            return this;
        }

        public Builder shipTo(String shipTo) {
            this.shipTo = shipTo;
            return this;
        }

        public Builder weightKg(double weightKg) {
            this.weightKg = weightKg;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder requirement(SpecialRequirement requirement) {
            this.specialRequirements.add(Objects.requireNonNull(requirement, "requirement must not be null"));
            return this;
        }

        public Builder status(OrderStatus status) {
            this.status = status;
            return this;
        }

        public Order build() {
            return new Order(this);
        }
    }
}
