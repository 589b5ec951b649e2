package org.freightplan.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only record binding an order to a truck and trailer.
 */
public final class OrderAssignment {

    public static final String ASSIGNED_BY_ENGINE = "optimization_engine";

    private final String orderId;
    private final String truckId;
    private final String trailerId;
    private final int sequence;
    private final String assignedBy;
    private final Instant assignedAt;

    public OrderAssignment(String orderId, String truckId, String trailerId, int sequence,
                           String assignedBy, Instant assignedAt) {
        this.orderId = Objects.requireNonNull(orderId, "orderId must not be null");
        this.truckId = Objects.requireNonNull(truckId, "truckId must not be null");
        this.trailerId = Objects.requireNonNull(trailerId, "trailerId must not be null");
        this.assignedBy = Objects.requireNonNull(assignedBy, "assignedBy must not be null");
        this.assignedAt = Objects.requireNonNull(assignedAt, "assignedAt must not be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must not be negative");
        }
        this.sequence = sequence;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getTruckId() {
        return truckId;
    }

    public String getTrailerId() {
        return trailerId;
    }

    public int getSequence() {
        return sequence;
    }

    public String getAssignedBy() {
        return assignedBy;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    @Override
    public String toString() {
        return String.format("OrderAssignment{order='%s', truck='%s', trailer='%s', seq=%d}",
                orderId, truckId, trailerId, sequence);
    }
}
