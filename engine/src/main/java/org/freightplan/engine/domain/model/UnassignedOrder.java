package org.freightplan.engine.domain.model;

import java.util.Objects;

/**
 * An order the pass could not assign, with the reason. These need manual assignment.
 */
public final class UnassignedOrder {

    public enum Reason {
        /** No truck or trailer was available when the batch started. */
        NO_AVAILABLE_FLEET,
        /** The solver did not place the order on any feasible route. */
        NOT_ROUTED,
        /** The order's route was feasible but rejected as unprofitable. */
        UNPROFITABLE_ROUTE,
        /** No trailer at the origin warehouse satisfied weight and equipment constraints. */
        NO_COMPATIBLE_TRAILER,
        /** The assignment record could not be saved. */
        PERSISTENCE_FAILED
    }

    private final String orderId;
    private final Reason reason;

    public UnassignedOrder(String orderId, Reason reason) {
        this.orderId = Objects.requireNonNull(orderId, "orderId must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public String getOrderId() {
        return orderId;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return orderId + "(" + reason + ")";
    }
}
