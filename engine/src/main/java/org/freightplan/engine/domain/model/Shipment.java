package org.freightplan.engine.domain.model;

import java.util.Objects;

/**
 * One order as the solver sees it: load at the pickup node, unload at the delivery node,
 * both on the same vehicle.
 */
public final class Shipment {

    private final String orderId;
    private final int pickupNode;
    private final int deliveryNode;

    public Shipment(String orderId, int pickupNode, int deliveryNode) {
        this.orderId = Objects.requireNonNull(orderId, "orderId must not be null");
        if (pickupNode < 0 || deliveryNode < 0) {
            throw new IllegalArgumentException("node indexes must not be negative");
        }
        if (pickupNode == deliveryNode) {
            throw new IllegalArgumentException("pickup and delivery are the same node for order " + orderId);
        }
        this.pickupNode = pickupNode;
        this.deliveryNode = deliveryNode;
    }

    public String getOrderId() {
        return orderId;
    }

    public int getPickupNode() {
        return pickupNode;
    }

    public int getDeliveryNode() {
        return deliveryNode;
    }

    @Override
    public String toString() {
        return "Shipment{" + orderId + ": " + pickupNode + " -> " + deliveryNode + "}";
    }
}
