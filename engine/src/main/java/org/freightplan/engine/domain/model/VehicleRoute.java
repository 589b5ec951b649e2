package org.freightplan.engine.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Location sequence driven by one vehicle, from its start depot to its end depot,
 * and the orders it delivers in drop-off order.
 */
public final class VehicleRoute {

    private final int vehicleIndex;
    private final List<Integer> nodes;
    private final List<String> deliveredOrderIds;

    public VehicleRoute(int vehicleIndex, List<Integer> nodes, List<String> deliveredOrderIds) {
        this.vehicleIndex = vehicleIndex;
        this.nodes = Collections.unmodifiableList(Objects.requireNonNull(nodes, "nodes must not be null"));
        this.deliveredOrderIds = Collections.unmodifiableList(
                Objects.requireNonNull(deliveredOrderIds, "deliveredOrderIds must not be null"));
    }

    public int getVehicleIndex() {
        return vehicleIndex;
    }

    /**
     * Matrix nodes in driving order. Repeated stops at one location appear once.
     */
    public List<Integer> getNodes() {
        return nodes;
    }

    public List<String> getDeliveredOrderIds() {
        return deliveredOrderIds;
    }

    /**
     * True when the vehicle carries nothing.
     */
    public boolean isEmpty() {
        return deliveredOrderIds.isEmpty();
    }

    @Override
    public String toString() {
        return "VehicleRoute{vehicle=" + vehicleIndex + ", nodes=" + nodes + ", orders=" + deliveredOrderIds + "}";
    }
}
