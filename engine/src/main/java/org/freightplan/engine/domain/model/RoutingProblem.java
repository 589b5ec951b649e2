package org.freightplan.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Input of one routing solve: the matrix, the shipments to carry, one depot and one latest-return
 * time per vehicle, and the time limits that bound the model and the search.
 */
public final class RoutingProblem {

    private final TravelMatrix matrix;
    private final List<Shipment> shipments;
    private final int[] depotNodes;
    private final long[] latestEndMinutes;
    private final int horizonMinutes;
    private final int maxWaitMinutes;
    private final int timeLimitSeconds;

    public RoutingProblem(TravelMatrix matrix, List<Shipment> shipments, int[] depotNodes, long[] latestEndMinutes,
                          int horizonMinutes, int maxWaitMinutes, int timeLimitSeconds) {
        this.matrix = Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(shipments, "shipments must not be null");
        for (Shipment shipment : shipments) {
            if (shipment.getPickupNode() >= matrix.size() || shipment.getDeliveryNode() >= matrix.size()) {
                throw new IllegalArgumentException("shipment node out of range: " + shipment);
            }
        }
        this.shipments = Collections.unmodifiableList(new ArrayList<>(shipments));
        Objects.requireNonNull(depotNodes, "depotNodes must not be null");
        Objects.requireNonNull(latestEndMinutes, "latestEndMinutes must not be null");
        if (depotNodes.length == 0) {
            throw new IllegalArgumentException("at least one vehicle is required");
        }
        if (depotNodes.length != latestEndMinutes.length) {
            throw new IllegalArgumentException("depotNodes and latestEndMinutes differ in length");
        }
        for (int depot : depotNodes) {
            if (depot < 0 || depot >= matrix.size()) {
                throw new IllegalArgumentException("depot node out of range: " + depot);
            }
        }
        if (horizonMinutes < 1 || maxWaitMinutes < 0 || timeLimitSeconds < 1) {
            throw new IllegalArgumentException("horizon and time limit must be positive, max wait non-negative");
        }
        this.depotNodes = depotNodes.clone();
        this.latestEndMinutes = latestEndMinutes.clone();
        this.horizonMinutes = horizonMinutes;
        this.maxWaitMinutes = maxWaitMinutes;
        this.timeLimitSeconds = timeLimitSeconds;
    }

    public TravelMatrix getMatrix() {
        return matrix;
    }

    public int getVehicleCount() {
        return depotNodes.length;
    }

    public int depotOf(int vehicle) {
        return depotNodes[vehicle];
    }

    public List<Shipment> getShipments() {
        return shipments;
    }

    /**
     * Latest time, in minutes from route start, the vehicle may be back at its depot.
     */
    public long latestEndOf(int vehicle) {
        return latestEndMinutes[vehicle];
    }

    public int getHorizonMinutes() {
        return horizonMinutes;
    }

    public int getMaxWaitMinutes() {
        return maxWaitMinutes;
    }

    public int getTimeLimitSeconds() {
        return timeLimitSeconds;
    }
}
