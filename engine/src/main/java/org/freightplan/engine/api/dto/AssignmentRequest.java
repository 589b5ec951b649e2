package org.freightplan.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for recording an order assignment.
 */
public final class AssignmentRequest {

    @JsonProperty("order_id")
    private final String orderId;

    @JsonProperty("truck_id")
    private final String truckId;

    @JsonProperty("trailer_id")
    private final String trailerId;

    @JsonProperty("sequence")
    private final int sequence;

    @JsonProperty("assigned_by")
    private final String assignedBy;

    // ISO-8601 UTC
    @JsonProperty("assigned_at")
    private final String assignedAt;

    public AssignmentRequest(String orderId, String truckId, String trailerId, int sequence,
                             String assignedBy, String assignedAt) {
        this.orderId = orderId;
        this.truckId = truckId;
        this.trailerId = trailerId;
        this.sequence = sequence;
        this.assignedBy = assignedBy;
        this.assignedAt = assignedAt;
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

    public String getAssignedAt() {
        return assignedAt;
    }
}
