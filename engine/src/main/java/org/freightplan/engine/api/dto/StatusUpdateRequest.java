package org.freightplan.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for PATCH v1/orders/{id}/status.
 */
public final class StatusUpdateRequest {

    @JsonProperty("status")
    private final String status;

    public StatusUpdateRequest(String status) {
        this.status = status;
    }

    public String getStatus() {
        return status;
    }
}
