package org.freightplan.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for GET fleet/vehicles.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FleetVehiclesResponseDto {

    @JsonProperty("data")
    private List<FleetVehicleDto> data;

    public List<FleetVehicleDto> getData() {
        return data;
    }

    public void setData(List<FleetVehicleDto> data) {
        this.data = data;
    }
}
