package org.freightplan.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * DTO for an order as served by the order API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class OrderDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("ship_from")
    private String shipFrom;

    @JsonProperty("ship_to")
    private String shipTo;

    @JsonProperty("weight_kg")
    private double weightKg;

    @JsonProperty("priority")
    private String priority;

    @JsonProperty("status")
    private String status;

    @JsonProperty("special_requirements")
    private Map<String, Boolean> specialRequirements;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }

    public String getShipFrom() {
        return shipFrom;
    }

    public void setShipFrom(String shipFrom) {
        this.shipFrom = shipFrom;
    }

    public String getShipTo() {
        return shipTo;
    }

    public void setShipTo(String shipTo) {
        this.shipTo = shipTo;
    }

    public double getWeightKg() {
        return weightKg;
    }

    public void setWeightKg(double weightKg) {
        this.weightKg = weightKg;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Map<String, Boolean> getSpecialRequirements() {
        return specialRequirements;
    }

    public void setSpecialRequirements(Map<String, Boolean> specialRequirements) {
        this.specialRequirements = specialRequirements;
    }
}
