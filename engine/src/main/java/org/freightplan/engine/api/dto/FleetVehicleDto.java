package org.freightplan.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a fleet vehicle. Trucks and trailers share the payload; trailer-only
 * fields are absent for trucks and vice versa.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FleetVehicleDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("driver")
    private DriverDto driver;

    @JsonProperty("engineHours")
    private double engineHours;

    @JsonProperty("maxHours")
    private Double maxHours;

    @JsonProperty("location")
    private VehicleLocationDto location;

    @JsonProperty("maxWeightKg")
    private double maxWeightKg;

    @JsonProperty("currentWeightKg")
    private double currentWeightKg;

    @JsonProperty("hasPalletJack")
    private boolean hasPalletJack;

    @JsonProperty("temperatureControlled")
    private boolean temperatureControlled;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public DriverDto getDriver() {
        return driver;
    }

    public void setDriver(DriverDto driver) {
        this.driver = driver;
    }

    public double getEngineHours() {
        return engineHours;
    }

    public void setEngineHours(double engineHours) {
        this.engineHours = engineHours;
    }

    public Double getMaxHours() {
        return maxHours;
    }

    public void setMaxHours(Double maxHours) {
        this.maxHours = maxHours;
    }

    public VehicleLocationDto getLocation() {
        return location;
    }

    public void setLocation(VehicleLocationDto location) {
        this.location = location;
    }

    public double getMaxWeightKg() {
        return maxWeightKg;
    }

    public void setMaxWeightKg(double maxWeightKg) {
        this.maxWeightKg = maxWeightKg;
    }

    public double getCurrentWeightKg() {
        return currentWeightKg;
    }

    public void setCurrentWeightKg(double currentWeightKg) {
        this.currentWeightKg = currentWeightKg;
    }

    public boolean isHasPalletJack() {
        return hasPalletJack;
    }

    public void setHasPalletJack(boolean hasPalletJack) {
        this.hasPalletJack = hasPalletJack;
    }

    public boolean isTemperatureControlled() {
        return temperatureControlled;
    }

    public void setTemperatureControlled(boolean temperatureControlled) {
        this.temperatureControlled = temperatureControlled;
    }

    /**
     * Warehouse the vehicle is parked at, or "Unknown" when the registry does not say.
     */
    public String warehouseOrUnknown() {
        if (location == null || location.getWarehouse() == null || location.getWarehouse().isEmpty()) {
            return "Unknown";
        }
        return location.getWarehouse();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DriverDto {
        @JsonProperty("name")
        private String name;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class VehicleLocationDto {
        @JsonProperty("warehouse")
        private String warehouse;

        @JsonProperty("latitude")
        private Double latitude;

        @JsonProperty("longitude")
        private Double longitude;

        public String getWarehouse() {
            return warehouse;
        }

        public void setWarehouse(String warehouse) {
            this.warehouse = warehouse;
        }

        public Double getLatitude() {
            return latitude;
        }

        public void setLatitude(Double latitude) {
            this.latitude = latitude;
        }

        public Double getLongitude() {
            return longitude;
        }

        public void setLongitude(Double longitude) {
            this.longitude = longitude;
        }
    }
}
