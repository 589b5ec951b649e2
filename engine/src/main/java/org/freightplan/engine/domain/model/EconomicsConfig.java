package org.freightplan.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-unit rates used to price and cost routes.
 * Defaults can be overridden key by key.
 */
public final class EconomicsConfig {

    private final Map<String, Double> values;

    // Revenue keys
    public static final String BASE_RATE_PER_KG = "base_rate_per_kg";
    public static final String DISTANCE_FACTOR_PER_KM = "distance_factor_per_km";
    public static final String SURCHARGE_HEATING = "surcharge_heating";
    public static final String SURCHARGE_REFRIGERATION = "surcharge_refrigeration";
    public static final String SURCHARGE_HAZARDOUS = "surcharge_hazardous";
    public static final String SURCHARGE_PALLET_JACK = "surcharge_pallet_jack";

    // Cost keys
    public static final String FUEL_COST_PER_KM = "fuel_cost_per_km";
    public static final String DRIVER_COST_PER_HOUR = "driver_cost_per_hour";
    public static final String MAINTENANCE_COST_PER_KM = "maintenance_cost_per_km";
    public static final String OVERHEAD_FIXED = "overhead_fixed";
    public static final String OVERHEAD_PER_HOUR = "overhead_per_hour";

    // Acceptance keys
    public static final String MIN_PROFIT_MARGIN = "min_profit_margin";

    private static final Map<String, Double> DEFAULTS;

    static {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(BASE_RATE_PER_KG, 0.10);
        defaults.put(DISTANCE_FACTOR_PER_KM, 0.01);
        defaults.put(SURCHARGE_HEATING, 0.3);
        defaults.put(SURCHARGE_REFRIGERATION, 0.3);
        defaults.put(SURCHARGE_HAZARDOUS, 0.5);
        defaults.put(SURCHARGE_PALLET_JACK, 0.0);
        defaults.put(FUEL_COST_PER_KM, 0.35);
        defaults.put(DRIVER_COST_PER_HOUR, 25.0);
        defaults.put(MAINTENANCE_COST_PER_KM, 0.05);
        defaults.put(OVERHEAD_FIXED, 50.0);
        defaults.put(OVERHEAD_PER_HOUR, 2.0);
        defaults.put(MIN_PROFIT_MARGIN, 0.0);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private EconomicsConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates the default configuration.
     */
    public static EconomicsConfig defaults() {
        return new EconomicsConfig(DEFAULTS);
    }

    /**
     * Creates a configuration from overrides layered on top of the defaults.
     *
     * @throws IllegalArgumentException for unknown keys or negative rates
     */
    public static EconomicsConfig fromMap(Map<String, Double> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Double> merged = new HashMap<>(DEFAULTS);
        for (Map.Entry<String, Double> entry : overrides.entrySet()) {
            if (!DEFAULTS.containsKey(entry.getKey())) {
                throw new IllegalArgumentException("Unknown economics key: " + entry.getKey());
            }
            Double value = Objects.requireNonNull(entry.getValue(), "value must not be null for " + entry.getKey());
            if (value < 0 || value.isNaN() || value.isInfinite()) {
                throw new IllegalArgumentException("Invalid value for " + entry.getKey() + ": " + value);
            }
            merged.put(entry.getKey(), value);
        }
        return new EconomicsConfig(merged);
    }

    /**
     * All keys this configuration understands.
     */
    public static Iterable<String> keys() {
        return DEFAULTS.keySet();
    }

    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown economics key: " + key);
        }
        return value;
    }

    public double getBaseRatePerKg() {
        return get(BASE_RATE_PER_KG);
    }

    public double getDistanceFactorPerKm() {
        return get(DISTANCE_FACTOR_PER_KM);
    }

    /**
     * Revenue surcharge added to the multiplier for one requirement flag.
     */
    public double getSurcharge(SpecialRequirement requirement) {
        switch (requirement) {
            case REQUIRES_HEATING:
                return get(SURCHARGE_HEATING);
            case REQUIRES_REFRIGERATION:
                return get(SURCHARGE_REFRIGERATION);
            case HAZARDOUS:
                return get(SURCHARGE_HAZARDOUS);
            case REQUIRES_PALLET_JACK:
                return get(SURCHARGE_PALLET_JACK);
            default:
                return 0.0;
        }
    }

    public double getFuelCostPerKm() {
        return get(FUEL_COST_PER_KM);
    }

    public double getDriverCostPerHour() {
        return get(DRIVER_COST_PER_HOUR);
    }

    public double getMaintenanceCostPerKm() {
        return get(MAINTENANCE_COST_PER_KM);
    }

    public double getOverheadFixed() {
        return get(OVERHEAD_FIXED);
    }

    public double getOverheadPerHour() {
        return get(OVERHEAD_PER_HOUR);
    }

    /**
     * Minimum margin a profitable route must also reach. 0 disables the floor.
     */
    public double getMinProfitMargin() {
        return get(MIN_PROFIT_MARGIN);
    }

    @Override
    public String toString() {
        return "EconomicsConfig" + values;
    }
}
