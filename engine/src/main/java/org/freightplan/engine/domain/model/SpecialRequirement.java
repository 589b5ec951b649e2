package org.freightplan.engine.domain.model;

import java.util.Optional;

/**
 * Special handling flags an order can carry.
 * The key is the flag name used in the order API's special_requirements map.
 */
public enum SpecialRequirement {
    REQUIRES_HEATING("requires_heating"),
    REQUIRES_REFRIGERATION("requires_refrigeration"),
    HAZARDOUS("hazardous"),
    REQUIRES_PALLET_JACK("requires_pallet_jack");

    private final String key;

    SpecialRequirement(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * True when a trailer must be temperature-controlled to carry the load.
     */
    public boolean needsTemperatureControl() {
        return this == REQUIRES_HEATING || this == REQUIRES_REFRIGERATION;
    }

    public static Optional<SpecialRequirement> fromKey(String key) {
        for (SpecialRequirement requirement : values()) {
            if (requirement.key.equalsIgnoreCase(key)) {
                return Optional.of(requirement);
            }
        }
        return Optional.empty();
    }
}
