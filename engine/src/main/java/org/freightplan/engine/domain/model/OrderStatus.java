package org.freightplan.engine.domain.model;

import java.util.Locale;

public enum OrderStatus {
    PENDING,
    ASSIGNED,
    IN_TRANSIT,
    DELIVERED,
    CANCELLED;

    public static OrderStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return OrderStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }

    /**
     * Wire representation used by the order API ("pending", "assigned", ...).
     */
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
