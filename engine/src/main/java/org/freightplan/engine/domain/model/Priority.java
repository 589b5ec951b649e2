package org.freightplan.engine.domain.model;

import java.util.Locale;

/**
 * Order priority. Each level carries the latest service time (minutes from
 * route start) allowed at the locations the order touches.
 */
public enum Priority {
    LOW(1000),
    MEDIUM(500),
    HIGH(200);

    private final long latestServiceMinutes;

    Priority(long latestServiceMinutes) {
        this.latestServiceMinutes = latestServiceMinutes;
    }

    public long getLatestServiceMinutes() {
        return latestServiceMinutes;
    }

    /**
     * Parse a wire value ("low", "medium", "high"). Unknown or missing values map to LOW.
     */
    public static Priority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        try {
            return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
