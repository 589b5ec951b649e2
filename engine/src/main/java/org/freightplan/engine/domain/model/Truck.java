package org.freightplan.engine.domain.model;

import java.util.Objects;

/**
 * Immutable snapshot of a truck available for routing.
 * The home warehouse is the truck's depot: routes start and end there.
 */
public final class Truck {

    private final String id;
    private final String name;
    private final String warehouse;
    private final double currentHours;
    private final double maxHours;

    public Truck(String id, String name, String warehouse, double currentHours, double maxHours) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.warehouse = Objects.requireNonNull(warehouse, "warehouse must not be null");
        this.name = name;
        this.currentHours = currentHours;
        this.maxHours = maxHours;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getWarehouse() {
        return warehouse;
    }

    public double getCurrentHours() {
        return currentHours;
    }

    public double getMaxHours() {
        return maxHours;
    }

    /**
     * Duty time left before the driver reaches the maximum, in minutes. Never negative.
     */
    public long getRemainingDutyMinutes() {
        return Math.max(0L, (long) Math.floor((maxHours - currentHours) * 60.0));
    }

    @Override
    public String toString() {
        return String.format("Truck{id='%s', warehouse='%s', hours=%.1f/%.1f}", id, warehouse, currentHours, maxHours);
    }
}
