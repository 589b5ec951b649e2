package org.freightplan.engine.domain.model;

import java.util.Objects;

/**
 * Trailer snapshot for one optimization pass.
 *
 * The loaded weight grows as orders are bound to the trailer and is never
 * decremented within a pass. Mutation happens from a single thread, in route
 * rank order.
 */
public final class Trailer {

    private final String id;
    private final String name;
    private final String warehouse;
    private final double maxWeightKg;
    private final boolean palletJack;
    private final boolean temperatureControlled;
    private double currentWeightKg;

    private Trailer(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.warehouse = Objects.requireNonNull(builder.warehouse, "warehouse must not be null");
        if (builder.maxWeightKg < 0) {
            throw new IllegalArgumentException("maxWeightKg must not be negative");
        }
        this.name = builder.name;
        this.maxWeightKg = builder.maxWeightKg;
        this.palletJack = builder.palletJack;
        this.temperatureControlled = builder.temperatureControlled;
        this.currentWeightKg = builder.currentWeightKg;
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

    public double getMaxWeightKg() {
        return maxWeightKg;
    }

    public boolean hasPalletJack() {
        return palletJack;
    }

    public boolean isTemperatureControlled() {
        return temperatureControlled;
    }

    public double getCurrentWeightKg() {
        return currentWeightKg;
    }

    public double getRemainingCapacityKg() {
        return Math.max(0.0, maxWeightKg - currentWeightKg);
    }

    /**
     * Check if the given weight still fits on this trailer.
     */
    public boolean canCarry(double weightKg) {
        return maxWeightKg >= weightKg && currentWeightKg + weightKg <= maxWeightKg;
    }

    /**
     * Add a bound order's weight to the running load.
     *
     * @throws IllegalStateException if the load would exceed the trailer's capacity
     */
    public void addLoad(double weightKg) {
        if (!canCarry(weightKg)) {
            throw new IllegalStateException(String.format(
                    "Trailer %s cannot take %.1fkg (current %.1fkg, max %.1fkg)",
                    id, weightKg, currentWeightKg, maxWeightKg));
        }
        this.currentWeightKg += weightKg;
    }

    @Override
    public String toString() {
        return String.format("Trailer{id='%s', warehouse='%s', load=%.1f/%.1fkg, palletJack=%s, temperatureControlled=%s}",
                id, warehouse, currentWeightKg, maxWeightKg, palletJack, temperatureControlled);
    }

    /**
     * Builder for Trailer.
     */
    public static final class Builder {
        private String id;
        private String name;
        private String warehouse;
        private double maxWeightKg;
        private double currentWeightKg;
        private boolean palletJack;
        private boolean temperatureControlled;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder warehouse(String warehouse) {
            this.warehouse = warehouse;
            return this;
        }

        public Builder maxWeightKg(double maxWeightKg) {
            this.maxWeightKg = maxWeightKg;
            return this;
        }

        public Builder currentWeightKg(double currentWeightKg) {
            this.currentWeightKg = currentWeightKg;
            return this;
        }

        public Builder palletJack(boolean palletJack) {
            this.palletJack = palletJack;
            return this;
        }

        public Builder temperatureControlled(boolean temperatureControlled) {
            this.temperatureControlled = temperatureControlled;
            return this;
        }

        public Trailer build() {
            return new Trailer(this);
        }
    }
}
