package org.freightplan.engine.api;

import java.util.Objects;

/**
 * Dominant forecast condition for one location.
 * A placeholder forecast is produced when no weather API key is configured and carries no signal.
 */
public final class WeatherForecast {

    private final String location;
    private final String condition;
    private final boolean placeholder;

    public WeatherForecast(String location, String condition, boolean placeholder) {
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.condition = condition == null ? "" : condition;
        this.placeholder = placeholder;
    }

    public static WeatherForecast placeholder(String location) {
        return new WeatherForecast(location, "Clear", true);
    }

    public String getLocation() {
        return location;
    }

    public String getCondition() {
        return condition;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    @Override
    public String toString() {
        return "WeatherForecast{" + location + ": " + condition + (placeholder ? " (placeholder)" : "") + "}";
    }
}
