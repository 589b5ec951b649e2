package org.freightplan.engine.domain.service;

import org.freightplan.engine.api.WeatherForecast;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps a forecast condition to the fractional increase applied to travel time into a location.
 */
public final class WeatherAdjustment {

    public static final double SNOW = 0.30;
    public static final double RAIN = 0.20;
    public static final double FOG = 0.10;
    public static final double STORM = 0.50;
    public static final double NONE = 0.0;

    private WeatherAdjustment() {
    }

    /**
     * Keywords are checked in order: snow, rain/shower, fog/mist, storm/thunder.
     * A condition such as "Thunderstorm with snow" therefore counts as snow.
     */
    public static double forCondition(String condition) {
        if (condition == null) {
            return NONE;
        }
        String c = condition.toLowerCase(Locale.ROOT);
        if (c.contains("snow")) {
            return SNOW;
        }
        if (c.contains("rain") || c.contains("shower")) {
            return RAIN;
        }
        if (c.contains("fog") || c.contains("mist")) {
            return FOG;
        }
        if (c.contains("storm") || c.contains("thunder")) {
            return STORM;
        }
        return NONE;
    }

    /**
     * Missing and placeholder forecasts carry no adjustment.
     */
    public static double forForecast(Optional<WeatherForecast> forecast) {
        if (forecast == null || forecast.isEmpty() || forecast.get().isPlaceholder()) {
            return NONE;
        }
        return forCondition(forecast.get().getCondition());
    }
}
