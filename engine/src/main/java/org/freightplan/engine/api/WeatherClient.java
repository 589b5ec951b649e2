package org.freightplan.engine.api;

import java.util.Optional;

/**
 * Client interface for the weather forecast service.
 */
public interface WeatherClient {

    /**
     * Get the forecast for a location.
     *
     * @param location place name
     * @param days     how many days ahead to look
     * @return the forecast, or empty if it could not be retrieved
     */
    Optional<WeatherForecast> forecast(String location, int days);
}
