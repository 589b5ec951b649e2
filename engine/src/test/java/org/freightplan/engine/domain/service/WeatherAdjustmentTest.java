package org.freightplan.engine.domain.service;

import org.freightplan.engine.api.WeatherForecast;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WeatherAdjustmentTest {

    @Test
    void conditionsMapToFractions() {
        assertEquals(WeatherAdjustment.SNOW, WeatherAdjustment.forCondition("Snow"));
        assertEquals(WeatherAdjustment.RAIN, WeatherAdjustment.forCondition("light rain"));
        assertEquals(WeatherAdjustment.RAIN, WeatherAdjustment.forCondition("Showers"));
        assertEquals(WeatherAdjustment.FOG, WeatherAdjustment.forCondition("Mist"));
        assertEquals(WeatherAdjustment.STORM, WeatherAdjustment.forCondition("Thunderstorm"));
        assertEquals(WeatherAdjustment.NONE, WeatherAdjustment.forCondition("Clear"));
        assertEquals(WeatherAdjustment.NONE, WeatherAdjustment.forCondition(null));
    }

    @Test
    void earlierKeywordWins() {
        assertEquals(WeatherAdjustment.SNOW, WeatherAdjustment.forCondition("Thunderstorm with snow"));
        assertEquals(WeatherAdjustment.RAIN, WeatherAdjustment.forCondition("Thunderstorm with rain"));
    }

    @Test
    void placeholderAndMissingForecastsAreNeutral() {
        assertEquals(WeatherAdjustment.NONE, WeatherAdjustment.forForecast(Optional.empty()));
        assertEquals(WeatherAdjustment.NONE, WeatherAdjustment.forForecast(Optional.of(WeatherForecast.placeholder("Regina"))));
        assertEquals(WeatherAdjustment.SNOW,
                WeatherAdjustment.forForecast(Optional.of(new WeatherForecast("Regina", "Snow", false))));
    }
}
