package org.freightplan.engine.config;

import org.freightplan.engine.domain.model.EconomicsConfig;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineConfigTest {

    @Test
    void emptySourceGivesDefaults() {
        EngineConfig config = EngineConfig.fromSource(key -> null);

        assertEquals(EngineConfig.DEFAULT_ORDER_API_URL, config.getOrderApiUrl());
        assertEquals(EngineConfig.DEFAULT_HORIZON_MINUTES, config.getRouteHorizonMinutes());
        assertEquals(EngineConfig.DEFAULT_MAX_OPTIMIZATION_SECONDS, config.getMaxOptimizationSeconds());
        assertEquals(EngineConfig.DEFAULT_CALLBACK_PORT, config.getCallbackPort());
        assertEquals("", config.getMapsApiKey());
        assertTrue(config.isSchedulerEnabled());
        assertEquals(EconomicsConfig.defaults().getFuelCostPerKm(), config.getEconomics().getFuelCostPerKm(), 1e-9);
    }

    @Test
    void valuesAndEconomicsOverridesAreRead() {
        Map<String, String> env = new HashMap<>();
        env.put("ORDER_API_URL", " http://orders:9000/ ");
        env.put("MAX_OPTIMIZATION_TIME", "5");
        env.put("OPTIMIZE_SCHEDULER_ENABLED", "false");
        env.put("ECON_FUEL_COST_PER_KM", "0.9");
        env.put("ECON_MIN_PROFIT_MARGIN", "0.125");

        EngineConfig config = EngineConfig.fromSource(env::get);

        assertEquals("http://orders:9000/", config.getOrderApiUrl());
        assertEquals(5, config.getMaxOptimizationSeconds());
        assertFalse(config.isSchedulerEnabled());
        assertEquals(0.9, config.getEconomics().getFuelCostPerKm(), 1e-9);
        assertEquals(0.125, config.getEconomics().getMinProfitMargin(), 1e-9);
    }

    @Test
    void unparsableNumbersFallBackToDefaults() {
        Map<String, String> env = new HashMap<>();
        env.put("AVERAGE_SPEED_KMH", "fast");
        env.put("ECON_OVERHEAD_FIXED", "lots");

        EngineConfig config = EngineConfig.fromSource(env::get);

        assertEquals(EngineConfig.DEFAULT_AVERAGE_SPEED_KMH, config.getAverageSpeedKmh(), 1e-9);
        assertEquals(EconomicsConfig.defaults().getOverheadFixed(), config.getEconomics().getOverheadFixed(), 1e-9);
    }

    @Test
    void outOfRangeValuesAreRejected() {
        Map<String, String> env = new HashMap<>();
        env.put("ENGINE_CALLBACK_PORT", "70000");

        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromSource(env::get));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig.Builder().weatherForecastDays(6));
    }

    @Test
    void economicsVariableNames() {
        assertEquals("ECON_DRIVER_COST_PER_HOUR", EngineConfig.economicsVariable(EconomicsConfig.DRIVER_COST_PER_HOUR));
    }
}
