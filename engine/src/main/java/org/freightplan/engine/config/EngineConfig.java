package org.freightplan.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.freightplan.engine.api.GoogleMapsClientImpl;
import org.freightplan.engine.api.OpenWeatherClientImpl;
import org.freightplan.engine.domain.model.EconomicsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Immutable configuration for the optimization engine.
 * Values are read from environment variables, then from a {@code .env} file, then defaults.
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_FLEET_API_URL = "https://api.samsara.com/";
    public static final String DEFAULT_ORDER_API_URL = "http://localhost:8000/";
    public static final int DEFAULT_FORECAST_DAYS = 1;
    public static final int DEFAULT_WEATHER_THREADS = 4;
    public static final int DEFAULT_MAX_OPTIMIZATION_SECONDS = 30;
    public static final double DEFAULT_AVERAGE_SPEED_KMH = 60.0;
    public static final int DEFAULT_HORIZON_MINUTES = 1440;
    public static final int DEFAULT_MAX_WAIT_MINUTES = 1440;
    public static final int DEFAULT_CALLBACK_PORT = 8082;
    public static final int DEFAULT_OPTIMIZE_INTERVAL = 900;
    public static final String DEFAULT_LOG_FILE = "/app/logs/engine/engine.log";

    /** Prefix of the environment variables overriding {@link EconomicsConfig} rates. */
    public static final String ECONOMICS_PREFIX = "ECON_";

    // Collaborator endpoints
    private final String fleetApiUrl;
    private final String fleetApiKey;
    private final String orderApiUrl;
    private final String mapsApiUrl;
    private final String mapsApiKey;
    private final String weatherApiUrl;
    private final String weatherApiKey;

    // Matrix and solver
    private final int weatherForecastDays;
    private final int weatherLookupThreads;
    private final int maxOptimizationSeconds;
    private final double averageSpeedKmh;
    private final int routeHorizonMinutes;
    private final int maxWaitMinutes;

    private final EconomicsConfig economics;

    // Callback server and scheduler
    private final int callbackPort;
    private final int optimizeIntervalSeconds;
    private final boolean schedulerEnabled;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.fleetApiUrl = builder.fleetApiUrl;
        this.fleetApiKey = builder.fleetApiKey;
        this.orderApiUrl = builder.orderApiUrl;
        this.mapsApiUrl = builder.mapsApiUrl;
        this.mapsApiKey = builder.mapsApiKey;
        this.weatherApiUrl = builder.weatherApiUrl;
        this.weatherApiKey = builder.weatherApiKey;
        this.weatherForecastDays = builder.weatherForecastDays;
        this.weatherLookupThreads = builder.weatherLookupThreads;
        this.maxOptimizationSeconds = builder.maxOptimizationSeconds;
        this.averageSpeedKmh = builder.averageSpeedKmh;
        this.routeHorizonMinutes = builder.routeHorizonMinutes;
        this.maxWaitMinutes = builder.maxWaitMinutes;
        this.economics = builder.economics;
        this.callbackPort = builder.callbackPort;
        this.optimizeIntervalSeconds = builder.optimizeIntervalSeconds;
        this.schedulerEnabled = builder.schedulerEnabled;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables, falling back to a {@code .env}
     * file in the working directory or its parent.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv local = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parent = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromSource(key -> {
            String value = System.getenv(key);
            if (isBlank(value)) {
                value = local.get(key);
            }
            if (isBlank(value)) {
                value = parent.get(key);
            }
            return value;
        });
    }

    /**
     * Creates configuration from an arbitrary key lookup. A lookup returning null or blank means "unset".
     */
    public static EngineConfig fromSource(UnaryOperator<String> source) {
        Objects.requireNonNull(source, "source must not be null");
        Env env = new Env(source);
        return new Builder()
                .fleetApiUrl(env.get("FLEET_API_URL", DEFAULT_FLEET_API_URL))
                .fleetApiKey(env.get("FLEET_API_KEY", ""))
                .orderApiUrl(env.get("ORDER_API_URL", DEFAULT_ORDER_API_URL))
                .mapsApiUrl(env.get("MAPS_API_URL", GoogleMapsClientImpl.DEFAULT_BASE_URL))
                .mapsApiKey(env.get("GOOGLE_MAPS_API_KEY", ""))
                .weatherApiUrl(env.get("WEATHER_API_URL", OpenWeatherClientImpl.DEFAULT_BASE_URL))
                .weatherApiKey(env.get("WEATHER_API_KEY", ""))
                .weatherForecastDays(env.getInt("WEATHER_FORECAST_DAYS", DEFAULT_FORECAST_DAYS))
                .weatherLookupThreads(env.getInt("WEATHER_LOOKUP_THREADS", DEFAULT_WEATHER_THREADS))
                .maxOptimizationSeconds(env.getInt("MAX_OPTIMIZATION_TIME", DEFAULT_MAX_OPTIMIZATION_SECONDS))
                .averageSpeedKmh(env.getDouble("AVERAGE_SPEED_KMH", DEFAULT_AVERAGE_SPEED_KMH))
                .routeHorizonMinutes(env.getInt("ROUTE_HORIZON_MINUTES", DEFAULT_HORIZON_MINUTES))
                .maxWaitMinutes(env.getInt("MAX_WAIT_MINUTES", DEFAULT_MAX_WAIT_MINUTES))
                .economics(economicsFrom(env))
                .callbackPort(env.getInt("ENGINE_CALLBACK_PORT", DEFAULT_CALLBACK_PORT))
                .optimizeIntervalSeconds(env.getInt("OPTIMIZE_INTERVAL_SECONDS", DEFAULT_OPTIMIZE_INTERVAL))
                .schedulerEnabled(env.getBoolean("OPTIMIZE_SCHEDULER_ENABLED", true))
                .logFilePath(env.get("ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(env.getBoolean("ENGINE_FILE_LOGGING_ENABLED", true))
                .build();
    }

    /**
     * Name of the environment variable overriding an economics key, e.g. ECON_FUEL_COST_PER_KM.
     */
    public static String economicsVariable(String key) {
        return ECONOMICS_PREFIX + key.toUpperCase(Locale.ROOT);
    }

    private static EconomicsConfig economicsFrom(Env env) {
        Map<String, Double> overrides = new HashMap<>();
        for (String key : EconomicsConfig.keys()) {
            String variable = economicsVariable(key);
            String raw = env.get(variable, null);
            if (raw == null) {
                continue;
            }
            try {
                overrides.put(key, Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}, using default", variable, raw);
            }
        }
        return EconomicsConfig.fromMap(overrides);
    }

    // Getters
    public String getFleetApiUrl() {
        return fleetApiUrl;
    }

    public String getFleetApiKey() {
        return fleetApiKey;
    }

    public String getOrderApiUrl() {
        return orderApiUrl;
    }

    public String getMapsApiUrl() {
        return mapsApiUrl;
    }

    public String getMapsApiKey() {
        return mapsApiKey;
    }

    public String getWeatherApiUrl() {
        return weatherApiUrl;
    }

    public String getWeatherApiKey() {
        return weatherApiKey;
    }

    public int getWeatherForecastDays() {
        return weatherForecastDays;
    }

    public int getWeatherLookupThreads() {
        return weatherLookupThreads;
    }

    public int getMaxOptimizationSeconds() {
        return maxOptimizationSeconds;
    }

    public double getAverageSpeedKmh() {
        return averageSpeedKmh;
    }

    public int getRouteHorizonMinutes() {
        return routeHorizonMinutes;
    }

    public int getMaxWaitMinutes() {
        return maxWaitMinutes;
    }

    public EconomicsConfig getEconomics() {
        return economics;
    }

    public int getCallbackPort() {
        return callbackPort;
    }

    public int getOptimizeIntervalSeconds() {
        return optimizeIntervalSeconds;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "fleetApiUrl='" + fleetApiUrl + '\'' +
                ", orderApiUrl='" + orderApiUrl + '\'' +
                ", mapsApiKeySet=" + !mapsApiKey.isEmpty() +
                ", weatherApiKeySet=" + !weatherApiKey.isEmpty() +
                ", maxOptimizationSeconds=" + maxOptimizationSeconds +
                ", routeHorizonMinutes=" + routeHorizonMinutes +
                ", callbackPort=" + callbackPort +
                ", optimizeIntervalSeconds=" + optimizeIntervalSeconds +
                ", schedulerEnabled=" + schedulerEnabled +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Typed reads over a raw key lookup.
     */
    private static final class Env {
        private final UnaryOperator<String> source;

        Env(UnaryOperator<String> source) {
            this.source = source;
        }

        String get(String key, String defaultValue) {
            String value = source.apply(key);
            if (isBlank(value)) {
                log.debug("Using default for {}: {}", key, defaultValue);
                return defaultValue;
            }
            return value.trim();
        }

        int getInt(String key, int defaultValue) {
            String value = get(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                log.warn("Invalid integer for {}: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        double getDouble(String key, double defaultValue) {
            String value = get(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        boolean getBoolean(String key, boolean defaultValue) {
            String value = get(key, null);
            if (value == null) {
                return defaultValue;
            }
            return "true".equalsIgnoreCase(value) || "1".equals(value);
        }
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String fleetApiUrl = DEFAULT_FLEET_API_URL;
        private String fleetApiKey = "";
        private String orderApiUrl = DEFAULT_ORDER_API_URL;
        private String mapsApiUrl = GoogleMapsClientImpl.DEFAULT_BASE_URL;
        private String mapsApiKey = "";
        private String weatherApiUrl = OpenWeatherClientImpl.DEFAULT_BASE_URL;
        private String weatherApiKey = "";
        private int weatherForecastDays = DEFAULT_FORECAST_DAYS;
        private int weatherLookupThreads = DEFAULT_WEATHER_THREADS;
        private int maxOptimizationSeconds = DEFAULT_MAX_OPTIMIZATION_SECONDS;
        private double averageSpeedKmh = DEFAULT_AVERAGE_SPEED_KMH;
        private int routeHorizonMinutes = DEFAULT_HORIZON_MINUTES;
        private int maxWaitMinutes = DEFAULT_MAX_WAIT_MINUTES;
        private EconomicsConfig economics = EconomicsConfig.defaults();
        private int callbackPort = DEFAULT_CALLBACK_PORT;
        private int optimizeIntervalSeconds = DEFAULT_OPTIMIZE_INTERVAL;
        private boolean schedulerEnabled = true;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = true;

        public Builder fleetApiUrl(String fleetApiUrl) {
            this.fleetApiUrl = Objects.requireNonNull(fleetApiUrl, "fleetApiUrl must not be null");
            return this;
        }

        public Builder fleetApiKey(String fleetApiKey) {
            this.fleetApiKey = fleetApiKey == null ? "" : fleetApiKey;
            return this;
        }

        public Builder orderApiUrl(String orderApiUrl) {
            this.orderApiUrl = Objects.requireNonNull(orderApiUrl, "orderApiUrl must not be null");
            return this;
        }

        public Builder mapsApiUrl(String mapsApiUrl) {
            this.mapsApiUrl = Objects.requireNonNull(mapsApiUrl, "mapsApiUrl must not be null");
            return this;
        }

        public Builder mapsApiKey(String mapsApiKey) {
            this.mapsApiKey = mapsApiKey == null ? "" : mapsApiKey;
            return this;
        }

        public Builder weatherApiUrl(String weatherApiUrl) {
            this.weatherApiUrl = Objects.requireNonNull(weatherApiUrl, "weatherApiUrl must not be null");
            return this;
        }

        public Builder weatherApiKey(String weatherApiKey) {
            this.weatherApiKey = weatherApiKey == null ? "" : weatherApiKey;
            return this;
        }

        public Builder weatherForecastDays(int weatherForecastDays) {
            if (weatherForecastDays < 1 || weatherForecastDays > 5) {
                throw new IllegalArgumentException("weatherForecastDays must be between 1 and 5");
            }
            this.weatherForecastDays = weatherForecastDays;
            return this;
        }

        public Builder weatherLookupThreads(int weatherLookupThreads) {
            if (weatherLookupThreads < 1) {
                throw new IllegalArgumentException("weatherLookupThreads must be at least 1");
            }
            this.weatherLookupThreads = weatherLookupThreads;
            return this;
        }

        public Builder maxOptimizationSeconds(int maxOptimizationSeconds) {
            if (maxOptimizationSeconds < 1) {
                throw new IllegalArgumentException("maxOptimizationSeconds must be at least 1");
            }
            this.maxOptimizationSeconds = maxOptimizationSeconds;
            return this;
        }

        public Builder averageSpeedKmh(double averageSpeedKmh) {
            if (!(averageSpeedKmh > 0) || Double.isInfinite(averageSpeedKmh)) {
                throw new IllegalArgumentException("averageSpeedKmh must be a positive number");
            }
            this.averageSpeedKmh = averageSpeedKmh;
            return this;
        }

        public Builder routeHorizonMinutes(int routeHorizonMinutes) {
            if (routeHorizonMinutes < 1) {
                throw new IllegalArgumentException("routeHorizonMinutes must be at least 1");
            }
            this.routeHorizonMinutes = routeHorizonMinutes;
            return this;
        }

        public Builder maxWaitMinutes(int maxWaitMinutes) {
            if (maxWaitMinutes < 0) {
                throw new IllegalArgumentException("maxWaitMinutes must not be negative");
            }
            this.maxWaitMinutes = maxWaitMinutes;
            return this;
        }

        public Builder economics(EconomicsConfig economics) {
            this.economics = Objects.requireNonNull(economics, "economics must not be null");
            return this;
        }

        public Builder callbackPort(int callbackPort) {
            if (callbackPort <= 0 || callbackPort > 65535) {
                throw new IllegalArgumentException("callbackPort must be between 1 and 65535");
            }
            this.callbackPort = callbackPort;
            return this;
        }

        public Builder optimizeIntervalSeconds(int optimizeIntervalSeconds) {
            if (optimizeIntervalSeconds < 1) {
                throw new IllegalArgumentException("optimizeIntervalSeconds must be at least 1");
            }
            this.optimizeIntervalSeconds = optimizeIntervalSeconds;
            return this;
        }

        public Builder schedulerEnabled(boolean schedulerEnabled) {
            this.schedulerEnabled = schedulerEnabled;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
