package org.freightplan.engine;

import org.freightplan.engine.api.FleetApiClient;
import org.freightplan.engine.api.FleetApiClientImpl;
import org.freightplan.engine.api.GoogleMapsClientImpl;
import org.freightplan.engine.api.HaversineDistanceTable;
import org.freightplan.engine.api.MappingClient;
import org.freightplan.engine.api.OpenWeatherClientImpl;
import org.freightplan.engine.api.OrderApiClient;
import org.freightplan.engine.api.OrderApiClientImpl;
import org.freightplan.engine.api.WeatherClient;
import org.freightplan.engine.config.EngineConfig;
import org.freightplan.engine.domain.service.AssignmentMaterializer;
import org.freightplan.engine.domain.service.GeoTimeMatrixBuilder;
import org.freightplan.engine.domain.service.GeoTimeMatrixBuilderImpl;
import org.freightplan.engine.domain.service.OptimizationService;
import org.freightplan.engine.domain.service.OptimizationServiceImpl;
import org.freightplan.engine.domain.service.OptimizationSummaryFormatter;
import org.freightplan.engine.domain.service.OrToolsRoutingSolver;
import org.freightplan.engine.domain.service.RouteCandidateExtractor;
import org.freightplan.engine.domain.service.RouteEconomicsEvaluator;
import org.freightplan.engine.domain.service.RouteEconomicsEvaluatorImpl;
import org.freightplan.engine.http.CallbackServer;
import org.freightplan.engine.scheduler.OptimizationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the optimization engine.
 *
 * The engine assigns pending transportation orders to trucks and trailers on
 * time-windowed routes and keeps only the routes that make money.
 *
 * Trigger modes:
 * - On demand: POST /optimize (all pending) or POST /optimize/{orderId}
 * - Periodic: Scheduler optimizes pending orders every N seconds
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            log.error("Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        log.info("=== FreightPlan Optimization Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        log.info("Configuration: {}", config);
        log.info("Economics: {}", config.getEconomics());

        // Configure logging
        configureLogging(config);

        // Create API clients
        FleetApiClient fleetApi = new FleetApiClientImpl(config.getFleetApiUrl(), config.getFleetApiKey());
        OrderApiClient orderApi = new OrderApiClientImpl(config.getOrderApiUrl());
        MappingClient mappingClient = new GoogleMapsClientImpl(config.getMapsApiUrl(), config.getMapsApiKey());
        WeatherClient weatherClient = new OpenWeatherClientImpl(config.getWeatherApiUrl(), config.getWeatherApiKey());
        if (config.getMapsApiKey().isEmpty()) {
            log.warn("Mapping API key not configured, distances will be approximated");
        }

        ExecutorService weatherExecutor = Executors.newFixedThreadPool(config.getWeatherLookupThreads(),
                daemonThreads("weather-lookup"));

        // Create services
        GeoTimeMatrixBuilder matrixBuilder = new GeoTimeMatrixBuilderImpl(mappingClient, new HaversineDistanceTable(),
                weatherClient, weatherExecutor, config.getWeatherForecastDays(), config.getAverageSpeedKmh(),
                config.getRouteHorizonMinutes());
        RouteEconomicsEvaluator evaluator = new RouteEconomicsEvaluatorImpl(config.getEconomics());
        AssignmentMaterializer materializer = new AssignmentMaterializer(orderApi, evaluator, Clock.systemUTC());
        OptimizationService optimizationService = new OptimizationServiceImpl(fleetApi, orderApi, matrixBuilder,
                new OrToolsRoutingSolver(), new RouteCandidateExtractor(), evaluator, materializer,
                new OptimizationSummaryFormatter(), config.getRouteHorizonMinutes(), config.getMaxWaitMinutes(),
                config.getMaxOptimizationSeconds());

        // Start callback server
        CallbackServer callbackServer = new CallbackServer(config.getCallbackPort(), optimizationService);
        callbackServer.start();

        // Start scheduler if enabled
        OptimizationScheduler scheduler = null;
        if (config.isSchedulerEnabled()) {
            scheduler = new OptimizationScheduler(optimizationService, config.getOptimizeIntervalSeconds());
            scheduler.start();
        } else {
            log.info("Optimization scheduler disabled");
        }

        // Register shutdown hook
        final OptimizationScheduler finalScheduler = scheduler;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down engine...");
            callbackServer.stop();
            if (finalScheduler != null) {
                finalScheduler.stop();
            }
            weatherExecutor.shutdownNow();
            log.info("Engine shutdown complete");
        }));

        log.info("=== Optimization Engine started successfully ===");
        log.info("Endpoints:");
        log.info("  - Health: http://localhost:{}/health", config.getCallbackPort());
        log.info("  - Optimize pending: POST http://localhost:{}/optimize", config.getCallbackPort());
        log.info("  - Optimize order: POST http://localhost:{}/optimize/{orderId}", config.getCallbackPort());

        // Keep main thread alive
        Thread.currentThread().join();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Configure file logging if enabled. SLF4J routes to java.util.logging, so the
     * handler goes on the JUL root logger.
     */
    private void configureLogging(EngineConfig config) {
        java.util.logging.Logger root = java.util.logging.Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            log.info("File logging enabled: {}", target);
        } catch (IOException e) {
            log.warn("Failed to setup file logging", e);
        }
    }
}
