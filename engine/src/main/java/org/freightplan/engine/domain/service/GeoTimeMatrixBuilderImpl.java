package org.freightplan.engine.domain.service;

import org.freightplan.engine.api.DistanceTable;
import org.freightplan.engine.api.MappingClient;
import org.freightplan.engine.api.MappingServiceException;
import org.freightplan.engine.api.RouteMatrix;
import org.freightplan.engine.api.WeatherClient;
import org.freightplan.engine.cache.BatchLookupCache;
import org.freightplan.engine.domain.model.LocationIndex;
import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.TimeWindow;
import org.freightplan.engine.domain.model.TravelMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Implementation of GeoTimeMatrixBuilder.
 *
 * Primary path: one mapping-service call for the whole location set, a symmetrized distance
 * matrix, and travel times stretched by the weather at each leg's destination.
 * Fallback path: straight-line distances at a constant average speed, no weather.
 */
public final class GeoTimeMatrixBuilderImpl implements GeoTimeMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(GeoTimeMatrixBuilderImpl.class);

    private final MappingClient mappingClient;
    private final DistanceTable distanceTable;
    private final WeatherClient weatherClient;
    private final Executor weatherExecutor;
    private final int forecastDays;
    private final double averageSpeedKmh;
    private final int horizonMinutes;

    public GeoTimeMatrixBuilderImpl(MappingClient mappingClient, DistanceTable distanceTable,
                                    WeatherClient weatherClient, Executor weatherExecutor,
                                    int forecastDays, double averageSpeedKmh, int horizonMinutes) {
        this.mappingClient = Objects.requireNonNull(mappingClient, "mappingClient must not be null");
        this.distanceTable = Objects.requireNonNull(distanceTable, "distanceTable must not be null");
        this.weatherClient = Objects.requireNonNull(weatherClient, "weatherClient must not be null");
        this.weatherExecutor = Objects.requireNonNull(weatherExecutor, "weatherExecutor must not be null");
        if (forecastDays < 1) {
            throw new IllegalArgumentException("forecastDays must be at least 1");
        }
        if (!(averageSpeedKmh > 0)) {
            throw new IllegalArgumentException("averageSpeedKmh must be positive");
        }
        if (horizonMinutes < 1) {
            throw new IllegalArgumentException("horizonMinutes must be at least 1");
        }
        this.forecastDays = forecastDays;
        this.averageSpeedKmh = averageSpeedKmh;
        this.horizonMinutes = horizonMinutes;
    }

    @Override
    public TravelMatrix build(LocationIndex locations, List<Order> orders, Collection<String> depots,
                              BatchLookupCache cache) {
        Objects.requireNonNull(locations, "locations must not be null");
        Objects.requireNonNull(orders, "orders must not be null");
        Objects.requireNonNull(depots, "depots must not be null");
        Objects.requireNonNull(cache, "cache must not be null");

        List<TimeWindow> windows = timeWindows(locations, orders, depots);

        RouteMatrix routeMatrix;
        try {
            routeMatrix = mappingClient.routeMatrix(locations.getLocations());
            validate(routeMatrix, locations.size());
        } catch (MappingServiceException e) {
            log.warn("Mapping service unavailable, using approximate distances: {}", e.getMessage());
            return fallback(locations, windows, cache);
        } catch (RuntimeException e) {
            log.warn("Mapping lookup failed, using approximate distances", e);
            return fallback(locations, windows, cache);
        }

        double[] adjustments = weatherAdjustments(locations, cache);
        int n = locations.size();
        double[][] rawDistance = routeMatrix.getDistanceKm();
        double[][] rawTime = routeMatrix.getTimeMinutes();
        double[][] distance = new double[n][n];
        double[][] time = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                // One-way streets can make A->B differ from B->A; keep the longer
                distance[i][j] = Math.max(rawDistance[i][j], rawDistance[j][i]);
                time[i][j] = rawTime[i][j] * (1.0 + adjustments[j]);
            }
        }

        log.debug("Built travel matrix for {} locations from the mapping service", n);
        return new TravelMatrix(locations, distance, time, windows, false);
    }

    /**
     * Tightest priority window among the orders touching each location.
     * Depots and untouched locations are open for the whole horizon.
     */
    List<TimeWindow> timeWindows(LocationIndex locations, List<Order> orders, Collection<String> depots) {
        TimeWindow open = new TimeWindow(0, horizonMinutes);
        TimeWindow[] windows = new TimeWindow[locations.size()];
        for (Order order : orders) {
            long latest = Math.min(order.getPriority().getLatestServiceMinutes(), horizonMinutes);
            TimeWindow window = new TimeWindow(0, latest);
            for (String location : new String[]{order.getShipFrom(), order.getShipTo()}) {
                locations.nodeOf(location).ifPresent(node ->
                        windows[node] = windows[node] == null ? window : windows[node].tighten(window));
            }
        }
        for (String depot : depots) {
            locations.nodeOf(depot).ifPresent(node -> windows[node] = open);
        }

        List<TimeWindow> result = new ArrayList<>(windows.length);
        for (TimeWindow window : windows) {
            result.add(window == null ? open : window);
        }
        return result;
    }

    /**
     * Look up every location's forecast concurrently and wait for all of them.
     */
    private double[] weatherAdjustments(LocationIndex locations, BatchLookupCache cache) {
        List<CompletableFuture<Double>> lookups = new ArrayList<>(locations.size());
        for (String location : locations.getLocations()) {
            lookups.add(CompletableFuture.supplyAsync(
                    () -> cache.weatherAdjustment(location, this::lookupAdjustment), weatherExecutor)
                    .exceptionally(e -> {
                        log.warn("Weather lookup for {} failed: {}", location, e.getMessage());
                        return WeatherAdjustment.NONE;
                    }));
        }
        CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0])).join();

        double[] adjustments = new double[lookups.size()];
        for (int i = 0; i < adjustments.length; i++) {
            adjustments[i] = lookups.get(i).join();
        }
        return adjustments;
    }

    private double lookupAdjustment(String location) {
        try {
            double adjustment = WeatherAdjustment.forForecast(weatherClient.forecast(location, forecastDays));
            if (adjustment > 0) {
                log.info("Weather at {} adds {}% to travel time", location, Math.round(adjustment * 100));
            }
            return adjustment;
        } catch (RuntimeException e) {
            log.warn("Weather lookup for {} failed: {}", location, e.getMessage());
            return WeatherAdjustment.NONE;
        }
    }

    private TravelMatrix fallback(LocationIndex locations, List<TimeWindow> windows, BatchLookupCache cache) {
        int n = locations.size();
        double[][] distance = new double[n][n];
        double[][] time = new double[n][n];
        for (int i = 0; i < n; i++) {
            String from = locations.locationAt(i);
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                String to = locations.locationAt(j);
                double km = cache.fallbackDistanceKm(from, to, () -> distanceTable.approximateDistanceKm(from, to));
                distance[i][j] = km;
                time[i][j] = km / averageSpeedKmh * 60.0;
            }
        }
        return new TravelMatrix(locations, distance, time, windows, true);
    }

    private static void validate(RouteMatrix matrix, int n) {
        if (matrix == null || matrix.size() != n) {
            throw new MappingServiceException("Route matrix does not cover " + n + " locations");
        }
        double[][] distance = matrix.getDistanceKm();
        double[][] time = matrix.getTimeMinutes();
        for (int i = 0; i < n; i++) {
            if (distance[i] == null || time[i] == null || distance[i].length != n || time[i].length != n) {
                throw new MappingServiceException("Route matrix row " + i + " is malformed");
            }
            for (int j = 0; j < n; j++) {
                if (!isUsable(distance[i][j]) || !isUsable(time[i][j])) {
                    throw new MappingServiceException("Route matrix has an invalid entry at " + i + "," + j);
                }
            }
        }
    }

    private static boolean isUsable(double value) {
        return value >= 0 && !Double.isInfinite(value);
    }
}
