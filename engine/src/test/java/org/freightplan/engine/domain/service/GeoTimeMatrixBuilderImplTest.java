package org.freightplan.engine.domain.service;

import org.freightplan.engine.api.DistanceTable;
import org.freightplan.engine.api.MappingClient;
import org.freightplan.engine.api.MappingServiceException;
import org.freightplan.engine.api.RouteMatrix;
import org.freightplan.engine.api.WeatherClient;
import org.freightplan.engine.api.WeatherForecast;
import org.freightplan.engine.cache.BatchLookupCache;
import org.freightplan.engine.domain.model.LocationIndex;
import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.Priority;
import org.freightplan.engine.domain.model.TimeWindow;
import org.freightplan.engine.domain.model.TravelMatrix;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GeoTimeMatrixBuilderImplTest {

    private static final List<String> DEPOTS = Collections.singletonList("Winnipeg");

    private final MappingClient mapping = mock(MappingClient.class);
    private final DistanceTable table = mock(DistanceTable.class);
    private final WeatherClient weather = mock(WeatherClient.class);
    private final GeoTimeMatrixBuilderImpl builder =
            new GeoTimeMatrixBuilderImpl(mapping, table, weather, Runnable::run, 1, 60.0, 1440);

    private final LocationIndex locations = LocationIndex.ofLocations(Arrays.asList("Winnipeg", "Regina", "Calgary"));
    private final List<Order> orders = Arrays.asList(
            order("O1", "Winnipeg", "Regina", Priority.HIGH),
            order("O2", "Regina", "Calgary", Priority.LOW));

    @Test
    void snowAtDestinationStretchesInboundLegs() {
        when(mapping.routeMatrix(anyList())).thenReturn(new RouteMatrix(
                new double[][]{{0, 570, 1330}, {575, 0, 760}, {1330, 760, 0}},
                new double[][]{{0, 330, 780}, {330, 0, 450}, {780, 450, 0}}));
        when(weather.forecast(anyString(), anyInt())).thenReturn(Optional.of(new WeatherForecast("x", "Clear", false)));
        when(weather.forecast("Regina", 1)).thenReturn(Optional.of(new WeatherForecast("Regina", "Snow", false)));

        TravelMatrix matrix = builder.build(locations, orders, DEPOTS, new BatchLookupCache());

        assertFalse(matrix.isFallback());
        assertEquals(330 * 1.3, matrix.timeMinutes(0, 1), 1e-9);
        assertEquals(450 * 1.3, matrix.timeMinutes(2, 1), 1e-9);
        assertEquals(330.0, matrix.timeMinutes(1, 0), 1e-9);
        assertEquals(0.0, matrix.timeMinutes(1, 1), 1e-9);
    }

    @Test
    void distancesAreSymmetrizedWithTheLongerDirection() {
        when(mapping.routeMatrix(anyList())).thenReturn(new RouteMatrix(
                new double[][]{{0, 570, 1330}, {575, 0, 760}, {1330, 760, 0}},
                new double[][]{{0, 330, 780}, {330, 0, 450}, {780, 450, 0}}));
        when(weather.forecast(anyString(), anyInt())).thenReturn(Optional.empty());

        TravelMatrix matrix = builder.build(locations, orders, DEPOTS, new BatchLookupCache());

        assertEquals(575.0, matrix.distanceKm(0, 1), 1e-9);
        assertEquals(575.0, matrix.distanceKm(1, 0), 1e-9);
    }

    @Test
    void failingWeatherLookupCountsAsClear() {
        when(mapping.routeMatrix(anyList())).thenReturn(new RouteMatrix(
                new double[][]{{0, 570, 1330}, {570, 0, 760}, {1330, 760, 0}},
                new double[][]{{0, 330, 780}, {330, 0, 450}, {780, 450, 0}}));
        when(weather.forecast(anyString(), anyInt())).thenThrow(new IllegalStateException("down"));

        TravelMatrix matrix = builder.build(locations, orders, DEPOTS, new BatchLookupCache());

        assertEquals(330.0, matrix.timeMinutes(0, 1), 1e-9);
    }

    @Test
    void mappingFailureUsesApproximateDistancesWithoutWeather() {
        when(mapping.routeMatrix(anyList())).thenThrow(new MappingServiceException("no key"));
        when(table.approximateDistanceKm(anyString(), anyString())).thenReturn(120.0);

        BatchLookupCache cache = new BatchLookupCache();
        TravelMatrix matrix = builder.build(locations, orders, DEPOTS, cache);

        assertTrue(matrix.isFallback());
        assertEquals(120.0, matrix.distanceKm(0, 2), 1e-9);
        assertEquals(120.0, matrix.timeMinutes(0, 2), 1e-9);
        assertEquals(3, cache.distanceEntries());
        verifyNoInteractions(weather);
    }

    @Test
    void invalidMatrixEntryTriggersFallback() {
        when(mapping.routeMatrix(anyList())).thenReturn(new RouteMatrix(
                new double[][]{{0, -1, 1330}, {570, 0, 760}, {1330, 760, 0}},
                new double[][]{{0, 330, 780}, {330, 0, 450}, {780, 450, 0}}));
        when(table.approximateDistanceKm(anyString(), anyString())).thenReturn(60.0);

        TravelMatrix matrix = builder.build(locations, orders, DEPOTS, new BatchLookupCache());

        assertTrue(matrix.isFallback());
        assertEquals(60.0, matrix.timeMinutes(1, 0), 1e-9);
    }

    @Test
    void windowsTakeTheTightestPriorityAndDepotsStayOpen() {
        List<TimeWindow> windows = builder.timeWindows(locations, orders, DEPOTS);

        assertEquals(new TimeWindow(0, 1440), windows.get(0));
        assertEquals(new TimeWindow(0, 200), windows.get(1));
        assertEquals(new TimeWindow(0, 1000), windows.get(2));
    }

    @Test
    void windowsAreCappedAtTheHorizon() {
        GeoTimeMatrixBuilderImpl shortDay = new GeoTimeMatrixBuilderImpl(mapping, table, weather, Runnable::run, 1, 60.0, 300);

        List<TimeWindow> windows = shortDay.timeWindows(locations, orders, DEPOTS);

        assertEquals(new TimeWindow(0, 300), windows.get(2));
    }

    private static Order order(String id, String from, String to, Priority priority) {
        return new Order.Builder()
                .id(id)
                .shipFrom(from)
                .shipTo(to)
                .weightKg(500)
                .priority(priority)
                .build();
    }
}
