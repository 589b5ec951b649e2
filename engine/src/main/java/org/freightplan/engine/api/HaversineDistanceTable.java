package org.freightplan.engine.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Great-circle distance over a fixed table of city coordinates.
 * Place names are matched case-insensitively, either exactly or by the part before the first comma
 * ("Calgary, AB" resolves to Calgary).
 */
public final class HaversineDistanceTable implements DistanceTable {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private static final Map<String, double[]> DEFAULT_COORDINATES;

    static {
        Map<String, double[]> coordinates = new LinkedHashMap<>();
        coordinates.put("winnipeg", new double[]{49.8951, -97.1384});
        coordinates.put("calgary", new double[]{51.0447, -114.0719});
        coordinates.put("edmonton", new double[]{53.5461, -113.4938});
        coordinates.put("vancouver", new double[]{49.2827, -123.1207});
        coordinates.put("toronto", new double[]{43.6532, -79.3832});
        coordinates.put("montreal", new double[]{45.5017, -73.5673});
        coordinates.put("regina", new double[]{50.4452, -104.6189});
        DEFAULT_COORDINATES = Collections.unmodifiableMap(coordinates);
    }

    private final Map<String, double[]> coordinates;

    public HaversineDistanceTable() {
        this(DEFAULT_COORDINATES);
    }

    /**
     * @param coordinates place name to {latitude, longitude}
     */
    public HaversineDistanceTable(Map<String, double[]> coordinates) {
        Objects.requireNonNull(coordinates, "coordinates must not be null");
        Map<String, double[]> normalized = new LinkedHashMap<>();
        coordinates.forEach((name, latLon) -> {
            if (latLon == null || latLon.length != 2) {
                throw new IllegalArgumentException("Coordinates for " + name + " must be {lat, lon}");
            }
            normalized.put(normalize(name), latLon.clone());
        });
        this.coordinates = Collections.unmodifiableMap(normalized);
    }

    @Override
    public double approximateDistanceKm(String from, String to) {
        double[] a = lookup(from);
        double[] b = lookup(to);
        if (a == null || b == null) {
            return Double.POSITIVE_INFINITY;
        }
        return haversineKm(a[0], a[1], b[0], b[1]);
    }

    static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    private double[] lookup(String place) {
        if (place == null) {
            return null;
        }
        String key = normalize(place);
        double[] exact = coordinates.get(key);
        if (exact != null) {
            return exact;
        }
        int comma = key.indexOf(',');
        return comma > 0 ? coordinates.get(key.substring(0, comma).trim()) : null;
    }

    private static String normalize(String place) {
        return place.trim().toLowerCase(Locale.ROOT);
    }
}
