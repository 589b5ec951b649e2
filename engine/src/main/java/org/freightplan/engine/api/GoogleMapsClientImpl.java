package org.freightplan.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.freightplan.engine.api.dto.DistanceMatrixDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;
import retrofit2.http.Query;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Mapping client backed by the Google Distance Matrix API.
 *
 * Distances come back in metres and durations in seconds; they are converted to
 * kilometres and minutes. Any non-OK response, overall or per element, fails the
 * whole call so the caller can switch to its fallback estimate.
 */
public final class GoogleMapsClientImpl implements MappingClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleMapsClientImpl.class);

    public static final String DEFAULT_BASE_URL = "https://maps.googleapis.com/maps/api/";

    private final DistanceMatrixApi api;
    private final String apiKey;

    public GoogleMapsClientImpl(String baseUrl, String apiKey) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        String normalized = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        // Route matrices take longer than plain lookups
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalized)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(client)
                .build();
        this.api = retrofit.create(DistanceMatrixApi.class);
        this.apiKey = apiKey == null ? "" : apiKey;

        log.info("Mapping client initialized with API: {}", normalized);
    }

    GoogleMapsClientImpl(DistanceMatrixApi api, String apiKey) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    @Override
    public RouteMatrix routeMatrix(List<String> locations) {
        Objects.requireNonNull(locations, "locations must not be null");
        if (apiKey.isEmpty()) {
            throw new MappingServiceException("No mapping API key configured");
        }

        int n = locations.size();
        double[][] distanceKm = new double[n][n];
        double[][] timeMinutes = new double[n][n];
        if (n == 0) {
            return new RouteMatrix(distanceKm, timeMinutes);
        }

        String joined = String.join("|", locations);
        DistanceMatrixDto body;
        try {
            Response<DistanceMatrixDto> response = api.distanceMatrix(joined, joined, "driving", "metric", apiKey).execute();
            if (!response.isSuccessful()) {
                throw new MappingServiceException("Distance matrix request failed: " + response.code() + " " + response.message());
            }
            body = response.body();
        } catch (IOException e) {
            throw new MappingServiceException("Distance matrix request error", e);
        }

        if (body == null || !body.isOk()) {
            String status = body == null ? "empty body" : body.getStatus();
            String detail = body == null || body.getErrorMessage() == null ? "" : " (" + body.getErrorMessage() + ")";
            throw new MappingServiceException("Distance matrix status " + status + detail);
        }
        if (body.getRows() == null || body.getRows().size() != n) {
            throw new MappingServiceException("Distance matrix has unexpected row count for " + n + " locations");
        }

        for (int i = 0; i < n; i++) {
            List<DistanceMatrixDto.ElementDto> elements = body.getRows().get(i).getElements();
            if (elements == null || elements.size() != n) {
                throw new MappingServiceException("Distance matrix row " + i + " has unexpected element count");
            }
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                DistanceMatrixDto.ElementDto element = elements.get(j);
                if (!element.isOk()) {
                    throw new MappingServiceException(String.format("No route from '%s' to '%s': %s",
                            locations.get(i), locations.get(j), element.getStatus()));
                }
                distanceKm[i][j] = element.getDistance().getValue() / 1000.0;
                timeMinutes[i][j] = element.getDuration().getValue() / 60.0;
            }
        }

        log.info("Retrieved route matrix for {} locations", n);
        return new RouteMatrix(distanceKm, timeMinutes);
    }

    // =========================================================================
    // Retrofit API Interface
    // =========================================================================

    interface DistanceMatrixApi {
        @GET("distancematrix/json")
        Call<DistanceMatrixDto> distanceMatrix(@Query("origins") String origins,
                                               @Query("destinations") String destinations,
                                               @Query("mode") String mode,
                                               @Query("units") String units,
                                               @Query("key") String key);
    }
}
