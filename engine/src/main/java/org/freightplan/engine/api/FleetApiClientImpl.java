package org.freightplan.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.freightplan.engine.api.dto.FleetVehicleDto;
import org.freightplan.engine.api.dto.FleetVehiclesResponseDto;
import org.freightplan.engine.domain.model.Trailer;
import org.freightplan.engine.domain.model.Truck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;
import retrofit2.http.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Retrofit-based implementation of FleetApiClient.
 */
public final class FleetApiClientImpl implements FleetApiClient {

    private static final Logger log = LoggerFactory.getLogger(FleetApiClientImpl.class);

    /** Duty-hour ceiling applied when the registry does not report one. */
    static final double DEFAULT_MAX_HOURS = 10.0;

    private final FleetApiService api;

    public FleetApiClientImpl(String baseUrl, String apiKey) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(new AuthInterceptor(apiKey == null ? "" : apiKey))
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(client)
                .build();

        this.api = retrofit.create(FleetApiService.class);
    }

    FleetApiClientImpl(FleetApiService api) {
        this.api = Objects.requireNonNull(api, "api must not be null");
    }

    @Override
    public List<Truck> getAvailableTrucks() {
        List<FleetVehicleDto> vehicles = fetchVehicles("truck");
        List<Truck> trucks = new ArrayList<>(vehicles.size());
        for (FleetVehicleDto vehicle : vehicles) {
            if (vehicle.getId() == null) {
                log.warn("Skipping truck without id: {}", vehicle.getName());
                continue;
            }
            double maxHours = vehicle.getMaxHours() != null ? vehicle.getMaxHours() : DEFAULT_MAX_HOURS;
            trucks.add(new Truck(vehicle.getId(), vehicle.getName(), vehicle.warehouseOrUnknown(),
                    vehicle.getEngineHours(), maxHours));
        }
        log.debug("Fleet registry returned {} available trucks", trucks.size());
        return trucks;
    }

    @Override
    public List<Trailer> getAvailableTrailers() {
        List<FleetVehicleDto> vehicles = fetchVehicles("trailer");
        List<Trailer> trailers = new ArrayList<>(vehicles.size());
        for (FleetVehicleDto vehicle : vehicles) {
            if (vehicle.getId() == null) {
                log.warn("Skipping trailer without id: {}", vehicle.getName());
                continue;
            }
            trailers.add(new Trailer.Builder()
                    .id(vehicle.getId())
                    .name(vehicle.getName())
                    .warehouse(vehicle.warehouseOrUnknown())
                    .maxWeightKg(vehicle.getMaxWeightKg())
                    .currentWeightKg(vehicle.getCurrentWeightKg())
                    .palletJack(vehicle.isHasPalletJack())
                    .temperatureControlled(vehicle.isTemperatureControlled())
                    .build());
        }
        log.debug("Fleet registry returned {} available trailers", trailers.size());
        return trailers;
    }

    private List<FleetVehicleDto> fetchVehicles(String type) {
        FleetVehiclesResponseDto response = execute(api.getVehicles("available", type),
                "GET fleet/vehicles?types=" + type);
        if (response == null || response.getData() == null) {
            return Collections.emptyList();
        }
        return response.getData();
    }

    /**
     * Execute a Retrofit call and return the result.
     */
    private <T> T execute(Call<T> call, String description) {
        try {
            Response<T> response = call.execute();
            if (response.isSuccessful()) {
                return response.body();
            }
            log.warn("[API] {} failed: {} {}", description, response.code(), response.message());
            return null;
        } catch (Exception e) {
            log.warn("[API] {} error", description, e);
            return null;
        }
    }

    /**
     * Retrofit service interface for the fleet API.
     */
    interface FleetApiService {
        @GET("fleet/vehicles")
        Call<FleetVehiclesResponseDto> getVehicles(@Query("vehicleStatus") String vehicleStatus,
                                                   @Query("types") String types);
    }
}
