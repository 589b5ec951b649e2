package org.freightplan.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.freightplan.engine.api.dto.ForecastResponseDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;
import retrofit2.http.Query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Weather client backed by the OpenWeatherMap forecast endpoint.
 *
 * The forecast condition is the main condition of the first 3-hour slot.
 * Without an API key every location gets a placeholder forecast.
 */
public final class OpenWeatherClientImpl implements WeatherClient {

    private static final Logger log = LoggerFactory.getLogger(OpenWeatherClientImpl.class);

    public static final String DEFAULT_BASE_URL = "https://api.openweathermap.org/data/2.5/";

    /** The endpoint returns 8 slots per day, at most 5 days. */
    static final int SLOTS_PER_DAY = 8;
    static final int MAX_SLOTS = 40;

    private final OpenWeatherApi api;
    private final String apiKey;

    public OpenWeatherClientImpl(String baseUrl, String apiKey) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        String normalized = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalized)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(client)
                .build();
        this.api = retrofit.create(OpenWeatherApi.class);
        this.apiKey = apiKey == null ? "" : apiKey.trim();

        if (this.apiKey.isEmpty()) {
            log.warn("Weather API key not configured, forecasts will be placeholders");
        }
    }

    OpenWeatherClientImpl(OpenWeatherApi api, String apiKey) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    @Override
    public Optional<WeatherForecast> forecast(String location, int days) {
        Objects.requireNonNull(location, "location must not be null");
        if (apiKey.isEmpty()) {
            return Optional.of(WeatherForecast.placeholder(location));
        }

        int count = Math.min(Math.max(days, 1) * SLOTS_PER_DAY, MAX_SLOTS);
        try {
            Response<ForecastResponseDto> response = api.forecast(location, apiKey, "metric", count).execute();
            if (!response.isSuccessful()) {
                log.warn("[Weather] Forecast for {} failed: {} {}", location, response.code(), response.message());
                return Optional.empty();
            }
            return firstCondition(response.body())
                    .map(condition -> new WeatherForecast(location, condition, false));
        } catch (Exception e) {
            log.warn("[Weather] Forecast for {} error: {}", location, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> firstCondition(ForecastResponseDto body) {
        if (body == null || body.getList() == null || body.getList().isEmpty()) {
            return Optional.empty();
        }
        List<ForecastResponseDto.ConditionDto> weather = body.getList().get(0).getWeather();
        if (weather == null || weather.isEmpty() || weather.get(0).getMain() == null) {
            return Optional.empty();
        }
        return Optional.of(weather.get(0).getMain());
    }

    interface OpenWeatherApi {
        @GET("forecast")
        Call<ForecastResponseDto> forecast(@Query("q") String location,
                                           @Query("appid") String apiKey,
                                           @Query("units") String units,
                                           @Query("cnt") int count);
    }
}
