package org.freightplan.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.freightplan.engine.api.dto.AssignmentRequest;
import org.freightplan.engine.api.dto.OrderDto;
import org.freightplan.engine.api.dto.StatusUpdateRequest;
import org.freightplan.engine.domain.model.Order;
import org.freightplan.engine.domain.model.OrderAssignment;
import org.freightplan.engine.domain.model.OrderStatus;
import org.freightplan.engine.domain.model.Priority;
import org.freightplan.engine.domain.model.SpecialRequirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.PATCH;
import retrofit2.http.POST;
import retrofit2.http.Path;
import retrofit2.http.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Retrofit-based implementation of OrderApiClient.
 */
public final class OrderApiClientImpl implements OrderApiClient {

    private static final Logger log = LoggerFactory.getLogger(OrderApiClientImpl.class);

    private final OrderApiService api;

    public OrderApiClientImpl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(client)
                .build();

        this.api = retrofit.create(OrderApiService.class);
    }

    OrderApiClientImpl(OrderApiService api) {
        this.api = Objects.requireNonNull(api, "api must not be null");
    }

    @Override
    public List<Order> getPendingOrders() {
        List<OrderDto> dtos = execute(api.getOrders(OrderStatus.PENDING.toValue()), "GET v1/orders?status=pending");
        if (dtos == null) {
            return Collections.emptyList();
        }
        List<Order> orders = new ArrayList<>(dtos.size());
        for (OrderDto dto : dtos) {
            toOrder(dto).ifPresent(orders::add);
        }
        return orders;
    }

    @Override
    public Optional<Order> getOrder(String orderId) {
        Objects.requireNonNull(orderId, "orderId must not be null");
        OrderDto dto = execute(api.getOrder(orderId), "GET v1/orders/" + orderId);
        return dto == null ? Optional.empty() : toOrder(dto);
    }

    @Override
    public boolean saveAssignment(OrderAssignment assignment) {
        AssignmentRequest request = new AssignmentRequest(
                assignment.getOrderId(),
                assignment.getTruckId(),
                assignment.getTrailerId(),
                assignment.getSequence(),
                assignment.getAssignedBy(),
                assignment.getAssignedAt().toString());
        return executeVoid(api.saveAssignment(assignment.getOrderId(), request),
                "POST v1/orders/" + assignment.getOrderId() + "/assignments");
    }

    @Override
    public boolean updateOrderStatus(String orderId, OrderStatus status) {
        return executeVoid(api.updateStatus(orderId, new StatusUpdateRequest(status.toValue())),
                "PATCH v1/orders/" + orderId + "/status");
    }

    /**
     * Map an API order to the domain model. Orders missing an id or a route endpoint are skipped.
     */
    static Optional<Order> toOrder(OrderDto dto) {
        if (dto.getId() == null || dto.getShipFrom() == null || dto.getShipTo() == null) {
            log.warn("Skipping incomplete order from API: id={}", dto.getId());
            return Optional.empty();
        }
        Order.Builder builder = new Order.Builder()
                .id(dto.getId())
                .customerName(dto.getCustomerName())
                .shipFrom(dto.getShipFrom())
                .shipTo(dto.getShipTo())
                .weightKg(Math.max(0.0, dto.getWeightKg()))
                .priority(Priority.fromValue(dto.getPriority()))
                .status(OrderStatus.fromValue(dto.getStatus()));
        if (dto.getSpecialRequirements() != null) {
            for (Map.Entry<String, Boolean> flag : dto.getSpecialRequirements().entrySet()) {
                if (Boolean.TRUE.equals(flag.getValue())) {
                    Optional<SpecialRequirement> requirement = SpecialRequirement.fromKey(flag.getKey());
                    if (requirement.isPresent()) {
                        builder.requirement(requirement.get());
                    } else {
                        log.debug("Ignoring unknown requirement '{}' on order {}", flag.getKey(), dto.getId());
                    }
                }
            }
        }
        return Optional.of(builder.build());
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
     * Execute a Retrofit call that returns no body.
     */
    private boolean executeVoid(Call<Void> call, String description) {
        try {
            Response<Void> response = call.execute();
            if (response.isSuccessful()) {
                return true;
            }
            log.warn("[API] {} failed: {} {}", description, response.code(), response.message());
            return false;
        } catch (Exception e) {
            log.warn("[API] {} error", description, e);
            return false;
        }
    }

    /**
     * Retrofit service interface for the order API.
     */
    interface OrderApiService {
        @GET("v1/orders")
        Call<List<OrderDto>> getOrders(@Query("status") String status);

        @GET("v1/orders/{id}")
        Call<OrderDto> getOrder(@Path("id") String orderId);

        @POST("v1/orders/{id}/assignments")
        Call<Void> saveAssignment(@Path("id") String orderId, @Body AssignmentRequest request);

        @PATCH("v1/orders/{id}/status")
        Call<Void> updateStatus(@Path("id") String orderId, @Body StatusUpdateRequest request);
    }
}
