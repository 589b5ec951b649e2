package org.freightplan.engine.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.freightplan.engine.domain.model.OptimizationResult;
import org.freightplan.engine.domain.service.OptimizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP server for optimization triggers.
 * Exposes health, batch and single-order endpoints.
 */
public final class CallbackServer {

    private static final Logger log = LoggerFactory.getLogger(CallbackServer.class);

    private static final String OPTIMIZE_PATH = "/optimize";

    private final HttpServer server;
    private final ExecutorService executor;
    private final OptimizationService optimizationService;

    /**
     * @param port port to listen on, 0 for any free port
     */
    public CallbackServer(int port, OptimizationService optimizationService) throws IOException {
        this.optimizationService = Objects.requireNonNull(optimizationService, "optimizationService must not be null");

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        log.info("Callback server initialized on port {}", getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", this::handleHealth);
        server.createContext(OPTIMIZE_PATH, this::handleOptimize);
    }

    public void start() {
        server.start();
        log.info("Callback server started");
    }

    public void stop() {
        server.stop(1);
        executor.shutdown();
        log.info("Callback server stopped");
    }

    /**
     * Port actually bound.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Health check endpoint.
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }
        sendResponse(exchange, 200, "{\"status\":\"healthy\"}");
    }

    /**
     * Batch or single-order optimization.
     * POST /optimize
     * POST /optimize/{orderId}
     */
    private void handleOptimize(HttpExchange exchange) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "{\"error\":\"method not allowed\"}");
            return;
        }

        String path = exchange.getRequestURI().getPath();
        boolean batch = OPTIMIZE_PATH.equals(path) || (OPTIMIZE_PATH + "/").equals(path);
        String orderId = batch ? null : extractOrderId(path);
        if (!batch && orderId == null) {
            sendResponse(exchange, 400, "{\"error\":\"missing order ID\"}");
            return;
        }

        try {
            OptimizationResult result;
            if (batch) {
                log.info("Received batch optimization request");
                result = optimizationService.optimizePending();
            } else {
                log.info("Received optimization request for order: {}", orderId);
                result = optimizationService.optimizeOrder(orderId);
            }
            sendResponse(exchange, 200, String.format(
                    "{\"status\":\"optimized\",\"assigned\":%d,\"unassigned\":%d,\"routes\":%d}",
                    result.getAssignments().size(), result.getUnassignedOrders().size(),
                    result.getRouteSummary().size()));
        } catch (Exception e) {
            log.error("Optimization request failed for {}", batch ? "pending orders" : orderId, e);
            sendResponse(exchange, 500, "{\"error\":\"optimization failed\"}");
        }
    }

    /**
     * Extract order ID from path like /optimize/{id}
     */
    static String extractOrderId(String path) {
        if (path == null || !path.startsWith(OPTIMIZE_PATH + "/")) {
            return null;
        }
        String id = path.substring(OPTIMIZE_PATH.length() + 1);
        if (id.endsWith("/")) {
            id = id.substring(0, id.length() - 1);
        }
        return id.isEmpty() || id.contains("/") ? null : id;
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
