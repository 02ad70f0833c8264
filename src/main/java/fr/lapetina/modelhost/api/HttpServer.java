package fr.lapetina.modelhost.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.modelhost.api.dto.HealthResponse;
import fr.lapetina.modelhost.api.dto.LifecycleRequest;
import fr.lapetina.modelhost.api.dto.LifecycleResponse;
import fr.lapetina.modelhost.api.dto.ResourceInfo;
import fr.lapetina.modelhost.api.dto.SystemResources;
import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.OverallHealth;
import fr.lapetina.modelhost.domain.health.Severity;
import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.ErrorType;
import fr.lapetina.modelhost.domain.model.LifecycleResult;
import fr.lapetina.modelhost.health.HealthAggregator;
import fr.lapetina.modelhost.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modelhost.lifecycle.LifecycleManager;
import fr.lapetina.modelhost.telemetry.MetricSource;
import fr.lapetina.modelhost.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET  /models - List catalog resources and their state
 * - POST /models/download - {model_id, force}
 * - POST /models/load - {model_id, device}
 * - POST /models/unload - {model_id} or ?model_id=
 * - GET  /health - Aggregated health
 * - GET  /health/history?limit= - Recent aggregated results
 * - GET  /health/{category} - One sub-check (system, resources, telemetry, service)
 * - GET  /telemetry?limit= - Recorded samples
 * - GET  /telemetry/average?minutes= - Averages over a window
 * - GET  /telemetry/trend?window= - CPU and memory trend
 * - GET  /system/resources - Fresh sample
 * - GET  /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final LifecycleManager lifecycleManager;
    private final TelemetryStore telemetryStore;
    private final MetricSource currentMetrics;
    private final HealthAggregator healthAggregator;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int workerThreads,
            LifecycleManager lifecycleManager,
            TelemetryStore telemetryStore,
            MetricSource currentMetrics,
            HealthAggregator healthAggregator,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.lifecycleManager = lifecycleManager;
        this.telemetryStore = telemetryStore;
        this.currentMetrics = currentMetrics;
        this.healthAggregator = healthAggregator;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

        InetSocketAddress address = host == null || host.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(host, port);
        this.server = com.sun.net.httpserver.HttpServer.create(address, backlog);

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "http-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/models", new ModelsHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/telemetry", new TelemetryHandler());
        server.createContext("/system/resources", new SystemResourcesHandler());
        if (metricsRegistry != null) {
            server.createContext("/metrics", new MetricsHandler());
        }

        log.info("HTTP server configured on {}:{}", address.getHostString(), server.getAddress().getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== BASE HANDLER ====================

    /**
     * Sets the request id in the MDC and turns failures into JSON error bodies.
     */
    private abstract class ApiHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = Optional.ofNullable(exchange.getRequestHeaders().getFirst("X-Request-ID"))
                    .orElseGet(() -> UUID.randomUUID().toString());
            MDC.put("requestId", requestId);
            try {
                log.debug("Request: method={}, path={}", exchange.getRequestMethod(), exchange.getRequestURI().getPath());
                route(exchange, exchange.getRequestMethod(), exchange.getRequestURI().getPath());
            } catch (ApiException e) {
                log.debug("Rejected request: status={}, error={}", e.status, e.getMessage());
                sendError(exchange, e.status, e.getMessage());
            } catch (Exception e) {
                log.error("Error handling request: path={}", exchange.getRequestURI().getPath(), e);
                sendError(exchange, 500, "Internal server error");
            } finally {
                MDC.clear();
                exchange.close();
            }
        }

        abstract void route(HttpExchange exchange, String method, String path) throws IOException;
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler extends ApiHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            if (path.equals("/models") || path.equals("/models/")) {
                requireMethod(method, "GET");
                handleList(exchange);
            } else if (path.equals("/models/download")) {
                requireMethod(method, "POST");
                LifecycleRequest request = readLifecycleRequest(exchange);
                sendResult(exchange, lifecycleManager.download(request.getModelId(), request.isForce()));
            } else if (path.equals("/models/load")) {
                requireMethod(method, "POST");
                LifecycleRequest request = readLifecycleRequest(exchange);
                Device device = parseDevice(request.getDevice());
                sendResult(exchange, lifecycleManager.load(request.getModelId(), device));
            } else if (path.equals("/models/unload")) {
                requireMethod(method, "POST");
                LifecycleRequest request = readLifecycleRequest(exchange);
                sendResult(exchange, lifecycleManager.unload(request.getModelId()));
            } else {
                throw new ApiException(404, "Not Found");
            }
        }

        private void handleList(HttpExchange exchange) throws IOException {
            List<ResourceInfo> resources = lifecycleManager.list().stream()
                    .map(ResourceInfo::from)
                    .toList();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("models", resources);
            body.put("total", resources.size());
            body.put("loaded", lifecycleManager.loadedCount());
            body.put("backend", lifecycleManager.getBackendName());
            sendJson(exchange, 200, body);
        }

        private LifecycleRequest readLifecycleRequest(HttpExchange exchange) throws IOException {
            LifecycleRequest request;
            try (InputStream is = exchange.getRequestBody()) {
                byte[] bytes = is.readAllBytes();
                request = bytes.length == 0
                        ? new LifecycleRequest()
                        : objectMapper.readValue(bytes, LifecycleRequest.class);
            } catch (JsonProcessingException e) {
                throw new ApiException(400, "Malformed JSON body: " + e.getOriginalMessage());
            }

            if (request.getModelId() == null || request.getModelId().isBlank()) {
                request.setModelId(queryParams(exchange.getRequestURI()).get("model_id"));
            }
            if (request.getModelId() == null || request.getModelId().isBlank()) {
                throw new ApiException(400, "Missing 'model_id' field");
            }
            MDC.put("resourceId", request.getModelId());
            return request;
        }

        private Device parseDevice(String value) {
            try {
                return Device.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ApiException(400, e.getMessage());
            }
        }

        private void sendResult(HttpExchange exchange, LifecycleResult result) throws IOException {
            int statusCode = result.success() ? 200 : mapErrorToStatus(result.errorType());
            sendJson(exchange, statusCode, LifecycleResponse.from(result));
        }
    }

    static int mapErrorToStatus(ErrorType errorType) {
        if (errorType == null) return 500;
        return switch (errorType) {
            case NOT_FOUND -> 404;
            case CONFLICT -> 409;
            case BACKEND_FAILURE -> 502;
            case RESOURCE_EXHAUSTED, UNAVAILABLE -> 503;
            case TIMEOUT -> 504;
        };
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler extends ApiHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            requireMethod(method, "GET");
            if (path.equals("/health") || path.equals("/health/")) {
                OverallHealth health = healthAggregator.checkHealth();
                int statusCode = health.status().isWorseThan(Severity.WARNING) ? 503 : 200;
                sendJson(exchange, statusCode, HealthResponse.from(health));
            } else if (path.equals("/health/history")) {
                int limit = intParam(exchange, "limit", 10);
                List<HealthResponse> history = healthAggregator.history(limit).stream()
                        .map(HealthResponse::from)
                        .toList();
                sendJson(exchange, 200, Map.of("history", history, "count", history.size()));
            } else {
                String name = path.substring("/health/".length());
                HealthCategory category = HealthCategory.fromName(name)
                        .orElseThrow(() -> new ApiException(404, "Unknown health category: " + name));
                sendJson(exchange, 200, HealthResponse.Report.from(healthAggregator.runCheck(category)));
            }
        }
    }

    // ==================== TELEMETRY HANDLER ====================

    private class TelemetryHandler extends ApiHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            requireMethod(method, "GET");
            if (path.equals("/telemetry") || path.equals("/telemetry/")) {
                int limit = intParam(exchange, "limit", 100);
                var samples = telemetryStore.history(limit);
                sendJson(exchange, 200, Map.of("samples", samples, "count", samples.size()));
            } else if (path.equals("/telemetry/average")) {
                int minutes = intParam(exchange, "minutes", 5);
                if (minutes <= 0) {
                    throw new ApiException(400, "'minutes' must be positive");
                }
                var average = telemetryStore.averageOver(Duration.ofMinutes(minutes))
                        .orElseThrow(() -> new ApiException(404,
                                "No telemetry recorded in the last " + minutes + " minutes"));
                sendJson(exchange, 200, average);
            } else if (path.equals("/telemetry/trend")) {
                int window = intParam(exchange, "window", 10);
                if (window < 2) {
                    throw new ApiException(400, "'window' must be at least 2");
                }
                var trend = telemetryStore.trend(window)
                        .orElseThrow(() -> new ApiException(404, "Not enough samples for a trend"));
                sendJson(exchange, 200, trend);
            } else {
                throw new ApiException(404, "Not Found");
            }
        }
    }

    // ==================== SYSTEM RESOURCES HANDLER ====================

    private class SystemResourcesHandler extends ApiHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            requireMethod(method, "GET");
            sendJson(exchange, 200, SystemResources.from(currentMetrics.collect()));
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler extends ApiHandler {
        @Override
        void route(HttpExchange exchange, String method, String path) throws IOException {
            requireMethod(method, "GET");
            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private static void requireMethod(String actual, String expected) {
        if (!expected.equalsIgnoreCase(actual)) {
            throw new ApiException(405, "Method Not Allowed");
        }
    }

    private static int intParam(HttpExchange exchange, String name, int defaultValue) {
        String value = queryParams(exchange.getRequestURI()).get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ApiException(400, "Invalid '" + name + "': " + value);
        }
    }

    static Map<String, String> queryParams(URI uri) {
        Map<String, String> params = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }

    /**
     * Request-level failure carrying the HTTP status to answer with.
     */
    private static final class ApiException extends RuntimeException {
        private final int status;

        ApiException(int status, String message) {
            super(message);
            this.status = status;
        }
    }
}
