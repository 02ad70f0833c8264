package fr.lapetina.modelhost.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.ErrorType;
import fr.lapetina.modelhost.integration.TestServiceFactory;
import fr.lapetina.modelhost.lifecycle.backend.BackendException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    @TempDir
    Path workDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

    private TestServiceFactory factory;
    private HttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        factory = TestServiceFactory.create(workDir);
        server = new HttpServer("127.0.0.1", 0, 10, 2,
                factory.getLifecycleManager(),
                factory.getTelemetryStore(),
                factory.getMetricSource(),
                factory.getHealthAggregator(),
                factory.getMetricsRegistry());
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        if (factory != null) {
            factory.close();
        }
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).timeout(Duration.ofSeconds(10)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return mapper.readTree(response.body());
    }

    @Nested
    @DisplayName("models")
    class Models {

        @Test
        @DisplayName("should list catalog resources with their state")
        void shouldListResources() throws Exception {
            HttpResponse<String> response = get("/models");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = json(response);
            assertThat(body.path("total").asInt()).isEqualTo(2);
            assertThat(body.path("loaded").asInt()).isZero();
            assertThat(body.path("backend").asText()).isEqualTo("stub");
            JsonNode alpha = body.path("models").get(0);
            assertThat(alpha.path("id").asText()).isEqualTo("alpha");
            assertThat(alpha.path("status").asText()).isEqualTo("not_downloaded");
            assertThat(alpha.path("loaded").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("should download, load and unload through the API")
        void shouldDriveLifecycle() throws Exception {
            HttpResponse<String> download = post("/models/download", "{\"model_id\":\"alpha\"}");
            assertThat(download.statusCode()).isEqualTo(200);
            assertThat(json(download).path("phase").asText()).isEqualTo("downloaded");

            HttpResponse<String> load = post("/models/load", "{\"model_id\":\"alpha\",\"device\":\"cpu\"}");
            assertThat(load.statusCode()).isEqualTo(200);
            JsonNode loadBody = json(load);
            assertThat(loadBody.path("success").asBoolean()).isTrue();
            assertThat(loadBody.path("operation").asText()).isEqualTo("load");
            assertThat(loadBody.path("phase").asText()).isEqualTo("loaded");

            JsonNode listed = json(get("/models")).path("models").get(0);
            assertThat(listed.path("status").asText()).isEqualTo("loaded");
            assertThat(listed.path("device").asText()).isEqualTo("cpu");
            assertThat(listed.path("memory_mb").asDouble()).isEqualTo(64.0);

            HttpResponse<String> unload = post("/models/unload?model_id=alpha", "");
            assertThat(unload.statusCode()).isEqualTo(200);
            assertThat(json(unload).path("phase").asText()).isEqualTo("downloaded");
        }

        @Test
        @DisplayName("should map lifecycle errors to HTTP statuses")
        void shouldMapErrors() throws Exception {
            HttpResponse<String> unknown = post("/models/load", "{\"model_id\":\"nope\"}");
            assertThat(unknown.statusCode()).isEqualTo(404);
            assertThat(json(unknown).path("error_type").asText()).isEqualTo("NOT_FOUND");

            HttpResponse<String> notDownloaded = post("/models/load", "{\"model_id\":\"alpha\"}");
            assertThat(notDownloaded.statusCode()).isEqualTo(409);
            assertThat(json(notDownloaded).path("success").asBoolean()).isFalse();

            factory.getStubBackend().setFetchFailure(new BackendException("beta", "registry down"));
            HttpResponse<String> failed = post("/models/download", "{\"model_id\":\"beta\"}");
            assertThat(failed.statusCode()).isEqualTo(502);
            assertThat(json(failed).path("error").asText()).contains("registry down");
        }

        @Test
        @DisplayName("should reject requests without an id, with bad JSON or with an unknown device")
        void shouldRejectBadRequests() throws Exception {
            assertThat(post("/models/load", "{}").statusCode()).isEqualTo(400);
            assertThat(post("/models/load", "{not json").statusCode()).isEqualTo(400);
            assertThat(post("/models/load", "{\"model_id\":\"alpha\",\"device\":\"tpu\"}").statusCode())
                    .isEqualTo(400);
            assertThat(get("/models/load").statusCode()).isEqualTo(405);
            assertThat(get("/models/unknown").statusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        @DisplayName("should return every sub-report and answer 503 when critical")
        void shouldReturnAggregatedHealth() throws Exception {
            HttpResponse<String> response = get("/health");

            // Nothing is loaded, so the resource report is critical
            assertThat(response.statusCode()).isEqualTo(503);
            JsonNode body = json(response);
            assertThat(body.path("status").asText()).isEqualTo("critical");
            assertThat(body.has("system_health")).isTrue();
            assertThat(body.has("resource_health")).isTrue();
            assertThat(body.has("telemetry_health")).isTrue();
            assertThat(body.has("service_health")).isTrue();
            assertThat(body.path("resource_health").path("issues").toString()).contains("No resources loaded");
            assertThat(body.path("recommendations").toString())
                    .contains("Download and load more models to improve service capabilities");
            assertThat(body.path("uptime_seconds").asDouble()).isPositive();
        }

        @Test
        @DisplayName("should answer 200 once enough resources are loaded")
        void shouldAnswerOkWhenLoaded() throws Exception {
            factory.getLifecycleManager().download("alpha", false);
            factory.getLifecycleManager().download("beta", false);
            factory.getLifecycleManager().load("alpha", Device.CPU);

            JsonNode resources = json(get("/health/resources"));

            assertThat(resources.path("status").asText()).isEqualTo("healthy");
            assertThat(resources.path("details").path("summary").path("loaded_resources").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep a bounded history")
        void shouldKeepHistory() throws Exception {
            for (int i = 0; i < 7; i++) {
                get("/health");
            }

            JsonNode history = json(get("/health/history?limit=3"));
            JsonNode all = json(get("/health/history?limit=0"));

            assertThat(history.path("count").asInt()).isEqualTo(3);
            assertThat(all.path("count").asInt()).isEqualTo(5);
        }

        @Test
        @DisplayName("should reject unknown categories")
        void shouldRejectUnknownCategory() throws Exception {
            assertThat(get("/health/bogus").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should reflect the CPU reading in the system report")
        void shouldReflectCpu() throws Exception {
            factory.getSettableSource().set(96, 20, 30);

            JsonNode system = json(get("/health/system"));

            assertThat(system.path("status").asText()).isEqualTo("critical");
            assertThat(system.path("issues").get(0).asText()).startsWith("Critical CPU usage");
        }
    }

    @Nested
    @DisplayName("telemetry")
    class Telemetry {

        private void awaitSamples(int count) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5_000;
            while (factory.getTelemetryStore().size() < count && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
        }

        @Test
        @DisplayName("should expose recorded samples, averages and trend")
        void shouldExposeTelemetry() throws Exception {
            awaitSamples(3);

            JsonNode samples = json(get("/telemetry?limit=2"));
            assertThat(samples.path("count").asInt()).isEqualTo(2);
            assertThat(samples.path("samples").get(0).path("cpu_percent").asDouble()).isEqualTo(10.0);

            HttpResponse<String> average = get("/telemetry/average?minutes=1");
            assertThat(average.statusCode()).isEqualTo(200);
            assertThat(json(average).path("avg_memory_percent").asDouble()).isEqualTo(20.0);

            HttpResponse<String> trend = get("/telemetry/trend?window=3");
            assertThat(trend.statusCode()).isEqualTo(200);
            assertThat(json(trend).path("cpu_trend_percent").asDouble()).isZero();
        }

        @Test
        @DisplayName("should validate query parameters")
        void shouldValidateParameters() throws Exception {
            assertThat(get("/telemetry/average?minutes=0").statusCode()).isEqualTo(400);
            assertThat(get("/telemetry/trend?window=1").statusCode()).isEqualTo(400);
            assertThat(get("/telemetry?limit=abc").statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should return a fresh reading of system resources")
        void shouldReturnFreshReading() throws Exception {
            factory.getSettableSource().set(42, 20, 30);

            JsonNode reading = json(get("/system/resources"));

            assertThat(reading.path("cpu").path("percent").asDouble()).isEqualTo(42.0);
            assertThat(reading.path("memory").path("percent").asDouble()).isEqualTo(20.0);
            assertThat(reading.path("gpu").isArray()).isTrue();
            assertThat(reading.path("system").path("process_count").asInt()).isEqualTo(100);
            assertThat(reading.path("system").path("uptime_seconds").asDouble()).isGreaterThanOrEqualTo(3599.0);
        }
    }

    @Test
    @DisplayName("should serve Prometheus metrics")
    void shouldServeMetrics() throws Exception {
        factory.getLifecycleManager().download("alpha", false);

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).startsWith("text/plain"));
        assertThat(response.body()).contains("test_lifecycle_operations_total").contains("test_loaded_resources");
    }

    @Test
    @DisplayName("should map every error type to a status")
    void shouldMapEveryErrorType() {
        assertThat(HttpServer.mapErrorToStatus(ErrorType.NOT_FOUND)).isEqualTo(404);
        assertThat(HttpServer.mapErrorToStatus(ErrorType.CONFLICT)).isEqualTo(409);
        assertThat(HttpServer.mapErrorToStatus(ErrorType.BACKEND_FAILURE)).isEqualTo(502);
        assertThat(HttpServer.mapErrorToStatus(ErrorType.RESOURCE_EXHAUSTED)).isEqualTo(503);
        assertThat(HttpServer.mapErrorToStatus(ErrorType.UNAVAILABLE)).isEqualTo(503);
        assertThat(HttpServer.mapErrorToStatus(ErrorType.TIMEOUT)).isEqualTo(504);
        assertThat(HttpServer.mapErrorToStatus(null)).isEqualTo(500);
        assertThat(HttpServer.queryParams(URI.create("http://h/p?a=1&b=x%20y&a=2")))
                .containsEntry("a", "1").containsEntry("b", "x y");
    }
}
