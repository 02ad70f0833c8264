package fr.lapetina.modelhost.infrastructure.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.QuantizationPolicy;
import fr.lapetina.modelhost.lifecycle.backend.BackendException;
import fr.lapetina.modelhost.lifecycle.backend.GenerationParameters;
import fr.lapetina.modelhost.lifecycle.backend.Materialized;
import fr.lapetina.modelhost.lifecycle.backend.ResourceExhaustedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaModelBackendTest {

    @Test
    @DisplayName("should append the quantization tag only to untagged repositories")
    void shouldAppendQuantizationTag() {
        OllamaModelBackend backend = new OllamaModelBackend(URI.create("http://localhost:11434"));

        assertThat(backend.reference("codellama", QuantizationPolicy.FOUR_BIT)).isEqualTo("codellama:q4_0");
        assertThat(backend.reference("starcoder2", QuantizationPolicy.EIGHT_BIT)).isEqualTo("starcoder2:q8_0");
        assertThat(backend.reference("tinyllama:1.1b", QuantizationPolicy.FOUR_BIT)).isEqualTo("tinyllama:1.1b");
        assertThat(backend.reference("qwen", QuantizationPolicy.NONE)).isEqualTo("qwen");
        assertThat(OllamaModelBackend.tagSuffix(QuantizationPolicy.NONE)).isEqualTo("latest");
    }

    @Test
    @DisplayName("should recognize out-of-memory failures")
    void shouldRecognizeOutOfMemory() {
        assertThat(OllamaModelBackend.isOutOfMemory("CUDA error: out of memory")).isTrue();
        assertThat(OllamaModelBackend.isOutOfMemory("model requires more system memory (8 GiB)")).isTrue();
        assertThat(OllamaModelBackend.isOutOfMemory("model not found")).isFalse();
        assertThat(OllamaModelBackend.isOutOfMemory(null)).isFalse();
    }

    @Test
    @DisplayName("should match listed models with an implicit latest tag")
    void shouldMatchModels() {
        assertThat(OllamaModelBackend.sameModel("codellama:latest", "codellama")).isTrue();
        assertThat(OllamaModelBackend.sameModel("codellama:q4_0", "codellama:q4_0")).isTrue();
        assertThat(OllamaModelBackend.sameModel("codellama:7b", "codellama")).isFalse();
    }

    @Nested
    @DisplayName("against a fake server")
    class AgainstFakeServer {

        @TempDir
        Path artifacts;

        private final ObjectMapper mapper = new ObjectMapper();
        private final List<JsonNode> generateBodies = new CopyOnWriteArrayList<>();
        private HttpServer server;
        private OllamaModelBackend backend;
        private volatile String generateError;

        @BeforeEach
        void setUp() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/api/pull", exchange -> {
                JsonNode body = mapper.readTree(exchange.getRequestBody());
                if (body.path("model").asText().startsWith("missing")) {
                    respond(exchange, 404, "{\"error\":\"pull model manifest: file does not exist\"}");
                } else {
                    respond(exchange, 200, "{\"status\":\"success\"}");
                }
            });
            server.createContext("/api/generate", exchange -> {
                generateBodies.add(mapper.readTree(exchange.getRequestBody()));
                String error = generateError;
                if (error != null) {
                    respond(exchange, 500, "{\"error\":\"" + error + "\"}");
                } else {
                    respond(exchange, 200, "{\"response\":\"hello back\",\"done\":true}");
                }
            });
            server.createContext("/api/ps", exchange -> respond(exchange, 200,
                    "{\"models\":[{\"name\":\"tiny:q4_0\",\"size\":1000,\"size_vram\":600}]}"));
            server.start();

            URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
            backend = new OllamaModelBackend(base, Duration.ofSeconds(2), Duration.ofSeconds(5));
        }

        @AfterEach
        void tearDown() {
            server.stop(0);
        }

        private void respond(HttpExchange exchange, int status, String json) throws IOException {
            byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }

        @Test
        @DisplayName("should pull, materialize, serve and release a model")
        void shouldRunFullCycle() {
            Path destination = artifacts.resolve("tiny");
            backend.fetch("tiny", "tiny:q4_0", destination);
            assertThat(destination.resolve(OllamaModelBackend.MANIFEST_FILE)).exists();

            Materialized materialized = backend.materialize("tiny", destination, Device.ACCELERATOR,
                    QuantizationPolicy.FOUR_BIT);
            assertThat(materialized.footprintBytes()).isEqualTo(600);
            assertThat(materialized.handle().device()).isEqualTo(Device.ACCELERATOR);

            String reply = backend.serve(materialized.handle(), "hi", GenerationParameters.defaults());
            assertThat(reply).isEqualTo("hello back");

            backend.release(materialized.handle());
            JsonNode releaseBody = generateBodies.get(generateBodies.size() - 1);
            assertThat(releaseBody.path("keep_alive").asInt()).isZero();
        }

        @Test
        @DisplayName("should pin a CPU load to zero GPU layers and report the full size")
        void shouldPinCpuLoad() {
            Path destination = artifacts.resolve("tiny");
            backend.fetch("tiny", "tiny:q4_0", destination);

            Materialized materialized = backend.materialize("tiny", destination, Device.CPU, QuantizationPolicy.NONE);

            assertThat(materialized.footprintBytes()).isEqualTo(1000);
            assertThat(generateBodies.get(0).path("options").path("num_gpu").asInt(-1)).isZero();
        }

        @Test
        @DisplayName("should surface the server error of a failed pull")
        void shouldSurfacePullError() {
            assertThatThrownBy(() -> backend.fetch("missing", "missing-model", artifacts.resolve("missing")))
                    .isInstanceOf(BackendException.class)
                    .hasMessageContaining("file does not exist");
        }

        @Test
        @DisplayName("should classify an out-of-memory load as exhausted capacity")
        void shouldClassifyOutOfMemory() {
            Path destination = artifacts.resolve("tiny");
            backend.fetch("tiny", "tiny:q4_0", destination);
            generateError = "CUDA error: out of memory";

            assertThatThrownBy(() -> backend.materialize("tiny", destination, Device.ACCELERATOR,
                    QuantizationPolicy.FOUR_BIT))
                    .isInstanceOf(ResourceExhaustedException.class);
        }

        @Test
        @DisplayName("should refuse to materialize without a manifest")
        void shouldRefuseWithoutManifest() {
            assertThatThrownBy(() -> backend.materialize("tiny", artifacts.resolve("empty"), Device.CPU,
                    QuantizationPolicy.NONE))
                    .isInstanceOf(BackendException.class)
                    .hasMessageContaining("Missing manifest");
        }
    }
}
