package fr.lapetina.modelhost.infrastructure.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.ModelHandle;
import fr.lapetina.modelhost.domain.model.QuantizationPolicy;
import fr.lapetina.modelhost.lifecycle.backend.BackendException;
import fr.lapetina.modelhost.lifecycle.backend.GenerationParameters;
import fr.lapetina.modelhost.lifecycle.backend.Materialized;
import fr.lapetina.modelhost.lifecycle.backend.ModelBackend;
import fr.lapetina.modelhost.lifecycle.backend.ResourceExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@link ModelBackend} backed by an Ollama server.
 *
 * <ul>
 *   <li>fetch: {@code /api/pull}, then a manifest is written to the destination</li>
 *   <li>materialize: an empty {@code /api/generate} with {@code keep_alive=-1},
 *       footprint read back from {@code /api/ps}</li>
 *   <li>release: {@code /api/generate} with {@code keep_alive=0}</li>
 *   <li>serve: a non-streaming {@code /api/generate}</li>
 * </ul>
 *
 * The server keeps the weights; the local artifact directory only holds the manifest.
 */
public class OllamaModelBackend implements ModelBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaModelBackend.class);

    static final String MANIFEST_FILE = "manifest.json";

    private final URI baseUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public OllamaModelBackend(URI baseUri, Duration connectTimeout, Duration requestTimeout) {
        String base = baseUri.toString();
        this.baseUri = URI.create(base.endsWith("/") ? base : base + "/");
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public OllamaModelBackend(URI baseUri) {
        this(baseUri, Duration.ofSeconds(10), Duration.ofMinutes(5));
    }

    @Override
    public void fetch(String resourceId, String repository, Path destination) {
        ObjectNode body = objectMapper.createObjectNode()
                .put("model", repository)
                .put("stream", false);

        log.info("Pulling model: resourceId={}, model={}", resourceId, repository);
        // Pulls may take far longer than a request; the caller bounds the call
        JsonNode response = post(resourceId, "api/pull", body, null);
        String status = response.path("status").asText("");
        if (!"success".equalsIgnoreCase(status)) {
            throw new BackendException(resourceId, "Pull did not complete: status=" + status);
        }

        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("resource_id", resourceId);
        manifest.put("model", repository);
        manifest.put("pulled_at", Instant.now());
        try {
            Files.createDirectories(destination);
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(destination.resolve(MANIFEST_FILE).toFile(), manifest);
        } catch (IOException e) {
            throw new BackendException(resourceId, "Failed to write manifest: " + e.getMessage(), e);
        }
    }

    /**
     * Appends the quantization tag ({@code q8_0}, {@code q4_0}) when the
     * repository names no tag of its own.
     */
    @Override
    public String reference(String repository, QuantizationPolicy quantization) {
        if (repository.contains(":") || quantization == QuantizationPolicy.NONE) {
            return repository;
        }
        return repository + ":" + tagSuffix(quantization);
    }

    static String tagSuffix(QuantizationPolicy quantization) {
        return switch (quantization) {
            case EIGHT_BIT -> "q8_0";
            case FOUR_BIT -> "q4_0";
            case NONE -> "latest";
        };
    }

    @Override
    public Materialized materialize(String resourceId, Path artifacts, Device device,
                                    QuantizationPolicy quantization) {
        String model = readModel(resourceId, artifacts);

        ObjectNode body = objectMapper.createObjectNode()
                .put("model", model)
                .put("prompt", "")
                .put("stream", false)
                .put("keep_alive", -1);
        if (device == Device.CPU) {
            body.putObject("options").put("num_gpu", 0);
        }

        try {
            post(resourceId, "api/generate", body, requestTimeout);
        } catch (BackendException e) {
            if (isOutOfMemory(e.getMessage())) {
                throw new ResourceExhaustedException(resourceId, e.getMessage(), e);
            }
            throw e;
        }

        long footprint = footprintOf(resourceId, model, device);
        log.info("Model resident: resourceId={}, model={}, device={}, footprintBytes={}",
                resourceId, model, device, footprint);
        return new Materialized(new OllamaHandle(resourceId, model, device), footprint);
    }

    @Override
    public void release(ModelHandle handle) {
        OllamaHandle ollama = asOllama(handle);
        ObjectNode body = objectMapper.createObjectNode()
                .put("model", ollama.model())
                .put("keep_alive", 0);
        post(handle.resourceId(), "api/generate", body, requestTimeout);
        log.info("Model released: resourceId={}, model={}", ollama.resourceId(), ollama.model());
    }

    @Override
    public String serve(ModelHandle handle, String prompt, GenerationParameters parameters) {
        OllamaHandle ollama = asOllama(handle);
        ObjectNode body = objectMapper.createObjectNode()
                .put("model", ollama.model())
                .put("prompt", prompt)
                .put("stream", false)
                .put("keep_alive", -1);
        body.putObject("options")
                .put("num_predict", parameters.maxTokens())
                .put("temperature", parameters.temperature());
        JsonNode response = post(handle.resourceId(), "api/generate", body, requestTimeout);
        return response.path("response").asText("");
    }

    @Override
    public String getName() {
        return "ollama";
    }

    /**
     * Memory the server reports for the model: VRAM share on an accelerator,
     * total size otherwise. Zero when the model is not listed.
     */
    long footprintOf(String resourceId, String model, Device device) {
        JsonNode running = get(resourceId, "api/ps");
        for (JsonNode entry : running.path("models")) {
            String name = entry.path("name").asText(entry.path("model").asText(""));
            if (sameModel(name, model)) {
                return device == Device.ACCELERATOR
                        ? entry.path("size_vram").asLong(0)
                        : entry.path("size").asLong(0);
            }
        }
        log.warn("Model not listed as running after load: resourceId={}, model={}", resourceId, model);
        return 0;
    }

    private String readModel(String resourceId, Path artifacts) {
        Path manifest = artifacts.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifest)) {
            throw new BackendException(resourceId, "Missing manifest at " + manifest);
        }
        try {
            String model = objectMapper.readTree(manifest.toFile()).path("model").asText("");
            if (model.isBlank()) {
                throw new BackendException(resourceId, "Manifest has no model name: " + manifest);
            }
            return model;
        } catch (IOException e) {
            throw new BackendException(resourceId, "Unreadable manifest: " + e.getMessage(), e);
        }
    }

    private JsonNode post(String resourceId, String path, JsonNode body, Duration timeout) {
        try {
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(baseUri.resolve(path))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
            if (timeout != null) {
                request.timeout(timeout);
            }
            return send(resourceId, request.build());
        } catch (JsonProcessingException e) {
            throw new BackendException(resourceId, "Failed to encode request: " + e.getMessage(), e);
        }
    }

    private JsonNode get(String resourceId, String path) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(baseUri.resolve(path))
                .timeout(requestTimeout)
                .GET()
                .build();
        return send(resourceId, request);
    }

    private JsonNode send(String resourceId, HttpRequest request) {
        log.debug("Ollama request: resourceId={}, method={}, uri={}", resourceId, request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(resourceId, "Request to Ollama interrupted", e);
        } catch (IOException e) {
            throw new BackendException(resourceId,
                    "Ollama unreachable at " + baseUri + ": " + e.getClass().getSimpleName(), e);
        }

        JsonNode json = parse(response.body());
        String error = json.path("error").asText(null);
        if (response.statusCode() < 200 || response.statusCode() >= 300 || error != null) {
            String message = error != null ? error : "HTTP " + response.statusCode();
            log.warn("Ollama request failed: resourceId={}, uri={}, status={}, error={}",
                    resourceId, request.uri(), response.statusCode(), message);
            throw new BackendException(resourceId, message);
        }
        return json;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON response from Ollama: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    static boolean isOutOfMemory(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("out of memory")
                || lower.contains("insufficient memory")
                || lower.contains("requires more system memory");
    }

    static boolean sameModel(String listed, String model) {
        return listed.equals(model) || listed.equals(model + ":latest");
    }

    private static OllamaHandle asOllama(ModelHandle handle) {
        if (handle instanceof OllamaHandle ollama) {
            return ollama;
        }
        throw new BackendException(handle.resourceId(),
                "Handle was not produced by this backend: " + handle.getClass().getSimpleName());
    }
}
