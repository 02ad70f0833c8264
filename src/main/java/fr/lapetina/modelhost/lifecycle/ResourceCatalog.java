package fr.lapetina.modelhost.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.QuantizationPolicy;
import fr.lapetina.modelhost.domain.model.ResourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Immutable set of resource descriptors, keyed by id, read from a JSON file.
 *
 * The file maps each id to its descriptor fields:
 * <pre>
 * {
 *   "tinyllama": {
 *     "name": "TinyLlama", "model_repo": "tinyllama:1.1b", "type": "decoder",
 *     "max_length": 2048, "capabilities": ["code-generation"], "size": "640MB",
 *     "quantization": "4bit", "device": "auto"
 *   }
 * }
 * </pre>
 */
public final class ResourceCatalog {

    private static final Logger log = LoggerFactory.getLogger(ResourceCatalog.class);

    private static final TypeReference<LinkedHashMap<String, CatalogEntry>> CATALOG_TYPE = new TypeReference<>() {
    };

    private final Map<String, ResourceDescriptor> descriptors;

    public ResourceCatalog(Collection<ResourceDescriptor> descriptors) {
        Map<String, ResourceDescriptor> byId = new LinkedHashMap<>();
        for (ResourceDescriptor descriptor : descriptors) {
            if (byId.putIfAbsent(descriptor.id(), descriptor) != null) {
                throw new CatalogException("Duplicate resource id: " + descriptor.id());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byId);
    }

    /**
     * Reads the catalog file, first writing the built-in defaults if it does not exist.
     *
     * @throws CatalogException if the file cannot be read, written or parsed
     */
    public static ResourceCatalog loadOrCreate(Path file, ObjectMapper mapper) {
        if (!Files.exists(file)) {
            ResourceCatalog defaults = defaults();
            defaults.write(file, mapper);
            log.info("Default catalog written: path={}, resources={}", file, defaults.size());
            return defaults;
        }
        return load(file, mapper);
    }

    /**
     * Reads an existing catalog file.
     */
    public static ResourceCatalog load(Path file, ObjectMapper mapper) {
        Map<String, CatalogEntry> entries;
        try {
            entries = mapper.readValue(file.toFile(), CATALOG_TYPE);
        } catch (IOException e) {
            throw new CatalogException("Failed to read catalog: " + file, e);
        }
        if (entries == null) {
            throw new CatalogException("Catalog is empty: " + file);
        }

        List<ResourceDescriptor> descriptors = new ArrayList<>(entries.size());
        for (Map.Entry<String, CatalogEntry> entry : entries.entrySet()) {
            try {
                descriptors.add(entry.getValue().toDescriptor(entry.getKey()));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new CatalogException("Invalid catalog entry '" + entry.getKey() + "': " + e.getMessage(), e);
            }
        }
        log.info("Catalog loaded: path={}, resources={}", file, descriptors.size());
        return new ResourceCatalog(descriptors);
    }

    /**
     * Writes this catalog as JSON, creating parent directories.
     */
    public void write(Path file, ObjectMapper mapper) {
        Map<String, CatalogEntry> entries = new LinkedHashMap<>();
        descriptors.forEach((id, descriptor) -> entries.put(id, CatalogEntry.from(descriptor)));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(file.toFile(), entries);
        } catch (IOException e) {
            throw new CatalogException("Failed to write catalog: " + file, e);
        }
    }

    /**
     * Built-in catalog of small code models served through Ollama.
     */
    public static ResourceCatalog defaults() {
        return new ResourceCatalog(List.of(
                ResourceDescriptor.builder()
                        .id("tinyllama")
                        .name("TinyLlama")
                        .description("Small but capable language model for code")
                        .repository("tinyllama:1.1b")
                        .kind("decoder")
                        .maxContextLength(2048)
                        .capabilities(Set.of("code-generation", "explanation", "refactoring"))
                        .sizeClass("640MB")
                        .quantization(QuantizationPolicy.FOUR_BIT)
                        .build(),
                ResourceDescriptor.builder()
                        .id("qwen2.5-coder")
                        .name("Qwen2.5 Coder 1.5B")
                        .description("Lightweight code completion and generation model")
                        .repository("qwen2.5-coder:1.5b")
                        .kind("decoder")
                        .maxContextLength(4096)
                        .capabilities(Set.of("code-completion", "code-generation", "documentation"))
                        .sizeClass("1GB")
                        .build(),
                ResourceDescriptor.builder()
                        .id("starcoder2")
                        .name("StarCoder2 3B")
                        .description("Code generation model trained on multiple languages")
                        .repository("starcoder2:3b")
                        .kind("decoder")
                        .maxContextLength(4096)
                        .capabilities(Set.of("code-generation", "translation", "completion"))
                        .sizeClass("1.7GB")
                        .quantization(QuantizationPolicy.EIGHT_BIT)
                        .build(),
                ResourceDescriptor.builder()
                        .id("codellama")
                        .name("Code Llama 7B")
                        .description("General purpose code model")
                        .repository("codellama")
                        .kind("decoder")
                        .maxContextLength(4096)
                        .capabilities(Set.of("code-generation", "explanation", "bug-detection"))
                        .sizeClass("3.8GB")
                        .quantization(QuantizationPolicy.FOUR_BIT)
                        .build()
        ));
    }

    public Optional<ResourceDescriptor> get(String id) {
        return Optional.ofNullable(descriptors.get(id));
    }

    public boolean contains(String id) {
        return descriptors.containsKey(id);
    }

    /**
     * All descriptors in catalog order.
     */
    public List<ResourceDescriptor> all() {
        return List.copyOf(descriptors.values());
    }

    public Set<String> ids() {
        return descriptors.keySet();
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * JSON shape of one catalog entry.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class CatalogEntry {
        @JsonProperty("name")
        public String name;
        @JsonProperty("description")
        public String description;
        @JsonProperty("model_repo")
        public String repository;
        @JsonProperty("type")
        public String kind;
        @JsonProperty("max_length")
        public Integer maxLength;
        @JsonProperty("capabilities")
        public List<String> capabilities;
        @JsonProperty("size")
        public String size;
        @JsonProperty("quantization")
        public String quantization;
        @JsonProperty("device")
        public String device;

        ResourceDescriptor toDescriptor(String id) {
            ResourceDescriptor.Builder builder = ResourceDescriptor.builder()
                    .id(id)
                    .name(name)
                    .description(description)
                    .repository(repository)
                    .kind(kind)
                    .sizeClass(size)
                    .quantization(QuantizationPolicy.parse(quantization))
                    .devicePreference(Device.parse(device));
            if (maxLength != null) {
                builder.maxContextLength(maxLength);
            }
            if (capabilities != null) {
                builder.capabilities(new LinkedHashSet<>(capabilities));
            }
            return builder.build();
        }

        static CatalogEntry from(ResourceDescriptor descriptor) {
            CatalogEntry entry = new CatalogEntry();
            entry.name = descriptor.name();
            entry.description = descriptor.description();
            entry.repository = descriptor.repository();
            entry.kind = descriptor.kind();
            entry.maxLength = descriptor.maxContextLength();
            entry.capabilities = new ArrayList<>(descriptor.capabilities());
            entry.size = descriptor.sizeClass();
            entry.quantization = descriptor.quantization().value();
            entry.device = descriptor.devicePreference().value();
            return entry;
        }
    }

    /**
     * Thrown when the catalog cannot be read, written or parsed.
     */
    public static class CatalogException extends RuntimeException {
        public CatalogException(String message) {
            super(message);
        }

        public CatalogException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
