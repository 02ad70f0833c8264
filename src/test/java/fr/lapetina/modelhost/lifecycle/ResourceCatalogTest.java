package fr.lapetina.modelhost.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.QuantizationPolicy;
import fr.lapetina.modelhost.domain.model.ResourceDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceCatalogTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("should write the defaults when no catalog file exists")
    void shouldWriteDefaults() {
        Path file = dir.resolve("nested").resolve("models_config.json");

        ResourceCatalog catalog = ResourceCatalog.loadOrCreate(file, mapper);

        assertThat(file).exists();
        assertThat(catalog.size()).isEqualTo(ResourceCatalog.defaults().size());
        assertThat(ResourceCatalog.load(file, mapper).ids()).containsExactlyElementsOf(catalog.ids());
    }

    @Test
    @DisplayName("should read entries keyed by id in file order")
    void shouldReadEntries() throws IOException {
        Path file = Files.writeString(dir.resolve("catalog.json"), """
                {
                  "small": {
                    "name": "Small",
                    "model_repo": "small:1b",
                    "type": "decoder",
                    "max_length": 1024,
                    "capabilities": ["completion"],
                    "size": "500MB",
                    "quantization": "8bit",
                    "device": "cpu"
                  },
                  "bare": {}
                }
                """);

        ResourceCatalog catalog = ResourceCatalog.load(file, mapper);

        assertThat(catalog.ids()).containsExactly("small", "bare");
        ResourceDescriptor small = catalog.get("small").orElseThrow();
        assertThat(small.repository()).isEqualTo("small:1b");
        assertThat(small.maxContextLength()).isEqualTo(1024);
        assertThat(small.quantization()).isEqualTo(QuantizationPolicy.EIGHT_BIT);
        assertThat(small.devicePreference()).isEqualTo(Device.CPU);
        assertThat(small.hasCapability("completion")).isTrue();
        assertThat(catalog.get("bare").orElseThrow().repository()).isEqualTo("bare");
    }

    @Test
    @DisplayName("should reject an entry with an unknown device")
    void shouldRejectInvalidEntry() throws IOException {
        Path file = Files.writeString(dir.resolve("catalog.json"), "{\"x\": {\"device\": \"tpu\"}}");

        assertThatThrownBy(() -> ResourceCatalog.load(file, mapper))
                .isInstanceOf(ResourceCatalog.CatalogException.class)
                .hasMessageContaining("'x'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"../outside", "..", ".", "nested/id", "back\\slash", "with space", "r.partial-1"})
    @DisplayName("should reject ids that are not a single safe directory name")
    void shouldRejectUnsafeIds(String id) throws IOException {
        Path file = dir.resolve("catalog.json");
        mapper.writeValue(file.toFile(), Map.of(id, Map.of()));

        assertThatThrownBy(() -> ResourceCatalog.load(file, mapper))
                .isInstanceOf(ResourceCatalog.CatalogException.class)
                .hasMessageContaining("Invalid catalog entry");
    }

    @Test
    @DisplayName("should accept ids carrying tags and versions")
    void shouldAcceptTaggedIds() {
        ResourceDescriptor descriptor = ResourceDescriptor.builder().id("qwen2.5-coder:7b_q4").build();

        assertThat(descriptor.id()).isEqualTo("qwen2.5-coder:7b_q4");
    }

    @Test
    @DisplayName("should reject unreadable JSON and duplicate ids")
    void shouldRejectBadInput() throws IOException {
        Path file = Files.writeString(dir.resolve("catalog.json"), "not json");

        assertThatThrownBy(() -> ResourceCatalog.load(file, mapper))
                .isInstanceOf(ResourceCatalog.CatalogException.class);
        ResourceDescriptor twice = ResourceDescriptor.builder().id("dup").build();
        assertThatThrownBy(() -> new ResourceCatalog(List.of(twice, twice)))
                .isInstanceOf(ResourceCatalog.CatalogException.class);
    }
}
