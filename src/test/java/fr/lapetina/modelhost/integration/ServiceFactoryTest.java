package fr.lapetina.modelhost.integration;

import fr.lapetina.modelhost.ServiceFactory;
import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.Severity;
import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.ResourcePhase;
import fr.lapetina.modelhost.infrastructure.config.ConfigLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wiring of the full component graph from a configuration file.
 */
class ServiceFactoryTest {

    @TempDir
    Path workDir;

    private TestServiceFactory factory;

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should wire the catalog, backend and health checks from configuration")
    void shouldWireComponents() {
        factory = TestServiceFactory.create(workDir);

        assertThat(factory.getConfig().getServer().getPort()).isZero();
        assertThat(factory.getLifecycleManager().list())
                .extracting(snapshot -> snapshot.id())
                .containsExactly("alpha", "beta");
        assertThat(factory.getLifecycleManager().getBackendName()).isEqualTo("stub");
        assertThat(factory.getHealthAggregator().categories())
                .containsExactlyInAnyOrder(HealthCategory.values());
        assertThat(factory.getTelemetryPipeline().isRunning()).isTrue();
        assertThat(factory.getTelemetrySampler().isRunning()).isTrue();
    }

    @Test
    @DisplayName("should store artifacts under the configured models directory")
    void shouldUseConfiguredStorage() {
        factory = TestServiceFactory.create(workDir);

        assertThat(factory.getLifecycleManager().download("alpha", false).success()).isTrue();
        assertThat(factory.getLifecycleManager().load("alpha", Device.CPU).phase()).isEqualTo(ResourcePhase.LOADED);

        assertThat(workDir.resolve("models").resolve("alpha")).isDirectory();
    }

    @Test
    @DisplayName("should apply reloaded health thresholds without a restart")
    void shouldHotReloadThresholds() throws Exception {
        factory = TestServiceFactory.create(workDir);
        factory.getSettableSource().set(80, 20, 30);
        assertThat(factory.getHealthAggregator().runCheck(HealthCategory.SYSTEM).severity())
                .isEqualTo(Severity.WARNING);

        String yaml = TestServiceFactory.testConfigYaml(workDir.resolve("models"))
                .replace("health:\n  historySize: 5",
                        "health:\n  historySize: 5\n  cpuWarningPercent: 85\n  cpuCriticalPercent: 95");
        TestServiceFactory.writeConfig(workDir, yaml);
        factory.getConfigLoader().reload();

        assertThat(factory.getHealthThresholds().cpuWarningPercent()).isEqualTo(85.0);
        assertThat(factory.getHealthAggregator().runCheck(HealthCategory.SYSTEM).severity())
                .isEqualTo(Severity.HEALTHY);
    }

    @Test
    @DisplayName("should keep the previous thresholds when the reloaded file is invalid")
    void shouldKeepThresholdsOnInvalidReload() throws Exception {
        factory = TestServiceFactory.create(workDir);

        String yaml = TestServiceFactory.testConfigYaml(workDir.resolve("models"))
                .replace("health:\n  historySize: 5",
                        "health:\n  historySize: 5\n  cpuWarningPercent: 99\n  cpuCriticalPercent: 50");
        TestServiceFactory.writeConfig(workDir, yaml);
        factory.getConfigLoader().reload();

        assertThat(factory.getHealthThresholds().cpuWarningPercent()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("should reject an unsupported backend type")
    void shouldRejectUnsupportedBackend() throws Exception {
        Path models = Files.createDirectories(workDir.resolve("models"));
        String yaml = TestServiceFactory.testConfigYaml(models).replace("type: ollama", "type: triton");
        Path config = TestServiceFactory.writeConfig(workDir, yaml);

        assertThatThrownBy(() -> ServiceFactory.create(config.toString()))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Unsupported backend type: triton");
    }
}
