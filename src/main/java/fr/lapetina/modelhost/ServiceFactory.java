package fr.lapetina.modelhost;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.modelhost.disruptor.TelemetryPipeline;
import fr.lapetina.modelhost.health.HealthAggregator;
import fr.lapetina.modelhost.health.HealthThresholds;
import fr.lapetina.modelhost.health.LifecycleHealthCheck;
import fr.lapetina.modelhost.health.RecommendationEngine;
import fr.lapetina.modelhost.health.ServiceSelfCheck;
import fr.lapetina.modelhost.health.SystemResourceCheck;
import fr.lapetina.modelhost.health.TelemetryHealthCheck;
import fr.lapetina.modelhost.infrastructure.config.ConfigLoader;
import fr.lapetina.modelhost.infrastructure.config.ServiceConfig;
import fr.lapetina.modelhost.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modelhost.infrastructure.ollama.OllamaModelBackend;
import fr.lapetina.modelhost.lifecycle.LifecycleManager;
import fr.lapetina.modelhost.lifecycle.ResourceCatalog;
import fr.lapetina.modelhost.lifecycle.backend.ModelBackend;
import fr.lapetina.modelhost.telemetry.AcceleratorProbe;
import fr.lapetina.modelhost.telemetry.AmdSysfsProbe;
import fr.lapetina.modelhost.telemetry.MetricSource;
import fr.lapetina.modelhost.telemetry.NvidiaSmiProbe;
import fr.lapetina.modelhost.telemetry.SystemMetricSampler;
import fr.lapetina.modelhost.telemetry.TelemetrySampler;
import fr.lapetina.modelhost.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Builds and owns every component of the service from configuration.
 * Nothing is global: each factory wires its own graph and tears it down in
 * {@link #close()}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ServiceFactory factory = ServiceFactory.create("config.yaml").start()) {
 *     LifecycleResult result = factory.getLifecycleManager().load("tinyllama", Device.AUTO);
 *     OverallHealth health = factory.getHealthAggregator().checkHealth();
 * }
 * }</pre>
 */
public class ServiceFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceFactory.class);

    private final ConfigLoader configLoader;
    private final ServiceConfig config;
    private final MetricsRegistry metricsRegistry;
    private final AcceleratorProbe acceleratorProbe;
    private final MetricSource metricSource;
    private final TelemetryStore telemetryStore;
    private final TelemetryPipeline telemetryPipeline;
    private final TelemetrySampler telemetrySampler;
    private final ModelBackend backend;
    private final ResourceCatalog catalog;
    private final LifecycleManager lifecycleManager;
    private final AtomicReference<HealthThresholds> thresholds;
    private final HealthAggregator healthAggregator;

    protected ServiceFactory(String configPath, ModelBackend backendOverride, MetricSource metricSourceOverride) {
        log.info("Initializing ServiceFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Telemetry
        ServiceConfig.TelemetryConfig telemetry = config.getTelemetry();
        this.acceleratorProbe = createAcceleratorProbe(telemetry);
        this.metricSource = metricSourceOverride != null
                ? metricSourceOverride
                : new SystemMetricSampler(Paths.get(telemetry.getDiskPath()), acceleratorProbe);
        this.telemetryStore = new TelemetryStore(telemetry.getHistorySize());
        this.telemetryPipeline = TelemetryPipeline.builder()
                .fromConfig(config)
                .store(telemetryStore)
                .metricsRegistry(metricsRegistry)
                .build();
        this.telemetrySampler = new TelemetrySampler(
                metricSource,
                telemetryPipeline::publish,
                Duration.ofMillis(telemetry.getIntervalMs()),
                Duration.ofMillis(telemetry.getShutdownGraceMs())
        );

        // Lifecycle (allow backend override for testing)
        this.backend = backendOverride != null ? backendOverride : createBackend(config.getBackend());
        Path storageDir = Paths.get(config.getStorage().getModelsDir());
        this.catalog = ResourceCatalog.loadOrCreate(
                storageDir.resolve(config.getStorage().getCatalogFile()), catalogMapper());
        this.lifecycleManager = new LifecycleManager(
                catalog,
                backend,
                acceleratorProbe,
                lifecycleSettings(storageDir, config.getLifecycle()),
                metricsRegistry
        );

        // Health
        this.thresholds = new AtomicReference<>(HealthThresholds.from(config.getHealth()));
        this.healthAggregator = new HealthAggregator(
                List.of(
                        new SystemResourceCheck(metricSource, thresholds::get),
                        new LifecycleHealthCheck(lifecycleManager),
                        new TelemetryHealthCheck(telemetryStore, metricSource, thresholds::get),
                        new ServiceSelfCheck(lifecycleManager, telemetryStore, thresholds::get)
                ),
                new RecommendationEngine(),
                HealthAggregator.uptimeFrom(telemetryStore),
                metricsRegistry,
                config.getHealth().getHistorySize(),
                Clock.systemUTC()
        );

        configLoader.addListener(this::onConfigChanged);

        log.info("ServiceFactory initialized: resources={}, backend={}", catalog.size(), backend.getName());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ServiceFactory create(String configPath) {
        return new ServiceFactory(configPath, null, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static ServiceFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the telemetry pipeline, the sampler and the config watcher.
     */
    public ServiceFactory start() {
        telemetryPipeline.start();
        if (config.getTelemetry().isEnabled()) {
            telemetrySampler.start();
        } else {
            log.info("Telemetry sampling disabled");
        }
        configLoader.startWatching();
        log.info("Services started");
        return this;
    }

    public ServiceConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public MetricSource getMetricSource() {
        return metricSource;
    }

    public TelemetryStore getTelemetryStore() {
        return telemetryStore;
    }

    public TelemetryPipeline getTelemetryPipeline() {
        return telemetryPipeline;
    }

    public TelemetrySampler getTelemetrySampler() {
        return telemetrySampler;
    }

    public ModelBackend getBackend() {
        return backend;
    }

    public LifecycleManager getLifecycleManager() {
        return lifecycleManager;
    }

    public HealthAggregator getHealthAggregator() {
        return healthAggregator;
    }

    public HealthThresholds getHealthThresholds() {
        return thresholds.get();
    }

    protected ModelBackend createBackend(ServiceConfig.BackendConfig backendConfig) {
        String type = backendConfig.getType() == null ? "" : backendConfig.getType().toLowerCase(Locale.ROOT);
        if (!"ollama".equals(type)) {
            throw new ConfigLoader.ConfigurationException("Unsupported backend type: " + backendConfig.getType());
        }
        return new OllamaModelBackend(
                URI.create(backendConfig.getUrl()),
                Duration.ofMillis(backendConfig.getConnectTimeoutMs()),
                Duration.ofMillis(backendConfig.getRequestTimeoutMs())
        );
    }

    private static AcceleratorProbe createAcceleratorProbe(ServiceConfig.TelemetryConfig telemetry) {
        if (!telemetry.isAcceleratorProbe()) {
            return AcceleratorProbe.none();
        }
        return AcceleratorProbe.firstAvailable(
                new NvidiaSmiProbe(telemetry.getNvidiaSmiCommand(), Duration.ofMillis(telemetry.getProbeTimeoutMs())),
                new AmdSysfsProbe()
        );
    }

    private static LifecycleManager.Settings lifecycleSettings(Path storageDir, ServiceConfig.LifecycleConfig lifecycle) {
        return new LifecycleManager.Settings(
                storageDir,
                Duration.ofMillis(lifecycle.getDownloadTimeoutMs()),
                Duration.ofMillis(lifecycle.getLoadTimeoutMs()),
                Duration.ofMillis(lifecycle.getUnloadTimeoutMs()),
                lifecycle.getWorkerThreads()
        );
    }

    private static ObjectMapper catalogMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private void onConfigChanged(ServiceConfig oldConfig, ServiceConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        thresholds.set(HealthThresholds.from(newConfig.getHealth()));

        if (oldConfig != null && (oldConfig.getServer().getPort() != newConfig.getServer().getPort()
                || !oldConfig.getStorage().getModelsDir().equals(newConfig.getStorage().getModelsDir())
                || oldConfig.getTelemetry().getIntervalMs() != newConfig.getTelemetry().getIntervalMs())) {
            log.warn("Server, storage and telemetry settings take effect after a restart");
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down ServiceFactory...");

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        try {
            telemetrySampler.close();
        } catch (Exception e) {
            log.warn("Error closing telemetry sampler", e);
        }

        try {
            telemetryPipeline.close();
        } catch (Exception e) {
            log.warn("Error closing telemetry pipeline", e);
        }

        try {
            lifecycleManager.close();
        } catch (Exception e) {
            log.warn("Error closing lifecycle manager", e);
        }

        try {
            backend.close();
        } catch (Exception e) {
            log.warn("Error closing backend", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ServiceFactory shut down");
    }
}
