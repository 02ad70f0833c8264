package fr.lapetina.modelhost.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link ServiceConfig} from YAML, with optional hot reload.
 *
 * The path is tried on the file system first, then on the classpath.
 * Every loaded configuration is validated before it replaces the current one;
 * a reload that fails validation keeps the previous configuration.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<ServiceConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ServiceConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration.
     *
     * @throws ConfigurationException if the file is missing, unparsable or invalid
     */
    public ServiceConfig load() {
        return install(loadFromPath());
    }

    /**
     * Loads configuration from an input stream.
     */
    public ServiceConfig loadFromStream(InputStream inputStream) {
        return install(parse(inputStream, "stream"));
    }

    private ServiceConfig install(ServiceConfig config) {
        validate(config);
        ServiceConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private ServiceConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ServiceConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private ServiceConfig parse(InputStream is, String source) {
        try {
            ServiceConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks ranges and threshold ordering.
     *
     * @throws ConfigurationException listing every violation found
     */
    public static void validate(ServiceConfig config) {
        List<String> errors = new ArrayList<>();

        ServiceConfig.ServerConfig server = config.getServer();
        if (server.getPort() < 0 || server.getPort() > 65535) {
            errors.add("server.port out of range: " + server.getPort());
        }
        if (server.getWorkerThreads() <= 0) {
            errors.add("server.workerThreads must be positive");
        }

        ServiceConfig.StorageConfig storage = config.getStorage();
        if (storage.getModelsDir() == null || storage.getModelsDir().isBlank()) {
            errors.add("storage.modelsDir is required");
        }
        if (storage.getCatalogFile() == null || storage.getCatalogFile().isBlank()) {
            errors.add("storage.catalogFile is required");
        }

        ServiceConfig.TelemetryConfig telemetry = config.getTelemetry();
        if (telemetry.getIntervalMs() <= 0) {
            errors.add("telemetry.intervalMs must be positive");
        }
        if (telemetry.getHistorySize() <= 0) {
            errors.add("telemetry.historySize must be positive");
        }

        ServiceConfig.LifecycleConfig lifecycle = config.getLifecycle();
        if (lifecycle.getDownloadTimeoutMs() <= 0 || lifecycle.getLoadTimeoutMs() <= 0
                || lifecycle.getUnloadTimeoutMs() <= 0) {
            errors.add("lifecycle timeouts must be positive");
        }
        if (lifecycle.getWorkerThreads() <= 0) {
            errors.add("lifecycle.workerThreads must be positive");
        }

        ServiceConfig.HealthConfig health = config.getHealth();
        if (health.getHistorySize() <= 0) {
            errors.add("health.historySize must be positive");
        }
        checkPair(errors, "cpu", health.getCpuWarningPercent(), health.getCpuCriticalPercent());
        checkPair(errors, "memory", health.getMemoryWarningPercent(), health.getMemoryCriticalPercent());
        checkPair(errors, "disk", health.getDiskWarningPercent(), health.getDiskCriticalPercent());
        if (health.getTrendWindow() < 2) {
            errors.add("health.trendWindow must be at least 2");
        }

        int ringSize = config.getDisruptor().getRingBufferSize();
        if (ringSize <= 0 || Integer.bitCount(ringSize) != 1) {
            errors.add("disruptor.ringBufferSize must be a power of 2: " + ringSize);
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
    }

    private static void checkPair(List<String> errors, String name, double warning, double critical) {
        if (warning < 0 || critical > 100) {
            errors.add("health." + name + " thresholds must be within 0-100");
        }
        if (warning > critical) {
            errors.add("health." + name + "WarningPercent must not exceed " + name + "CriticalPercent");
        }
    }

    /**
     * Returns the current configuration.
     */
    public ServiceConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. Keeps the current configuration on failure.
     */
    public ServiceConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ServiceConfig oldConfig, ServiceConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Creates a default configuration.
     */
    public static ServiceConfig createDefault() {
        return new ServiceConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
