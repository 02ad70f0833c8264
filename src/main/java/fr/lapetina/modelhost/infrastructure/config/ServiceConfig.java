package fr.lapetina.modelhost.infrastructure.config;

/**
 * Root configuration object for the model host.
 * Designed to be populated from YAML.
 */
public class ServiceConfig {

    private ServerConfig server = new ServerConfig();
    private StorageConfig storage = new StorageConfig();
    private TelemetryConfig telemetry = new TelemetryConfig();
    private LifecycleConfig lifecycle = new LifecycleConfig();
    private HealthConfig health = new HealthConfig();
    private BackendConfig backend = new BackendConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public StorageConfig getStorage() { return storage; }
    public void setStorage(StorageConfig storage) { this.storage = storage; }

    public TelemetryConfig getTelemetry() { return telemetry; }
    public void setTelemetry(TelemetryConfig telemetry) { this.telemetry = telemetry; }

    public LifecycleConfig getLifecycle() { return lifecycle; }
    public void setLifecycle(LifecycleConfig lifecycle) { this.lifecycle = lifecycle; }

    public HealthConfig getHealth() { return health; }
    public void setHealth(HealthConfig health) { this.health = health; }

    public BackendConfig getBackend() { return backend; }
    public void setBackend(BackendConfig backend) { this.backend = backend; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8000;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 8;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Where artifacts and the catalog live.
     */
    public static class StorageConfig {
        private String modelsDir = "./models";
        private String catalogFile = "catalog.json";

        public String getModelsDir() { return modelsDir; }
        public void setModelsDir(String modelsDir) { this.modelsDir = modelsDir; }

        public String getCatalogFile() { return catalogFile; }
        public void setCatalogFile(String catalogFile) { this.catalogFile = catalogFile; }
    }

    /**
     * Background sampling configuration.
     */
    public static class TelemetryConfig {
        private boolean enabled = true;
        private long intervalMs = 5000;
        private int historySize = 1000;
        private String diskPath = "/";
        private long shutdownGraceMs = 5000;
        private boolean acceleratorProbe = true;
        private String nvidiaSmiCommand = "nvidia-smi";
        private long probeTimeoutMs = 2000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }

        public String getDiskPath() { return diskPath; }
        public void setDiskPath(String diskPath) { this.diskPath = diskPath; }

        public long getShutdownGraceMs() { return shutdownGraceMs; }
        public void setShutdownGraceMs(long shutdownGraceMs) { this.shutdownGraceMs = shutdownGraceMs; }

        public boolean isAcceleratorProbe() { return acceleratorProbe; }
        public void setAcceleratorProbe(boolean acceleratorProbe) { this.acceleratorProbe = acceleratorProbe; }

        public String getNvidiaSmiCommand() { return nvidiaSmiCommand; }
        public void setNvidiaSmiCommand(String nvidiaSmiCommand) { this.nvidiaSmiCommand = nvidiaSmiCommand; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }
    }

    /**
     * Lifecycle operation timeouts and worker pool.
     */
    public static class LifecycleConfig {
        private long downloadTimeoutMs = 3_600_000;
        private long loadTimeoutMs = 600_000;
        private long unloadTimeoutMs = 60_000;
        private int workerThreads = 4;

        public long getDownloadTimeoutMs() { return downloadTimeoutMs; }
        public void setDownloadTimeoutMs(long downloadTimeoutMs) { this.downloadTimeoutMs = downloadTimeoutMs; }

        public long getLoadTimeoutMs() { return loadTimeoutMs; }
        public void setLoadTimeoutMs(long loadTimeoutMs) { this.loadTimeoutMs = loadTimeoutMs; }

        public long getUnloadTimeoutMs() { return unloadTimeoutMs; }
        public void setUnloadTimeoutMs(long unloadTimeoutMs) { this.unloadTimeoutMs = unloadTimeoutMs; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Health check thresholds. Percentages are 0-100.
     */
    public static class HealthConfig {
        private int historySize = 100;

        private double cpuWarningPercent = 75;
        private double cpuCriticalPercent = 90;
        private double memoryWarningPercent = 80;
        private double memoryCriticalPercent = 90;
        private double diskWarningPercent = 85;
        private double diskCriticalPercent = 95;
        private int processCountWarning = 1000;

        private double temperatureWarningCelsius = 80;
        private double memoryPressurePercent = 85;
        private double diskPerformancePercent = 90;
        private double acceleratorMemoryPercent = 90;
        private double cpuTrendWarningPercent = 20;
        private int trendWindow = 10;

        private long responseTimeWarningMs = 1000;
        private long serviceMemoryWarningMb = 1024;

        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }

        public double getCpuWarningPercent() { return cpuWarningPercent; }
        public void setCpuWarningPercent(double v) { this.cpuWarningPercent = v; }

        public double getCpuCriticalPercent() { return cpuCriticalPercent; }
        public void setCpuCriticalPercent(double v) { this.cpuCriticalPercent = v; }

        public double getMemoryWarningPercent() { return memoryWarningPercent; }
        public void setMemoryWarningPercent(double v) { this.memoryWarningPercent = v; }

        public double getMemoryCriticalPercent() { return memoryCriticalPercent; }
        public void setMemoryCriticalPercent(double v) { this.memoryCriticalPercent = v; }

        public double getDiskWarningPercent() { return diskWarningPercent; }
        public void setDiskWarningPercent(double v) { this.diskWarningPercent = v; }

        public double getDiskCriticalPercent() { return diskCriticalPercent; }
        public void setDiskCriticalPercent(double v) { this.diskCriticalPercent = v; }

        public int getProcessCountWarning() { return processCountWarning; }
        public void setProcessCountWarning(int v) { this.processCountWarning = v; }

        public double getTemperatureWarningCelsius() { return temperatureWarningCelsius; }
        public void setTemperatureWarningCelsius(double v) { this.temperatureWarningCelsius = v; }

        public double getMemoryPressurePercent() { return memoryPressurePercent; }
        public void setMemoryPressurePercent(double v) { this.memoryPressurePercent = v; }

        public double getDiskPerformancePercent() { return diskPerformancePercent; }
        public void setDiskPerformancePercent(double v) { this.diskPerformancePercent = v; }

        public double getAcceleratorMemoryPercent() { return acceleratorMemoryPercent; }
        public void setAcceleratorMemoryPercent(double v) { this.acceleratorMemoryPercent = v; }

        public double getCpuTrendWarningPercent() { return cpuTrendWarningPercent; }
        public void setCpuTrendWarningPercent(double v) { this.cpuTrendWarningPercent = v; }

        public int getTrendWindow() { return trendWindow; }
        public void setTrendWindow(int trendWindow) { this.trendWindow = trendWindow; }

        public long getResponseTimeWarningMs() { return responseTimeWarningMs; }
        public void setResponseTimeWarningMs(long v) { this.responseTimeWarningMs = v; }

        public long getServiceMemoryWarningMb() { return serviceMemoryWarningMb; }
        public void setServiceMemoryWarningMb(long v) { this.serviceMemoryWarningMb = v; }
    }

    /**
     * Model backend connection.
     */
    public static class BackendConfig {
        private String type = "ollama";
        private String url = "http://localhost:11434";
        private long connectTimeoutMs = 10_000;
        private long requestTimeoutMs = 600_000;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * LMAX Disruptor configuration for the telemetry hand-off ring.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 256;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "model_host";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
