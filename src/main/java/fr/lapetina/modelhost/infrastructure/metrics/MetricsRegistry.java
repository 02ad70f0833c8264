package fr.lapetina.modelhost.infrastructure.metrics;

import fr.lapetina.modelhost.domain.health.Severity;
import fr.lapetina.modelhost.domain.model.LifecycleResult;
import fr.lapetina.modelhost.domain.model.MetricSample;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Lifecycle operation latency and outcome counters per resource
 * - Loaded resource gauge
 * - Latest host telemetry gauges
 * - Health severity gauge
 * - JVM metrics and Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> operationTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> operationCounters = new ConcurrentHashMap<>();

    private final DoubleHolder cpuPercent = new DoubleHolder();
    private final DoubleHolder memoryPercent = new DoubleHolder();
    private final DoubleHolder diskPercent = new DoubleHolder();
    private final AtomicInteger acceleratorCount = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);
    private final AtomicInteger healthSeverity = new AtomicInteger(0);

    private final Counter samplesRecorded;
    private final Counter samplesDropped;
    private final Timer healthCheckTimer;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_host_cpu_percent", cpuPercent, DoubleHolder::get)
                .description("Host CPU utilization from the latest sample")
                .register(registry);
        Gauge.builder(prefix + "_host_memory_percent", memoryPercent, DoubleHolder::get)
                .description("Host memory utilization from the latest sample")
                .register(registry);
        Gauge.builder(prefix + "_host_disk_percent", diskPercent, DoubleHolder::get)
                .description("Disk utilization from the latest sample")
                .register(registry);
        Gauge.builder(prefix + "_accelerators", acceleratorCount, AtomicInteger::get)
                .description("Accelerators visible in the latest sample")
                .register(registry);
        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the telemetry ring buffer")
                .register(registry);
        Gauge.builder(prefix + "_health_severity", healthSeverity, AtomicInteger::get)
                .description("Overall health (0=healthy, 1=not_available, 2=warning, 3=error, 4=critical)")
                .register(registry);

        samplesRecorded = Counter.builder(prefix + "_telemetry_samples_total")
                .description("Telemetry samples appended to the store")
                .register(registry);
        samplesDropped = Counter.builder(prefix + "_telemetry_samples_dropped_total")
                .description("Telemetry samples dropped because the ring buffer was full")
                .register(registry);
        healthCheckTimer = Timer.builder(prefix + "_health_check_duration")
                .description("Time to run all health checks")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("model_host");
    }

    /**
     * Records the outcome and duration of a lifecycle operation.
     */
    public void recordOperation(LifecycleResult result) {
        String operation = result.operation().name().toLowerCase(java.util.Locale.ROOT);
        String outcome = result.success() ? "success" : result.errorType().name();
        String resource = result.resourceId();

        operationCounters.computeIfAbsent(operation + ":" + resource + ":" + outcome, k ->
                Counter.builder(prefix + "_lifecycle_operations_total")
                        .description("Lifecycle operations by outcome")
                        .tag("operation", operation)
                        .tag("resource", resource)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        operationTimers.computeIfAbsent(operation + ":" + resource, k ->
                Timer.builder(prefix + "_lifecycle_duration")
                        .description("Lifecycle operation duration")
                        .tag("operation", operation)
                        .tag("resource", resource)
                        .publishPercentiles(0.5, 0.95)
                        .register(registry)
        ).record(result.elapsed());
    }

    /**
     * Registers a gauge for the number of loaded resources.
     */
    public void registerLoadedResources(Supplier<Number> loadedCount) {
        Gauge.builder(prefix + "_loaded_resources", loadedCount, s -> s.get().doubleValue())
                .description("Resources currently materialized")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Updates host gauges from a telemetry sample.
     */
    public void recordSample(MetricSample sample) {
        cpuPercent.set(sample.cpuPercent());
        memoryPercent.set(sample.memoryPercent());
        diskPercent.set(sample.diskPercent());
        acceleratorCount.set(sample.accelerators().size());
        samplesRecorded.increment();
    }

    public void incrementSamplesDropped() {
        samplesDropped.increment();
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    public void recordHealth(Severity severity, Duration checkDuration) {
        healthSeverity.set(severity.priority());
        healthCheckTimer.record(checkDuration);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }

    private static final class DoubleHolder {
        private volatile double value;

        double get() {
            return value;
        }

        void set(double value) {
            this.value = value;
        }
    }
}
