package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;
import fr.lapetina.modelhost.domain.health.Severity;
import fr.lapetina.modelhost.domain.model.AcceleratorMetrics;
import fr.lapetina.modelhost.domain.model.MetricSample;
import fr.lapetina.modelhost.telemetry.MetricSource;
import fr.lapetina.modelhost.telemetry.MetricTrend;
import fr.lapetina.modelhost.telemetry.TelemetryStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Performance signals from the recorded telemetry: temperature, memory
 * pressure, disk saturation, accelerator memory and a rising CPU trend.
 * All findings are WARNING.
 *
 * Uses the most recent recorded sample and falls back to a fresh reading
 * while the history is still empty.
 */
public final class TelemetryHealthCheck implements HealthCheck {

    private final TelemetryStore store;
    private final MetricSource source;
    private final Supplier<HealthThresholds> thresholds;

    /**
     * @param store  recorded history, may be null
     * @param source fresh readings, may be null
     */
    public TelemetryHealthCheck(TelemetryStore store, MetricSource source, Supplier<HealthThresholds> thresholds) {
        this.store = store;
        this.source = source;
        this.thresholds = thresholds;
    }

    @Override
    public HealthCategory category() {
        return HealthCategory.TELEMETRY;
    }

    @Override
    public HealthReport check() {
        Optional<MetricSample> current = currentSample();
        if (current.isEmpty()) {
            return HealthReport.notAvailable("Telemetry not available");
        }

        HealthThresholds limits = thresholds.get();
        MetricSample sample = current.get();
        HealthReport.Builder report = HealthReport.builder();

        OptionalDouble temperature = sample.cpuTemperature();
        if (temperature.isPresent() && temperature.getAsDouble() > limits.temperatureWarningCelsius()) {
            report.escalate(Severity.WARNING,
                    String.format("High CPU temperature: %.1f°C", temperature.getAsDouble()));
        }
        if (sample.memoryPercent() > limits.memoryPressurePercent()) {
            report.escalate(Severity.WARNING, "High memory pressure");
        }
        if (sample.diskPercent() > limits.diskPerformancePercent()) {
            report.escalate(Severity.WARNING, "High disk usage affecting performance");
        }
        for (AcceleratorMetrics accelerator : sample.accelerators()) {
            if (accelerator.memoryPercent() > limits.acceleratorMemoryPercent()) {
                report.escalate(Severity.WARNING, String.format(
                        "High accelerator memory usage on device %d: %.1f%%",
                        accelerator.id(), accelerator.memoryPercent()));
            }
        }

        Optional<MetricTrend> trend = store != null ? store.trend(limits.trendWindow()) : Optional.empty();
        trend.filter(t -> t.isCpuRisingBy(limits.cpuTrendWarningPercent()))
                .ifPresent(t -> report.escalate(Severity.WARNING, String.format(
                        "Rising CPU trend: +%.1f points over %d samples", t.cpuDelta(), t.sampleCount())));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("cpu_percent", sample.cpuPercent());
        metrics.put("memory_percent", sample.memoryPercent());
        metrics.put("disk_percent", sample.diskPercent());
        metrics.put("cpu_temperature_celsius", sample.cpuTemperatureCelsius());
        metrics.put("accelerator_count", sample.accelerators().size());
        report.detail("current_metrics", metrics);
        trend.ifPresent(t -> report.detail("trend", t));
        return report.build();
    }

    private Optional<MetricSample> currentSample() {
        Optional<MetricSample> latest = store != null ? store.latest() : Optional.empty();
        if (latest.isPresent() || source == null) {
            return latest;
        }
        return Optional.of(source.collect());
    }
}
