package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;
import fr.lapetina.modelhost.domain.health.Severity;
import fr.lapetina.modelhost.domain.model.MetricSample;
import fr.lapetina.modelhost.telemetry.MetricSource;

import java.util.function.Supplier;

/**
 * CPU, memory, disk and process count of a fresh sample against the
 * configured thresholds. Every breach is listed; the worst one sets the severity.
 */
public final class SystemResourceCheck implements HealthCheck {

    private final MetricSource source;
    private final Supplier<HealthThresholds> thresholds;

    public SystemResourceCheck(MetricSource source, Supplier<HealthThresholds> thresholds) {
        this.source = source;
        this.thresholds = thresholds;
    }

    @Override
    public HealthCategory category() {
        return HealthCategory.SYSTEM;
    }

    @Override
    public HealthReport check() {
        HealthThresholds limits = thresholds.get();
        MetricSample sample = source.collect();
        HealthReport.Builder report = HealthReport.builder();

        grade(report, "CPU", sample.cpuPercent(), limits.cpuWarningPercent(), limits.cpuCriticalPercent());
        grade(report, "memory", sample.memoryPercent(), limits.memoryWarningPercent(), limits.memoryCriticalPercent());
        grade(report, "disk", sample.diskPercent(), limits.diskWarningPercent(), limits.diskCriticalPercent());

        if (sample.processCount() > limits.processCountWarning()) {
            report.escalate(Severity.WARNING, "High process count: " + sample.processCount());
        }

        return report
                .detail("cpu_percent", sample.cpuPercent())
                .detail("memory_percent", sample.memoryPercent())
                .detail("disk_percent", sample.diskPercent())
                .detail("process_count", sample.processCount())
                .detail("uptime_hours", sample.uptime().toSeconds() / 3600.0)
                .build();
    }

    private static void grade(HealthReport.Builder report, String resource, double value,
                              double warning, double critical) {
        if (value > critical) {
            report.escalate(Severity.CRITICAL, String.format("Critical %s usage: %.1f%%", resource, value));
        } else if (value > warning) {
            report.escalate(Severity.WARNING, String.format("High %s usage: %.1f%%", resource, value));
        }
    }
}
