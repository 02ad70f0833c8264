package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;
import fr.lapetina.modelhost.domain.health.Severity;
import fr.lapetina.modelhost.lifecycle.LifecycleManager;
import fr.lapetina.modelhost.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Supplier;

/**
 * Checks the service itself: responsiveness of its own components, its
 * resident memory and thread count.
 *
 * A missing component is a WARNING here, not NOT_AVAILABLE: the service is
 * running but partially wired.
 */
public final class ServiceSelfCheck implements HealthCheck {

    private static final Logger log = LoggerFactory.getLogger(ServiceSelfCheck.class);

    private final LifecycleManager lifecycleManager;
    private final TelemetryStore store;
    private final Supplier<HealthThresholds> thresholds;
    private final Path processStatus;

    public ServiceSelfCheck(LifecycleManager lifecycleManager, TelemetryStore store,
                            Supplier<HealthThresholds> thresholds) {
        this(lifecycleManager, store, thresholds, Paths.get("/proc/self/status"));
    }

    ServiceSelfCheck(LifecycleManager lifecycleManager, TelemetryStore store,
                     Supplier<HealthThresholds> thresholds, Path processStatus) {
        this.lifecycleManager = lifecycleManager;
        this.store = store;
        this.thresholds = thresholds;
        this.processStatus = processStatus;
    }

    @Override
    public HealthCategory category() {
        return HealthCategory.SERVICE;
    }

    @Override
    public HealthReport check() {
        HealthThresholds limits = thresholds.get();
        HealthReport.Builder report = HealthReport.builder();

        long start = System.nanoTime();
        if (lifecycleManager != null) {
            lifecycleManager.list();
        } else {
            report.escalate(Severity.WARNING, "Lifecycle manager not available");
        }
        if (store != null) {
            store.history(1);
        } else {
            report.escalate(Severity.WARNING, "Telemetry not available");
        }
        double responseTimeMs = (System.nanoTime() - start) / 1_000_000.0;

        if (responseTimeMs > limits.responseTimeWarningMs()) {
            report.escalate(Severity.WARNING, String.format("Slow response time: %.2fms", responseTimeMs));
        }

        double memoryMb = residentMemoryMb();
        if (memoryMb > limits.serviceMemoryWarningMb()) {
            report.escalate(Severity.WARNING, String.format("High memory usage: %.2f MB", memoryMb));
        }

        return report
                .detail("response_time_ms", responseTimeMs)
                .detail("memory_usage_mb", memoryMb)
                .detail("thread_count", ManagementFactory.getThreadMXBean().getThreadCount())
                .build();
    }

    /**
     * Resident set size from the process status file, or used heap when it
     * cannot be read.
     */
    double residentMemoryMb() {
        try {
            List<String> lines = Files.readAllLines(processStatus);
            for (String line : lines) {
                if (line.startsWith("VmRSS:")) {
                    String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
                    return Long.parseLong(parts[0]) / 1024.0;
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Process status unreadable, using heap usage: {}", e.getMessage());
        }
        Runtime runtime = Runtime.getRuntime();
        return (runtime.totalMemory() - runtime.freeMemory()) / (1024.0 * 1024.0);
    }
}
