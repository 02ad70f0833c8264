package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;
import fr.lapetina.modelhost.domain.health.OverallHealth;
import fr.lapetina.modelhost.domain.health.Severity;
import fr.lapetina.modelhost.domain.model.MetricSample;
import fr.lapetina.modelhost.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modelhost.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the health checks on demand and folds them into one {@link OverallHealth}.
 *
 * The overall status is the worst sub-report severity. A check that throws
 * becomes an ERROR report; a failure of the aggregation itself becomes an
 * ERROR result. {@link #checkHealth()} never throws.
 *
 * Results are kept in a bounded history, oldest evicted first.
 */
public final class HealthAggregator {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private final Map<HealthCategory, HealthCheck> checks = new EnumMap<>(HealthCategory.class);
    private final RecommendationEngine recommendations;
    private final Supplier<Duration> uptime;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final int historySize;
    private final Deque<OverallHealth> history = new ArrayDeque<>();

    public HealthAggregator(
            Collection<? extends HealthCheck> checks,
            RecommendationEngine recommendations,
            Supplier<Duration> uptime,
            MetricsRegistry metricsRegistry,
            int historySize,
            Clock clock
    ) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("History size must be positive: " + historySize);
        }
        for (HealthCheck check : checks) {
            if (this.checks.putIfAbsent(check.category(), check) != null) {
                throw new IllegalArgumentException("Duplicate health check for " + check.category());
            }
        }
        this.recommendations = recommendations;
        this.uptime = uptime;
        this.metricsRegistry = metricsRegistry;
        this.historySize = historySize;
        this.clock = clock;
    }

    public HealthAggregator(Collection<? extends HealthCheck> checks, TelemetryStore store,
                            MetricsRegistry metricsRegistry, int historySize) {
        this(checks, new RecommendationEngine(), uptimeFrom(store), metricsRegistry, historySize,
                Clock.systemUTC());
    }

    /**
     * Runs every check and records the aggregated result.
     */
    public OverallHealth checkHealth() {
        long start = System.nanoTime();
        Instant now = clock.instant();
        OverallHealth result;
        try {
            Map<HealthCategory, HealthReport> reports = new EnumMap<>(HealthCategory.class);
            for (HealthCategory category : checks.keySet()) {
                reports.put(category, runCheck(category));
            }
            Severity status = Severity.max(reports.values().stream().map(HealthReport::severity).toList());
            result = new OverallHealth(status, now, safeUptime(), reports,
                    recommendations.recommend(reports), null);
        } catch (RuntimeException e) {
            log.error("Health aggregation failed", e);
            result = OverallHealth.failed(now, safeUptime(), "Health check failed: " + describe(e));
        }

        append(result);
        if (metricsRegistry != null) {
            metricsRegistry.recordHealth(result.status(), Duration.ofNanos(System.nanoTime() - start));
        }
        if (result.status().isWorseThan(Severity.NOT_AVAILABLE)) {
            log.warn("Health status: {}", result.status().value());
        } else {
            log.debug("Health status: {}", result.status().value());
        }
        return result;
    }

    /**
     * Runs a single check. Failures are returned as an ERROR report.
     *
     * @throws IllegalArgumentException if no check is registered for the category
     */
    public HealthReport runCheck(HealthCategory category) {
        HealthCheck check = checks.get(category);
        if (check == null) {
            throw new IllegalArgumentException("No health check registered for " + category);
        }
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("Health check {} failed", category, e);
            return HealthReport.error(label(category) + " health check failed: " + describe(e));
        }
    }

    /**
     * Most recent results, newest last. A limit of zero or less returns all.
     */
    public synchronized List<OverallHealth> history(int limit) {
        List<OverallHealth> all = new ArrayList<>(history);
        if (limit <= 0 || limit >= all.size()) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - limit, all.size()));
    }

    public synchronized int historySize() {
        return history.size();
    }

    public Collection<HealthCategory> categories() {
        return checks.keySet();
    }

    private synchronized void append(OverallHealth result) {
        history.addLast(result);
        Iterator<OverallHealth> oldest = history.iterator();
        while (history.size() > historySize && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    private Duration safeUptime() {
        try {
            return uptime.get();
        } catch (RuntimeException e) {
            log.debug("Uptime unavailable: {}", e.getMessage());
            return jvmUptime();
        }
    }

    /**
     * Host uptime from the most recent sample, or JVM uptime when the boot
     * time is unknown.
     */
    public static Supplier<Duration> uptimeFrom(TelemetryStore store) {
        return () -> {
            if (store == null) {
                return jvmUptime();
            }
            return store.latest()
                    .map(MetricSample::uptime)
                    .filter(d -> !d.isZero())
                    .orElseGet(HealthAggregator::jvmUptime);
        };
    }

    private static Duration jvmUptime() {
        return Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
    }

    private static String label(HealthCategory category) {
        return switch (category) {
            case SYSTEM -> "System";
            case RESOURCES -> "Resource";
            case TELEMETRY -> "Telemetry";
            case SERVICE -> "Service";
        };
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
