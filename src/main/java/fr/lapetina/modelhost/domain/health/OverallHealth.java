package fr.lapetina.modelhost.domain.health;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated health: the worst severity across all sub-reports plus
 * generated recommendations. Immutable.
 *
 * @param status          maximum severity across {@code reports}
 * @param timestamp       when the aggregation ran
 * @param uptime          host uptime (JVM uptime when boot time is unknown)
 * @param reports         sub-reports keyed by category, verbatim
 * @param recommendations actionable suggestions derived from the reports
 * @param error           set only when the aggregation pipeline itself failed
 */
public record OverallHealth(
        Severity status,
        Instant timestamp,
        Duration uptime,
        Map<HealthCategory, HealthReport> reports,
        List<String> recommendations,
        String error
) {
    public OverallHealth {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(timestamp, "Timestamp is required");
        if (uptime == null) {
            uptime = Duration.ZERO;
        }
        reports = reports == null || reports.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(reports));
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public HealthReport report(HealthCategory category) {
        return reports.get(category);
    }

    public boolean isDegraded() {
        return error != null;
    }

    /**
     * Result used when aggregation itself throws.
     */
    public static OverallHealth failed(Instant timestamp, Duration uptime, String error) {
        return new OverallHealth(Severity.ERROR, timestamp, uptime, Map.of(), List.of(), error);
    }
}
