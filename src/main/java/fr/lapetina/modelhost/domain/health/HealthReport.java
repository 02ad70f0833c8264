package fr.lapetina.modelhost.domain.health;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one health sub-check.
 *
 * The details map is opaque to the aggregator; it is rendered as-is.
 */
public record HealthReport(
        Severity severity,
        List<String> issues,
        Map<String, Object> details
) {
    public HealthReport {
        Objects.requireNonNull(severity, "Severity is required");
        issues = issues != null ? List.copyOf(issues) : List.of();
        details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
    }

    public boolean hasIssueContaining(String keyword) {
        String needle = keyword.toLowerCase(Locale.ROOT);
        return issues.stream().anyMatch(issue -> issue.toLowerCase(Locale.ROOT).contains(needle));
    }

    public static HealthReport healthy(Map<String, Object> details) {
        return new HealthReport(Severity.HEALTHY, List.of(), details);
    }

    public static HealthReport notAvailable(String issue) {
        return new HealthReport(Severity.NOT_AVAILABLE, List.of(issue), Map.of());
    }

    /**
     * Report for a check that itself failed.
     */
    public static HealthReport error(String issue) {
        return new HealthReport(Severity.ERROR, List.of(issue), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates issues while keeping the highest severity seen.
     */
    public static final class Builder {
        private Severity severity = Severity.HEALTHY;
        private final List<String> issues = new ArrayList<>();
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Builder escalate(Severity candidate, String issue) {
            severity = severity.max(candidate);
            if (issue != null) {
                issues.add(issue);
            }
            return this;
        }

        /**
         * Records an issue without changing the severity.
         */
        public Builder note(String issue) {
            issues.add(issue);
            return this;
        }

        /**
         * Forces the severity, regardless of what was accumulated so far.
         */
        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder detail(String key, Object value) {
            details.put(key, value);
            return this;
        }

        public Severity currentSeverity() {
            return severity;
        }

        public HealthReport build() {
            return new HealthReport(severity, issues, details);
        }
    }
}
