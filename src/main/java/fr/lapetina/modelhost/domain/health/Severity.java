package fr.lapetina.modelhost.domain.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

/**
 * Health severity, totally ordered for aggregation:
 * HEALTHY(0) &lt; NOT_AVAILABLE(1) &lt; WARNING(2) &lt; ERROR(3) &lt; CRITICAL(4).
 *
 * Declaration order is the aggregation order; do not reorder.
 */
public enum Severity {
    HEALTHY,
    NOT_AVAILABLE,
    WARNING,
    ERROR,
    CRITICAL;

    public int priority() {
        return ordinal();
    }

    public boolean isWorseThan(Severity other) {
        return compareTo(other) > 0;
    }

    public Severity max(Severity other) {
        return other != null && other.isWorseThan(this) ? other : this;
    }

    public static Severity max(Collection<Severity> severities) {
        Severity worst = HEALTHY;
        for (Severity severity : severities) {
            worst = worst.max(severity);
        }
        return worst;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
