package fr.lapetina.modelhost.domain.health;

import java.util.Locale;
import java.util.Optional;

/**
 * The four independent sub-checks folded into an overall health status.
 */
public enum HealthCategory {
    SYSTEM("system_health"),
    RESOURCES("resource_health"),
    TELEMETRY("telemetry_health"),
    SERVICE("service_health");

    private final String reportKey;

    HealthCategory(String reportKey) {
        this.reportKey = reportKey;
    }

    /**
     * Key under which this category's report appears in the health response.
     */
    public String reportKey() {
        return reportKey;
    }

    /**
     * Resolves a category from a path segment. "models" and "performance" are
     * accepted as aliases of RESOURCES and TELEMETRY.
     */
    public static Optional<HealthCategory> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "system" -> Optional.of(SYSTEM);
            case "resources", "models" -> Optional.of(RESOURCES);
            case "telemetry", "performance" -> Optional.of(TELEMETRY);
            case "service" -> Optional.of(SERVICE);
            default -> Optional.empty();
        };
    }
}
