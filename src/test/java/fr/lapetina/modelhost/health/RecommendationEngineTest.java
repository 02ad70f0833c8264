package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;
import fr.lapetina.modelhost.domain.health.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine();

    private static HealthReport report(Severity severity, String... issues) {
        return new HealthReport(severity, List.of(issues), null);
    }

    private static Map<HealthCategory, HealthReport> healthyReports() {
        Map<HealthCategory, HealthReport> reports = new EnumMap<>(HealthCategory.class);
        for (HealthCategory category : HealthCategory.values()) {
            reports.put(category, report(Severity.HEALTHY));
        }
        return reports;
    }

    @Test
    @DisplayName("should suggest routine monitoring when everything is healthy")
    void shouldSuggestMonitoring() {
        assertThat(engine.recommend(healthyReports()))
                .containsExactly(RecommendationEngine.OPTIMAL, RecommendationEngine.AUTOMATE);
    }

    @Test
    @DisplayName("should not claim optimal health when a category is missing")
    void shouldNotClaimOptimalWithMissingCategory() {
        Map<HealthCategory, HealthReport> reports = healthyReports();
        reports.remove(HealthCategory.SERVICE);

        assertThat(engine.recommend(reports)).isEmpty();
    }

    @Test
    @DisplayName("should map system issues to targeted suggestions")
    void shouldMapSystemIssues() {
        Map<HealthCategory, HealthReport> reports = healthyReports();
        reports.put(HealthCategory.SYSTEM, report(Severity.CRITICAL,
                "Critical CPU usage: 97.0%", "High memory usage: 85.0%", "High disk usage: 90.0%"));

        assertThat(engine.recommend(reports)).containsExactly(
                "Consider closing unnecessary applications or processes to reduce CPU usage",
                "Free up memory by closing unused applications or increasing system RAM",
                "Clean up disk space or consider expanding storage capacity");
    }

    @Test
    @DisplayName("should suggest loading models when few are loaded")
    void shouldSuggestLoadingModels() {
        Map<HealthCategory, HealthReport> reports = healthyReports();
        reports.put(HealthCategory.RESOURCES, report(Severity.CRITICAL, "No resources loaded (0 of 2)"));

        assertThat(engine.recommend(reports)).containsExactly(
                "Download and load more models to improve service capabilities",
                "Check model logs for errors and consider reloading problematic models");
    }

    @Test
    @DisplayName("should suggest cooling on a temperature warning")
    void shouldSuggestCooling() {
        Map<HealthCategory, HealthReport> reports = healthyReports();
        reports.put(HealthCategory.TELEMETRY, report(Severity.WARNING, "High CPU temperature: 85.0°C"));
        reports.put(HealthCategory.SERVICE, report(Severity.WARNING,
                "High memory usage: 2048.00 MB", "Slow response time: 1500.00ms"));

        assertThat(engine.recommend(reports)).containsExactly(
                "Optimize system performance by addressing resource bottlenecks",
                "Improve system cooling to reduce CPU temperature",
                "Restart the model host service to free up memory",
                "Check system resources and network connectivity");
    }

    @Test
    @DisplayName("should ignore NOT_AVAILABLE and ERROR reports")
    void shouldIgnoreNonActionableReports() {
        Map<HealthCategory, HealthReport> reports = healthyReports();
        reports.put(HealthCategory.RESOURCES, report(Severity.NOT_AVAILABLE, "No resources registered"));
        reports.put(HealthCategory.TELEMETRY, report(Severity.ERROR, "Telemetry health check failed: boom"));

        assertThat(engine.recommend(reports)).isEmpty();
    }
}
