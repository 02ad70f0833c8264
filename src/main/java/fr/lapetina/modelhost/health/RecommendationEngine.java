package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;
import fr.lapetina.modelhost.domain.health.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives actionable suggestions from the sub-reports by matching keywords
 * in their issues. Stateless.
 */
public final class RecommendationEngine {

    static final String OPTIMAL = "System is running optimally. Continue regular monitoring.";
    static final String AUTOMATE = "Consider setting up automated health checks for early issue detection.";

    public List<String> recommend(Map<HealthCategory, HealthReport> reports) {
        List<String> recommendations = new ArrayList<>();

        HealthReport system = reports.get(HealthCategory.SYSTEM);
        if (isDegraded(system)) {
            if (system.hasIssueContaining("CPU")) {
                recommendations.add("Consider closing unnecessary applications or processes to reduce CPU usage");
            }
            if (system.hasIssueContaining("memory")) {
                recommendations.add("Free up memory by closing unused applications or increasing system RAM");
            }
            if (system.hasIssueContaining("disk")) {
                recommendations.add("Clean up disk space or consider expanding storage capacity");
            }
        }

        HealthReport resources = reports.get(HealthCategory.RESOURCES);
        if (isDegraded(resources)) {
            if (resources.hasIssueContaining("No resources loaded")
                    || resources.hasIssueContaining("Less than 50%")) {
                recommendations.add("Download and load more models to improve service capabilities");
            }
            recommendations.add("Check model logs for errors and consider reloading problematic models");
        }

        HealthReport telemetry = reports.get(HealthCategory.TELEMETRY);
        if (telemetry != null && telemetry.severity() == Severity.WARNING) {
            recommendations.add("Optimize system performance by addressing resource bottlenecks");
            if (telemetry.hasIssueContaining("temperature")) {
                recommendations.add("Improve system cooling to reduce CPU temperature");
            }
        }

        HealthReport service = reports.get(HealthCategory.SERVICE);
        if (service != null && service.severity() == Severity.WARNING) {
            if (service.hasIssueContaining("memory")) {
                recommendations.add("Restart the model host service to free up memory");
            }
            if (service.hasIssueContaining("response")) {
                recommendations.add("Check system resources and network connectivity");
            }
        }

        if (reports.size() == HealthCategory.values().length
                && reports.values().stream().allMatch(r -> r.severity() == Severity.HEALTHY)) {
            recommendations.add(OPTIMAL);
            recommendations.add(AUTOMATE);
        }
        return recommendations;
    }

    private static boolean isDegraded(HealthReport report) {
        return report != null
                && (report.severity() == Severity.WARNING || report.severity() == Severity.CRITICAL);
    }
}
