package fr.lapetina.modelhost.api.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;
import fr.lapetina.modelhost.domain.health.OverallHealth;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated health as returned over HTTP. Each sub-report appears under
 * its category key, e.g. {@code system_health}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {

    private final String status;
    private final Instant timestamp;
    private final double uptimeSeconds;
    private final Map<String, Report> reports;
    private final List<String> recommendations;
    private final String error;

    private HealthResponse(String status, Instant timestamp, double uptimeSeconds,
                           Map<String, Report> reports, List<String> recommendations, String error) {
        this.status = status;
        this.timestamp = timestamp;
        this.uptimeSeconds = uptimeSeconds;
        this.reports = reports;
        this.recommendations = recommendations;
        this.error = error;
    }

    public String getStatus() { return status; }

    public Instant getTimestamp() { return timestamp; }

    @JsonProperty("uptime_seconds")
    public double getUptimeSeconds() { return uptimeSeconds; }

    @JsonAnyGetter
    public Map<String, Report> getReports() { return reports; }

    public List<String> getRecommendations() { return recommendations; }

    public String getError() { return error; }

    public static HealthResponse from(OverallHealth health) {
        Map<String, Report> reports = new LinkedHashMap<>();
        for (HealthCategory category : HealthCategory.values()) {
            HealthReport report = health.report(category);
            if (report != null) {
                reports.put(category.reportKey(), Report.from(report));
            }
        }
        return new HealthResponse(
                health.status().value(),
                health.timestamp(),
                health.uptime().toMillis() / 1000.0,
                reports,
                health.recommendations(),
                health.error()
        );
    }

    /**
     * One sub-report.
     */
    public record Report(String status, List<String> issues, Map<String, Object> details) {

        public static Report from(HealthReport report) {
            return new Report(report.severity().value(), report.issues(), report.details());
        }
    }
}
