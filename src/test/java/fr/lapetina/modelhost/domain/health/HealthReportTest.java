package fr.lapetina.modelhost.domain.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HealthReportTest {

    @Test
    @DisplayName("should keep the highest severity while collecting issues")
    void shouldKeepHighestSeverity() {
        HealthReport report = HealthReport.builder()
                .escalate(Severity.CRITICAL, "Critical CPU usage: 97.0%")
                .escalate(Severity.WARNING, "High memory usage: 86.0%")
                .note("Resource r not downloaded")
                .build();

        assertThat(report.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(report.issues()).hasSize(3);
        assertThat(report.hasIssueContaining("cpu")).isTrue();
        assertThat(report.hasIssueContaining("disk")).isFalse();
    }

    @Test
    @DisplayName("should resolve categories by name and alias")
    void shouldResolveCategories() {
        assertThat(HealthCategory.fromName("system")).contains(HealthCategory.SYSTEM);
        assertThat(HealthCategory.fromName("Models")).contains(HealthCategory.RESOURCES);
        assertThat(HealthCategory.fromName("performance")).contains(HealthCategory.TELEMETRY);
        assertThat(HealthCategory.fromName("bogus")).isEmpty();
        assertThat(HealthCategory.SERVICE.reportKey()).isEqualTo("service_health");
    }
}
