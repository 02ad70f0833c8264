package fr.lapetina.modelhost.health;

import fr.lapetina.modelhost.domain.health.HealthCategory;
import fr.lapetina.modelhost.domain.health.HealthReport;
import fr.lapetina.modelhost.domain.health.Severity;
import fr.lapetina.modelhost.domain.model.ResourcePhase;
import fr.lapetina.modelhost.domain.model.ResourceSnapshot;
import fr.lapetina.modelhost.lifecycle.LifecycleManager;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grades the catalog by how many resources are loaded.
 *
 * <ul>
 *   <li>no registered resources: NOT_AVAILABLE</li>
 *   <li>none loaded: CRITICAL</li>
 *   <li>fewer than half loaded: WARNING</li>
 * </ul>
 * A resource whose last operation failed adds a WARNING issue.
 */
public final class LifecycleHealthCheck implements HealthCheck {

    private final LifecycleManager lifecycleManager;

    /**
     * @param lifecycleManager may be null, in which case the check reports NOT_AVAILABLE
     */
    public LifecycleHealthCheck(LifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    @Override
    public HealthCategory category() {
        return HealthCategory.RESOURCES;
    }

    @Override
    public HealthReport check() {
        if (lifecycleManager == null) {
            return HealthReport.notAvailable("Lifecycle manager not available");
        }

        List<ResourceSnapshot> resources = lifecycleManager.list();
        HealthReport.Builder report = HealthReport.builder();
        Map<String, Object> perResource = new LinkedHashMap<>();
        int loaded = 0;

        for (ResourceSnapshot resource : resources) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", resource.status());
            entry.put("name", resource.name());
            entry.put("size", resource.sizeClass());
            entry.put("capabilities", List.copyOf(resource.capabilities()));
            perResource.put(resource.id(), entry);

            if (resource.loaded()) {
                loaded++;
            }
            if (resource.isInError()) {
                report.escalate(Severity.WARNING,
                        "Resource " + resource.id() + " in error state: " + resource.lastError());
            } else if (resource.phase() == ResourcePhase.NOT_DOWNLOADED) {
                report.note("Resource " + resource.id() + " not downloaded");
            }
        }

        int total = resources.size();
        double loadedPercent = total > 0 ? (loaded * 100.0) / total : 0.0;

        if (total == 0) {
            report.severity(Severity.NOT_AVAILABLE).note("No resources registered");
        } else if (loaded == 0) {
            report.escalate(Severity.CRITICAL, "No resources loaded (0 of " + total + ")");
        } else if (loaded * 2 < total) {
            report.escalate(Severity.WARNING,
                    "Less than 50% of resources are loaded (" + loaded + " of " + total + ")");
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_resources", total);
        summary.put("loaded_resources", loaded);
        summary.put("health_percentage", loadedPercent);

        return report
                .detail("resources", perResource)
                .detail("summary", summary)
                .build();
    }
}
