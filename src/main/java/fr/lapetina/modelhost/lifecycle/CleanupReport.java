package fr.lapetina.modelhost.lifecycle;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link LifecycleManager#cleanupAll()}.
 *
 * @param unloaded ids released successfully
 * @param failures id to error message for releases that failed
 */
public record CleanupReport(List<String> unloaded, Map<String, String> failures) {

    public CleanupReport {
        unloaded = List.copyOf(unloaded);
        failures = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean isClean() {
        return failures.isEmpty();
    }
}
