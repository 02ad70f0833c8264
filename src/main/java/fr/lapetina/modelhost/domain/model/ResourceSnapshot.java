package fr.lapetina.modelhost.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only view of a resource combining catalog metadata and runtime state.
 * This is what listings, health checks and the HTTP layer see; it never
 * carries the backend handle.
 */
public record ResourceSnapshot(
        String id,
        String name,
        String description,
        String sizeClass,
        Set<String> capabilities,
        ResourcePhase phase,
        boolean loaded,
        Device device,
        long memoryBytes,
        Duration loadDuration,
        Instant transitionedAt,
        String lastError
) {

    public static ResourceSnapshot of(ResourceDescriptor descriptor, ResourceState state) {
        return new ResourceSnapshot(
                descriptor.id(),
                descriptor.name(),
                descriptor.description(),
                descriptor.sizeClass(),
                descriptor.capabilities(),
                state.phase(),
                state.isLoaded(),
                state.device(),
                state.memoryBytes(),
                state.loadDuration(),
                state.transitionedAt(),
                state.lastError()
        );
    }

    /**
     * Listing status: "loaded", "downloaded", "not_downloaded", a transitional
     * phase name, or "error" when the last operation on a not-loaded resource failed.
     */
    public String status() {
        if (phase == ResourcePhase.LOADED) {
            return "loaded";
        }
        if (lastError != null && !phase.isTransitional()) {
            return "error";
        }
        return phase.name().toLowerCase(Locale.ROOT);
    }

    public boolean isInError() {
        return "error".equals(status());
    }
}
