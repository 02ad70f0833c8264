package fr.lapetina.modelhost.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Runtime state of one resource. Immutable snapshot, replaced as a whole on
 * every transition so readers never see a handle without LOADED (or the
 * reverse).
 */
public record ResourceState(
        ResourcePhase phase,
        Device device,
        long memoryBytes,
        Duration loadDuration,
        Instant transitionedAt,
        String lastError,
        ModelHandle handle
) {
    public ResourceState {
        Objects.requireNonNull(phase, "Phase is required");
        Objects.requireNonNull(transitionedAt, "Transition timestamp is required");
        if ((phase == ResourcePhase.LOADED) != (handle != null)) {
            throw new IllegalStateException(
                    "Handle must be present if and only if phase is LOADED: phase=" + phase);
        }
        if (handle == null) {
            device = null;
            memoryBytes = 0;
        }
    }

    public static ResourceState initial(boolean downloaded, Instant now) {
        return new ResourceState(
                downloaded ? ResourcePhase.DOWNLOADED : ResourcePhase.NOT_DOWNLOADED,
                null, 0, null, now, null, null);
    }

    /**
     * Moves to a phase without a handle, keeping the last error and load duration.
     */
    public ResourceState transitionTo(ResourcePhase next, Instant now) {
        return new ResourceState(next, null, 0, loadDuration, now, lastError, null);
    }

    public ResourceState loaded(ModelHandle handle, long footprintBytes, Duration duration, Instant now) {
        return new ResourceState(ResourcePhase.LOADED, handle.device(), footprintBytes, duration, now, null, handle);
    }

    public ResourceState withError(String error) {
        return new ResourceState(phase, device, memoryBytes, loadDuration, transitionedAt, error, handle);
    }

    public ResourceState clearError() {
        return lastError == null ? this : withError(null);
    }

    public boolean isLoaded() {
        return phase == ResourcePhase.LOADED;
    }

    public boolean hasError() {
        return lastError != null;
    }
}
