package fr.lapetina.modelhost.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a download, load or unload call.
 * Immutable and thread-safe.
 */
public record LifecycleResult(
        String resourceId,
        Operation operation,
        boolean success,
        String message,
        ErrorType errorType,
        ResourcePhase phase,
        Duration elapsed
) {
    public enum Operation {
        DOWNLOAD,
        LOAD,
        UNLOAD
    }

    public LifecycleResult {
        Objects.requireNonNull(resourceId, "Resource ID is required");
        Objects.requireNonNull(operation, "Operation is required");
        if (success && errorType != null) {
            throw new IllegalArgumentException("Successful result cannot carry an error type");
        }
        if (!success && errorType == null) {
            throw new IllegalArgumentException("Failed result requires an error type");
        }
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    public boolean isError() {
        return !success;
    }

    public static LifecycleResult success(
            String resourceId, Operation operation, String message, ResourcePhase phase, Duration elapsed) {
        return new LifecycleResult(resourceId, operation, true, message, null, phase, elapsed);
    }

    public static LifecycleResult error(
            String resourceId, Operation operation, ErrorType errorType, String message,
            ResourcePhase phase, Duration elapsed) {
        return new LifecycleResult(resourceId, operation, false, message, errorType, phase, elapsed);
    }
}
