package fr.lapetina.modelhost.lifecycle.backend;

import fr.lapetina.modelhost.domain.model.ModelHandle;

import java.util.Objects;

/**
 * Result of a successful materialize call.
 *
 * @param handle         backend-owned handle, to be released exactly once
 * @param footprintBytes accelerator memory when on an accelerator, else resident memory
 */
public record Materialized(ModelHandle handle, long footprintBytes) {

    public Materialized {
        Objects.requireNonNull(handle, "Handle is required");
        if (footprintBytes < 0) {
            throw new IllegalArgumentException("Footprint must not be negative: " + footprintBytes);
        }
    }
}
