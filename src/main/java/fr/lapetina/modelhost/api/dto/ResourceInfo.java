package fr.lapetina.modelhost.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.modelhost.domain.model.ResourceSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the resource listing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceInfo(
        String id,
        String name,
        String description,
        String size,
        List<String> capabilities,
        String status,
        boolean loaded,
        String device,
        @JsonProperty("memory_mb") double memoryMb,
        @JsonProperty("load_time_seconds") Double loadTimeSeconds,
        @JsonProperty("last_transition") Instant lastTransition,
        @JsonProperty("last_error") String lastError
) {

    public static ResourceInfo from(ResourceSnapshot snapshot) {
        return new ResourceInfo(
                snapshot.id(),
                snapshot.name(),
                snapshot.description(),
                snapshot.sizeClass(),
                List.copyOf(snapshot.capabilities()),
                snapshot.status(),
                snapshot.loaded(),
                snapshot.device() != null ? snapshot.device().value() : null,
                snapshot.memoryBytes() / (1024.0 * 1024.0),
                snapshot.loadDuration() != null ? snapshot.loadDuration().toMillis() / 1000.0 : null,
                snapshot.transitionedAt(),
                snapshot.lastError()
        );
    }
}
