package fr.lapetina.modelhost.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Target device for a materialized resource.
 *
 * AUTO is only a request value; the lifecycle manager resolves it to CPU or
 * ACCELERATOR before calling the backend.
 */
public enum Device {
    AUTO("auto"),
    CPU("cpu"),
    ACCELERATOR("accelerator");

    private final String value;

    Device(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a device name. Accepts "cuda" and "gpu" as accelerator aliases.
     * Null or blank means AUTO.
     */
    @JsonCreator
    public static Device parse(String name) {
        if (name == null || name.isBlank()) {
            return AUTO;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "cpu" -> CPU;
            case "accelerator", "cuda", "gpu" -> ACCELERATOR;
            default -> throw new IllegalArgumentException("Unknown device: " + name);
        };
    }
}
