package fr.lapetina.modelhost.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Precision a resource is materialized with.
 */
public enum QuantizationPolicy {
    NONE(null),
    EIGHT_BIT("8bit"),
    FOUR_BIT("4bit");

    private final String value;

    QuantizationPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static QuantizationPolicy parse(String name) {
        if (name == null || name.isBlank() || "none".equalsIgnoreCase(name.trim())) {
            return NONE;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "8bit", "int8", "q8" -> EIGHT_BIT;
            case "4bit", "int4", "q4" -> FOUR_BIT;
            default -> throw new IllegalArgumentException("Unknown quantization policy: " + name);
        };
    }
}
