package fr.lapetina.modelhost.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static description of a catalog resource.
 * Immutable; many lifecycle snapshots reference one descriptor.
 */
public record ResourceDescriptor(
        String id,
        String name,
        String description,
        String repository,
        String kind,
        Set<String> capabilities,
        String sizeClass,
        Device devicePreference,
        QuantizationPolicy quantization,
        int maxContextLength
) {

    /**
     * Infix of in-progress download directories; never part of a resource id.
     */
    public static final String STAGING_MARKER = ".partial-";

    // Ids name a single directory under the storage root
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._:-]+");

    public ResourceDescriptor {
        Objects.requireNonNull(id, "Resource ID is required");
        validateId(id);
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
        if (repository == null || repository.isBlank()) {
            repository = id;
        }
        if (kind == null || kind.isBlank()) {
            kind = "decoder";
        }
        capabilities = capabilities != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(capabilities))
                : Set.of();
        if (sizeClass == null || sizeClass.isBlank()) {
            sizeClass = "unknown";
        }
        if (devicePreference == null) {
            devicePreference = Device.AUTO;
        }
        if (quantization == null) {
            quantization = QuantizationPolicy.NONE;
        }
        if (maxContextLength <= 0) {
            maxContextLength = 512;
        }
    }

    private static void validateId(String id) {
        if (id.isBlank()) {
            throw new IllegalArgumentException("Resource ID must not be blank");
        }
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException(
                    "Resource ID may only contain letters, digits, '.', '_', ':' and '-': " + id);
        }
        if (id.contains("..") || id.equals(".")) {
            throw new IllegalArgumentException("Resource ID must not be a relative path: " + id);
        }
        if (id.contains(STAGING_MARKER)) {
            throw new IllegalArgumentException("Resource ID must not contain '" + STAGING_MARKER + "': " + id);
        }
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private String repository;
        private String kind;
        private final Set<String> capabilities = new LinkedHashSet<>();
        private String sizeClass;
        private Device devicePreference = Device.AUTO;
        private QuantizationPolicy quantization = QuantizationPolicy.NONE;
        private int maxContextLength = 512;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder repository(String repository) {
            this.repository = repository;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder addCapability(String capability) {
            this.capabilities.add(capability);
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder sizeClass(String sizeClass) {
            this.sizeClass = sizeClass;
            return this;
        }

        public Builder devicePreference(Device device) {
            this.devicePreference = device;
            return this;
        }

        public Builder quantization(QuantizationPolicy quantization) {
            this.quantization = quantization;
            return this;
        }

        public Builder maxContextLength(int maxContextLength) {
            this.maxContextLength = maxContextLength;
            return this;
        }

        public ResourceDescriptor build() {
            return new ResourceDescriptor(id, name, description, repository, kind,
                    capabilities, sizeClass, devicePreference, quantization, maxContextLength);
        }
    }
}
