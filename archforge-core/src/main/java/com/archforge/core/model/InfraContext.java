package com.archforge.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * Opaque infrastructure settings (region, stage, bucket names...) passed through
 * to build-task prompts and the deployment collaborator.
 *
 * @param attributes free-form attributes
 */
public record InfraContext(Map<String, Object> attributes) {

    /**
     * Compact constructor with validation.
     */
    public InfraContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static InfraContext empty() {
        return new InfraContext(Map.of());
    }

    /**
     * Returns an attribute as a string.
     *
     * @param key attribute key
     * @return the value's string form, if present
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(attributes.get(key)).map(Object::toString);
    }
}
