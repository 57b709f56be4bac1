package com.archforge.core.model;

import java.util.Objects;

/**
 * Method parameter.
 *
 * @param name parameter name
 * @param type declared type ({@code any} when the diagram omitted it)
 * @param required false for optional parameters
 */
public record Parameter(
    String name,
    String type,
    boolean required
) {
    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null || type.isBlank()) {
            type = "any";
        }
    }

    /**
     * Renders the parameter as {@code name: type} (or {@code name?: type}).
     *
     * @return parameter text
     */
    public String render() {
        return name + (required ? "" : "?") + ": " + type;
    }
}
