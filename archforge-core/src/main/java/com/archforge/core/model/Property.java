package com.archforge.core.model;

import java.util.Objects;

/**
 * Typed property of a unit.
 *
 * @param name property name
 * @param type declared type, as written in the diagram
 * @param visibility property visibility
 * @param required false when the diagram marked the name optional ({@code name?})
 */
public record Property(
    String name,
    String type,
    Visibility visibility,
    boolean required
) {
    /**
     * Compact constructor with validation.
     */
    public Property {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
    }
}
