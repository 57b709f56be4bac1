package com.archforge.core.model;

import java.util.Objects;

/**
 * Directed relationship between two units.
 *
 * @param source owning unit name
 * @param target target unit name
 * @param kind relationship kind
 * @param description optional label
 */
public record Relationship(
    String source,
    String target,
    RelationshipKind kind,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (description == null) {
            description = "";
        }
    }
}
