package com.archforge.core.model;

/**
 * Relationship kinds recognized in class diagrams.
 */
public enum RelationshipKind {
    COMPOSITION,
    AGGREGATION,
    ASSOCIATION,
    DEPENDENCY,
    REALIZATION,
    INHERITANCE;

    /**
     * Returns true when the target must exist before the source can be generated.
     *
     * <p>Inheritance, realization and composition constrain generation order.
     * Looser references are resolved by the linking pass instead.
     *
     * @return true if the relationship implies a generation-order edge
     */
    public boolean ordersGeneration() {
        return this == INHERITANCE || this == REALIZATION || this == COMPOSITION;
    }
}
