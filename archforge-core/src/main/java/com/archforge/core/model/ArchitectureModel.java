package com.archforge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed output of the diagram parser and input to every later stage.
 *
 * <p>This is the intermediate representation that bridges parsing and generation:
 * the symbol registry indexes it, the consistency engine repairs it, and the task
 * planner expands it into generation tasks.
 *
 * @param projectId project the diagrams belong to
 * @param units declared and inferred units, in declaration order
 * @param relationships every relationship found in the class diagram
 * @param sequenceSteps calls found in the sequence diagram
 * @param infraContext opaque infrastructure settings passed through to build and deploy
 */
public record ArchitectureModel(
    String projectId,
    List<Unit> units,
    List<Relationship> relationships,
    List<SequenceStep> sequenceSteps,
    InfraContext infraContext
) {
    /**
     * Compact constructor with validation.
     */
    public ArchitectureModel {
        Objects.requireNonNull(projectId, "projectId must not be null");
        units = units == null ? List.of() : List.copyOf(units);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        sequenceSteps = sequenceSteps == null ? List.of() : List.copyOf(sequenceSteps);
        if (infraContext == null) {
            infraContext = InfraContext.empty();
        }
    }

    /**
     * Returns true when the model holds no units at all.
     *
     * @return true if nothing was parsed
     */
    public boolean isEmpty() {
        return units.isEmpty();
    }

    /**
     * Finds a unit by exact name.
     *
     * @param name unit name
     * @return the unit, if present
     */
    public Optional<Unit> findUnit(String name) {
        return units.stream().filter(u -> u.name().equals(name)).findFirst();
    }

    /**
     * Returns all units of the given kind in declaration order.
     *
     * @param kind unit kind
     * @return matching units
     */
    public List<Unit> unitsOfKind(UnitKind kind) {
        return units.stream().filter(u -> u.kind() == kind).toList();
    }

    /**
     * Returns true if any unit lives in the frontend layer.
     *
     * @return true when a UI exists
     */
    public boolean hasFrontend() {
        return units.stream().anyMatch(u -> u.layer() == Layer.FRONTEND);
    }

    /**
     * Returns a copy with the unit of the same name replaced.
     *
     * @param unit replacement unit
     * @return updated model
     */
    public ArchitectureModel withUnit(Unit unit) {
        List<Unit> updated = new ArrayList<>(units.size());
        for (Unit existing : units) {
            updated.add(existing.name().equals(unit.name()) ? unit : existing);
        }
        return new ArchitectureModel(projectId, updated, relationships, sequenceSteps, infraContext);
    }
}
