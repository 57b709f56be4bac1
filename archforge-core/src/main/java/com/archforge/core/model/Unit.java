package com.archforge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named class-like unit of the architecture: an entity, service, controller,
 * repository, UI component and so on.
 *
 * <p>Units are immutable. Components that need to change a unit (sequence
 * backfill, the consistency engine) produce a replacement via the {@code with*}
 * methods and swap it into a new {@link ArchitectureModel}.
 *
 * @param name unit name
 * @param kind unit kind
 * @param properties declared properties
 * @param methods declared methods
 * @param relationships outgoing relationships declared in the class diagram
 * @param dependencies names of units this unit depends on (component diagrams)
 * @param filePath output-root relative artifact path
 * @param description optional label from a component diagram
 */
public record Unit(
    String name,
    UnitKind kind,
    List<Property> properties,
    List<MethodSpec> methods,
    List<Relationship> relationships,
    List<String> dependencies,
    String filePath,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public Unit {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        properties = properties == null ? List.of() : List.copyOf(properties);
        methods = methods == null ? List.of() : List.copyOf(methods);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (filePath == null || filePath.isBlank()) {
            filePath = kind.defaultPath(name);
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Creates a unit with no members at its conventional path.
     *
     * @param name unit name
     * @param kind unit kind
     * @return empty unit
     */
    public static Unit of(String name, UnitKind kind) {
        return new Unit(name, kind, List.of(), List.of(), List.of(), List.of(), null, null);
    }

    public Layer layer() {
        return kind.layer();
    }

    /**
     * Finds a method by name.
     *
     * @param methodName method name
     * @return the method, if declared
     */
    public Optional<MethodSpec> findMethod(String methodName) {
        return methods.stream().filter(m -> m.name().equals(methodName)).findFirst();
    }

    public boolean hasMethod(String methodName) {
        return findMethod(methodName).isPresent();
    }

    public Unit withMethods(List<MethodSpec> newMethods) {
        return new Unit(name, kind, properties, newMethods, relationships, dependencies, filePath, description);
    }

    /**
     * Returns a copy with one extra method appended.
     *
     * @param method method to append
     * @return updated unit
     */
    public Unit withMethod(MethodSpec method) {
        List<MethodSpec> updated = new ArrayList<>(methods);
        updated.add(method);
        return withMethods(updated);
    }

    /**
     * Returns a copy where the method with the same name is replaced.
     *
     * @param method replacement method
     * @return updated unit
     */
    public Unit replaceMethod(MethodSpec method) {
        List<MethodSpec> updated = new ArrayList<>(methods.size());
        for (MethodSpec existing : methods) {
            updated.add(existing.name().equals(method.name()) ? method : existing);
        }
        return withMethods(updated);
    }

    public Unit withDependencies(List<String> newDependencies) {
        return new Unit(name, kind, properties, methods, relationships, newDependencies, filePath, description);
    }

    public Unit withKind(UnitKind newKind) {
        return new Unit(name, newKind, properties, methods, relationships, dependencies, newKind.defaultPath(name), description);
    }

    public Unit withDescription(String newDescription) {
        return new Unit(name, kind, properties, methods, relationships, dependencies, filePath, newDescription);
    }
}
