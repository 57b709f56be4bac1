package com.archforge.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Method declared on a unit. Identity is {@code (owner, name)}.
 *
 * @param name method name
 * @param parameters ordered parameters
 * @param returnType return type, {@code void} when not declared
 * @param visibility method visibility
 */
public record MethodSpec(
    String name,
    List<Parameter> parameters,
    String returnType,
    Visibility visibility
) {
    /**
     * Compact constructor with validation.
     */
    public MethodSpec {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (returnType == null || returnType.isBlank()) {
            returnType = "void";
        }
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
    }

    /**
     * Creates a public method.
     *
     * @param name method name
     * @param parameters parameters
     * @param returnType return type
     * @return method spec
     */
    public static MethodSpec of(String name, List<Parameter> parameters, String returnType) {
        return new MethodSpec(name, parameters, returnType, Visibility.PUBLIC);
    }

    /**
     * Returns a copy with the given parameters and return type, keeping name and visibility.
     *
     * @param newParameters replacement parameters
     * @param newReturnType replacement return type
     * @return rewritten method
     */
    public MethodSpec withSignature(List<Parameter> newParameters, String newReturnType) {
        return new MethodSpec(name, newParameters, newReturnType, visibility);
    }

    /**
     * Renders the parameter list without parentheses.
     *
     * @return comma separated parameters
     */
    public String renderParameters() {
        return parameters.stream().map(Parameter::render).collect(Collectors.joining(", "));
    }

    /**
     * Renders {@code name(params): returnType}.
     *
     * @return signature text
     */
    public String signature() {
        return name + "(" + renderParameters() + "): " + returnType;
    }
}
