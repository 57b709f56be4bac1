package com.archforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One call in an interaction trace ({@code A->>B: verb(args)}).
 *
 * @param from calling participant
 * @param to called participant, the owner of {@code action}
 * @param action invoked method name
 * @param parameters call parameters
 * @param returnType type returned on the following return arrow, {@code void} if none
 */
public record SequenceStep(
    String from,
    String to,
    String action,
    List<Parameter> parameters,
    String returnType
) {
    /**
     * Compact constructor with validation.
     */
    public SequenceStep {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(action, "action must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (returnType == null || returnType.isBlank()) {
            returnType = "void";
        }
    }

    /**
     * Converts the step into the method it implies on its callee.
     *
     * @return implied method
     */
    public MethodSpec impliedMethod() {
        return MethodSpec.of(action, parameters, returnType);
    }
}
