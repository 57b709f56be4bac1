package com.archforge.core.registry;

import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Parameter;

import java.util.List;
import java.util.Objects;

/**
 * Registry projection of one method, keyed by {@code (className, methodName)}.
 *
 * @param className owning unit
 * @param methodName method name
 * @param parameters parameters
 * @param returnType return type
 * @param filePath file that defines the owning unit
 * @param crossLayerConsistency true once the consistency engine found this method in line with its canonical version
 */
public record MethodSignature(
    String className,
    String methodName,
    List<Parameter> parameters,
    String returnType,
    String filePath,
    boolean crossLayerConsistency
) {
    /**
     * Compact constructor with validation.
     */
    public MethodSignature {
        Objects.requireNonNull(className, "className must not be null");
        Objects.requireNonNull(methodName, "methodName must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (returnType == null || returnType.isBlank()) {
            returnType = "void";
        }
    }

    /**
     * Returns true when parameters and return type equal those of the given method.
     *
     * @param method method to compare
     * @return true if the signature matches exactly
     */
    public boolean matches(MethodSpec method) {
        return methodName.equals(method.name())
            && parameters.equals(method.parameters())
            && returnType.equals(method.returnType());
    }

    public MethodSpec toMethodSpec() {
        return MethodSpec.of(methodName, parameters, returnType);
    }

    MethodSignature withSignature(List<Parameter> newParameters, String newReturnType) {
        return new MethodSignature(className, methodName, newParameters, newReturnType, filePath, crossLayerConsistency);
    }

    MethodSignature withConsistency(boolean consistent) {
        return new MethodSignature(className, methodName, parameters, returnType, filePath, consistent);
    }
}
