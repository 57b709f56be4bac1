package com.archforge.core.consistency;

import java.util.Objects;

/**
 * A cross-layer signature mismatch that was auto-corrected.
 *
 * @param resource entity name owning the canonical signature
 * @param className dependent unit that drifted
 * @param methodName drifted method
 * @param found signature found on the dependent
 * @param rewrittenTo signature written in its place
 */
public record DriftWarning(
    String resource,
    String className,
    String methodName,
    String found,
    String rewrittenTo
) {
    /**
     * Compact constructor with validation.
     */
    public DriftWarning {
        Objects.requireNonNull(resource, "resource must not be null");
        Objects.requireNonNull(className, "className must not be null");
        Objects.requireNonNull(methodName, "methodName must not be null");
    }

    public String message() {
        return className + "." + methodName + " drifted from " + resource + ": '" + found + "' rewritten to '" + rewrittenTo + "'";
    }
}
