package com.archforge.core.external;

import java.util.List;

/**
 * Result of build validation.
 *
 * @param errors blocking problems
 * @param warnings non-blocking problems
 */
public record ValidationReport(List<String> errors, List<String> warnings) {

    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationReport clean() {
        return new ValidationReport(List.of(), List.of());
    }

    public boolean passed() {
        return errors.isEmpty();
    }
}
