package com.archforge.core.parser;

import com.archforge.core.model.ArchitectureModel;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing a project's diagrams.
 *
 * @param model parsed architecture model
 * @param anomalies lines that looked meaningful but could not be parsed, prefixed with their diagram kind
 * @param backfilledMethods methods appended to units from sequence steps, as {@code Owner.method}
 */
public record ParseResult(
    ArchitectureModel model,
    List<String> anomalies,
    List<String> backfilledMethods
) {
    /**
     * Compact constructor with validation.
     */
    public ParseResult {
        Objects.requireNonNull(model, "model must not be null");
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        backfilledMethods = backfilledMethods == null ? List.of() : List.copyOf(backfilledMethods);
    }
}
