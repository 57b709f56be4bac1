package com.archforge.core.linking;

import com.archforge.core.consistency.DriftWarning;
import com.archforge.core.generator.GeneratedArtifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the link-and-fix stage.
 *
 * @param success true when every file was linked without error
 * @param errors per-file failures; those files keep their generated content
 * @param warnings unresolved references and similar findings
 * @param fixedFiles paths whose content changed
 * @param addedImports names imported per file
 * @param removedImports names dropped per file
 * @param reconciledSignatures drift corrected in generated services and controllers
 * @param artifacts artifacts after linking, in input order
 */
public record LinkingResult(
    boolean success,
    List<String> errors,
    List<String> warnings,
    List<String> fixedFiles,
    Map<String, List<String>> addedImports,
    Map<String, List<String>> removedImports,
    List<DriftWarning> reconciledSignatures,
    List<GeneratedArtifact> artifacts
) {
    /**
     * Compact constructor with validation.
     */
    public LinkingResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        fixedFiles = fixedFiles == null ? List.of() : List.copyOf(fixedFiles);
        addedImports = addedImports == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(addedImports));
        removedImports = removedImports == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(removedImports));
        reconciledSignatures = reconciledSignatures == null ? List.of() : List.copyOf(reconciledSignatures);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    /**
     * Returns the number of edits made across all files.
     *
     * @return added plus removed imports plus reconciled signatures
     */
    public int editCount() {
        int added = addedImports.values().stream().mapToInt(List::size).sum();
        int removed = removedImports.values().stream().mapToInt(List::size).sum();
        return added + removed + reconciledSignatures.size();
    }
}
