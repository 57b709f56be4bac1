package com.archforge.core.external;

import java.nio.file.Path;

/**
 * External build-validation collaborator: compiles or type-checks the composed output.
 */
public interface BuildValidator {

    String getId();

    /**
     * Validates the artifact tree.
     *
     * @param outputRoot root of the composed output
     * @return errors and warnings found; never null
     */
    ValidationReport validate(Path outputRoot);
}
