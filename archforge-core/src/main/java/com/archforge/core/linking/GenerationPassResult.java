package com.archforge.core.linking;

import com.archforge.core.generator.GeneratedArtifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the generate-and-register stage.
 *
 * @param artifacts artifacts written, in generation order
 * @param stubbedTasks ids of tasks whose artifact is a stub
 * @param failures task id to failure message for tasks that produced nothing
 * @param stopped true when the stage stopped early on cancellation or timeout
 */
public record GenerationPassResult(
    List<GeneratedArtifact> artifacts,
    List<String> stubbedTasks,
    Map<String, String> failures,
    boolean stopped
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationPassResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        stubbedTasks = stubbedTasks == null ? List.of() : List.copyOf(stubbedTasks);
        failures = failures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }
}
