package com.archforge.core.generator;

import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;

import java.util.List;

/**
 * Produces the artifact of one task.
 *
 * <p>There is exactly one generator per {@link TaskCategory}. Implementations never fail:
 * when text generation is exhausted they return a stub artifact instead.
 *
 * @see GeneratorRegistry
 */
public interface ArtifactGenerator {

    /**
     * Returns the category this generator handles.
     *
     * @return task category
     */
    TaskCategory category();

    /**
     * Generates the artifact for a task.
     *
     * @param task task to generate; its category must equal {@link #category()}
     * @param priorArtifacts artifacts generated earlier in the same run, in generation order
     * @return generated artifact, possibly a stub
     * @throws IllegalArgumentException if the task belongs to another category
     */
    GeneratedArtifact generate(Task task, List<GeneratedArtifact> priorArtifacts);
}
