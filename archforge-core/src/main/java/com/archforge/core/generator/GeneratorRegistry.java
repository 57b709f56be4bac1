package com.archforge.core.generator;

import com.archforge.core.external.TextGenerator;
import com.archforge.core.generator.impl.BackendGenerator;
import com.archforge.core.generator.impl.BuildGenerator;
import com.archforge.core.generator.impl.DeployGenerator;
import com.archforge.core.generator.impl.FrontendGenerator;
import com.archforge.core.generator.impl.SharedGenerator;
import com.archforge.core.generator.impl.TestGenerator;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;

/**
 * Holds the generator of every {@link TaskCategory} for one run.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratorRegistry generators = GeneratorRegistry.create(textGenerator, context, RetryPolicy.from(config));
 * GeneratedArtifact artifact = generators.forTask(task).generate(task, prior);
 * }</pre>
 */
public class GeneratorRegistry {

    private final ArtifactGenerator backend;
    private final ArtifactGenerator frontend;
    private final ArtifactGenerator shared;
    private final ArtifactGenerator test;
    private final ArtifactGenerator build;
    private final ArtifactGenerator deploy;

    public GeneratorRegistry(ArtifactGenerator backend, ArtifactGenerator frontend, ArtifactGenerator shared,
                             ArtifactGenerator test, ArtifactGenerator build, ArtifactGenerator deploy) {
        this.backend = backend;
        this.frontend = frontend;
        this.shared = shared;
        this.test = test;
        this.build = build;
        this.deploy = deploy;
    }

    public static GeneratorRegistry create(TextGenerator textGenerator, GenerationContext context, RetryPolicy retryPolicy) {
        return create(textGenerator, context, retryPolicy, Thread::sleep);
    }

    /**
     * Creates the standard generators sharing one collaborator, context and retry policy.
     *
     * @param textGenerator text-generation collaborator
     * @param context run-scoped generation inputs
     * @param retryPolicy backoff policy
     * @param sleeper pause between attempts
     * @return registry with one generator per category
     */
    public static GeneratorRegistry create(TextGenerator textGenerator, GenerationContext context,
                                           RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper) {
        return new GeneratorRegistry(
            new BackendGenerator(textGenerator, context, retryPolicy, sleeper),
            new FrontendGenerator(textGenerator, context, retryPolicy, sleeper),
            new SharedGenerator(textGenerator, context, retryPolicy, sleeper),
            new TestGenerator(textGenerator, context, retryPolicy, sleeper),
            new BuildGenerator(textGenerator, context, retryPolicy, sleeper),
            new DeployGenerator(textGenerator, context, retryPolicy, sleeper)
        );
    }

    public ArtifactGenerator forCategory(TaskCategory category) {
        return switch (category) {
            case BACKEND -> backend;
            case FRONTEND -> frontend;
            case SHARED -> shared;
            case TEST -> test;
            case BUILD -> build;
            case DEPLOY -> deploy;
        };
    }

    public ArtifactGenerator forTask(Task task) {
        return forCategory(task.category());
    }
}
