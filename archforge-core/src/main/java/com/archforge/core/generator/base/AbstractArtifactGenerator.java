package com.archforge.core.generator.base;

import com.archforge.core.external.TextGenerationException;
import com.archforge.core.external.TextGenerator;
import com.archforge.core.generator.ArtifactGenerator;
import com.archforge.core.generator.CodeSanitizer;
import com.archforge.core.generator.ExportScanner;
import com.archforge.core.generator.GeneratedArtifact;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.model.Unit;
import com.archforge.core.planner.Task;
import com.archforge.core.registry.DataContract;
import com.archforge.core.registry.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Abstract base class for generators providing the shared generation loop.
 *
 * <p>Subclasses contribute only what differs per category:
 * <ul>
 *   <li>{@link #instructions(Task)}: category-specific prompt instructions</li>
 *   <li>{@link #stub(Task)}: the mechanical fallback content</li>
 * </ul>
 *
 * <p>The loop builds a grounded prompt, calls the {@link TextGenerator}, sanitizes the reply
 * and retries with {@link RetryPolicy} backoff. Blank replies count as failures. When the
 * budget is exhausted, or a failure is not retryable, the stub is returned.
 *
 * @see ArtifactGenerator
 */
public abstract class AbstractArtifactGenerator implements ArtifactGenerator {

    /**
     * Logger instance for this generator.
     * Automatically initialized with the concrete generator class name.
     */
    protected final Logger log;

    protected final TextGenerator textGenerator;
    protected final GenerationContext context;

    private final RetryPolicy retryPolicy;
    private final RetryPolicy.Sleeper sleeper;

    protected AbstractArtifactGenerator(TextGenerator textGenerator, GenerationContext context,
                                        RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper) {
        this.log = LoggerFactory.getLogger(getClass());
        this.textGenerator = textGenerator;
        this.context = context;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @Override
    public GeneratedArtifact generate(Task task, List<GeneratedArtifact> priorArtifacts) {
        if (task.category() != category()) {
            throw new IllegalArgumentException(
                "Task " + task.id() + " is " + task.category() + ", generator handles " + category());
        }

        String prompt = buildPrompt(task, priorArtifacts);
        String failure = "no attempt made";

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                String content = CodeSanitizer.sanitize(textGenerator.generate(prompt), task.filePath());
                if (!content.isEmpty()) {
                    log.debug("Generated {} on attempt {} ({} chars)", task.id(), attempt, content.length());
                    return artifact(task, content, false);
                }
                failure = "empty output";
            } catch (TextGenerationException e) {
                failure = e.getMessage();
                if (!e.isRetryable()) {
                    log.debug("Non-retryable failure for {}: {}", task.id(), failure);
                    break;
                }
            }

            if (attempt < retryPolicy.maxAttempts()) {
                long delay = retryPolicy.delayAfter(attempt);
                log.warn("Attempt {}/{} for {} failed ({}), retrying in {} ms",
                    attempt, retryPolicy.maxAttempts(), task.id(), failure, delay);
                if (!pause(delay)) {
                    failure = "interrupted";
                    break;
                }
            }
        }

        log.warn("Generation of {} failed ({}), substituting stub", task.id(), failure);
        return artifact(task, stub(task), true);
    }

    /**
     * Returns category-specific instructions appended to the grounded prompt.
     *
     * @param task task being generated
     * @return instruction text
     */
    protected abstract String instructions(Task task);

    /**
     * Returns mechanically derived fallback content with the right name, exports and method stubs.
     *
     * @param task task being generated
     * @return stub content
     */
    protected abstract String stub(Task task);

    /**
     * Builds the full prompt: task header, registry grounding, prior artifacts, instructions.
     *
     * @param task task being generated
     * @param priorArtifacts artifacts generated earlier
     * @return prompt text
     */
    protected String buildPrompt(Task task, List<GeneratedArtifact> priorArtifacts) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("# Task\n")
            .append(task.description()).append('\n')
            .append("File: ").append(task.filePath()).append('\n')
            .append("Kind: ").append(task.kind()).append("\n\n");

        unit(task).ifPresent(unit -> appendContracts(prompt, unit));
        appendPriorArtifacts(prompt, priorArtifacts);

        prompt.append("# Instructions\n").append(instructions(task)).append('\n');
        return prompt.toString();
    }

    protected Optional<Unit> unit(Task task) {
        return task.hasUnit() ? context.registry().getUnit(task.unitName()) : Optional.empty();
    }

    private void appendContracts(StringBuilder prompt, Unit unit) {
        prompt.append("# Contract\n");
        context.registry().dataContract(unit.name()).map(DataContract::render).ifPresent(prompt::append);
        for (String dependency : unit.dependencies()) {
            context.registry().dataContract(dependency).ifPresent(contract -> prompt.append(contract.render()));
        }

        List<MethodSignature> signatures = context.registry().methodSignatures(unit.name());
        if (!signatures.isEmpty()) {
            prompt.append("\n# Signatures that must be kept exactly\n");
            for (MethodSignature signature : signatures) {
                prompt.append("- ").append(signature.className()).append('.')
                    .append(signature.toMethodSpec().signature()).append('\n');
            }
        }
        prompt.append('\n');
    }

    private static void appendPriorArtifacts(StringBuilder prompt, List<GeneratedArtifact> priorArtifacts) {
        if (priorArtifacts.isEmpty()) {
            return;
        }
        prompt.append("# Existing modules\n");
        for (GeneratedArtifact artifact : priorArtifacts) {
            List<String> exports = artifact.exports().isEmpty() ? ExportScanner.scan(artifact.content()) : artifact.exports();
            if (!exports.isEmpty()) {
                prompt.append("- ").append(artifact.path()).append(": ").append(String.join(", ", exports)).append('\n');
            }
        }
        prompt.append('\n');
    }

    private GeneratedArtifact artifact(Task task, String content, boolean stub) {
        return new GeneratedArtifact(task.id(), task.filePath(), content, task.category(),
            ExportScanner.scan(content), List.of(), stub);
    }

    private boolean pause(long delay) {
        if (delay <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
