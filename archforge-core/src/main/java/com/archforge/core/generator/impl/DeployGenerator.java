package com.archforge.core.generator.impl;

import com.archforge.core.external.TextGenerator;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.generator.base.AbstractArtifactGenerator;
import com.archforge.core.model.InfraContext;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates deployment files: the packaging script, the serverless function definition
 * and the static-site publishing script. Infrastructure settings come from the
 * {@link InfraContext} ({@code region}, {@code stage}, {@code bucket}, {@code runtime}).
 */
public class DeployGenerator extends AbstractArtifactGenerator {

    private static final ObjectMapper YAML = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    public DeployGenerator(TextGenerator textGenerator, GenerationContext context,
                           RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper) {
        super(textGenerator, context, retryPolicy, sleeper);
    }

    @Override
    public TaskCategory category() {
        return TaskCategory.DEPLOY;
    }

    @Override
    protected String instructions(Task task) {
        String infra = "Region: " + region() + ", stage: " + stage() + ".";
        return switch (task.kind()) {
            case DEPLOY_PACKAGE -> "Write a POSIX shell script zipping backend/dist and its production "
                + "node_modules into deploy/backend.zip. " + infra;
            case DEPLOY_FUNCTION -> "Write serverless.yml deploying backend/src/handler.handler behind an HTTP API. "
                + infra + " Output YAML only.";
            case DEPLOY_STATIC_SITE -> "Write a POSIX shell script syncing frontend/dist to the bucket "
                + bucket() + ". " + infra;
            default -> throw new IllegalArgumentException("Not a deploy task: " + task.kind());
        };
    }

    @Override
    protected String stub(Task task) {
        return switch (task.kind()) {
            case DEPLOY_PACKAGE -> "#!/bin/sh\nset -e\n\n"
                + "mkdir -p deploy\n"
                + "(cd backend && npm ci --omit=dev && zip -r ../deploy/backend.zip dist node_modules)\n";
            case DEPLOY_FUNCTION -> serverlessDefinition();
            default -> "#!/bin/sh\nset -e\n\n"
                + "aws s3 sync frontend/dist s3://" + bucket() + " --delete --region " + region() + "\n";
        };
    }

    private String serverlessDefinition() {
        Map<String, Object> provider = new LinkedHashMap<>();
        provider.put("name", "aws");
        provider.put("runtime", infra().get("runtime").orElse("nodejs20.x"));
        provider.put("region", region());
        provider.put("stage", stage());

        Map<String, Object> api = new LinkedHashMap<>();
        api.put("handler", "backend/dist/handler.handler");
        api.put("events", List.of(Map.of("httpApi", "*")));

        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("service", context.model().projectId().toLowerCase(Locale.ROOT));
        definition.put("provider", provider);
        definition.put("package", Map.of("artifact", "deploy/backend.zip"));
        definition.put("functions", Map.of("api", api));
        try {
            return YAML.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render serverless definition", e);
        }
    }

    private InfraContext infra() {
        return context.infraContext();
    }

    private String region() {
        return infra().get("region").orElse("us-east-1");
    }

    private String stage() {
        return infra().get("stage").orElse("dev");
    }

    private String bucket() {
        return infra().get("bucket").orElse(context.model().projectId().toLowerCase(Locale.ROOT) + "-frontend");
    }
}
