package com.archforge.core.generator.impl;

import com.archforge.core.external.TextGenerator;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.generator.base.AbstractArtifactGenerator;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Generates build files: package manifests, TypeScript configuration and build scripts.
 *
 * <p>JSON stubs are rendered through Jackson so they are always well-formed.
 */
public class BuildGenerator extends AbstractArtifactGenerator {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public BuildGenerator(TextGenerator textGenerator, GenerationContext context,
                          RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper) {
        super(textGenerator, context, retryPolicy, sleeper);
    }

    @Override
    public TaskCategory category() {
        return TaskCategory.BUILD;
    }

    @Override
    protected String instructions(Task task) {
        return switch (task.kind()) {
            case BACKEND_PACKAGE -> "Write backend/package.json for an Express + TypeScript service with jest, "
                + "supertest and serverless-http. Output JSON only.";
            case FRONTEND_PACKAGE -> "Write frontend/package.json for a React + TypeScript app with "
                + "react-router-dom and @testing-library/react. Output JSON only.";
            case TYPESCRIPT_CONFIG -> "Write a strict tsconfig.json targeting ES2020 with outDir dist. Output JSON only.";
            case BUILD_SCRIPTS -> "Write a POSIX shell script installing and building every package.";
            default -> throw new IllegalArgumentException("Not a build task: " + task.kind());
        };
    }

    @Override
    protected String stub(Task task) {
        return switch (task.kind()) {
            case BACKEND_PACKAGE -> json(packageManifest("backend",
                Map.of("express", "^4.19.2", "serverless-http", "^3.2.0"),
                Map.of("typescript", "^5.4.5", "jest", "^29.7.0", "ts-jest", "^29.1.2", "supertest", "^7.0.0")));
            case FRONTEND_PACKAGE -> json(packageManifest("frontend",
                Map.of("react", "^18.3.1", "react-dom", "^18.3.1", "react-router-dom", "^6.23.1"),
                Map.of("typescript", "^5.4.5", "@testing-library/react", "^15.0.7")));
            case TYPESCRIPT_CONFIG -> json(tsconfig());
            default -> buildScript();
        };
    }

    private Map<String, Object> packageManifest(String role, Map<String, String> dependencies,
                                                Map<String, String> devDependencies) {
        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("name", context.model().projectId().toLowerCase(Locale.ROOT) + "-" + role);
        manifest.put("version", "1.0.0");
        manifest.put("private", true);
        manifest.put("scripts", Map.of("build", "tsc", "test", "jest"));
        manifest.put("dependencies", new TreeMap<>(dependencies));
        manifest.put("devDependencies", new TreeMap<>(devDependencies));
        return manifest;
    }

    private static Map<String, Object> tsconfig() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("target", "ES2020");
        options.put("module", "commonjs");
        options.put("strict", true);
        options.put("esModuleInterop", true);
        options.put("jsx", "react-jsx");
        options.put("outDir", "dist");
        options.put("baseUrl", ".");
        options.put("paths", Map.of("@/*", List.of("src/*")));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("compilerOptions", options);
        config.put("include", List.of("src", "tests"));
        return config;
    }

    private String buildScript() {
        StringBuilder sb = new StringBuilder();
        sb.append("#!/bin/sh\nset -e\n\n");
        sb.append("(cd backend && npm install && npm run build)\n");
        if (context.model().hasFrontend()) {
            sb.append("(cd frontend && npm install && npm run build)\n");
        }
        return sb.toString();
    }

    private static String json(Object value) {
        try {
            return JSON.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON stub", e);
        }
    }
}
