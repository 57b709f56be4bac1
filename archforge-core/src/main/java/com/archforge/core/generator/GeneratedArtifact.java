package com.archforge.core.generator;

import com.archforge.core.planner.TaskCategory;

import java.util.List;
import java.util.Objects;

/**
 * Represents one generated file.
 *
 * @param taskId task that produced the artifact
 * @param path output-root relative path (e.g. {@code backend/src/models/Order.ts})
 * @param content file content
 * @param category category of the producing task
 * @param exports top-level names the content exports
 * @param dependencies symbol names the content uses that other files of the run export
 * @param stub true when the content is a mechanical fallback
 */
public record GeneratedArtifact(
    String taskId,
    String path,
    String content,
    TaskCategory category,
    List<String> exports,
    List<String> dependencies,
    boolean stub
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedArtifact {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(category, "category must not be null");
        exports = exports == null ? List.of() : List.copyOf(exports);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * Returns a copy with new content. Exports are rescanned.
     *
     * @param newContent replacement content
     * @return updated artifact
     */
    public GeneratedArtifact withContent(String newContent) {
        return new GeneratedArtifact(taskId, path, newContent, category, ExportScanner.scan(newContent), dependencies, stub);
    }

    /**
     * Returns a copy with new referenced symbol names.
     *
     * @param newDependencies names the content uses from other files
     * @return updated artifact
     */
    public GeneratedArtifact withDependencies(List<String> newDependencies) {
        return new GeneratedArtifact(taskId, path, content, category, exports, newDependencies, stub);
    }

    public boolean isScript() {
        return path.endsWith(".ts") || path.endsWith(".tsx") || path.endsWith(".js") || path.endsWith(".jsx");
    }
}
