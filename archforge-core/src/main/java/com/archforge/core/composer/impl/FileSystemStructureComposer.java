package com.archforge.core.composer.impl;

import com.archforge.core.composer.ComposeContext;
import com.archforge.core.composer.StructureComposer;
import com.archforge.core.generator.ExportScanner;
import com.archforge.core.generator.GeneratedArtifact;
import com.archforge.core.planner.TaskCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Composer that writes artifacts to the filesystem.
 *
 * <p>Cleanup walks each managed root, skips preserved names (a preserved directory is kept
 * with its whole subtree), deletes every other file and then removes directories left empty.
 * Files the previous plan generated outside the managed roots are deleted one by one.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ComposeContext context = ComposeContext.of(Path.of("./generated"), config.output());
 * StructureComposer composer = new FileSystemStructureComposer();
 * composer.cleanup(context);
 * composer.write(artifact, context);
 * // Creates: ./generated/backend/src/models/Order.ts
 * }</pre>
 */
public class FileSystemStructureComposer implements StructureComposer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemStructureComposer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public List<String> cleanup(ComposeContext context) {
        List<String> deleted = new ArrayList<>();
        for (String managedRoot : context.managedRoots()) {
            Path root = resolveInside(context.outputRoot(), managedRoot);
            if (!Files.isDirectory(root)) {
                continue;
            }
            try {
                Files.walkFileTree(root, new CleanupVisitor(context, root, deleted));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to clean output directory: " + root, e);
            }
        }
        for (String previous : context.previousFiles()) {
            Path file = resolveInside(context.outputRoot(), previous);
            if (!Files.isRegularFile(file) || context.isPreserved(file)) {
                continue;
            }
            try {
                Files.delete(file);
                deleted.add(previous);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to remove stale file: " + previous, e);
            }
        }
        log.info("Removed {} stale files under {}", deleted.size(), context.outputRoot());
        return deleted;
    }

    @Override
    public Path write(GeneratedArtifact artifact, ComposeContext context) {
        Path target = resolveInside(context.outputRoot(), artifact.path());
        log.debug("Writing file: {}", target);

        try {
            Path parentDir = target.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(target, artifact.content(), StandardCharsets.UTF_8);
            log.debug("Wrote file: {} ({} bytes)", artifact.path(), artifact.content().length());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + artifact.path(), e);
        }
    }

    @Override
    public List<GeneratedArtifact> load(ComposeContext context) {
        List<GeneratedArtifact> artifacts = new ArrayList<>();
        for (String managedRoot : context.managedRoots()) {
            Path root = resolveInside(context.outputRoot(), managedRoot);
            if (!Files.isDirectory(root)) {
                continue;
            }
            try (Stream<Path> files = Files.walk(root)) {
                List<Path> scripts = files
                    .filter(Files::isRegularFile)
                    .filter(file -> isScript(file.getFileName().toString()))
                    .filter(file -> !insidePreservedDirectory(context, root, file))
                    .sorted()
                    .toList();
                for (Path file : scripts) {
                    String relative = context.outputRoot().relativize(file).toString().replace('\\', '/');
                    String content = Files.readString(file, StandardCharsets.UTF_8);
                    artifacts.add(new GeneratedArtifact(relative, relative, content, categoryOf(relative),
                        ExportScanner.scan(content), List.of(), false));
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read output directory: " + root, e);
            }
        }
        log.info("Loaded {} existing artifacts from {}", artifacts.size(), context.outputRoot());
        return artifacts;
    }

    /**
     * Infers the task category of an existing file from its location.
     *
     * @param relativePath output-root relative path
     * @return category
     */
    static TaskCategory categoryOf(String relativePath) {
        if (relativePath.contains("/tests/") || relativePath.contains(".test.")) {
            return TaskCategory.TEST;
        }
        if (relativePath.startsWith("frontend/")) {
            return TaskCategory.FRONTEND;
        }
        if (relativePath.startsWith("shared/")) {
            return TaskCategory.SHARED;
        }
        if (relativePath.startsWith("scripts/")) {
            return TaskCategory.BUILD;
        }
        if (relativePath.startsWith("deploy/")) {
            return TaskCategory.DEPLOY;
        }
        return TaskCategory.BACKEND;
    }

    private static boolean isScript(String fileName) {
        return fileName.endsWith(".ts") || fileName.endsWith(".tsx") || fileName.endsWith(".js") || fileName.endsWith(".jsx");
    }

    private static boolean insidePreservedDirectory(ComposeContext context, Path root, Path file) {
        for (Path dir = file.getParent(); dir != null && !dir.equals(root); dir = dir.getParent()) {
            if (context.isPreserved(dir)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves a relative path and rejects anything landing outside the root.
     *
     * @param root output root
     * @param relativePath artifact or managed-root path
     * @return normalized absolute path
     * @throws IllegalArgumentException if the path escapes the root
     */
    static Path resolveInside(Path root, String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Path escapes output root: " + relativePath);
        }
        return resolved;
    }

    private static final class CleanupVisitor extends SimpleFileVisitor<Path> {
        private final ComposeContext context;
        private final Path managedRoot;
        private final List<String> deleted;

        private CleanupVisitor(ComposeContext context, Path managedRoot, List<String> deleted) {
            this.context = context;
            this.managedRoot = managedRoot;
            this.deleted = deleted;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(managedRoot) && context.isPreserved(dir)) {
                log.debug("Preserving directory: {}", dir);
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            if (context.isPreserved(file)) {
                log.debug("Preserving file: {}", file);
                return FileVisitResult.CONTINUE;
            }
            Files.delete(file);
            deleted.add(context.outputRoot().relativize(file).toString().replace('\\', '/'));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null) {
                throw exc;
            }
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isEmpty()) {
                    Files.delete(dir);
                }
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
