package com.archforge.core.composer;

import com.archforge.core.config.ProjectConfig.OutputConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Context provided to composers.
 *
 * @param outputRoot root every artifact path is relative to
 * @param managedRoots top-level directories owned by generation and cleaned before writing
 * @param preserved file and directory names never deleted during cleanup
 * @param previousFiles output-root relative paths the previous plan generated, removed during
 *                      cleanup wherever they live (e.g. a root-level {@code serverless.yml})
 */
public record ComposeContext(
    Path outputRoot,
    List<String> managedRoots,
    Set<String> preserved,
    List<String> previousFiles
) {
    /**
     * Compact constructor with validation.
     */
    public ComposeContext {
        Objects.requireNonNull(outputRoot, "outputRoot must not be null");
        outputRoot = outputRoot.toAbsolutePath().normalize();
        managedRoots = managedRoots == null ? OutputConfig.DEFAULT_MANAGED_ROOTS : List.copyOf(managedRoots);
        preserved = preserved == null ? Set.copyOf(OutputConfig.DEFAULT_PRESERVE) : Set.copyOf(preserved);
        previousFiles = previousFiles == null ? List.of() : List.copyOf(previousFiles);
    }

    public ComposeContext(Path outputRoot, List<String> managedRoots, Set<String> preserved) {
        this(outputRoot, managedRoots, preserved, null);
    }

    /**
     * Creates a context from output configuration.
     *
     * @param outputRoot resolved output root
     * @param config output configuration
     * @return compose context
     */
    public static ComposeContext of(Path outputRoot, OutputConfig config) {
        return new ComposeContext(outputRoot, config.managedRoots(), Set.copyOf(config.preserve()));
    }

    /**
     * Returns a copy that also removes the given files of the previous plan during cleanup.
     *
     * @param files output-root relative paths
     * @return updated context
     */
    public ComposeContext withPreviousFiles(List<String> files) {
        return new ComposeContext(outputRoot, managedRoots, preserved, files);
    }

    public boolean isPreserved(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && preserved.contains(fileName.toString());
    }
}
