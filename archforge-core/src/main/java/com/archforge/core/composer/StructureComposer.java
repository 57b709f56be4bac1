package com.archforge.core.composer;

import com.archforge.core.generator.GeneratedArtifact;

import java.nio.file.Path;
import java.util.List;

/**
 * Lays generated artifacts out on a target.
 *
 * <p>Composition always starts by removing previously generated output under the managed
 * roots, so stale files can never satisfy a later reference check. Names on the preserve
 * list (configuration and lock files) survive cleanup.
 *
 * <p>Implementations throw {@link IllegalStateException} when the target cannot be written
 * and {@link IllegalArgumentException} for artifact paths escaping the output root.
 *
 * @see ComposeContext
 */
public interface StructureComposer {

    /**
     * Returns unique identifier for this composer.
     *
     * @return composer identifier (e.g. "filesystem")
     */
    String getId();

    /**
     * Removes previously generated output under the managed roots, and the files of the
     * previous plan listed in {@link ComposeContext#previousFiles()}.
     *
     * @param context compose context
     * @return output-root relative paths removed
     */
    List<String> cleanup(ComposeContext context);

    /**
     * Writes a single artifact, creating parent directories lazily.
     *
     * @param artifact artifact to write
     * @param context compose context
     * @return absolute path written
     */
    Path write(GeneratedArtifact artifact, ComposeContext context);

    /**
     * Reads previously composed script artifacts back from the target.
     *
     * <p>Used to re-run linking over an existing output tree. Preserved directories are skipped.
     *
     * @param context compose context
     * @return artifacts found under the managed roots, ordered by path
     */
    List<GeneratedArtifact> load(ComposeContext context);

    /**
     * Cleans the managed roots, then writes every artifact.
     *
     * @param artifacts artifacts to write
     * @param context compose context
     * @return written and deleted paths
     */
    default CompositionResult compose(List<GeneratedArtifact> artifacts, ComposeContext context) {
        List<String> deleted = cleanup(context);
        List<String> written = artifacts.stream()
            .map(artifact -> {
                write(artifact, context);
                return artifact.path();
            })
            .toList();
        return new CompositionResult(written, deleted);
    }
}
