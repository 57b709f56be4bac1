package com.archforge.cli;

import com.archforge.core.composer.ComposeContext;
import com.archforge.core.composer.impl.FileSystemStructureComposer;
import com.archforge.core.config.ProjectConfig;
import com.archforge.core.consistency.ConsistencyEngine;
import com.archforge.core.consistency.DriftWarning;
import com.archforge.core.generator.GeneratedArtifact;
import com.archforge.core.linking.LinkingPass;
import com.archforge.core.linking.LinkingResult;
import com.archforge.core.linking.ReferencePathResolver;
import com.archforge.core.model.InfraContext;
import com.archforge.core.pipeline.PipelineFactory;
import com.archforge.core.registry.SymbolRegistry;
import com.archforge.core.run.EmptyModelException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command re-running the linking pass over an existing output tree.
 *
 * <p>The project's diagrams are parsed again so service and controller signatures are
 * reconciled as in a full run. Without diagrams only imports are linked.
 *
 * <p>Linking is idempotent, so this is safe to run after a crashed or cancelled run, or
 * repeatedly.
 */
@Command(
    name = "link",
    description = "Re-link an existing output tree (idempotent)",
    mixinStandardHelpOptions = true
)
public class LinkCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LinkCommand.class);

    @Mixin
    ProjectOptions project = new ProjectOptions();

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: output.directory from the configuration)"
    )
    private Path outputDir;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = project.loadConfiguration();
            Path outputRoot = project.outputRoot(config, outputDir);
            if (!Files.isDirectory(outputRoot)) {
                System.err.println("✗ Output directory not found: " + outputRoot);
                return 1;
            }

            FileSystemStructureComposer composer = new FileSystemStructureComposer();
            ComposeContext composeContext = ComposeContext.of(outputRoot, config.output());
            List<GeneratedArtifact> artifacts = composer.load(composeContext);
            System.out.println("Linking " + artifacts.size() + " files under " + outputRoot);

            SymbolRegistry registry = modelRegistry(config);
            for (GeneratedArtifact artifact : artifacts) {
                registry.registerExports(artifact.path(), artifact.exports(), artifact.category().layer());
            }

            LinkingPass linking = new LinkingPass(composer, composeContext, registry, new ConsistencyEngine(),
                new ReferencePathResolver(config.linking().aliases()));
            LinkingResult result = linking.linkAndFix(artifacts);

            result.warnings().forEach(w -> System.out.println("  ⚠ " + w));
            for (DriftWarning drift : result.reconciledSignatures()) {
                System.out.println("  ↻ " + drift.message());
            }
            result.errors().forEach(e -> System.err.println("  ✗ " + e));
            System.out.println("✓ " + result.fixedFiles().size() + " files updated, " + result.editCount() + " edits");
            return result.success() ? 0 : 1;

        } catch (Exception e) {
            log.error("Linking failed", e);
            System.err.println("✗ Linking failed: " + e.getMessage());
            return 1;
        }
    }

    private SymbolRegistry modelRegistry(ProjectConfig config) {
        String projectId = project.projectId(config);
        try {
            return PipelineFactory.create(project.diagramRoot(), config)
                .prepare(projectId, new InfraContext(config.infra()))
                .registry();
        } catch (EmptyModelException | IllegalStateException e) {
            log.warn("No usable diagrams for {}: {}", projectId, e.getMessage());
            System.out.println("  ⚠ No diagrams for " + projectId + "; linking imports only");
            return new SymbolRegistry();
        }
    }
}
