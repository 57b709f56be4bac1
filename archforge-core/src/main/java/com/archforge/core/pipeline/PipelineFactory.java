package com.archforge.core.pipeline;

import com.archforge.core.composer.impl.FileSystemStructureComposer;
import com.archforge.core.config.ProjectConfig;
import com.archforge.core.config.ProjectConfig.ValidationConfig;
import com.archforge.core.external.BuildValidator;
import com.archforge.core.external.TextGenerator;
import com.archforge.core.external.impl.CommandBuildValidator;
import com.archforge.core.external.impl.FileSystemDiagramSource;
import com.archforge.core.external.impl.NoOpBuildValidator;
import com.archforge.core.external.impl.NoOpDeployer;
import com.archforge.core.external.impl.OpenAiCompatibleTextGenerator;
import com.archforge.core.external.impl.UnavailableTextGenerator;
import com.archforge.core.parser.impl.MermaidDiagramParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires a {@link GenerationPipeline} from configuration.
 */
public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private PipelineFactory() {
    }

    /**
     * Creates a pipeline reading diagrams from the filesystem.
     *
     * @param diagramRoot directory holding one sub-directory of diagrams per project
     * @param config project configuration
     * @return configured pipeline
     */
    public static GenerationPipeline create(Path diagramRoot, ProjectConfig config) {
        return new GenerationPipeline(
            new FileSystemDiagramSource(diagramRoot),
            new MermaidDiagramParser(),
            textGenerator(config),
            buildValidator(config),
            new NoOpDeployer(),
            new FileSystemStructureComposer(),
            Thread::sleep
        );
    }

    static TextGenerator textGenerator(ProjectConfig config) {
        if (!config.generation().hasProvider()) {
            log.warn("No text-generation provider configured; every artifact will be a stub");
            return new UnavailableTextGenerator();
        }
        log.info("Using text-generation provider '{}' with model {}", config.generation().provider(), config.generation().model());
        return new OpenAiCompatibleTextGenerator(config.generation());
    }

    static BuildValidator buildValidator(ProjectConfig config) {
        ValidationConfig validation = config.validation();
        if (!validation.isEnabled()) {
            return new NoOpBuildValidator();
        }
        return new CommandBuildValidator(validation.command(), validation.workingDirectory(),
            Duration.ofSeconds(config.run().timeoutSeconds()));
    }
}
