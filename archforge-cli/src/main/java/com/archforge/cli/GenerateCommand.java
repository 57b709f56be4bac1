package com.archforge.cli;

import com.archforge.core.config.ProjectConfig;
import com.archforge.core.pipeline.GenerationPipeline;
import com.archforge.core.pipeline.PipelineFactory;
import com.archforge.core.pipeline.RunCoordinator;
import com.archforge.core.pipeline.RunReport;
import com.archforge.core.pipeline.RunRequest;
import com.archforge.core.run.RunIssue;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command running the full generation pipeline.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Generate from ./diagrams/<project.name>
 * archforge generate
 *
 * # Plan only
 * archforge generate --dry-run
 *
 * # Generate without build validation or deployment
 * archforge generate --skip-validation --skip-deploy
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate application code from architecture diagrams",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    ProjectOptions project = new ProjectOptions();

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(names = {"--dry-run"}, description = "Parse and plan, but generate nothing")
    private boolean dryRun;

    @Option(names = {"--skip-validation"}, description = "Do not run build validation")
    private boolean skipValidation;

    @Option(names = {"--skip-deploy"}, description = "Do not deploy")
    private boolean skipDeploy;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = project.loadConfiguration();
            String projectId = project.projectId(config);
            Path outputRoot = project.outputRoot(config, outputDir);

            log.info("Generating project {} into {}", projectId, outputRoot);
            System.out.println("Generating project: " + projectId);
            System.out.println("Output directory:   " + outputRoot);
            if (dryRun) {
                System.out.println("Running in dry-run mode (only the task plan will be written)");
            }
            System.out.println();

            GenerationPipeline pipeline = PipelineFactory.create(project.diagramRoot(), config);
            RunRequest request = new RunRequest(projectId, outputRoot, config, dryRun, skipValidation, skipDeploy);

            RunReport report;
            try (RunCoordinator coordinator = new RunCoordinator(pipeline)) {
                report = coordinator.submit(request).join();
            }

            printReport(report);
            return report.success() ? 0 : 1;

        } catch (Exception e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    private void printReport(RunReport report) {
        System.out.println("✓ Planned " + report.generationOrder().size() + " tasks");
        report.cycles().forEach(cycle -> System.out.println("  ⚠ cycle: " + cycle));
        if (!report.artifactPaths().isEmpty()) {
            System.out.println("✓ Wrote " + report.artifactPaths().size() + " artifacts ("
                + report.stubbedTasks().size() + " stubs)");
        }
        report.deployedUrl().ifPresent(url -> System.out.println("✓ Deployed to " + url));

        for (RunIssue warning : report.warnings()) {
            System.out.println("  ⚠ " + warning.describe());
        }
        for (RunIssue error : report.errors()) {
            System.err.println("  ✗ " + error.describe());
        }

        System.out.println();
        if (report.success()) {
            System.out.println("✓ Run " + report.runId() + " complete (" + report.phase() + ")");
        } else {
            System.err.println("✗ Run " + report.runId() + " ended " + report.phase()
                + " with " + report.errors().size() + " errors");
        }
    }
}
