package com.archforge.cli;

import com.archforge.core.config.ProjectConfig;
import com.archforge.core.consistency.DriftWarning;
import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.InfraContext;
import com.archforge.core.model.UnitKind;
import com.archforge.core.pipeline.GenerationPipeline;
import com.archforge.core.pipeline.ModelPreparation;
import com.archforge.core.pipeline.PipelineFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Command to validate a project's diagrams without generating anything.
 */
@Command(
    name = "validate",
    description = "Parse diagrams and report anomalies and signature drift",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Mixin
    ProjectOptions project = new ProjectOptions();

    @Override
    public Integer call() {
        try {
            ProjectConfig config = project.loadConfiguration();
            String projectId = project.projectId(config);
            log.info("Validating diagrams of project {}", projectId);

            GenerationPipeline pipeline = PipelineFactory.create(project.diagramRoot(), config);
            ModelPreparation preparation = pipeline.prepare(projectId, new InfraContext(config.infra()));
            ArchitectureModel model = preparation.model();

            System.out.println("Architecture Model Summary:");
            for (UnitKind kind : UnitKind.values()) {
                int count = model.unitsOfKind(kind).size();
                if (count > 0) {
                    System.out.printf("  %-16s %d%n", kind + ":", count);
                }
            }
            System.out.printf("  %-16s %d%n", "Relationships:", model.relationships().size());
            System.out.printf("  %-16s %d%n", "Sequence steps:", model.sequenceSteps().size());
            System.out.println();

            preparation.parse().anomalies().forEach(a -> System.out.println("  ⚠ ignored line: " + a));
            preparation.parse().backfilledMethods().forEach(m -> System.out.println("  + method from sequence: " + m));
            for (DriftWarning drift : preparation.consistency().drifts()) {
                System.out.println("  ⚠ " + drift.message());
            }

            System.out.println("✓ " + preparation.consistency().consistentMethods().size() + " consistent methods, "
                + preparation.consistency().drifts().size() + " drifts corrected");
            return 0;

        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
