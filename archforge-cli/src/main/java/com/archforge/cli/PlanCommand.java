package com.archforge.cli;

import com.archforge.core.config.ProjectConfig;
import com.archforge.core.model.InfraContext;
import com.archforge.core.pipeline.GenerationPipeline;
import com.archforge.core.pipeline.ModelPreparation;
import com.archforge.core.pipeline.PipelineFactory;
import com.archforge.core.planner.PlanningCycle;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskPlan;
import com.archforge.core.planner.TaskPlanRecord;
import com.archforge.core.planner.TaskPlanWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command that parses, reconciles and plans a project, then writes the task-plan record.
 */
@Command(
    name = "plan",
    description = "Compute the generation order and write the task-plan record",
    mixinStandardHelpOptions = true
)
public class PlanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlanCommand.class);

    @Mixin
    ProjectOptions project = new ProjectOptions();

    @Option(
        names = {"-o", "--output"},
        description = "Plan file (default: <output directory>/<output.planFile>)"
    )
    private Path planFile;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = project.loadConfiguration();
            String projectId = project.projectId(config);

            GenerationPipeline pipeline = PipelineFactory.create(project.diagramRoot(), config);
            ModelPreparation preparation = pipeline.prepare(projectId, new InfraContext(config.infra()));
            TaskPlan plan = pipeline.plan(preparation);

            Path target = planFile != null
                ? planFile
                : project.outputRoot(config, null).resolve(config.output().planFile());
            new TaskPlanWriter().write(TaskPlanRecord.of(projectId, plan, preparation.registry()), target);

            System.out.println("Generation order for " + projectId + ":");
            int position = 1;
            for (Task task : plan.orderedTasks()) {
                System.out.printf("  %3d. %-40s %s%n", position++, task.id(), task.filePath());
            }
            for (PlanningCycle cycle : plan.cycles()) {
                System.out.println("  ⚠ cycle excluded: " + cycle.describe());
            }
            for (String blocked : plan.blocked()) {
                System.out.println("  ⚠ blocked by cycle: " + blocked);
            }

            System.out.println();
            System.out.println("✓ Wrote task plan: " + target.toAbsolutePath());
            return 0;

        } catch (Exception e) {
            log.error("Planning failed", e);
            System.err.println("✗ Planning failed: " + e.getMessage());
            return 1;
        }
    }
}
