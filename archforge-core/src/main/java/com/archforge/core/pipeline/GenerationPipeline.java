package com.archforge.core.pipeline;

import com.archforge.core.composer.ComposeContext;
import com.archforge.core.composer.StructureComposer;
import com.archforge.core.config.ProjectConfig;
import com.archforge.core.consistency.ConsistencyEngine;
import com.archforge.core.consistency.ConsistencyReport;
import com.archforge.core.consistency.DriftWarning;
import com.archforge.core.external.BuildValidator;
import com.archforge.core.external.Deployer;
import com.archforge.core.external.DeploymentResult;
import com.archforge.core.external.DiagramSource;
import com.archforge.core.external.TextGenerator;
import com.archforge.core.external.ValidationReport;
import com.archforge.core.generator.GeneratedArtifact;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.GeneratorRegistry;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.linking.GenerationPassResult;
import com.archforge.core.linking.LinkingPass;
import com.archforge.core.linking.LinkingResult;
import com.archforge.core.linking.ReferencePathResolver;
import com.archforge.core.model.DiagramSources;
import com.archforge.core.model.InfraContext;
import com.archforge.core.parser.DiagramParser;
import com.archforge.core.parser.ParseResult;
import com.archforge.core.planner.PlanningCycle;
import com.archforge.core.planner.TaskPlan;
import com.archforge.core.planner.TaskPlanRecord;
import com.archforge.core.planner.TaskPlanWriter;
import com.archforge.core.planner.TaskPlanner;
import com.archforge.core.registry.SymbolRegistry;
import com.archforge.core.run.EmptyModelException;
import com.archforge.core.run.IssueKind;
import com.archforge.core.run.RunContext;
import com.archforge.core.run.RunIssue;
import com.archforge.core.run.RunPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one project from diagrams to a linked, validated and deployed artifact tree.
 *
 * <p>The phases are driven through the run's state machine:
 * <ol>
 *   <li>PARSING: load and parse the diagrams, build the registry, reconcile signatures</li>
 *   <li>PLANNING: derive tasks, order them, write the plan record</li>
 *   <li>GENERATING: clean the managed roots, then Pass A in plan order</li>
 *   <li>LINKING: Pass B over everything Pass A produced</li>
 *   <li>VALIDATING and DEPLOYING, unless skipped</li>
 * </ol>
 *
 * <p>Per-task and per-file failures are recorded on the {@link RunContext} and never end the
 * run. An empty model ends it in {@link RunPhase#FAILED}; so do cancellation and timeout,
 * which leave already-written artifacts in place.
 *
 * <p>One pipeline instance may serve concurrent runs: every piece of run state lives in the
 * context or in locals of {@link #run(RunRequest, RunContext)}.
 */
public class GenerationPipeline {

    private static final Logger log = LoggerFactory.getLogger(GenerationPipeline.class);

    private final DiagramSource diagramSource;
    private final DiagramParser parser;
    private final TextGenerator textGenerator;
    private final BuildValidator buildValidator;
    private final Deployer deployer;
    private final StructureComposer composer;
    private final ConsistencyEngine consistencyEngine;
    private final TaskPlanner planner;
    private final TaskPlanWriter planWriter;
    private final RetryPolicy.Sleeper sleeper;

    public GenerationPipeline(DiagramSource diagramSource, DiagramParser parser, TextGenerator textGenerator,
                              BuildValidator buildValidator, Deployer deployer, StructureComposer composer,
                              RetryPolicy.Sleeper sleeper) {
        this.diagramSource = diagramSource;
        this.parser = parser;
        this.textGenerator = textGenerator;
        this.buildValidator = buildValidator;
        this.deployer = deployer;
        this.composer = composer;
        this.sleeper = sleeper;
        this.consistencyEngine = new ConsistencyEngine();
        this.planner = new TaskPlanner();
        this.planWriter = new TaskPlanWriter();
    }

    /**
     * Executes a run to a terminal phase.
     *
     * @param request run inputs
     * @param context run-scoped context; its state machine must still be queued
     * @return report of the finished run
     */
    public RunReport run(RunRequest request, RunContext context) {
        context.stateMachine().enqueue(phasesFor(request));
        try {
            execute(request, context);
        } catch (EmptyModelException e) {
            log.error("Run {} failed: {}", context.runId(), e.getMessage());
            context.record(RunIssue.error(IssueKind.PRECONDITION, e.getProjectId(), e.getMessage()));
            context.stateMachine().fail();
        } catch (RuntimeException e) {
            log.error("Run {} failed unexpectedly", context.runId(), e);
            context.record(RunIssue.error(IssueKind.PRECONDITION, context.projectId(), String.valueOf(e.getMessage())));
            context.stateMachine().fail();
        }

        RunReport report = RunReport.from(context);
        log.info("Run {} finished in {}: {} ({} errors, {} warnings)", report.runId(), report.phase(),
            report.success() ? "success" : "failure", report.errors().size(), report.warnings().size());
        return report;
    }

    /**
     * Loads, parses and reconciles a project's diagrams.
     *
     * @param projectId project identifier
     * @param infraContext infrastructure settings attached to the model
     * @return parsed and reconciled model with its registry
     * @throws EmptyModelException if the diagrams are blank or yield no units
     */
    public ModelPreparation prepare(String projectId, InfraContext infraContext) {
        DiagramSources sources = diagramSource.load(projectId);
        if (sources.isBlank()) {
            throw new EmptyModelException(projectId, "No diagrams found for project " + projectId);
        }

        ParseResult parse = parser.parse(sources, infraContext);
        if (parse.model().isEmpty()) {
            throw new EmptyModelException(projectId, "Diagrams of project " + projectId + " contain no units");
        }

        SymbolRegistry registry = SymbolRegistry.fromModel(parse.model());
        ConsistencyReport consistency = consistencyEngine.reconcile(parse.model(), registry);
        return new ModelPreparation(parse, consistency, registry);
    }

    /**
     * Plans a prepared model.
     *
     * @param preparation prepared model
     * @return task plan
     */
    public TaskPlan plan(ModelPreparation preparation) {
        return planner.plan(preparation.model());
    }

    // Paths of the last written plan; an unreadable record yields none.
    private List<String> previousFiles(Path planFile) {
        if (!Files.isRegularFile(planFile)) {
            return List.of();
        }
        try {
            List<TaskPlanRecord.TaskEntry> tasks = planWriter.read(planFile).tasks();
            return tasks == null ? List.of() : tasks.stream()
                .map(TaskPlanRecord.TaskEntry::filePath)
                .filter(Objects::nonNull)
                .toList();
        } catch (IllegalStateException e) {
            log.warn("Ignoring previous task plan {}: {}", planFile, e.getMessage());
            return List.of();
        }
    }

    private void execute(RunRequest request, RunContext context) {
        ProjectConfig config = request.config();
        InfraContext infra = new InfraContext(config.infra());

        context.stateMachine().advance();
        ModelPreparation preparation = prepare(request.projectId(), infra);
        preparation.parse().anomalies()
            .forEach(a -> context.record(RunIssue.info(IssueKind.PARSE_ANOMALY, "", a)));
        preparation.consistency().drifts()
            .forEach(d -> context.record(driftIssue(d)));

        context.stateMachine().advance();
        TaskPlan plan = plan(preparation);
        recordPlan(plan, context);
        Path planFile = request.outputRoot().resolve(config.output().planFile());
        List<String> previousFiles = previousFiles(planFile);
        planWriter.write(TaskPlanRecord.of(request.projectId(), plan, preparation.registry()), planFile);

        if (request.dryRun()) {
            log.info("Dry run: stopping after planning ({} tasks)", plan.order().size());
            context.stateMachine().advance();
            return;
        }

        context.stateMachine().advance();
        ComposeContext composeContext = ComposeContext.of(request.outputRoot(), config.output())
            .withPreviousFiles(previousFiles);
        List<String> removed = composer.cleanup(composeContext);
        log.info("Removed {} stale files under {}", removed.size(), composeContext.outputRoot());

        GenerationContext generationContext =
            new GenerationContext(preparation.model(), preparation.registry(), infra);
        GeneratorRegistry generators = GeneratorRegistry.create(
            textGenerator, generationContext, RetryPolicy.from(config.generation()), sleeper);
        LinkingPass linking = new LinkingPass(generators, composer, composeContext, preparation.registry(),
            consistencyEngine, new ReferencePathResolver(config.linking().aliases()));

        GenerationPassResult passA = linking.generateAndRegister(plan.orderedTasks(), context::shouldStop);
        recordGeneration(passA, context);
        if (passA.stopped()) {
            interrupt(context, "generation");
            return;
        }

        context.stateMachine().advance();
        LinkingResult passB = linking.linkAndFix(passA.artifacts());
        recordLinking(passB, context);
        if (context.shouldStop()) {
            interrupt(context, "linking");
            return;
        }

        if (!request.skipValidation()) {
            context.stateMachine().advance();
            ValidationReport validation = buildValidator.validate(composeContext.outputRoot());
            validation.errors().forEach(e -> context.record(RunIssue.error(IssueKind.BUILD_VALIDATION, buildValidator.getId(), e)));
            validation.warnings().forEach(w -> context.record(RunIssue.warning(IssueKind.BUILD_VALIDATION, buildValidator.getId(), w)));
        }

        if (!request.skipDeploy()) {
            context.stateMachine().advance();
            DeploymentResult deployment = deployer.deploy(composeContext.outputRoot(), infra);
            deployment.errors().forEach(e -> context.record(RunIssue.error(IssueKind.DEPLOYMENT, deployer.getId(), e)));
            deployment.deployedUrl().ifPresent(context::setDeploymentUrl);
        }

        context.stateMachine().advance();
    }

    private static List<RunPhase> phasesFor(RunRequest request) {
        List<RunPhase> phases = new ArrayList<>(List.of(RunPhase.PARSING, RunPhase.PLANNING));
        if (!request.dryRun()) {
            phases.add(RunPhase.GENERATING);
            phases.add(RunPhase.LINKING);
            if (!request.skipValidation()) {
                phases.add(RunPhase.VALIDATING);
            }
            if (!request.skipDeploy()) {
                phases.add(RunPhase.DEPLOYING);
            }
        }
        phases.add(RunPhase.DONE);
        return phases;
    }

    private static void recordPlan(TaskPlan plan, RunContext context) {
        context.setGenerationOrder(plan.order());
        context.setCycles(plan.cycles().stream().map(PlanningCycle::describe).toList());
        for (PlanningCycle cycle : plan.cycles()) {
            context.record(RunIssue.warning(IssueKind.PLANNING_CYCLE, String.join(",", cycle.members()),
                "Dependency cycle excluded from generation: " + cycle.describe()));
        }
        for (String blocked : plan.blocked()) {
            context.record(RunIssue.warning(IssueKind.PLANNING_CYCLE, blocked, "Depends on a cycle; excluded from generation"));
        }
        plan.warnings().forEach(w -> context.record(RunIssue.info(IssueKind.PLANNING_CYCLE, "", w)));
    }

    private static void recordGeneration(GenerationPassResult passA, RunContext context) {
        context.setArtifactPaths(passA.artifacts().stream().map(GeneratedArtifact::path).toList());
        context.setStubbedTasks(passA.stubbedTasks());
        for (String taskId : passA.stubbedTasks()) {
            context.record(RunIssue.warning(IssueKind.GENERATION_FAILURE, taskId, "Text generation failed; stub substituted"));
        }
        for (Map.Entry<String, String> failure : passA.failures().entrySet()) {
            context.record(RunIssue.error(IssueKind.GENERATION_FAILURE, failure.getKey(), String.valueOf(failure.getValue())));
        }
    }

    private static void recordLinking(LinkingResult passB, RunContext context) {
        context.setArtifactPaths(passB.artifacts().stream().map(GeneratedArtifact::path).toList());
        passB.errors().forEach(e -> context.record(RunIssue.error(IssueKind.LINKING_FAILURE, "", e)));
        passB.warnings().forEach(w -> context.record(RunIssue.warning(IssueKind.LINKING_FAILURE, "", w)));
        passB.reconciledSignatures().forEach(d -> context.record(driftIssue(d)));
        log.info("Linked {} files ({} edits)", passB.fixedFiles().size(), passB.editCount());
    }

    private static RunIssue driftIssue(DriftWarning drift) {
        return RunIssue.warning(IssueKind.CONSISTENCY_DRIFT, drift.className() + "." + drift.methodName(), drift.message());
    }

    private static void interrupt(RunContext context, String stage) {
        String reason = context.isCancelled() ? "cancelled" : "timed out";
        log.warn("Run {} {} during {}; written artifacts are kept", context.runId(), reason, stage);
        context.record(RunIssue.error(IssueKind.RUN_INTERRUPTED, context.projectId(), "Run " + reason + " during " + stage));
        context.stateMachine().fail();
    }
}
