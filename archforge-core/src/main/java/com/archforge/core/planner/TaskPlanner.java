package com.archforge.core.planner;

import com.archforge.core.consistency.ConsistencyEngine;
import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.Layer;
import com.archforge.core.model.Relationship;
import com.archforge.core.model.SequenceStep;
import com.archforge.core.model.Unit;
import com.archforge.core.model.UnitKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Expands an architecture model into generation tasks and orders them.
 *
 * <p>Tasks are created category by category (backend, frontend, shared, test, build,
 * deploy) in model order, which is the discovery order the sorter uses as tie-break.
 * Conventional dependencies:
 * <ul>
 *   <li>a service depends on its entity's model task</li>
 *   <li>a controller depends on its service (or entity when there is no service)</li>
 *   <li>a repository depends on its entity, a route on its controller</li>
 *   <li>unit tests depend on their subject, deploy tasks on build tasks</li>
 * </ul>
 * Declared component dependencies and ordering relationships (inheritance, realization,
 * composition) add further edges; sequence calls between units are added last, as edges
 * discovered from the interaction trace.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * TaskPlan plan = new TaskPlanner().plan(model);
 * plan.cycles().forEach(c -> System.err.println("cycle: " + c.describe()));
 * for (Task task : plan.orderedTasks()) {
 *     generate(task);
 * }
 * }</pre>
 */
public class TaskPlanner {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanner.class);

    private final TopologicalSorter sorter;

    public TaskPlanner() {
        this(new TopologicalSorter());
    }

    public TaskPlanner(TopologicalSorter sorter) {
        this.sorter = sorter;
    }

    /**
     * Plans generation for a model.
     *
     * @param model reconciled architecture model
     * @return tasks, graph, order and cycle findings
     */
    public TaskPlan plan(ArchitectureModel model) {
        PlanBuilder builder = new PlanBuilder();

        addBackendTasks(model, builder);
        addFrontendTasks(model, builder);
        addSharedTasks(builder);
        addTestTasks(model, builder);
        addBuildTasks(model, builder);
        addDeployTasks(model, builder);
        addDeclaredEdges(model, builder);
        addSequenceEdges(model, builder);

        TopologicalSorter.SortResult sorted = sorter.sort(builder.dag);
        List<Task> tasks = builder.tasks.values().stream()
            .map(t -> t.withDependencies(builder.dag.dependenciesOf(t.id())))
            .toList();

        log.info("Planned {} tasks, {} schedulable, {} cycles", tasks.size(), sorted.order().size(), sorted.cycles().size());
        return new TaskPlan(tasks, builder.dag.asMap(), sorted.order(), sorted.cycles(), sorted.blocked(), builder.warnings);
    }

    private void addBackendTasks(ArchitectureModel model, PlanBuilder builder) {
        List<Unit> backendUnits = model.units().stream()
            .filter(u -> u.layer() == Layer.ENTITY || u.layer() == Layer.BACKEND)
            .toList();

        for (Unit entity : model.unitsOfKind(UnitKind.DATA_ENTITY)) {
            builder.addUnitTask(entity, TaskKind.MODEL, "Data model for " + entity.name());
        }
        for (Unit unit : backendUnits) {
            switch (unit.kind()) {
                case SERVICE -> builder.addUnitTask(unit, TaskKind.SERVICE, "Business logic for " + unit.name());
                case REPOSITORY -> builder.addUnitTask(unit, TaskKind.REPOSITORY, "Persistence access for " + unit.name());
                case CONTROLLER -> builder.addUnitTask(unit, TaskKind.CONTROLLER, "Request handling for " + unit.name());
                case MIDDLEWARE -> builder.addUnitTask(unit, TaskKind.MIDDLEWARE, "Middleware " + unit.name());
                case UTILITY -> builder.addUnitTask(unit, TaskKind.UTILITY, "Utility " + unit.name());
                default -> {
                    // entities were added above
                }
            }
        }

        for (Unit unit : backendUnits) {
            String resource = resourceName(unit.name(), unit.kind());
            switch (unit.kind()) {
                case SERVICE, REPOSITORY -> builder.edgeToUnit(unit.name(), resource);
                case CONTROLLER -> {
                    if (builder.hasUnitTask(resource + "Service")) {
                        builder.edgeToUnit(unit.name(), resource + "Service");
                    } else {
                        builder.edgeToUnit(unit.name(), resource);
                    }
                }
                default -> {
                    // no conventional dependency
                }
            }
        }

        List<String> routeIds = new ArrayList<>();
        for (Unit controller : model.unitsOfKind(UnitKind.CONTROLLER)) {
            String resource = resourceName(controller.name(), UnitKind.CONTROLLER);
            String routeId = builder.addTask(
                "backend_route_" + resource,
                TaskKind.ROUTE,
                controller.name(),
                "backend/src/routes/" + lowerFirst(resource) + "Routes.ts",
                "HTTP routes for " + controller.name()
            );
            builder.edge(routeId, builder.unitTaskId(controller.name()));
            routeIds.add(routeId);
        }

        if (!backendUnits.isEmpty()) {
            String entryId = builder.addTask("backend_server_entry", TaskKind.SERVER_ENTRY, null,
                "backend/src/handler.ts", "Server entry point wiring all routes");
            routeIds.forEach(routeId -> builder.edge(entryId, routeId));
        }
    }

    private void addFrontendTasks(ArchitectureModel model, PlanBuilder builder) {
        List<String> pageIds = new ArrayList<>();
        List<String> componentIds = new ArrayList<>();
        for (Unit unit : model.units()) {
            switch (unit.kind()) {
                case UI_COMPONENT -> componentIds.add(builder.addUnitTask(unit, TaskKind.COMPONENT, "UI component " + unit.name()));
                case UI_PAGE -> pageIds.add(builder.addUnitTask(unit, TaskKind.PAGE, "Page " + unit.name()));
                case HOOK -> componentIds.add(builder.addUnitTask(unit, TaskKind.HOOK, "Hook " + unit.name()));
                default -> {
                    // not a frontend unit
                }
            }
        }

        if (model.hasFrontend()) {
            String routerId = builder.addTask("frontend_router", TaskKind.ROUTER, null,
                "frontend/src/AppRouter.tsx", "Application router over all pages");
            (pageIds.isEmpty() ? componentIds : pageIds).forEach(id -> builder.edge(routerId, id));
        }
    }

    private void addSharedTasks(PlanBuilder builder) {
        builder.addTask("shared_types", TaskKind.SHARED_TYPES, null, "shared/src/types/index.ts",
            "Shared data transfer types");
        builder.addTask("shared_constants", TaskKind.SHARED_CONSTANTS, null, "shared/src/constants/index.ts",
            "Shared constants");
        builder.addTask("shared_utils", TaskKind.SHARED_UTILS, null, "shared/src/utils/index.ts",
            "Shared utility functions");
    }

    private void addTestTasks(ArchitectureModel model, PlanBuilder builder) {
        for (Unit unit : model.units()) {
            if (unit.kind() == UnitKind.SERVICE || unit.kind() == UnitKind.CONTROLLER) {
                String testId = builder.addTask("test_unit_" + unit.name(), TaskKind.UNIT_TEST, unit.name(),
                    "backend/tests/unit/" + unit.name() + ".test.ts", "Unit tests for " + unit.name());
                builder.edge(testId, builder.unitTaskId(unit.name()));
            }
        }

        if (builder.tasks.containsKey("backend_server_entry")) {
            String integrationId = builder.addTask("test_integration", TaskKind.INTEGRATION_TEST, null,
                "backend/tests/integration/api.test.ts", "API integration tests");
            builder.edge(integrationId, "backend_server_entry");
        }

        if (model.hasFrontend()) {
            String e2eId = builder.addTask("test_e2e", TaskKind.E2E_TEST, null,
                "frontend/tests/e2e/app.test.ts", "End-to-end tests through the UI");
            builder.edge(e2eId, "frontend_router");
        }
    }

    private void addBuildTasks(ArchitectureModel model, PlanBuilder builder) {
        builder.addTask("build_backend_package", TaskKind.BACKEND_PACKAGE, null, "backend/package.json",
            "Backend package manifest");
        builder.addTask("build_backend_tsconfig", TaskKind.TYPESCRIPT_CONFIG, null, "backend/tsconfig.json",
            "Backend TypeScript compiler configuration");
        if (model.hasFrontend()) {
            builder.addTask("build_frontend_package", TaskKind.FRONTEND_PACKAGE, null, "frontend/package.json",
                "Frontend package manifest");
        }
        String scriptsId = builder.addTask("build_scripts", TaskKind.BUILD_SCRIPTS, null, "scripts/build.sh",
            "Build scripts for all packages");
        builder.edge(scriptsId, "build_backend_package");
        if (model.hasFrontend()) {
            builder.edge(scriptsId, "build_frontend_package");
        }
    }

    private void addDeployTasks(ArchitectureModel model, PlanBuilder builder) {
        String packageId = builder.addTask("deploy_package", TaskKind.DEPLOY_PACKAGE, null, "deploy/package.sh",
            "Package the backend for deployment");
        builder.edge(packageId, "build_scripts");

        String functionId = builder.addTask("deploy_function", TaskKind.DEPLOY_FUNCTION, null, "serverless.yml",
            "Deploy the backend as a serverless function");
        builder.edge(functionId, packageId);

        if (model.hasFrontend()) {
            String siteId = builder.addTask("deploy_static_site", TaskKind.DEPLOY_STATIC_SITE, null,
                "deploy/deploy-frontend.sh", "Publish the frontend as a static site");
            builder.edge(siteId, "build_frontend_package");
            builder.edge(siteId, packageId);
        }
    }

    private void addDeclaredEdges(ArchitectureModel model, PlanBuilder builder) {
        for (Unit unit : model.units()) {
            for (String dependency : unit.dependencies()) {
                builder.edgeToUnit(unit.name(), dependency);
            }
        }
        for (Relationship relationship : model.relationships()) {
            if (relationship.kind().ordersGeneration()) {
                builder.edgeToUnit(relationship.source(), relationship.target());
            }
        }
    }

    private void addSequenceEdges(ArchitectureModel model, PlanBuilder builder) {
        for (SequenceStep step : model.sequenceSteps()) {
            if (builder.hasUnitTask(step.from()) && builder.hasUnitTask(step.to()) && !step.from().equals(step.to())) {
                if (builder.dag.addEdge(builder.unitTaskId(step.from()), builder.unitTaskId(step.to()))) {
                    log.debug("Sequence call {} -> {} added a task dependency", step.from(), step.to());
                }
            }
        }
    }

    private static String resourceName(String unitName, UnitKind kind) {
        if (kind == UnitKind.REPOSITORY && unitName.endsWith("Repository")) {
            return unitName.substring(0, unitName.length() - "Repository".length());
        }
        return ConsistencyEngine.resourceOf(unitName).orElse(unitName);
    }

    private static String lowerFirst(String value) {
        return value.isEmpty() ? value : value.substring(0, 1).toLowerCase(Locale.ROOT) + value.substring(1);
    }

    /**
     * Mutable state of one planning call.
     */
    private static final class PlanBuilder {
        private final Map<String, Task> tasks = new LinkedHashMap<>();
        private final Map<String, String> unitTasks = new LinkedHashMap<>();
        private final TaskDag dag = new TaskDag();
        private final List<String> warnings = new ArrayList<>();

        private String addUnitTask(Unit unit, TaskKind kind, String description) {
            String id = kind.category().name().toLowerCase(Locale.ROOT) + "_" + kind.name().toLowerCase(Locale.ROOT) + "_" + unit.name();
            addTask(id, kind, unit.name(), unit.filePath(), description);
            unitTasks.putIfAbsent(unit.name(), id);
            return id;
        }

        private String addTask(String id, TaskKind kind, String unitName, String filePath, String description) {
            tasks.put(id, new Task(id, kind, unitName, filePath, List.of(), kind.defaultPriority(), description));
            dag.addTask(id);
            return id;
        }

        private boolean hasUnitTask(String unitName) {
            return unitTasks.containsKey(unitName);
        }

        private String unitTaskId(String unitName) {
            return unitTasks.get(unitName);
        }

        private void edgeToUnit(String fromUnit, String toUnit) {
            Optional<String> from = Optional.ofNullable(unitTasks.get(fromUnit));
            Optional<String> to = Optional.ofNullable(unitTasks.get(toUnit));
            if (from.isPresent() && to.isPresent()) {
                dag.addEdge(from.get(), to.get());
            } else if (from.isPresent()) {
                log.debug("Dependency {} -> {} has no task, ignored", fromUnit, toUnit);
            }
        }

        private void edge(String from, String to) {
            if (from == null || to == null) {
                return;
            }
            if (!dag.contains(to)) {
                String warning = "Dropped edge " + from + " -> " + to + ": unknown task";
                log.warn(warning);
                warnings.add(warning);
                return;
            }
            dag.addEdge(from, to);
        }
    }
}
