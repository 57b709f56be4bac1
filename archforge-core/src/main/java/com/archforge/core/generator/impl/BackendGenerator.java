package com.archforge.core.generator.impl;

import com.archforge.core.consistency.ConsistencyEngine;
import com.archforge.core.external.TextGenerator;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.generator.base.AbstractArtifactGenerator;
import com.archforge.core.generator.base.TypeScriptStubs;
import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Unit;
import com.archforge.core.model.UnitKind;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;

import java.util.List;
import java.util.Locale;

/**
 * Generates backend artifacts: models, services, repositories, controllers, middleware,
 * utilities, HTTP routes and the server entry point.
 */
public class BackendGenerator extends AbstractArtifactGenerator {

    public BackendGenerator(TextGenerator textGenerator, GenerationContext context,
                            RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper) {
        super(textGenerator, context, retryPolicy, sleeper);
    }

    @Override
    public TaskCategory category() {
        return TaskCategory.BACKEND;
    }

    @Override
    protected String instructions(Task task) {
        return switch (task.kind()) {
            case MODEL -> "Write a TypeScript class named " + task.unitName()
                + " with exactly the properties and methods of its contract. Export the class.";
            case SERVICE -> "Write the TypeScript service class " + task.unitName()
                + ". Implement every listed signature exactly. Keep business logic here, no HTTP concerns.";
            case REPOSITORY -> "Write the TypeScript repository class " + task.unitName()
                + " persisting its entity in memory behind async methods.";
            case CONTROLLER -> "Write the TypeScript controller class " + task.unitName()
                + ". Delegate to the matching service and keep every listed signature exactly.";
            case MIDDLEWARE -> "Write Express middleware " + task.unitName() + " as an exported class.";
            case UTILITY -> "Write the exported utility " + task.unitName() + ".";
            case ROUTE -> "Write an Express router exposing every public method of " + task.unitName()
                + " as a POST endpoint. Export the router as a named const.";
            case SERVER_ENTRY -> "Write the Express application entry point. Register every router from the "
                + "existing modules, enable JSON bodies and export both the app and a serverless handler.";
            default -> throw new IllegalArgumentException("Not a backend task: " + task.kind());
        };
    }

    @Override
    protected String stub(Task task) {
        return switch (task.kind()) {
            case ROUTE -> routeStub(task);
            case SERVER_ENTRY -> serverEntryStub();
            default -> unit(task).map(TypeScriptStubs::classStub)
                .orElseGet(() -> "export class " + task.unitName() + " {}\n");
        };
    }

    /**
     * Returns the name of the router const exported for a controller.
     *
     * @param controllerName controller unit name
     * @return e.g. {@code orderRoutes} for {@code OrderController}
     */
    static String routerName(String controllerName) {
        String resource = ConsistencyEngine.resourceOf(controllerName).orElse(controllerName);
        return TypeScriptStubs.lowerFirst(resource) + "Routes";
    }

    private String routeStub(Task task) {
        String controller = task.unitName();
        String router = routerName(controller);
        String basePath = "/" + ConsistencyEngine.resourceOf(controller).orElse(controller).toLowerCase(Locale.ROOT);
        List<MethodSpec> methods = unit(task).map(Unit::methods).orElse(List.of());

        StringBuilder sb = new StringBuilder();
        sb.append("import { Router } from 'express';\n\n");
        sb.append("export const ").append(router).append(" = Router();\n");
        sb.append("const controller = new ").append(controller).append("();\n");
        for (MethodSpec method : methods) {
            String args = method.parameters().isEmpty() ? "" : "req.body";
            sb.append('\n')
                .append(router).append(".post('").append(basePath).append('/').append(method.name())
                .append("', async (req, res) => {\n")
                .append("  res.json(await (controller as any).").append(method.name()).append('(').append(args).append("));\n")
                .append("});\n");
        }
        return sb.toString();
    }

    private String serverEntryStub() {
        StringBuilder sb = new StringBuilder();
        sb.append("import express from 'express';\n");
        sb.append("import serverless from 'serverless-http';\n\n");
        sb.append("export const app = express();\n");
        sb.append("app.use(express.json());\n");
        for (Unit controller : context.model().unitsOfKind(UnitKind.CONTROLLER)) {
            sb.append("app.use(").append(routerName(controller.name())).append(");\n");
        }
        sb.append("\nexport const handler = serverless(app);\n");
        return sb.toString();
    }
}
