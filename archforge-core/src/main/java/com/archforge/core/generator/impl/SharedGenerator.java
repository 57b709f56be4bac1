package com.archforge.core.generator.impl;

import com.archforge.core.external.TextGenerator;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.generator.base.AbstractArtifactGenerator;
import com.archforge.core.model.Property;
import com.archforge.core.model.Unit;
import com.archforge.core.model.UnitKind;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;


/**
 * Generates the shared package: DTO types, constants and utilities.
 */
public class SharedGenerator extends AbstractArtifactGenerator {

    public SharedGenerator(TextGenerator textGenerator, GenerationContext context,
                           RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper) {
        super(textGenerator, context, retryPolicy, sleeper);
    }

    @Override
    public TaskCategory category() {
        return TaskCategory.SHARED;
    }

    @Override
    protected String instructions(Task task) {
        return switch (task.kind()) {
            case SHARED_TYPES -> "Write exported TypeScript interfaces for these entities, one per entity, named "
                + "<Entity>Dto, carrying the properties only:\n" + entityContracts();
            case SHARED_CONSTANTS -> "Write exported constants shared by backend and frontend, including API_BASE_URL.";
            case SHARED_UTILS -> "Write small exported pure helper functions shared by backend and frontend.";
            default -> throw new IllegalArgumentException("Not a shared task: " + task.kind());
        };
    }

    @Override
    protected String stub(Task task) {
        return switch (task.kind()) {
            case SHARED_TYPES -> typesStub();
            case SHARED_CONSTANTS -> "export const API_BASE_URL = process.env.API_BASE_URL ?? '/api';\n"
                + "export const PROJECT_ID = '" + context.model().projectId() + "';\n";
            default -> "export function isPresent<T>(value: T | null | undefined): value is T {\n"
                + "  return value !== null && value !== undefined;\n"
                + "}\n";
        };
    }

    private String entityContracts() {
        StringBuilder sb = new StringBuilder();
        for (Unit entity : context.model().unitsOfKind(UnitKind.DATA_ENTITY)) {
            context.registry().dataContract(entity.name()).ifPresent(contract -> sb.append(contract.render()));
        }
        return sb.toString();
    }

    private String typesStub() {
        StringBuilder sb = new StringBuilder();
        for (Unit entity : context.model().unitsOfKind(UnitKind.DATA_ENTITY)) {
            sb.append("export interface ").append(entity.name()).append("Dto {\n");
            for (Property property : entity.properties()) {
                sb.append("  ").append(property.name()).append(property.required() ? "" : "?")
                    .append(": ").append(property.type()).append(";\n");
            }
            sb.append("}\n\n");
        }
        if (sb.length() == 0) {
            sb.append("export type Identifier = string;\n");
        }
        return sb.toString().stripTrailing() + "\n";
    }
}
