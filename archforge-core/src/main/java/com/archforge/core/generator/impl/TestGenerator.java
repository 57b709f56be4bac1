package com.archforge.core.generator.impl;

import com.archforge.core.external.TextGenerator;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.generator.base.AbstractArtifactGenerator;
import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Unit;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;

import java.util.List;

/**
 * Generates Jest test suites: unit tests per service and controller, API integration
 * tests and UI end-to-end tests.
 */
public class TestGenerator extends AbstractArtifactGenerator {

    public TestGenerator(TextGenerator textGenerator, GenerationContext context,
                         RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper) {
        super(textGenerator, context, retryPolicy, sleeper);
    }

    @Override
    public TaskCategory category() {
        return TaskCategory.TEST;
    }

    @Override
    protected String instructions(Task task) {
        return switch (task.kind()) {
            case UNIT_TEST -> "Write Jest unit tests for " + task.unitName()
                + ", one describe block per public method, mocking its dependencies.";
            case INTEGRATION_TEST -> "Write Jest integration tests using supertest against the exported app.";
            case E2E_TEST -> "Write end-to-end tests rendering AppRouter with @testing-library/react.";
            default -> throw new IllegalArgumentException("Not a test task: " + task.kind());
        };
    }

    @Override
    protected String stub(Task task) {
        return switch (task.kind()) {
            case UNIT_TEST -> unitTestStub(task.unitName());
            case INTEGRATION_TEST -> "import request from 'supertest';\n\n"
                + "describe('API', () => {\n"
                + "  it('responds', async () => {\n"
                + "    const response = await request(app).post('/health');\n"
                + "    expect(response.status).toBeDefined();\n"
                + "  });\n"
                + "});\n";
            default -> "import React from 'react';\n"
                + "import { render } from '@testing-library/react';\n\n"
                + "describe('App', () => {\n"
                + "  it('renders', () => {\n"
                + "    render(<AppRouter />);\n"
                + "  });\n"
                + "});\n";
        };
    }

    private String unitTestStub(String subject) {
        List<MethodSpec> methods = context.registry().getUnit(subject).map(Unit::methods).orElse(List.of());
        StringBuilder sb = new StringBuilder();
        sb.append("describe('").append(subject).append("', () => {\n");
        sb.append("  const subject = new ").append(subject).append("();\n");
        if (methods.isEmpty()) {
            sb.append("\n  it('is constructed', () => {\n    expect(subject).toBeDefined();\n  });\n");
        }
        for (MethodSpec method : methods) {
            sb.append("\n  it('declares ").append(method.name()).append("', () => {\n")
                .append("    expect(typeof subject.").append(method.name()).append(").toBe('function');\n")
                .append("  });\n");
        }
        sb.append("});\n");
        return sb.toString();
    }
}
