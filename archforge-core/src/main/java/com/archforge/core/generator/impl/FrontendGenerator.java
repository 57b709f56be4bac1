package com.archforge.core.generator.impl;

import com.archforge.core.external.TextGenerator;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.generator.base.AbstractArtifactGenerator;
import com.archforge.core.generator.base.TypeScriptStubs;
import com.archforge.core.model.Unit;
import com.archforge.core.model.UnitKind;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;

import java.util.List;
import java.util.Locale;

/**
 * Generates React artifacts: components, pages, hooks and the application router.
 */
public class FrontendGenerator extends AbstractArtifactGenerator {

    public FrontendGenerator(TextGenerator textGenerator, GenerationContext context,
                             RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper) {
        super(textGenerator, context, retryPolicy, sleeper);
    }

    @Override
    public TaskCategory category() {
        return TaskCategory.FRONTEND;
    }

    @Override
    protected String instructions(Task task) {
        return switch (task.kind()) {
            case COMPONENT -> "Write the React function component " + task.unitName()
                + " in TypeScript. Export it by name and as default.";
            case PAGE -> "Write the React page " + task.unitName()
                + " composing the existing components. Export it by name and as default.";
            case HOOK -> "Write the React hook " + task.unitName() + " calling the backend API with fetch.";
            case ROUTER -> "Write AppRouter using react-router-dom with one route per existing page.";
            default -> throw new IllegalArgumentException("Not a frontend task: " + task.kind());
        };
    }

    @Override
    protected String stub(Task task) {
        return switch (task.kind()) {
            case HOOK -> hookStub(task.unitName());
            case ROUTER -> routerStub();
            default -> componentStub(task.unitName());
        };
    }

    private static String componentStub(String name) {
        return "import React from 'react';\n\n"
            + "export function " + name + "(): JSX.Element {\n"
            + "  return <div className=\"" + name.toLowerCase(Locale.ROOT) + "\">" + name + "</div>;\n"
            + "}\n\n"
            + "export default " + name + ";\n";
    }

    private static String hookStub(String name) {
        return "import { useState } from 'react';\n\n"
            + "export function " + name + "() {\n"
            + "  const [data, setData] = useState<unknown>(null);\n"
            + "  return { data, setData };\n"
            + "}\n";
    }

    private String routerStub() {
        List<Unit> pages = context.model().unitsOfKind(UnitKind.UI_PAGE);
        List<Unit> targets = pages.isEmpty() ? context.model().unitsOfKind(UnitKind.UI_COMPONENT) : pages;

        StringBuilder sb = new StringBuilder();
        sb.append("import React from 'react';\n");
        sb.append("import { BrowserRouter, Route, Routes } from 'react-router-dom';\n\n");
        sb.append("export function AppRouter(): JSX.Element {\n");
        sb.append("  return (\n    <BrowserRouter>\n      <Routes>\n");
        boolean first = true;
        for (Unit target : targets) {
            String path = first ? "/" : "/" + TypeScriptStubs.lowerFirst(target.name());
            sb.append("        <Route path=\"").append(path).append("\" element={<")
                .append(target.name()).append(" />} />\n");
            first = false;
        }
        sb.append("      </Routes>\n    </BrowserRouter>\n  );\n}\n\nexport default AppRouter;\n");
        return sb.toString();
    }
}
