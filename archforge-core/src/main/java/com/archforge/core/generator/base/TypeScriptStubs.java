package com.archforge.core.generator.base;

import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Property;
import com.archforge.core.model.Unit;
import com.archforge.core.model.Visibility;

import java.util.Locale;

/**
 * Renders mechanical TypeScript fallbacks from model units.
 */
public final class TypeScriptStubs {

    private TypeScriptStubs() {
        // Utility class
    }

    /**
     * Renders an exported class with declared properties and throwing method bodies.
     *
     * @param unit unit to render
     * @return class source
     */
    public static String classStub(Unit unit) {
        StringBuilder sb = new StringBuilder();
        sb.append("export class ").append(unit.name()).append(" {\n");
        for (Property property : unit.properties()) {
            sb.append("  ").append(modifier(property.visibility()))
                .append(property.name()).append(property.required() ? "!" : "?")
                .append(": ").append(property.type()).append(";\n");
        }
        if (!unit.properties().isEmpty() && !unit.methods().isEmpty()) {
            sb.append('\n');
        }
        for (MethodSpec method : unit.methods()) {
            sb.append(methodStub(unit.name(), method));
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Renders one method whose body throws.
     *
     * @param owner owning class name, used in the error message
     * @param method method to render
     * @return method source, indented for a class body
     */
    public static String methodStub(String owner, MethodSpec method) {
        return "  " + modifier(method.visibility()) + method.signature() + " {\n"
            + "    throw new Error('Not implemented: " + owner + "." + method.name() + "');\n"
            + "  }\n";
    }

    public static String lowerFirst(String value) {
        return value.isEmpty() ? value : value.substring(0, 1).toLowerCase(Locale.ROOT) + value.substring(1);
    }

    private static String modifier(Visibility visibility) {
        return switch (visibility) {
            case PRIVATE -> "private ";
            case PROTECTED -> "protected ";
            case PUBLIC, PACKAGE -> "";
        };
    }
}
