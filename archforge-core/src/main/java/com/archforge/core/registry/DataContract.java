package com.archforge.core.registry;

import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Property;

import java.util.List;
import java.util.Objects;

/**
 * Per-unit contract view used to ground generation prompts.
 *
 * @param unitName unit name
 * @param properties declared properties
 * @param methods declared methods, after consistency repair
 * @param dependencies names of units this unit depends on
 * @param usedBy names of units depending on this unit
 */
public record DataContract(
    String unitName,
    List<Property> properties,
    List<MethodSpec> methods,
    List<String> dependencies,
    List<String> usedBy
) {
    /**
     * Compact constructor with validation.
     */
    public DataContract {
        Objects.requireNonNull(unitName, "unitName must not be null");
        properties = properties == null ? List.of() : List.copyOf(properties);
        methods = methods == null ? List.of() : List.copyOf(methods);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        usedBy = usedBy == null ? List.of() : List.copyOf(usedBy);
    }

    /**
     * Renders the contract as TypeScript interface text.
     *
     * @return interface declaration named {@code I<unitName>}
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("interface I").append(unitName).append(" {\n");
        for (Property property : properties) {
            sb.append("  ").append(property.name()).append(property.required() ? "" : "?")
                .append(": ").append(property.type()).append(";\n");
        }
        for (MethodSpec method : methods) {
            sb.append("  ").append(method.signature()).append(";\n");
        }
        sb.append("}\n");
        if (!dependencies.isEmpty()) {
            sb.append("// depends on: ").append(String.join(", ", dependencies)).append('\n');
        }
        if (!usedBy.isEmpty()) {
            sb.append("// used by: ").append(String.join(", ", usedBy)).append('\n');
        }
        return sb.toString();
    }
}
