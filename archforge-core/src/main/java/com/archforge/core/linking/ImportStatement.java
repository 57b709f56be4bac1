package com.archforge.core.linking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One ES module import statement.
 *
 * <p>Supported forms: named ({@code import { A, B as C } from 'x'}), default, namespace
 * ({@code import * as X from 'x'}), combinations of default with named or namespace,
 * {@code import type} and side-effect imports ({@code import 'x'}).
 *
 * @param typeOnly true for {@code import type}
 * @param defaultName default binding, null if absent
 * @param namespace namespace binding, null if absent
 * @param named named entries as written, e.g. {@code A} or {@code B as C}
 * @param source module specifier
 * @param sideEffect true for a bare {@code import 'x'}
 */
public record ImportStatement(
    boolean typeOnly,
    String defaultName,
    String namespace,
    List<String> named,
    String source,
    boolean sideEffect
) {
    private static final Pattern BINDING_IMPORT = Pattern.compile(
        "^\\s*import\\s+(type\\s+)?(?:([A-Za-z_$][\\w$]*)\\s*,?\\s*)?"
            + "(?:\\{([^}]*)}|\\*\\s*as\\s+([A-Za-z_$][\\w$]*))?\\s*from\\s*['\"]([^'\"]+)['\"]\\s*;?\\s*$",
        Pattern.DOTALL);

    private static final Pattern SIDE_EFFECT_IMPORT = Pattern.compile("^\\s*import\\s*['\"]([^'\"]+)['\"]\\s*;?\\s*$");

    /**
     * Compact constructor with validation.
     */
    public ImportStatement {
        Objects.requireNonNull(source, "source must not be null");
        named = named == null ? List.of() : List.copyOf(named);
    }

    /**
     * Creates a named import.
     *
     * @param source module specifier
     * @param names imported names
     * @return import statement
     */
    public static ImportStatement named(String source, List<String> names) {
        return new ImportStatement(false, null, null, names, source, false);
    }

    /**
     * Parses one statement; multi-line named lists must already be joined.
     *
     * @param text statement text
     * @return parsed statement, empty when the text is not a recognised import
     */
    public static Optional<ImportStatement> parse(String text) {
        Matcher sideEffect = SIDE_EFFECT_IMPORT.matcher(text);
        if (sideEffect.matches()) {
            return Optional.of(new ImportStatement(false, null, null, List.of(), sideEffect.group(1), true));
        }
        Matcher matcher = BINDING_IMPORT.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        if (matcher.group(2) == null && matcher.group(3) == null && matcher.group(4) == null) {
            return Optional.empty();
        }
        List<String> named = new ArrayList<>();
        if (matcher.group(3) != null) {
            for (String entry : matcher.group(3).split(",")) {
                String trimmed = entry.trim().replaceAll("\\s+", " ");
                if (!trimmed.isEmpty()) {
                    named.add(trimmed);
                }
            }
        }
        return Optional.of(new ImportStatement(matcher.group(1) != null, matcher.group(2), matcher.group(4),
            named, matcher.group(5), false));
    }

    /**
     * Returns the local name an entry binds ({@code C} for {@code B as C}).
     *
     * @param entry named entry
     * @return local binding
     */
    public static String localName(String entry) {
        String name = entry.startsWith("type ") ? entry.substring(5).trim() : entry;
        int alias = name.indexOf(" as ");
        return alias >= 0 ? name.substring(alias + 4).trim() : name;
    }

    /**
     * Returns every local name this statement binds.
     *
     * @return bound names in statement order
     */
    public Set<String> boundNames() {
        Set<String> names = new LinkedHashSet<>();
        if (defaultName != null) {
            names.add(defaultName);
        }
        if (namespace != null) {
            names.add(namespace);
        }
        named.forEach(entry -> names.add(localName(entry)));
        return names;
    }

    public boolean isEmpty() {
        return !sideEffect && defaultName == null && namespace == null && named.isEmpty();
    }

    public ImportStatement withNamed(List<String> newNamed) {
        return new ImportStatement(typeOnly, defaultName, namespace, newNamed, source, sideEffect);
    }

    public ImportStatement withoutDefault() {
        return new ImportStatement(typeOnly, null, namespace, named, source, sideEffect);
    }

    public ImportStatement withoutNamespace() {
        return new ImportStatement(typeOnly, defaultName, null, named, source, sideEffect);
    }

    public ImportStatement withSource(String newSource) {
        return new ImportStatement(typeOnly, defaultName, namespace, named, newSource, sideEffect);
    }

    /**
     * Formats the statement on a single line with single quotes.
     *
     * @return statement text ending with a semicolon
     */
    public String format() {
        if (sideEffect) {
            return "import '" + source + "';";
        }
        StringBuilder sb = new StringBuilder("import ");
        if (typeOnly) {
            sb.append("type ");
        }
        List<String> bindings = new ArrayList<>();
        if (defaultName != null) {
            bindings.add(defaultName);
        }
        if (namespace != null) {
            bindings.add("* as " + namespace);
        }
        if (!named.isEmpty()) {
            bindings.add("{ " + String.join(", ", named) + " }");
        }
        sb.append(String.join(", ", bindings)).append(" from '").append(source).append("';");
        return sb.toString();
    }
}
