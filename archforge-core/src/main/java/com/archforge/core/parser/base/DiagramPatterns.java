package com.archforge.core.parser.base;

import com.archforge.core.model.Parameter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shared regex patterns and token helpers for diagram parsing.
 *
 * <p>Patterns are compiled once at class loading time and applied to trimmed,
 * single lines of diagram text.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Matcher m = DiagramPatterns.METHOD.matcher("+total(items: Item[]): number");
 * if (m.matches()) {
 *     List<Parameter> params = DiagramPatterns.parseParameters(m.group(3));
 * }
 * }</pre>
 */
public final class DiagramPatterns {

    // Class diagrams
    public static final Pattern CLASS_DECLARATION =
        Pattern.compile("^class\\s+(\\w+)(?:\\s*~[^~]*~)?(?:\\s*<<\\s*\\w+\\s*>>)?\\s*(\\{)?\\s*(})?\\s*$");

    public static final Pattern BLOCK_END = Pattern.compile("^}\\s*$");

    public static final Pattern INLINE_MEMBER = Pattern.compile("^(\\w+)\\s*:\\s*(.+)$");

    public static final Pattern METHOD =
        Pattern.compile("^([+\\-#~])?\\s*(\\w+)\\s*\\(([^)]*)\\)\\s*:?\\s*([^$*]*?)\\s*[$*]?$");

    public static final Pattern PROPERTY =
        Pattern.compile("^([+\\-#~])?\\s*(\\w+)(\\?)?\\s*:\\s*([^():]+?)\\s*$");

    public static final Pattern PROPERTY_TYPE_FIRST =
        Pattern.compile("^([+\\-#~])?\\s*([\\w.]+(?:<[^>]*>)?(?:\\[])*)\\s+(\\w+)\\s*$");

    public static final Pattern RELATIONSHIP = Pattern.compile(
        "^(\\w++)\\s*(?:\"[^\"]*\"\\s*)?"
            + "(<\\|--|<\\|\\.\\.|\\.\\.\\|>|--\\|>|\\*--|--\\*|o--|--o|\\.\\.>|-->)"
            + "\\s*(?:\"[^\"]*\"\\s*)?(\\w+)\\s*(?::\\s*(.*))?$");

    public static final Pattern ANNOTATION = Pattern.compile("^<<.*>>.*$");

    // Component diagrams
    public static final Pattern FLOWCHART_HEADER = Pattern.compile("^(?:flowchart|graph)\\b.*$");

    public static final Pattern SUBGRAPH = Pattern.compile("^subgraph\\s+(\\w+)(?:\\s*\\[([^\\]]*)])?.*$");

    public static final Pattern NODE_REF = Pattern.compile(
        "(\\w+)\\s*(?:\\[+\\(?\"?([^\\]\")]+?)\"?\\)?]+|\\(+\"?([^)\"]+?)\"?\\)+|\\{\"?([^}\"]+?)\"?})?");

    public static final Pattern EDGE = Pattern.compile(
        "^(.+?)\\s*(?:-->|-\\.->|==>|--\\s*[^->]+?\\s*-->)\\s*(?:\\|[^|]*\\|\\s*)?(.+)$");

    // Sequence diagrams
    public static final Pattern PARTICIPANT =
        Pattern.compile("^(?:participant|actor)\\s+(\\w+)(?:\\s+as\\s+(.+))?$");

    public static final Pattern SEQUENCE_CALL =
        Pattern.compile("^(\\w+)\\s*->>[+-]?\\s*(\\w+)\\s*:\\s*(\\w+)\\s*\\(([^)]*)\\).*$");

    public static final Pattern SEQUENCE_RETURN =
        Pattern.compile("^(\\w+)\\s*-->>[+-]?\\s*(\\w+)\\s*:\\s*([^:]+)$");

    public static final Pattern TYPE_TOKEN =
        Pattern.compile("^[A-Za-z_][\\w.]*(?:<[^>]*>)?(?:\\[])*$");

    private DiagramPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Splits a parameter list on top-level commas, keeping generic arguments intact.
     *
     * <p>Accepts {@code name: type}, {@code name?: type}, {@code type name} and a bare
     * {@code name}; a bare name gets type {@code any}.
     *
     * @param raw text between the parentheses, may be blank
     * @return parsed parameters in order
     */
    public static List<Parameter> parseParameters(String raw) {
        List<Parameter> parameters = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return parameters;
        }
        for (String token : splitTopLevel(raw)) {
            String part = token.trim();
            if (part.isEmpty()) {
                continue;
            }
            int colon = part.indexOf(':');
            if (colon >= 0) {
                String name = part.substring(0, colon).trim();
                String type = part.substring(colon + 1).trim();
                boolean optional = name.endsWith("?");
                if (optional) {
                    name = name.substring(0, name.length() - 1).trim();
                }
                parameters.add(new Parameter(name, type, !optional));
            } else {
                int space = part.lastIndexOf(' ');
                if (space > 0) {
                    parameters.add(new Parameter(part.substring(space + 1).trim(), part.substring(0, space).trim(), true));
                } else {
                    parameters.add(new Parameter(part, "any", true));
                }
            }
        }
        return parameters;
    }

    /**
     * Splits on commas that are not nested inside {@code <>}, {@code ()}, {@code []} or {@code {}}.
     *
     * @param text text to split
     * @return parts, untrimmed
     */
    public static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<', '(', '[', '{' -> depth++;
                case '>', ')', ']', '}' -> depth = Math.max(0, depth - 1);
                case ',' -> {
                    if (depth == 0) {
                        parts.add(text.substring(start, i));
                        start = i + 1;
                    }
                }
                default -> {
                    // part of the current token
                }
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /**
     * Turns a free-form node label into a PascalCase identifier.
     *
     * <p>{@code "Order Controller"} becomes {@code OrderController}; labels that are already
     * identifiers are returned unchanged.
     *
     * @param label node label
     * @return identifier usable as a unit name
     */
    public static String toIdentifier(String label) {
        String trimmed = label.trim();
        if (trimmed.matches("\\w+")) {
            return trimmed;
        }
        StringBuilder sb = new StringBuilder();
        for (String word : trimmed.split("[^A-Za-z0-9_]+")) {
            if (word.isEmpty()) {
                continue;
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
