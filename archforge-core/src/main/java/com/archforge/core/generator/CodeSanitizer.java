package com.archforge.core.generator;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips Markdown fencing and conversational prose from text-generation output.
 *
 * <p>Deterministic: sanitizing already clean content returns it unchanged.
 */
public final class CodeSanitizer {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[\\w.+-]*[ \\t]*\\r?\\n(.*?)```", Pattern.DOTALL);

    private static final List<String> CODE_PREFIXES = List.of(
        "import", "export", "class", "interface", "type", "enum", "const", "let", "var",
        "function", "describe", "async", "abstract", "declare", "{", "//", "/*", "@", "'use", "\"use");

    private CodeSanitizer() {
        // Utility class
    }

    /**
     * Cleans generated text for the given artifact path.
     *
     * @param raw collaborator output, may be null
     * @param path artifact path; decides which lines count as content
     * @return cleaned content ending with a newline, or an empty string when nothing usable remains
     */
    public static String sanitize(String raw, String path) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String text = raw.replace("\r\n", "\n");
        Matcher fenced = FENCED_BLOCK.matcher(text);
        if (fenced.find()) {
            text = fenced.group(1);
        } else {
            text = text.replaceAll("(?m)^```.*$", "");
        }

        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) {
            text = dropLeadingUntil(text, line -> line.startsWith("{") || line.startsWith("["));
        } else if (isScript(lower)) {
            text = dropLeadingUntil(text, CodeSanitizer::looksLikeCode);
        }

        String trimmed = text.strip();
        return trimmed.isEmpty() ? "" : trimmed + "\n";
    }

    static boolean looksLikeCode(String line) {
        for (String prefix : CODE_PREFIXES) {
            if (line.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isScript(String lowerPath) {
        return lowerPath.endsWith(".ts") || lowerPath.endsWith(".tsx")
            || lowerPath.endsWith(".js") || lowerPath.endsWith(".jsx");
    }

    private static String dropLeadingUntil(String text, Predicate<String> isContent) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (isContent.test(lines[i].stripLeading())) {
                return String.join("\n", Arrays.copyOfRange(lines, i, lines.length));
            }
        }
        return "";
    }
}
