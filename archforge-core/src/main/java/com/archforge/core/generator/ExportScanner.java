package com.archforge.core.generator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds top-level exported names in TypeScript source.
 */
public final class ExportScanner {

    private static final Pattern EXPORT_DECLARATION = Pattern.compile(
        "(?m)^\\s*export\\s+(?:default\\s+)?(?:declare\\s+)?(?:abstract\\s+)?(?:async\\s+)?"
            + "(?:class|interface|type|enum|function\\*?|const|let|var)\\s+([A-Za-z_$][\\w$]*)");

    private static final Pattern EXPORT_LIST = Pattern.compile("(?m)^\\s*export\\s*\\{([^}]*)}\\s*;?\\s*$");

    private ExportScanner() {
        // Utility class
    }

    /**
     * Scans content for exported names.
     *
     * @param content source text
     * @return exported names in order of appearance, without duplicates
     */
    public static List<String> scan(String content) {
        Set<String> names = new LinkedHashSet<>();
        Matcher declaration = EXPORT_DECLARATION.matcher(content);
        while (declaration.find()) {
            names.add(declaration.group(1));
        }
        Matcher list = EXPORT_LIST.matcher(content);
        while (list.find()) {
            for (String part : list.group(1).split(",")) {
                String name = part.trim();
                int alias = name.indexOf(" as ");
                if (alias >= 0) {
                    name = name.substring(alias + 4).trim();
                }
                if (!name.isEmpty() && !"default".equals(name)) {
                    names.add(name);
                }
            }
        }
        return new ArrayList<>(names);
    }
}
