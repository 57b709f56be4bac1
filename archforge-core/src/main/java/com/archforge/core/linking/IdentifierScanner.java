package com.archforge.core.linking;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical scanner for TypeScript source used by the linking pass.
 *
 * <p>This is not a parser. It blanks out comments and string literals (keeping template
 * interpolations as code), then reports identifiers that are referenced and names that are
 * declared locally. Property accesses ({@code a.Name}), JSX text between tags, object and
 * member keys ({@code total: 1}) and method declaration names are not references.
 */
public final class IdentifierScanner {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

    private static final Pattern DECLARATION = Pattern.compile(
        "\\b(?:class|interface|type|enum|function\\*?|const|let|var|namespace)\\s+([A-Za-z_$][\\w$]*)");

    private static final Pattern DESTRUCTURING = Pattern.compile("\\b(?:const|let|var)\\s*[{\\[]([^}\\]]*)[}\\]]");

    private static final Pattern CATCH_BINDING = Pattern.compile("\\bcatch\\s*\\(\\s*([A-Za-z_$][\\w$]*)");

    private static final Set<String> MODIFIERS = Set.of(
        "public", "private", "protected", "readonly", "static", "declare", "abstract", "override", "async", "get", "set");

    private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "for", "while", "switch", "catch", "with", "function");

    private static final Set<String> HERITAGE = Set.of("extends", "implements", "new");

    private IdentifierScanner() {
        // Utility class
    }

    /**
     * Replaces comments and string literal contents with spaces. Line breaks are kept so
     * positions stay comparable with the input.
     *
     * @param source source text
     * @return code-only text of the same length
     */
    public static String stripCommentsAndStrings(String source) {
        StringBuilder out = new StringBuilder(source.length());
        Deque<Integer> interpolationDepth = new ArrayDeque<>();
        int braceDepth = 0;
        int i = 0;
        int n = source.length();

        while (i < n) {
            char c = source.charAt(i);
            char next = i + 1 < n ? source.charAt(i + 1) : '\0';

            if (c == '/' && next == '/') {
                while (i < n && source.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                out.append("  ");
                i += 2;
                while (i < n && !(source.charAt(i) == '*' && i + 1 < n && source.charAt(i + 1) == '/')) {
                    out.append(source.charAt(i) == '\n' ? '\n' : ' ');
                    i++;
                }
                if (i < n) {
                    out.append("  ");
                    i += 2;
                }
            } else if (c == '\'' || c == '"') {
                out.append(c);
                i++;
                while (i < n && source.charAt(i) != c && source.charAt(i) != '\n') {
                    if (source.charAt(i) == '\\' && i + 1 < n) {
                        out.append(' ');
                        i++;
                    }
                    out.append(' ');
                    i++;
                }
                if (i < n && source.charAt(i) == c) {
                    out.append(c);
                    i++;
                }
            } else if (c == '`' || (c == '}' && !interpolationDepth.isEmpty() && interpolationDepth.peek() == braceDepth)) {
                if (c == '}') {
                    interpolationDepth.pop();
                }
                out.append(c);
                i++;
                while (i < n && source.charAt(i) != '`') {
                    if (source.charAt(i) == '\\' && i + 1 < n) {
                        out.append(' ');
                        i++;
                    } else if (source.charAt(i) == '$' && i + 1 < n && source.charAt(i + 1) == '{') {
                        break;
                    }
                    out.append(source.charAt(i) == '\n' ? '\n' : ' ');
                    i++;
                }
                if (i < n && source.charAt(i) == '$') {
                    out.append("${");
                    i += 2;
                    interpolationDepth.push(braceDepth);
                } else if (i < n) {
                    out.append('`');
                    i++;
                }
            } else {
                if (c == '{') {
                    braceDepth++;
                } else if (c == '}') {
                    braceDepth--;
                }
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Returns identifiers referenced in code, in order of first appearance.
     *
     * @param source source text without import statements
     * @return referenced identifiers
     */
    public static Set<String> referencedIdentifiers(String source) {
        String code = blankJsxText(stripCommentsAndStrings(source));
        Set<String> identifiers = new LinkedHashSet<>();
        Matcher matcher = IDENTIFIER.matcher(code);
        while (matcher.find()) {
            int start = matcher.start();
            if (start > 0 && isIdentifierPart(code.charAt(start - 1))) {
                continue;
            }
            if (isPropertyAccess(code, start) || isKey(code, start, matcher.end())
                || isMethodDeclaration(code, matcher.group(), start, matcher.end())) {
                continue;
            }
            identifiers.add(matcher.group());
        }
        return identifiers;
    }

    /**
     * Replaces JSX text children with spaces. Tags and {@code {...}} expressions are kept.
     *
     * @param code source with comments and strings already blanked
     * @return code of the same length
     */
    static String blankJsxText(String code) {
        char[] out = code.toCharArray();
        int n = code.length();
        int i = code.indexOf('<');
        while (i >= 0) {
            int end = tagEnd(code, i);
            if (end < 0 || code.charAt(end - 1) == '/') {
                i = code.indexOf('<', i + 1);
                continue;
            }
            int segmentStart = end + 1;
            int j = segmentStart;
            while (j < n) {
                char c = code.charAt(j);
                if (c == '{') {
                    blank(out, segmentStart, j);
                    j = closingBrace(code, j) + 1;
                    if (j == 0) {
                        j = n;
                        break;
                    }
                    segmentStart = j;
                } else if (c == '<' && tagEnd(code, j) >= 0) {
                    blank(out, segmentStart, j);
                    break;
                } else if ("<>};=".indexOf(c) >= 0) {
                    break;
                } else {
                    j++;
                }
            }
            i = j < n ? code.indexOf('<', Math.max(j, i + 1)) : -1;
        }
        return new String(out);
    }

    /**
     * Returns the index of the {@code >} that closes a JSX tag starting at {@code start}, or
     * -1 when the {@code <} is a comparison or a type argument list.
     */
    private static int tagEnd(String code, int start) {
        int n = code.length();
        if (start + 1 >= n) {
            return -1;
        }
        char next = code.charAt(start + 1);
        if (next == '>') {
            return start + 1;
        }
        int i = start + 1;
        if (next == '/') {
            i++;
        } else if (!Character.isLetter(next) || !canStartTag(code, start)) {
            return -1;
        }
        while (i < n && (isIdentifierPart(code.charAt(i)) || code.charAt(i) == '.' || code.charAt(i) == '-')) {
            i++;
        }
        while (i < n) {
            char c = code.charAt(i);
            if (c == '>') {
                return i;
            } else if (c == '{') {
                i = closingBrace(code, i);
                if (i < 0) {
                    return -1;
                }
            } else if (c == '<' || c == ';' || c == ')') {
                return -1;
            }
            i++;
        }
        return -1;
    }

    private static boolean canStartTag(String code, int start) {
        int p = start - 1;
        while (p >= 0 && Character.isWhitespace(code.charAt(p))) {
            p--;
        }
        if (p < 0) {
            return true;
        }
        char prev = code.charAt(p);
        if (prev == ')' || prev == ']' || prev == '.') {
            return false;
        }
        if (!isIdentifierPart(prev)) {
            return true;
        }
        String word = wordEndingAt(code, p);
        return word.equals("return") || word.equals("yield") || word.equals("default");
    }

    private static int closingBrace(String code, int open) {
        int depth = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static void blank(char[] out, int from, int to) {
        for (int k = from; k < to; k++) {
            if (out[k] != '\n') {
                out[k] = ' ';
            }
        }
    }

    /** Object literal, class member and parameter keys: {@code name:} or {@code name?:}. */
    private static boolean isKey(String code, int start, int end) {
        int i = skipSpaces(code, end);
        if (i < code.length() && (code.charAt(i) == '?' || code.charAt(i) == '!')) {
            i = skipSpaces(code, i + 1);
        }
        if (i >= code.length() || code.charAt(i) != ':' || (i + 1 < code.length() && code.charAt(i + 1) == ':')) {
            return false;
        }
        int p = start - 1;
        while (p >= 0 && code.charAt(p) != '\n' && Character.isWhitespace(code.charAt(p))) {
            p--;
        }
        if (p < 0 || code.charAt(p) == '\n') {
            return true;
        }
        char prev = code.charAt(p);
        if (prev == '{' || prev == ',' || prev == ';' || prev == '(') {
            return true;
        }
        return isIdentifierPart(prev) && MODIFIERS.contains(wordEndingAt(code, p));
    }

    /**
     * Method headers such as {@code total(id: string): number} or {@code find<T>(id)} followed
     * by an opening brace. Calls in expression position are never followed by a body.
     */
    private static boolean isMethodDeclaration(String code, String name, int start, int end) {
        if (CONTROL_KEYWORDS.contains(name)) {
            return false;
        }
        int p = start - 1;
        while (p >= 0 && Character.isWhitespace(code.charAt(p))) {
            p--;
        }
        if (p >= 0 && isIdentifierPart(code.charAt(p)) && HERITAGE.contains(wordEndingAt(code, p))) {
            return false;
        }
        int n = code.length();
        int i = skipSpaces(code, end);
        if (i < n && code.charAt(i) == '<') {
            i = skipBalanced(code, i, '<', '>');
            if (i < 0) {
                return false;
            }
            i = skipSpaces(code, i);
        }
        if (i >= n || code.charAt(i) != '(') {
            return false;
        }
        i = skipBalanced(code, i, '(', ')');
        if (i < 0) {
            return false;
        }
        i = skipSpaces(code, i);
        if (i < n && code.charAt(i) == ':') {
            while (i < n && code.charAt(i) != '{') {
                char c = code.charAt(i);
                if (c == ';' || c == '=' || c == ')' || c == '}') {
                    return false;
                }
                i++;
            }
        }
        return i < n && code.charAt(i) == '{';
    }

    /** Returns the index just past the bracket matching the one at {@code open}, or -1. */
    private static int skipBalanced(String code, int open, char opening, char closing) {
        int depth = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == opening) {
                depth++;
            } else if (c == closing && --depth == 0) {
                return i + 1;
            }
        }
        return -1;
    }

    private static int skipSpaces(String code, int from) {
        int i = from;
        while (i < code.length() && Character.isWhitespace(code.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String wordEndingAt(String code, int last) {
        int s = last;
        while (s > 0 && isIdentifierPart(code.charAt(s - 1))) {
            s--;
        }
        return code.substring(s, last + 1);
    }

    /**
     * Returns names declared at any level of the source.
     *
     * @param source source text without import statements
     * @return locally declared names
     */
    public static Set<String> localDefinitions(String source) {
        String code = stripCommentsAndStrings(source);
        Set<String> names = new LinkedHashSet<>();
        Matcher declaration = DECLARATION.matcher(code);
        while (declaration.find()) {
            names.add(declaration.group(1));
        }
        Matcher destructuring = DESTRUCTURING.matcher(code);
        while (destructuring.find()) {
            for (String part : destructuring.group(1).split(",")) {
                String name = part.contains(":") ? part.substring(part.indexOf(':') + 1) : part;
                name = name.replace("...", "").split("=")[0].trim();
                if (IDENTIFIER.matcher(name).matches()) {
                    names.add(name);
                }
            }
        }
        Matcher catchBinding = CATCH_BINDING.matcher(code);
        while (catchBinding.find()) {
            names.add(catchBinding.group(1));
        }
        return names;
    }

    private static boolean isPropertyAccess(String code, int start) {
        int i = start - 1;
        while (i >= 0 && Character.isWhitespace(code.charAt(i)) && code.charAt(i) != '\n') {
            i--;
        }
        if (i < 0 || code.charAt(i) != '.') {
            return false;
        }
        // spread and rest syntax
        return !(i >= 2 && code.charAt(i - 1) == '.' && code.charAt(i - 2) == '.');
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
