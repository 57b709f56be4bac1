package com.archforge.core.consistency;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes return types so that layers using different async conventions compare equal.
 *
 * <p>One level of async wrapper is stripped ({@code Future<X>}, {@code Promise<X>},
 * {@code CompletableFuture<X>}, {@code CompletionStage<X>}, {@code Mono<X>} all become
 * {@code X}), {@code Array<X>} is rewritten to {@code X[]} and whitespace is removed.
 */
public final class ReturnTypeNormalizer {

    static final Set<String> ASYNC_WRAPPERS = Set.of("Future", "Promise", "CompletableFuture", "CompletionStage", "Mono");

    private static final Pattern WRAPPED = Pattern.compile("^(\\w+)\\s*<(.*)>$");
    private static final Pattern ARRAY_GENERIC = Pattern.compile("Array<([^<>]+)>");

    private ReturnTypeNormalizer() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns the comparable form of a type.
     *
     * @param type declared type, may be null
     * @return normalized type, {@code void} for null or blank input
     */
    public static String normalize(String type) {
        if (type == null || type.isBlank()) {
            return "void";
        }
        String current = type.trim();
        Matcher wrapped = WRAPPED.matcher(current);
        if (wrapped.matches() && ASYNC_WRAPPERS.contains(wrapped.group(1))) {
            current = wrapped.group(2).trim();
        }
        Matcher array = ARRAY_GENERIC.matcher(current);
        while (array.find()) {
            current = array.replaceFirst(Matcher.quoteReplacement(array.group(1).trim() + "[]"));
            array = ARRAY_GENERIC.matcher(current);
        }
        return current.replaceAll("\\s+", "");
    }

    /**
     * Returns the async wrapper around a type, if there is one.
     *
     * @param type declared type, may be null
     * @return wrapper name such as {@code Future}
     */
    public static Optional<String> asyncWrapper(String type) {
        if (type == null) {
            return Optional.empty();
        }
        Matcher wrapped = WRAPPED.matcher(type.trim());
        if (wrapped.matches() && ASYNC_WRAPPERS.contains(wrapped.group(1))) {
            return Optional.of(wrapped.group(1));
        }
        return Optional.empty();
    }

    /**
     * Wraps the unwrapped form of a type in the given async wrapper.
     *
     * @param wrapper wrapper name
     * @param type type to wrap; an existing wrapper is replaced
     * @return {@code wrapper<type>}
     */
    public static String wrap(String wrapper, String type) {
        return wrapper + "<" + unwrap(type) + ">";
    }

    /**
     * Strips one async wrapper without any other normalization.
     *
     * @param type declared type
     * @return inner type, or the trimmed type when it is not wrapped
     */
    public static String unwrap(String type) {
        String trimmed = type == null ? "void" : type.trim();
        Matcher wrapped = WRAPPED.matcher(trimmed);
        if (wrapped.matches() && ASYNC_WRAPPERS.contains(wrapped.group(1))) {
            return wrapped.group(2).trim();
        }
        return trimmed;
    }

    /**
     * Returns true if two return types are equivalent after normalization.
     *
     * @param left first type
     * @param right second type
     * @return true when both normalize to the same text
     */
    public static boolean equivalent(String left, String right) {
        return normalize(left).equals(normalize(right));
    }
}
