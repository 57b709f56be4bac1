package com.archforge.core.parser.base;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for line-oriented diagram parsers.
 *
 * <p>Provides:
 * <ul>
 *   <li>Splitting diagram text into trimmed, meaningful lines</li>
 *   <li>Precompiled pattern matching helpers</li>
 *   <li>Anomaly bookkeeping for lines that could not be parsed</li>
 * </ul>
 *
 * <p>Subclasses are not thread-safe: anomalies accumulate per parse call, so each
 * call to a subclass parse method starts with {@link #resetAnomalies()}.
 */
public abstract class AbstractLineParser {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final List<String> anomalies = new ArrayList<>();

    /**
     * Returns the diagram kind this parser handles, used to prefix anomalies.
     *
     * @return diagram kind (e.g. "class", "sequence")
     */
    protected abstract String diagramKind();

    /**
     * Splits text into trimmed lines, dropping blanks and {@code %%} comments.
     *
     * @param text diagram text, may be null
     * @return meaningful lines in order
     */
    protected List<String> meaningfulLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return lines;
        }
        for (String raw : text.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("%%")) {
                continue;
            }
            lines.add(line);
        }
        return lines;
    }

    /**
     * Matches the whole line against a pattern.
     *
     * @param pattern compiled regex pattern
     * @param line line to match
     * @return matcher if the line matches, null otherwise
     */
    protected Matcher matchLine(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.matches() ? matcher : null;
    }

    /**
     * Extracts a numbered group from a matcher.
     *
     * @param matcher matcher with results
     * @param groupIndex index of the capture group (1-based)
     * @return captured text, trimmed, or null if the group did not participate
     */
    protected String extractGroup(Matcher matcher, int groupIndex) {
        try {
            String value = matcher.group(groupIndex);
            return value == null ? null : value.trim();
        } catch (IndexOutOfBoundsException | IllegalStateException e) {
            return null;
        }
    }

    /**
     * Records a line that looked meaningful but matched nothing.
     *
     * @param line offending line
     */
    protected void recordAnomaly(String line) {
        log.debug("Ignoring unparseable {} diagram line: {}", diagramKind(), line);
        anomalies.add(diagramKind() + ": " + line);
    }

    protected void resetAnomalies() {
        anomalies.clear();
    }

    /**
     * Returns anomalies recorded by the last parse call.
     *
     * @return immutable copy of recorded anomalies
     */
    public List<String> anomalies() {
        return List.copyOf(anomalies);
    }
}
