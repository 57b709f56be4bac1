package com.archforge.core.parser.impl;

import com.archforge.core.model.SequenceStep;
import com.archforge.core.parser.base.AbstractLineParser;
import com.archforge.core.parser.base.DiagramPatterns;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Parses sequence diagrams into {@link SequenceStep}s.
 *
 * <p>A call {@code A->>B: verb(args)} becomes a step owned by {@code B}. When the
 * next line is the matching return arrow {@code B-->>A: Type}, its text becomes the
 * step's return type. Participant aliases ({@code participant OS as OrderService})
 * are resolved so steps always name real units.
 */
public class SequenceDiagramParser extends AbstractLineParser {

    private static final Set<String> BLOCK_KEYWORDS = Set.of(
        "sequenceDiagram", "autonumber", "loop", "alt", "else", "opt", "par", "and", "critical",
        "break", "rect", "end", "note", "activate", "deactivate", "box", "title"
    );

    @Override
    protected String diagramKind() {
        return "sequence";
    }

    /**
     * Parses sequence diagram text.
     *
     * @param text diagram text, may be blank
     * @return steps in diagram order
     */
    public List<SequenceStep> parse(String text) {
        resetAnomalies();
        List<String> lines = meaningfulLines(text);
        Map<String, String> aliases = new HashMap<>();
        List<SequenceStep> steps = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher participant = matchLine(DiagramPatterns.PARTICIPANT, line);
            if (participant != null) {
                String alias = extractGroup(participant, 2);
                if (alias != null) {
                    aliases.put(extractGroup(participant, 1), DiagramPatterns.toIdentifier(alias));
                }
                continue;
            }

            Matcher call = matchLine(DiagramPatterns.SEQUENCE_CALL, line);
            if (call != null) {
                String from = resolve(aliases, extractGroup(call, 1));
                String to = resolve(aliases, extractGroup(call, 2));
                String returnType = null;

                if (i + 1 < lines.size()) {
                    Matcher ret = matchLine(DiagramPatterns.SEQUENCE_RETURN, lines.get(i + 1));
                    if (ret != null
                        && resolve(aliases, extractGroup(ret, 1)).equals(to)
                        && resolve(aliases, extractGroup(ret, 2)).equals(from)) {
                        returnType = asType(extractGroup(ret, 3));
                        i++;
                    }
                }

                steps.add(new SequenceStep(
                    from,
                    to,
                    extractGroup(call, 3),
                    DiagramPatterns.parseParameters(extractGroup(call, 4)),
                    returnType
                ));
                continue;
            }

            if (matchLine(DiagramPatterns.SEQUENCE_RETURN, line) != null || isBlockKeyword(line) || line.contains("->")) {
                // Unpaired returns, block structure and plain messages carry no method facts
                continue;
            }
            recordAnomaly(line);
        }

        log.debug("Parsed sequence diagram: {} steps", steps.size());
        return steps;
    }

    private static String resolve(Map<String, String> aliases, String participant) {
        return aliases.getOrDefault(participant, participant);
    }

    private static String asType(String text) {
        String candidate = text.trim();
        return DiagramPatterns.TYPE_TOKEN.matcher(candidate).matches() ? candidate : null;
    }

    private static boolean isBlockKeyword(String line) {
        String first = line.split("\\s+", 2)[0];
        return BLOCK_KEYWORDS.contains(first) || BLOCK_KEYWORDS.contains(first.toLowerCase(Locale.ROOT));
    }
}
