package com.archforge.core.parser.impl;

import com.archforge.core.model.UnitKind;
import com.archforge.core.parser.base.AbstractLineParser;
import com.archforge.core.parser.base.DiagramPatterns;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Parses component (flowchart) diagrams into component nodes with dependency lists.
 *
 * <p>Nodes are written {@code Id[Label]}, {@code Id(Label)} or just {@code Id}; the
 * label (or the id when there is none) becomes the unit name. Edges
 * {@code A --> B} make {@code A} depend on {@code B}. A {@code subgraph} whose name
 * mentions frontend, ui or client switches node kinds to frontend kinds.
 */
public class ComponentDiagramParser extends AbstractLineParser {

    /**
     * Component node found in a diagram.
     *
     * @param name unit name derived from the label
     * @param kind inferred kind
     * @param label raw label
     * @param dependencies names of components this node points at
     */
    public record ComponentNode(String name, UnitKind kind, String label, List<String> dependencies) {
        public ComponentNode {
            dependencies = List.copyOf(dependencies);
        }
    }

    @Override
    protected String diagramKind() {
        return "component";
    }

    /**
     * Parses a component diagram.
     *
     * @param text diagram text, may be blank
     * @param frontend true to infer frontend kinds for every node
     * @return nodes in first-seen order
     */
    public List<ComponentNode> parse(String text, boolean frontend) {
        resetAnomalies();
        Map<String, NodeDraft> nodes = new LinkedHashMap<>();
        Deque<Boolean> frontendScopes = new ArrayDeque<>();
        frontendScopes.push(frontend);

        for (String line : meaningfulLines(text)) {
            if (matchLine(DiagramPatterns.FLOWCHART_HEADER, line) != null
                || line.startsWith("classDef") || line.startsWith("class ") || line.startsWith("style")
                || line.startsWith("direction")) {
                continue;
            }

            Matcher subgraph = matchLine(DiagramPatterns.SUBGRAPH, line);
            if (subgraph != null) {
                String title = extractGroup(subgraph, 2) != null ? extractGroup(subgraph, 2) : extractGroup(subgraph, 1);
                frontendScopes.push(frontendScopes.peek() || isFrontendTitle(title));
                continue;
            }
            if (line.equals("end")) {
                if (frontendScopes.size() > 1) {
                    frontendScopes.pop();
                }
                continue;
            }

            boolean inFrontend = frontendScopes.peek();
            Matcher edge = matchLine(DiagramPatterns.EDGE, line);
            if (edge != null) {
                NodeDraft from = declare(nodes, extractGroup(edge, 1), inFrontend);
                NodeDraft to = declare(nodes, extractGroup(edge, 2), inFrontend);
                if (from != null && to != null) {
                    from.dependencyIds.add(to.id);
                } else {
                    recordAnomaly(line);
                }
                continue;
            }

            if (declare(nodes, line, inFrontend) == null) {
                recordAnomaly(line);
            }
        }

        List<ComponentNode> result = new ArrayList<>();
        for (NodeDraft draft : nodes.values()) {
            List<String> dependencies = draft.dependencyIds.stream()
                .map(id -> nodes.get(id).name())
                .filter(name -> !name.equals(draft.name()))
                .distinct()
                .toList();
            result.add(new ComponentNode(draft.name(), draft.kind(), draft.label, dependencies));
        }
        log.debug("Parsed component diagram: {} nodes", result.size());
        return result;
    }

    private NodeDraft declare(Map<String, NodeDraft> nodes, String reference, boolean frontend) {
        Matcher matcher = matchLine(DiagramPatterns.NODE_REF, reference.trim());
        if (matcher == null) {
            return null;
        }
        String id = extractGroup(matcher, 1);
        String label = firstNonNull(extractGroup(matcher, 2), extractGroup(matcher, 3), extractGroup(matcher, 4));

        NodeDraft draft = nodes.computeIfAbsent(id, key -> new NodeDraft(key, frontend));
        if (label != null && !label.isBlank()) {
            draft.label = label;
        }
        return draft;
    }

    private static boolean isFrontendTitle(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        return lower.contains("frontend") || lower.contains("ui") || lower.contains("client");
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static final class NodeDraft {
        private final String id;
        private final boolean frontend;
        private final Set<String> dependencyIds = new LinkedHashSet<>();
        private String label;

        private NodeDraft(String id, boolean frontend) {
            this.id = id;
            this.frontend = frontend;
        }

        private String name() {
            return DiagramPatterns.toIdentifier(label != null ? label : id);
        }

        private UnitKind kind() {
            String name = name();
            return frontend ? UnitKind.fromFrontendLabel(name) : UnitKind.fromBackendLabel(name);
        }
    }
}
