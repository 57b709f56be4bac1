package com.archforge.core.parser.impl;

import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.DiagramSources;
import com.archforge.core.model.InfraContext;
import com.archforge.core.model.SequenceStep;
import com.archforge.core.model.Unit;
import com.archforge.core.parser.DiagramParser;
import com.archforge.core.parser.ParseResult;
import com.archforge.core.parser.impl.ComponentDiagramParser.ComponentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default {@link DiagramParser} for Mermaid-flavoured diagram text.
 *
 * <p>Combines the class, component and sequence parsers:
 * <ol>
 *   <li>Class diagram units come first and keep their declared members</li>
 *   <li>Backend then frontend component nodes are merged in by name, adding
 *       dependency lists and labels; unknown nodes become new units</li>
 *   <li>Sequence steps backfill methods their callee does not declare</li>
 * </ol>
 *
 * <p>This class is stateless between calls; the line parsers it owns are created
 * per call, so one instance may be shared by concurrent runs.
 */
public class MermaidDiagramParser implements DiagramParser {

    private static final Logger log = LoggerFactory.getLogger(MermaidDiagramParser.class);

    @Override
    public String getId() {
        return "mermaid";
    }

    @Override
    public ParseResult parse(DiagramSources sources, InfraContext infraContext) {
        log.info("Parsing diagrams for project: {}", sources.projectId());

        ClassDiagramParser classParser = new ClassDiagramParser();
        ComponentDiagramParser componentParser = new ComponentDiagramParser();
        SequenceDiagramParser sequenceParser = new SequenceDiagramParser();
        List<String> anomalies = new ArrayList<>();

        ClassDiagramParser.ClassDiagram classDiagram = classParser.parse(sources.classDiagram());
        anomalies.addAll(classParser.anomalies());

        Map<String, Unit> units = new LinkedHashMap<>();
        classDiagram.units().forEach(unit -> units.put(unit.name(), unit));

        mergeComponents(units, componentParser.parse(sources.backendComponentDiagram(), false));
        anomalies.addAll(componentParser.anomalies());
        mergeComponents(units, componentParser.parse(sources.frontendComponentDiagram(), true));
        anomalies.addAll(componentParser.anomalies());

        List<SequenceStep> steps = sequenceParser.parse(sources.sequenceDiagram());
        anomalies.addAll(sequenceParser.anomalies());
        List<String> backfilled = backfillMethods(units, steps);

        ArchitectureModel model = new ArchitectureModel(
            sources.projectId(),
            new ArrayList<>(units.values()),
            classDiagram.relationships(),
            steps,
            infraContext
        );

        log.info("Parsed {} units, {} relationships, {} sequence steps ({} anomalies, {} backfilled methods)",
            model.units().size(), model.relationships().size(), steps.size(), anomalies.size(), backfilled.size());
        return new ParseResult(model, anomalies, backfilled);
    }

    private void mergeComponents(Map<String, Unit> units, List<ComponentNode> nodes) {
        for (ComponentNode node : nodes) {
            Unit existing = units.get(node.name());
            if (existing == null) {
                Unit created = Unit.of(node.name(), node.kind())
                    .withDependencies(node.dependencies())
                    .withDescription(node.label());
                units.put(node.name(), created);
                continue;
            }

            Set<String> dependencies = new LinkedHashSet<>(existing.dependencies());
            dependencies.addAll(node.dependencies());
            Unit merged = existing.withDependencies(new ArrayList<>(dependencies));
            if (merged.description().isEmpty() && node.label() != null) {
                merged = merged.withDescription(node.label());
            }
            units.put(node.name(), merged);
        }
    }

    /**
     * Appends methods implied by sequence steps to their callee.
     *
     * @return backfilled methods as {@code Owner.method}
     */
    private List<String> backfillMethods(Map<String, Unit> units, List<SequenceStep> steps) {
        List<String> backfilled = new ArrayList<>();
        for (SequenceStep step : steps) {
            Optional<Unit> owner = findOwner(units, step.to());
            if (owner.isEmpty()) {
                log.debug("Sequence participant {} is not a known unit, skipping {}", step.to(), step.action());
                continue;
            }
            Unit unit = owner.get();
            if (!unit.hasMethod(step.action())) {
                units.put(unit.name(), unit.withMethod(step.impliedMethod()));
                backfilled.add(unit.name() + "." + step.action());
                log.debug("Backfilled {}.{} from sequence diagram", unit.name(), step.action());
            }
        }
        return backfilled;
    }

    private static Optional<Unit> findOwner(Map<String, Unit> units, String participant) {
        Unit exact = units.get(participant);
        if (exact != null) {
            return Optional.of(exact);
        }
        return units.values().stream()
            .filter(u -> u.name().equalsIgnoreCase(participant))
            .findFirst();
    }
}
