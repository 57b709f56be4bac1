package com.archforge.core.parser.impl;

import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Property;
import com.archforge.core.model.Relationship;
import com.archforge.core.model.RelationshipKind;
import com.archforge.core.model.Unit;
import com.archforge.core.model.UnitKind;
import com.archforge.core.model.Visibility;
import com.archforge.core.parser.base.AbstractLineParser;
import com.archforge.core.parser.base.DiagramPatterns;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Parses structural (class) diagrams into units and relationships.
 *
 * <p>Recognizes {@code class Name} declarations with optional member blocks,
 * {@code Name : member} one-liners, property and method member lines, and the
 * relationship arrow shapes listed below. Unit kinds are inferred from the class
 * name suffix ({@code OrderService} is a service, {@code Order} an entity).
 *
 * <p><b>Arrow shapes:</b>
 * <ul>
 *   <li>{@code *--} / {@code --*} composition</li>
 *   <li>{@code o--} / {@code --o} aggregation</li>
 *   <li>{@code -->} association</li>
 *   <li>{@code ..>} dependency</li>
 *   <li>{@code ..|>} / {@code <|..} realization</li>
 *   <li>{@code --|>} / {@code <|--} inheritance</li>
 * </ul>
 */
public class ClassDiagramParser extends AbstractLineParser {

    /**
     * Parsed content of one class diagram.
     *
     * @param units declared units with their members and outgoing relationships
     * @param relationships all relationships in declaration order
     */
    public record ClassDiagram(List<Unit> units, List<Relationship> relationships) {
        public ClassDiagram {
            units = List.copyOf(units);
            relationships = List.copyOf(relationships);
        }
    }

    @Override
    protected String diagramKind() {
        return "class";
    }

    /**
     * Parses class diagram text.
     *
     * @param text diagram text, may be blank
     * @return declared units and relationships
     */
    public ClassDiagram parse(String text) {
        resetAnomalies();
        Map<String, UnitDraft> drafts = new LinkedHashMap<>();
        List<Relationship> relationships = new ArrayList<>();
        UnitDraft current = null;

        for (String line : meaningfulLines(text)) {
            if (line.startsWith("classDiagram") || line.startsWith("direction ") || line.startsWith("note")) {
                continue;
            }

            if (current != null) {
                if (matchLine(DiagramPatterns.BLOCK_END, line) != null) {
                    current = null;
                } else if (matchLine(DiagramPatterns.ANNOTATION, line) == null && !parseMember(current, line)) {
                    recordAnomaly(line);
                }
                continue;
            }

            Matcher declaration = matchLine(DiagramPatterns.CLASS_DECLARATION, line);
            if (declaration != null) {
                String name = extractGroup(declaration, 1);
                UnitDraft draft = drafts.computeIfAbsent(name, UnitDraft::new);
                boolean opensBlock = declaration.group(2) != null;
                boolean closesBlock = declaration.group(3) != null;
                current = opensBlock && !closesBlock ? draft : null;
                continue;
            }

            Matcher relationship = matchLine(DiagramPatterns.RELATIONSHIP, line);
            if (relationship != null) {
                Relationship parsed = toRelationship(relationship);
                relationships.add(parsed);
                UnitDraft owner = drafts.get(parsed.source());
                if (owner != null) {
                    owner.relationships.add(parsed);
                } else {
                    log.debug("Relationship source {} is not a declared class", parsed.source());
                }
                continue;
            }

            Matcher inline = matchLine(DiagramPatterns.INLINE_MEMBER, line);
            if (inline != null) {
                UnitDraft owner = drafts.computeIfAbsent(extractGroup(inline, 1), UnitDraft::new);
                if (!parseMember(owner, extractGroup(inline, 2))) {
                    recordAnomaly(line);
                }
                continue;
            }

            if (matchLine(DiagramPatterns.ANNOTATION, line) == null) {
                recordAnomaly(line);
            }
        }

        // Relationships declared before their source class
        for (Relationship relationship : relationships) {
            UnitDraft owner = drafts.get(relationship.source());
            if (owner != null && !owner.relationships.contains(relationship)) {
                owner.relationships.add(relationship);
            }
        }

        List<Unit> units = drafts.values().stream().map(UnitDraft::build).toList();
        log.debug("Parsed class diagram: {} units, {} relationships", units.size(), relationships.size());
        return new ClassDiagram(units, relationships);
    }

    private boolean parseMember(UnitDraft owner, String line) {
        Matcher method = matchLine(DiagramPatterns.METHOD, line);
        if (method != null) {
            owner.methods.add(new MethodSpec(
                extractGroup(method, 2),
                DiagramPatterns.parseParameters(extractGroup(method, 3)),
                extractGroup(method, 4),
                Visibility.fromMarker(extractGroup(method, 1))
            ));
            return true;
        }

        Matcher property = matchLine(DiagramPatterns.PROPERTY, line);
        if (property != null) {
            owner.properties.add(new Property(
                extractGroup(property, 2),
                extractGroup(property, 4),
                Visibility.fromMarker(extractGroup(property, 1)),
                property.group(3) == null
            ));
            return true;
        }

        Matcher typeFirst = matchLine(DiagramPatterns.PROPERTY_TYPE_FIRST, line);
        if (typeFirst != null) {
            owner.properties.add(new Property(
                extractGroup(typeFirst, 3),
                extractGroup(typeFirst, 2),
                Visibility.fromMarker(extractGroup(typeFirst, 1)),
                true
            ));
            return true;
        }
        return false;
    }

    private Relationship toRelationship(Matcher matcher) {
        String left = extractGroup(matcher, 1);
        String arrow = extractGroup(matcher, 2);
        String right = extractGroup(matcher, 3);
        String label = extractGroup(matcher, 4);

        return switch (arrow) {
            case "*--" -> new Relationship(left, right, RelationshipKind.COMPOSITION, label);
            case "--*" -> new Relationship(right, left, RelationshipKind.COMPOSITION, label);
            case "o--" -> new Relationship(left, right, RelationshipKind.AGGREGATION, label);
            case "--o" -> new Relationship(right, left, RelationshipKind.AGGREGATION, label);
            case "..|>" -> new Relationship(left, right, RelationshipKind.REALIZATION, label);
            case "<|.." -> new Relationship(right, left, RelationshipKind.REALIZATION, label);
            case "--|>" -> new Relationship(left, right, RelationshipKind.INHERITANCE, label);
            case "<|--" -> new Relationship(right, left, RelationshipKind.INHERITANCE, label);
            case "..>" -> new Relationship(left, right, RelationshipKind.DEPENDENCY, label);
            default -> new Relationship(left, right, RelationshipKind.ASSOCIATION, label);
        };
    }

    /**
     * Mutable accumulator for a unit while its lines are being read.
     */
    private static final class UnitDraft {
        private final String name;
        private final List<Property> properties = new ArrayList<>();
        private final List<MethodSpec> methods = new ArrayList<>();
        private final List<Relationship> relationships = new ArrayList<>();

        private UnitDraft(String name) {
            this.name = name;
        }

        private Unit build() {
            UnitKind kind = UnitKind.fromClassName(name);
            return new Unit(name, kind, properties, methods, relationships, List.of(), null, null);
        }
    }
}
