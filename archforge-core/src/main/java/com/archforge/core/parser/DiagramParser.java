package com.archforge.core.parser;

import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.DiagramSources;
import com.archforge.core.model.InfraContext;

/**
 * Turns diagram text into a typed {@link ArchitectureModel}.
 *
 * <p>Implementations are tolerant: lines they do not understand are skipped and
 * counted as anomalies, never reported as fatal errors. A stricter grammar-based
 * parser can replace the default line-oriented one without touching callers.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * DiagramParser parser = new MermaidDiagramParser();
 * ParseResult result = parser.parse(sources, InfraContext.empty());
 *
 * for (Unit unit : result.model().units()) {
 *     System.out.println(unit.name() + " -> " + unit.filePath());
 * }
 * }</pre>
 *
 * @see ParseResult
 */
public interface DiagramParser {

    /**
     * Returns unique identifier for this parser.
     *
     * @return parser identifier (e.g. "mermaid")
     */
    String getId();

    /**
     * Parses all diagram blocks of a project into one model.
     *
     * @param sources the diagram blocks
     * @param infraContext infrastructure settings carried on the model
     * @return model plus parse diagnostics
     */
    ParseResult parse(DiagramSources sources, InfraContext infraContext);

    /**
     * Parses a single class diagram text.
     *
     * @param text class diagram text
     * @return parsed model
     */
    default ArchitectureModel parseDiagram(String text) {
        return parse(DiagramSources.ofClassDiagram("default", text), InfraContext.empty()).model();
    }
}
