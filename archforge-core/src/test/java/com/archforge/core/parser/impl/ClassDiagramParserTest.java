package com.archforge.core.parser.impl;

import com.archforge.core.model.MethodSpec;
import com.archforge.core.model.Property;
import com.archforge.core.model.RelationshipKind;
import com.archforge.core.model.Unit;
import com.archforge.core.model.UnitKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ClassDiagramParser}.
 */
class ClassDiagramParserTest {

    private ClassDiagramParser parser;

    @BeforeEach
    void setUp() {
        parser = new ClassDiagramParser();
    }

    @Test
    void parse_classWithMembers_extractsPropertiesAndMethods() {
        // Given
        String text = """
            classDiagram
                class Order {
                    +id: string
                    -note?: string
                    +total(discount: number): number
                }
            """;

        // When
        ClassDiagramParser.ClassDiagram diagram = parser.parse(text);

        // Then
        assertThat(diagram.units()).hasSize(1);
        Unit order = diagram.units().get(0);
        assertThat(order.name()).isEqualTo("Order");
        assertThat(order.kind()).isEqualTo(UnitKind.DATA_ENTITY);
        assertThat(order.filePath()).isEqualTo("backend/src/models/Order.ts");
        assertThat(order.properties()).extracting(Property::name).containsExactly("id", "note");
        assertThat(order.properties().get(1).required()).isFalse();

        MethodSpec total = order.findMethod("total").orElseThrow();
        assertThat(total.signature()).isEqualTo("total(discount: number): number");
        assertThat(parser.anomalies()).isEmpty();
    }

    @Test
    void parse_suffixedNames_inferUnitKinds() {
        // Given
        String text = """
            classDiagram
                class OrderService
                class OrderController
                class OrderRepository
                class AuthMiddleware
                class DateUtils
            """;

        // When
        ClassDiagramParser.ClassDiagram diagram = parser.parse(text);

        // Then
        assertThat(diagram.units()).extracting(Unit::kind).containsExactly(
            UnitKind.SERVICE, UnitKind.CONTROLLER, UnitKind.REPOSITORY, UnitKind.MIDDLEWARE, UnitKind.UTILITY);
    }

    @Test
    void parse_inlineMember_attachesToNamedClass() {
        // Given
        String text = """
            classDiagram
                class Order
                Order : +cancel() void
                Order : +status: string
            """;

        // When
        Unit order = parser.parse(text).units().get(0);

        // Then
        assertThat(order.findMethod("cancel")).isPresent();
        assertThat(order.properties()).extracting(Property::name).containsExactly("status");
    }

    @Test
    void parse_relationshipArrows_normalizeDirection() {
        // Given
        String text = """
            classDiagram
                class Order
                class SpecialOrder
                class LineItem
                Order <|-- SpecialOrder
                Order *-- LineItem
                Order ..> LineItem
            """;

        // When
        ClassDiagramParser.ClassDiagram diagram = parser.parse(text);

        // Then
        assertThat(diagram.relationships()).hasSize(3);
        assertThat(diagram.relationships().get(0).source()).isEqualTo("SpecialOrder");
        assertThat(diagram.relationships().get(0).target()).isEqualTo("Order");
        assertThat(diagram.relationships().get(0).kind()).isEqualTo(RelationshipKind.INHERITANCE);
        assertThat(diagram.relationships().get(1).kind()).isEqualTo(RelationshipKind.COMPOSITION);
        assertThat(diagram.relationships().get(2).kind()).isEqualTo(RelationshipKind.DEPENDENCY);
    }

    @Test
    void parse_unparseableLine_isRecordedAndSkipped() {
        // Given
        String text = """
            classDiagram
                class Order {
                    +id: string
                    ??? broken member ???
                }
                this is not mermaid!
            """;

        // When
        ClassDiagramParser.ClassDiagram diagram = parser.parse(text);

        // Then
        assertThat(diagram.units()).hasSize(1);
        assertThat(diagram.units().get(0).properties()).hasSize(1);
        assertThat(parser.anomalies())
            .containsExactly("class: ??? broken member ???", "class: this is not mermaid!");
    }

    @Test
    void parse_blankText_returnsNothing() {
        ClassDiagramParser.ClassDiagram diagram = parser.parse("   ");

        assertThat(diagram.units()).isEmpty();
        assertThat(diagram.relationships()).isEmpty();
    }

    @Test
    void parse_commentsAreIgnored() {
        ClassDiagramParser.ClassDiagram diagram = parser.parse("""
            classDiagram
                %% domain model
                class Order
            """);

        assertThat(diagram.units()).hasSize(1);
        assertThat(parser.anomalies()).isEmpty();
    }
}
