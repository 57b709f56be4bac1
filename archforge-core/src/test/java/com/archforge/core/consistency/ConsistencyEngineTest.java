package com.archforge.core.consistency;

import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.model.Parameter;
import com.archforge.core.model.UnitKind;
import com.archforge.core.registry.MethodSignature;
import com.archforge.core.registry.SymbolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.archforge.core.support.Units.entity;
import static com.archforge.core.support.Units.method;
import static com.archforge.core.support.Units.model;
import static com.archforge.core.support.Units.orderResource;
import static com.archforge.core.support.Units.param;
import static com.archforge.core.support.Units.property;
import static com.archforge.core.support.Units.unit;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsistencyEngine}.
 */
class ConsistencyEngineTest {

    private ConsistencyEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ConsistencyEngine();
    }

    @Test
    void reconcile_equivalentAfterNormalization_marksAllConsistent() {
        // Given
        ArchitectureModel model = orderResource("Future<number>");
        SymbolRegistry registry = SymbolRegistry.fromModel(model);

        // When
        ConsistencyReport report = engine.reconcile(model, registry);

        // Then
        assertThat(report.hasDrift()).isFalse();
        assertThat(report.consistentMethods()).containsExactly("OrderService.total", "OrderController.total");
        assertThat(consistent(registry, "Order")).isTrue();
        assertThat(consistent(registry, "OrderService")).isTrue();
        assertThat(consistent(registry, "OrderController")).isTrue();
    }

    @Test
    void reconcile_serviceChangedToString_isRewrittenToFutureOfNumber() {
        // Given
        SymbolRegistry registry = SymbolRegistry.fromModel(orderResource("Future<number>"));
        ArchitectureModel drifted = orderResource("string");

        // When
        ConsistencyReport report = engine.reconcile(drifted, registry);

        // Then
        assertThat(report.drifts()).singleElement().satisfies(drift -> {
            assertThat(drift.className()).isEqualTo("OrderService");
            assertThat(drift.found()).isEqualTo("total(): string");
            assertThat(drift.rewrittenTo()).isEqualTo("total(): Future<number>");
        });
        assertThat(report.model().findUnit("OrderService").orElseThrow().findMethod("total").orElseThrow().returnType())
            .isEqualTo("Future<number>");
        MethodSignature signature = registry.getMethodSignature("OrderService", "total").orElseThrow();
        assertThat(signature.returnType()).isEqualTo("Future<number>");
        assertThat(signature.crossLayerConsistency()).isFalse();
        assertThat(consistent(registry, "Order")).isFalse();
    }

    @Test
    void reconcile_driftWithoutWrapper_takesCanonicalType() {
        // Given
        ArchitectureModel model = orderResource("string");
        SymbolRegistry registry = SymbolRegistry.fromModel(model);

        // When
        ConsistencyReport report = engine.reconcile(model, registry);

        // Then
        assertThat(report.model().findUnit("OrderService").orElseThrow().findMethod("total").orElseThrow().returnType())
            .isEqualTo("number");
    }

    @Test
    void reconcile_parameterMismatch_copiesCanonicalParameters() {
        // Given
        ArchitectureModel model = model(
            entity("Order", List.of(), List.of(method("total", "number", param("discount", "number")))),
            unit("OrderService", UnitKind.SERVICE, List.of(), List.of(method("total", "number")), List.of())
        );
        SymbolRegistry registry = SymbolRegistry.fromModel(model);

        // When
        ConsistencyReport report = engine.reconcile(model, registry);

        // Then
        assertThat(report.drifts()).hasSize(1);
        assertThat(report.model().findUnit("OrderService").orElseThrow().findMethod("total").orElseThrow().signature())
            .isEqualTo("total(discount: number): number");
        assertThat(registry.getMethodSignature("OrderService", "total").orElseThrow().parameters())
            .extracting(Parameter::name).containsExactly("discount");
    }

    @Test
    void reconcile_methodMissingOnDependent_isNotInvented() {
        // Given
        ArchitectureModel model = model(
            entity("Order", List.of(property("id", "string")), List.of(method("total", "number"))),
            unit("OrderService", UnitKind.SERVICE, List.of(), List.of(method("place", "void")), List.of())
        );
        SymbolRegistry registry = SymbolRegistry.fromModel(model);

        // When
        ConsistencyReport report = engine.reconcile(model, registry);

        // Then
        assertThat(report.hasDrift()).isFalse();
        assertThat(report.model().findUnit("OrderService").orElseThrow().hasMethod("total")).isFalse();
        assertThat(registry.getMethodSignature("OrderService", "total")).isEmpty();
    }

    @Test
    void reconcileSource_driftedHeader_restoresRecordedWrapper() {
        // Given
        SymbolRegistry registry = SymbolRegistry.fromModel(orderResource("Future<number>"));
        String content = """
            export class OrderService {
              total(): string {
                return '0';
              }
            }
            """;

        // When
        SourceReconciliation result = engine.reconcileSource("OrderService", content, registry);

        // Then
        assertThat(result.drifts()).hasSize(1);
        assertThat(result.content()).contains("  total(): Future<number> {");
        assertThat(result.content()).contains("return '0';");
    }

    @Test
    void reconcileSource_asyncMethod_keepsPromiseWrapper() {
        // Given
        SymbolRegistry registry = SymbolRegistry.fromModel(orderResource("number"));
        String content = "export class OrderController {\n  async total(): Promise<string> {\n    return '';\n  }\n}\n";

        // When
        SourceReconciliation result = engine.reconcileSource("OrderController", content, registry);

        // Then
        assertThat(result.content()).contains("  async total(): Promise<number> {");
    }

    @Test
    void reconcileSource_runTwice_secondRunMakesNoChange() {
        // Given
        SymbolRegistry registry = SymbolRegistry.fromModel(orderResource("Future<number>"));
        String content = "export class OrderService {\n  total(): string {\n    return '0';\n  }\n}\n";

        // When
        SourceReconciliation first = engine.reconcileSource("OrderService", content, registry);
        SourceReconciliation second = engine.reconcileSource("OrderService", first.content(), registry);

        // Then
        assertThat(second.drifts()).isEmpty();
        assertThat(second.content()).isEqualTo(first.content());
    }

    @Test
    void reconcileSource_notADependent_isUntouched() {
        SymbolRegistry registry = SymbolRegistry.fromModel(orderResource("number"));
        String content = "export function total(): string { return ''; }\n";

        SourceReconciliation result = engine.reconcileSource("Order", content, registry);

        assertThat(result.content()).isEqualTo(content);
        assertThat(result.drifts()).isEmpty();
    }

    @Test
    void resourceOf_stripsDependentSuffix() {
        assertThat(ConsistencyEngine.resourceOf("OrderService")).contains("Order");
        assertThat(ConsistencyEngine.resourceOf("OrderController")).contains("Order");
        assertThat(ConsistencyEngine.resourceOf("Service")).isEmpty();
        assertThat(ConsistencyEngine.resourceOf("Order")).isEmpty();
    }

    private static boolean consistent(SymbolRegistry registry, String className) {
        return registry.getMethodSignature(className, "total").orElseThrow().crossLayerConsistency();
    }
}
