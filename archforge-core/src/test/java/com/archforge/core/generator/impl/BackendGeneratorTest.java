package com.archforge.core.generator.impl;

import com.archforge.core.generator.GeneratedArtifact;
import com.archforge.core.generator.GenerationContext;
import com.archforge.core.generator.RetryPolicy;
import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.planner.Task;
import com.archforge.core.planner.TaskCategory;
import com.archforge.core.planner.TaskPlan;
import com.archforge.core.planner.TaskPlanner;
import com.archforge.core.registry.SymbolRegistry;
import com.archforge.core.support.ScriptedTextGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.archforge.core.support.Units.orderResource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BackendGenerator} and the generation loop it inherits.
 */
class BackendGeneratorTest {

    private ScriptedTextGenerator textGenerator;
    private List<Long> sleeps;
    private GenerationContext context;
    private TaskPlan plan;

    @BeforeEach
    void setUp() {
        ArchitectureModel model = orderResource("Future<number>");
        context = new GenerationContext(model, SymbolRegistry.fromModel(model), null);
        plan = new TaskPlanner().plan(model);
        textGenerator = new ScriptedTextGenerator();
        sleeps = new ArrayList<>();
    }

    private BackendGenerator generator(int maxAttempts) {
        return new BackendGenerator(textGenerator, context, new RetryPolicy(maxAttempts, 10, 2.0, 1_000), sleeps::add);
    }

    private Task task(String id) {
        return plan.findTask(id).orElseThrow();
    }

    @Test
    void generate_validReply_returnsSanitizedArtifact() {
        // Given
        textGenerator.reply("```ts\nexport class Order {\n  id!: string;\n}\n```");

        // When
        GeneratedArtifact artifact = generator(3).generate(task("backend_model_Order"), List.of());

        // Then
        assertThat(artifact.stub()).isFalse();
        assertThat(artifact.path()).isEqualTo("backend/src/models/Order.ts");
        assertThat(artifact.category()).isEqualTo(TaskCategory.BACKEND);
        assertThat(artifact.content()).isEqualTo("export class Order {\n  id!: string;\n}\n");
        assertThat(artifact.exports()).containsExactly("Order");
        assertThat(textGenerator.calls()).isEqualTo(1);
    }

    @Test
    void generate_alwaysRetryableFailure_stubsAfterExactlyMaxAttempts() {
        // Given
        textGenerator.alwaysFail(true);

        // When
        GeneratedArtifact artifact = generator(3).generate(task("backend_model_Order"), List.of());

        // Then
        assertThat(textGenerator.calls()).isEqualTo(3);
        assertThat(sleeps).containsExactly(10L, 20L);
        assertThat(artifact.stub()).isTrue();
        assertThat(artifact.content())
            .contains("export class Order {")
            .contains("  id!: string;")
            .contains("  total(): number {")
            .contains("throw new Error('Not implemented: Order.total');");
        assertThat(artifact.exports()).containsExactly("Order");
    }

    @Test
    void generate_nonRetryableFailure_stubsWithoutRetrying() {
        // Given
        textGenerator.alwaysFail(false);

        // When
        GeneratedArtifact artifact = generator(5).generate(task("backend_service_OrderService"), List.of());

        // Then
        assertThat(textGenerator.calls()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        assertThat(artifact.stub()).isTrue();
        assertThat(artifact.content()).contains("total(): Future<number> {");
    }

    @Test
    void generate_blankThenValid_countsBlankAsFailedAttempt() {
        // Given
        textGenerator.reply("   ").reply("Sorry, no code.").reply("export class OrderService {}\n");

        // When
        GeneratedArtifact artifact = generator(3).generate(task("backend_service_OrderService"), List.of());

        // Then
        assertThat(artifact.stub()).isFalse();
        assertThat(textGenerator.calls()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void generate_prompt_carriesContractsSignaturesAndPriorExports() {
        // Given
        textGenerator.reply("export class OrderService {}\n");
        GeneratedArtifact prior = new GeneratedArtifact("backend_model_Order", "backend/src/models/Order.ts",
            "export class Order {}\n", TaskCategory.BACKEND, List.of("Order"), List.of(), false);

        // When
        generator(1).generate(task("backend_service_OrderService"), List.of(prior));

        // Then
        String prompt = textGenerator.prompts().get(0);
        assertThat(prompt)
            .contains("File: backend/src/services/OrderService.ts")
            .contains("interface IOrderService {")
            .contains("interface IOrder {")
            .contains("- OrderService.total(): Future<number>")
            .contains("- backend/src/models/Order.ts: Order");
    }

    @Test
    void generate_routeStub_exposesControllerMethods() {
        // Given
        textGenerator.alwaysFail(false);

        // When
        GeneratedArtifact artifact = generator(1).generate(task("backend_route_Order"), List.of());

        // Then
        assertThat(artifact.content())
            .contains("export const orderRoutes = Router();")
            .contains("const controller = new OrderController();")
            .contains("orderRoutes.post('/order/total'");
        assertThat(artifact.exports()).containsExactly("orderRoutes");
    }

    @Test
    void generate_serverEntryStub_registersEveryRouter() {
        textGenerator.alwaysFail(false);

        GeneratedArtifact artifact = generator(1).generate(task("backend_server_entry"), List.of());

        assertThat(artifact.content()).contains("app.use(orderRoutes);").contains("export const handler");
        assertThat(artifact.exports()).containsExactly("app", "handler");
    }

    @Test
    void generate_taskOfOtherCategory_throws() {
        assertThatThrownBy(() -> generator(1).generate(task("shared_types"), List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shared_types");
    }

    @Test
    void generate_interruptedWhileWaiting_stubsImmediately() {
        // Given
        textGenerator.alwaysFail(true);
        BackendGenerator generator = new BackendGenerator(textGenerator, context, new RetryPolicy(4, 10, 2.0, 100),
            millis -> {
                throw new InterruptedException("stop");
            });

        try {
            // When
            GeneratedArtifact artifact = generator.generate(task("backend_model_Order"), List.of());

            // Then
            assertThat(artifact.stub()).isTrue();
            assertThat(textGenerator.calls()).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
