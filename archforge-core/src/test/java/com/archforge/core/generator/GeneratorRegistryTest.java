package com.archforge.core.generator;

import com.archforge.core.generator.impl.BackendGenerator;
import com.archforge.core.generator.impl.DeployGenerator;
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

/**
 * Tests for {@link GeneratorRegistry}.
 */
class GeneratorRegistryTest {

    private GeneratorRegistry registry;
    private TaskPlan plan;

    @BeforeEach
    void setUp() {
        ArchitectureModel model = orderResource("Future<number>");
        GenerationContext context = new GenerationContext(model, SymbolRegistry.fromModel(model), null);
        plan = new TaskPlanner().plan(model);
        registry = GeneratorRegistry.create(new ScriptedTextGenerator().alwaysFail(false), context,
            RetryPolicy.noDelay(1), millis -> { });
    }

    @Test
    void forCategory_everyCategory_hasMatchingGenerator() {
        for (TaskCategory category : TaskCategory.values()) {
            assertThat(registry.forCategory(category).category()).isEqualTo(category);
        }
        assertThat(registry.forCategory(TaskCategory.BACKEND)).isInstanceOf(BackendGenerator.class);
        assertThat(registry.forCategory(TaskCategory.DEPLOY)).isInstanceOf(DeployGenerator.class);
    }

    @Test
    void forTask_everyPlannedTask_producesStubAtTaskPath() {
        // Given
        List<GeneratedArtifact> prior = new ArrayList<>();

        // When
        for (Task task : plan.orderedTasks()) {
            GeneratedArtifact artifact = registry.forTask(task).generate(task, List.copyOf(prior));
            prior.add(artifact);
        }

        // Then
        assertThat(prior).hasSize(plan.order().size());
        assertThat(prior).allSatisfy(artifact -> {
            assertThat(artifact.stub()).isTrue();
            assertThat(artifact.content()).isNotBlank();
            assertThat(artifact.path()).isEqualTo(plan.findTask(artifact.taskId()).orElseThrow().filePath());
        });
    }
}
