package com.archforge.core.planner;

import com.archforge.core.model.ArchitectureModel;
import com.archforge.core.registry.SymbolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.archforge.core.support.Units.orderResource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TaskPlanWriter} and {@link TaskPlanRecord}.
 */
class TaskPlanWriterTest {

    @TempDir
    Path tempDir;

    private TaskPlanWriter writer;
    private TaskPlan plan;
    private TaskPlanRecord record;

    @BeforeEach
    void setUp() {
        ArchitectureModel model = orderResource("Future<number>");
        plan = new TaskPlanner().plan(model);
        record = TaskPlanRecord.of("shop", plan, SymbolRegistry.fromModel(model));
        writer = new TaskPlanWriter();
    }

    @Test
    void of_capturesSummaryAndOwnerSignatures() {
        assertThat(record.summary().totalTasks()).isEqualTo(plan.tasks().size());
        assertThat(record.summary().schedulableTasks()).isEqualTo(plan.order().size());
        assertThat(record.summary().tasksByCategory()).containsEntry("shared", 3);

        TaskPlanRecord.TaskEntry service = record.tasks().stream()
            .filter(t -> t.id().equals("backend_service_OrderService"))
            .findFirst()
            .orElseThrow();
        assertThat(service.category()).isEqualTo("backend");
        assertThat(service.folderPath()).isEqualTo("backend/src/services");
        assertThat(service.methodSignatures()).containsExactly("total(): Future<number>");
    }

    @Test
    void write_thenRead_preservesPlan() throws IOException {
        // Given
        Path target = tempDir.resolve("out/task-plan.json");

        // When
        writer.write(record, target);
        TaskPlanRecord read = writer.read(target);

        // Then
        assertThat(Files.readString(target)).contains("\"taskDAG\"").contains("\"generationOrder\"");
        assertThat(read.projectId()).isEqualTo("shop");
        assertThat(read.generationOrder()).isEqualTo(plan.order());
        assertThat(read.taskDag()).containsOnlyKeys(plan.dag().keySet());
        assertThat(read.tasks()).hasSameSizeAs(plan.tasks());
    }

    @Test
    void read_missingFile_throwsIllegalState() {
        assertThatThrownBy(() -> writer.read(tempDir.resolve("none.json")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("none.json");
    }
}
