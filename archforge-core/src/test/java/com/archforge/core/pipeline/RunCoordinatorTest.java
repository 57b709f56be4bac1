package com.archforge.core.pipeline;

import com.archforge.core.composer.impl.FileSystemStructureComposer;
import com.archforge.core.config.ProjectConfig;
import com.archforge.core.external.DiagramSource;
import com.archforge.core.external.impl.NoOpBuildValidator;
import com.archforge.core.external.impl.NoOpDeployer;
import com.archforge.core.model.DiagramSources;
import com.archforge.core.parser.impl.MermaidDiagramParser;
import com.archforge.core.run.InMemoryRunStore;
import com.archforge.core.run.IssueKind;
import com.archforge.core.run.RunIssue;
import com.archforge.core.run.RunPhase;
import com.archforge.core.run.RunStatus;
import com.archforge.core.support.MutableClock;
import com.archforge.core.support.ScriptedTextGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RunCoordinator}.
 */
class RunCoordinatorTest {

    private static final String CLASS_DIAGRAM = """
        classDiagram
            class Order {
                +id: string
                +total(): number
            }
            class OrderService {
                +total(): Promise<number>
            }
            OrderService ..> Order
        """;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private CountDownLatch release;
    private RunCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        release = new CountDownLatch(0);
        DiagramSource source = projectId -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return DiagramSources.ofClassDiagram(projectId, CLASS_DIAGRAM);
        };
        GenerationPipeline pipeline = new GenerationPipeline(source, new MermaidDiagramParser(),
            new ScriptedTextGenerator(), new NoOpBuildValidator(), new NoOpDeployer(),
            new FileSystemStructureComposer(), millis -> { });
        coordinator = new RunCoordinator(pipeline, new InMemoryRunStore<>(clock),
            Executors.newFixedThreadPool(2), Duration.ofHours(1), clock);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    @Test
    void submit_completesRunAndPublishesFinalStatus() {
        // When
        RunReport report = coordinator.submit("run-1", request("shop", "out")).join();

        // Then
        assertThat(report.runId()).isEqualTo("run-1");
        assertThat(report.phase()).isEqualTo(RunPhase.DONE);
        assertThat(coordinator.activeRuns()).isZero();
        assertThat(coordinator.status("run-1")).hasValueSatisfying(status -> {
            assertThat(status.phase()).isEqualTo(RunPhase.DONE);
            assertThat(status.projectId()).isEqualTo("shop");
        });
    }

    @Test
    void submit_generatedId_startsWithProjectId() {
        // When
        RunReport report = coordinator.submit(request("shop", "out")).join();

        // Then
        assertThat(report.runId()).startsWith("shop-");
    }

    @Test
    void submit_independentProjects_runConcurrently() {
        // When
        CompletableFuture<RunReport> first = coordinator.submit("a", request("alpha", "out-a"));
        CompletableFuture<RunReport> second = coordinator.submit("b", request("beta", "out-b"));

        // Then
        assertThat(first.join().projectId()).isEqualTo("alpha");
        assertThat(second.join().projectId()).isEqualTo("beta");
        assertThat(first.join().phase()).isEqualTo(RunPhase.DONE);
        assertThat(second.join().phase()).isEqualTo(RunPhase.DONE);
        assertThat(tempDir.resolve("out-a/backend/src/models/Order.ts")).exists();
        assertThat(tempDir.resolve("out-b/backend/src/models/Order.ts")).exists();
    }

    @Test
    void submit_duplicateActiveId_throwsAndCancelStopsTheRun() {
        // Given
        release = new CountDownLatch(1);
        CompletableFuture<RunReport> running = coordinator.submit("run-1", request("shop", "out"));

        // When / Then
        assertThatThrownBy(() -> coordinator.submit("run-1", request("shop", "out")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("run-1");

        assertThat(coordinator.cancel("run-1")).isTrue();
        release.countDown();
        RunReport report = running.join();
        assertThat(report.phase()).isEqualTo(RunPhase.FAILED);
        assertThat(report.errors()).extracting(RunIssue::kind).containsExactly(IssueKind.RUN_INTERRUPTED);
    }

    @Test
    void cancel_unknownRun_returnsFalse() {
        // When / Then
        assertThat(coordinator.cancel("nope")).isFalse();
    }

    @Test
    void status_afterRetention_isGone() {
        // Given
        coordinator.submit("run-1", request("shop", "out")).join();

        // When
        clock.advance(Duration.ofHours(2));

        // Then
        assertThat(coordinator.status("run-1")).isEmpty();
    }

    @Test
    void status_unknownRun_isEmpty() {
        // When / Then
        assertThat(coordinator.status("nope")).map(RunStatus::phase).isEmpty();
    }

    private RunRequest request(String projectId, String output) {
        return RunRequest.of(projectId, tempDir.resolve(output), ProjectConfig.defaults());
    }
}
