package com.archforge.core.pipeline;

import com.archforge.core.run.InMemoryRunStore;
import com.archforge.core.run.RunContext;
import com.archforge.core.run.RunStatus;
import com.archforge.core.run.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes independent runs concurrently, one thread per run.
 *
 * <p>Each run gets its own {@link RunContext}; its phase transitions are mirrored into the
 * {@link RunStore} so callers can poll {@link #status(String)} while it executes.
 */
public class RunCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final GenerationPipeline pipeline;
    private final RunStore<RunStatus> store;
    private final ExecutorService executor;
    private final Duration retention;
    private final Clock clock;
    private final Map<String, RunContext> active = new ConcurrentHashMap<>();

    public RunCoordinator(GenerationPipeline pipeline) {
        this(pipeline, new InMemoryRunStore<>(), newExecutor(), DEFAULT_RETENTION, Clock.systemUTC());
    }

    public RunCoordinator(GenerationPipeline pipeline, RunStore<RunStatus> store, ExecutorService executor,
                          Duration retention, Clock clock) {
        this.pipeline = pipeline;
        this.store = store;
        this.executor = executor;
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Starts a run under a generated id.
     *
     * @param request run inputs
     * @return future completed with the report when the run ends
     */
    public CompletableFuture<RunReport> submit(RunRequest request) {
        return submit(request.projectId() + "-" + UUID.randomUUID().toString().substring(0, 8), request);
    }

    /**
     * Starts a run under a caller-chosen id.
     *
     * @param runId unique run id
     * @param request run inputs
     * @return future completed with the report when the run ends
     * @throws IllegalArgumentException if a run with this id is still active
     */
    public CompletableFuture<RunReport> submit(String runId, RunRequest request) {
        Duration timeout = Duration.ofSeconds(request.config().run().timeoutSeconds());
        RunContext context = new RunContext(runId, request.projectId(), timeout, clock);
        if (active.putIfAbsent(runId, context) != null) {
            throw new IllegalArgumentException("Run already active: " + runId);
        }

        context.stateMachine().addListener(t -> store.set(runId, RunStatus.of(context, t.at()), retention));
        store.set(runId, RunStatus.of(context, clock.instant()), retention);
        log.info("Submitted run {} for project {}", runId, request.projectId());

        return CompletableFuture
            .supplyAsync(() -> pipeline.run(request, context), executor)
            .whenComplete((report, error) -> {
                active.remove(runId);
                if (error != null) {
                    log.error("Run {} terminated abnormally", runId, error);
                }
            });
    }

    /**
     * Requests cancellation of an active run. The run stops before its next task.
     *
     * @param runId run id
     * @return true if the run was active
     */
    public boolean cancel(String runId) {
        RunContext context = active.get(runId);
        if (context == null) {
            return false;
        }
        log.info("Cancelling run {}", runId);
        context.cancel();
        return true;
    }

    public Optional<RunStatus> status(String runId) {
        return store.get(runId);
    }

    public int activeRuns() {
        return active.size();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Runs still executing after shutdown timeout; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutorService newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "archforge-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
