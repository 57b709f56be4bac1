package com.archforge.core.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Explicit phase state machine of one run.
 *
 * <p>The pipeline enqueues the phases it intends to run, then calls {@link #advance()} as
 * each one starts. Every transition is checked against {@link RunPhase#allowedNext()} and
 * published to listeners after it is applied. {@link #fail()} ends the run from any
 * non-terminal phase and clears the queue.
 *
 * <p>Listeners run on the run's thread; a listener that throws is logged and skipped.
 */
public class RunStateMachine {

    private static final Logger log = LoggerFactory.getLogger(RunStateMachine.class);

    private final String runId;
    private final Clock clock;
    private final Deque<RunPhase> queue = new ArrayDeque<>();
    private final List<PhaseTransition> history = new ArrayList<>();
    private final List<PhaseListener> listeners = new CopyOnWriteArrayList<>();
    private volatile RunPhase current = RunPhase.QUEUED;

    public RunStateMachine(String runId) {
        this(runId, Clock.systemUTC());
    }

    public RunStateMachine(String runId, Clock clock) {
        this.runId = runId;
        this.clock = clock;
    }

    public RunPhase current() {
        return current;
    }

    public void addListener(PhaseListener listener) {
        listeners.add(listener);
    }

    /**
     * Appends phases to run, in order.
     *
     * @param phases planned phases
     */
    public synchronized void enqueue(Collection<RunPhase> phases) {
        queue.addAll(phases);
    }

    /**
     * Returns the phases still queued.
     *
     * @return queued phases in order
     */
    public synchronized List<RunPhase> pending() {
        return List.copyOf(queue);
    }

    /**
     * Moves to the next queued phase.
     *
     * @return the phase entered
     * @throws IllegalStateException if the queue is empty or the transition is not allowed
     */
    public synchronized RunPhase advance() {
        RunPhase next = queue.poll();
        if (next == null) {
            throw new IllegalStateException("Run " + runId + " has no queued phase after " + current);
        }
        transitionTo(next);
        return next;
    }

    /**
     * Applies a transition.
     *
     * @param next phase to enter
     * @throws IllegalStateException if {@code current -> next} is not allowed
     */
    public synchronized void transitionTo(RunPhase next) {
        RunPhase from = current;
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal run transition " + from + " -> " + next + " for run " + runId);
        }
        current = next;
        PhaseTransition transition = new PhaseTransition(runId, from, next, clock.instant());
        history.add(transition);
        log.info("Run {}: {} -> {}", runId, from, next);
        publish(transition);
    }

    /**
     * Ends the run in {@link RunPhase#FAILED}. A no-op when the run already ended.
     */
    public synchronized void fail() {
        queue.clear();
        if (!current.isTerminal()) {
            transitionTo(RunPhase.FAILED);
        }
    }

    public synchronized List<PhaseTransition> history() {
        return List.copyOf(history);
    }

    private void publish(PhaseTransition transition) {
        for (PhaseListener listener : listeners) {
            try {
                listener.onTransition(transition);
            } catch (RuntimeException e) {
                log.warn("Phase listener failed for run {}: {}", runId, e.getMessage());
            }
        }
    }
}
