package com.archforge.core.planner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first topological sort over a {@link TaskDag} with cycle reporting.
 *
 * <p>The DFS follows dependency edges and emits a task once all its dependencies are
 * emitted, so the result lists dependencies first. Roots are visited in task insertion
 * order and edges in declaration order, which makes the order stable across runs.
 *
 * <p>The traversal uses an explicit stack, so graph depth is bounded by heap rather
 * than thread stack. A dependency found while it is still on the stack closes a cycle:
 * the path is recorded, every cycle member is excluded, and so is every task that
 * transitively depends on a member. The remaining tasks are still ordered.
 */
public class TopologicalSorter {

    private static final Logger log = LoggerFactory.getLogger(TopologicalSorter.class);

    private enum Mark { ON_STACK, DONE }

    /**
     * Result of sorting.
     *
     * @param order emitted task ids, dependencies before dependents
     * @param cycles detected cycles, in detection order
     * @param blocked tasks excluded because they depend on a cycle member
     */
    public record SortResult(List<String> order, List<PlanningCycle> cycles, Set<String> blocked) {
        public SortResult {
            order = List.copyOf(order);
            cycles = List.copyOf(cycles);
            blocked = Set.copyOf(blocked);
        }

        public boolean hasCycles() {
            return !cycles.isEmpty();
        }
    }

    /**
     * Sorts the graph.
     *
     * @param dag graph to sort
     * @return order plus cycle findings
     */
    public SortResult sort(TaskDag dag) {
        Map<String, Mark> marks = new HashMap<>();
        List<String> postorder = new ArrayList<>();
        List<PlanningCycle> cycles = new ArrayList<>();
        Set<Set<String>> seenCycles = new HashSet<>();
        Set<String> cyclic = new LinkedHashSet<>();

        for (String root : dag.taskIds()) {
            if (marks.containsKey(root)) {
                continue;
            }

            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root, dag.dependenciesOf(root).iterator()));
            marks.put(root, Mark.ON_STACK);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.pending.hasNext()) {
                    String dependency = frame.pending.next();
                    Mark mark = marks.get(dependency);
                    if (mark == null) {
                        marks.put(dependency, Mark.ON_STACK);
                        stack.push(new Frame(dependency, dag.dependenciesOf(dependency).iterator()));
                    } else if (mark == Mark.ON_STACK) {
                        PlanningCycle cycle = cyclePath(stack, dependency);
                        if (seenCycles.add(cycle.members())) {
                            cycles.add(cycle);
                            log.warn("Planning cycle detected: {}", cycle.describe());
                        }
                        cyclic.addAll(cycle.members());
                    }
                } else {
                    stack.pop();
                    marks.put(frame.taskId, Mark.DONE);
                    postorder.add(frame.taskId);
                }
            }
        }

        Set<String> blocked = blockedBy(dag, cyclic);
        List<String> order = postorder.stream()
            .filter(id -> !cyclic.contains(id) && !blocked.contains(id))
            .toList();

        if (!blocked.isEmpty()) {
            log.warn("Tasks blocked by planning cycles: {}", blocked);
        }
        log.debug("Computed generation order of {} tasks ({} cycles)", order.size(), cycles.size());
        return new SortResult(order, cycles, blocked);
    }

    /**
     * Builds the cycle path from the re-entered task up to the top of the stack.
     */
    private static PlanningCycle cyclePath(Deque<Frame> stack, String reentered) {
        List<String> path = new ArrayList<>();
        Iterator<Frame> bottomUp = stack.descendingIterator();
        boolean inCycle = false;
        while (bottomUp.hasNext()) {
            String id = bottomUp.next().taskId;
            if (id.equals(reentered)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(id);
            }
        }
        path.add(reentered);
        return new PlanningCycle(path);
    }

    /**
     * Returns tasks outside the cyclic set that transitively depend on a cyclic task.
     */
    private static Set<String> blockedBy(TaskDag dag, Set<String> cyclic) {
        Set<String> blocked = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(cyclic);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependent : dag.dependentsOf(current)) {
                if (!cyclic.contains(dependent) && blocked.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return blocked;
    }

    private static final class Frame {
        private final String taskId;
        private final Iterator<String> pending;

        private Frame(String taskId, Iterator<String> pending) {
            this.taskId = taskId;
            this.pending = pending;
        }
    }
}
