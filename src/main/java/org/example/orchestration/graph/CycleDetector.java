package org.example.orchestration.graph;

import org.example.orchestration.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Detects cycles in a dependency graph using an iterative depth-first traversal.
 *
 * <p>Each project is marked in-progress while it is on the traversal stack. Reaching an
 * in-progress project again closes a cycle, which is rebuilt by walking parent pointers
 * back from the current project. Cycles over the same set of projects are reported once.</p>
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    private enum Mark {
        IN_PROGRESS,
        DONE
    }

    private final DependencyGraph graph;

    public CycleDetector(DependencyGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph cannot be null");
    }

    /**
     * Finds cycles in the graph.
     *
     * @return cycles in traversal order, e.g. {@code [a, b, c]} for a -> b -> c -> a;
     *         a self-dependency yields a single-element cycle
     */
    public List<List<String>> findCycles() {
        Map<String, Mark> marks = new HashMap<>();
        Map<String, String> parents = new HashMap<>();
        Set<Set<String>> seen = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();

        for (Project project : graph.getProjects()) {
            String start = project.getName();
            if (marks.containsKey(start)) {
                continue;
            }

            Deque<Frame> stack = new ArrayDeque<>();
            marks.put(start, Mark.IN_PROGRESS);
            stack.push(new Frame(start, graph.getDependencyNames(start).iterator()));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();

                if (!frame.neighbors.hasNext()) {
                    marks.put(frame.node, Mark.DONE);
                    stack.pop();
                    continue;
                }

                String neighbor = frame.neighbors.next();
                Mark mark = marks.get(neighbor);

                if (mark == null) {
                    marks.put(neighbor, Mark.IN_PROGRESS);
                    parents.put(neighbor, frame.node);
                    stack.push(new Frame(neighbor, graph.getDependencyNames(neighbor).iterator()));
                } else if (mark == Mark.IN_PROGRESS) {
                    List<String> cycle = reconstruct(frame.node, neighbor, parents);
                    if (seen.add(new HashSet<>(cycle))) {
                        log.debug("Cycle detected: {}", cycle);
                        cycles.add(cycle);
                    }
                }
            }
        }

        return cycles;
    }

    /**
     * Walks parent pointers from {@code current} back to {@code target}.
     */
    private List<String> reconstruct(String current, String target, Map<String, String> parents) {
        LinkedList<String> cycle = new LinkedList<>();
        String node = current;
        while (node != null && !node.equals(target)) {
            cycle.addFirst(node);
            node = parents.get(node);
        }
        cycle.addFirst(target);
        return new ArrayList<>(cycle);
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> neighbors;

        private Frame(String node, Iterator<String> neighbors) {
            this.node = node;
            this.neighbors = neighbors;
        }
    }
}
