package org.example.orchestration.graph;

import org.example.orchestration.model.Project;
import org.example.orchestration.model.ProjectDependency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CycleDetector.
 */
class CycleDetectorTest {

    private static DependencyGraph graphOf(String[] names, String[][] edges) throws Exception {
        DependencyGraph graph = new DependencyGraph(true);
        for (String name : names) {
            graph.addProject(Project.builder().name(name).build());
        }
        for (String[] edge : edges) {
            graph.addDependency(ProjectDependency.direct(edge[0], edge[1]));
        }
        return graph;
    }

    @Test
    @DisplayName("should report cycle in traversal order")
    void shouldReportCycleInTraversalOrder() throws Exception {
        DependencyGraph graph = graphOf(
                new String[]{"a", "b", "c"},
                new String[][]{{"a", "b"}, {"b", "c"}, {"c", "a"}});

        List<List<String>> cycles = new CycleDetector(graph).findCycles();

        assertThat(cycles).containsExactly(List.of("a", "b", "c"));
    }

    @Test
    @DisplayName("should report self-dependency as single-element cycle")
    void shouldReportSelfDependency() throws Exception {
        DependencyGraph graph = graphOf(new String[]{"x"}, new String[][]{{"x", "x"}});

        assertThat(new CycleDetector(graph).findCycles()).containsExactly(List.of("x"));
    }

    @Test
    @DisplayName("should report each disjoint cycle once")
    void shouldReportDisjointCycles() throws Exception {
        DependencyGraph graph = graphOf(
                new String[]{"a", "b", "c", "d", "e"},
                new String[][]{{"a", "b"}, {"b", "a"}, {"c", "d"}, {"d", "c"}, {"e", "a"}});

        List<List<String>> cycles = new CycleDetector(graph).findCycles();

        assertThat(cycles).hasSize(2);
        assertThat(cycles.get(0)).containsExactlyInAnyOrder("a", "b");
        assertThat(cycles.get(1)).containsExactlyInAnyOrder("c", "d");
    }

    @Test
    @DisplayName("should find nothing in a diamond")
    void shouldFindNothingInDiamond() throws Exception {
        DependencyGraph graph = graphOf(
                new String[]{"top", "left", "right", "bottom"},
                new String[][]{{"top", "left"}, {"top", "right"}, {"left", "bottom"}, {"right", "bottom"}});

        assertThat(new CycleDetector(graph).findCycles()).isEmpty();
    }

    @Test
    @DisplayName("should handle long chains without recursion")
    void shouldHandleLongChains() throws Exception {
        DependencyGraph graph = new DependencyGraph(true);
        int size = 20_000;
        for (int i = 0; i < size; i++) {
            graph.addProject(Project.builder().name("p" + i).build());
        }
        for (int i = 0; i < size - 1; i++) {
            graph.addDependency(ProjectDependency.direct("p" + i, "p" + (i + 1)));
        }
        graph.addDependency(ProjectDependency.direct("p" + (size - 1), "p0"));

        List<List<String>> cycles = new CycleDetector(graph).findCycles();

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0)).hasSize(size).startsWith("p0", "p1");
    }
}
