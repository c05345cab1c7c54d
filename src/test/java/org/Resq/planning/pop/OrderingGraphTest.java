package org.Resq.planning.pop;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Ordering Graph Tests")
class OrderingGraphTest {

    @Test
    @DisplayName("Reachability follows transitive paths only forward")
    void testReaches() {
        OrderingGraph graph = OrderingGraph.of(
                List.of("a", "b", "c", "d"),
                List.of(new Ordering("a", "b"), new Ordering("b", "c"))
        );
        assertTrue(graph.reaches("a", "c"));
        assertFalse(graph.reaches("c", "a"));
        assertFalse(graph.reaches("a", "a"));
        assertFalse(graph.reaches("a", "d"));
        assertFalse(graph.reaches("a", "zzz"));
        assertTrue(graph.contains("d"));
    }

    @Test
    @DisplayName("Topological order breaks ties by insertion order")
    void testTopologicalOrder() {
        OrderingGraph graph = OrderingGraph.of(
                List.of("s", "x", "y", "z"),
                List.of(new Ordering("s", "z"), new Ordering("s", "y"), new Ordering("z", "x"))
        );
        assertTrue(graph.isAcyclic());
        assertEquals(Optional.of(List.of("s", "y", "z", "x")), graph.topologicalOrder());
        assertTrue(graph.nodesNotSorted().isEmpty());
    }

    @Test
    @DisplayName("Cycles are detected and the unsorted nodes are named")
    void testCycle() {
        OrderingGraph graph = OrderingGraph.of(
                List.of("a", "b", "c"),
                List.of(new Ordering("b", "c"), new Ordering("c", "b"))
        );
        assertFalse(graph.isAcyclic());
        assertTrue(graph.topologicalOrder().isEmpty());
        assertEquals(List.of("b", "c"), graph.nodesNotSorted());
        assertTrue(graph.reaches("b", "b"));
    }

    @Test
    @DisplayName("Validation: unknown endpoints and duplicate ids are rejected")
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class,
                () -> OrderingGraph.of(List.of("a"), List.of(new Ordering("a", "b"))));
        assertThrows(IllegalArgumentException.class,
                () -> OrderingGraph.of(List.of("a", "a"), List.of()));
    }
}
