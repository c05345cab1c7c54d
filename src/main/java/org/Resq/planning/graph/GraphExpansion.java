package org.Resq.planning.graph;

import java.util.Objects;

/**
 * Planning-graph expansion outcome.
 *
 * @param graph expanded graph.
 * @param goalLayer index of the first proposition layer containing every goal.
 */
public record GraphExpansion(PlanGraph graph, int goalLayer) {

    public GraphExpansion {
        Objects.requireNonNull(graph, "graph");
        if (goalLayer < 0 || goalLayer > graph.levelCount()) {
            throw new IllegalArgumentException("goalLayer out of bounds: " + goalLayer);
        }
    }
}
