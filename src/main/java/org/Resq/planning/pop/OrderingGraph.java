package org.Resq.planning.pop;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntHeapPriorityQueue;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Directed graph over plan-node ids induced by ordering constraints.
 *
 * <p>Node ids are mapped to dense indices; successor lists are primitive int lists.
 * Instances are immutable after construction.</p>
 */
final class OrderingGraph {
    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> indexById;
    private final String[] ids;
    private final IntArrayList[] successors;
    private final int[] topologicalOrder;

    private OrderingGraph(Object2IntOpenHashMap<String> indexById, String[] ids, IntArrayList[] successors) {
        this.indexById = indexById;
        this.ids = ids;
        this.successors = successors;
        this.topologicalOrder = kahn();
    }

    /**
     * Builds the graph.
     *
     * @throws IllegalArgumentException when an ordering endpoint is not among {@code nodeIds}.
     */
    static OrderingGraph of(Collection<String> nodeIds, Collection<Ordering> orderings) {
        Objects.requireNonNull(nodeIds, "nodeIds");
        Objects.requireNonNull(orderings, "orderings");

        Object2IntOpenHashMap<String> indexById = new Object2IntOpenHashMap<>(nodeIds.size());
        indexById.defaultReturnValue(MISSING);
        String[] ids = new String[nodeIds.size()];
        IntArrayList[] successors = new IntArrayList[nodeIds.size()];
        int next = 0;
        for (String id : nodeIds) {
            if (indexById.containsKey(id)) {
                throw new IllegalArgumentException("duplicate node id: " + id);
            }
            indexById.put(id, next);
            ids[next] = id;
            successors[next] = new IntArrayList();
            next++;
        }

        for (Ordering ordering : orderings) {
            int before = indexById.getInt(ordering.before());
            int after = indexById.getInt(ordering.after());
            if (before == MISSING || after == MISSING) {
                throw new IllegalArgumentException("ordering references unknown node: " + ordering);
            }
            if (!successors[before].contains(after)) {
                successors[before].add(after);
            }
        }
        return new OrderingGraph(indexById, ids, successors);
    }

    boolean contains(String id) {
        return indexById.containsKey(id);
    }

    /**
     * Returns whether a non-empty path leads from {@code from} to {@code to}.
     */
    boolean reaches(String from, String to) {
        int source = indexById.getInt(from);
        int target = indexById.getInt(to);
        if (source == MISSING || target == MISSING) {
            return false;
        }
        boolean[] visited = new boolean[ids.length];
        IntArrayList stack = new IntArrayList();
        stack.addAll(successors[source]);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            if (node == target) {
                return true;
            }
            if (visited[node]) {
                continue;
            }
            visited[node] = true;
            stack.addAll(successors[node]);
        }
        return false;
    }

    boolean isAcyclic() {
        return topologicalOrder != null;
    }

    /**
     * Returns node ids in a topological order, or empty when the graph has a cycle.
     * Ties resolve by insertion order.
     */
    Optional<List<String>> topologicalOrder() {
        if (topologicalOrder == null) {
            return Optional.empty();
        }
        List<String> order = new ArrayList<>(topologicalOrder.length);
        for (int index : topologicalOrder) {
            order.add(ids[index]);
        }
        return Optional.of(Collections.unmodifiableList(order));
    }

    /**
     * Returns ids of nodes that lie on or behind a cycle, in insertion order.
     */
    List<String> nodesNotSorted() {
        if (topologicalOrder != null) {
            return List.of();
        }
        boolean[] sorted = new boolean[ids.length];
        int[] partial = kahnPartial();
        for (int index : partial) {
            sorted[index] = true;
        }
        List<String> remaining = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            if (!sorted[i]) {
                remaining.add(ids[i]);
            }
        }
        return remaining;
    }

    private int[] kahn() {
        int[] partial = kahnPartial();
        return partial.length == ids.length ? partial : null;
    }

    private int[] kahnPartial() {
        int[] inDegree = new int[ids.length];
        for (IntArrayList out : successors) {
            for (int i = 0; i < out.size(); i++) {
                inDegree[out.getInt(i)]++;
            }
        }
        // smallest-index-first keeps the order stable
        IntHeapPriorityQueue ready = new IntHeapPriorityQueue();
        for (int i = 0; i < ids.length; i++) {
            if (inDegree[i] == 0) {
                ready.enqueue(i);
            }
        }
        IntArrayList order = new IntArrayList(ids.length);
        while (!ready.isEmpty()) {
            int node = ready.dequeueInt();
            order.add(node);
            IntArrayList out = successors[node];
            for (int i = 0; i < out.size(); i++) {
                int succ = out.getInt(i);
                if (--inDegree[succ] == 0) {
                    ready.enqueue(succ);
                }
            }
        }
        return order.toIntArray();
    }
}
