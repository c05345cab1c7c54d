package org.Resq.planning.graph;

import org.Resq.planning.domain.GroundAction;
import org.Resq.planning.domain.Proposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Layered relaxed planning graph.
 *
 * <p>Proposition layers {@code P0..Pn} alternate with action layers {@code A0..A(n-1)}.
 * Each layer is an independent immutable snapshot addressed by index; expanding the
 * graph never touches an earlier layer.</p>
 */
public final class PlanGraph {
    private final List<Set<Proposition>> propositionLayers;
    private final List<List<GroundAction>> actionLayers;

    private PlanGraph(List<Set<Proposition>> propositionLayers, List<List<GroundAction>> actionLayers) {
        this.propositionLayers = propositionLayers;
        this.actionLayers = actionLayers;
    }

    /**
     * Creates a graph from explicit layers.
     *
     * @param propositionLayers proposition layers {@code P0..Pn}.
     * @param actionLayers action layers {@code A0..A(n-1)}.
     * @throws IllegalArgumentException unless there is exactly one more proposition layer than action layers.
     */
    public static PlanGraph of(List<? extends Set<Proposition>> propositionLayers, List<? extends List<GroundAction>> actionLayers) {
        Objects.requireNonNull(propositionLayers, "propositionLayers");
        Objects.requireNonNull(actionLayers, "actionLayers");
        if (propositionLayers.size() != actionLayers.size() + 1) {
            throw new IllegalArgumentException(
                    "expected " + (actionLayers.size() + 1) + " proposition layers, got " + propositionLayers.size()
            );
        }
        List<Set<Proposition>> props = new ArrayList<>(propositionLayers.size());
        for (Set<Proposition> layer : propositionLayers) {
            props.add(Collections.unmodifiableSet(new LinkedHashSet<>(layer)));
        }
        List<List<GroundAction>> actions = new ArrayList<>(actionLayers.size());
        for (List<GroundAction> layer : actionLayers) {
            actions.add(List.copyOf(layer));
        }
        return new PlanGraph(Collections.unmodifiableList(props), Collections.unmodifiableList(actions));
    }

    /**
     * Returns proposition layer {@code P(index)}.
     */
    public Set<Proposition> propositionLayer(int index) {
        return propositionLayers.get(index);
    }

    /**
     * Returns action layer {@code A(index)}, the actions applicable in {@code P(index)}.
     */
    public List<GroundAction> actionLayer(int index) {
        return actionLayers.get(index);
    }

    public List<Set<Proposition>> propositionLayers() {
        return propositionLayers;
    }

    public List<List<GroundAction>> actionLayers() {
        return actionLayers;
    }

    /**
     * Returns the number of expanded levels, i.e. action layers.
     */
    public int levelCount() {
        return actionLayers.size();
    }

    /**
     * Returns the last proposition layer.
     */
    public Set<Proposition> lastPropositionLayer() {
        return propositionLayers.get(propositionLayers.size() - 1);
    }

    /**
     * Returns the first index {@code i > 0} with {@code P(i) == P(i-1)}, or -1 when the
     * graph never levelled off.
     */
    public int levelledOffAt() {
        for (int i = 1; i < propositionLayers.size(); i++) {
            if (propositionLayers.get(i).size() == propositionLayers.get(i - 1).size()
                    && propositionLayers.get(i).containsAll(propositionLayers.get(i - 1))) {
                return i;
            }
        }
        return -1;
    }
}
