package org.Resq.planning.graph;

import org.Resq.planning.PlanNotFoundException;
import org.Resq.planning.domain.GroundAction;
import org.Resq.planning.domain.PlanningDomain;
import org.Resq.planning.domain.Proposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Relaxed GraphPlan-style forward expansion.
 *
 * <p>{@code A(i)} holds every action whose preconditions are contained in {@code P(i)};
 * {@code P(i+1) = P(i) ∪ addEffects(A(i))}. Delete effects are ignored, so layers only
 * grow. Mutual exclusion is not tracked.</p>
 *
 * <p>Expansion stops at the first level whose proposition layer covers the goals. When
 * {@code maxLevels} levels are expanded without success the request fails with
 * {@link PlanNotFoundException}; the bound is the only stop condition besides success.</p>
 */
public final class PlanGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(PlanGraphBuilder.class);

    /**
     * Expands the graph for a domain.
     */
    public GraphExpansion expand(PlanningDomain domain, int maxLevels) {
        Objects.requireNonNull(domain, "domain");
        return expand(domain.initialState(), domain.actions(), domain.goals(), maxLevels);
    }

    /**
     * Expands the graph until the goals appear or {@code maxLevels} is exhausted.
     *
     * @param initialState proposition layer {@code P0}.
     * @param actions ground action catalog; its order is preserved in every action layer.
     * @param goals goal propositions.
     * @param maxLevels maximum number of action layers to expand, at least 1.
     * @return graph and index of the first goal-covering proposition layer (at least 1).
     * @throws PlanNotFoundException when the goals are not covered within {@code maxLevels}.
     */
    public GraphExpansion expand(
            Set<Proposition> initialState,
            List<GroundAction> actions,
            Set<Proposition> goals,
            int maxLevels
    ) {
        Objects.requireNonNull(initialState, "initialState");
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(goals, "goals");
        if (maxLevels < 1) {
            throw new IllegalArgumentException("maxLevels must be >= 1, got " + maxLevels);
        }

        List<Set<Proposition>> propositionLayers = new ArrayList<>(maxLevels + 1);
        List<List<GroundAction>> actionLayers = new ArrayList<>(maxLevels);
        propositionLayers.add(Collections.unmodifiableSet(new LinkedHashSet<>(initialState)));

        for (int level = 0; level < maxLevels; level++) {
            Set<Proposition> current = propositionLayers.get(level);

            List<GroundAction> applicable = new ArrayList<>();
            for (GroundAction action : actions) {
                if (action.isApplicable(current)) {
                    applicable.add(action);
                }
            }

            LinkedHashSet<Proposition> next = new LinkedHashSet<>(current);
            for (GroundAction action : applicable) {
                next.addAll(action.getAddEffects());
            }

            actionLayers.add(List.copyOf(applicable));
            propositionLayers.add(Collections.unmodifiableSet(next));
            log.debug("Level {}: {} applicable actions, {} -> {} propositions",
                    level, applicable.size(), current.size(), next.size());

            if (next.containsAll(goals)) {
                log.debug("Goals {} covered at layer {}", goals, level + 1);
                return new GraphExpansion(PlanGraph.of(propositionLayers, actionLayers), level + 1);
            }
        }

        Set<Proposition> last = propositionLayers.get(propositionLayers.size() - 1);
        LinkedHashSet<Proposition> unreached = new LinkedHashSet<>(goals);
        unreached.removeAll(last);
        throw new PlanNotFoundException(goals, unreached, maxLevels);
    }
}
