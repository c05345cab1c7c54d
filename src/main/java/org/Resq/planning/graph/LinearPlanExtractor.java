package org.Resq.planning.graph;

import org.Resq.planning.PlanExtractionException;
import org.Resq.planning.domain.GroundAction;
import org.Resq.planning.domain.Proposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Backward regression from the goal layer to a single linear plan.
 *
 * <p>Walking from the goal layer down to layer 1, each open goal is either carried
 * down (it already holds in the previous proposition layer) or supported by the first
 * action of the previous action layer that adds it; the supporter's preconditions join
 * the goals of the next level down. Selected supporters are reversed into forward order
 * and de-duplicated by name, keeping the earliest occurrence.</p>
 *
 * <p>A goal that is neither carried nor supported, or that is still open at layer 0
 * without being part of {@code P0}, is an error: regression never drops goals.</p>
 */
public final class LinearPlanExtractor {
    private static final Logger log = LoggerFactory.getLogger(LinearPlanExtractor.class);

    /**
     * Extracts a plan for the goals of an expansion.
     *
     * @param expansion graph plus goal layer index.
     * @param goals goals to regress; must be contained in the goal layer.
     * @return linear plan in execution order.
     * @throws PlanExtractionException when a goal cannot be justified by the graph.
     */
    public LinearPlan extract(GraphExpansion expansion, Set<Proposition> goals) {
        Objects.requireNonNull(expansion, "expansion");
        Objects.requireNonNull(goals, "goals");
        PlanGraph graph = expansion.graph();
        int goalLayer = expansion.goalLayer();

        Set<Proposition> top = graph.propositionLayer(goalLayer);
        for (Proposition goal : goals) {
            if (!top.contains(goal)) {
                throw new PlanExtractionException(
                        PlanExtractionException.REASON_UNSUPPORTED_GOAL,
                        goal,
                        goalLayer,
                        "goal " + goal + " is not in proposition layer " + goalLayer
                );
            }
        }

        List<GroundAction> chosen = new ArrayList<>();
        Set<Proposition> currentGoals = new LinkedHashSet<>(goals);

        for (int level = goalLayer; level >= 1; level--) {
            Set<Proposition> previous = graph.propositionLayer(level - 1);
            List<GroundAction> candidates = graph.actionLayer(level - 1);
            Set<Proposition> nextGoals = new LinkedHashSet<>();

            for (Proposition goal : currentGoals) {
                if (previous.contains(goal)) {
                    nextGoals.add(goal);
                    continue;
                }
                GroundAction supporter = firstSupporter(candidates, goal);
                if (supporter == null) {
                    throw new PlanExtractionException(
                            PlanExtractionException.REASON_UNSUPPORTED_GOAL,
                            goal,
                            level,
                            "no action in layer " + (level - 1) + " adds " + goal
                    );
                }
                log.debug("Layer {}: {} supported by {}", level, goal, supporter.getName());
                chosen.add(supporter);
                nextGoals.addAll(supporter.getPreconditions());
            }
            currentGoals = nextGoals;
        }

        Set<Proposition> initial = graph.propositionLayer(0);
        for (Proposition goal : currentGoals) {
            if (!initial.contains(goal)) {
                throw new PlanExtractionException(
                        PlanExtractionException.REASON_UNGROUNDED_GOAL,
                        goal,
                        0,
                        "goal " + goal + " reached layer 0 but is not in the initial state"
                );
            }
        }

        return LinearPlan.builder().steps(forwardUnique(chosen)).build();
    }

    private static GroundAction firstSupporter(List<GroundAction> candidates, Proposition goal) {
        for (GroundAction action : candidates) {
            if (action.getAddEffects().contains(goal)) {
                return action;
            }
        }
        return null;
    }

    /**
     * Reverses backward selections into execution order, keeping each name's first occurrence.
     */
    private static List<GroundAction> forwardUnique(List<GroundAction> backward) {
        List<GroundAction> forward = new ArrayList<>(backward);
        Collections.reverse(forward);
        LinkedHashMap<String, GroundAction> unique = new LinkedHashMap<>();
        for (GroundAction action : forward) {
            unique.putIfAbsent(action.getName(), action);
        }
        return new ArrayList<>(unique.values());
    }
}
