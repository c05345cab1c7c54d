package org.Resq.planning.pop;

import org.Resq.planning.PlanValidationException;
import org.Resq.planning.domain.Proposition;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks the structural invariants of a {@link PopPlan}.
 *
 * <ul>
 * <li>{@code Start} has no preconditions and no incoming ordering; {@code Finish} has no outgoing ordering.</li>
 * <li>The ordering relation is acyclic.</li>
 * <li>Every causal link is backed by the producer's effects, the consumer's preconditions
 * and an ordering path from producer to consumer.</li>
 * <li>Branches at the same decision point name pairwise disjoint actions.</li>
 * </ul>
 */
public final class PopPlanValidator {

    /**
     * Validates the plan.
     *
     * @throws PlanValidationException on the first violated invariant.
     */
    public void validate(PopPlan plan) {
        Objects.requireNonNull(plan, "plan");
        checkStartFinish(plan);
        checkAcyclic(plan);
        checkCausalLinks(plan);
        checkBranchExclusivity(plan);
    }

    /**
     * Validates the plan and additionally requires {@code Finish} to consume exactly {@code goals}.
     */
    public void validate(PopPlan plan, Set<Proposition> goals) {
        validate(plan);
        Objects.requireNonNull(goals, "goals");
        Set<Proposition> finishPreconditions = plan.finish().preconditions();
        if (!(finishPreconditions.size() == goals.size() && finishPreconditions.containsAll(goals))) {
            throw new PlanValidationException(
                    PlanValidationException.REASON_START_FINISH_CONTRACT,
                    "Finish preconditions " + finishPreconditions + " differ from goals " + goals
            );
        }
    }

    private static void checkStartFinish(PopPlan plan) {
        if (!plan.start().preconditions().isEmpty()) {
            throw new PlanValidationException(
                    PlanValidationException.REASON_START_FINISH_CONTRACT,
                    "Start must have no preconditions"
            );
        }
        for (Ordering ordering : plan.orderings()) {
            if (ordering.after().equals(PopAction.START_ID)) {
                throw new PlanValidationException(
                        PlanValidationException.REASON_START_FINISH_CONTRACT,
                        "Start must have no incoming ordering: " + ordering
                );
            }
            if (ordering.before().equals(PopAction.FINISH_ID)) {
                throw new PlanValidationException(
                        PlanValidationException.REASON_START_FINISH_CONTRACT,
                        "Finish must have no outgoing ordering: " + ordering
                );
            }
        }
    }

    private static void checkAcyclic(PopPlan plan) {
        OrderingGraph graph = plan.orderingGraph();
        if (!graph.isAcyclic()) {
            throw new PlanValidationException(
                    PlanValidationException.REASON_ORDERING_CYCLE,
                    "orderings contain a cycle through " + graph.nodesNotSorted()
            );
        }
    }

    private static void checkCausalLinks(PopPlan plan) {
        for (CausalLink link : plan.causalLinks()) {
            PopAction producer = plan.action(link.producer());
            PopAction consumer = plan.action(link.consumer());
            if (!producer.effects().contains(link.proposition())) {
                throw invalidLink(link, "producer does not add the proposition");
            }
            if (!consumer.preconditions().contains(link.proposition())) {
                throw invalidLink(link, "consumer does not require the proposition");
            }
            if (!plan.isOrderedBefore(link.producer(), link.consumer())) {
                throw invalidLink(link, "producer is not ordered before consumer");
            }
        }
    }

    private static void checkBranchExclusivity(PopPlan plan) {
        Map<String, Set<String>> claimed = new HashMap<>();
        for (ContingencyBranch branch : plan.branches()) {
            Set<String> seen = claimed.computeIfAbsent(branch.decisionPoint(), key -> new HashSet<>());
            List<String> ids = branch.actionIds();
            Set<String> local = new HashSet<>(ids);
            for (String id : local) {
                if (!seen.add(id)) {
                    throw new PlanValidationException(
                            PlanValidationException.REASON_BRANCH_OVERLAP,
                            "action " + id + " appears in more than one branch at " + branch.decisionPoint()
                    );
                }
            }
        }
    }

    private static PlanValidationException invalidLink(CausalLink link, String reason) {
        return new PlanValidationException(
                PlanValidationException.REASON_INVALID_CAUSAL_LINK,
                "invalid causal link " + link + ": " + reason
        );
    }
}
