package org.Resq.planning.pop;

import org.Resq.planning.domain.Proposition;

import java.util.List;
import java.util.Objects;

/**
 * Runtime decision point: execute {@code actionIds} if {@code condition} is observed to hold.
 *
 * <p>Branches sharing a decision point are mutually exclusive continuations. The planner
 * never picks one; the executor does, once the condition can be observed.</p>
 *
 * @param decisionPoint id of the plan node after which the condition is evaluated.
 * @param condition runtime-observable proposition.
 * @param actionIds plan-node ids to execute when the condition holds.
 * @param rationale human-readable explanation.
 */
public record ContingencyBranch(
        String decisionPoint,
        Proposition condition,
        List<String> actionIds,
        String rationale
) {
    public ContingencyBranch {
        Objects.requireNonNull(decisionPoint, "decisionPoint");
        Objects.requireNonNull(condition, "condition");
        actionIds = List.copyOf(Objects.requireNonNull(actionIds, "actionIds"));
        if (actionIds.isEmpty()) {
            throw new IllegalArgumentException("branch must name at least one action");
        }
        rationale = rationale == null ? "" : rationale;
    }
}
