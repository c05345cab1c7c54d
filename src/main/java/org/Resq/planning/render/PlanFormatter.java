package org.Resq.planning.render;

import lombok.experimental.UtilityClass;
import org.Resq.planning.domain.GroundAction;
import org.Resq.planning.domain.Proposition;
import org.Resq.planning.graph.LinearPlan;
import org.Resq.planning.pop.CausalLink;
import org.Resq.planning.pop.ContingencyBranch;
import org.Resq.planning.pop.Ordering;
import org.Resq.planning.pop.PopAction;
import org.Resq.planning.pop.PopPlan;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of plans for operators and briefing generators.
 */
@UtilityClass
public class PlanFormatter {

    /**
     * Renders one numbered line per step, starting at 1, in execution order.
     */
    public static String formatLinearPlan(LinearPlan plan) {
        StringBuilder out = new StringBuilder();
        List<GroundAction> steps = plan.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            out.append(i + 1).append(". ").append(steps.get(i).getName()).append('\n');
        }
        return out.toString();
    }

    /**
     * Renders the node catalog, orderings, causal links and branches.
     */
    public static String formatPopPlan(PopPlan plan) {
        StringBuilder out = new StringBuilder();

        out.append("Actions:\n");
        for (PopAction action : plan.actions().values()) {
            out.append("- ").append(action.id()).append(": ").append(action.name()).append('\n');
            if (!action.preconditions().isEmpty()) {
                out.append("    Pre: ").append(sorted(action.preconditions())).append('\n');
            }
            if (!action.effects().isEmpty()) {
                out.append("    Eff: ").append(sorted(action.effects())).append('\n');
            }
        }
        out.append('\n');

        out.append("Ordering constraints (before -> after):\n");
        for (Ordering ordering : plan.orderings()) {
            out.append("  ").append(ordering).append('\n');
        }
        out.append('\n');

        out.append("Causal links (producer --[condition]--> consumer):\n");
        for (CausalLink link : plan.causalLinks()) {
            out.append("  ").append(link).append('\n');
        }
        out.append('\n');

        out.append("Contingency branches:\n");
        for (ContingencyBranch branch : plan.branches()) {
            out.append("  IF ").append(branch.condition()).append(" (after ").append(branch.decisionPoint()).append("):\n");
            out.append("    THEN execute actions: ").append(branch.actionIds()).append('\n');
            if (!branch.rationale().isEmpty()) {
                out.append("    (").append(branch.rationale()).append(")\n");
            }
        }
        return out.toString();
    }

    private static String sorted(Collection<Proposition> propositions) {
        return propositions.stream()
                .sorted()
                .map(Proposition::key)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
