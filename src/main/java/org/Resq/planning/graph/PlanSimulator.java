package org.Resq.planning.graph;

import org.Resq.planning.PlanValidationException;
import org.Resq.planning.domain.GroundAction;
import org.Resq.planning.domain.Proposition;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Forward replay of a linear plan from an initial state.
 */
public final class PlanSimulator {

    /**
     * Replay semantics.
     */
    public enum Mode {
        /** Add effects only, matching relaxed graph expansion. */
        RELAXED,
        /** Full STRIPS transition: deletes, then adds. */
        STRIPS
    }

    /**
     * Replay outcome.
     *
     * @param failedStep zero-based index of the first step whose preconditions did not hold, or -1.
     * @param missingPreconditions preconditions missing at {@code failedStep}.
     * @param missingGoals goals absent from the final state (empty when a step failed).
     * @param finalState state after the last executed step.
     */
    public record Result(
            int failedStep,
            Set<Proposition> missingPreconditions,
            Set<Proposition> missingGoals,
            Set<Proposition> finalState
    ) {
        public boolean isValid() {
            return failedStep < 0 && missingGoals.isEmpty();
        }
    }

    /**
     * Replays {@code steps} from {@code initialState}.
     */
    public Result simulate(Set<Proposition> initialState, List<GroundAction> steps, Set<Proposition> goals, Mode mode) {
        Objects.requireNonNull(initialState, "initialState");
        Objects.requireNonNull(steps, "steps");
        Objects.requireNonNull(goals, "goals");
        Objects.requireNonNull(mode, "mode");

        Set<Proposition> state = initialState;
        for (int i = 0; i < steps.size(); i++) {
            GroundAction action = steps.get(i);
            if (!action.isApplicable(state)) {
                LinkedHashSet<Proposition> missing = new LinkedHashSet<>(action.getPreconditions());
                missing.removeAll(state);
                return new Result(i, Collections.unmodifiableSet(missing), Set.of(), state);
            }
            state = mode == Mode.STRIPS ? action.apply(state) : action.applyRelaxed(state);
        }
        LinkedHashSet<Proposition> missingGoals = new LinkedHashSet<>(goals);
        missingGoals.removeAll(state);
        return new Result(-1, Set.of(), Collections.unmodifiableSet(missingGoals), state);
    }

    /**
     * Verifies that the plan is duplicate-free, executable and goal-achieving.
     *
     * @throws PlanValidationException on the first violated property.
     */
    public void verify(Set<Proposition> initialState, LinearPlan plan, Set<Proposition> goals, Mode mode) {
        Objects.requireNonNull(plan, "plan");
        Set<String> seen = new HashSet<>();
        for (GroundAction action : plan.getSteps()) {
            if (!seen.add(action.getName())) {
                throw new PlanValidationException(
                        PlanValidationException.REASON_DUPLICATE_ACTION,
                        "action appears more than once: " + action.getName()
                );
            }
        }

        Result result = simulate(initialState, plan.getSteps(), goals, mode);
        if (result.failedStep() >= 0) {
            throw new PlanValidationException(
                    PlanValidationException.REASON_PRECONDITION_UNSATISFIED,
                    "step " + (result.failedStep() + 1) + " (" + plan.getSteps().get(result.failedStep()).getName()
                            + ") lacks " + result.missingPreconditions()
            );
        }
        if (!result.missingGoals().isEmpty()) {
            throw new PlanValidationException(
                    PlanValidationException.REASON_GOAL_NOT_ACHIEVED,
                    "plan leaves goals unachieved: " + result.missingGoals()
            );
        }
    }
}
