package org.Resq.planning.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Instantiated STRIPS operator.
 *
 * <p>Set-valued fields keep insertion order, which makes rendering and supporter
 * tie-breaking deterministic.</p>
 */
@Value
@Builder
public class GroundAction {
    /** Operator name, e.g. {@code NotifyHospital}. */
    String operator;
    /** Ordered object arguments the operator is instantiated with. */
    @Singular
    List<String> arguments;
    /** Role within the response catalog. */
    @Builder.Default
    ActionRole role = ActionRole.GENERIC;
    /** Propositions that must hold before execution. */
    @Singular
    Set<Proposition> preconditions;
    /** Propositions made true by execution. */
    @Singular
    Set<Proposition> addEffects;
    /** Propositions made false by execution (ignored by relaxed expansion). */
    @Singular
    Set<Proposition> delEffects;

    /**
     * Returns the unique action name, e.g. {@code NotifyHospital(H1)}.
     */
    public String getName() {
        if (arguments.isEmpty()) {
            return operator;
        }
        return operator + "(" + String.join(", ", arguments) + ")";
    }

    /**
     * Returns whether every precondition holds in {@code state}.
     */
    public boolean isApplicable(Collection<Proposition> state) {
        return state.containsAll(preconditions);
    }

    /**
     * Returns {@code (state \ delEffects) ∪ addEffects} as a new set.
     */
    public Set<Proposition> apply(Collection<Proposition> state) {
        LinkedHashSet<Proposition> next = new LinkedHashSet<>(state);
        next.removeAll(delEffects);
        next.addAll(addEffects);
        return Collections.unmodifiableSet(next);
    }

    /**
     * Returns the state reached when delete effects are ignored.
     */
    public Set<Proposition> applyRelaxed(Collection<Proposition> state) {
        LinkedHashSet<Proposition> next = new LinkedHashSet<>(state);
        next.addAll(addEffects);
        return Collections.unmodifiableSet(next);
    }

    @Override
    public String toString() {
        return getName();
    }
}
