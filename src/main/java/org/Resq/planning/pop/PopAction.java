package org.Resq.planning.pop;

import org.Resq.planning.domain.ActionRole;
import org.Resq.planning.domain.GroundAction;
import org.Resq.planning.domain.Proposition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Plan node: a ground action wrapped with a stable id distinct from its name.
 *
 * @param id plan-node id, unique within one plan.
 * @param name ground action name (or {@code Start}/{@code Finish}).
 * @param role catalog role; {@link ActionRole#GENERIC} for synthetic nodes.
 * @param preconditions propositions the node consumes.
 * @param effects propositions the node produces (add effects only).
 */
public record PopAction(
        String id,
        String name,
        ActionRole role,
        Set<Proposition> preconditions,
        Set<Proposition> effects
) {
    public static final String START_ID = "Start";
    public static final String FINISH_ID = "Finish";

    public PopAction {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        preconditions = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(preconditions, "preconditions")));
        effects = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(effects, "effects")));
    }

    /**
     * Creates the synthetic start node producing the initial state.
     */
    public static PopAction start(Set<Proposition> initialState) {
        return new PopAction(START_ID, START_ID, ActionRole.GENERIC, Set.of(), initialState);
    }

    /**
     * Creates the synthetic finish node consuming the goals.
     */
    public static PopAction finish(Set<Proposition> goals) {
        return new PopAction(FINISH_ID, FINISH_ID, ActionRole.GENERIC, goals, Set.of());
    }

    /**
     * Wraps a ground action, keeping its add effects as node effects.
     */
    public static PopAction wrap(GroundAction action, String id) {
        return new PopAction(id, action.getName(), action.getRole(), action.getPreconditions(), action.getAddEffects());
    }

    public boolean isSynthetic() {
        return START_ID.equals(id) || FINISH_ID.equals(id);
    }
}
