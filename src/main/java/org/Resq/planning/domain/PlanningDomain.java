package org.Resq.planning.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ground STRIPS domain: initial state, action catalog and goal set.
 *
 * <p>Catalog order is significant; planners break ties by it.</p>
 */
public final class PlanningDomain {
    private final Set<Proposition> initialState;
    private final List<GroundAction> actions;
    private final Set<Proposition> goals;
    private final Map<String, GroundAction> actionsByName;

    public PlanningDomain(Set<Proposition> initialState, List<GroundAction> actions, Set<Proposition> goals) {
        this.initialState = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(initialState, "initialState")));
        this.actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
        this.goals = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(goals, "goals")));

        LinkedHashMap<String, GroundAction> byName = new LinkedHashMap<>();
        for (GroundAction action : this.actions) {
            if (byName.putIfAbsent(action.getName(), action) != null) {
                throw new IllegalArgumentException("Duplicate action name: " + action.getName());
            }
        }
        this.actionsByName = Collections.unmodifiableMap(byName);
    }

    public Set<Proposition> initialState() {
        return initialState;
    }

    public List<GroundAction> actions() {
        return actions;
    }

    public Set<Proposition> goals() {
        return goals;
    }

    public Optional<GroundAction> action(String name) {
        return Optional.ofNullable(actionsByName.get(name));
    }

    /**
     * Returns catalog actions with the given role, in catalog order.
     */
    public List<GroundAction> actionsWithRole(ActionRole role) {
        return actions.stream().filter(action -> action.getRole() == role).toList();
    }

    /**
     * Returns a copy of this domain with a different goal set.
     */
    public PlanningDomain withGoals(Set<Proposition> newGoals) {
        return new PlanningDomain(initialState, actions, newGoals);
    }
}
