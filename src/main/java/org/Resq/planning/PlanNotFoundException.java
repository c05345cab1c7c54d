package org.Resq.planning;

import lombok.Getter;
import org.Resq.planning.domain.Proposition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Raised when planning-graph expansion exhausts its level bound without covering the goals.
 *
 * <p>The core never retries; callers may retry with a larger bound.</p>
 */
@Getter
public final class PlanNotFoundException extends PlanningException {
    public static final String REASON_PLAN_NOT_FOUND = "PLAN_NOT_FOUND";

    private final Set<Proposition> goals;
    private final Set<Proposition> unreachedGoals;
    private final int maxLevels;

    public PlanNotFoundException(Set<Proposition> goals, Set<Proposition> unreachedGoals, int maxLevels) {
        super(
                REASON_PLAN_NOT_FOUND,
                "goals " + goals + " not reachable within " + maxLevels + " levels; unreached " + unreachedGoals
        );
        this.goals = Collections.unmodifiableSet(new LinkedHashSet<>(goals));
        this.unreachedGoals = Collections.unmodifiableSet(new LinkedHashSet<>(unreachedGoals));
        this.maxLevels = maxLevels;
    }
}
