package org.Resq.planning;

import lombok.Getter;
import org.Resq.planning.domain.Proposition;

/**
 * Raised when backward regression meets a subgoal it cannot justify.
 */
@Getter
public final class PlanExtractionException extends PlanningException {
    public static final String REASON_UNSUPPORTED_GOAL = "PLAN_EXTRACTION_UNSUPPORTED_GOAL";
    public static final String REASON_UNGROUNDED_GOAL = "PLAN_EXTRACTION_UNGROUNDED_GOAL";

    private final Proposition goal;
    private final int level;

    public PlanExtractionException(String reasonCode, Proposition goal, int level, String message) {
        super(reasonCode, message);
        this.goal = goal;
        this.level = level;
    }
}
