package org.Resq.planning;

/**
 * Raised when a constructed plan violates one of its structural invariants.
 */
public final class PlanValidationException extends PlanningException {
    public static final String REASON_PRECONDITION_UNSATISFIED = "PLAN_PRECONDITION_UNSATISFIED";
    public static final String REASON_GOAL_NOT_ACHIEVED = "PLAN_GOAL_NOT_ACHIEVED";
    public static final String REASON_DUPLICATE_ACTION = "PLAN_DUPLICATE_ACTION";
    public static final String REASON_UNKNOWN_ACTION = "POP_UNKNOWN_ACTION";
    public static final String REASON_ORDERING_CYCLE = "POP_ORDERING_CYCLE";
    public static final String REASON_INVALID_CAUSAL_LINK = "POP_INVALID_CAUSAL_LINK";
    public static final String REASON_START_FINISH_CONTRACT = "POP_START_FINISH_CONTRACT";
    public static final String REASON_BRANCH_OVERLAP = "POP_BRANCH_OVERLAP";

    public PlanValidationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
