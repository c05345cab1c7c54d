package org.Resq.planning;

import lombok.Getter;

import java.util.Objects;

/**
 * Root of the planner's failures: unknown snapshot objects, goals the planning graph cannot
 * reach within its level bound, regression steps that cannot justify a goal, and linear or
 * partial-order plans that break their invariants.
 *
 * <p>The dispatch layer branches on {@link #getReasonCode()}, for example to retry with a larger
 * level bound on {@code PLAN_NOT_FOUND} or to report a stale assignment on
 * {@code OBJECT_NOT_FOUND}. The planner itself never retries.</p>
 */
@Getter
public class PlanningException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded planning failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public PlanningException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded planning failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public PlanningException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
