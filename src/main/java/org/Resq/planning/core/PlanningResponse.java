package org.Resq.planning.core;

import lombok.Builder;
import lombok.Value;
import org.Resq.planning.graph.LinearPlan;
import org.Resq.planning.pop.PopPlan;

/**
 * Client-facing planning response carrying both plan representations.
 */
@Value
@Builder
public class PlanningResponse {
    /** Committed action sequence. */
    LinearPlan linearPlan;
    /** First proposition layer covering the goals. */
    int goalLayer;
    /** Partial-order plan with contingency branches. */
    PopPlan popPlan;
}
