package org.Resq.planning.core;

import org.Resq.planning.graph.LinearPlan;
import org.Resq.planning.pop.PopPlan;

/**
 * Public planning contract.
 *
 * <p>Implementations validate requests deterministically and surface failures as
 * reason-coded {@link org.Resq.planning.PlanningException}s; nothing is retried.</p>
 */
public interface PlanningService {
    /**
     * Computes the committed linear plan.
     */
    LinearPlan linearPlan(PlanningRequest request);

    /**
     * Computes the partial-order plan with contingency branches.
     */
    PopPlan partialOrderPlan(PlanningRequest request);

    /**
     * Computes both representations from one domain.
     */
    PlanningResponse plan(PlanningRequest request);
}
