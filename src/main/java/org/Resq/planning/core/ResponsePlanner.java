package org.Resq.planning.core;

import lombok.Builder;
import org.Resq.planning.PlanningException;
import org.Resq.planning.domain.EmergencyDomainBuilder;
import org.Resq.planning.domain.PlanningDomain;
import org.Resq.planning.graph.GraphExpansion;
import org.Resq.planning.graph.LinearPlan;
import org.Resq.planning.graph.LinearPlanExtractor;
import org.Resq.planning.graph.PlanGraphBuilder;
import org.Resq.planning.graph.PlanSimulator;
import org.Resq.planning.pop.PartialOrderPlanner;
import org.Resq.planning.pop.PopPlan;
import org.Resq.planning.pop.PopPlanValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main planning entry point.
 *
 * <p>Execution flow per request:</p>
 * <ul>
 * <li>Validate request fields and resolve the level bound.</li>
 * <li>Build the ground domain from the snapshot (fails fast on unknown ids).</li>
 * <li>Expand the relaxed planning graph and regress a linear plan from the goal layer.</li>
 * <li>Build the partial-order plan from the same domain.</li>
 * <li>Replay/validate both plans before returning them.</li>
 * </ul>
 *
 * <p>Every request builds private data structures; one instance may serve concurrent callers.</p>
 */
public final class ResponsePlanner implements PlanningService {
    public static final String REASON_REQUEST_REQUIRED = "REQUEST_REQUIRED";
    public static final String REASON_SNAPSHOT_REQUIRED = "SNAPSHOT_REQUIRED";
    public static final String REASON_ASSIGNMENT_REQUIRED = "ASSIGNMENT_REQUIRED";
    public static final String REASON_INVALID_ASSIGNMENT = "INVALID_ASSIGNMENT";
    public static final String REASON_INVALID_CONFIG = "INVALID_CONFIG";

    private static final Logger log = LoggerFactory.getLogger(ResponsePlanner.class);

    private final PlannerConfig config;
    private final EmergencyDomainBuilder domainBuilder;
    private final PlanGraphBuilder graphBuilder;
    private final LinearPlanExtractor extractor;
    private final PartialOrderPlanner partialOrderPlanner;
    private final PlanSimulator simulator;
    private final PopPlanValidator popPlanValidator;

    /**
     * Creates a planner; every collaborator is optional and defaults to the standard implementation.
     *
     * @param config planner configuration, defaults to {@link PlannerConfig#defaults()}.
     * @throws PlanningException with {@link #REASON_INVALID_CONFIG} when the configured level bound is below 1.
     */
    @Builder
    public ResponsePlanner(
            PlannerConfig config,
            EmergencyDomainBuilder domainBuilder,
            PlanGraphBuilder graphBuilder,
            LinearPlanExtractor extractor,
            PartialOrderPlanner partialOrderPlanner
    ) {
        this.config = config == null ? PlannerConfig.defaults() : config;
        if (this.config.getMaxLevels() < 1) {
            throw new PlanningException(
                    REASON_INVALID_CONFIG,
                    "configured maxLevels must be >= 1, got " + this.config.getMaxLevels()
            );
        }
        this.domainBuilder = domainBuilder == null ? new EmergencyDomainBuilder() : domainBuilder;
        this.graphBuilder = graphBuilder == null ? new PlanGraphBuilder() : graphBuilder;
        this.extractor = extractor == null ? new LinearPlanExtractor() : extractor;
        this.partialOrderPlanner = partialOrderPlanner == null ? new PartialOrderPlanner() : partialOrderPlanner;
        this.simulator = new PlanSimulator();
        this.popPlanValidator = new PopPlanValidator();
    }

    /**
     * Creates a planner with default collaborators and {@link PlannerConfig#defaults()}.
     */
    public static ResponsePlanner withDefaults() {
        return ResponsePlanner.builder().build();
    }

    /**
     * Computes the committed linear plan.
     *
     * @throws org.Resq.planning.ObjectNotFoundException when an assigned id is missing.
     * @throws org.Resq.planning.PlanNotFoundException when the level bound is exhausted.
     */
    @Override
    public LinearPlan linearPlan(PlanningRequest request) {
        PlanningDomain domain = buildDomain(request);
        return computeLinear(domain, resolveMaxLevels(request)).plan();
    }

    /**
     * Computes the partial-order plan.
     *
     * @throws org.Resq.planning.ObjectNotFoundException when an assigned id is missing.
     */
    @Override
    public PopPlan partialOrderPlan(PlanningRequest request) {
        PlanningDomain domain = buildDomain(request);
        return computePartialOrder(domain);
    }

    @Override
    public PlanningResponse plan(PlanningRequest request) {
        PlanningDomain domain = buildDomain(request);
        LinearResult linear = computeLinear(domain, resolveMaxLevels(request));
        PopPlan popPlan = computePartialOrder(domain);
        log.info("Planned response for {}: {} steps (goal layer {}), {} POP nodes, {} branches",
                request.getAssignment().getAccidentId(),
                linear.plan().size(),
                linear.goalLayer(),
                popPlan.actions().size(),
                popPlan.branches().size());
        return PlanningResponse.builder()
                .linearPlan(linear.plan())
                .goalLayer(linear.goalLayer())
                .popPlan(popPlan)
                .build();
    }

    /**
     * Builds the domain after request validation; exposed for diagnostics and tests.
     */
    PlanningDomain buildDomain(PlanningRequest request) {
        if (request == null) {
            throw new PlanningException(REASON_REQUEST_REQUIRED, "planning request must be non-null");
        }
        if (request.getSnapshot() == null) {
            throw new PlanningException(REASON_SNAPSHOT_REQUIRED, "snapshot must be non-null");
        }
        if (request.getAssignment() == null) {
            throw new PlanningException(REASON_ASSIGNMENT_REQUIRED, "assignment must be non-null");
        }
        try {
            return domainBuilder.build(request.getSnapshot(), request.getAssignment());
        } catch (IllegalArgumentException ex) {
            throw new PlanningException(REASON_INVALID_ASSIGNMENT, ex.getMessage(), ex);
        }
    }

    private int resolveMaxLevels(PlanningRequest request) {
        return request.getMaxLevels() > 0 ? request.getMaxLevels() : config.getMaxLevels();
    }

    private LinearResult computeLinear(PlanningDomain domain, int maxLevels) {
        GraphExpansion expansion = graphBuilder.expand(domain, maxLevels);
        LinearPlan plan = extractor.extract(expansion, domain.goals());
        if (config.isValidatePlans()) {
            simulator.verify(domain.initialState(), plan, domain.goals(), PlanSimulator.Mode.RELAXED);
        }
        log.debug("Linear plan at goal layer {}: {}", expansion.goalLayer(), plan.getStepNames());
        return new LinearResult(plan, expansion.goalLayer());
    }

    private PopPlan computePartialOrder(PlanningDomain domain) {
        PopPlan plan = partialOrderPlanner.build(domain);
        if (config.isValidatePlans()) {
            popPlanValidator.validate(plan, domain.goals());
        }
        return plan;
    }

    private record LinearResult(LinearPlan plan, int goalLayer) {
    }
}
