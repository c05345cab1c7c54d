package org.Resq.app;

import org.Resq.planning.PlanningException;
import org.Resq.planning.core.PlanningRequest;
import org.Resq.planning.core.PlanningResponse;
import org.Resq.planning.core.ResponsePlanner;
import org.Resq.planning.render.PlanFormatter;
import org.Resq.planning.render.PopPlanJsonExporter;
import org.Resq.scenario.CanonicalScenario;
import org.Resq.scenario.CtStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Smoke driver: plans the canonical scenario and prints both plans.
 *
 * <p>Flags: {@code --json} prints the partial-order plan as JSON;
 * {@code --secondary-ct-available} brings the secondary hospital's CT back online.</p>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    /**
     * Runs the driver.
     *
     * @param args command-line flags.
     */
    public static void main(String[] args) {
        List<String> flags = Arrays.asList(args);
        CtStatus secondaryCt = flags.contains("--secondary-ct-available") ? CtStatus.AVAILABLE : CtStatus.OFFLINE;

        PlanningRequest request = PlanningRequest.builder()
                .snapshot(CanonicalScenario.snapshot(secondaryCt))
                .assignment(CanonicalScenario.assignment())
                .build();

        PlanningResponse response;
        try {
            response = ResponsePlanner.withDefaults().plan(request);
        } catch (PlanningException ex) {
            log.warn("Planning failed ({}): {}", ex.getReasonCode(), ex.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("=== Strict plan for " + CanonicalScenario.TARGET_ACCIDENT_ID + " ===");
        System.out.print(PlanFormatter.formatLinearPlan(response.getLinearPlan()));
        System.out.println();
        System.out.println("=== Partial-order plan with contingent routing ===");
        if (flags.contains("--json")) {
            System.out.println(new PopPlanJsonExporter().toJson(response.getPopPlan()));
        } else {
            System.out.print(PlanFormatter.formatPopPlan(response.getPopPlan()));
        }
    }
}
