package org.Resq.planning.pop;

import org.Resq.planning.PlanValidationException;
import org.Resq.planning.domain.ActionRole;
import org.Resq.planning.domain.Proposition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.Resq.testutil.PlanningFixtures.p;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("POP Plan Validator Tests")
class PopPlanValidatorTest {

    private static final Proposition P = p("P");
    private static final Proposition G = p("G");

    private final PopPlanValidator validator = new PopPlanValidator();

    private static PopAction node(String id, Set<Proposition> preconditions, Set<Proposition> effects) {
        return new PopAction(id, id, ActionRole.GENERIC, preconditions, effects);
    }

    private static PopPlan.PopPlanBuilder skeleton() {
        return PopPlan.builder()
                .action(PopAction.start(Set.of(P)))
                .action(node("X", Set.of(P), Set.of(G)))
                .action(node("Y", Set.of(P), Set.of(G)))
                .action(PopAction.finish(Set.of(G)))
                .ordering(new Ordering("Start", "X"))
                .ordering(new Ordering("Start", "Y"))
                .ordering(new Ordering("X", "Finish"))
                .ordering(new Ordering("Y", "Finish"));
    }

    private static String reasonOf(PopPlan plan) {
        return assertThrows(PlanValidationException.class, () -> new PopPlanValidator().validate(plan)).getReasonCode();
    }

    @Test
    @DisplayName("Well-formed plan passes")
    void testValidPlan() {
        PopPlan plan = skeleton()
                .causalLink(new CausalLink("Start", P, "X"))
                .causalLink(new CausalLink("X", G, "Finish"))
                .branch(new ContingencyBranch("Start", p("Sunny"), List.of("X"), "go X"))
                .branch(new ContingencyBranch("Start", p("Rainy"), List.of("Y"), null))
                .build();
        assertDoesNotThrow(() -> validator.validate(plan, Set.of(G)));
        assertEquals("", plan.branches().get(1).rationale());
    }

    @Test
    @DisplayName("Cycle is reported")
    void testCycle() {
        PopPlan plan = skeleton()
                .ordering(new Ordering("X", "Y"))
                .ordering(new Ordering("Y", "X"))
                .build();
        assertEquals(PlanValidationException.REASON_ORDERING_CYCLE, reasonOf(plan));
        assertEquals(PlanValidationException.REASON_ORDERING_CYCLE,
                assertThrows(PlanValidationException.class, plan::topologicalOrder).getReasonCode());
        assertEquals(List.of("X", "Y", "Finish"), plan.orderingGraph().nodesNotSorted());
    }

    @Test
    @DisplayName("Causal link whose producer lacks the effect is rejected")
    void testLinkWithoutEffect() {
        PopPlan plan = skeleton().causalLink(new CausalLink("X", P, "Y")).ordering(new Ordering("X", "Y")).build();
        assertEquals(PlanValidationException.REASON_INVALID_CAUSAL_LINK, reasonOf(plan));
    }

    @Test
    @DisplayName("Causal link whose consumer does not need the proposition is rejected")
    void testLinkWithoutPrecondition() {
        PopPlan plan = skeleton().causalLink(new CausalLink("X", G, "Y")).ordering(new Ordering("X", "Y")).build();
        assertEquals(PlanValidationException.REASON_INVALID_CAUSAL_LINK, reasonOf(plan));
    }

    @Test
    @DisplayName("Causal link between unordered nodes is rejected")
    void testUnorderedLink() {
        PopPlan plan = PopPlan.builder()
                .action(PopAction.start(Set.of(P)))
                .action(node("X", Set.of(P), Set.of(G)))
                .action(node("Y", Set.of(G), Set.of()))
                .action(PopAction.finish(Set.of(G)))
                .causalLink(new CausalLink("X", G, "Y"))
                .build();
        assertEquals(PlanValidationException.REASON_INVALID_CAUSAL_LINK, reasonOf(plan));
    }

    @Test
    @DisplayName("Overlapping branches at one decision point are rejected")
    void testBranchOverlap() {
        PopPlan plan = skeleton()
                .branch(new ContingencyBranch("Start", p("Sunny"), List.of("X"), "a"))
                .branch(new ContingencyBranch("Start", p("Rainy"), List.of("Y", "X"), "b"))
                .build();
        assertEquals(PlanValidationException.REASON_BRANCH_OVERLAP, reasonOf(plan));
    }

    @Test
    @DisplayName("The same action may appear at different decision points")
    void testBranchesAtDifferentPoints() {
        PopPlan plan = skeleton()
                .branch(new ContingencyBranch("Start", p("Sunny"), List.of("X"), "a"))
                .branch(new ContingencyBranch("Y", p("Rainy"), List.of("X"), "b"))
                .build();
        assertDoesNotThrow(() -> validator.validate(plan));
    }

    @Test
    @DisplayName("Start and Finish contract violations are rejected")
    void testStartFinishContract() {
        assertEquals(PlanValidationException.REASON_START_FINISH_CONTRACT,
                reasonOf(skeleton().ordering(new Ordering("X", "Start")).build()));
        assertEquals(PlanValidationException.REASON_START_FINISH_CONTRACT,
                reasonOf(skeleton().ordering(new Ordering("Finish", "Y")).build()));

        PopPlan plan = skeleton().build();
        assertEquals(PlanValidationException.REASON_START_FINISH_CONTRACT, assertThrows(PlanValidationException.class,
                () -> validator.validate(plan, Set.of(G, P))).getReasonCode());
    }

    @Test
    @DisplayName("Plan construction rejects unknown node references")
    void testUnknownNodes() {
        assertEquals(PlanValidationException.REASON_UNKNOWN_ACTION, assertThrows(PlanValidationException.class,
                () -> skeleton().ordering(new Ordering("X", "Ghost")).build()).getReasonCode());
        assertEquals(PlanValidationException.REASON_UNKNOWN_ACTION, assertThrows(PlanValidationException.class,
                () -> skeleton().causalLink(new CausalLink("Ghost", P, "X")).build()).getReasonCode());
        assertEquals(PlanValidationException.REASON_UNKNOWN_ACTION, assertThrows(PlanValidationException.class,
                () -> skeleton().branch(new ContingencyBranch("X", P, List.of("Ghost"), "")).build()).getReasonCode());
        assertEquals(PlanValidationException.REASON_UNKNOWN_ACTION, assertThrows(PlanValidationException.class,
                () -> PopPlan.builder().action(PopAction.start(Set.of())).build()).getReasonCode());
        assertEquals(PlanValidationException.REASON_UNKNOWN_ACTION, assertThrows(PlanValidationException.class,
                () -> skeleton().action(node("X", Set.of(), Set.of())).build()).getReasonCode());
    }
}
