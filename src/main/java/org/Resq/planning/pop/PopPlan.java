package org.Resq.planning.pop;

import lombok.Builder;
import lombok.Singular;
import org.Resq.planning.PlanValidationException;
import org.Resq.planning.domain.Proposition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable partial-order plan with causal links and contingency branches.
 *
 * <p>Construction enforces referential integrity: both synthetic nodes exist and every
 * ordering, causal link and branch names a known node. Semantic invariants (acyclicity,
 * causal support, branch exclusivity) are checked by {@link PopPlanValidator}.</p>
 *
 * <p>Concurrency contract for executors: nodes with no ordering path between them may run
 * concurrently unless they are alternatives at the same decision point; alternatives are
 * never both executed.</p>
 */
public final class PopPlan {
    private final Map<String, PopAction> actions;
    private final Set<Ordering> orderings;
    private final List<CausalLink> causalLinks;
    private final List<ContingencyBranch> branches;
    private final OrderingGraph orderingGraph;

    /**
     * Creates a plan.
     *
     * @throws PlanValidationException when a referenced node id is unknown or a synthetic node is missing.
     */
    @Builder
    private PopPlan(
            @Singular List<PopAction> actions,
            @Singular Set<Ordering> orderings,
            @Singular List<CausalLink> causalLinks,
            @Singular("branch") List<ContingencyBranch> branches
    ) {
        LinkedHashMap<String, PopAction> byId = new LinkedHashMap<>();
        for (PopAction action : actions) {
            if (byId.putIfAbsent(action.id(), action) != null) {
                throw new PlanValidationException(
                        PlanValidationException.REASON_UNKNOWN_ACTION,
                        "duplicate plan node id: " + action.id()
                );
            }
        }
        requireNode(byId, PopAction.START_ID, "plan");
        requireNode(byId, PopAction.FINISH_ID, "plan");
        for (Ordering ordering : orderings) {
            requireNode(byId, ordering.before(), "ordering " + ordering);
            requireNode(byId, ordering.after(), "ordering " + ordering);
        }
        for (CausalLink link : causalLinks) {
            requireNode(byId, link.producer(), "causal link " + link);
            requireNode(byId, link.consumer(), "causal link " + link);
        }
        for (ContingencyBranch branch : branches) {
            requireNode(byId, branch.decisionPoint(), "branch on " + branch.condition());
            for (String actionId : branch.actionIds()) {
                requireNode(byId, actionId, "branch on " + branch.condition());
            }
        }

        this.actions = Collections.unmodifiableMap(byId);
        this.orderings = Collections.unmodifiableSet(new LinkedHashSet<>(orderings));
        this.causalLinks = List.copyOf(causalLinks);
        this.branches = List.copyOf(branches);
        this.orderingGraph = OrderingGraph.of(byId.keySet(), this.orderings);
    }

    /**
     * Returns all nodes, including {@code Start} and {@code Finish}, in insertion order.
     */
    public Map<String, PopAction> actions() {
        return actions;
    }

    /**
     * Returns the node with the given id, or null when absent.
     */
    public PopAction action(String id) {
        return actions.get(id);
    }

    public PopAction start() {
        return actions.get(PopAction.START_ID);
    }

    public PopAction finish() {
        return actions.get(PopAction.FINISH_ID);
    }

    public Set<Ordering> orderings() {
        return orderings;
    }

    public List<CausalLink> causalLinks() {
        return causalLinks;
    }

    public List<ContingencyBranch> branches() {
        return branches;
    }

    /**
     * Returns branches evaluated at the given decision point, in declaration order.
     */
    public List<ContingencyBranch> branchesAt(String decisionPoint) {
        return branches.stream().filter(branch -> branch.decisionPoint().equals(decisionPoint)).toList();
    }

    /**
     * Returns whether an ordering path (direct or transitive) leads from {@code before} to {@code after}.
     */
    public boolean isOrderedBefore(String before, String after) {
        return orderingGraph.reaches(before, after);
    }

    /**
     * Returns whether two distinct nodes are alternatives of the same decision point.
     */
    public boolean areMutuallyExclusive(String first, String second) {
        if (first.equals(second)) {
            return false;
        }
        for (ContingencyBranch a : branches) {
            if (!a.actionIds().contains(first)) {
                continue;
            }
            for (ContingencyBranch b : branches) {
                if (a != b && b.decisionPoint().equals(a.decisionPoint()) && b.actionIds().contains(second)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns whether an executor may dispatch both nodes concurrently.
     */
    public boolean mayRunConcurrently(String first, String second) {
        if (first.equals(second) || !actions.containsKey(first) || !actions.containsKey(second)) {
            return false;
        }
        return !isOrderedBefore(first, second)
                && !isOrderedBefore(second, first)
                && !areMutuallyExclusive(first, second);
    }

    /**
     * Returns preconditions of {@code id} that no causal link supplies.
     */
    public Set<Proposition> openPreconditions(String id) {
        PopAction action = actions.get(id);
        if (action == null) {
            return Set.of();
        }
        LinkedHashSet<Proposition> open = new LinkedHashSet<>(action.preconditions());
        for (CausalLink link : causalLinks) {
            if (link.consumer().equals(id)) {
                open.remove(link.proposition());
            }
        }
        return Collections.unmodifiableSet(open);
    }

    /**
     * Returns node ids in an order consistent with all orderings.
     *
     * @throws PlanValidationException when the orderings contain a cycle.
     */
    public List<String> topologicalOrder() {
        return orderingGraph.topologicalOrder().orElseThrow(() -> new PlanValidationException(
                PlanValidationException.REASON_ORDERING_CYCLE,
                "orderings contain a cycle through " + orderingGraph.nodesNotSorted()
        ));
    }

    OrderingGraph orderingGraph() {
        return orderingGraph;
    }

    private static void requireNode(Map<String, PopAction> byId, String id, String context) {
        if (!byId.containsKey(id)) {
            throw new PlanValidationException(
                    PlanValidationException.REASON_UNKNOWN_ACTION,
                    context + " references unknown node " + id
            );
        }
    }
}
