package org.Resq.planning.pop;

import org.Resq.planning.domain.ActionRole;
import org.Resq.planning.domain.GroundAction;
import org.Resq.planning.domain.PlanningDomain;
import org.Resq.planning.domain.Proposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Builds a partial-order plan with contingent delivery branches from a response domain.
 *
 * <p>Ordering scheme:</p>
 * <ul>
 * <li>{@code Start} precedes every other node.</li>
 * <li>Each preparatory action (reconnaissance, diversion, pre-positioning) precedes transport start.</li>
 * <li>Each notification precedes each baseline delivery.</li>
 * <li>Transport start precedes each delivery alternative.</li>
 * <li>Each delivery alternative precedes {@code Finish}.</li>
 * </ul>
 *
 * <p>Preparatory actions stay mutually unordered, as do the delivery alternatives.
 * Causal links are derived from the orderings: for every precondition of a node, each
 * node ordered before it that produces the proposition becomes a producer. Every
 * contingency delivery gets a branch keyed by its runtime condition, the precondition no
 * earlier non-start node supplies; the baseline deliveries get the branch keyed by
 * the negation of the first contingency condition.</p>
 */
public final class PartialOrderPlanner {
    private static final Logger log = LoggerFactory.getLogger(PartialOrderPlanner.class);

    /**
     * Builds the plan.
     *
     * @param domain response domain whose catalog carries action roles.
     * @return partial-order plan rooted at the transport decision point.
     * @throws IllegalArgumentException when the catalog lacks exactly one transport start,
     *                                  a baseline delivery or a contingency delivery.
     */
    public PopPlan build(PlanningDomain domain) {
        Objects.requireNonNull(domain, "domain");

        List<GroundAction> transports = domain.actionsWithRole(ActionRole.TRANSPORT_START);
        if (transports.size() != 1) {
            throw new IllegalArgumentException("domain must define exactly one transport-start action, found " + transports.size());
        }
        if (domain.actionsWithRole(ActionRole.DELIVERY).isEmpty()) {
            throw new IllegalArgumentException("domain must define a baseline delivery action");
        }
        if (domain.actionsWithRole(ActionRole.CONTINGENCY_DELIVERY).isEmpty()) {
            throw new IllegalArgumentException("domain must define a contingency delivery action");
        }

        PopAction start = PopAction.start(domain.initialState());
        PopAction finish = PopAction.finish(domain.goals());

        LinkedHashMap<String, PopAction> nodes = new LinkedHashMap<>();
        nodes.put(start.id(), start);
        for (GroundAction action : domain.actions()) {
            if (action.getRole() == ActionRole.GENERIC) {
                continue;
            }
            PopAction node = PopAction.wrap(action, action.getRole().nodeId(action.getArguments()));
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("plan node id collision: " + node.id());
            }
        }
        nodes.put(finish.id(), finish);

        PopAction transport = nodes.get(transports.get(0).getRole().nodeId(transports.get(0).getArguments()));
        List<PopAction> preparatory = withRole(nodes, ActionRole::isPreparatory);
        List<PopAction> notifications = withRole(nodes, role -> role == ActionRole.NOTIFICATION);
        List<PopAction> deliveries = withRole(nodes, role -> role == ActionRole.DELIVERY);
        List<PopAction> contingencies = withRole(nodes, role -> role == ActionRole.CONTINGENCY_DELIVERY);
        List<PopAction> alternatives = withRole(nodes, ActionRole::isDeliveryAlternative);

        LinkedHashSet<Ordering> orderings = new LinkedHashSet<>();
        for (String id : nodes.keySet()) {
            if (!id.equals(start.id())) {
                orderings.add(new Ordering(start.id(), id));
            }
        }
        for (PopAction action : preparatory) {
            orderings.add(new Ordering(action.id(), transport.id()));
        }
        for (PopAction notification : notifications) {
            for (PopAction delivery : deliveries) {
                orderings.add(new Ordering(notification.id(), delivery.id()));
            }
        }
        for (PopAction alternative : alternatives) {
            orderings.add(new Ordering(transport.id(), alternative.id()));
        }
        for (PopAction alternative : alternatives) {
            orderings.add(new Ordering(alternative.id(), finish.id()));
        }

        OrderingGraph graph = OrderingGraph.of(nodes.keySet(), orderings);
        List<CausalLink> causalLinks = causalLinks(nodes, graph);
        List<ContingencyBranch> branches = branches(nodes, graph, transport, deliveries, contingencies);

        PopPlan plan = PopPlan.builder()
                .actions(nodes.values())
                .orderings(orderings)
                .causalLinks(causalLinks)
                .branches(branches)
                .build();
        log.debug("Built partial-order plan: {} nodes, {} orderings, {} causal links, {} branches",
                nodes.size(), orderings.size(), causalLinks.size(), branches.size());
        return plan;
    }

    private static List<CausalLink> causalLinks(Map<String, PopAction> nodes, OrderingGraph graph) {
        List<CausalLink> links = new ArrayList<>();
        for (PopAction consumer : nodes.values()) {
            for (Proposition precondition : consumer.preconditions()) {
                for (PopAction producer : nodes.values()) {
                    if (producer != consumer
                            && producer.effects().contains(precondition)
                            && graph.reaches(producer.id(), consumer.id())) {
                        links.add(new CausalLink(producer.id(), precondition, consumer.id()));
                    }
                }
            }
        }
        return links;
    }

    private static List<ContingencyBranch> branches(
            Map<String, PopAction> nodes,
            OrderingGraph graph,
            PopAction transport,
            List<PopAction> deliveries,
            List<PopAction> contingencies
    ) {
        List<ContingencyBranch> branches = new ArrayList<>();
        Proposition firstCondition = null;
        for (PopAction contingency : contingencies) {
            Proposition condition = runtimeCondition(nodes, graph, contingency);
            if (firstCondition == null) {
                firstCondition = condition;
            }
            branches.add(new ContingencyBranch(
                    transport.id(),
                    condition,
                    List.of(contingency.id()),
                    "If " + condition + " is observed once " + transport.name()
                            + " is under way, switch to " + contingency.name() + "."
            ));
        }

        Proposition baseline = firstCondition.negation();
        List<String> deliveryIds = deliveries.stream().map(PopAction::id).toList();
        List<String> deliveryNames = deliveries.stream().map(PopAction::name).toList();
        branches.add(new ContingencyBranch(
                transport.id(),
                baseline,
                deliveryIds,
                "If " + baseline + " persists, continue with the baseline plan: " + String.join(", ", deliveryNames) + "."
        ));
        return branches;
    }

    /**
     * Returns the first precondition of {@code contingency} not produced by any non-start
     * node ordered before it.
     */
    private static Proposition runtimeCondition(Map<String, PopAction> nodes, OrderingGraph graph, PopAction contingency) {
        for (Proposition precondition : contingency.preconditions()) {
            boolean suppliedByPlan = false;
            for (PopAction producer : nodes.values()) {
                if (producer.id().equals(PopAction.START_ID) || producer == contingency) {
                    continue;
                }
                if (producer.effects().contains(precondition) && graph.reaches(producer.id(), contingency.id())) {
                    suppliedByPlan = true;
                    break;
                }
            }
            if (!suppliedByPlan) {
                return precondition;
            }
        }
        throw new IllegalArgumentException("contingency " + contingency.id() + " has no runtime-observable precondition");
    }

    private static List<PopAction> withRole(Map<String, PopAction> nodes, Predicate<ActionRole> filter) {
        List<PopAction> selected = new ArrayList<>();
        for (PopAction node : nodes.values()) {
            if (!node.isSynthetic() && filter.test(node.role())) {
                selected.add(node);
            }
        }
        return selected;
    }
}
