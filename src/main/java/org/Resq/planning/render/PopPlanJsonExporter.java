package org.Resq.planning.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.Resq.planning.PlanningException;
import org.Resq.planning.domain.Proposition;
import org.Resq.planning.pop.CausalLink;
import org.Resq.planning.pop.ContingencyBranch;
import org.Resq.planning.pop.Ordering;
import org.Resq.planning.pop.PopAction;
import org.Resq.planning.pop.PopPlan;

import java.util.Collection;

/**
 * Serializes a {@link PopPlan} to JSON.
 *
 * <p>The document has four top-level arrays, {@code actions}, {@code orderings},
 * {@code causalLinks} and {@code branches}, mirroring the plan collections in order.
 * Propositions are written as canonical keys.</p>
 */
public final class PopPlanJsonExporter {
    public static final String REASON_EXPORT_FAILED = "POP_EXPORT_FAILED";

    private final ObjectMapper mapper;

    public PopPlanJsonExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public PopPlanJsonExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Builds the JSON tree for a plan.
     */
    public ObjectNode toTree(PopPlan plan) {
        ObjectNode root = mapper.createObjectNode();

        ArrayNode actions = root.putArray("actions");
        for (PopAction action : plan.actions().values()) {
            ObjectNode node = actions.addObject();
            node.put("id", action.id());
            node.put("name", action.name());
            node.put("role", action.role().name());
            writeKeys(node.putArray("preconditions"), action.preconditions());
            writeKeys(node.putArray("effects"), action.effects());
        }

        ArrayNode orderings = root.putArray("orderings");
        for (Ordering ordering : plan.orderings()) {
            orderings.addObject()
                    .put("before", ordering.before())
                    .put("after", ordering.after());
        }

        ArrayNode links = root.putArray("causalLinks");
        for (CausalLink link : plan.causalLinks()) {
            links.addObject()
                    .put("producer", link.producer())
                    .put("proposition", link.proposition().key())
                    .put("consumer", link.consumer());
        }

        ArrayNode branches = root.putArray("branches");
        for (ContingencyBranch branch : plan.branches()) {
            ObjectNode node = branches.addObject();
            node.put("decisionPoint", branch.decisionPoint());
            node.put("condition", branch.condition().key());
            ArrayNode ids = node.putArray("actions");
            branch.actionIds().forEach(ids::add);
            node.put("rationale", branch.rationale());
        }
        return root;
    }

    /**
     * Serializes the plan to a JSON string.
     *
     * @throws PlanningException when serialization fails.
     */
    public String toJson(PopPlan plan) {
        try {
            return mapper.writeValueAsString(toTree(plan));
        } catch (JsonProcessingException ex) {
            throw new PlanningException(REASON_EXPORT_FAILED, "failed to serialize plan: " + ex.getOriginalMessage(), ex);
        }
    }

    private static void writeKeys(ArrayNode target, Collection<Proposition> propositions) {
        for (Proposition proposition : propositions) {
            target.add(proposition.key());
        }
    }
}
