package org.Resq.planning.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.Resq.planning.pop.PartialOrderPlanner;
import org.Resq.planning.pop.PopPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.Resq.testutil.PlanningFixtures.canonicalDomain;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("POP Plan JSON Exporter Tests")
class PopPlanJsonExporterTest {

    private final PopPlan plan = new PartialOrderPlanner().build(canonicalDomain());

    @Test
    @DisplayName("Tree mirrors the plan collections")
    void testTree() {
        ObjectNode root = new PopPlanJsonExporter().toTree(plan);

        assertEquals(plan.actions().size(), root.get("actions").size());
        assertEquals(plan.orderings().size(), root.get("orderings").size());
        assertEquals(plan.causalLinks().size(), root.get("causalLinks").size());
        assertEquals(2, root.get("branches").size());

        JsonNode start = root.get("actions").get(0);
        assertEquals("Start", start.get("id").asText());
        assertEquals("GENERIC", start.get("role").asText());
        assertEquals(0, start.get("preconditions").size());

        JsonNode reroute = root.get("branches").get(0);
        assertEquals("StartTransport", reroute.get("decisionPoint").asText());
        assertEquals("CTAvailable(H2)", reroute.get("condition").asText());
        assertEquals("RerouteH2", reroute.get("actions").get(0).asText());
    }

    @Test
    @DisplayName("JSON string parses back to the same tree")
    void testJson() throws Exception {
        PopPlanJsonExporter exporter = new PopPlanJsonExporter();
        String json = exporter.toJson(plan);

        assertTrue(json.contains("\"decisionPoint\" : \"StartTransport\""));
        assertEquals(exporter.toTree(plan), new ObjectMapper().readTree(json));
    }
}
