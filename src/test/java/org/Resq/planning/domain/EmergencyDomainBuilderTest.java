package org.Resq.planning.domain;

import org.Resq.planning.ObjectNotFoundException;
import org.Resq.scenario.Accident;
import org.Resq.scenario.Ambulance;
import org.Resq.scenario.CanonicalScenario;
import org.Resq.scenario.CtStatus;
import org.Resq.scenario.FieldConditions;
import org.Resq.scenario.Hospital;
import org.Resq.scenario.RiskLevel;
import org.Resq.scenario.ScenarioSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.Resq.testutil.PlanningFixtures.DELIVER_H1;
import static org.Resq.testutil.PlanningFixtures.DRONE_RECON;
import static org.Resq.testutil.PlanningFixtures.NOTIFY_H1;
import static org.Resq.testutil.PlanningFixtures.PRE_DEPLOY;
import static org.Resq.testutil.PlanningFixtures.REQUEST_DIVERSION;
import static org.Resq.testutil.PlanningFixtures.REROUTE_H2;
import static org.Resq.testutil.PlanningFixtures.START_TRANSPORT;
import static org.Resq.testutil.PlanningFixtures.p;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Emergency Domain Builder Tests")
class EmergencyDomainBuilderTest {

    private final EmergencyDomainBuilder builder = new EmergencyDomainBuilder();

    @Nested
    @DisplayName("Canonical scenario")
    class Canonical {
        private final PlanningDomain domain = builder.build(CanonicalScenario.snapshot(), CanonicalScenario.assignment());

        @Test
        @DisplayName("Every snapshot object contributes its facts to the initial state")
        void testInitialStateIsTotal() {
            Set<Proposition> init = domain.initialState();

            assertTrue(init.contains(p("Hospital", "H1")));
            assertTrue(init.contains(p("Hospital", "H2")));
            assertTrue(init.contains(p("TraumaCenter", "H1")));
            assertFalse(init.contains(p("TraumaCenter", "H2")));
            assertTrue(init.contains(p("CTAvailable", "H1")));
            assertTrue(init.contains(p("CTOffline", "H2")));
            assertFalse(init.contains(p("CTAvailable", "H2")));

            assertTrue(init.contains(p("AmbulanceFree", "A1")));
            assertTrue(init.contains(p("AmbulanceAt", "A1", "hospital_h1")));
            assertTrue(init.contains(p("AmbulanceFree", "A2")));
            assertTrue(init.contains(p("AmbulanceAt", "A2", "hospital_h2")));

            for (String accident : List.of("ACC1", "ACC2", "ACC3")) {
                assertTrue(init.contains(p("AccidentReported", accident)), accident);
                assertTrue(init.contains(p("AccidentNotServed", accident)), accident);
            }
            assertTrue(init.contains(p("AccidentHighRisk", "ACC3")));
            assertTrue(init.contains(p("AccidentMediumRisk", "ACC1")));
            assertTrue(init.contains(p("AccidentLowRisk", "ACC2")));

            assertTrue(init.contains(p("RainyConditions")));
            assertTrue(init.contains(p("StadiumTrafficLikely")));
            assertTrue(init.contains(p("ControlRoomOperational")));
        }

        @Test
        @DisplayName("Catalog order and roles are fixed")
        void testCatalog() {
            List<String> names = domain.actions().stream().map(GroundAction::getName).toList();
            assertEquals(List.of(DRONE_RECON, REQUEST_DIVERSION, PRE_DEPLOY, NOTIFY_H1, START_TRANSPORT, DELIVER_H1, REROUTE_H2), names);

            assertEquals(ActionRole.TRANSPORT_START, domain.action(START_TRANSPORT).orElseThrow().getRole());
            assertEquals(1, domain.actionsWithRole(ActionRole.DELIVERY).size());
            assertEquals(1, domain.actionsWithRole(ActionRole.CONTINGENCY_DELIVERY).size());
        }

        @Test
        @DisplayName("Goals are AccidentServed and PatientAt the primary hospital")
        void testGoals() {
            assertEquals(Set.of(p("AccidentServed", "ACC3"), p("PatientAt", "ACC3", "H1")), domain.goals());
        }

        @Test
        @DisplayName("Transport consumes the staging position, confirmation and diversion")
        void testTransportPreconditions() {
            GroundAction transport = domain.action(START_TRANSPORT).orElseThrow();
            assertEquals(Set.of(
                    p("AmbulanceFree", "A1"),
                    p("AmbulanceAt", "A1", "nayapalli_chowk"),
                    p("AccidentLocationConfirmed", "ACC3"),
                    p("TrafficDiverted", "stadium_corridor")
            ), transport.getPreconditions());
            assertTrue(transport.getDelEffects().contains(p("AmbulanceFree", "A1")));
        }
    }

    @Nested
    @DisplayName("Missing objects")
    class MissingObjects {

        @Test
        @DisplayName("Unknown accident raises NotFound and returns no domain")
        void testUnknownAccident() {
            ResponseAssignment assignment = CanonicalScenario.assignment().toBuilder().accidentId("ACC9").build();
            ObjectNotFoundException ex = assertThrows(ObjectNotFoundException.class,
                    () -> builder.build(CanonicalScenario.snapshot(), assignment));
            assertEquals("ACC9", ex.getObjectId());
            assertEquals(ScenarioSnapshot.KIND_ACCIDENT, ex.getObjectKind());
        }

        @Test
        @DisplayName("Unknown ambulance raises NotFound")
        void testUnknownAmbulance() {
            ResponseAssignment assignment = CanonicalScenario.assignment().toBuilder().ambulanceId("A7").build();
            assertEquals("A7", assertThrows(ObjectNotFoundException.class,
                    () -> builder.build(CanonicalScenario.snapshot(), assignment)).getObjectId());
        }

        @Test
        @DisplayName("Unknown alternate hospital raises NotFound")
        void testUnknownHospital() {
            ResponseAssignment assignment = CanonicalScenario.assignment().toBuilder().alternateHospitalId("H5").build();
            assertEquals(ScenarioSnapshot.KIND_HOSPITAL, assertThrows(ObjectNotFoundException.class,
                    () -> builder.build(CanonicalScenario.snapshot(), assignment)).getObjectKind());
        }
    }

    @Test
    @DisplayName("Validation: primary and alternate hospitals must differ")
    void testSameHospitalsRejected() {
        ResponseAssignment assignment = CanonicalScenario.assignment().toBuilder().alternateHospitalId("H1").build();
        assertThrows(IllegalArgumentException.class, () -> builder.build(CanonicalScenario.snapshot(), assignment));
    }

    @Test
    @DisplayName("Validation: staging node must be non-blank")
    void testBlankStagingRejected() {
        ResponseAssignment assignment = CanonicalScenario.assignment().toBuilder().stagingNode(" ").build();
        assertThrows(IllegalArgumentException.class, () -> builder.build(CanonicalScenario.snapshot(), assignment));
    }

    @Test
    @DisplayName("Without expected stadium traffic no diversion is planned or required")
    void testNoDiversionWithoutTraffic() {
        ScenarioSnapshot snapshot = snapshot(FieldConditions.builder().rainy(false).stadiumTrafficLikely(false).build(), true);
        PlanningDomain domain = builder.build(snapshot, CanonicalScenario.assignment());

        assertTrue(domain.action(REQUEST_DIVERSION).isEmpty());
        assertFalse(domain.action(START_TRANSPORT).orElseThrow().getPreconditions()
                .contains(p("TrafficDiverted", "stadium_corridor")));
        assertFalse(domain.initialState().contains(p("StadiumTrafficLikely")));
        assertFalse(domain.initialState().contains(p("RainyConditions")));
    }

    @Test
    @DisplayName("Unavailable ambulance is asserted busy")
    void testBusyAmbulance() {
        PlanningDomain domain = builder.build(snapshot(CanonicalScenario.conditions(), false), CanonicalScenario.assignment());
        assertTrue(domain.initialState().contains(p("AmbulanceBusy", "A1")));
        assertFalse(domain.initialState().contains(p("AmbulanceFree", "A1")));
    }

    @Test
    @DisplayName("Alternate CT available maps to CTAvailable")
    void testAlternateCtAvailable() {
        PlanningDomain domain = builder.build(CanonicalScenario.snapshot(CtStatus.AVAILABLE), CanonicalScenario.assignment());
        assertTrue(domain.initialState().contains(p("CTAvailable", "H2")));
        assertFalse(domain.initialState().contains(p("CTOffline", "H2")));
    }

    private static ScenarioSnapshot snapshot(FieldConditions conditions, boolean ambulanceAvailable) {
        return new ScenarioSnapshot(
                List.of(
                        Hospital.builder().id("H1").node("hospital_h1").traumaCenter(true).build(),
                        Hospital.builder().id("H2").node("hospital_h2").ctStatus(CtStatus.OFFLINE).build()
                ),
                List.of(Ambulance.builder().id("A1").currentNode("hospital_h1").available(ambulanceAvailable).build()),
                List.of(Accident.builder().id("ACC3").locationNode("airport_approach").riskLevel(RiskLevel.HIGH).build()),
                conditions
        );
    }
}
