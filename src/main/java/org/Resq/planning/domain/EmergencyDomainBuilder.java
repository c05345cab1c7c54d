package org.Resq.planning.domain;

import org.Resq.planning.ObjectNotFoundException;
import org.Resq.scenario.Accident;
import org.Resq.scenario.Ambulance;
import org.Resq.scenario.CtStatus;
import org.Resq.scenario.FieldConditions;
import org.Resq.scenario.Hospital;
import org.Resq.scenario.ScenarioSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Translates a scenario snapshot into a ground STRIPS domain for one accident.
 *
 * <p>Construction is two-phase. All referenced ids are resolved first, so a missing
 * object raises {@link ObjectNotFoundException} before any proposition or action exists.
 * The fact mapping is then total over the snapshot: every hospital, ambulance and
 * accident contributes its facts to the initial state, not only the assigned ones.</p>
 *
 * <p>The action catalog, in tie-breaking order:</p>
 * <ol>
 * <li>{@code TriggerDroneRecon(acc)}: confirms the accident location.</li>
 * <li>{@code RequestTrafficDiversion(corridor)}: only when stadium traffic is likely;
 * transport then depends on the diversion.</li>
 * <li>{@code PreDeployAmbulanceNearHotspot(amb, staging)}</li>
 * <li>{@code NotifyHospital(primary)}: requires a high-risk accident.</li>
 * <li>{@code StartTransportToAccident(amb, acc)}</li>
 * <li>{@code DeliverPatientToPrimary(amb, acc, primary)}</li>
 * <li>{@code RerouteMidJourneyToAlternate(amb, acc, alternate)}: needs CT at the alternate.</li>
 * </ol>
 */
public final class EmergencyDomainBuilder {
    private static final Logger log = LoggerFactory.getLogger(EmergencyDomainBuilder.class);

    /**
     * Builds the response domain for {@code assignment}.
     *
     * @param snapshot world snapshot.
     * @param assignment accident, ambulance, hospitals and staging objects to plan for.
     * @return immutable planning domain.
     * @throws ObjectNotFoundException when any assigned id is absent from the snapshot.
     * @throws IllegalArgumentException when staging/corridor names are blank or both hospitals coincide.
     */
    public PlanningDomain build(ScenarioSnapshot snapshot, ResponseAssignment assignment) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(assignment, "assignment");

        Accident accident = snapshot.accident(assignment.getAccidentId());
        Ambulance ambulance = snapshot.ambulance(assignment.getAmbulanceId());
        Hospital primary = snapshot.hospital(assignment.getPrimaryHospitalId());
        Hospital alternate = snapshot.hospital(assignment.getAlternateHospitalId());
        String stagingNode = requireName(assignment.getStagingNode(), "stagingNode");
        String corridor = requireName(assignment.getDiversionCorridor(), "diversionCorridor");
        if (primary.getId().equals(alternate.getId())) {
            throw new IllegalArgumentException("primary and alternate hospital must differ: " + primary.getId());
        }

        Set<Proposition> initialState = initialState(snapshot);
        List<GroundAction> actions = catalog(snapshot.conditions(), accident, ambulance, primary, alternate, stagingNode, corridor);
        Set<Proposition> goals = new LinkedHashSet<>();
        goals.add(Proposition.of(Predicates.ACCIDENT_SERVED, accident.getId()));
        goals.add(Proposition.of(Predicates.PATIENT_AT, accident.getId(), primary.getId()));

        log.debug("Built domain for {}: {} facts, {} actions, goals {}",
                accident.getId(), initialState.size(), actions.size(), goals);
        return new PlanningDomain(initialState, actions, goals);
    }

    /**
     * Maps every snapshot object to its initial-state facts.
     */
    Set<Proposition> initialState(ScenarioSnapshot snapshot) {
        LinkedHashSet<Proposition> state = new LinkedHashSet<>();

        for (Ambulance ambulance : snapshot.ambulances()) {
            String id = ambulance.getId();
            state.add(Proposition.of(ambulance.isAvailable() ? Predicates.AMBULANCE_FREE : Predicates.AMBULANCE_BUSY, id));
            state.add(Proposition.of(Predicates.AMBULANCE_AT, id, ambulance.getCurrentNode()));
        }

        for (Accident accident : snapshot.accidents()) {
            String id = accident.getId();
            state.add(Proposition.of(Predicates.ACCIDENT_REPORTED, id));
            state.add(Proposition.of(Predicates.ACCIDENT_AT, id, accident.getLocationNode()));
            state.add(Proposition.of(riskPredicate(accident), id));
            state.add(Proposition.of(accident.isServed() ? Predicates.ACCIDENT_SERVED : Predicates.ACCIDENT_NOT_SERVED, id));
        }

        for (Hospital hospital : snapshot.hospitals()) {
            String id = hospital.getId();
            state.add(Proposition.of(Predicates.HOSPITAL, id));
            if (hospital.isTraumaCenter()) {
                state.add(Proposition.of(Predicates.TRAUMA_CENTER, id));
            }
            state.add(Proposition.of(
                    hospital.getCtStatus() == CtStatus.OFFLINE ? Predicates.CT_OFFLINE : Predicates.CT_AVAILABLE,
                    id
            ));
        }

        FieldConditions conditions = snapshot.conditions();
        if (conditions.isRainy()) {
            state.add(Proposition.of(Predicates.RAINY_CONDITIONS));
        }
        if (conditions.isStadiumTrafficLikely()) {
            state.add(Proposition.of(Predicates.STADIUM_TRAFFIC_LIKELY));
        }
        if (conditions.isControlRoomOperational()) {
            state.add(Proposition.of(Predicates.CONTROL_ROOM_OPERATIONAL));
        }
        return state;
    }

    private List<GroundAction> catalog(
            FieldConditions conditions,
            Accident accident,
            Ambulance ambulance,
            Hospital primary,
            Hospital alternate,
            String stagingNode,
            String corridor
    ) {
        String acc = accident.getId();
        String amb = ambulance.getId();
        Proposition controlRoom = Proposition.of(Predicates.CONTROL_ROOM_OPERATIONAL);
        Proposition ambulanceFree = Proposition.of(Predicates.AMBULANCE_FREE, amb);
        Proposition ambulanceBusy = Proposition.of(Predicates.AMBULANCE_BUSY, amb);
        Proposition atStaging = Proposition.of(Predicates.AMBULANCE_AT, amb, stagingNode);
        Proposition locationConfirmed = Proposition.of(Predicates.ACCIDENT_LOCATION_CONFIRMED, acc);
        Proposition enRoute = Proposition.of(Predicates.AMBULANCE_EN_ROUTE, amb, acc);
        Proposition served = Proposition.of(Predicates.ACCIDENT_SERVED, acc);
        Proposition notServed = Proposition.of(Predicates.ACCIDENT_NOT_SERVED, acc);
        Proposition primaryNotified = Proposition.of(Predicates.HOSPITAL_NOTIFIED, primary.getId());
        Proposition diverted = Proposition.of(Predicates.TRAFFIC_DIVERTED, corridor);
        boolean divertTraffic = conditions.isStadiumTrafficLikely();

        List<GroundAction> actions = new ArrayList<>();

        actions.add(GroundAction.builder()
                .operator("TriggerDroneRecon")
                .argument(acc)
                .role(ActionRole.RECONNAISSANCE)
                .precondition(controlRoom)
                .precondition(Proposition.of(Predicates.ACCIDENT_REPORTED, acc))
                .addEffect(Proposition.of(Predicates.DRONE_RECON_DONE, acc))
                .addEffect(locationConfirmed)
                .build());

        if (divertTraffic) {
            actions.add(GroundAction.builder()
                    .operator("RequestTrafficDiversion")
                    .argument(corridor)
                    .role(ActionRole.TRAFFIC_DIVERSION)
                    .precondition(controlRoom)
                    .precondition(Proposition.of(Predicates.STADIUM_TRAFFIC_LIKELY))
                    .addEffect(diverted)
                    .build());
        }

        Proposition atCurrentNode = Proposition.of(Predicates.AMBULANCE_AT, amb, ambulance.getCurrentNode());
        GroundAction.GroundActionBuilder preDeploy = GroundAction.builder()
                .operator("PreDeployAmbulanceNearHotspot")
                .argument(amb)
                .argument(stagingNode)
                .role(ActionRole.PRE_POSITIONING)
                .precondition(ambulanceFree)
                .precondition(atCurrentNode)
                .addEffect(atStaging)
                .addEffect(Proposition.of(Predicates.AMBULANCE_PREDEPLOYED, amb));
        if (!atCurrentNode.equals(atStaging)) {
            preDeploy.delEffect(atCurrentNode);
        }
        actions.add(preDeploy.build());

        actions.add(GroundAction.builder()
                .operator("NotifyHospital")
                .argument(primary.getId())
                .role(ActionRole.NOTIFICATION)
                .precondition(controlRoom)
                .precondition(Proposition.of(Predicates.ACCIDENT_HIGH_RISK, acc))
                .precondition(Proposition.of(Predicates.HOSPITAL, primary.getId()))
                .addEffect(primaryNotified)
                .build());

        GroundAction.GroundActionBuilder startTransport = GroundAction.builder()
                .operator("StartTransportToAccident")
                .argument(amb)
                .argument(acc)
                .role(ActionRole.TRANSPORT_START)
                .precondition(ambulanceFree)
                .precondition(atStaging)
                .precondition(locationConfirmed);
        if (divertTraffic) {
            startTransport.precondition(diverted);
        }
        actions.add(startTransport
                .addEffect(enRoute)
                .addEffect(ambulanceBusy)
                .delEffect(ambulanceFree)
                .build());

        actions.add(GroundAction.builder()
                .operator("DeliverPatientToPrimary")
                .argument(amb)
                .argument(acc)
                .argument(primary.getId())
                .role(ActionRole.DELIVERY)
                .precondition(enRoute)
                .precondition(primaryNotified)
                .addEffect(Proposition.of(Predicates.PATIENT_AT, acc, primary.getId()))
                .addEffect(served)
                .addEffect(ambulanceFree)
                .addEffect(Proposition.of(Predicates.AMBULANCE_AT, amb, primary.getNode()))
                .delEffect(notServed)
                .delEffect(enRoute)
                .delEffect(ambulanceBusy)
                .delEffect(atStaging)
                .build());

        actions.add(GroundAction.builder()
                .operator("RerouteMidJourneyToAlternate")
                .argument(amb)
                .argument(acc)
                .argument(alternate.getId())
                .role(ActionRole.CONTINGENCY_DELIVERY)
                .precondition(enRoute)
                .precondition(Proposition.of(Predicates.CT_AVAILABLE, alternate.getId()))
                .addEffect(Proposition.of(Predicates.PATIENT_AT, acc, alternate.getId()))
                .addEffect(served)
                .addEffect(ambulanceFree)
                .addEffect(Proposition.of(Predicates.AMBULANCE_AT, amb, alternate.getNode()))
                .delEffect(notServed)
                .delEffect(enRoute)
                .delEffect(ambulanceBusy)
                .delEffect(atStaging)
                .build());

        return actions;
    }

    private static String riskPredicate(Accident accident) {
        return switch (accident.getRiskLevel()) {
            case HIGH -> Predicates.ACCIDENT_HIGH_RISK;
            case MEDIUM -> Predicates.ACCIDENT_MEDIUM_RISK;
            case LOW -> Predicates.ACCIDENT_LOW_RISK;
        };
    }

    private static String requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must be non-blank");
        }
        return value;
    }
}
