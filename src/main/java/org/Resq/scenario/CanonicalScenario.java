package org.Resq.scenario;

import lombok.experimental.UtilityClass;
import org.Resq.planning.domain.ResponseAssignment;

import java.util.List;

/**
 * Fixed rainy-evening match-day scenario used by the driver and the end-to-end tests.
 *
 * <p>H1 is a trauma center with CT available; H2 is closer but its CT is offline.
 * ACC3, an SUV rollover near the airport approach, is the high-risk accident the
 * response plans are built for.</p>
 */
@UtilityClass
public class CanonicalScenario {
    public static final String TRAUMA_HOSPITAL_ID = "H1";
    public static final String SECONDARY_HOSPITAL_ID = "H2";
    public static final String PRIMARY_AMBULANCE_ID = "A1";
    public static final String SECONDARY_AMBULANCE_ID = "A2";
    public static final String TARGET_ACCIDENT_ID = "ACC3";
    public static final String STAGING_NODE = "nayapalli_chowk";
    public static final String DIVERSION_CORRIDOR = "stadium_corridor";

    /**
     * Returns the snapshot with H2's CT offline.
     */
    public static ScenarioSnapshot snapshot() {
        return snapshot(CtStatus.OFFLINE);
    }

    /**
     * Returns the snapshot with the given CT status at H2.
     */
    public static ScenarioSnapshot snapshot(CtStatus secondaryCtStatus) {
        return new ScenarioSnapshot(hospitals(secondaryCtStatus), ambulances(), accidents(), conditions());
    }

    /**
     * Returns the default assignment: A1 from H1 serves ACC3, H2 is the alternate.
     */
    public static ResponseAssignment assignment() {
        return ResponseAssignment.builder()
                .accidentId(TARGET_ACCIDENT_ID)
                .ambulanceId(PRIMARY_AMBULANCE_ID)
                .primaryHospitalId(TRAUMA_HOSPITAL_ID)
                .alternateHospitalId(SECONDARY_HOSPITAL_ID)
                .stagingNode(STAGING_NODE)
                .diversionCorridor(DIVERSION_CORRIDOR)
                .build();
    }

    public static FieldConditions conditions() {
        return FieldConditions.builder()
                .rainy(true)
                .stadiumTrafficLikely(true)
                .controlRoomOperational(true)
                .build();
    }

    private static List<Hospital> hospitals(CtStatus secondaryCtStatus) {
        return List.of(
                Hospital.builder()
                        .id(TRAUMA_HOSPITAL_ID)
                        .name("H1 Trauma Hospital")
                        .node("hospital_h1")
                        .traumaCenter(true)
                        .ctStatus(CtStatus.AVAILABLE)
                        .build(),
                Hospital.builder()
                        .id(SECONDARY_HOSPITAL_ID)
                        .name("H2 General Hospital")
                        .node("hospital_h2")
                        .traumaCenter(false)
                        .ctStatus(secondaryCtStatus)
                        .build()
        );
    }

    private static List<Ambulance> ambulances() {
        return List.of(
                Ambulance.builder().id(PRIMARY_AMBULANCE_ID).currentNode("hospital_h1").available(true).build(),
                Ambulance.builder().id(SECONDARY_AMBULANCE_ID).currentNode("hospital_h2").available(true).build()
        );
    }

    private static List<Accident> accidents() {
        return List.of(
                Accident.builder()
                        .id("ACC1")
                        .locationNode("jaydev_vihar_flyover")
                        .description("High-speed bike collision near Jaydev Vihar flyover")
                        .riskLevel(RiskLevel.MEDIUM)
                        .build(),
                Accident.builder()
                        .id("ACC2")
                        .locationNode("rupali_square")
                        .description("Car-auto crash at Rupali Square")
                        .riskLevel(RiskLevel.LOW)
                        .build(),
                Accident.builder()
                        .id(TARGET_ACCIDENT_ID)
                        .locationNode("airport_approach")
                        .description("SUV rollover near Airport approach road with airbags deployed")
                        .riskLevel(RiskLevel.HIGH)
                        .build()
        );
    }
}
