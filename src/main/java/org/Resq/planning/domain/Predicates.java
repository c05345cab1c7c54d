package org.Resq.planning.domain;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Predicate vocabulary of the emergency-response domain.
 */
@UtilityClass
public class Predicates {
    public static final String NOT = "Not";

    // static world facts
    public static final String HOSPITAL = "Hospital";
    public static final String TRAUMA_CENTER = "TraumaCenter";
    public static final String CT_AVAILABLE = "CTAvailable";
    public static final String CT_OFFLINE = "CTOffline";
    public static final String RAINY_CONDITIONS = "RainyConditions";
    public static final String STADIUM_TRAFFIC_LIKELY = "StadiumTrafficLikely";
    public static final String CONTROL_ROOM_OPERATIONAL = "ControlRoomOperational";

    // ambulances
    public static final String AMBULANCE_FREE = "AmbulanceFree";
    public static final String AMBULANCE_BUSY = "AmbulanceBusy";
    public static final String AMBULANCE_AT = "AmbulanceAt";
    public static final String AMBULANCE_PREDEPLOYED = "AmbulancePredeployed";
    public static final String AMBULANCE_EN_ROUTE = "AmbulanceEnRoute";

    // accidents
    public static final String ACCIDENT_REPORTED = "AccidentReported";
    public static final String ACCIDENT_AT = "AccidentAt";
    public static final String ACCIDENT_HIGH_RISK = "AccidentHighRisk";
    public static final String ACCIDENT_MEDIUM_RISK = "AccidentMediumRisk";
    public static final String ACCIDENT_LOW_RISK = "AccidentLowRisk";
    public static final String ACCIDENT_NOT_SERVED = "AccidentNotServed";
    public static final String ACCIDENT_SERVED = "AccidentServed";
    public static final String ACCIDENT_LOCATION_CONFIRMED = "AccidentLocationConfirmed";
    public static final String DRONE_RECON_DONE = "DroneReconDone";
    public static final String PATIENT_AT = "PatientAt";

    // control-room outcomes
    public static final String TRAFFIC_DIVERTED = "TrafficDiverted";
    public static final String HOSPITAL_NOTIFIED = "HospitalNotified";

    private static final Map<String, String> COMPLEMENTS = Map.of(
            CT_AVAILABLE, CT_OFFLINE,
            CT_OFFLINE, CT_AVAILABLE,
            AMBULANCE_FREE, AMBULANCE_BUSY,
            AMBULANCE_BUSY, AMBULANCE_FREE,
            ACCIDENT_SERVED, ACCIDENT_NOT_SERVED,
            ACCIDENT_NOT_SERVED, ACCIDENT_SERVED
    );

    /**
     * Returns the complementary predicate tag, or null when none is declared.
     */
    public static String complementOf(String predicate) {
        return COMPLEMENTS.get(predicate);
    }

    /**
     * Parses a canonical key such as {@code PatientAt(ACC3, H1)} back into a proposition.
     *
     * <p>Nested parentheses are kept verbatim inside a single argument.</p>
     */
    public static Proposition parse(String key) {
        String trimmed = key.trim();
        int open = trimmed.indexOf('(');
        if (open < 0) {
            return Proposition.of(trimmed);
        }
        if (!trimmed.endsWith(")")) {
            throw new IllegalArgumentException("Malformed proposition key: " + key);
        }
        String predicate = trimmed.substring(0, open).trim();
        String body = trimmed.substring(open + 1, trimmed.length() - 1);
        List<String> arguments = new ArrayList<>();
        int depth = 0;
        int tokenStart = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                arguments.add(body.substring(tokenStart, i).trim());
                tokenStart = i + 1;
            }
        }
        String last = body.substring(tokenStart).trim();
        if (!last.isEmpty() || !arguments.isEmpty()) {
            arguments.add(last);
        }
        return new Proposition(predicate, arguments);
    }
}
