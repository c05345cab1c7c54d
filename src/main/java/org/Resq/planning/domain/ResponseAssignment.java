package org.Resq.planning.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Objects a response domain is built around.
 */
@Value
@Builder(toBuilder = true)
public class ResponseAssignment {
    /** Accident to advance to the served state. */
    String accidentId;
    /** Ambulance dispatched to the accident. */
    String ambulanceId;
    /** Hospital the strict plan delivers to. */
    String primaryHospitalId;
    /** Hospital the contingency branch may reroute to. */
    String alternateHospitalId;
    /** Node the ambulance is pre-positioned at before transport. */
    String stagingNode;
    /** Road corridor for which a traffic diversion is requested. */
    String diversionCorridor;
}
