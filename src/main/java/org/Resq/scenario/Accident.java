package org.Resq.scenario;

import lombok.Builder;
import lombok.Value;

/**
 * Accident record supplied by the scenario snapshot.
 */
@Value
@Builder
public class Accident {
    /** External accident id, e.g. {@code ACC3}. */
    String id;
    /** Road-network node of the reported location. */
    String locationNode;
    /** Free-text description from the caller report. */
    String description;
    /** Risk class from upstream inference. */
    @Builder.Default
    RiskLevel riskLevel = RiskLevel.MEDIUM;
    /** Whether a patient from this accident has already been delivered. */
    boolean served;
}
