package org.Resq.scenario;

import lombok.Builder;
import lombok.Value;

/**
 * Ambulance record supplied by the scenario snapshot.
 */
@Value
@Builder
public class Ambulance {
    /** External ambulance id, e.g. {@code A1}. */
    String id;
    /** Road-network node where the ambulance currently is. */
    String currentNode;
    /** Whether the ambulance is free for dispatch. */
    @Builder.Default
    boolean available = true;
}
