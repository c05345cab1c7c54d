package org.Resq.scenario;

import lombok.Builder;
import lombok.Value;

/**
 * Hospital record supplied by the scenario snapshot.
 */
@Value
@Builder
public class Hospital {
    /** External hospital id, e.g. {@code H1}. */
    String id;
    /** Display name. */
    String name;
    /** Road-network node hosting the hospital. */
    String node;
    /** Whether the hospital is a trauma center. */
    boolean traumaCenter;
    /** Current CT scanner status. */
    @Builder.Default
    CtStatus ctStatus = CtStatus.AVAILABLE;
}
