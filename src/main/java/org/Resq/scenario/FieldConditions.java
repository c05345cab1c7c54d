package org.Resq.scenario;

import lombok.Builder;
import lombok.Value;

/**
 * Environment facts that hold for the whole snapshot.
 */
@Value
@Builder
public class FieldConditions {
    boolean rainy;
    boolean stadiumTrafficLikely;
    @Builder.Default
    boolean controlRoomOperational = true;

    /**
     * Returns clear-weather conditions with an operational control room.
     */
    public static FieldConditions nominal() {
        return FieldConditions.builder().build();
    }
}
