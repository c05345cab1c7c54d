package org.Resq.planning.pop;

import org.Resq.planning.domain.Proposition;

import java.util.Objects;

/**
 * Records that {@code producer} supplies {@code proposition} to {@code consumer}.
 */
public record CausalLink(String producer, Proposition proposition, String consumer) {

    public CausalLink {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(proposition, "proposition");
        Objects.requireNonNull(consumer, "consumer");
    }

    @Override
    public String toString() {
        return producer + " --[" + proposition + "]--> " + consumer;
    }
}
