package org.Resq.planning.pop;

import java.util.Objects;

/**
 * Ordering constraint: {@code before} must complete before {@code after} starts.
 */
public record Ordering(String before, String after) {

    public Ordering {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
    }

    @Override
    public String toString() {
        return before + " -> " + after;
    }
}
