package org.Resq.planning.core;

import lombok.Builder;
import lombok.Value;

/**
 * Planner-wide defaults, bound once when a {@link ResponsePlanner} is created.
 */
@Value
@Builder
public class PlannerConfig {
    public static final int DEFAULT_MAX_LEVELS = 8;

    static final String PROP_MAX_LEVELS = "resq.planning.maxLevels";
    static final String PROP_VALIDATE_PLANS = "resq.planning.validatePlans";

    /** Planning-graph level bound used when a request does not override it. */
    @Builder.Default
    int maxLevels = DEFAULT_MAX_LEVELS;

    /** Whether plans are replayed/validated before they are returned. */
    @Builder.Default
    boolean validatePlans = true;

    /**
     * Loads configuration from system properties, falling back to defaults on blank or malformed values.
     */
    public static PlannerConfig defaults() {
        return PlannerConfig.builder()
                .maxLevels(readPositiveInt(PROP_MAX_LEVELS, DEFAULT_MAX_LEVELS))
                .validatePlans(readBoolean(PROP_VALIDATE_PLANS, true))
                .build();
    }

    private static int readPositiveInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static boolean readBoolean(String property, boolean fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        return fallback;
    }
}
