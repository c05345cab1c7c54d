package org.Resq.planning.domain;

import java.util.List;

/**
 * Structural role of a ground action in the incident-response catalog.
 *
 * <p>The partial-order builder selects actions by role, and derives each node id from
 * the role label plus an optional qualifying argument (for example {@code NotifyH1}).</p>
 */
public enum ActionRole {
    GENERIC("Action", Qualifier.ALL, false),
    RECONNAISSANCE("DroneRecon", Qualifier.NONE, true),
    TRAFFIC_DIVERSION("RequestDiversion", Qualifier.NONE, true),
    PRE_POSITIONING("Predeploy", Qualifier.FIRST, true),
    NOTIFICATION("Notify", Qualifier.FIRST, false),
    TRANSPORT_START("StartTransport", Qualifier.NONE, false),
    DELIVERY("Deliver", Qualifier.LAST, false),
    CONTINGENCY_DELIVERY("Reroute", Qualifier.LAST, false);

    private final String nodeLabel;
    private final Qualifier qualifier;
    private final boolean preparatory;

    ActionRole(String nodeLabel, Qualifier qualifier, boolean preparatory) {
        this.nodeLabel = nodeLabel;
        this.qualifier = qualifier;
        this.preparatory = preparatory;
    }

    /**
     * Returns true for actions that must complete before transport starts.
     */
    public boolean isPreparatory() {
        return preparatory;
    }

    /**
     * Returns true for the mutually exclusive ways of finishing the response.
     */
    public boolean isDeliveryAlternative() {
        return this == DELIVERY || this == CONTINGENCY_DELIVERY;
    }

    /**
     * Derives a stable plan-node id for an action with the given arguments.
     */
    public String nodeId(List<String> arguments) {
        return switch (qualifier) {
            case NONE -> nodeLabel;
            case FIRST -> arguments.isEmpty() ? nodeLabel : nodeLabel + arguments.get(0);
            case LAST -> arguments.isEmpty() ? nodeLabel : nodeLabel + arguments.get(arguments.size() - 1);
            case ALL -> arguments.isEmpty() ? nodeLabel : nodeLabel + "_" + String.join("_", arguments);
        };
    }

    private enum Qualifier {
        NONE,
        FIRST,
        LAST,
        ALL
    }
}
