package org.Resq.planning.core;

import lombok.Builder;
import lombok.Value;
import org.Resq.planning.domain.ResponseAssignment;
import org.Resq.scenario.ScenarioSnapshot;

/**
 * Client-facing planning request.
 */
@Value
@Builder(toBuilder = true)
public class PlanningRequest {
    /** World snapshot to plan against. */
    ScenarioSnapshot snapshot;
    /** Objects the response is planned for. */
    ResponseAssignment assignment;
    /** Optional level bound override; values {@code <= 0} fall back to {@link PlannerConfig#getMaxLevels()}. */
    int maxLevels;
}
