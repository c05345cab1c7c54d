package org.Resq.scenario;

import org.Resq.core.id.ObjectIndex;
import org.Resq.planning.ObjectNotFoundException;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of the world handed to the planning core.
 *
 * <p>Hospitals, ambulances and accidents are indexed by id once at construction, so
 * every lookup is O(1) and every miss surfaces as {@link ObjectNotFoundException}.</p>
 */
public final class ScenarioSnapshot {
    public static final String KIND_HOSPITAL = "hospital";
    public static final String KIND_AMBULANCE = "ambulance";
    public static final String KIND_ACCIDENT = "accident";

    private final ObjectIndex<Hospital> hospitals;
    private final ObjectIndex<Ambulance> ambulances;
    private final ObjectIndex<Accident> accidents;
    private final FieldConditions conditions;

    /**
     * Creates a snapshot from plain collections.
     *
     * @throws IllegalArgumentException on duplicate or blank ids within one collection.
     */
    public ScenarioSnapshot(
            Collection<Hospital> hospitals,
            Collection<Ambulance> ambulances,
            Collection<Accident> accidents,
            FieldConditions conditions
    ) {
        this.hospitals = ObjectIndex.of(KIND_HOSPITAL, hospitals, Hospital::getId);
        this.ambulances = ObjectIndex.of(KIND_AMBULANCE, ambulances, Ambulance::getId);
        this.accidents = ObjectIndex.of(KIND_ACCIDENT, accidents, Accident::getId);
        this.conditions = Objects.requireNonNull(conditions, "conditions");
    }

    public Hospital hospital(String id) {
        return hospitals.require(id);
    }

    public Ambulance ambulance(String id) {
        return ambulances.require(id);
    }

    public Accident accident(String id) {
        return accidents.require(id);
    }

    public List<Hospital> hospitals() {
        return hospitals.values();
    }

    public List<Ambulance> ambulances() {
        return ambulances.values();
    }

    public List<Accident> accidents() {
        return accidents.values();
    }

    public FieldConditions conditions() {
        return conditions;
    }
}
