package com.wayfarer.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * The plan being assembled across stages. Task fields are replaced wholesale by a
 * successful outcome of their own kind and never touched by a failure.
 */
public record TravelPlan(
    DestinationResearch destination,
    FlightResults flights,
    AccommodationResults accommodation,
    TransportationResults transportation,
    ActivityResults activities,
    BudgetReport budget,
    List<String> alerts
) implements Serializable {

    public TravelPlan {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public static TravelPlan empty() {
        return new TravelPlan(null, null, null, null, null, null, List.of());
    }

    /**
     * Returns a copy with the field belonging to {@code payload}'s kind replaced.
     */
    public TravelPlan withPayload(TaskPayload payload) {
        if (payload instanceof FlightResults f) {
            return new TravelPlan(destination, f, accommodation, transportation, activities, budget, alerts);
        }
        if (payload instanceof AccommodationResults a) {
            return new TravelPlan(destination, flights, a, transportation, activities, budget, alerts);
        }
        if (payload instanceof TransportationResults t) {
            return new TravelPlan(destination, flights, accommodation, t, activities, budget, alerts);
        }
        if (payload instanceof ActivityResults a) {
            return new TravelPlan(destination, flights, accommodation, transportation, a, budget, alerts);
        }
        if (payload instanceof BudgetReport b) {
            return new TravelPlan(destination, flights, accommodation, transportation, activities, b, alerts);
        }
        throw new IllegalArgumentException("Unsupported payload: " + payload);
    }

    public TravelPlan withDestination(DestinationResearch research) {
        return new TravelPlan(research, flights, accommodation, transportation, activities, budget, alerts);
    }

    public TravelPlan withAlert(String alert) {
        var updated = new ArrayList<>(alerts);
        updated.add(alert);
        return new TravelPlan(destination, flights, accommodation, transportation, activities, budget, updated);
    }

    /** Current value of the field owned by {@code kind}, or null if never written. */
    public TaskPayload field(TaskKind kind) {
        return switch (kind) {
            case FLIGHT_SEARCH -> flights;
            case ACCOMMODATION -> accommodation;
            case TRANSPORTATION -> transportation;
            case ACTIVITIES -> activities;
            case BUDGET -> budget;
        };
    }
}
