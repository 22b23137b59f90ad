package com.wayfarer.core.nodes;

import com.wayfarer.core.model.*;
import com.wayfarer.core.state.PlanningState;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the parameter maps handed to task capabilities from a state snapshot.
 * Absent values are left out rather than sent as "null".
 */
final class TripParameters {

    private TripParameters() {}

    static Map<String, String> from(PlanningState state) {
        var params = new LinkedHashMap<String, String>();
        TravelQuery query = state.query();
        put(params, "destination", state.destination());
        put(params, "origin", query.origin());
        put(params, "departureDate", query.departureDate());
        put(params, "returnDate", query.returnDate());
        put(params, "travelers", query.travelers());
        put(params, "budget", query.budget());
        put(params, "currency", query.currency());
        if (!state.preferences().interests().isEmpty()) {
            params.put("interests", String.join(", ", state.preferences().interests()));
        }
        state.preferences().values().forEach((k, v) -> put(params, "preference." + k, v));
        return params;
    }

    /**
     * Trip parameters plus the cheapest option found so far in each search category.
     */
    static Map<String, String> forBudget(PlanningState state) {
        var params = new LinkedHashMap<>(from(state));
        TravelPlan plan = state.plan();
        if (plan.flights() != null) {
            plan.flights().options().stream().map(FlightOption::price).filter(Objects::nonNull)
                    .min(Comparator.naturalOrder())
                    .ifPresent(p -> params.put("cheapestFlight", p.toPlainString()));
        }
        if (plan.accommodation() != null) {
            plan.accommodation().options().stream().map(AccommodationOption::nightlyRate).filter(Objects::nonNull)
                    .min(Comparator.naturalOrder())
                    .ifPresent(p -> params.put("cheapestNightlyRate", p.toPlainString()));
        }
        if (plan.transportation() != null) {
            plan.transportation().options().stream().map(TransportOption::estimatedCost).filter(Objects::nonNull)
                    .min(Comparator.naturalOrder())
                    .ifPresent(p -> params.put("cheapestTransport", p.toPlainString()));
        }
        if (plan.activities() != null) {
            params.put("itineraryDays", String.valueOf(plan.activities().itineraries().size()));
        }
        return params;
    }

    private static void put(Map<String, String> params, String key, Object value) {
        if (value == null) return;
        String text = value instanceof BigDecimal d ? d.toPlainString() : value.toString();
        if (!text.isBlank()) params.put(key, text);
    }
}
