package com.wayfarer.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * The traveller's request. {@code requestText} is the original free-form text; the
 * remaining fields are filled in by query analysis and may be null until then.
 */
public record TravelQuery(
    String requestText,
    String origin,
    String destination,
    LocalDate departureDate,
    LocalDate returnDate,
    int travelers,
    BigDecimal budget,
    String currency
) implements Serializable {

    public static TravelQuery of(String requestText) {
        return new TravelQuery(requestText, null, null, null, null, 1, null, "USD");
    }

    public boolean hasDestination() {
        return destination != null && !destination.isBlank();
    }

    public TravelQuery withDestination(String newDestination) {
        return new TravelQuery(requestText, origin, newDestination, departureDate, returnDate,
                travelers, budget, currency);
    }
}
