package com.wayfarer.core.model;

import java.io.Serializable;
import java.math.BigDecimal;

public record FlightOption(
    String airline,
    String flightNumber,
    String origin,
    String destination,
    String departureTime,
    String arrivalTime,
    BigDecimal price
) implements Serializable {}
