package com.wayfarer.core.model;

import java.io.Serializable;
import java.math.BigDecimal;

public record AccommodationOption(
    String name,
    String type,
    String location,
    BigDecimal nightlyRate,
    double rating
) implements Serializable {}
