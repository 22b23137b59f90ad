package com.wayfarer.core.model;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * A local transportation option at the destination (transit pass, car rental, transfer).
 */
public record TransportOption(
    String mode,
    String description,
    BigDecimal estimatedCost
) implements Serializable {}
