package com.wayfarer.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Estimated trip cost, broken down by category (flights, lodging, transport, activities).
 */
public record BudgetReport(
    BigDecimal estimatedTotal,
    String currency,
    Map<String, BigDecimal> breakdown,
    boolean withinBudget
) implements TaskPayload, Serializable {

    public BudgetReport {
        breakdown = breakdown == null ? Map.of() : Map.copyOf(breakdown);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.BUDGET;
    }
}
