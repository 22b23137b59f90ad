package com.wayfarer.core.model;

/**
 * Canonical result schema of one {@link TaskKind}. There is exactly one payload type
 * per kind, so merge logic never has to guess how to read a result.
 */
public sealed interface TaskPayload
        permits FlightResults, AccommodationResults, TransportationResults, ActivityResults, BudgetReport {

    TaskKind kind();
}
