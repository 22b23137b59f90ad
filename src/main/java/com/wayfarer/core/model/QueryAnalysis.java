package com.wayfarer.core.model;

import java.io.Serializable;

/**
 * Structured reading of the traveller's request.
 *
 * @param query          the request with extracted fields filled in
 * @param preferences    preferences inferred from the request
 * @param confidence     how sure the analysis is, 0.0 to 1.0
 * @param researchNeeded true when the destination is vague and must be researched
 */
public record QueryAnalysis(
    TravelQuery query,
    TravelPreferences preferences,
    double confidence,
    boolean researchNeeded
) implements Serializable {}
