package com.wayfarer.core.capability;

import com.wayfarer.core.state.PlanningState;

import java.util.Map;

/**
 * Renders the user prompt of an LLM-backed capability.
 */
@FunctionalInterface
public interface PromptTemplate {

    String render(Map<String, String> parameters, PlanningState snapshot);
}
