package com.wayfarer.core.graph;

import com.wayfarer.core.state.PlanningState;

/**
 * Picks the key of a conditional edge from the state a handler returned.
 */
@FunctionalInterface
public interface Router {

    String route(PlanningState state);
}
