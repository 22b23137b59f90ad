package com.wayfarer.core.graph;

import com.wayfarer.core.state.PlanningState;

/**
 * The work that runs from a stage. Returns the updated state; the graph decides where
 * the run goes next.
 */
@FunctionalInterface
public interface StageHandler {

    PlanningState apply(PlanningState state);
}
