package com.wayfarer.core.engine;

import com.wayfarer.core.model.RunStatus;
import com.wayfarer.core.state.PlanningState;

/**
 * What a planning run returned to its caller.
 */
public record RunResult(
    String runId,
    RunStatus status,
    PlanningState state
) {

    public static RunResult of(PlanningState state) {
        return new RunResult(state.runId(), RunStatus.of(state.currentStage()), state);
    }
}
