package com.wayfarer.core.parallel;

import com.wayfarer.core.config.WorkflowProperties;
import com.wayfarer.core.model.*;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Folds the outcomes of a parallel batch into the plan.
 * <p>
 * Outcomes are applied in {@link TaskKind} declaration order, whatever order they
 * completed in. A success replaces its own plan field wholesale; a failure leaves the
 * field alone and appends {@code "<kind>: <reason>"} to the plan alerts. The run then
 * advances to the post-batch stage even when some tasks failed. When fewer than
 * {@code minSuccessfulTasks} tasks succeeded, capped at the batch size, a
 * {@link FailureOrigin#TASK_BATCH} stage failure is recorded so error recovery gets consulted.
 */
@Component
public class ResultMerger {

    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    private final int minSuccessfulTasks;

    @Autowired
    public ResultMerger(WorkflowProperties properties) {
        this(properties.getMinSuccessfulTasks());
    }

    public ResultMerger(int minSuccessfulTasks) {
        this.minSuccessfulTasks = minSuccessfulTasks;
    }

    /**
     * Merges a search batch and advances to {@link Stage#PARALLEL_SEARCH_COMPLETED}.
     */
    public PlanningState combine(PlanningState state, Map<TaskKind, TaskOutcome> outcomes) {
        return combine(state, outcomes, Stage.PARALLEL_SEARCH_COMPLETED);
    }

    /**
     * Merges a batch and advances to {@code postStage}.
     *
     * @param state     the state the batch was run against
     * @param outcomes  one outcome per task of the batch
     * @param postStage the stage reached once the batch is folded in
     */
    public PlanningState combine(PlanningState state, Map<TaskKind, TaskOutcome> outcomes, Stage postStage) {
        if (outcomes == null || outcomes.isEmpty()) {
            throw new IllegalArgumentException("No outcomes to merge");
        }
        Stage batchStage = state.currentStage();
        TravelPlan plan = state.plan();
        PlanningState merged = state;
        int successes = 0;

        for (TaskKind kind : TaskKind.values()) {
            TaskOutcome outcome = outcomes.get(kind);
            if (outcome == null) continue;

            if (outcome instanceof TaskOutcome.Success s) {
                plan = plan.withPayload(s.payload());
                merged = merged.addTaskResult(kind.label(), TaskResult.success(describe(s.payload())));
                successes++;
            } else if (outcome instanceof TaskOutcome.Failure f) {
                String alert = kind.label() + ": " + f.reason();
                log.warn("Task {} failed, keeping previous {} data: {}", kind.label(), kind.label(), f.reason());
                plan = plan.withAlert(alert);
                merged = merged.addTaskResult(kind.label(), TaskResult.failure(f.reason()));
            }
        }

        merged = merged.toBuilder().plan(plan).build();

        // activities and budget run as single-task batches
        int required = Math.min(minSuccessfulTasks, outcomes.size());
        if (successes < required) {
            String message = String.format("%d of %d task(s) succeeded, at least %d required",
                    successes, outcomes.size(), required);
            log.warn("Escalating batch at {}: {}", batchStage, message);
            merged = merged.withFailure(StageFailure.of(batchStage, FailureOrigin.TASK_BATCH, message));
        }

        return merged.updateStage(postStage);
    }

    static String describe(TaskPayload payload) {
        if (payload instanceof FlightResults f) return f.options().size() + " flight option(s)";
        if (payload instanceof AccommodationResults a) return a.options().size() + " accommodation option(s)";
        if (payload instanceof TransportationResults t) return t.options().size() + " transportation option(s)";
        if (payload instanceof ActivityResults a) return a.itineraries().size() + " day(s) planned";
        if (payload instanceof BudgetReport b) {
            return "estimated " + b.estimatedTotal() + " " + b.currency()
                    + (b.withinBudget() ? " (within budget)" : " (over budget)");
        }
        return payload.getClass().getSimpleName();
    }
}
