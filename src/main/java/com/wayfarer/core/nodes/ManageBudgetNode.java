package com.wayfarer.core.nodes;

import com.wayfarer.core.capability.CapabilityRegistry;
import com.wayfarer.core.model.*;
import com.wayfarer.core.parallel.ParallelCoordinator;
import com.wayfarer.core.parallel.ResultMerger;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Estimates the trip cost from everything found so far and flags a plan that exceeds
 * the traveller's budget.
 */
@Component
public class ManageBudgetNode {

    private static final Logger log = LoggerFactory.getLogger(ManageBudgetNode.class);

    private final ParallelCoordinator coordinator;
    private final ResultMerger merger;
    private final CapabilityRegistry registry;

    public ManageBudgetNode(ParallelCoordinator coordinator, ResultMerger merger, CapabilityRegistry registry) {
        this.coordinator = coordinator;
        this.merger = merger;
        this.registry = registry;
    }

    public PlanningState apply(PlanningState state) {
        TaskSpec task = TaskSpec.of(TaskKind.BUDGET, registry.require(TaskKind.BUDGET),
                TripParameters.forBudget(state));
        Map<TaskKind, TaskOutcome> outcomes = coordinator.execute(List.of(task), state);
        PlanningState merged = merger.combine(state, outcomes, Stage.BUDGET_MANAGED);

        if (!(outcomes.get(TaskKind.BUDGET) instanceof TaskOutcome.Success s)) {
            return merged;
        }
        BudgetReport report = (BudgetReport) s.payload();
        if (report.withinBudget()) {
            return merged;
        }
        String alert = "budget: estimated " + report.estimatedTotal() + " " + report.currency()
                + (state.query().budget() != null ? " exceeds the budget of " + state.query().budget() : " exceeds the budget");
        log.warn(alert);
        return merged.toBuilder()
                .plan(merged.plan().withAlert(alert))
                .build();
    }
}
