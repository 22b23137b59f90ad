package com.wayfarer.core.nodes;

import com.wayfarer.core.capability.CapabilityRegistry;
import com.wayfarer.core.model.*;
import com.wayfarer.core.parallel.ParallelCoordinator;
import com.wayfarer.core.parallel.ResultMerger;
import com.wayfarer.core.state.PlanningState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds the day-by-day itinerary once the searches are in.
 */
@Component
public class PlanActivitiesNode {

    private final ParallelCoordinator coordinator;
    private final ResultMerger merger;
    private final CapabilityRegistry registry;

    public PlanActivitiesNode(ParallelCoordinator coordinator, ResultMerger merger, CapabilityRegistry registry) {
        this.coordinator = coordinator;
        this.merger = merger;
        this.registry = registry;
    }

    public PlanningState apply(PlanningState state) {
        TaskSpec task = TaskSpec.of(TaskKind.ACTIVITIES, registry.require(TaskKind.ACTIVITIES),
                TripParameters.from(state));
        Map<TaskKind, TaskOutcome> outcomes = coordinator.execute(List.of(task), state);
        PlanningState merged = merger.combine(state, outcomes, Stage.ACTIVITIES_PLANNED);

        ActivityResults activities = merged.plan().activities();
        if (outcomes.get(TaskKind.ACTIVITIES).succeeded() && activities != null) {
            return merged.recordHistory(ConversationRecord.system(
                    "Planned activities for " + activities.itineraries().size() + " day(s)"));
        }
        return merged;
    }
}
