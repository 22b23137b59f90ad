package com.wayfarer.core.nodes;

import com.wayfarer.core.capability.CapabilityRegistry;
import com.wayfarer.core.model.*;
import com.wayfarer.core.parallel.ParallelCoordinator;
import com.wayfarer.core.parallel.ResultMerger;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Searches flights, accommodation and local transportation concurrently and merges
 * whatever came back. Individual search failures only become alerts.
 */
@Component
public class ParallelSearchNode {

    private static final Logger log = LoggerFactory.getLogger(ParallelSearchNode.class);
    static final List<TaskKind> SEARCH_KINDS =
            List.of(TaskKind.FLIGHT_SEARCH, TaskKind.ACCOMMODATION, TaskKind.TRANSPORTATION);

    private final ParallelCoordinator coordinator;
    private final ResultMerger merger;
    private final CapabilityRegistry registry;

    public ParallelSearchNode(ParallelCoordinator coordinator, ResultMerger merger, CapabilityRegistry registry) {
        this.coordinator = coordinator;
        this.merger = merger;
        this.registry = registry;
    }

    public PlanningState apply(PlanningState state) {
        Map<String, String> parameters = TripParameters.from(state);
        var tasks = new ArrayList<TaskSpec>();
        for (TaskKind kind : SEARCH_KINDS) {
            tasks.add(TaskSpec.of(kind, registry.require(kind), parameters));
        }

        Map<TaskKind, TaskOutcome> outcomes = coordinator.execute(tasks, state);
        PlanningState merged = merger.combine(state, outcomes);

        TravelPlan plan = merged.plan();
        String summary = String.format("Completed parallel search: %d flights, %d accommodations, %d transportation options",
                plan.flights() != null ? plan.flights().options().size() : 0,
                plan.accommodation() != null ? plan.accommodation().options().size() : 0,
                plan.transportation() != null ? plan.transportation().options().size() : 0);
        log.info(summary);
        return merged.recordHistory(ConversationRecord.system(summary));
    }
}
