package com.wayfarer.core.engine;

import com.wayfarer.core.config.WorkflowProperties;
import com.wayfarer.core.events.EventBus;
import com.wayfarer.core.events.EventType;
import com.wayfarer.core.events.WayfarerEvent;
import com.wayfarer.core.graph.TravelPlanningGraph;
import com.wayfarer.core.interrupt.HumanInput;
import com.wayfarer.core.interrupt.InterruptionController;
import com.wayfarer.core.logging.MdcContext;
import com.wayfarer.core.metrics.WayfarerMetrics;
import com.wayfarer.core.model.ConversationRecord;
import com.wayfarer.core.model.TravelQuery;
import com.wayfarer.core.persistence.SnapshotStore;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for planning runs: creates the initial state, drives the graph until it
 * halts, and persists the resulting snapshot.
 * <p>
 * A run that stops for input is stored at {@code INTERRUPTED} and continued later by
 * {@link #resume(String, HumanInput)}.
 */
@Service
public class PlanningEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanningEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final TravelPlanningGraph graph;
    private final InterruptionController interruptions;
    private final SnapshotStore snapshots;
    private final EventBus eventBus;
    private final WayfarerMetrics metrics;
    private final int defaultConcurrency;

    public PlanningEngine(TravelPlanningGraph graph, InterruptionController interruptions,
                          SnapshotStore snapshots, EventBus eventBus, WayfarerMetrics metrics,
                          WorkflowProperties properties) {
        this.graph = graph;
        this.interruptions = interruptions;
        this.snapshots = snapshots;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.defaultConcurrency = properties.getMaxConcurrency();
    }

    /**
     * Plans a trip with the configured concurrency limit.
     */
    public RunResult plan(String request) {
        return plan(request, defaultConcurrency);
    }

    /**
     * Plans a trip for a free-form request.
     *
     * @param request          the traveller's request
     * @param concurrencyLimit upper bound on concurrently running tasks
     * @throws IllegalArgumentException if the request is blank or the limit is below 1
     */
    public RunResult plan(String request, int concurrencyLimit) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("Travel request must not be empty");
        }
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be at least 1, got " + concurrencyLimit);
        }
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {} with concurrency {}: {}", runId, concurrencyLimit, request);
            var payload = new HashMap<String, Object>();
            payload.put("request", request);
            payload.put("concurrencyLimit", concurrencyLimit);
            eventBus.publish(WayfarerEvent.of(EventType.RUN_CREATED, runId, null, payload));

            PlanningState initial = PlanningState.initial(runId, TravelQuery.of(request), concurrencyLimit)
                    .recordHistory(ConversationRecord.user(request));
            return finish(graph.run(initial));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Continues a run that is waiting for input.
     *
     * The stored snapshot is left untouched when the input is rejected.
     *
     * @throws IllegalArgumentException if no run with {@code runId} is stored, or the run
     *                                  needs a destination that {@code input} does not give
     * @throws IllegalStateException    if the run is not waiting for input
     */
    public RunResult resume(String runId, HumanInput input) {
        PlanningState snapshot = snapshots.load(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
        MdcContext.setRun(runId);
        try {
            log.info("Resuming run {} from {}", runId, snapshot.currentStage());
            return finish(graph.run(interruptions.resume(snapshot, input)));
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<PlanningState> status(String runId) {
        return snapshots.load(runId);
    }

    private RunResult finish(PlanningState state) {
        snapshots.save(state);
        RunResult result = RunResult.of(state);
        if (metrics != null) metrics.recordRunResult(result.status().name());
        eventBus.publish(WayfarerEvent.of(EventType.RUN_HALTED, state.runId(), state.currentStage().name(),
                Map.of("status", result.status().name())));
        log.info("Run {} finished with status {}", state.runId(), result.status());
        return result;
    }

    /**
     * Generates a run ID in the format TRIP-YYYY-NNNN, skipping IDs already stored.
     */
    public String generateRunId() {
        Set<String> existing = new HashSet<>(snapshots.listRunIds());
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        String runId;
        do {
            runId = String.format("TRIP-%d-%04d", year, RUN_COUNTER.incrementAndGet());
        } while (existing.contains(runId));
        return runId;
    }
}
