package com.wayfarer.core.interrupt;

import com.wayfarer.core.config.WorkflowProperties;
import com.wayfarer.core.events.EventBus;
import com.wayfarer.core.events.EventType;
import com.wayfarer.core.events.WayfarerEvent;
import com.wayfarer.core.metrics.WayfarerMetrics;
import com.wayfarer.core.model.ConversationRecord;
import com.wayfarer.core.model.DestinationResearch;
import com.wayfarer.core.model.Interruption;
import com.wayfarer.core.model.Stage;
import com.wayfarer.core.recovery.StateValidator;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Objects;

/**
 * Suspends runs that need a human decision and resumes them once input arrives.
 * <p>
 * A run needs input when a handler asked for it explicitly, or when query analysis
 * reported a confidence below the configured threshold. A suspended run sits at
 * {@link Stage#INTERRUPTED} with an {@link Interruption} naming where to re-enter.
 */
@Component
public class InterruptionController {

    private static final Logger log = LoggerFactory.getLogger(InterruptionController.class);
    static final String LOW_CONFIDENCE_REASON = "Query confidence %.2f is below %.2f; please confirm the trip details";

    private final double confidenceThreshold;
    private final EventBus eventBus;
    private final WayfarerMetrics metrics;

    @Autowired
    public InterruptionController(WorkflowProperties properties, EventBus eventBus, WayfarerMetrics metrics) {
        this(properties.getConfidenceThreshold(), eventBus, metrics);
    }

    public InterruptionController(double confidenceThreshold) {
        this(confidenceThreshold, new EventBus(), null);
    }

    InterruptionController(double confidenceThreshold, EventBus eventBus, WayfarerMetrics metrics) {
        this.confidenceThreshold = confidenceThreshold;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public boolean needsInput(PlanningState state) {
        if (state.humanInputRequested()) return true;
        return state.queryConfidence() != null && state.queryConfidence() < confidenceThreshold;
    }

    /**
     * Suspends {@code state}, recording {@code resumeStage} as the re-entry point.
     */
    public PlanningState suspend(PlanningState state, Stage resumeStage) {
        Objects.requireNonNull(resumeStage, "resumeStage");
        if (resumeStage.haltsExecution()) {
            throw new IllegalArgumentException("Cannot resume a run at " + resumeStage);
        }
        String reason = reasonFor(state);
        log.info("Suspending run {} before {}: {}", state.runId(), resumeStage, reason);

        PlanningState suspended = state.toBuilder()
                .interruption(new Interruption(resumeStage, reason, Instant.now()))
                .build()
                .addAlert("Awaiting input: " + reason)
                .recordHistory(ConversationRecord.system(reason))
                .recordHistory(ConversationRecord.workflow(state.currentStage() + " -> " + Stage.INTERRUPTED))
                .updateStage(Stage.INTERRUPTED);

        if (metrics != null) metrics.recordInterruption(resumeStage.name());
        var payload = new HashMap<String, Object>();
        payload.put("reason", reason);
        payload.put("resumeStage", resumeStage.name());
        eventBus.publish(WayfarerEvent.of(EventType.RUN_INTERRUPTED, state.runId(), state.currentStage().name(), payload));
        return suspended;
    }

    /**
     * Applies {@code input} to a suspended run and moves it to its resume stage.
     *
     * @throws IllegalStateException    if {@code state} is not suspended
     * @throws IllegalArgumentException if the resume stage needs a destination and neither
     *                                  the run nor {@code input} supplies one
     */
    public PlanningState resume(PlanningState state, HumanInput input) {
        if (state.currentStage() != Stage.INTERRUPTED || state.interruption() == null) {
            throw new IllegalStateException("Run " + state.runId() + " is not awaiting input (stage "
                    + state.currentStage() + ")");
        }
        Objects.requireNonNull(input, "input");
        Stage resumeStage = state.interruption().resumeStage();

        PlanningState.Builder builder = state.toBuilder()
                .preferences(state.preferences().merge(input.preferences()))
                .queryConfidence(1.0)
                .humanInputRequested(false)
                .inputRequestReason(null)
                .interruption(null);
        if (input.destination() != null && !input.destination().isBlank()) {
            builder.query(state.query().withDestination(input.destination()));
            DestinationResearch research = state.plan().destination();
            if (research != null) {
                builder.plan(state.plan().withDestination(new DestinationResearch(input.destination(),
                        research.summary(), research.highlights(), research.alternatives())));
            }
        }
        PlanningState resumed = builder.build();
        if (StateValidator.requiresDestination(resumeStage) && resumed.destination() == null) {
            throw new IllegalArgumentException("Run " + state.runId() + " needs a destination to continue at "
                    + resumeStage + "; pass one with --destination");
        }
        if (input.message() != null && !input.message().isBlank()) {
            resumed = resumed.recordHistory(ConversationRecord.user(input.message()));
        }

        log.info("Resuming run {} at {}", state.runId(), resumeStage);
        eventBus.publish(WayfarerEvent.of(EventType.RUN_RESUMED, state.runId(), resumeStage.name(),
                new HashMap<>()));
        return resumed
                .recordHistory(ConversationRecord.workflow(Stage.INTERRUPTED + " -> " + resumeStage))
                .updateStage(resumeStage);
    }

    private String reasonFor(PlanningState state) {
        if (state.humanInputRequested()) {
            return state.inputRequestReason() != null ? state.inputRequestReason() : "Human input requested";
        }
        return String.format(Locale.ROOT, LOW_CONFIDENCE_REASON, state.queryConfidence(), confidenceThreshold);
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }
}
