package com.wayfarer.core.recovery;

import com.wayfarer.core.config.WorkflowProperties;
import com.wayfarer.core.events.EventBus;
import com.wayfarer.core.events.EventType;
import com.wayfarer.core.events.WayfarerEvent;
import com.wayfarer.core.metrics.WayfarerMetrics;
import com.wayfarer.core.model.ConversationRecord;
import com.wayfarer.core.model.Stage;
import com.wayfarer.core.model.StageFailure;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Decides whether a failed stage is replayed or ends the run.
 * <p>
 * Capability, handler and batch failures are replayed from the failing stage until the
 * same stage has failed {@code maxAttempts} times; that failure ends the run. State
 * invariant failures end the run immediately.
 */
@Component
public class ErrorRecovery {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecovery.class);

    private final int maxAttempts;
    private final EventBus eventBus;
    private final WayfarerMetrics metrics;

    @Autowired
    public ErrorRecovery(WorkflowProperties properties, EventBus eventBus, WayfarerMetrics metrics) {
        this(properties.getMaxAttempts(), eventBus, metrics);
    }

    public ErrorRecovery(int maxAttempts) {
        this(maxAttempts, new EventBus(), null);
    }

    ErrorRecovery(int maxAttempts, EventBus eventBus, WayfarerMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Classifies {@code failure} given the attempts already recorded on {@code state}.
     */
    public RecoveryDecision classify(StageFailure failure, PlanningState state) {
        if (failure.structural()) {
            return new RecoveryDecision.Unrecoverable("invalid state at " + failure.stage() + ": " + failure.message());
        }
        int attempt = state.retryCount(failure.stage()) + 1;
        if (attempt >= maxAttempts) {
            return new RecoveryDecision.Unrecoverable(failure.stage() + " failed " + attempt
                    + " time(s): " + failure.message());
        }
        return new RecoveryDecision.Recoverable(failure.stage(), attempt);
    }

    /**
     * Applies the decision for the pending failure on {@code state}: routes back to the
     * failing stage with a fresh attempt, or to {@link Stage#ERROR}.
     *
     * @throws IllegalStateException if no failure is pending
     */
    public PlanningState recover(PlanningState state) {
        StageFailure failure = state.failure();
        if (failure == null) {
            throw new IllegalStateException("No stage failure to recover from");
        }
        RecoveryDecision decision = classify(failure, state);

        if (decision instanceof RecoveryDecision.Recoverable r) {
            log.warn("Recoverable failure at {} (attempt {}/{}): {}",
                    failure.stage(), r.attempt(), maxAttempts, failure.message());
            if (metrics != null) metrics.recordRecovery(failure.stage().name(), true);
            eventBus.publish(WayfarerEvent.of(EventType.STAGE_RETRYING, state.runId(), failure.stage().name(),
                    Map.of("attempt", r.attempt(), "reason", failure.message())));
            return state
                    .withRetryCount(failure.stage(), r.attempt())
                    .clearFailure()
                    .removeTaskResult(failure.stage().name())
                    .addAlert("Retrying " + failure.stage() + " (attempt " + r.attempt() + " of "
                            + maxAttempts + "): " + failure.message())
                    .recordHistory(ConversationRecord.workflow(
                            failure.stage() + " -> " + r.resumeStage() + " (recovery)"))
                    .updateStage(r.resumeStage());
        }

        String reason = ((RecoveryDecision.Unrecoverable) decision).reason();
        log.error("Unrecoverable failure, ending run {}: {}", state.runId(), reason);
        if (metrics != null) metrics.recordRecovery(failure.stage().name(), false);
        eventBus.publish(WayfarerEvent.of(EventType.RUN_FAILED, state.runId(), failure.stage().name(),
                Map.of("reason", reason)));
        return state.withRetryCount(failure.stage(), state.retryCount(failure.stage()) + 1)
                .toBuilder()
                .plan(state.plan().withAlert("workflow: " + reason))
                .failure(null)
                .build()
                .addAlert("Run ended: " + reason)
                .recordHistory(ConversationRecord.workflow(failure.stage() + " -> " + Stage.ERROR))
                .updateStage(Stage.ERROR);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
