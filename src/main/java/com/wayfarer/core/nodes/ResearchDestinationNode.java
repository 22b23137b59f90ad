package com.wayfarer.core.nodes;

import com.wayfarer.core.capability.Capability;
import com.wayfarer.core.capability.Outcome;
import com.wayfarer.core.config.WorkflowProperties;
import com.wayfarer.core.model.*;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Researches a destination for requests that did not name one. When research cannot
 * settle on a single place the traveller is asked to choose.
 */
@Component
public class ResearchDestinationNode {

    private static final Logger log = LoggerFactory.getLogger(ResearchDestinationNode.class);
    public static final String RESULT_KEY = "destination_research";

    private final Capability<DestinationResearch> capability;
    private final Duration timeout;

    @Autowired
    public ResearchDestinationNode(Capability<DestinationResearch> destinationResearchCapability,
                                   WorkflowProperties properties) {
        this(destinationResearchCapability, properties.getTaskTimeout());
    }

    ResearchDestinationNode(Capability<DestinationResearch> capability, Duration timeout) {
        this.capability = capability;
        this.timeout = timeout;
    }

    public PlanningState apply(PlanningState state) {
        Outcome<DestinationResearch> outcome = capability.execute(TripParameters.from(state), state,
                timeout != null ? Instant.now().plus(timeout) : null);
        if (outcome instanceof Outcome.Failure<DestinationResearch> f) {
            return state.withFailure(StageFailure.of(state.currentStage(), FailureOrigin.CAPABILITY,
                    "destination research: " + f.reason()));
        }
        DestinationResearch research = ((Outcome.Success<DestinationResearch>) outcome).payload();
        if (research == null) {
            return state.withFailure(StageFailure.of(state.currentStage(), FailureOrigin.CAPABILITY,
                    "destination research: empty answer"));
        }

        PlanningState updated = state.toBuilder()
                .plan(state.plan().withDestination(research))
                .build();

        if (!research.resolved()) {
            String reason = research.alternatives().isEmpty()
                    ? "No destination could be determined; please name one"
                    : "Please choose a destination: " + String.join(", ", research.alternatives());
            log.info("Destination research inconclusive: {}", reason);
            return updated.toBuilder()
                    .humanInputRequested(true)
                    .inputRequestReason(reason)
                    .build()
                    .addTaskResult(RESULT_KEY, TaskResult.failure("inconclusive"));
        }

        log.info("Destination researched: {}", research.destination());
        return updated
                .recordHistory(ConversationRecord.system("Destination researched: " + research.destination()))
                .addTaskResult(RESULT_KEY, TaskResult.success(research.destination()));
    }
}
