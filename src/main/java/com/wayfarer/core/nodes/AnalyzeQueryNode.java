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
import java.util.Map;

/**
 * Reads the traveller's request into a structured query, preferences and a confidence.
 * <p>
 * The original request text always survives analysis. Low confidence is left on the state
 * for the interruption controller to act on.
 */
@Component
public class AnalyzeQueryNode {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeQueryNode.class);
    public static final String RESULT_KEY = "query_analysis";

    private final Capability<QueryAnalysis> capability;
    private final Duration timeout;

    @Autowired
    public AnalyzeQueryNode(Capability<QueryAnalysis> queryAnalysisCapability, WorkflowProperties properties) {
        this(queryAnalysisCapability, properties.getTaskTimeout());
    }

    AnalyzeQueryNode(Capability<QueryAnalysis> capability, Duration timeout) {
        this.capability = capability;
        this.timeout = timeout;
    }

    public PlanningState apply(PlanningState state) {
        Outcome<QueryAnalysis> outcome = capability.execute(Map.of(), state,
                timeout != null ? Instant.now().plus(timeout) : null);
        if (outcome instanceof Outcome.Failure<QueryAnalysis> f) {
            return state.withFailure(StageFailure.of(state.currentStage(), FailureOrigin.CAPABILITY,
                    "query analysis: " + f.reason()));
        }
        QueryAnalysis analysis = ((Outcome.Success<QueryAnalysis>) outcome).payload();
        if (analysis == null) {
            return state.withFailure(StageFailure.of(state.currentStage(), FailureOrigin.CAPABILITY,
                    "query analysis: empty answer"));
        }

        TravelQuery query = mergeQuery(state.query(), analysis.query());
        boolean researchNeeded = analysis.researchNeeded() || !query.hasDestination();
        String destination = query.hasDestination() ? query.destination() : "Unknown";
        log.info("Query analyzed. Destination: {}, confidence {}", destination, analysis.confidence());

        return state.toBuilder()
                .query(query)
                .preferences(analysis.preferences() != null ? analysis.preferences() : state.preferences())
                .queryConfidence(analysis.confidence())
                .build()
                .recordHistory(ConversationRecord.system(researchNeeded
                        ? "Query analyzed: Destination research needed"
                        : "Query analyzed: " + destination))
                .addTaskResult(RESULT_KEY, TaskResult.success("destination " + destination, Map.of(
                        "confidence", String.valueOf(analysis.confidence()),
                        "researchNeeded", String.valueOf(researchNeeded))));
    }

    /**
     * True when the analysis recorded on {@code state} asked for destination research.
     */
    public static boolean researchNeeded(PlanningState state) {
        TaskResult result = state.taskResults().get(RESULT_KEY);
        if (result != null && "true".equals(result.details().get("researchNeeded"))) {
            return true;
        }
        return !state.query().hasDestination();
    }

    private static TravelQuery mergeQuery(TravelQuery original, TravelQuery extracted) {
        if (extracted == null) return original;
        return new TravelQuery(
                original.requestText(),
                extracted.origin() != null ? extracted.origin() : original.origin(),
                extracted.hasDestination() ? extracted.destination() : original.destination(),
                extracted.departureDate() != null ? extracted.departureDate() : original.departureDate(),
                extracted.returnDate() != null ? extracted.returnDate() : original.returnDate(),
                extracted.travelers() > 0 ? extracted.travelers() : original.travelers(),
                extracted.budget() != null ? extracted.budget() : original.budget(),
                extracted.currency() != null && !extracted.currency().isBlank()
                        ? extracted.currency() : original.currency());
    }
}
