package com.wayfarer.core.state;

import com.wayfarer.core.model.*;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Central state of one planning run, threaded through every stage by value.
 * <p>
 * Instances are immutable: every collection is an unmodifiable copy, and every
 * operation returns a new state. A value handed to a concurrent task is therefore
 * a snapshot that no other writer can change underneath it.
 *
 * @param runId               identifier of the run
 * @param query               the traveller's request
 * @param preferences         preferences derived from the request
 * @param plan                the plan aggregate under construction
 * @param conversationHistory append-only conversation and event records
 * @param currentStage        the stage the run is at, never null
 * @param taskResults         last result per stage or task key
 * @param retryCounts         failures recorded per stage, used to bound recovery
 * @param alerts              workflow-level alerts (recoveries, interruptions)
 * @param failure             pending stage failure awaiting recovery, or null
 * @param humanInputRequested set by a handler that needs a human decision
 * @param inputRequestReason  what the handler needs, or null
 * @param queryConfidence     confidence reported by query analysis, or null before it ran
 * @param interruption        present only while the run is suspended
 * @param concurrencyLimit    upper bound on concurrently running tasks
 */
public record PlanningState(
    String runId,
    TravelQuery query,
    TravelPreferences preferences,
    TravelPlan plan,
    List<ConversationRecord> conversationHistory,
    Stage currentStage,
    Map<String, TaskResult> taskResults,
    Map<Stage, Integer> retryCounts,
    List<String> alerts,
    StageFailure failure,
    boolean humanInputRequested,
    String inputRequestReason,
    Double queryConfidence,
    Interruption interruption,
    int concurrencyLimit
) implements Serializable {

    public PlanningState {
        Objects.requireNonNull(currentStage, "currentStage");
        preferences = preferences == null ? TravelPreferences.empty() : preferences;
        plan = plan == null ? TravelPlan.empty() : plan;
        conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
        taskResults = taskResults == null ? Map.of() : Map.copyOf(taskResults);
        retryCounts = retryCounts == null ? Map.of() : Map.copyOf(retryCounts);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    /**
     * Creates the state a new run starts from.
     */
    public static PlanningState initial(String runId, TravelQuery query, int concurrencyLimit) {
        return new PlanningState(runId, query, TravelPreferences.empty(), TravelPlan.empty(),
                List.of(), Stage.START, Map.of(), Map.of(), List.of(), null,
                false, null, null, null, concurrencyLimit);
    }

    // ── Stage machine ────────────────────────────────────────────────

    /**
     * Moves the run to {@code next}. Callers record history before calling this.
     */
    public PlanningState updateStage(Stage next) {
        Objects.requireNonNull(next, "next");
        return toBuilder().currentStage(next).build();
    }

    public PlanningState addTaskResult(String key, TaskResult result) {
        var updated = new HashMap<>(taskResults);
        updated.put(key, result);
        return toBuilder().taskResults(updated).build();
    }

    public PlanningState removeTaskResult(String key) {
        if (!taskResults.containsKey(key)) return this;
        var updated = new HashMap<>(taskResults);
        updated.remove(key);
        return toBuilder().taskResults(updated).build();
    }

    public PlanningState recordHistory(ConversationRecord entry) {
        var updated = new ArrayList<>(conversationHistory);
        updated.add(entry);
        return toBuilder().conversationHistory(updated).build();
    }

    public PlanningState addAlert(String alert) {
        var updated = new ArrayList<>(alerts);
        updated.add(alert);
        return toBuilder().alerts(updated).build();
    }

    // ── Failures and retries ─────────────────────────────────────────

    public boolean hasFailure() {
        return failure != null;
    }

    public PlanningState withFailure(StageFailure stageFailure) {
        return toBuilder().failure(stageFailure).build();
    }

    public PlanningState clearFailure() {
        return failure == null ? this : toBuilder().failure(null).build();
    }

    public int retryCount(Stage stage) {
        return retryCounts.getOrDefault(stage, 0);
    }

    public PlanningState withRetryCount(Stage stage, int count) {
        var updated = new EnumMap<Stage, Integer>(Stage.class);
        updated.putAll(retryCounts);
        updated.put(stage, count);
        return toBuilder().retryCounts(updated).build();
    }

    // ── Convenience accessors ────────────────────────────────────────

    /**
     * The destination the plan is being built for: the researched one when present,
     * otherwise the one named in the query.
     */
    public String destination() {
        if (plan.destination() != null && plan.destination().resolved()) {
            return plan.destination().destination();
        }
        return query != null && query.hasDestination() ? query.destination() : null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Copy-on-write builder; starts from an existing state.
     */
    public static final class Builder {
        private String runId;
        private TravelQuery query;
        private TravelPreferences preferences;
        private TravelPlan plan;
        private List<ConversationRecord> conversationHistory;
        private Stage currentStage;
        private Map<String, TaskResult> taskResults;
        private Map<Stage, Integer> retryCounts;
        private List<String> alerts;
        private StageFailure failure;
        private boolean humanInputRequested;
        private String inputRequestReason;
        private Double queryConfidence;
        private Interruption interruption;
        private int concurrencyLimit;

        private Builder(PlanningState s) {
            this.runId = s.runId;
            this.query = s.query;
            this.preferences = s.preferences;
            this.plan = s.plan;
            this.conversationHistory = s.conversationHistory;
            this.currentStage = s.currentStage;
            this.taskResults = s.taskResults;
            this.retryCounts = s.retryCounts;
            this.alerts = s.alerts;
            this.failure = s.failure;
            this.humanInputRequested = s.humanInputRequested;
            this.inputRequestReason = s.inputRequestReason;
            this.queryConfidence = s.queryConfidence;
            this.interruption = s.interruption;
            this.concurrencyLimit = s.concurrencyLimit;
        }

        public Builder query(TravelQuery v) { this.query = v; return this; }
        public Builder preferences(TravelPreferences v) { this.preferences = v; return this; }
        public Builder plan(TravelPlan v) { this.plan = v; return this; }
        public Builder conversationHistory(List<ConversationRecord> v) { this.conversationHistory = v; return this; }
        public Builder currentStage(Stage v) { this.currentStage = v; return this; }
        public Builder taskResults(Map<String, TaskResult> v) { this.taskResults = v; return this; }
        public Builder retryCounts(Map<Stage, Integer> v) { this.retryCounts = v; return this; }
        public Builder alerts(List<String> v) { this.alerts = v; return this; }
        public Builder failure(StageFailure v) { this.failure = v; return this; }
        public Builder humanInputRequested(boolean v) { this.humanInputRequested = v; return this; }
        public Builder inputRequestReason(String v) { this.inputRequestReason = v; return this; }
        public Builder queryConfidence(Double v) { this.queryConfidence = v; return this; }
        public Builder interruption(Interruption v) { this.interruption = v; return this; }
        public Builder concurrencyLimit(int v) { this.concurrencyLimit = v; return this; }

        public PlanningState build() {
            return new PlanningState(runId, query, preferences, plan, conversationHistory,
                    currentStage, taskResults, retryCounts, alerts, failure,
                    humanInputRequested, inputRequestReason, queryConfidence,
                    interruption, concurrencyLimit);
        }
    }
}
