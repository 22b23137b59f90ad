package com.wayfarer.core.graph;

import com.wayfarer.core.interrupt.InterruptionController;
import com.wayfarer.core.logging.MdcContext;
import com.wayfarer.core.metrics.WayfarerMetrics;
import com.wayfarer.core.model.ConversationRecord;
import com.wayfarer.core.model.FailureOrigin;
import com.wayfarer.core.model.Stage;
import com.wayfarer.core.model.StageFailure;
import com.wayfarer.core.model.TaskResult;
import com.wayfarer.core.recovery.ErrorRecovery;
import com.wayfarer.core.recovery.StateInvariantException;
import com.wayfarer.core.recovery.StateValidator;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes the stage machine: one handler per stage, fixed or conditional edges between
 * stages, and a fixed routing priority after every handler.
 * <p>
 * After a handler returns, a pending {@link StageFailure} goes to {@link ErrorRecovery};
 * otherwise a request for human input goes to the {@link InterruptionController}, which
 * suspends the run before the stage normal routing would have chosen; otherwise the
 * handler's own edge is followed. The run returns at {@link Stage#COMPLETE},
 * {@link Stage#ERROR} or {@link Stage#INTERRUPTED}.
 * <pre>
 *   START -> [analyze_query] -> QUERY_ANALYZED -> [research_destination] -> DESTINATION_RESEARCHED
 *   START -> [analyze_query] -> DESTINATION_RESEARCHED            (destination already known)
 *   DESTINATION_RESEARCHED -> [parallel_search] -> PARALLEL_SEARCH_COMPLETED
 *         -> [plan_activities] -> ACTIVITIES_PLANNED -> [manage_budget] -> BUDGET_MANAGED
 *         -> [finalize_plan] -> COMPLETE
 * </pre>
 */
public class StageGraph {

    private static final Logger log = LoggerFactory.getLogger(StageGraph.class);

    private final Map<Stage, Node> nodes;
    private final Map<Stage, Route> routes;
    private final StateValidator validator;
    private final ErrorRecovery recovery;
    private final InterruptionController interruptions;
    private final WayfarerMetrics metrics;
    private final int maxSteps;

    private StageGraph(Builder builder) {
        this.nodes = new EnumMap<>(builder.nodes);
        this.routes = new EnumMap<>(builder.routes);
        this.validator = builder.validator;
        this.recovery = builder.recovery;
        this.interruptions = builder.interruptions;
        this.metrics = builder.metrics;
        this.maxSteps = builder.maxSteps;
    }

    public static Builder builder(StateValidator validator, ErrorRecovery recovery,
                                  InterruptionController interruptions) {
        return new Builder(validator, recovery, interruptions);
    }

    /**
     * Advances {@code state} until it completes, fails, or is suspended for input.
     */
    public PlanningState run(PlanningState state) {
        Objects.requireNonNull(state, "state");
        PlanningState current = state;
        int steps = 0;

        while (!current.currentStage().haltsExecution()) {
            if (steps >= maxSteps) {
                return abort(current, "step limit of " + maxSteps + " reached at " + current.currentStage());
            }
            steps++;
            Stage from = current.currentStage();
            Node node = nodes.get(from);
            MdcContext.setStage(current.runId(), from.name());
            if (node == null) {
                current = fail(current.withFailure(
                        StageFailure.of(from, FailureOrigin.STATE, "no handler registered for " + from)));
                continue;
            }

            log.info("Running {} from {}", node.name(), from);
            long startMs = System.currentTimeMillis();
            PlanningState after = invoke(node, from, current);
            if (metrics != null) {
                metrics.recordStageDuration(from.name(), System.currentTimeMillis() - startMs);
            }
            current = advance(from, after);
        }

        log.info("Run {} halted at {}", current.runId(), current.currentStage());
        return current;
    }

    private PlanningState invoke(Node node, Stage from, PlanningState state) {
        try {
            validator.validate(from, state);
            PlanningState result = node.handler().apply(state);
            if (result == null) {
                return state.withFailure(StageFailure.of(from, FailureOrigin.HANDLER,
                        node.name() + " returned no state"));
            }
            return result;
        } catch (StateInvariantException e) {
            log.error("State invariant violated at {}: {}", from, e.getMessage());
            return state.withFailure(StageFailure.of(from, FailureOrigin.STATE, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("{} failed at {}: {}", node.name(), from, e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return state.withFailure(StageFailure.of(from, FailureOrigin.CAPABILITY, message));
        }
    }

    private PlanningState advance(Stage from, PlanningState after) {
        if (after.hasFailure()) {
            return fail(after);
        }
        Stage next = nextStage(from, after);
        if (next == null) {
            return fail(after.withFailure(StageFailure.of(from, FailureOrigin.STATE, "no route from " + from)));
        }
        if (!next.haltsExecution() && interruptions.needsInput(after)) {
            return interruptions.suspend(after, next);
        }
        return after
                .recordHistory(ConversationRecord.workflow(from + " -> " + next))
                .updateStage(next);
    }

    /**
     * Records the pending failure under its stage's name and hands the state to recovery,
     * which drops the record again when the stage is retried.
     */
    private PlanningState fail(PlanningState state) {
        StageFailure failure = state.failure();
        return recovery.recover(state.addTaskResult(failure.stage().name(),
                TaskResult.failure(failure.origin() + ": " + failure.message())));
    }

    private Stage nextStage(Stage from, PlanningState state) {
        Route route = routes.get(from);
        if (route == null) return null;
        if (route.router() == null) return route.target();
        String key = route.router().route(state);
        Stage target = route.destinations().get(key);
        if (target == null) {
            log.error("Router for {} returned unknown key '{}'", from, key);
        }
        return target;
    }

    private PlanningState abort(PlanningState state, String reason) {
        log.error("Aborting run {}: {}", state.runId(), reason);
        return state.toBuilder()
                .plan(state.plan().withAlert("workflow: " + reason))
                .build()
                .addAlert("Run ended: " + reason)
                .recordHistory(ConversationRecord.workflow(state.currentStage() + " -> " + Stage.ERROR))
                .updateStage(Stage.ERROR);
    }

    public boolean hasHandler(Stage stage) {
        return nodes.containsKey(stage);
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    private record Node(String name, StageHandler handler) {}

    private record Route(Stage target, Router router, Map<String, Stage> destinations) {}

    /**
     * Collects handlers and edges; {@link #build()} validates them.
     */
    public static final class Builder {

        private final Map<Stage, Node> nodes = new EnumMap<>(Stage.class);
        private final Map<Stage, Route> routes = new EnumMap<>(Stage.class);
        private final Map<Stage, Integer> routeCounts = new EnumMap<>(Stage.class);
        private final StateValidator validator;
        private final ErrorRecovery recovery;
        private final InterruptionController interruptions;
        private WayfarerMetrics metrics;
        private int maxSteps = 100;

        private Builder(StateValidator validator, ErrorRecovery recovery, InterruptionController interruptions) {
            this.validator = Objects.requireNonNull(validator, "validator");
            this.recovery = Objects.requireNonNull(recovery, "recovery");
            this.interruptions = Objects.requireNonNull(interruptions, "interruptions");
        }

        public Builder addNode(Stage stage, String name, StageHandler handler) {
            if (stage.haltsExecution()) {
                throw new GraphDefinitionException("Cannot register a handler for " + stage);
            }
            if (nodes.putIfAbsent(stage, new Node(name, handler)) != null) {
                throw new GraphDefinitionException("Handler already registered for " + stage);
            }
            return this;
        }

        public Builder addEdge(Stage from, Stage to) {
            Objects.requireNonNull(to, "to");
            routes.put(from, new Route(to, null, Map.of()));
            routeCounts.merge(from, 1, Integer::sum);
            return this;
        }

        public Builder addConditionalEdges(Stage from, Router router, Map<String, Stage> destinations) {
            if (destinations == null || destinations.isEmpty()) {
                throw new GraphDefinitionException("Conditional edges from " + from + " have no destinations");
            }
            routes.put(from, new Route(null, router, new LinkedHashMap<>(destinations)));
            routeCounts.merge(from, 1, Integer::sum);
            return this;
        }

        public Builder metrics(WayfarerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        /**
         * @throws GraphDefinitionException if the definition cannot run to completion
         */
        public StageGraph build() {
            if (!nodes.containsKey(Stage.START)) {
                throw new GraphDefinitionException("No handler registered for " + Stage.START);
            }
            if (maxSteps < 1) {
                throw new GraphDefinitionException("maxSteps must be at least 1, got " + maxSteps);
            }
            for (Stage stage : nodes.keySet()) {
                int count = routeCounts.getOrDefault(stage, 0);
                if (count != 1) {
                    throw new GraphDefinitionException(stage + " must have exactly one outgoing route, has " + count);
                }
            }
            for (var entry : routes.entrySet()) {
                if (!nodes.containsKey(entry.getKey())) {
                    throw new GraphDefinitionException("Route from " + entry.getKey() + " which has no handler");
                }
                Route route = entry.getValue();
                Collection<Stage> targets = route.router() == null
                        ? List.of(route.target()) : route.destinations().values();
                for (Stage target : targets) {
                    if (target == null || !(target.isTerminal() || nodes.containsKey(target))) {
                        throw new GraphDefinitionException("Route from " + entry.getKey()
                                + " leads to " + target + " which has no handler");
                    }
                }
            }
            return new StageGraph(this);
        }
    }
}
