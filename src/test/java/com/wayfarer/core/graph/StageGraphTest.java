package com.wayfarer.core.graph;

import com.wayfarer.core.interrupt.InterruptionController;
import com.wayfarer.core.model.*;
import com.wayfarer.core.recovery.ErrorRecovery;
import com.wayfarer.core.recovery.StateInvariantException;
import com.wayfarer.core.recovery.StateValidator;
import com.wayfarer.core.state.PlanningState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.wayfarer.core.PlanningFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class StageGraphTest {

    private StateValidator validator;
    private ErrorRecovery recovery;
    private InterruptionController interruptions;

    @BeforeEach
    void setUp() {
        validator = new StateValidator();
        recovery = new ErrorRecovery(3);
        interruptions = new InterruptionController(0.6);
    }

    private StageGraph.Builder builder() {
        return StageGraph.builder(validator, recovery, interruptions);
    }

    private static StageHandler identity() {
        return state -> state;
    }

    @Nested
    @DisplayName("Definition")
    class Definition {

        @Test
        @DisplayName("requires a handler for START")
        void requiresStart() {
            var b = builder()
                    .addNode(Stage.QUERY_ANALYZED, "research", identity())
                    .addEdge(Stage.QUERY_ANALYZED, Stage.COMPLETE);
            assertThrows(GraphDefinitionException.class, b::build);
        }

        @Test
        @DisplayName("requires exactly one route per handler")
        void requiresOneRoute() {
            var missing = builder().addNode(Stage.START, "analyze", identity());
            assertThrows(GraphDefinitionException.class, missing::build);

            var twice = builder()
                    .addNode(Stage.START, "analyze", identity())
                    .addEdge(Stage.START, Stage.COMPLETE)
                    .addEdge(Stage.START, Stage.ERROR);
            assertThrows(GraphDefinitionException.class, twice::build);
        }

        @Test
        @DisplayName("rejects routes to stages without handlers")
        void rejectsDanglingTarget() {
            var b = builder()
                    .addNode(Stage.START, "analyze", identity())
                    .addConditionalEdges(Stage.START, s -> "next",
                            Map.of("next", Stage.QUERY_ANALYZED, "done", Stage.COMPLETE));
            assertThrows(GraphDefinitionException.class, b::build);
        }

        @Test
        @DisplayName("rejects handlers for halting stages and duplicate handlers")
        void rejectsInvalidNodes() {
            assertThrows(GraphDefinitionException.class,
                    () -> builder().addNode(Stage.COMPLETE, "done", identity()));
            assertThrows(GraphDefinitionException.class,
                    () -> builder().addNode(Stage.START, "a", identity()).addNode(Stage.START, "b", identity()));
        }
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("follows edges until a terminal stage and records each transition")
        void followsEdges() {
            StageGraph graph = builder()
                    .addNode(Stage.START, "analyze", identity())
                    .addNode(Stage.DESTINATION_RESEARCHED, "search", identity())
                    .addEdge(Stage.START, Stage.DESTINATION_RESEARCHED)
                    .addEdge(Stage.DESTINATION_RESEARCHED, Stage.COMPLETE)
                    .build();

            PlanningState result = graph.run(state(Stage.START));

            assertEquals(Stage.COMPLETE, result.currentStage());
            assertEquals(2, result.conversationHistory().size());
            assertEquals("START -> DESTINATION_RESEARCHED", result.conversationHistory().get(0).content());
        }

        @Test
        @DisplayName("conditional edges pick the destination named by the router")
        void conditionalEdges() {
            StageGraph graph = builder()
                    .addNode(Stage.START, "analyze", identity())
                    .addNode(Stage.QUERY_ANALYZED, "research", identity())
                    .addConditionalEdges(Stage.START, s -> s.query().hasDestination() ? "done" : "research",
                            Map.of("research", Stage.QUERY_ANALYZED, "done", Stage.COMPLETE))
                    .addEdge(Stage.QUERY_ANALYZED, Stage.COMPLETE)
                    .build();

            PlanningState result = graph.run(state(Stage.START));

            assertEquals(Stage.COMPLETE, result.currentStage());
            assertEquals(1, result.conversationHistory().size());
        }

        @Test
        @DisplayName("a pending failure takes priority over a request for input")
        void failureBeatsInterruption() {
            StageGraph graph = builder()
                    .addNode(Stage.START, "analyze", s -> s.toBuilder()
                            .humanInputRequested(true)
                            .failure(StageFailure.of(Stage.START, FailureOrigin.CAPABILITY, "boom"))
                            .build())
                    .addEdge(Stage.START, Stage.COMPLETE)
                    .maxSteps(10)
                    .build();

            PlanningState result = graph.run(state(Stage.START));

            assertEquals(Stage.ERROR, result.currentStage());
            assertNull(result.interruption());
            assertEquals(3, result.retryCount(Stage.START));
        }

        @Test
        @DisplayName("a request for input suspends before the stage normal routing would pick")
        void interruptionBeatsNormalRouting() {
            StageGraph graph = builder()
                    .addNode(Stage.START, "analyze", s -> s.toBuilder().queryConfidence(0.2).build())
                    .addNode(Stage.DESTINATION_RESEARCHED, "search", identity())
                    .addEdge(Stage.START, Stage.DESTINATION_RESEARCHED)
                    .addEdge(Stage.DESTINATION_RESEARCHED, Stage.COMPLETE)
                    .build();

            PlanningState result = graph.run(state(Stage.START));

            assertEquals(Stage.INTERRUPTED, result.currentStage());
            assertEquals(Stage.DESTINATION_RESEARCHED, result.interruption().resumeStage());
        }

        @Test
        @DisplayName("input requested by the last handler does not block completion")
        void noInterruptionIntoTerminal() {
            StageGraph graph = builder()
                    .addNode(Stage.START, "finish", s -> s.toBuilder().humanInputRequested(true).build())
                    .addEdge(Stage.START, Stage.COMPLETE)
                    .build();

            assertEquals(Stage.COMPLETE, graph.run(state(Stage.START)).currentStage());
        }

        @Test
        @DisplayName("a halted state is returned untouched")
        void haltedStateUntouched() {
            StageGraph graph = builder()
                    .addNode(Stage.START, "analyze", identity())
                    .addEdge(Stage.START, Stage.COMPLETE)
                    .build();
            PlanningState interrupted = state(Stage.INTERRUPTED);

            assertSame(interrupted, graph.run(interrupted));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a handler exception is retried and the run recovers")
        void exceptionRetried() {
            var calls = new AtomicInteger();
            StageGraph graph = builder()
                    .addNode(Stage.START, "flaky", s -> {
                        if (calls.incrementAndGet() == 1) throw new IllegalStateException("provider hiccup");
                        return s;
                    })
                    .addEdge(Stage.START, Stage.COMPLETE)
                    .build();

            PlanningState result = graph.run(state(Stage.START));

            assertEquals(Stage.COMPLETE, result.currentStage());
            assertEquals(2, calls.get());
            assertEquals(1, result.retryCount(Stage.START));
            assertTrue(result.alerts().get(0).contains("provider hiccup"));
        }

        @Test
        @DisplayName("a handler that keeps failing ends the run after three attempts")
        void persistentFailure() {
            var calls = new AtomicInteger();
            StageGraph graph = builder()
                    .addNode(Stage.START, "broken", s -> {
                        calls.incrementAndGet();
                        throw new IllegalStateException("always down");
                    })
                    .addEdge(Stage.START, Stage.COMPLETE)
                    .build();

            PlanningState result = graph.run(state(Stage.START));

            assertEquals(Stage.ERROR, result.currentStage());
            assertEquals(3, calls.get());
            assertTrue(result.plan().alerts().get(0).startsWith("workflow: START failed 3 time(s)"));
            assertFalse(result.taskResults().get(Stage.START.name()).success());
        }

        @Test
        @DisplayName("an invariant violation ends the run without retrying")
        void invariantNotRetried() {
            var calls = new AtomicInteger();
            StageGraph graph = builder()
                    .addNode(Stage.START, "strict", s -> {
                        calls.incrementAndGet();
                        throw new StateInvariantException(Stage.START, "query is corrupt");
                    })
                    .addEdge(Stage.START, Stage.COMPLETE)
                    .build();

            PlanningState result = graph.run(state(Stage.START));

            assertEquals(Stage.ERROR, result.currentStage());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("state validation runs before the handler")
        void validationBeforeHandler() {
            var calls = new AtomicInteger();
            StageGraph graph = builder()
                    .addNode(Stage.START, "analyze", s -> {
                        calls.incrementAndGet();
                        return s;
                    })
                    .addEdge(Stage.START, Stage.COMPLETE)
                    .build();

            PlanningState result = graph.run(
                    PlanningState.initial(RUN_ID, TravelQuery.of(""), 3));

            assertEquals(Stage.ERROR, result.currentStage());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("the step limit stops a run that never halts")
        void stepLimit() {
            StageGraph graph = builder()
                    .addNode(Stage.START, "a", identity())
                    .addNode(Stage.QUERY_ANALYZED, "b", identity())
                    .addEdge(Stage.START, Stage.QUERY_ANALYZED)
                    .addEdge(Stage.QUERY_ANALYZED, Stage.START)
                    .maxSteps(7)
                    .build();

            PlanningState result = graph.run(state(Stage.START));

            assertEquals(Stage.ERROR, result.currentStage());
            assertEquals(7, result.conversationHistory().size() - 1);
            assertTrue(result.plan().alerts().get(0).contains("step limit of 7"));
        }
    }
}
