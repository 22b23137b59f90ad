package com.wayfarer.dispatch.cli;

import com.wayfarer.core.engine.PlanningEngine;
import com.wayfarer.core.model.ConversationRecord;
import com.wayfarer.core.model.TaskResult;
import com.wayfarer.core.state.PlanningState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.TreeMap;

/**
 * CLI command: wayfarer status &lt;run-id&gt;
 * <p>
 * Shows the stored snapshot of a run: stage, task results, alerts and optionally the
 * conversation history.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the state of a run")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--history"}, description = "Include the conversation history")
    private boolean history;

    private final PlanningEngine planningEngine;

    public StatusCommand(PlanningEngine planningEngine) {
        this.planningEngine = planningEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var stateOpt = planningEngine.status(runId);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return;
        }
        PlanningState state = stateOpt.get();

        System.out.println();
        System.out.println("RUN " + state.runId());
        System.out.println("Request: " + state.query().requestText());
        switch (state.currentStage()) {
            case COMPLETE -> ConsoleOutput.success("Stage: " + state.currentStage());
            case ERROR -> ConsoleOutput.error("Stage: " + state.currentStage());
            default -> ConsoleOutput.info("Stage: " + state.currentStage());
        }
        if (state.interruption() != null) {
            ConsoleOutput.info("Waiting since " + state.interruption().requestedAt() + ": "
                    + state.interruption().reason());
        }

        if (!state.taskResults().isEmpty()) {
            System.out.println();
            System.out.printf("  %-22s %-8s %s%n", "TASK", "RESULT", "SUMMARY");
            System.out.println("  " + "-".repeat(64));
            for (Map.Entry<String, TaskResult> e : new TreeMap<>(state.taskResults()).entrySet()) {
                System.out.printf("  %-22s %-8s %s%n", e.getKey(), e.getValue().success() ? "ok" : "failed",
                        ConsoleOutput.truncate(e.getValue().summary(), 40));
            }
        }

        if (!state.retryCounts().isEmpty()) {
            System.out.println();
            state.retryCounts().forEach((stage, count) ->
                    ConsoleOutput.warn(stage + " failed " + count + " time(s)"));
        }

        if (!state.alerts().isEmpty()) {
            ConsoleOutput.section("Workflow alerts (" + state.alerts().size() + ")");
            state.alerts().forEach(ConsoleOutput::warn);
        }
        if (!state.plan().alerts().isEmpty()) {
            ConsoleOutput.section("Plan alerts (" + state.plan().alerts().size() + ")");
            state.plan().alerts().forEach(ConsoleOutput::warn);
        }

        if (history) {
            ConsoleOutput.section("History");
            for (ConversationRecord r : state.conversationHistory()) {
                System.out.printf("  %s %-8s %s%n", r.timestamp(), r.role(), r.content());
            }
        }
    }
}
