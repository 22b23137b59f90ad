package com.wayfarer.dispatch.cli;

import com.wayfarer.core.engine.PlanningEngine;
import com.wayfarer.core.engine.RunResult;
import com.wayfarer.core.interrupt.HumanInput;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: wayfarer resume &lt;run-id&gt; "&lt;answer&gt;"
 * <p>
 * Answers the question a suspended run is waiting on and continues planning. Exits with 1
 * when the input is rejected or the run fails.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Answer a run that is awaiting input")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Parameters(index = "1", arity = "0..1", description = "Free-form answer")
    private String message;

    @Option(names = {"--destination", "-d"}, description = "Destination to plan for")
    private String destination;

    @Option(names = {"--pref", "-p"}, description = "Preference to set, as key=value (repeatable)")
    private Map<String, String> preferences = new LinkedHashMap<>();

    private final PlanningEngine planningEngine;

    public ResumeCommand(PlanningEngine planningEngine) {
        this.planningEngine = planningEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Resuming run " + runId + "...");

        RunResult result;
        try {
            result = planningEngine.resume(runId, new HumanInput(message, destination, preferences));
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return PlanCommand.EXIT_FAILED;
        } catch (Exception e) {
            ConsoleOutput.error("Resume failed: " + PlanCommand.rootCauseMessage(e));
            return PlanCommand.EXIT_FAILED;
        }
        ConsoleOutput.runResult(result);
        return PlanCommand.exitCode(result);
    }
}
