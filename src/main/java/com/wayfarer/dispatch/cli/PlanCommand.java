package com.wayfarer.dispatch.cli;

import com.wayfarer.core.engine.PlanningEngine;
import com.wayfarer.core.engine.RunResult;
import com.wayfarer.core.events.EventBus;
import com.wayfarer.core.model.RunStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: wayfarer plan "&lt;request&gt;"
 * <p>
 * Runs the planning workflow for a free-form travel request and prints the plan, or
 * the question the run is waiting on. Exits with 1 when planning fails.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Plan a trip from a travel request")
@Component
public class PlanCommand implements Callable<Integer> {

    static final int EXIT_FAILED = 1;

    @Parameters(index = "0", description = "Natural language travel request")
    private String request;

    @Option(names = {"--concurrency", "-c"},
            description = "Maximum number of searches run at once (default: configured value)")
    private Integer concurrency;

    @Option(names = {"--watch", "-w"}, description = "Print workflow events as they happen")
    private boolean watch;

    private final PlanningEngine planningEngine;
    private final EventBus eventBus;

    public PlanCommand(PlanningEngine planningEngine, EventBus eventBus) {
        this.planningEngine = planningEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Planning trip...");

        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::watchEvent) : null;
        RunResult result;
        try {
            result = concurrency != null
                    ? planningEngine.plan(request, concurrency)
                    : planningEngine.plan(request);
        } catch (Exception e) {
            ConsoleOutput.error("Planning failed: " + rootCauseMessage(e));
            return EXIT_FAILED;
        } finally {
            if (subscription != null) subscription.close();
        }
        ConsoleOutput.runResult(result);
        return exitCode(result);
    }

    /**
     * 0 for a completed or suspended run, {@link #EXIT_FAILED} for a run that ended in error.
     */
    static int exitCode(RunResult result) {
        return result.status() == RunStatus.FAILED ? EXIT_FAILED : 0;
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
