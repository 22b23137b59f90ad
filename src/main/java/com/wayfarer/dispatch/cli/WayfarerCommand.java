package com.wayfarer.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Wayfarer.
 * Routes to subcommands: plan, resume, status, history.
 */
@Command(
        name = "wayfarer",
        mixinStandardHelpOptions = true,
        version = "Wayfarer 0.1.0",
        description = "Stage-based travel planner",
        subcommands = {
                PlanCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WayfarerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
