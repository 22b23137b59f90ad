package com.wayfarer.dispatch.cli;

import com.wayfarer.core.persistence.SnapshotStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: wayfarer history
 * <p>
 * Lists stored runs with their current stage.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List stored runs")
@Component
public class HistoryCommand implements Runnable {

    private final SnapshotStore snapshotStore;

    public HistoryCommand(SnapshotStore snapshotStore) {
        this.snapshotStore = snapshotStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var runIds = snapshotStore.listRunIds();
        if (runIds.isEmpty()) {
            ConsoleOutput.info("No runs stored.");
            return;
        }
        System.out.printf("  %-16s %-26s %s%n", "RUN", "STAGE", "REQUEST");
        System.out.println("  " + "-".repeat(64));
        for (String runId : runIds) {
            snapshotStore.load(runId).ifPresent(state ->
                    System.out.printf("  %-16s %-26s %s%n", runId, state.currentStage(),
                            ConsoleOutput.truncate(state.query().requestText(), 40)));
        }
    }
}
