package com.strata.dispatch.cli;

import com.strata.core.engine.WorkflowEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: strata cleanup
 * <p>
 * Deletes expired workflow records.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Delete expired workflow records")
@Component
public class CleanupCommand implements Runnable {

    private final WorkflowEngine engine;

    public CleanupCommand(WorkflowEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            int removed = engine.cleanupExpired();
            ConsoleOutput.success("Removed " + removed + " expired workflow record(s).");
        } catch (RuntimeException e) {
            ConsoleOutput.error("Cleanup failed: " + RunCommand.rootCauseMessage(e));
        }
    }
}
