package com.strata.dispatch.cli;

import com.strata.core.engine.WorkflowEngine;
import com.strata.core.scheduler.StepOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: strata resume &lt;workflowId&gt;
 * <p>
 * Continues a stored workflow from its latest checkpoint, or from the one given
 * with {@code --checkpoint}.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume a workflow from its checkpoint")
@Component
public class ResumeCommand implements Runnable {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    @Option(names = {"--checkpoint", "-c"}, description = "Checkpoint to resume from (default: latest)")
    private String checkpointId;

    @Option(names = {"--yes", "-y"}, description = "Approve every checkpoint without prompting")
    private boolean autoApprove;

    private final WorkflowEngine engine;

    public ResumeCommand(WorkflowEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            StepOutcome outcome;
            if (checkpointId != null) {
                ConsoleOutput.info("Resuming workflow " + workflowId + " from checkpoint " + checkpointId);
                outcome = engine.resume(checkpointId);
                if (!outcome.workflowId().equals(workflowId)) {
                    ConsoleOutput.warn("Checkpoint " + checkpointId + " belongs to workflow " + outcome.workflowId());
                }
            } else {
                ConsoleOutput.info("Resuming workflow " + workflowId);
                outcome = engine.continueWorkflow(workflowId);
            }
            outcome = new ApprovalPrompt(engine, autoApprove).drive(outcome);
            if (!outcome.layerResults().isEmpty()) {
                ConsoleOutput.layer(outcome.layerIndex(), outcome.layerResults());
            }
            ConsoleOutput.outcome(outcome);
        } catch (Exception e) {
            ConsoleOutput.error("Resume failed: " + RunCommand.rootCauseMessage(e));
        }
    }
}
