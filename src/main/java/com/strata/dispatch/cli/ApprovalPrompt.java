package com.strata.dispatch.cli;

import com.strata.core.engine.WorkflowEngine;
import com.strata.core.scheduler.StepOutcome;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Answers approval pauses until the workflow completes or aborts.
 * Reads {@code y}/{@code n} answers from standard input unless auto-approval is on;
 * end of input counts as a rejection.
 */
final class ApprovalPrompt {

    private final WorkflowEngine engine;
    private final boolean autoApprove;

    ApprovalPrompt(WorkflowEngine engine, boolean autoApprove) {
        this.engine = engine;
        this.autoApprove = autoApprove;
    }

    StepOutcome drive(StepOutcome outcome) throws IOException {
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        StepOutcome current = outcome;
        while (current.kind() == StepOutcome.Kind.AWAITING_APPROVAL) {
            ConsoleOutput.layer(current.layerIndex(), current.layerResults());
            ConsoleOutput.approvalSummary(current.approvalSummary());

            boolean approved;
            String feedback = null;
            if (autoApprove) {
                ConsoleOutput.info("Auto-approving checkpoint " + current.checkpointId());
                approved = true;
            } else {
                System.out.print("Approve and continue? [y/N] ");
                System.out.flush();
                String answer = in.readLine();
                approved = answer != null && answer.strip().toLowerCase(Locale.ROOT).startsWith("y");
                if (!approved && answer != null) {
                    System.out.print("Feedback (optional): ");
                    System.out.flush();
                    String line = in.readLine();
                    feedback = line == null || line.isBlank() ? null : line.strip();
                }
            }
            current = engine.approve(current.workflowId(), current.checkpointId(), approved, feedback);
        }
        return current;
    }
}
