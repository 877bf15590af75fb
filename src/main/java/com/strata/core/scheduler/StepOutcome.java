package com.strata.core.scheduler;

import com.strata.core.model.TaskResult;

import java.util.List;

/**
 * What one {@link WorkflowScheduler#step()} produced.
 *
 * @param kind            paused, completed, aborted or awaiting approval
 * @param workflowId      the workflow
 * @param layerIndex      layer that ran in this step, or the last one that ran
 * @param layerResults    results of the layer that ran in this step (empty if none ran)
 * @param results         every result accumulated so far
 * @param checkpointId    checkpoint saved after the layer (nullable)
 * @param reason          abort reason (nullable)
 * @param approvalSummary text shown to the approver (nullable)
 */
public record StepOutcome(
    Kind kind,
    String workflowId,
    int layerIndex,
    List<TaskResult> layerResults,
    List<TaskResult> results,
    String checkpointId,
    String reason,
    String approvalSummary
) {

    public enum Kind {
        PAUSED,
        COMPLETED,
        ABORTED,
        AWAITING_APPROVAL;

        public boolean isTerminal() {
            return this == COMPLETED || this == ABORTED;
        }
    }

    public StepOutcome {
        layerResults = layerResults == null ? List.of() : List.copyOf(layerResults);
        results = results == null ? List.of() : List.copyOf(results);
    }

    static StepOutcome paused(String workflowId, int layer, List<TaskResult> layerResults,
                              List<TaskResult> results, String checkpointId) {
        return new StepOutcome(Kind.PAUSED, workflowId, layer, layerResults, results, checkpointId, null, null);
    }

    static StepOutcome completed(String workflowId, int layer, List<TaskResult> layerResults,
                                 List<TaskResult> results, String checkpointId) {
        return new StepOutcome(Kind.COMPLETED, workflowId, layer, layerResults, results, checkpointId, null, null);
    }

    static StepOutcome aborted(String workflowId, int layer, List<TaskResult> layerResults,
                               List<TaskResult> results, String checkpointId, String reason) {
        return new StepOutcome(Kind.ABORTED, workflowId, layer, layerResults, results, checkpointId, reason, null);
    }

    static StepOutcome awaitingApproval(String workflowId, int layer, List<TaskResult> layerResults,
                                        List<TaskResult> results, String checkpointId, String summary) {
        return new StepOutcome(Kind.AWAITING_APPROVAL, workflowId, layer, layerResults, results, checkpointId, null, summary);
    }

    public boolean isTerminal() {
        return kind.isTerminal();
    }
}
