package com.strata.core.engine;

import com.strata.core.config.ApprovalMode;

import java.util.Map;

/**
 * Per-run options for {@link WorkflowEngine#start}.
 *
 * @param intent       what the workflow is for, stored with the workflow record (nullable)
 * @param parameters   run parameters, read by {@code parameter} argument sources
 * @param approvalMode overrides the configured approval mode (nullable)
 * @param context      initial shared context of the workflow state
 */
public record WorkflowRunOptions(
    String intent,
    Map<String, Object> parameters,
    ApprovalMode approvalMode,
    Map<String, Object> context
) {

    public WorkflowRunOptions {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static WorkflowRunOptions defaults() {
        return new WorkflowRunOptions(null, Map.of(), null, Map.of());
    }

    public WorkflowRunOptions withIntent(String newIntent) {
        return new WorkflowRunOptions(newIntent, parameters, approvalMode, context);
    }

    public WorkflowRunOptions withApprovalMode(ApprovalMode mode) {
        return new WorkflowRunOptions(intent, parameters, mode, context);
    }

    public WorkflowRunOptions withParameters(Map<String, Object> newParameters) {
        return new WorkflowRunOptions(intent, newParameters, approvalMode, context);
    }
}
