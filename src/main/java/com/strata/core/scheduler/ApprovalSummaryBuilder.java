package com.strata.core.scheduler;

import com.strata.core.model.Task;
import com.strata.core.model.TaskResult;
import com.strata.core.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain-text summary shown to the approver when a layer pauses for approval.
 */
@Component
public class ApprovalSummaryBuilder {

    private static final int RECENT_RESULTS = 3;
    private static final int PREVIEW_LIMIT = 5;

    /**
     * @param layerIndex   the layer that just ran
     * @param layerTasks   tasks of that layer
     * @param results      all results so far, in completion order
     * @param nextLayer    tasks eligible next, empty when this was the final layer
     */
    public String build(int layerIndex, List<Task> layerTasks, List<TaskResult> results, List<Task> nextLayer) {
        long completed = results.stream().filter(r -> r.status() == TaskStatus.SUCCESS).count();
        long failed = results.stream().filter(r -> r.status() == TaskStatus.ERROR).count();
        Map<String, TaskResult> byId = new HashMap<>();
        results.forEach(r -> byId.put(r.taskId(), r));

        List<String> lines = new ArrayList<>();
        lines.add("=== Workflow Approval Checkpoint ===");
        lines.add("Layer " + layerIndex + " completed");
        lines.add("");
        lines.add("## Execution Summary");
        lines.add("Tasks executed in this layer: " + layerTasks.size());
        lines.add("Total tasks completed: " + completed);
        lines.add("Total tasks failed: " + failed);
        lines.add("Current workflow status: " + (failed == 0 ? "All tasks successful" : "Some tasks have errors"));
        lines.add("");
        lines.add("## Recent Task Results");
        for (TaskResult result : results.subList(Math.max(0, results.size() - RECENT_RESULTS), results.size())) {
            lines.add("  - " + result.taskId() + ": " + result.status().wireName()
                    + (result.elapsedMs() != null ? " (" + result.elapsedMs() + "ms)" : ""));
        }
        lines.add("");
        lines.add("## Layer " + layerIndex + " Task Details");
        for (Task task : layerTasks) {
            TaskResult result = byId.get(task.id());
            lines.add("  - Task ID: " + task.id());
            lines.add("    Tool: " + task.displayTool());
            lines.add("    Dependencies: " + task.dependsOn().size());
            lines.add("    Status: " + (result != null ? result.status().wireName() : "unknown"));
        }
        lines.add("");

        if (!nextLayer.isEmpty()) {
            lines.add("## Next Layer Preview");
            lines.add("The next layer contains " + nextLayer.size() + " task(s):");
            for (Task task : nextLayer.subList(0, Math.min(PREVIEW_LIMIT, nextLayer.size()))) {
                lines.add("  - Task ID: " + task.id());
                lines.add("    Tool: " + task.displayTool());
                lines.add("    Dependencies: " + (task.dependsOn().isEmpty() ? "none" : String.join(", ", task.dependsOn())));
            }
            if (nextLayer.size() > PREVIEW_LIMIT) {
                lines.add("  ... and " + (nextLayer.size() - PREVIEW_LIMIT) + " more tasks");
            }
            lines.add("");
            lines.add("## Approval Request");
            lines.add("The workflow is ready to proceed to layer " + (layerIndex + 1) + ".");
            lines.add("Approve to continue execution? [Y/N]");
        } else {
            lines.add("## Final Layer Reached");
            lines.add("This was the final layer of the workflow.");
            lines.add("Approve to complete the workflow? [Y/N]");
        }
        return String.join("\n", lines);
    }
}
