package com.strata.core.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Add tasks to the running graph.
 *
 * @param tasks       tasks in DAG wire form
 * @param targetLayer layer the caller expects the tasks to join; scheduling still follows dependencies
 */
public record InjectTasksCommand(List<Map<String, Object>> tasks, Integer targetLayer) implements Command {

    @Override
    public CommandType type() {
        return CommandType.INJECT_TASKS;
    }

    @Override
    public List<String> violations() {
        var violations = new ArrayList<String>();
        if (tasks == null) {
            violations.add("inject_tasks requires a tasks array");
        }
        if (targetLayer == null || targetLayer < 0) {
            violations.add("inject_tasks requires a non-negative targetLayer");
        }
        return violations;
    }
}
