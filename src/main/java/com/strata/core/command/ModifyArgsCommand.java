package com.strata.core.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Merge argument updates into a task that has not started yet.
 *
 * @param taskId  task to modify
 * @param updates argument values that replace existing keys
 */
public record ModifyArgsCommand(String taskId, Map<String, Object> updates) implements Command {

    @Override
    public CommandType type() {
        return CommandType.MODIFY_ARGS;
    }

    @Override
    public List<String> violations() {
        var violations = new ArrayList<String>();
        if (taskId == null || taskId.isBlank()) {
            violations.add("modify_args requires a taskId");
        }
        if (updates == null) {
            violations.add("modify_args requires updates");
        }
        return violations;
    }
}
