package com.strata.core.command;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ask for the graph to be extended for a new requirement. Tasks carried by the command are
 * merged as-is; without them the configured replanner proposes the additions.
 *
 * @param newRequirement   what the workflow must now also achieve
 * @param availableContext facts the replanner may use, may be empty
 * @param tasks            optional tasks in DAG wire form
 */
public record ReplanDagCommand(
    String newRequirement,
    Map<String, Object> availableContext,
    List<Map<String, Object>> tasks
) implements Command {

    @JsonCreator
    public ReplanDagCommand {
    }

    public ReplanDagCommand(String newRequirement, Map<String, Object> availableContext) {
        this(newRequirement, availableContext, null);
    }

    public boolean hasTasks() {
        return tasks != null && !tasks.isEmpty();
    }

    @Override
    public CommandType type() {
        return CommandType.REPLAN_DAG;
    }

    @Override
    public List<String> violations() {
        var violations = new ArrayList<String>();
        if (newRequirement == null) {
            violations.add("replan_dag requires newRequirement");
        }
        if (availableContext == null) {
            violations.add("replan_dag requires availableContext");
        }
        return violations;
    }
}
