package com.strata.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Answer to a checkpoint pause.
 *
 * @param checkpointId checkpoint the answer refers to
 * @param decision     continue, roll back to the checkpoint, or continue after modifications
 */
public record CheckpointResponseCommand(String checkpointId, Decision decision) implements Command {

    public enum Decision {
        @JsonProperty("continue") CONTINUE,
        @JsonProperty("rollback") ROLLBACK,
        @JsonProperty("modify") MODIFY
    }

    @Override
    public CommandType type() {
        return CommandType.CHECKPOINT_RESPONSE;
    }

    @Override
    public List<String> violations() {
        var violations = new ArrayList<String>();
        if (checkpointId == null || checkpointId.isBlank()) {
            violations.add("checkpoint_response requires a checkpointId");
        }
        if (decision == null) {
            violations.add("checkpoint_response requires decision continue, rollback or modify");
        }
        return violations;
    }
}
