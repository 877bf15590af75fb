package com.strata.core.command;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.ArrayList;
import java.util.List;

/**
 * Human answer to a pending approval. {@code approved=false} aborts the workflow.
 *
 * @param checkpointId checkpoint the approval refers to
 * @param approved     whether execution may proceed
 * @param feedback     optional free text, recorded with the decision
 */
public record ApprovalResponseCommand(String checkpointId, Boolean approved, String feedback) implements Command {

    @JsonCreator
    public ApprovalResponseCommand {
    }

    public ApprovalResponseCommand(String checkpointId, boolean approved) {
        this(checkpointId, approved, null);
    }

    /** Null-safe view of {@code approved}. */
    public boolean granted() {
        return Boolean.TRUE.equals(approved);
    }

    @Override
    public CommandType type() {
        return CommandType.APPROVAL_RESPONSE;
    }

    @Override
    public List<String> violations() {
        var violations = new ArrayList<String>();
        if (checkpointId == null || checkpointId.isBlank()) {
            violations.add("approval_response requires a checkpointId");
        }
        if (approved == null) {
            violations.add("approval_response requires approved");
        }
        return violations;
    }
}
