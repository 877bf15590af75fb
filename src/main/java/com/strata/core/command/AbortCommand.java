package com.strata.core.command;

import java.util.ArrayList;
import java.util.List;

/**
 * Stop the workflow at the next layer boundary and return the results gathered so far.
 *
 * @param reason why the workflow is stopped
 */
public record AbortCommand(String reason) implements Command {

    @Override
    public CommandType type() {
        return CommandType.ABORT;
    }

    @Override
    public List<String> violations() {
        var violations = new ArrayList<String>();
        if (reason == null) {
            violations.add("abort requires a reason");
        }
        return violations;
    }
}
