package com.strata.core.command;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.List;

/**
 * Resume at the next layer boundary.
 *
 * @param reason optional note for the log
 */
public record ContinueCommand(String reason) implements Command {

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public ContinueCommand {
    }

    public ContinueCommand() {
        this(null);
    }

    @Override
    public CommandType type() {
        return CommandType.CONTINUE;
    }

    @Override
    public List<String> violations() {
        return List.of();
    }
}
