package com.strata.core.command;

/**
 * Raised when a command fails structural validation and is refused by the {@link CommandQueue}.
 */
public class InvalidCommandException extends RuntimeException {

    public InvalidCommandException(String message) {
        super(message);
    }

    public InvalidCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
