package com.strata.core.state;

/**
 * Raised when a state update would break a workflow state invariant. The update is not applied.
 */
public class StateInvariantException extends RuntimeException {

    public StateInvariantException(String message) {
        super(message);
    }

    public StateInvariantException(String message, Throwable cause) {
        super(message, cause);
    }
}
