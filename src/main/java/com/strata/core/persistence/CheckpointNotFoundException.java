package com.strata.core.persistence;

/**
 * Thrown when a checkpoint id does not name a stored checkpoint.
 */
public class CheckpointNotFoundException extends RuntimeException {

    public CheckpointNotFoundException(String message) {
        super(message);
    }

    public CheckpointNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
