package com.strata.core.scheduler;

/**
 * Raised when tasks remain but none can ever become eligible and at least one of them is
 * not blocked by a failed dependency.
 */
public class CycleDetectedException extends RuntimeException {

    public CycleDetectedException(String message) {
        super(message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
