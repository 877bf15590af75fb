package com.strata.core.execution;

/**
 * An executor was invoked without a collaborator it cannot work without.
 * Unlike task failures this is not folded into a task result; it aborts the current step.
 */
public class ExecutorConfigurationException extends RuntimeException {

    public ExecutorConfigurationException(String message) {
        super(message);
    }

    public ExecutorConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
