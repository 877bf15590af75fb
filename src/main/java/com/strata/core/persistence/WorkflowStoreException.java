package com.strata.core.persistence;

/**
 * Failure of the underlying record or checkpoint storage.
 */
public class WorkflowStoreException extends RuntimeException {

    public WorkflowStoreException(String message) {
        super(message);
    }

    public WorkflowStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
