package com.strata.core.model;

/**
 * Thrown when a task graph is structurally invalid: duplicate task ids,
 * dependencies on unknown tasks, or a task payload missing its required fields.
 */
public class InvalidDagException extends RuntimeException {

    public InvalidDagException(String message) {
        super(message);
    }

    public InvalidDagException(String message, Throwable cause) {
        super(message, cause);
    }
}
