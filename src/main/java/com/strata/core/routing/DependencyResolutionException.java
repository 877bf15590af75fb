package com.strata.core.routing;

/**
 * Thrown by {@link DependencyResolver#resolveOrThrow} when an upstream dependency is missing or failed.
 */
public class DependencyResolutionException extends RuntimeException {

    public DependencyResolutionException(String message) {
        super(message);
    }

    public DependencyResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
