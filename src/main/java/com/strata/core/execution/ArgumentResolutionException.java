package com.strata.core.execution;

/**
 * An argument reference could not be resolved against the recorded task outputs.
 */
public class ArgumentResolutionException extends RuntimeException {

    public ArgumentResolutionException(String message) {
        super(message);
    }
}
