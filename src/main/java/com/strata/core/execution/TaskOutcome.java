package com.strata.core.execution;

/**
 * What a {@link TaskExecutor} produced: an output, or an error message to be recorded verbatim.
 *
 * @param success   whether the task completed
 * @param output    task output when successful
 * @param error     failure message otherwise
 * @param elapsedMs execution time
 */
public record TaskOutcome(boolean success, Object output, String error, long elapsedMs) {

    public static TaskOutcome success(Object output, long elapsedMs) {
        return new TaskOutcome(true, output, null, elapsedMs);
    }

    public static TaskOutcome failure(String error, long elapsedMs) {
        return new TaskOutcome(false, null, error, elapsedMs);
    }
}
