package com.strata.sandbox;

/**
 * Outcome of a {@link SandboxExecutor} call.
 *
 * @param success   whether the code completed normally
 * @param result    the value the code returned, on success
 * @param error     classified failure, otherwise
 * @param elapsedMs wall-clock time spent
 */
public record SandboxResult(boolean success, Object result, SandboxError error, long elapsedMs) {

    public static SandboxResult ok(Object result, long elapsedMs) {
        return new SandboxResult(true, result, null, elapsedMs);
    }

    public static SandboxResult failed(String type, String message, long elapsedMs) {
        return new SandboxResult(false, null, new SandboxError(type, message), elapsedMs);
    }
}
