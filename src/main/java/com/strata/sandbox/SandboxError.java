package com.strata.sandbox;

/**
 * Classified failure of sandboxed code.
 *
 * @param type    TimeoutError, MemoryError, PermissionError, SyntaxError or RuntimeError
 * @param message sanitized message
 */
public record SandboxError(String type, String message) {

    public static final String TIMEOUT = "TimeoutError";
    public static final String MEMORY = "MemoryError";
    public static final String PERMISSION = "PermissionError";
    public static final String SYNTAX = "SyntaxError";
    public static final String RUNTIME = "RuntimeError";
}
