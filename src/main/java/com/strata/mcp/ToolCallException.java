package com.strata.mcp;

/**
 * A tool server reported a failed call, or could not be reached.
 */
public class ToolCallException extends RuntimeException {

    public ToolCallException(String message) {
        super(message);
    }

    public ToolCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
