package com.strata.mcp;

import java.util.Map;

/**
 * Client for one tool server. Calls are addressed as {@code server:action}; the
 * {@link ToolClientRegistry} routes on {@link #server()} and hands the action here.
 */
public interface ToolClient {

    String server();

    /**
     * Invokes {@code action} and returns its raw result.
     *
     * @throws ToolCallException if the server reports a failure
     */
    Object call(String action, Map<String, Object> arguments);
}
