package com.strata.core.execution;

import com.strata.core.model.Task;
import com.strata.core.model.TaskKind;
import com.strata.core.model.TaskResult;
import com.strata.core.model.ToolInvocation;
import com.strata.mcp.ToolCallException;
import com.strata.mcp.ToolClient;
import com.strata.mcp.ToolClientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs {@link TaskKind#MCP_TOOL} tasks by routing {@code server:action} to the registered client.
 */
@Component
public class ToolInvoker implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolInvoker.class);

    private final ToolClientRegistry registry;
    private final ArgumentResolver argumentResolver;

    public ToolInvoker(ToolClientRegistry registry, ArgumentResolver argumentResolver) {
        this.registry = registry;
        this.argumentResolver = argumentResolver;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.MCP_TOOL;
    }

    @Override
    public TaskOutcome execute(Task task, Map<String, TaskResult> dependencies, ExecutionContext context) {
        ToolInvocation invocation = (ToolInvocation) task.payload();
        long start = System.currentTimeMillis();
        try {
            Map<String, Object> arguments = argumentResolver.resolve(invocation, dependencies, context);
            Object output = invoke(invocation.tool(), arguments);
            return TaskOutcome.success(output, System.currentTimeMillis() - start);
        } catch (ToolCallException | ArgumentResolutionException e) {
            return TaskOutcome.failure(e.getMessage(), System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.warn("Tool {} threw unexpectedly for task {}", invocation.tool(), task.id(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return TaskOutcome.failure(message, System.currentTimeMillis() - start);
        }
    }

    /**
     * Calls {@code toolId} ({@code server:action}) with {@code arguments} and returns the raw result.
     *
     * @throws ToolCallException if no client is registered for the server, or the call fails
     */
    public Object invoke(String toolId, Map<String, Object> arguments) {
        int separator = toolId.indexOf(':');
        if (separator <= 0) {
            throw new ToolCallException("Invalid tool id '" + toolId + "', expected server:action");
        }
        String server = toolId.substring(0, separator);
        String action = toolId.substring(separator + 1);
        ToolClient client = registry.find(server)
                .orElseThrow(() -> new ToolCallException("Unknown MCP server: " + server));
        log.debug("Calling {} on server {}", action, server);
        return client.call(action, arguments);
    }
}
