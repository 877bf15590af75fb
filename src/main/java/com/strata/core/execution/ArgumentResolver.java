package com.strata.core.execution;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.core.model.ArgumentSource;
import com.strata.core.model.TaskResult;
import com.strata.core.model.TaskStatus;
import com.strata.core.model.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Computes the arguments of a tool call at run time.
 * <p>
 * Static argument sources are resolved first:
 * <ul>
 *   <li>{@code literal}: the stored value</li>
 *   <li>{@code parameter}: a run parameter</li>
 *   <li>{@code reference}: a path into an earlier task's output, e.g. {@code n1.items[0].name};
 *       the root names a task id, or a source node id under the default {@value #TASK_ID_PREFIX} prefix</li>
 * </ul>
 * A static source that cannot be resolved is left out. Explicit arguments are applied on top;
 * string values of the form {@code $OUTPUT[taskId]} or {@code $OUTPUT[taskId].path} are replaced
 * by the referenced output and must resolve.
 */
@Component
public class ArgumentResolver {

    private static final Logger log = LoggerFactory.getLogger(ArgumentResolver.class);

    public static final String TASK_ID_PREFIX = "task_";

    private static final Pattern OUTPUT_REFERENCE = Pattern.compile("^\\$OUTPUT\\[([^\\]]+)](.*)$");

    private final ObjectMapper objectMapper;

    @Autowired
    public ArgumentResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ArgumentResolver() {
        this(new ObjectMapper());
    }

    public Map<String, Object> resolve(ToolInvocation invocation,
                                       Map<String, TaskResult> dependencies,
                                       ExecutionContext context) {
        Map<String, TaskResult> visible = new LinkedHashMap<>(context.priorResults());
        visible.putAll(dependencies);

        Map<String, Object> resolved = new LinkedHashMap<>(
                resolveStatic(invocation.staticArguments(), context.parameters(), visible));
        invocation.arguments().forEach((key, value) -> resolved.put(key, substituteOutputs(value, visible)));
        return resolved;
    }

    public Map<String, Object> resolveStatic(Map<String, ArgumentSource> sources,
                                             Map<String, Object> parameters,
                                             Map<String, TaskResult> results) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (var entry : sources.entrySet()) {
            Object value = resolveSource(entry.getValue(), parameters, results);
            if (value != null) {
                resolved.put(entry.getKey(), value);
            } else {
                log.debug("Static argument '{}' ({}) not resolved", entry.getKey(), entry.getValue().type());
            }
        }
        return resolved;
    }

    private Object resolveSource(ArgumentSource source, Map<String, Object> parameters, Map<String, TaskResult> results) {
        if (source.type() == null) {
            return null;
        }
        return switch (source.type()) {
            case LITERAL -> source.value();
            case PARAMETER -> source.parameterName() == null ? null : parameters.get(source.parameterName());
            case REFERENCE -> resolveReference(source.expression(), parameters, results);
        };
    }

    private Object resolveReference(String expression, Map<String, Object> parameters, Map<String, TaskResult> results) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        List<String> parts = parsePath(expression);
        if (parts.isEmpty()) {
            return null;
        }
        String root = parts.get(0);
        List<String> path = parts.subList(1, parts.size());

        TaskResult result = results.containsKey(root) ? results.get(root) : results.get(TASK_ID_PREFIX + root);
        if (result != null && result.status() == TaskStatus.SUCCESS && result.output() != null) {
            return navigate(result.output(), path);
        }
        if (parameters.containsKey(root)) {
            return navigate(parameters.get(root), path);
        }
        return null;
    }

    Object substituteOutputs(Object value, Map<String, TaskResult> results) {
        if (value instanceof String text) {
            Matcher matcher = OUTPUT_REFERENCE.matcher(text.strip());
            if (!matcher.matches()) {
                return value;
            }
            String taskId = matcher.group(1).strip();
            TaskResult result = results.get(taskId);
            if (result == null || result.status() != TaskStatus.SUCCESS) {
                throw new ArgumentResolutionException(
                        "Cannot resolve " + text + ": task " + taskId + " has no successful output");
            }
            String rest = matcher.group(2);
            List<String> path = rest.isEmpty() ? List.of() : parsePath(rest);
            return navigate(result.output(), path);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> substituted = new LinkedHashMap<>();
            map.forEach((k, v) -> substituted.put(k, substituteOutputs(v, results)));
            return substituted;
        }
        if (value instanceof List<?> list) {
            List<Object> substituted = new ArrayList<>(list.size());
            list.forEach(v -> substituted.add(substituteOutputs(v, results)));
            return substituted;
        }
        return value;
    }

    // ── Paths ───────────────────────────────────────────────────────────

    /**
     * Splits {@code a.b[0]['c']} into {@code [a, b, 0, c]}. Surrounding backticks are ignored.
     */
    static List<String> parsePath(String expression) {
        String cleaned = expression.strip();
        if (cleaned.length() >= 2 && cleaned.startsWith("`") && cleaned.endsWith("`")) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        List<String> parts = new ArrayList<>();
        var current = new StringBuilder();
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (c == '.' || c == '[' || c == ']') {
                if (!current.isEmpty()) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else if (c != '\'' && c != '"') {
                current.append(c);
            }
        }
        if (!current.isEmpty()) {
            parts.add(current.toString());
        }
        return parts;
    }

    /**
     * Reads {@code path} out of {@code root} through its JSON tree. Missing and null nodes yield {@code null};
     * an empty path returns {@code root} unchanged.
     */
    Object navigate(Object root, List<String> path) {
        if (path.isEmpty() || root == null) {
            return root;
        }
        JsonNode node;
        try {
            node = objectMapper.valueToTree(root).at(toPointer(path));
        } catch (IllegalArgumentException e) {
            log.debug("Output of type {} cannot be navigated: {}", root.getClass().getSimpleName(), e.getMessage());
            return null;
        }
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    static JsonPointer toPointer(List<String> path) {
        return JsonPointer.compile(path.stream()
                .map(part -> "/" + part.replace("~", "~0").replace("/", "~1"))
                .collect(Collectors.joining()));
    }
}
