package com.strata.core.convert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.core.model.CapabilityInvocation;
import com.strata.core.model.DagStructure;
import com.strata.core.model.InvalidDagException;
import com.strata.core.model.Task;
import com.strata.core.model.TaskCondition;
import com.strata.core.model.ToolInvocation;
import com.strata.mcp.DecisionToolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link StaticStructure} into an executable {@link DagStructure}.
 *
 * <p>Node mapping:
 * <ul>
 *   <li>task: tool task whose arguments are resolved at run time from the node's argument sources</li>
 *   <li>capability: capability task</li>
 *   <li>decision: no task, unless decision tasks are requested; then an {@code internal:decision} task</li>
 *   <li>fork, join: structural only</li>
 * </ul>
 * Sequence and provides edges become dependencies; conditional edges set the target's
 * {@link TaskCondition}; contains edges are ignored. An edge leaving a node that is not a task
 * makes the target depend on the tasks feeding that node, so the children of a fork are
 * parallel siblings and the successor of a join waits for every branch.
 */
@Component
public class StaticStructureConverter {

    private static final Logger log = LoggerFactory.getLogger(StaticStructureConverter.class);

    private final ObjectMapper objectMapper;

    public StaticStructureConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StaticStructureConverter() {
        this(new ObjectMapper());
    }

    public StaticStructure read(String json) {
        try {
            return objectMapper.readerFor(StaticStructure.class)
                    .with(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
                    .readValue(json);
        } catch (JsonProcessingException e) {
            throw new InvalidDagException("Malformed static structure: " + e.getOriginalMessage(), e);
        }
    }

    public DagStructure convert(StaticStructure structure) {
        return convert(structure, ConversionOptions.defaults());
    }

    public DagStructure convert(StaticStructure structure, ConversionOptions options) {
        if (!isValidForDagConversion(structure)) {
            throw new InvalidDagException("Static structure has no executable nodes");
        }
        log.debug("Converting static structure: {} nodes, {} edges",
                structure.nodes().size(), structure.edges().size());

        // Phase 1: nodes to tasks
        Map<String, Task> tasksByNode = new LinkedHashMap<>();
        Map<String, List<String>> forkChildren = new LinkedHashMap<>();
        for (StructureNode node : structure.nodes()) {
            Task task = nodeToTask(node, options);
            if (task != null) {
                tasksByNode.put(node.id(), task);
            }
            if (node.type() == StructureNode.Type.FORK) {
                forkChildren.put(node.id(), new ArrayList<>());
            }
        }

        // Phase 2: edges to dependencies and conditions
        var upstream = new UpstreamTasks(structure, tasksByNode);
        Map<String, Set<String>> dependencies = new HashMap<>();
        Map<String, TaskCondition> conditions = new HashMap<>();
        for (StructureEdge edge : structure.edges()) {
            Task target = tasksByNode.get(edge.to());
            if (target == null || edge.type() == null) {
                continue;
            }
            switch (edge.type()) {
                case SEQUENCE, PROVIDES -> {
                    dependencies.computeIfAbsent(target.id(), k -> new LinkedHashSet<>())
                            .addAll(upstream.of(edge.from()));
                    if (forkChildren.containsKey(edge.from())) {
                        forkChildren.get(edge.from()).add(target.id());
                    }
                }
                case CONDITIONAL -> {
                    if (edge.outcome() == null) {
                        continue;
                    }
                    conditions.put(target.id(), new TaskCondition(edge.from(), edge.outcome()));
                    dependencies.computeIfAbsent(target.id(), k -> new LinkedHashSet<>())
                            .addAll(upstream.of(edge.from()));
                }
                case CONTAINS, UNKNOWN -> {
                    // hierarchy only
                }
            }
        }
        forkChildren.forEach((fork, children) ->
                log.debug("Fork {} fans out to parallel tasks {}", fork, children));

        // Phase 3: apply
        List<Task> tasks = new ArrayList<>();
        for (Task task : tasksByNode.values()) {
            Set<String> deps = new LinkedHashSet<>(dependencies.getOrDefault(task.id(), Set.of()));
            deps.remove(task.id());
            Task converted = task.withDependsOn(new ArrayList<>(deps));
            TaskCondition condition = conditions.get(task.id());
            tasks.add(condition != null ? converted.withCondition(condition) : converted);
        }

        log.debug("Static structure converted: {} tasks, {} with dependencies, {} conditional",
                tasks.size(),
                tasks.stream().filter(t -> !t.dependsOn().isEmpty()).count(),
                tasks.stream().filter(t -> t.condition() != null).count());
        return new DagStructure(tasks);
    }

    private Task nodeToTask(StructureNode node, ConversionOptions options) {
        String taskId = options.taskIdPrefix() + node.id();
        if (node.type() == null) {
            log.warn("Node {} has no type, skipped", node.id());
            return null;
        }
        return switch (node.type()) {
            case TASK -> new Task(taskId, new ToolInvocation(node.tool(), Map.of(), node.arguments()),
                    List.of(), false, null, null);
            case CAPABILITY -> new Task(taskId, new CapabilityInvocation(node.capabilityId(), null, null, Map.of()),
                    List.of(), false, null, null);
            case DECISION -> options.includeDecisionTasks() ? decisionTask(taskId, node) : null;
            case FORK, JOIN -> null;
            case UNKNOWN -> {
                log.warn("Unknown node type in static structure: {}", node.id());
                yield null;
            }
        };
    }

    private static Task decisionTask(String taskId, StructureNode node) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("condition", node.condition());
        arguments.put("decisionNodeId", node.id());
        return new Task(taskId, new ToolInvocation(DecisionToolClient.DECISION_TOOL, arguments),
                List.of(), false, null, null);
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    /**
     * A structure converts to a useful DAG only if it has at least one task or capability node.
     */
    public boolean isValidForDagConversion(StaticStructure structure) {
        return structure != null && structure.nodes().stream().anyMatch(StructureNode::isExecutable);
    }

    /**
     * Tool ids the structure will call, in node order.
     */
    public List<String> getToolsFromStaticStructure(StaticStructure structure) {
        return structure.nodes().stream()
                .filter(n -> n.type() == StructureNode.Type.TASK)
                .map(StructureNode::tool)
                .toList();
    }

    /**
     * Rough layer count for progress display: one layer per executable node when the
     * structure has no fork, otherwise one more than the number of forks.
     */
    public int estimateParallelLayers(StaticStructure structure) {
        long forks = structure.nodes().stream().filter(n -> n.type() == StructureNode.Type.FORK).count();
        if (forks == 0) {
            return (int) structure.nodes().stream().filter(StructureNode::isExecutable).count();
        }
        return (int) Math.max(1, forks + 1);
    }

    /**
     * Task ids reachable backwards from a node through non-task nodes.
     */
    private static final class UpstreamTasks {

        private final Map<String, Task> tasksByNode;
        private final Map<String, List<StructureEdge>> incoming = new HashMap<>();
        private final Map<String, Set<String>> memo = new HashMap<>();

        UpstreamTasks(StaticStructure structure, Map<String, Task> tasksByNode) {
            this.tasksByNode = tasksByNode;
            for (StructureEdge edge : structure.edges()) {
                if (edge.type() == StructureEdge.Type.SEQUENCE
                        || edge.type() == StructureEdge.Type.PROVIDES
                        || edge.type() == StructureEdge.Type.CONDITIONAL) {
                    incoming.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
                }
            }
        }

        Set<String> of(String nodeId) {
            return of(nodeId, new HashSet<>());
        }

        private Set<String> of(String nodeId, Set<String> visiting) {
            Task task = tasksByNode.get(nodeId);
            if (task != null) {
                return Set.of(task.id());
            }
            Set<String> cached = memo.get(nodeId);
            if (cached != null) {
                return cached;
            }
            if (!visiting.add(nodeId)) {
                return Set.of();
            }
            Set<String> sources = new LinkedHashSet<>();
            for (StructureEdge edge : incoming.getOrDefault(nodeId, List.of())) {
                sources.addAll(of(edge.from(), visiting));
            }
            visiting.remove(nodeId);
            memo.put(nodeId, sources);
            return sources;
        }
    }
}
