package com.strata.core.scheduler;

import com.strata.core.model.DagStructure;
import com.strata.core.model.Task;
import com.strata.core.model.TaskCondition;
import com.strata.core.model.TaskResult;
import com.strata.core.model.TaskStatus;
import com.strata.core.model.ToolInvocation;
import com.strata.core.state.Decision;
import com.strata.mcp.DecisionToolClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Kahn-style layering, one layer at a time.
 * <p>
 * A task is settled once it has a result or was skipped. An unsettled task is eligible when
 * every dependency is settled without error and its condition, if any, is satisfied. A
 * condition names a decision node; it is satisfied by the latest recorded decision for
 * that node, mismatches skip the task, and a node that no decision task of the DAG
 * evaluates leaves the task unconditional. A task is blocked when a dependency (or the
 * decision task its condition waits for) failed with {@code error} or is itself blocked.
 */
@Component
public class LayerPlanner {

    public LayerPlan plan(DagStructure dag, Map<String, TaskResult> results,
                          Set<String> skipped, List<Decision> decisions) {
        Map<String, String> outcomes = latestOutcomes(decisions);
        Map<String, Task> decisionTasks = decisionTasksByNode(dag);

        Set<String> settled = new LinkedHashSet<>(results.keySet());
        settled.addAll(skipped);
        List<String> newlySkipped = new ArrayList<>();

        // Conditions can only be evaluated once their decision is known; skipping a task may
        // settle dependents that are skipped in turn.
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Task task : dag.tasks()) {
                if (settled.contains(task.id()) || task.condition() == null) {
                    continue;
                }
                TaskCondition condition = task.condition();
                Task source = decisionTasks.get(condition.decisionNodeId());
                if (source == null) {
                    continue;
                }
                boolean sourceSkipped = skipped.contains(source.id()) || newlySkipped.contains(source.id());
                String outcome = outcomes.get(condition.decisionNodeId());
                if (sourceSkipped || (outcome != null && !condition.matches(outcome))) {
                    settled.add(task.id());
                    newlySkipped.add(task.id());
                    changed = true;
                }
            }
        }

        Set<String> blocked = blockedTasks(dag, results, settled, decisionTasks);

        List<Task> eligible = new ArrayList<>();
        List<String> waiting = new ArrayList<>();
        for (Task task : dag.tasks()) {
            if (settled.contains(task.id()) || blocked.contains(task.id())) {
                continue;
            }
            if (dependenciesSettled(task, settled) && conditionReady(task, decisionTasks, outcomes)) {
                eligible.add(task);
            } else {
                waiting.add(task.id());
            }
        }

        List<String> blockedInOrder = dag.tasks().stream()
                .map(Task::id)
                .filter(blocked::contains)
                .toList();
        return new LayerPlan(eligible, newlySkipped, blockedInOrder, waiting);
    }

    /**
     * Formats the error raised for a layer plan that can make no progress.
     */
    public static String cycleMessage(LayerPlan plan) {
        List<String> remaining = new ArrayList<>(plan.waiting());
        remaining.addAll(plan.blocked());
        return "Circular dependency detected in DAG. Remaining tasks: " + String.join(", ", remaining);
    }

    public static String haltMessage(LayerPlan plan) {
        return "Workflow halted: " + plan.blocked().size() + " task(s) blocked by failed dependencies: "
                + String.join(", ", plan.blocked());
    }

    /**
     * The decision node a decision task evaluates: its {@code decisionNodeId} argument, or
     * its own id when the argument is absent.
     */
    public static Optional<String> decisionNodeOf(Task task) {
        if (!(task.payload() instanceof ToolInvocation invocation)
                || !DecisionToolClient.DECISION_TOOL.equals(invocation.tool())) {
            return Optional.empty();
        }
        Object node = invocation.arguments().get("decisionNodeId");
        return Optional.of(node != null ? node.toString() : task.id());
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private static Map<String, Task> decisionTasksByNode(DagStructure dag) {
        Map<String, Task> byNode = new HashMap<>();
        for (Task task : dag.tasks()) {
            decisionNodeOf(task).ifPresent(node -> byNode.put(node, task));
        }
        return byNode;
    }

    private static Map<String, String> latestOutcomes(List<Decision> decisions) {
        Map<String, String> outcomes = new HashMap<>();
        for (Decision decision : decisions) {
            if (decision.decisionNodeId() != null && decision.outcome() != null) {
                outcomes.put(decision.decisionNodeId(), decision.outcome());
            }
        }
        return outcomes;
    }

    private static boolean dependenciesSettled(Task task, Set<String> settled) {
        return settled.containsAll(task.dependsOn());
    }

    private static boolean conditionReady(Task task, Map<String, Task> decisionTasks, Map<String, String> outcomes) {
        TaskCondition condition = task.condition();
        if (condition == null || !decisionTasks.containsKey(condition.decisionNodeId())) {
            return true;
        }
        String outcome = outcomes.get(condition.decisionNodeId());
        return outcome != null && condition.matches(outcome);
    }

    private static Set<String> blockedTasks(DagStructure dag, Map<String, TaskResult> results,
                                            Set<String> settled, Map<String, Task> decisionTasks) {
        Set<String> failed = new LinkedHashSet<>();
        results.values().stream()
                .filter(r -> r.status() == TaskStatus.ERROR)
                .forEach(r -> failed.add(r.taskId()));

        Set<String> blocked = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Task task : dag.tasks()) {
                if (settled.contains(task.id()) || blocked.contains(task.id())) {
                    continue;
                }
                List<String> upstream = new ArrayList<>(task.dependsOn());
                if (task.condition() != null && decisionTasks.containsKey(task.condition().decisionNodeId())) {
                    upstream.add(decisionTasks.get(task.condition().decisionNodeId()).id());
                }
                for (String dep : upstream) {
                    if (failed.contains(dep) || blocked.contains(dep)) {
                        blocked.add(task.id());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return blocked;
    }
}
