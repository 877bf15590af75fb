package com.strata.core.scheduler;

import com.strata.core.model.DagStructure;
import com.strata.core.model.Task;
import com.strata.core.model.TaskCondition;
import com.strata.core.model.TaskResult;
import com.strata.core.model.ToolInvocation;
import com.strata.core.state.Decision;
import com.strata.mcp.DecisionToolClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LayerPlannerTest {

    private final LayerPlanner planner = new LayerPlanner();

    private static Task tool(String id, String... deps) {
        return Task.tool(id, "fs:read", Map.of(), List.of(deps));
    }

    private static Task decision(String id, String node, String... deps) {
        return new Task(id, new ToolInvocation(DecisionToolClient.DECISION_TOOL,
                Map.of("condition", "x", "decisionNodeId", node)), List.of(deps), false, null, null);
    }

    private static Task gated(String id, String node, String outcome, String... deps) {
        return tool(id, deps).withCondition(new TaskCondition(node, outcome));
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    private static Map<String, TaskResult> ok(String... ids) {
        var results = new LinkedHashMap<String, TaskResult>();
        for (String id : ids) {
            results.put(id, TaskResult.success(id, "out", 1));
        }
        return results;
    }

    // -- Dependencies ---------------------------------------------------------

    @Nested
    @DisplayName("Dependencies")
    class Dependencies {

        @Test
        @DisplayName("roots are eligible first, dependents wait")
        void roots() {
            var dag = DagStructure.of(tool("a"), tool("b"), tool("c", "a", "b"));

            LayerPlan plan = planner.plan(dag, Map.of(), Set.of(), List.of());

            assertEquals(List.of("a", "b"), ids(plan.eligible()));
            assertEquals(List.of("c"), plan.waiting());
            assertFalse(plan.isComplete());
        }

        @Test
        @DisplayName("a task becomes eligible once every dependency settled")
        void settledDependencies() {
            var dag = DagStructure.of(tool("a"), tool("b"), tool("c", "a", "b"));

            LayerPlan plan = planner.plan(dag, ok("a"), Set.of("b"), List.of());

            assertEquals(List.of("c"), ids(plan.eligible()));
        }

        @Test
        @DisplayName("failed_safe dependencies do not block")
        void failedSafe() {
            var dag = DagStructure.of(tool("a"), tool("b", "a"));
            Map<String, TaskResult> results = Map.of("a", TaskResult.failedSafe("a", "meh", 1));

            assertEquals(List.of("b"), ids(planner.plan(dag, results, Set.of(), List.of()).eligible()));
        }

        @Test
        @DisplayName("errors block dependents transitively and halt the plan")
        void blockedTransitively() {
            var dag = DagStructure.of(tool("a"), tool("b", "a"), tool("c", "b"));
            Map<String, TaskResult> results = Map.of("a", TaskResult.error("a", "boom", 1));

            LayerPlan plan = planner.plan(dag, results, Set.of(), List.of());

            assertEquals(List.of("b", "c"), plan.blocked());
            assertTrue(plan.isHalted());
            assertEquals("Workflow halted: 2 task(s) blocked by failed dependencies: b, c", LayerPlanner.haltMessage(plan));
        }

        @Test
        @DisplayName("a dependency cycle leaves tasks waiting with nothing eligible")
        void cycle() {
            var dag = DagStructure.of(tool("a", "b"), tool("b", "a"), tool("c"));

            LayerPlan plan = planner.plan(dag, ok("c"), Set.of(), List.of());

            assertTrue(plan.isCycle());
            assertEquals("Circular dependency detected in DAG. Remaining tasks: a, b", LayerPlanner.cycleMessage(plan));
        }

        @Test
        @DisplayName("everything settled is complete")
        void complete() {
            var dag = DagStructure.of(tool("a"), tool("b", "a"));

            assertTrue(planner.plan(dag, ok("a"), Set.of("b"), List.of()).isComplete());
        }
    }

    // -- Conditions -----------------------------------------------------------

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        private final DagStructure dag = DagStructure.of(
                tool("a"),
                decision("d", "n", "a"),
                gated("yes", "n", "true", "d"),
                gated("no", "n", "false", "d"),
                tool("after", "no"));

        @Test
        @DisplayName("gated tasks wait for their decision")
        void waitForDecision() {
            LayerPlan plan = planner.plan(dag, ok("a"), Set.of(), List.of());

            assertEquals(List.of("d"), ids(plan.eligible()));
            assertTrue(plan.skipped().isEmpty());
        }

        @Test
        @DisplayName("the matching branch runs and the other is skipped along with its dependents")
        void branchSelection() {
            LayerPlan plan = planner.plan(dag, ok("a", "d"), Set.of(), List.of(Decision.branch("n", "true")));

            assertEquals(List.of("yes", "after"), ids(plan.eligible()));
            assertEquals(List.of("no"), plan.skipped());
        }

        @Test
        @DisplayName("the latest decision for a node wins")
        void latestDecisionWins() {
            LayerPlan plan = planner.plan(dag, ok("a", "d"), Set.of(),
                    List.of(Decision.branch("n", "true"), Decision.branch("n", "false")));

            assertEquals(List.of("no"), ids(plan.eligible()));
            assertEquals(List.of("yes"), plan.skipped());
        }

        @Test
        @DisplayName("a skipped decision task skips the tasks it gates")
        void skippedDecision() {
            LayerPlan plan = planner.plan(dag, ok("a"), Set.of("d"), List.of());

            assertTrue(plan.skipped().containsAll(List.of("yes", "no")));
        }

        @Test
        @DisplayName("a condition on a node no task evaluates is ignored")
        void unevaluatedNode() {
            var plain = DagStructure.of(tool("a"), gated("b", "ghost", "true", "a"));

            assertEquals(List.of("b"), ids(planner.plan(plain, ok("a"), Set.of(), List.of()).eligible()));
        }

        @Test
        @DisplayName("a failed decision task blocks the tasks it gates")
        void failedDecision() {
            Map<String, TaskResult> results = Map.of(
                    "a", TaskResult.success("a", 1, 1),
                    "d", TaskResult.error("d", "bad condition", 1));

            LayerPlan plan = planner.plan(dag, results, Set.of(), List.of());

            assertTrue(plan.blocked().containsAll(List.of("yes", "no", "after")));
            assertTrue(plan.isHalted());
        }
    }

    @Test
    @DisplayName("decisionNodeOf reads the node argument or falls back to the task id")
    void decisionNodeOf() {
        assertEquals(Optional.of("n"), LayerPlanner.decisionNodeOf(decision("d", "n")));
        var bare = new Task("d2", new ToolInvocation(DecisionToolClient.DECISION_TOOL, Map.of("condition", "true")),
                List.of(), false, null, null);
        assertEquals(Optional.of("d2"), LayerPlanner.decisionNodeOf(bare));
        assertEquals(Optional.empty(), LayerPlanner.decisionNodeOf(tool("x")));
    }
}
