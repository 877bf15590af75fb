package com.strata.core.convert;

import com.strata.core.model.ArgumentSource;
import com.strata.core.model.DagStructure;
import com.strata.core.model.InvalidDagException;
import com.strata.core.model.Task;
import com.strata.core.model.TaskCondition;
import com.strata.core.model.TaskKind;
import com.strata.core.model.ToolInvocation;
import com.strata.mcp.DecisionToolClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StaticStructureConverterTest {

    private final StaticStructureConverter converter = new StaticStructureConverter();

    private static Task task(DagStructure dag, String id) {
        return dag.tasks().stream()
                .filter(t -> t.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no task " + id));
    }

    // -- Nodes ----------------------------------------------------------------

    @Nested
    @DisplayName("Nodes")
    class Nodes {

        @Test
        @DisplayName("a task node becomes a prefixed tool task keeping its argument sources")
        void taskNode() {
            var node = new StructureNode("n1", StructureNode.Type.TASK, "fs:read",
                    Map.of("path", ArgumentSource.literal("/tmp/a.txt")), null, null);

            DagStructure dag = converter.convert(new StaticStructure(List.of(node), List.of()));

            assertEquals(1, dag.size());
            Task task = dag.tasks().get(0);
            assertEquals("task_n1", task.id());
            assertEquals(TaskKind.MCP_TOOL, task.kind());
            assertTrue(task.dependsOn().isEmpty());
            var invocation = (ToolInvocation) task.payload();
            assertEquals("fs:read", invocation.tool());
            assertTrue(invocation.arguments().isEmpty());
            assertEquals(ArgumentSource.literal("/tmp/a.txt"), invocation.staticArguments().get("path"));
        }

        @Test
        @DisplayName("a capability node becomes a capability task")
        void capabilityNode() {
            DagStructure dag = converter.convert(new StaticStructure(
                    List.of(StructureNode.capability("c", "summarize")), List.of()));

            Task task = dag.tasks().get(0);
            assertEquals("task_c", task.id());
            assertEquals(TaskKind.CAPABILITY, task.kind());
            assertEquals("capability:summarize", task.displayTool());
        }

        @Test
        @DisplayName("fork and join nodes produce no tasks")
        void structuralNodes() {
            DagStructure dag = converter.convert(new StaticStructure(
                    List.of(StructureNode.fork("f"), StructureNode.task("a", "fs:read"), StructureNode.join("j")),
                    List.of()));

            assertEquals(List.of("task_a"), dag.tasks().stream().map(Task::id).toList());
        }

        @Test
        @DisplayName("the id prefix is configurable")
        void customPrefix() {
            DagStructure dag = converter.convert(
                    new StaticStructure(List.of(StructureNode.task("a", "fs:read"), StructureNode.task("b", "fs:write")),
                            List.of(StructureEdge.sequence("a", "b"))),
                    new ConversionOptions(false, "step_"));

            assertEquals(List.of("step_a"), task(dag, "step_b").dependsOn());
        }

        @Test
        @DisplayName("a null prefix falls back to the default")
        void nullPrefix() {
            assertEquals(ConversionOptions.DEFAULT_PREFIX, new ConversionOptions(true, null).taskIdPrefix());
        }
    }

    // -- Edges ----------------------------------------------------------------

    @Nested
    @DisplayName("Edges")
    class Edges {

        @Test
        @DisplayName("sequence and provides edges become dependencies")
        void sequenceAndProvides() {
            var structure = new StaticStructure(
                    List.of(StructureNode.task("a", "fs:read"), StructureNode.task("b", "text:upper"),
                            StructureNode.task("c", "fs:write")),
                    List.of(StructureEdge.sequence("a", "b"), StructureEdge.provides("a", "c"),
                            StructureEdge.sequence("b", "c")));

            DagStructure dag = converter.convert(structure);

            assertTrue(task(dag, "task_a").dependsOn().isEmpty());
            assertEquals(List.of("task_a"), task(dag, "task_b").dependsOn());
            assertEquals(List.of("task_a", "task_b"), task(dag, "task_c").dependsOn());
        }

        @Test
        @DisplayName("children of a fork are siblings depending on the fork's predecessor")
        void forkSiblings() {
            var structure = new StaticStructure(
                    List.of(StructureNode.task("a", "fs:list"), StructureNode.fork("f"),
                            StructureNode.task("b", "fs:read"), StructureNode.task("c", "fs:stat")),
                    List.of(StructureEdge.sequence("a", "f"), StructureEdge.sequence("f", "b"),
                            StructureEdge.sequence("f", "c")));

            DagStructure dag = converter.convert(structure);

            assertEquals(List.of("task_a"), task(dag, "task_b").dependsOn());
            assertEquals(List.of("task_a"), task(dag, "task_c").dependsOn());
        }

        @Test
        @DisplayName("the successor of a join waits for every branch")
        void joinWaitsForAllBranches() {
            var structure = new StaticStructure(
                    List.of(StructureNode.fork("f"), StructureNode.task("b", "fs:read"),
                            StructureNode.task("c", "fs:stat"), StructureNode.join("j"),
                            StructureNode.task("d", "fs:write")),
                    List.of(StructureEdge.sequence("f", "b"), StructureEdge.sequence("f", "c"),
                            StructureEdge.sequence("b", "j"), StructureEdge.sequence("c", "j"),
                            StructureEdge.sequence("j", "d")));

            DagStructure dag = converter.convert(structure);

            assertTrue(task(dag, "task_b").dependsOn().isEmpty());
            assertEquals(List.of("task_b", "task_c"), task(dag, "task_d").dependsOn());
        }

        @Test
        @DisplayName("contains edges and self edges add no dependency")
        void ignoredEdges() {
            var structure = new StaticStructure(
                    List.of(StructureNode.task("a", "fs:read"), StructureNode.task("b", "fs:write")),
                    List.of(StructureEdge.contains("a", "b"), StructureEdge.sequence("b", "b")));

            DagStructure dag = converter.convert(structure);

            assertTrue(task(dag, "task_b").dependsOn().isEmpty());
        }
    }

    // -- Decisions ------------------------------------------------------------

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        private final StaticStructure branching = new StaticStructure(
                List.of(StructureNode.task("a", "fs:exists"), StructureNode.decision("d", "$OUTPUT[task_a].exists"),
                        StructureNode.task("yes", "fs:read"), StructureNode.task("no", "fs:create")),
                List.of(StructureEdge.sequence("a", "d"), StructureEdge.conditional("d", "yes", "true"),
                        StructureEdge.conditional("d", "no", "false")));

        @Test
        @DisplayName("without decision tasks, branches depend on the tasks feeding the decision")
        void conditionsWithoutDecisionTasks() {
            DagStructure dag = converter.convert(branching);

            assertEquals(3, dag.size());
            Task yes = task(dag, "task_yes");
            assertEquals(new TaskCondition("d", "true"), yes.condition());
            assertEquals(List.of("task_a"), yes.dependsOn());
            assertEquals(new TaskCondition("d", "false"), task(dag, "task_no").condition());
        }

        @Test
        @DisplayName("with decision tasks, the decision becomes an internal:decision task")
        void decisionTasks() {
            DagStructure dag = converter.convert(branching, new ConversionOptions(true, "task_"));

            assertEquals(4, dag.size());
            Task decision = task(dag, "task_d");
            var invocation = (ToolInvocation) decision.payload();
            assertEquals(DecisionToolClient.DECISION_TOOL, invocation.tool());
            assertEquals("$OUTPUT[task_a].exists", invocation.arguments().get("condition"));
            assertEquals("d", invocation.arguments().get("decisionNodeId"));
            assertEquals(List.of("task_a"), decision.dependsOn());

            Task yes = task(dag, "task_yes");
            assertEquals(List.of("task_d"), yes.dependsOn());
            assertEquals(new TaskCondition("d", "true"), yes.condition());
        }

        @Test
        @DisplayName("a conditional edge without an outcome is ignored")
        void conditionalWithoutOutcome() {
            var structure = new StaticStructure(
                    List.of(StructureNode.decision("d", "x"), StructureNode.task("b", "fs:read")),
                    List.of(new StructureEdge("d", "b", StructureEdge.Type.CONDITIONAL, null)));

            Task b = converter.convert(structure).tasks().get(0);

            assertNull(b.condition());
            assertTrue(b.dependsOn().isEmpty());
        }
    }

    // -- Validation and reading -----------------------------------------------

    @Test
    @DisplayName("a structure with no task or capability node is rejected")
    void noExecutableNodes() {
        var structure = new StaticStructure(
                List.of(StructureNode.fork("f"), StructureNode.decision("d", "true")), List.of());

        var e = assertThrows(InvalidDagException.class, () -> converter.convert(structure));
        assertEquals("Static structure has no executable nodes", e.getMessage());
        assertFalse(converter.isValidForDagConversion(null));
    }

    @Test
    @DisplayName("reads JSON, mapping unknown node and edge types to UNKNOWN")
    void readsJson() {
        String json = """
                {
                  "nodes": [
                    {"id": "a", "type": "task", "tool": "fs:read",
                     "arguments": {"path": {"type": "parameter", "parameterName": "file"}}},
                    {"id": "l", "type": "loop"},
                    {"id": "b", "type": "task", "tool": "fs:write", "extra": 1}
                  ],
                  "edges": [
                    {"from": "a", "to": "b", "type": "sequence"},
                    {"from": "l", "to": "b", "type": "iterates"}
                  ]
                }
                """;

        StaticStructure structure = converter.read(json);

        assertEquals(StructureNode.Type.UNKNOWN, structure.nodes().get(1).type());
        assertEquals(StructureEdge.Type.UNKNOWN, structure.edges().get(1).type());
        assertEquals(ArgumentSource.parameter("file"), structure.nodes().get(0).arguments().get("path"));

        DagStructure dag = converter.convert(structure);
        assertEquals(List.of("task_a", "task_b"), dag.tasks().stream().map(Task::id).toList());
        assertEquals(List.of("task_a"), task(dag, "task_b").dependsOn());
    }

    @Test
    @DisplayName("malformed JSON is an InvalidDagException")
    void malformedJson() {
        assertThrows(InvalidDagException.class, () -> converter.read("{\"nodes\": ["));
    }

    @Test
    @DisplayName("lists the tools in node order")
    void toolsInOrder() {
        var structure = new StaticStructure(
                List.of(StructureNode.task("a", "fs:read"), StructureNode.capability("c", "cap"),
                        StructureNode.task("b", "http:get")),
                List.of());

        assertEquals(List.of("fs:read", "http:get"), converter.getToolsFromStaticStructure(structure));
    }

    @Test
    @DisplayName("estimates one layer per node without forks and forks + 1 otherwise")
    void estimatesLayers() {
        var linear = new StaticStructure(
                List.of(StructureNode.task("a", "fs:read"), StructureNode.task("b", "fs:write")), List.of());
        var forked = new StaticStructure(
                List.of(StructureNode.fork("f1"), StructureNode.fork("f2"), StructureNode.task("a", "fs:read"),
                        StructureNode.task("b", "fs:read"), StructureNode.task("c", "fs:read")),
                List.of());

        assertEquals(2, converter.estimateParallelLayers(linear));
        assertEquals(3, converter.estimateParallelLayers(forked));
    }
}
