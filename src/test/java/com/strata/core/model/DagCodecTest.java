package com.strata.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DagCodec} and the structural checks of {@link DagStructure}.
 */
class DagCodecTest {

    private final DagCodec codec = new DagCodec();

    @Nested
    @DisplayName("read")
    class ReadTests {

        @Test
        @DisplayName("a task without kind is a tool invocation")
        void defaultsToToolInvocation() {
            DagStructure dag = codec.read("""
                    {"tasks": [{"id": "t1", "tool": "fs:read", "arguments": {"path": "/tmp/a"}}]}
                    """);

            Task task = dag.task("t1").orElseThrow();
            assertEquals(TaskKind.MCP_TOOL, task.kind());
            var invocation = assertInstanceOf(ToolInvocation.class, task.payload());
            assertEquals("fs", invocation.server());
            assertEquals("read", invocation.action());
            assertEquals(Map.of("path", "/tmp/a"), task.arguments());
        }

        @Test
        @DisplayName("maps every kind to its payload")
        void mapsKinds() {
            DagStructure dag = codec.read("""
                    {"tasks": [
                      {"id": "a", "kind": "code_execution", "code": "return 1;", "sideEffects": true},
                      {"id": "b", "type": "capability", "capabilityId": "cap-1", "intent": "sum", "dependsOn": ["a"]},
                      {"id": "c", "tool": "gh:create_issue", "dependsOn": ["a", "b"],
                       "condition": {"decisionNodeId": "d1", "requiredOutcome": "true"},
                       "sandboxConfig": {"timeoutMs": 500}}
                    ]}
                    """);

            assertEquals(3, dag.size());
            Task a = dag.task("a").orElseThrow();
            assertEquals(TaskKind.CODE_EXECUTION, a.kind());
            assertTrue(a.sideEffects());
            Task b = dag.task("b").orElseThrow();
            var capability = assertInstanceOf(CapabilityInvocation.class, b.payload());
            assertEquals("cap-1", capability.capabilityId());
            assertEquals("capability:cap-1", b.displayTool());
            Task c = dag.task("c").orElseThrow();
            assertEquals(List.of("a", "b"), c.dependsOn());
            assertTrue(c.condition().matches("true"));
            assertEquals(500L, c.sandbox().timeoutMs());
        }

        @Test
        @DisplayName("reads from a file")
        void readsFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("dag.json");
            Files.writeString(file, "{\"tasks\": [{\"id\": \"x\", \"tool\": \"fs:list\"}]}");

            assertEquals(List.of("x"), List.copyOf(codec.read(file).ids()));
        }

        @Test
        @DisplayName("rejects malformed JSON")
        void rejectsMalformedJson() {
            assertThrows(InvalidDagException.class, () -> codec.read("{\"tasks\": ["));
        }

        @Test
        @DisplayName("rejects a document without tasks")
        void rejectsMissingTasks() {
            var e = assertThrows(InvalidDagException.class, () -> codec.read("{}"));
            assertTrue(e.getMessage().contains("tasks"));
        }

        @Test
        @DisplayName("rejects an unknown kind")
        void rejectsUnknownKind() {
            assertThrows(InvalidDagException.class,
                    () -> codec.read("{\"tasks\": [{\"id\": \"t\", \"kind\": \"quantum\"}]}"));
        }

        @Test
        @DisplayName("rejects a tool id without a server")
        void rejectsToolWithoutServer() {
            assertThrows(InvalidDagException.class,
                    () -> codec.read("{\"tasks\": [{\"id\": \"t\", \"tool\": \"read\"}]}"));
        }
    }

    @Nested
    @DisplayName("structure checks")
    class StructureTests {

        @Test
        @DisplayName("rejects duplicate ids")
        void rejectsDuplicateIds() {
            var e = assertThrows(InvalidDagException.class, () -> DagStructure.of(
                    Task.tool("t", "fs:read", Map.of(), List.of()),
                    Task.tool("t", "fs:write", Map.of(), List.of())));
            assertTrue(e.getMessage().contains("Duplicate task id: t"));
        }

        @Test
        @DisplayName("rejects a dependency on an unknown task")
        void rejectsUnknownDependency() {
            assertThrows(InvalidDagException.class, () -> DagStructure.of(
                    Task.tool("t", "fs:read", Map.of(), List.of("ghost"))));
        }

        @Test
        @DisplayName("augment validates the merged graph")
        void augmentValidates() {
            DagStructure dag = DagStructure.of(Task.tool("a", "fs:read", Map.of(), List.of()));

            DagStructure merged = dag.augment(List.of(Task.tool("b", "fs:write", Map.of(), List.of("a"))));

            assertEquals(List.of("a", "b"), List.copyOf(merged.ids()));
            assertThrows(InvalidDagException.class,
                    () -> dag.augment(List.of(Task.tool("a", "fs:write", Map.of(), List.of()))));
        }

        @Test
        @DisplayName("replace keeps the task position")
        void replaceKeepsPosition() {
            DagStructure dag = DagStructure.of(
                    Task.tool("a", "fs:read", Map.of("path", "x"), List.of()),
                    Task.tool("b", "fs:read", Map.of(), List.of("a")));

            DagStructure replaced = dag.replace(dag.task("a").orElseThrow().withArguments(Map.of("path", "y")));

            assertEquals(List.of("a", "b"), List.copyOf(replaced.ids()));
            assertEquals("y", replaced.task("a").orElseThrow().arguments().get("path"));
        }
    }

    @Nested
    @DisplayName("write")
    class WriteTests {

        @Test
        @DisplayName("writes the wire names and omits defaults")
        void writesWireNames() {
            DagStructure dag = DagStructure.of(
                    Task.code("a", "return 1;", List.of(), false),
                    Task.capability("b", "cap-9", Map.of("n", 2), List.of("a")));

            String json = codec.write(dag);

            assertTrue(json.contains("\"kind\" : \"code_execution\""));
            assertTrue(json.contains("\"capabilityId\" : \"cap-9\""));
            assertFalse(json.contains("sideEffects"));
            assertEquals(dag, codec.read(json));
        }

        @Test
        @DisplayName("tasksFromWire parses command payloads")
        void tasksFromWire() {
            List<Task> tasks = codec.tasksFromWire(List.of(
                    Map.of("id", "n1", "tool", "fs:read", "dependsOn", List.of())));

            assertEquals(1, tasks.size());
            assertEquals("fs:read", tasks.get(0).displayTool());
        }

        @Test
        @DisplayName("tasksFromWire reports malformed tasks")
        void tasksFromWireMalformed() {
            assertThrows(InvalidDagException.class,
                    () -> codec.tasksFromWire(List.of(Map.of("id", "n1", "kind", "code_execution"))));
        }
    }
}
