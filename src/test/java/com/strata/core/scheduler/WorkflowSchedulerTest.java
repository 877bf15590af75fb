package com.strata.core.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.core.command.AbortCommand;
import com.strata.core.command.ApprovalResponseCommand;
import com.strata.core.command.CheckpointResponseCommand;
import com.strata.core.command.CommandQueue;
import com.strata.core.command.ContinueCommand;
import com.strata.core.command.InjectTasksCommand;
import com.strata.core.command.ModifyArgsCommand;
import com.strata.core.command.ReplanDagCommand;
import com.strata.core.command.SkipLayerCommand;
import com.strata.core.config.ApprovalMode;
import com.strata.core.config.ExecutionSettings;
import com.strata.core.convert.ConversionOptions;
import com.strata.core.convert.StaticStructure;
import com.strata.core.convert.StaticStructureConverter;
import com.strata.core.convert.StructureEdge;
import com.strata.core.convert.StructureNode;
import com.strata.core.events.EventBus;
import com.strata.core.events.WorkflowEvent;
import com.strata.core.execution.ArgumentResolver;
import com.strata.core.execution.ToolInvoker;
import com.strata.core.model.DagCodec;
import com.strata.core.model.DagStructure;
import com.strata.core.model.Task;
import com.strata.core.model.TaskResult;
import com.strata.core.model.TaskStatus;
import com.strata.core.model.ToolInvocation;
import com.strata.core.persistence.CheckpointNotFoundException;
import com.strata.core.persistence.InMemoryWorkflowRecordStore;
import com.strata.core.persistence.WorkflowCheckpointer;
import com.strata.core.persistence.WorkflowRecordStore;
import com.strata.core.persistence.WorkflowStoreException;
import com.strata.core.routing.DependencyResolver;
import com.strata.core.routing.TaskRouter;
import com.strata.core.state.DecisionType;
import com.strata.core.state.WorkflowState;
import com.strata.mcp.DecisionToolClient;
import com.strata.mcp.RecordingToolClient;
import com.strata.mcp.ToolClientRegistry;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkflowSchedulerTest {

    private static final String WF = "wf-1";

    private RecordingToolClient fs;
    private WorkflowCheckpointer checkpointer;
    private WorkflowRecordStore records;
    private EventBus eventBus;
    private List<WorkflowEvent> events;
    private DagReplanner replanner;

    @BeforeEach
    void setUp() {
        fs = new RecordingToolClient("fs");
        checkpointer = new WorkflowCheckpointer(new MemorySaver(), new ObjectMapper(), new DagCodec());
        records = new InMemoryWorkflowRecordStore(Clock.systemUTC(), Duration.ofHours(1));
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        replanner = null;
    }

    private SchedulerDependencies deps() {
        var registry = new ToolClientRegistry(List.of(fs, new DecisionToolClient()));
        var dispatcher = new LayerDispatcher(new TaskRouter(), new DependencyResolver(),
                List.of(new ToolInvoker(registry, new ArgumentResolver())), eventBus, null);
        return new SchedulerDependencies(new LayerPlanner(), dispatcher, checkpointer, records, eventBus,
                null, new DagCodec(), replanner, new ApprovalSummaryBuilder());
    }

    private WorkflowScheduler scheduler(DagStructure dag, ExecutionSettings settings) {
        records.save(WF, dag, "test");
        return new WorkflowScheduler(WF, dag, WorkflowState.initial(WF, Map.of()), settings, Map.of(),
                new CommandQueue(), deps());
    }

    private WorkflowScheduler scheduler(DagStructure dag) {
        return scheduler(dag, ExecutionSettings.defaults());
    }

    private static DagStructure linear() {
        return DagStructure.of(
                Task.tool("a", "fs:read", Map.of("path", "/tmp/in"), List.of()),
                Task.tool("b", "fs:transform", Map.of("from", "$OUTPUT[a].action"), List.of("a")),
                Task.tool("c", "fs:write", Map.of("path", "/tmp/out"), List.of("b")));
    }

    private static StepOutcome runToEnd(WorkflowScheduler scheduler) {
        StepOutcome outcome;
        int guard = 0;
        do {
            outcome = scheduler.step();
            assertTrue(++guard < 20, "scheduler did not terminate");
        } while (outcome.kind() == StepOutcome.Kind.PAUSED);
        return outcome;
    }

    private static List<String> ids(Collection<TaskResult> results) {
        return results.stream().map(TaskResult::taskId).toList();
    }

    private List<String> eventTypes() {
        return events.stream().map(WorkflowEvent::eventType).toList();
    }

    // -- Layering -------------------------------------------------------------

    @Nested
    @DisplayName("Layering")
    class Layering {

        @Test
        @DisplayName("a linear chain runs one task per layer and passes outputs along")
        void linearChain() {
            WorkflowScheduler scheduler = scheduler(linear());

            StepOutcome first = scheduler.step();
            assertEquals(StepOutcome.Kind.PAUSED, first.kind());
            assertEquals(0, first.layerIndex());
            assertEquals(List.of("a"), ids(first.layerResults()));
            assertNotNull(first.checkpointId());

            StepOutcome second = scheduler.step();
            assertEquals(1, second.layerIndex());
            assertEquals("read", fs.calls().get(1).arguments().get("from"));

            StepOutcome last = scheduler.step();
            assertEquals(StepOutcome.Kind.COMPLETED, last.kind());
            assertEquals(2, last.layerIndex());
            assertEquals(List.of("a", "b", "c"), ids(last.results()));
            assertEquals(List.of("read", "transform", "write"), fs.actions());
            assertEquals(SchedulerStatus.COMPLETED, scheduler.status());
            assertEquals(2, scheduler.state().currentLayer());
            assertSame(last, scheduler.step());
        }

        @Test
        @DisplayName("diamond branches share a layer and the join waits for both")
        void diamond() {
            var dag = DagStructure.of(
                    Task.tool("a", "fs:list", Map.of(), List.of()),
                    Task.tool("b", "fs:read", Map.of(), List.of("a")),
                    Task.tool("c", "fs:stat", Map.of(), List.of("a")),
                    Task.tool("d", "fs:write", Map.of(), List.of("b", "c")));
            WorkflowScheduler scheduler = scheduler(dag, ExecutionSettings.defaults().withMaxParallel(1));

            scheduler.step();
            StepOutcome middle = scheduler.step();
            StepOutcome last = scheduler.step();

            assertEquals(List.of("b", "c"), ids(middle.layerResults()));
            assertEquals(List.of("d"), ids(last.layerResults()));
            assertEquals(StepOutcome.Kind.COMPLETED, last.kind());
        }

        @Test
        @DisplayName("an empty DAG completes on the first step")
        void emptyDag() {
            StepOutcome outcome = scheduler(new DagStructure(List.of())).step();

            assertEquals(StepOutcome.Kind.COMPLETED, outcome.kind());
            assertTrue(outcome.results().isEmpty());
            assertTrue(fs.calls().isEmpty());
        }

        @Test
        @DisplayName("a failed task halts its dependents but not independent tasks")
        void failureHalts() {
            fs.fail("read");
            var dag = DagStructure.of(
                    Task.tool("a", "fs:read", Map.of(), List.of()),
                    Task.tool("b", "fs:write", Map.of(), List.of("a")),
                    Task.tool("c", "fs:stat", Map.of(), List.of()));
            WorkflowScheduler scheduler = scheduler(dag);

            StepOutcome first = scheduler.step();
            assertEquals(TaskStatus.ERROR, first.layerResults().get(0).status());
            assertEquals("fs:read failed", first.layerResults().get(0).error());
            assertEquals(TaskStatus.SUCCESS, first.layerResults().get(1).status());

            StepOutcome halted = scheduler.step();
            assertEquals(StepOutcome.Kind.ABORTED, halted.kind());
            assertEquals("Workflow halted: 1 task(s) blocked by failed dependencies: b", halted.reason());
            assertFalse(fs.actions().contains("write"));
            assertTrue(eventTypes().contains(WorkflowEvent.TASK_FAILED));
        }

        @Test
        @DisplayName("a cycle is reported with the tasks that can never run")
        void cycle() {
            var dag = DagStructure.of(
                    Task.tool("a", "fs:read", Map.of(), List.of("b")),
                    Task.tool("b", "fs:read", Map.of(), List.of("a")));

            var e = assertThrows(CycleDetectedException.class, () -> scheduler(dag).step());
            assertEquals("Circular dependency detected in DAG. Remaining tasks: a, b", e.getMessage());
        }

        @Test
        @DisplayName("layer and checkpoint events are published per layer")
        void events() {
            runToEnd(scheduler(linear()));

            assertEquals(3, eventTypes().stream().filter(WorkflowEvent.LAYER_STARTED::equals).count());
            assertEquals(3, eventTypes().stream().filter(WorkflowEvent.CHECKPOINT_SAVED::equals).count());
            assertEquals(WorkflowEvent.WORKFLOW_COMPLETED, eventTypes().get(eventTypes().size() - 1));
        }

        @Test
        @DisplayName("task events from the dispatcher reach the workflow's event bus")
        void taskEvents() {
            runToEnd(scheduler(linear()));

            assertEquals(3, eventTypes().stream().filter(WorkflowEvent.TASK_STARTED::equals).count());
            assertEquals(3, eventTypes().stream().filter(WorkflowEvent.TASK_COMPLETED::equals).count());
            assertTrue(eventTypes().indexOf(WorkflowEvent.LAYER_STARTED)
                    < eventTypes().indexOf(WorkflowEvent.TASK_STARTED));
        }

        @Test
        @DisplayName("a failing checkpoint save does not stop the workflow")
        void checkpointFailure() {
            checkpointer = mock(WorkflowCheckpointer.class);
            when(checkpointer.save(anyString(), anyInt(), any(), any(), any(), anyInt()))
                    .thenThrow(new WorkflowStoreException("db down"));

            StepOutcome outcome = runToEnd(scheduler(linear()));

            assertEquals(StepOutcome.Kind.COMPLETED, outcome.kind());
            assertNull(outcome.checkpointId());
        }
    }

    // -- Decisions ------------------------------------------------------------

    @Test
    @DisplayName("a decision task records its outcome and gates the branches")
    void decisionBranches() {
        fs.respond("exists", Map.of("exists", true));
        var structure = new StaticStructure(
                List.of(StructureNode.task("a", "fs:exists"),
                        StructureNode.decision("d", "$OUTPUT[task_a].exists"),
                        StructureNode.task("yes", "fs:read"),
                        StructureNode.task("no", "fs:create")),
                List.of(StructureEdge.sequence("a", "d"),
                        StructureEdge.conditional("d", "yes", "true"),
                        StructureEdge.conditional("d", "no", "false")));
        DagStructure dag = new StaticStructureConverter().convert(structure, new ConversionOptions(true, "task_"));
        WorkflowScheduler scheduler = scheduler(dag);

        StepOutcome outcome = runToEnd(scheduler);

        assertEquals(StepOutcome.Kind.COMPLETED, outcome.kind());
        assertEquals(List.of("task_a", "task_d", "task_yes"), ids(outcome.results()));
        assertEquals(List.of("exists", "read"), fs.actions());
        assertEquals(Set.of("task_no"), scheduler.skippedTaskIds());
        var decision = scheduler.state().decisions().get(0);
        assertEquals(DecisionType.AIL, decision.type());
        assertEquals("d", decision.decisionNodeId());
        assertEquals("true", decision.outcome());
        assertTrue(eventTypes().contains(WorkflowEvent.TASK_SKIPPED));
    }

    // -- Approval -------------------------------------------------------------

    @Nested
    @DisplayName("Approval")
    class Approval {

        @Test
        @DisplayName("always-mode pauses after each layer until approved")
        void pausesUntilApproved() {
            WorkflowScheduler scheduler = scheduler(linear(), ExecutionSettings.defaults().withApprovalMode(ApprovalMode.ALWAYS));

            StepOutcome paused = scheduler.step();
            assertEquals(StepOutcome.Kind.AWAITING_APPROVAL, paused.kind());
            assertEquals(SchedulerStatus.PAUSED_FOR_APPROVAL, scheduler.status());
            assertTrue(paused.approvalSummary().contains("Layer 0 completed"));
            assertTrue(eventTypes().contains(WorkflowEvent.DECISION_REQUIRED));

            scheduler.commands().enqueue(new ContinueCommand("no approval"));
            StepOutcome still = scheduler.step();
            assertEquals(StepOutcome.Kind.AWAITING_APPROVAL, still.kind());
            assertTrue(still.layerResults().isEmpty());
            assertEquals(1, fs.calls().size());

            scheduler.commands().enqueue(new ApprovalResponseCommand(paused.checkpointId(), true, "looks good"));
            StepOutcome next = scheduler.step();
            assertEquals(StepOutcome.Kind.AWAITING_APPROVAL, next.kind());
            assertEquals(1, next.layerIndex());

            WorkflowState state = scheduler.state();
            assertEquals("Layer 0 approved: looks good", state.messages().get(0).content());
            assertEquals(DecisionType.HIL, state.decisions().get(0).type());
            assertEquals("approved", state.decisions().get(0).outcome());
        }

        @Test
        @DisplayName("a rejection aborts with the feedback as reason")
        void rejection() {
            WorkflowScheduler scheduler = scheduler(linear(), ExecutionSettings.defaults().withApprovalMode(ApprovalMode.ALWAYS));
            StepOutcome paused = scheduler.step();

            scheduler.commands().enqueue(new ApprovalResponseCommand(paused.checkpointId(), false, "wrong file"));
            StepOutcome aborted = scheduler.step();

            assertEquals(StepOutcome.Kind.ABORTED, aborted.kind());
            assertEquals("Workflow aborted by user: wrong file", aborted.reason());
            assertEquals("rejected", scheduler.state().decisions().get(0).outcome());
            assertEquals(List.of("read"), fs.actions());
        }

        @Test
        @DisplayName("critical-only pauses only after layers with side effects")
        void criticalOnly() {
            var dag = DagStructure.of(
                    Task.tool("a", "fs:read", Map.of(), List.of()),
                    new Task("b", new ToolInvocation("fs:delete", Map.of()), List.of("a"), true, null, null));
            WorkflowScheduler scheduler = scheduler(dag, ExecutionSettings.defaults().withApprovalMode(ApprovalMode.CRITICAL_ONLY));

            assertEquals(StepOutcome.Kind.PAUSED, scheduler.step().kind());
            StepOutcome second = scheduler.step();
            assertEquals(StepOutcome.Kind.AWAITING_APPROVAL, second.kind());
            assertTrue(second.approvalSummary().contains("Final Layer Reached"));

            scheduler.commands().enqueue(new ApprovalResponseCommand(second.checkpointId(), true));
            assertEquals(StepOutcome.Kind.COMPLETED, scheduler.step().kind());
        }

        @Test
        @DisplayName("an approval while nothing is pending is ignored")
        void strayApproval() {
            WorkflowScheduler scheduler = scheduler(linear());
            scheduler.commands().enqueue(new ApprovalResponseCommand("cp-x", false, null));

            assertEquals(StepOutcome.Kind.PAUSED, scheduler.step().kind());
            assertTrue(scheduler.state().messages().isEmpty());
        }
    }

    // -- Commands -------------------------------------------------------------

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        @DisplayName("abort before the first layer runs nothing")
        void abortFirst() {
            WorkflowScheduler scheduler = scheduler(linear());
            scheduler.commands().enqueue(new AbortCommand("operator stop"));

            StepOutcome outcome = scheduler.step();

            assertEquals(StepOutcome.Kind.ABORTED, outcome.kind());
            assertEquals("operator stop", outcome.reason());
            assertTrue(fs.calls().isEmpty());
            assertTrue(eventTypes().contains(WorkflowEvent.WORKFLOW_ABORTED));
        }

        @Test
        @DisplayName("commands after an abort are not applied")
        void abortStopsDraining() {
            WorkflowScheduler scheduler = scheduler(linear());
            scheduler.commands().enqueue(new AbortCommand("stop"));
            scheduler.commands().enqueue(new ModifyArgsCommand("a", Map.of("path", "/x")));

            scheduler.step();

            assertEquals(Map.of("path", "/tmp/in"), scheduler.dag().task("a").orElseThrow().arguments());
        }

        @Test
        @DisplayName("replan with tasks merges them into the DAG and the record")
        void replanWithTasks() {
            WorkflowScheduler scheduler = scheduler(linear());
            scheduler.step();

            scheduler.commands().enqueue(new ReplanDagCommand("also archive", Map.of(),
                    List.of(Map.of("id", "z", "tool", "fs:archive", "dependsOn", List.of("a")))));
            StepOutcome next = scheduler.step();

            assertEquals(List.of("b", "z"), ids(next.layerResults()));
            assertTrue(records.get(WF).orElseThrow().task("z").isPresent());
            assertTrue(eventTypes().contains(WorkflowEvent.WORKFLOW_REPLANNED));
            assertTrue(scheduler.state().messages().get(0).content().contains("also archive"));
        }

        @Test
        @DisplayName("replan without tasks asks the replanner")
        void replanWithReplanner() {
            replanner = request -> List.of(Task.tool("r", "fs:stat", Map.of(), List.of("a")));
            WorkflowScheduler scheduler = scheduler(linear());
            scheduler.step();

            scheduler.commands().enqueue(new ReplanDagCommand("check size", Map.of("hint", 1)));
            scheduler.step();

            assertTrue(scheduler.dag().task("r").isPresent());
            assertTrue(fs.actions().contains("stat"));
        }

        @Test
        @DisplayName("replans beyond the limit are ignored")
        void replanLimit() {
            var settings = new ExecutionSettings(1, 8, 120_000, ApprovalMode.NEVER, 0, 30_000, 512, null);
            WorkflowScheduler scheduler = scheduler(linear(), settings);

            scheduler.commands().enqueue(new ReplanDagCommand("more", Map.of(),
                    List.of(Map.of("id", "z", "tool", "fs:archive"))));
            scheduler.step();

            assertTrue(scheduler.dag().task("z").isEmpty());
        }

        @Test
        @DisplayName("injected tasks join the DAG")
        void inject() {
            WorkflowScheduler scheduler = scheduler(linear());
            scheduler.commands().enqueue(new InjectTasksCommand(
                    List.of(Map.of("id", "i", "tool", "fs:touch")), 5));

            StepOutcome first = scheduler.step();

            assertEquals(List.of("a", "i"), ids(first.layerResults()));
        }

        @Test
        @DisplayName("skip_layer skips the tasks of that layer and dependents still run")
        void skipLayer() {
            WorkflowScheduler scheduler = scheduler(linear());
            scheduler.commands().enqueue(new SkipLayerCommand(1, "not needed"));

            StepOutcome outcome = runToEnd(scheduler);

            assertEquals(StepOutcome.Kind.COMPLETED, outcome.kind());
            assertEquals(Set.of("b"), scheduler.skippedTaskIds());
            assertEquals(List.of("read", "write"), fs.actions());
            assertEquals(2, outcome.layerIndex());
        }

        @Test
        @DisplayName("modify_args merges updates into a pending task")
        void modifyArgs() {
            WorkflowScheduler scheduler = scheduler(linear());
            scheduler.step();
            scheduler.step();

            scheduler.commands().enqueue(new ModifyArgsCommand("c", Map.of("path", "/tmp/elsewhere", "mode", "append")));
            scheduler.commands().enqueue(new ModifyArgsCommand("a", Map.of("path", "/ignored")));
            scheduler.step();

            Map<String, Object> sent = fs.calls().get(2).arguments();
            assertEquals("/tmp/elsewhere", sent.get("path"));
            assertEquals("append", sent.get("mode"));
            assertEquals("/tmp/in", scheduler.dag().task("a").orElseThrow().arguments().get("path"));
        }
    }

    // -- Resume ---------------------------------------------------------------

    @Nested
    @DisplayName("Resume")
    class Resume {

        @Test
        @DisplayName("a new scheduler resumes after the checkpointed layer")
        void resumeFromCheckpoint() {
            WorkflowScheduler original = scheduler(linear());
            String afterFirst = original.step().checkpointId();

            var restarted = new WorkflowScheduler(WF, linear(), WorkflowState.initial(WF, Map.of()),
                    ExecutionSettings.defaults(), Map.of(), new CommandQueue(), deps());
            StepOutcome outcome = restarted.resume(null, afterFirst);

            assertEquals(1, outcome.layerIndex());
            assertEquals(List.of("a", "b"), ids(outcome.results()));
            assertEquals(List.of("read", "transform"), fs.actions());
        }

        @Test
        @DisplayName("rollback restores an earlier checkpoint and reruns from there")
        void rollback() {
            WorkflowScheduler scheduler = scheduler(linear());
            String afterFirst = scheduler.step().checkpointId();
            scheduler.step();

            scheduler.commands().enqueue(new CheckpointResponseCommand(afterFirst, CheckpointResponseCommand.Decision.ROLLBACK));
            StepOutcome outcome = scheduler.step();

            assertEquals(1, outcome.layerIndex());
            assertEquals(List.of("a", "b"), ids(outcome.results()));
            assertEquals(List.of("read", "transform", "transform"), fs.actions());
        }

        @Test
        @DisplayName("an unknown checkpoint is rejected")
        void unknownCheckpoint() {
            WorkflowScheduler scheduler = scheduler(linear());

            assertThrows(CheckpointNotFoundException.class, () -> scheduler.resume(null, "cp-missing"));
        }

        @Test
        @DisplayName("a checkpoint of another workflow is rejected")
        void foreignCheckpoint() {
            String foreign = checkpointer.save("wf-other", 0, WorkflowState.initial("wf-other", Map.of()),
                    linear(), List.of(), 0).checkpointId();

            assertThrows(CheckpointNotFoundException.class, () -> scheduler(linear()).resume(null, foreign));
        }
    }
}
