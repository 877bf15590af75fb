package com.strata.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.core.command.AbortCommand;
import com.strata.core.command.ApprovalResponseCommand;
import com.strata.core.command.Command;
import com.strata.core.command.CommandQueue;
import com.strata.core.command.InvalidCommandException;
import com.strata.core.config.ApprovalMode;
import com.strata.core.config.ExecutionSettings;
import com.strata.core.config.ExecutionSettingsHolder;
import com.strata.core.events.EventBus;
import com.strata.core.events.WorkflowEvent;
import com.strata.core.logging.MdcContext;
import com.strata.core.metrics.WorkflowMetrics;
import com.strata.core.model.DagCodec;
import com.strata.core.model.DagStructure;
import com.strata.core.persistence.WorkflowCheckpoint;
import com.strata.core.persistence.WorkflowCheckpointer;
import com.strata.core.persistence.WorkflowNotFoundException;
import com.strata.core.persistence.WorkflowRecord;
import com.strata.core.persistence.WorkflowRecordStore;
import com.strata.core.scheduler.ApprovalSummaryBuilder;
import com.strata.core.scheduler.DagReplanner;
import com.strata.core.scheduler.LayerDispatcher;
import com.strata.core.scheduler.LayerPlanner;
import com.strata.core.scheduler.SchedulerDependencies;
import com.strata.core.scheduler.StepOutcome;
import com.strata.core.scheduler.WorkflowScheduler;
import com.strata.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives workflows: starts them, steps their schedulers, routes commands to them, and
 * rebuilds a scheduler from the record store and the latest checkpoint after a restart.
 * <p>
 * Terminal outcomes release the live scheduler and delete the workflow record;
 * checkpoints are kept.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    static final String CONTEXT_INTENT = "intent";
    static final String CONTEXT_APPROVAL_MODE = "approvalMode";
    static final String CONTEXT_PARAMETERS = "parameters";

    private final WorkflowRegistry registry;
    private final WorkflowRecordStore records;
    private final WorkflowCheckpointer checkpointer;
    private final ExecutionSettingsHolder settingsHolder;
    private final EventBus eventBus;
    private final WorkflowMetrics metrics;
    private final ObjectMapper objectMapper;
    private final SchedulerDependencies schedulerDependencies;

    @Autowired
    public WorkflowEngine(WorkflowRegistry registry, WorkflowRecordStore records, WorkflowCheckpointer checkpointer,
                          ExecutionSettingsHolder settingsHolder, LayerPlanner planner, LayerDispatcher dispatcher,
                          EventBus eventBus, @Autowired(required = false) WorkflowMetrics metrics,
                          DagCodec dagCodec, @Autowired(required = false) DagReplanner replanner,
                          ApprovalSummaryBuilder summaries, ObjectMapper objectMapper) {
        this.registry = registry;
        this.records = records;
        this.checkpointer = checkpointer;
        this.settingsHolder = settingsHolder;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.schedulerDependencies = new SchedulerDependencies(planner, dispatcher, checkpointer, records,
                eventBus, metrics, dagCodec, replanner, summaries);
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Registers a new workflow and saves its record. Nothing runs until it is stepped.
     *
     * @return the new workflow id
     */
    public String start(DagStructure dag, WorkflowRunOptions options) {
        String workflowId = UUID.randomUUID().toString();
        MdcContext.setWorkflow(workflowId);
        try {
            ExecutionSettings settings = settingsFor(options.approvalMode());

            Map<String, Object> context = new LinkedHashMap<>(options.context());
            if (options.intent() != null) {
                context.put(CONTEXT_INTENT, options.intent());
            }
            context.put(CONTEXT_APPROVAL_MODE, settings.approvalMode().name());
            context.put(CONTEXT_PARAMETERS, options.parameters());
            WorkflowState state = WorkflowState.initial(workflowId, context);

            records.save(workflowId, dag, options.intent(), context);
            var scheduler = newScheduler(workflowId, dag, state, settings, options.parameters());
            registry.register(scheduler);

            log.info("Workflow {} started: {} task(s), approval {}", workflowId, dag.size(), settings.approvalMode());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("tasks", dag.size());
            payload.put("approvalMode", settings.approvalMode().name());
            if (options.intent() != null) {
                payload.put("intent", options.intent());
            }
            eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_STARTED, workflowId, null, payload));
            return workflowId;
        } finally {
            MdcContext.clear();
        }
    }

    /** Runs one step of a live workflow. */
    public StepOutcome step(String workflowId) {
        return finish(liveScheduler(workflowId).step());
    }

    /**
     * Steps until the workflow completes, aborts or waits for approval.
     */
    public StepOutcome runToPause(String workflowId) {
        return runToPause(liveScheduler(workflowId));
    }

    /**
     * Continues a workflow, rebuilding its scheduler from the stored record and latest
     * checkpoint when it is not live in this process.
     *
     * @throws WorkflowNotFoundException if the workflow is neither live nor stored
     */
    public StepOutcome continueWorkflow(String workflowId) {
        Optional<WorkflowScheduler> live = registry.find(workflowId);
        if (live.isPresent()) {
            records.extendExpiration(workflowId);
            return runToPause(live.get());
        }
        WorkflowRecord record = records.getRecord(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow " + workflowId + " not found"));
        Optional<WorkflowCheckpoint> latest = checkpointer.latest(workflowId);
        if (latest.isEmpty()) {
            log.info("Workflow {} has no checkpoint; restarting from its first layer", workflowId);
            Map<String, Object> context = record.context();
            var scheduler = newScheduler(workflowId, record.dag(), WorkflowState.initial(workflowId, context),
                    settingsFor(approvalModeOf(context)), parametersOf(context));
            registry.register(scheduler);
            records.extendExpiration(workflowId);
            return runToPause(scheduler);
        }
        return resumeFrom(record, latest.get());
    }

    /**
     * Resumes from a specific checkpoint, rebuilding the scheduler if needed.
     */
    public StepOutcome resume(String checkpointId) {
        WorkflowCheckpoint checkpoint = checkpointer.load(checkpointId);
        WorkflowRecord record = records.getRecord(checkpoint.workflowId())
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow " + checkpoint.workflowId() + " not found"));
        Optional<WorkflowScheduler> live = registry.find(checkpoint.workflowId());
        if (live.isPresent()) {
            StepOutcome outcome = finish(live.get().resume(record.dag(), checkpointId));
            return outcome.kind() == StepOutcome.Kind.PAUSED ? runToPause(live.get()) : outcome;
        }
        return resumeFrom(record, checkpoint);
    }

    private StepOutcome resumeFrom(WorkflowRecord record, WorkflowCheckpoint checkpoint) {
        WorkflowState state = checkpoint.state();
        var scheduler = newScheduler(record.workflowId(), record.dag(), state,
                settingsFor(approvalModeOf(state.context())), parametersOf(state.context()));
        registry.register(scheduler);
        records.extendExpiration(record.workflowId());
        log.info("Workflow {} rebuilt from checkpoint {} (layer {})",
                record.workflowId(), checkpoint.checkpointId(), checkpoint.layer());
        StepOutcome outcome = finish(scheduler.resume(record.dag(), checkpoint.checkpointId()));
        return outcome.kind() == StepOutcome.Kind.PAUSED ? runToPause(scheduler) : outcome;
    }

    // ── Commands ────────────────────────────────────────────────────────

    /**
     * @throws InvalidCommandException if the command is malformed; it is counted and not queued
     */
    public void enqueueCommand(String workflowId, Command command) {
        CommandQueue queue = liveScheduler(workflowId).commands();
        try {
            queue.enqueue(command);
        } catch (InvalidCommandException e) {
            recordRejected(command != null ? command.type().wireName() : "null");
            throw e;
        }
    }

    public Command enqueueCommandJson(String workflowId, String json) {
        CommandQueue queue = liveScheduler(workflowId).commands();
        try {
            return queue.enqueueJson(json);
        } catch (InvalidCommandException e) {
            recordRejected("json");
            throw e;
        }
    }

    /**
     * Answers a pending approval and keeps running until the next pause.
     */
    public StepOutcome approve(String workflowId, String checkpointId, boolean approved, String feedback) {
        enqueueCommand(workflowId, new ApprovalResponseCommand(checkpointId, approved, feedback));
        records.extendExpiration(workflowId);
        return runToPause(workflowId);
    }

    public StepOutcome abort(String workflowId, String reason) {
        enqueueCommand(workflowId, new AbortCommand(reason));
        return step(workflowId);
    }

    /** Physically removes expired workflow records. */
    public int cleanupExpired() {
        return records.cleanupExpired();
    }

    public Optional<WorkflowScheduler> find(String workflowId) {
        return registry.find(workflowId);
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private StepOutcome runToPause(WorkflowScheduler scheduler) {
        StepOutcome outcome;
        do {
            outcome = finish(scheduler.step());
        } while (outcome.kind() == StepOutcome.Kind.PAUSED);
        return outcome;
    }

    private StepOutcome finish(StepOutcome outcome) {
        if (outcome.isTerminal()) {
            registry.release(outcome.workflowId());
            records.delete(outcome.workflowId());
        }
        return outcome;
    }

    private WorkflowScheduler liveScheduler(String workflowId) {
        return registry.find(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException("Workflow " + workflowId + " is not running"));
    }

    private WorkflowScheduler newScheduler(String workflowId, DagStructure dag, WorkflowState state,
                                           ExecutionSettings settings, Map<String, Object> parameters) {
        return new WorkflowScheduler(workflowId, dag, state, settings, parameters,
                new CommandQueue(objectMapper), schedulerDependencies);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parametersOf(Map<String, Object> context) {
        Object value = context.get(CONTEXT_PARAMETERS);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static ApprovalMode approvalModeOf(Map<String, Object> context) {
        return context.get(CONTEXT_APPROVAL_MODE) instanceof String mode ? ApprovalMode.fromWire(mode) : null;
    }

    private ExecutionSettings settingsFor(ApprovalMode approvalMode) {
        ExecutionSettings settings = settingsHolder.current();
        return approvalMode != null ? settings.withApprovalMode(approvalMode) : settings;
    }

    private void recordRejected(String type) {
        if (metrics != null) {
            metrics.incrementRejectedCommands(type);
        }
    }
}
