package com.strata.core.scheduler;

import com.strata.core.command.AbortCommand;
import com.strata.core.command.ApprovalResponseCommand;
import com.strata.core.command.CheckpointResponseCommand;
import com.strata.core.command.Command;
import com.strata.core.command.CommandQueue;
import com.strata.core.command.ContinueCommand;
import com.strata.core.command.InjectTasksCommand;
import com.strata.core.command.ModifyArgsCommand;
import com.strata.core.command.ReplanDagCommand;
import com.strata.core.command.SkipLayerCommand;
import com.strata.core.config.ExecutionSettings;
import com.strata.core.events.WorkflowEvent;
import com.strata.core.execution.ExecutionContext;
import com.strata.core.logging.MdcContext;
import com.strata.core.model.DagStructure;
import com.strata.core.model.Task;
import com.strata.core.model.TaskResult;
import com.strata.core.persistence.CheckpointNotFoundException;
import com.strata.core.persistence.WorkflowCheckpoint;
import com.strata.core.state.Decision;
import com.strata.core.state.Message;
import com.strata.core.state.StateUpdate;
import com.strata.core.state.WorkflowState;
import com.strata.core.state.WorkflowStateReducers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resumable state machine that runs one workflow a layer at a time.
 * <p>
 * {@code CREATED → RUNNING → (PAUSED_FOR_APPROVAL | RUNNING) → (COMPLETED | ABORTED)}.
 * Each {@link #step()} drains the command queue, plans and runs at most one layer, folds the
 * results into the workflow state, saves a checkpoint, and then either pauses for approval,
 * applies the commands that arrived meanwhile, or returns. The caller drives the loop; the
 * scheduler never runs ahead of it.
 * <p>
 * Task failures are data. Cycles, unknown checkpoints, invalid merged DAGs, missing
 * collaborators and record store failures are thrown to the caller.
 * <p>
 * One instance owns one workflow; methods are synchronized so that commands may be
 * enqueued from other threads while a step runs.
 */
public class WorkflowScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowScheduler.class);

    private final String workflowId;
    private final ExecutionSettings settings;
    private final Map<String, Object> parameters;
    private final CommandQueue commands;
    private final SchedulerDependencies deps;

    private DagStructure dag;
    private WorkflowState state;
    private final Set<String> skipped = new LinkedHashSet<>();
    private final Set<Integer> layersToSkip = new TreeSet<>();
    private SchedulerStatus status = SchedulerStatus.CREATED;
    private int nextLayer;
    private int lastLayer = -1;
    private int replans;
    private String lastCheckpointId;
    private String pendingSummary;
    private StepOutcome terminalOutcome;

    public WorkflowScheduler(String workflowId, DagStructure dag, WorkflowState initialState,
                             ExecutionSettings settings, Map<String, Object> parameters,
                             CommandQueue commands, SchedulerDependencies deps) {
        this.workflowId = workflowId;
        this.dag = dag;
        this.state = initialState;
        this.settings = settings;
        this.parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        this.commands = commands;
        this.deps = deps;
    }

    // ── Driving ─────────────────────────────────────────────────────────

    /**
     * Advances the workflow by at most one layer. Once terminal, returns the terminal outcome again.
     *
     * @throws CycleDetectedException if no remaining task can ever run
     */
    public synchronized StepOutcome step() {
        if (terminalOutcome != null) {
            return terminalOutcome;
        }
        MdcContext.setWorkflow(workflowId);
        try {
            if (status == SchedulerStatus.CREATED) {
                status = SchedulerStatus.RUNNING;
            }
            StepOutcome early = applyCommands(List.of());
            if (early != null) {
                return early;
            }
            if (status == SchedulerStatus.PAUSED_FOR_APPROVAL) {
                return StepOutcome.awaitingApproval(workflowId, lastLayer, List.of(), state.tasks(),
                        lastCheckpointId, pendingSummary);
            }
            return runNextLayer();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Rehydrates from a checkpoint and continues with the layer after it.
     *
     * @throws CheckpointNotFoundException if the id is unknown or belongs to another workflow
     */
    public synchronized StepOutcome resume(DagStructure resumeDag, String checkpointId) {
        WorkflowCheckpoint checkpoint = deps.checkpointer().load(checkpointId);
        restore(checkpoint);
        if (resumeDag != null) {
            this.dag = resumeDag;
        }
        log.info("Workflow {} resumed from checkpoint {} at layer {}", workflowId, checkpointId, nextLayer);
        return step();
    }

    private void restore(WorkflowCheckpoint checkpoint) {
        if (!workflowId.equals(checkpoint.workflowId())) {
            throw new CheckpointNotFoundException("Checkpoint " + checkpoint.checkpointId()
                    + " does not belong to workflow " + workflowId);
        }
        this.state = checkpoint.state();
        this.dag = checkpoint.dag();
        this.skipped.clear();
        this.skipped.addAll(checkpoint.skipped());
        this.replans = checkpoint.replans();
        this.lastLayer = checkpoint.layer();
        this.nextLayer = checkpoint.layer() + 1;
        this.lastCheckpointId = checkpoint.checkpointId();
        this.pendingSummary = null;
        this.status = SchedulerStatus.RUNNING;
    }

    private StepOutcome runNextLayer() {
        LayerPlan plan;
        while (true) {
            plan = planNext();
            if (plan.isComplete()) {
                return complete(List.of());
            }
            if (plan.isHalted()) {
                return abort(LayerPlanner.haltMessage(plan), List.of());
            }
            if (plan.isCycle()) {
                throw new CycleDetectedException(LayerPlanner.cycleMessage(plan));
            }
            if (!layersToSkip.remove(nextLayer)) {
                break;
            }
            markSkipped(plan.eligible().stream().map(Task::id).toList(), "layer " + nextLayer + " skipped");
            nextLayer++;
        }

        int layer = nextLayer;
        List<Task> layerTasks = plan.eligible().stream().map(this::withoutSkippedDependencies).toList();
        MdcContext.setLayer(workflowId, layer);
        log.info("Layer {}: running {} task(s) {}", layer, layerTasks.size(),
                layerTasks.stream().map(Task::id).toList());
        deps.eventBus().publish(WorkflowEvent.of(WorkflowEvent.LAYER_STARTED, workflowId, null,
                Map.of("layer", layer, "tasks", layerTasks.stream().map(Task::id).toList())));

        var context = new ExecutionContext(workflowId, parameters, state.resultsById(), settings);
        List<TaskResult> results = deps.dispatcher().dispatch(layer, layerTasks, context);

        state = WorkflowStateReducers.updateState(state, StateUpdate.none()
                .withLayer(layer)
                .withTasks(results)
                .withDecisions(decisionsFrom(layerTasks, results)));
        lastLayer = layer;
        nextLayer = layer + 1;
        lastCheckpointId = saveCheckpoint(layer);
        deps.records().extendExpiration(workflowId);

        if (requiresApproval(layerTasks)) {
            List<Task> upcoming = deps.planner().plan(dag, state.resultsById(), skipped, state.decisions()).eligible();
            pendingSummary = deps.summaries().build(layer, layerTasks, state.tasks(), upcoming);
            status = SchedulerStatus.PAUSED_FOR_APPROVAL;
            log.info("Layer {} awaiting approval (checkpoint {})", layer, lastCheckpointId);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("layer", layer);
            payload.put("checkpointId", String.valueOf(lastCheckpointId));
            payload.put("summary", pendingSummary);
            deps.eventBus().publish(WorkflowEvent.of(WorkflowEvent.DECISION_REQUIRED, workflowId, null, payload));
            return StepOutcome.awaitingApproval(workflowId, layer, results, state.tasks(), lastCheckpointId, pendingSummary);
        }

        StepOutcome early = applyCommands(results);
        if (early != null) {
            return early;
        }
        if (planNext().isComplete()) {
            return complete(results);
        }
        return StepOutcome.paused(workflowId, layer, results, state.tasks(), lastCheckpointId);
    }

    private LayerPlan planNext() {
        LayerPlan plan = deps.planner().plan(dag, state.resultsById(), skipped, state.decisions());
        markSkipped(plan.skipped(), "condition not met");
        return plan;
    }

    private void markSkipped(List<String> taskIds, String reason) {
        for (String taskId : taskIds) {
            if (skipped.add(taskId)) {
                log.info("Task {} skipped: {}", taskId, reason);
                deps.eventBus().publish(WorkflowEvent.of(WorkflowEvent.TASK_SKIPPED, workflowId, taskId,
                        Map.of("reason", reason)));
            }
        }
    }

    private Task withoutSkippedDependencies(Task task) {
        if (task.dependsOn().stream().noneMatch(skipped::contains)) {
            return task;
        }
        return task.withDependsOn(task.dependsOn().stream().filter(d -> !skipped.contains(d)).toList());
    }

    private static List<Decision> decisionsFrom(List<Task> layerTasks, List<TaskResult> results) {
        Map<String, TaskResult> byId = new LinkedHashMap<>();
        results.forEach(r -> byId.put(r.taskId(), r));
        List<Decision> decisions = new ArrayList<>();
        for (Task task : layerTasks) {
            Optional<String> node = LayerPlanner.decisionNodeOf(task);
            TaskResult result = byId.get(task.id());
            if (node.isPresent() && result != null && result.isSuccess()) {
                decisions.add(Decision.branch(node.get(), String.valueOf(result.output())));
            }
        }
        return decisions;
    }

    private boolean requiresApproval(List<Task> layerTasks) {
        return switch (settings.approvalMode()) {
            case NEVER -> false;
            case ALWAYS -> true;
            case CRITICAL_ONLY -> layerTasks.stream().anyMatch(Task::sideEffects);
        };
    }

    private String saveCheckpoint(int layer) {
        try {
            WorkflowCheckpoint checkpoint = deps.checkpointer().save(workflowId, layer, state, dag, skipped, replans);
            deps.eventBus().publish(WorkflowEvent.of(WorkflowEvent.CHECKPOINT_SAVED, workflowId, null,
                    Map.of("checkpointId", checkpoint.checkpointId(), "layer", layer)));
            return checkpoint.checkpointId();
        } catch (RuntimeException e) {
            log.warn("Checkpoint save failed for workflow {} at layer {}; continuing without it: {}",
                    workflowId, layer, e.getMessage(), e);
            return null;
        }
    }

    // ── Commands ────────────────────────────────────────────────────────

    private StepOutcome applyCommands(List<TaskResult> layerResults) {
        List<Command> drained = commands.processCommands();
        for (int i = 0; i < drained.size(); i++) {
            Command command = drained.get(i);
            log.debug("Applying command {}", command.type().wireName());
            StepOutcome outcome = apply(command, layerResults);
            if (outcome != null) {
                if (i + 1 < drained.size()) {
                    log.info("Workflow {} ended; {} later command(s) not applied", workflowId, drained.size() - i - 1);
                }
                return outcome;
            }
        }
        return null;
    }

    private StepOutcome apply(Command command, List<TaskResult> layerResults) {
        if (command instanceof ContinueCommand) {
            if (status == SchedulerStatus.PAUSED_FOR_APPROVAL) {
                log.info("Continue received while awaiting approval; approval still required");
            }
            return null;
        }
        if (command instanceof AbortCommand abort) {
            return abort(abort.reason(), layerResults);
        }
        if (command instanceof ApprovalResponseCommand approval) {
            return applyApproval(approval.checkpointId(), approval.granted(), approval.feedback(), layerResults);
        }
        if (command instanceof CheckpointResponseCommand response) {
            return applyCheckpointResponse(response, layerResults);
        }
        if (command instanceof ReplanDagCommand replan) {
            replan(replan);
            return null;
        }
        if (command instanceof InjectTasksCommand inject) {
            List<Task> added = deps.dagCodec().tasksFromWire(inject.tasks());
            merge(added);
            log.info("Injected {} task(s) into workflow {} (requested layer {})",
                    added.size(), workflowId, inject.targetLayer());
            return null;
        }
        if (command instanceof SkipLayerCommand skip) {
            if (skip.layerIndex() < nextLayer) {
                log.warn("Layer {} already ran; skip ignored", skip.layerIndex());
            } else {
                layersToSkip.add(skip.layerIndex());
                log.info("Layer {} will be skipped: {}", skip.layerIndex(), skip.reason());
            }
            return null;
        }
        if (command instanceof ModifyArgsCommand modify) {
            modifyArguments(modify);
            return null;
        }
        log.warn("Unhandled command type {}", command.type().wireName());
        return null;
    }

    private StepOutcome applyApproval(String checkpointId, boolean approved, String feedback,
                                      List<TaskResult> layerResults) {
        if (status != SchedulerStatus.PAUSED_FOR_APPROVAL) {
            log.warn("Approval for checkpoint {} received but no approval is pending; ignored", checkpointId);
            return null;
        }
        if (lastCheckpointId != null && !lastCheckpointId.equals(checkpointId)) {
            log.debug("Approval names checkpoint {}, pending checkpoint is {}", checkpointId, lastCheckpointId);
        }
        recordApproval(checkpointId, approved, feedback);
        if (!approved) {
            return abort("Workflow aborted by user" + (feedback != null && !feedback.isBlank() ? ": " + feedback : ""),
                    layerResults);
        }
        status = SchedulerStatus.RUNNING;
        pendingSummary = null;
        log.info("Layer {} approved", lastLayer);
        return null;
    }

    private StepOutcome applyCheckpointResponse(CheckpointResponseCommand response, List<TaskResult> layerResults) {
        if (response.decision() == CheckpointResponseCommand.Decision.ROLLBACK) {
            restore(deps.checkpointer().load(response.checkpointId()));
            deps.records().update(workflowId, dag);
            log.info("Workflow {} rolled back to checkpoint {} (layer {})",
                    workflowId, response.checkpointId(), lastLayer);
            return null;
        }
        if (status == SchedulerStatus.PAUSED_FOR_APPROVAL) {
            return applyApproval(response.checkpointId(), true, response.decision().name().toLowerCase(Locale.ROOT), layerResults);
        }
        return null;
    }

    private void recordApproval(String checkpointId, boolean approved, String feedback) {
        String outcome = approved ? "approved" : "rejected";
        String text = "Layer " + lastLayer + " " + outcome + (feedback != null && !feedback.isBlank() ? ": " + feedback : "");
        StateUpdate update = StateUpdate.none().withMessages(List.of(Message.of("user", text)));
        // an approval decision needs a task result to pair with
        if (state.decisions().size() < state.tasks().size()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("layer", lastLayer);
            if (checkpointId != null) {
                metadata.put("checkpointId", checkpointId);
            }
            if (feedback != null) {
                metadata.put("feedback", feedback);
            }
            update = update.withDecisions(List.of(Decision.human("Approval of layer " + lastLayer, outcome, metadata)));
        }
        state = WorkflowStateReducers.updateState(state, update);
    }

    private void replan(ReplanDagCommand command) {
        if (replans >= settings.maxReplans()) {
            log.warn("Replan limit ({}) reached for workflow {}; replan ignored", settings.maxReplans(), workflowId);
            return;
        }
        List<Task> added;
        if (command.hasTasks()) {
            added = deps.dagCodec().tasksFromWire(command.tasks());
        } else if (deps.replanner() != null) {
            added = deps.replanner().replan(new DagReplanner.Request(workflowId, dag, state.resultsById(),
                    command.newRequirement(), command.availableContext()));
        } else {
            log.warn("No replanner configured; replan for '{}' ignored", command.newRequirement());
            return;
        }
        if (added == null || added.isEmpty()) {
            log.info("Replan for '{}' produced no tasks", command.newRequirement());
            return;
        }
        merge(added);
        replans++;
        state = WorkflowStateReducers.updateState(state, StateUpdate.none()
                .withMessages(List.of(Message.of("system", "Replanned: " + command.newRequirement()))));
        deps.eventBus().publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_REPLANNED, workflowId, null,
                Map.of("requirement", command.newRequirement(),
                       "added", added.stream().map(Task::id).toList(),
                       "replans", replans)));
        log.info("Workflow {} replanned ({} of {}): added {}", workflowId, replans, settings.maxReplans(),
                added.stream().map(Task::id).toList());
    }

    private void merge(List<Task> added) {
        dag = dag.augment(added);
        deps.records().update(workflowId, dag);
    }

    private void modifyArguments(ModifyArgsCommand command) {
        Optional<Task> task = dag.task(command.taskId());
        if (task.isEmpty()) {
            log.warn("modify_args names unknown task {}; ignored", command.taskId());
            return;
        }
        if (isSettled(command.taskId())) {
            log.warn("Task {} already ran or was skipped; modify_args ignored", command.taskId());
            return;
        }
        Map<String, Object> arguments = new LinkedHashMap<>(task.get().arguments());
        arguments.putAll(command.updates());
        dag = dag.replace(task.get().withArguments(arguments));
        deps.records().update(workflowId, dag);
        log.info("Arguments of task {} updated: {}", command.taskId(), command.updates().keySet());
    }

    private boolean isSettled(String taskId) {
        return skipped.contains(taskId) || state.resultsById().containsKey(taskId);
    }

    // ── Terminal transitions ────────────────────────────────────────────

    private StepOutcome complete(List<TaskResult> layerResults) {
        status = SchedulerStatus.COMPLETED;
        terminalOutcome = StepOutcome.completed(workflowId, lastLayer, layerResults, state.tasks(), lastCheckpointId);
        log.info("Workflow {} completed: {} result(s), {} skipped", workflowId, state.tasks().size(), skipped.size());
        deps.eventBus().publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_COMPLETED, workflowId, null,
                Map.of("results", state.tasks().size(), "skipped", skipped.size())));
        if (deps.metrics() != null) {
            deps.metrics().recordWorkflowOutcome("completed");
        }
        return terminalOutcome;
    }

    private StepOutcome abort(String reason, List<TaskResult> layerResults) {
        status = SchedulerStatus.ABORTED;
        terminalOutcome = StepOutcome.aborted(workflowId, lastLayer, layerResults, state.tasks(), lastCheckpointId, reason);
        log.warn("Workflow {} aborted: {}", workflowId, reason);
        deps.eventBus().publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_ABORTED, workflowId, null,
                Map.of("reason", String.valueOf(reason), "results", state.tasks().size())));
        if (deps.metrics() != null) {
            deps.metrics().recordWorkflowOutcome("aborted");
        }
        return terminalOutcome;
    }

    // ── Accessors ───────────────────────────────────────────────────────

    public String workflowId() {
        return workflowId;
    }

    public synchronized SchedulerStatus status() {
        return status;
    }

    public synchronized WorkflowState state() {
        return state;
    }

    public synchronized DagStructure dag() {
        return dag;
    }

    public synchronized Set<String> skippedTaskIds() {
        return Set.copyOf(skipped);
    }

    public synchronized String lastCheckpointId() {
        return lastCheckpointId;
    }

    public synchronized int nextLayer() {
        return nextLayer;
    }

    public CommandQueue commands() {
        return commands;
    }
}
