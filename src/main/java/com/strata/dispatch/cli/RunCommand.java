package com.strata.dispatch.cli;

import com.strata.core.config.ApprovalMode;
import com.strata.core.engine.WorkflowEngine;
import com.strata.core.engine.WorkflowRunOptions;
import com.strata.core.events.EventBus;
import com.strata.core.model.DagCodec;
import com.strata.core.model.DagStructure;
import com.strata.core.scheduler.StepOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI command: strata run &lt;dag.json&gt;
 * <p>
 * Loads a DAG file, starts a workflow and runs it layer by layer, stopping at
 * approval checkpoints to ask for a decision.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a DAG workflow")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "DAG file in JSON format")
    private Path dagFile;

    @Option(names = {"--intent", "-i"}, description = "What the workflow is for")
    private String intent;

    @Option(names = {"--approval", "-a"},
            description = "Approval mode: never, always, critical_only (default: configured mode)")
    private String approval;

    @Option(names = {"--param", "-p"}, description = "Run parameter as key=value (repeatable)")
    private Map<String, String> params = new LinkedHashMap<>();

    @Option(names = {"--yes", "-y"}, description = "Approve every checkpoint without prompting")
    private boolean autoApprove;

    @Option(names = {"--watch", "-w"}, description = "Print workflow events as they happen")
    private boolean watch;

    private final WorkflowEngine engine;
    private final DagCodec dagCodec;
    private final EventBus eventBus;

    public RunCommand(WorkflowEngine engine, DagCodec dagCodec, EventBus eventBus) {
        this.engine = engine;
        this.dagCodec = dagCodec;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        ApprovalMode mode;
        try {
            mode = ApprovalMode.fromWire(approval);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid approval mode: " + approval
                    + ". Valid modes: never, always, critical_only");
            return;
        }

        DagStructure dag;
        try {
            dag = dagCodec.read(dagFile);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Cannot load DAG: " + rootCauseMessage(e));
            return;
        }
        ConsoleOutput.info("Loaded " + dag.size() + " task(s) from " + dagFile);

        var options = WorkflowRunOptions.defaults()
                .withIntent(intent)
                .withApprovalMode(mode)
                .withParameters(new LinkedHashMap<>(params));

        String workflowId = engine.start(dag, options);
        ConsoleOutput.info("Workflow " + workflowId);
        EventBus.Subscription subscription = watch
                ? eventBus.subscribe(workflowId, ConsoleOutput::watchEvent)
                : null;
        try {
            StepOutcome outcome = new ApprovalPrompt(engine, autoApprove).drive(engine.runToPause(workflowId));
            if (!outcome.layerResults().isEmpty()) {
                ConsoleOutput.layer(outcome.layerIndex(), outcome.layerResults());
            }
            ConsoleOutput.outcome(outcome);
        } catch (Exception e) {
            ConsoleOutput.error("Workflow failed: " + rootCauseMessage(e));
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
