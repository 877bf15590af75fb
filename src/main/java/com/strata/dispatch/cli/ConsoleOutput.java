package com.strata.dispatch.cli;

import com.strata.core.events.WorkflowEvent;
import com.strata.core.model.TaskResult;
import com.strata.core.scheduler.StepOutcome;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Strata CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STRATA v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STRATA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void layer(int layerIndex, List<TaskResult> results) {
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [LAYER " + layerIndex + "]|@ " +
                "@|fg(green) " + (results.size() - failed) + " succeeded|@" +
                (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "")));
        for (TaskResult result : results) {
            taskResult(result);
        }
    }

    public static void taskResult(TaskResult result) {
        String status = switch (result.status()) {
            case SUCCESS -> "@|fg(green) SUCCESS|@";
            case FAILED_SAFE -> "@|fg(yellow) FAILED_SAFE|@";
            case ERROR -> "@|fg(red) ERROR|@";
        };
        String detail = result.isSuccess()
                ? String.valueOf(result.output())
                : result.error();
        String elapsed = result.elapsedMs() != null ? " (" + formatDuration(result.elapsedMs()) + ")" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + result.taskId() + elapsed + " " + truncate(detail, 100)));
    }

    public static void approvalSummary(String summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Approval required|@"));
        if (summary != null) {
            System.out.println(summary);
        }
        System.out.println("──────────────────────────────────");
    }

    public static void outcome(StepOutcome outcome) {
        System.out.println();
        switch (outcome.kind()) {
            case COMPLETED -> success("Workflow " + outcome.workflowId() + " completed with "
                    + outcome.results().size() + " result(s).");
            case ABORTED -> error("Workflow " + outcome.workflowId() + " aborted: " + outcome.reason());
            case AWAITING_APPROVAL -> info("Workflow " + outcome.workflowId() + " awaiting approval at checkpoint "
                    + outcome.checkpointId());
            case PAUSED -> info("Workflow " + outcome.workflowId() + " paused after layer " + outcome.layerIndex());
        }
    }

    public static void watchEvent(WorkflowEvent event) {
        String prefix = switch (event.eventType()) {
            case WorkflowEvent.WORKFLOW_STARTED -> "@|fg(cyan) [WORKFLOW]|@";
            case WorkflowEvent.LAYER_STARTED -> "@|bold,fg(yellow) [LAYER]|@";
            case WorkflowEvent.TASK_STARTED, WorkflowEvent.TASK_COMPLETED -> "@|fg(blue) [TASK]|@";
            case WorkflowEvent.TASK_WARNING, WorkflowEvent.TASK_SKIPPED -> "@|fg(yellow) [TASK]|@";
            case WorkflowEvent.TASK_FAILED -> "@|fg(red) [TASK]|@";
            case WorkflowEvent.CHECKPOINT_SAVED -> "@|fg(magenta) [CHECKPOINT]|@";
            case WorkflowEvent.DECISION_REQUIRED -> "@|fg(yellow),bold [DECISION]|@";
            case WorkflowEvent.WORKFLOW_REPLANNED -> "@|fg(cyan) [REPLAN]|@";
            case WorkflowEvent.WORKFLOW_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case WorkflowEvent.WORKFLOW_ABORTED -> "@|fg(red),bold [ABORTED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.payload()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }
}
