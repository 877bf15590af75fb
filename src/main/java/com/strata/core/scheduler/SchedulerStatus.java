package com.strata.core.scheduler;

/**
 * Lifecycle of a {@link WorkflowScheduler}.
 */
public enum SchedulerStatus {
    CREATED,
    RUNNING,
    PAUSED_FOR_APPROVAL,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
