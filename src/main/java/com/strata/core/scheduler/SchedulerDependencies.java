package com.strata.core.scheduler;

import com.strata.core.events.EventBus;
import com.strata.core.metrics.WorkflowMetrics;
import com.strata.core.model.DagCodec;
import com.strata.core.persistence.WorkflowCheckpointer;
import com.strata.core.persistence.WorkflowRecordStore;

/**
 * Shared collaborators of every {@link WorkflowScheduler}.
 *
 * @param metrics   nullable
 * @param replanner nullable; without one, replan commands that carry no tasks are ignored
 */
public record SchedulerDependencies(
    LayerPlanner planner,
    LayerDispatcher dispatcher,
    WorkflowCheckpointer checkpointer,
    WorkflowRecordStore records,
    EventBus eventBus,
    WorkflowMetrics metrics,
    DagCodec dagCodec,
    DagReplanner replanner,
    ApprovalSummaryBuilder summaries
) {}
