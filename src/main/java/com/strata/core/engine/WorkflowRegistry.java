package com.strata.core.engine;

import com.strata.core.scheduler.WorkflowScheduler;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live schedulers of this process, one per workflow id.
 */
@Component
public class WorkflowRegistry {

    private final ConcurrentHashMap<String, WorkflowScheduler> live = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the workflow already has a live scheduler
     */
    public void register(WorkflowScheduler scheduler) {
        WorkflowScheduler existing = live.putIfAbsent(scheduler.workflowId(), scheduler);
        if (existing != null && existing != scheduler) {
            throw new IllegalStateException("Workflow " + scheduler.workflowId() + " already has a live scheduler");
        }
    }

    public Optional<WorkflowScheduler> find(String workflowId) {
        return Optional.ofNullable(live.get(workflowId));
    }

    public void release(String workflowId) {
        live.remove(workflowId);
    }

    public Set<String> activeWorkflowIds() {
        return Set.copyOf(live.keySet());
    }
}
