package com.strata.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for workflow execution.
 */
@Service
public class WorkflowMetrics {

    private final MeterRegistry registry;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param kind   task kind wire name
     * @param status task status wire name
     */
    public void recordTaskDuration(String kind, String status, long ms) {
        Timer.builder("strata.task.duration")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordLayerSize(int taskCount) {
        DistributionSummary.builder("strata.layer.size")
                .description("Number of tasks dispatched per layer")
                .register(registry)
                .record(taskCount);
    }

    public void recordWorkflowOutcome(String outcome) {
        Counter.builder("strata.workflow.outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementRejectedCommands(String type) {
        Counter.builder("strata.command.rejected")
                .description("Commands rejected by validation")
                .tag("type", type)
                .register(registry)
                .increment();
    }
}
