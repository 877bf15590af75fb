package com.strata.core.scheduler;

import com.strata.core.events.EventBus;
import com.strata.core.events.WorkflowEvent;
import com.strata.core.execution.ExecutionContext;
import com.strata.core.execution.ExecutorConfigurationException;
import com.strata.core.execution.TaskExecutor;
import com.strata.core.execution.TaskOutcome;
import com.strata.core.logging.MdcContext;
import com.strata.core.metrics.WorkflowMetrics;
import com.strata.core.model.Task;
import com.strata.core.model.TaskKind;
import com.strata.core.model.TaskResult;
import com.strata.core.routing.DependencyResolution;
import com.strata.core.routing.DependencyResolver;
import com.strata.core.routing.TaskRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs all tasks of one layer concurrently and waits for every one of them.
 * <p>
 * Concurrency is bounded by a semaphore at {@code maxParallel}; each task is bounded by
 * {@code taskTimeoutMs} from the moment it acquires a permit. Per task: route by kind,
 * resolve dependencies, execute, and turn the outcome into a {@link TaskResult}. Failures
 * of side-effect-free code tasks become {@code failed_safe}, everything else {@code error}.
 * Results are returned in the order of the given tasks.
 */
@Component
public class LayerDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LayerDispatcher.class);

    private final TaskRouter router;
    private final DependencyResolver resolver;
    private final Map<TaskKind, TaskExecutor> executors = new EnumMap<>(TaskKind.class);
    private final EventBus eventBus;
    private final WorkflowMetrics metrics;

    @Autowired
    public LayerDispatcher(TaskRouter router, DependencyResolver resolver, List<TaskExecutor> executors,
                           EventBus eventBus, @Autowired(required = false) WorkflowMetrics metrics) {
        this.router = router;
        this.resolver = resolver;
        for (TaskExecutor executor : executors) {
            this.executors.put(executor.kind(), executor);
        }
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    LayerDispatcher(List<TaskExecutor> executors) {
        this(new TaskRouter(), new DependencyResolver(), executors, new EventBus(), null);
    }

    /**
     * @throws ExecutorConfigurationException if a task needs a collaborator that is not configured
     */
    public List<TaskResult> dispatch(int layerIndex, List<Task> tasks, ExecutionContext context) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        String workflowId = context.workflowId();
        var semaphore = new Semaphore(Math.max(1, context.settings().maxParallel()));
        long timeoutMs = context.settings().taskTimeoutMs();
        Map<String, String> callerMdc = MdcContext.capture();
        ExecutorService pool = Executors.newCachedThreadPool(workerThreads(workflowId, layerIndex));

        try {
            var futures = new ArrayList<CompletableFuture<TaskResult>>();
            for (Task task : tasks) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    MdcContext.restore(callerMdc);
                    MdcContext.setTask(workflowId, task.id(), router.classify(task).wireName());
                    try {
                        semaphore.acquire();
                        try {
                            return runWithTimeout(task, context, pool, timeoutMs);
                        } finally {
                            semaphore.release();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return failure(task, "Interrupted: " + e.getMessage(), 0);
                    } finally {
                        MdcContext.clear();
                    }
                }, pool));
            }

            var results = new ArrayList<TaskResult>();
            for (CompletableFuture<TaskResult> future : futures) {
                try {
                    results.add(future.join());
                } catch (CompletionException e) {
                    if (e.getCause() instanceof ExecutorConfigurationException config) {
                        throw config;
                    }
                    throw e;
                }
            }
            if (metrics != null) {
                metrics.recordLayerSize(tasks.size());
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private TaskResult runWithTimeout(Task task, ExecutionContext context, ExecutorService pool,
                                      long timeoutMs) throws InterruptedException {
        long start = System.currentTimeMillis();
        TaskKind kind = router.classify(task);
        Map<String, String> mdc = MdcContext.capture();
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.TASK_STARTED, context.workflowId(), task.id(),
                Map.of("kind", kind.wireName(), "tool", task.displayTool())));
        log.info("Running task {} [{}] {}", task.id(), kind.wireName(), task.displayTool());

        var execution = CompletableFuture.supplyAsync(() -> {
            MdcContext.restore(mdc);
            try {
                return runTask(task, kind, context);
            } finally {
                MdcContext.clear();
            }
        }, pool);

        TaskResult result;
        try {
            result = execution.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            execution.cancel(true);
            log.warn("Task {} timed out after {} ms", task.id(), timeoutMs);
            result = failure(task, "Task timed out after " + timeoutMs + " ms", System.currentTimeMillis() - start);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ExecutorConfigurationException config) {
                throw config;
            }
            log.error("Task {} failed unexpectedly: {}", task.id(), e.getCause().getMessage(), e.getCause());
            result = failure(task, String.valueOf(e.getCause().getMessage()), System.currentTimeMillis() - start);
        }
        publishResult(context.workflowId(), task, kind, result);
        return result;
    }

    private TaskResult runTask(Task task, TaskKind kind, ExecutionContext context) {
        long start = System.currentTimeMillis();
        TaskExecutor executor = executors.get(kind);
        if (executor == null) {
            throw new ExecutorConfigurationException("No executor registered for task kind " + kind.wireName());
        }

        DependencyResolution resolution = resolver.resolve(task.dependsOn(), context.priorResults());
        if (!resolution.isResolved()) {
            return failure(task, resolution.error(), System.currentTimeMillis() - start);
        }

        TaskOutcome outcome;
        try {
            outcome = executor.execute(task, resolution.dependencies(), context);
        } catch (ExecutorConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Executor for task {} threw: {}", task.id(), e.getMessage(), e);
            outcome = TaskOutcome.failure(String.valueOf(e.getMessage()), System.currentTimeMillis() - start);
        }
        if (outcome.success()) {
            return TaskResult.success(task.id(), outcome.output(), outcome.elapsedMs());
        }
        return failure(task, outcome.error(), outcome.elapsedMs());
    }

    private TaskResult failure(Task task, String error, long elapsedMs) {
        return router.isSafeToFail(task)
                ? TaskResult.failedSafe(task.id(), error, elapsedMs)
                : TaskResult.error(task.id(), error, elapsedMs);
    }

    private void publishResult(String workflowId, Task task, TaskKind kind, TaskResult result) {
        long elapsed = result.elapsedMs() != null ? result.elapsedMs() : 0L;
        if (metrics != null) {
            metrics.recordTaskDuration(kind.wireName(), result.status().wireName(), elapsed);
        }
        switch (result.status()) {
            case SUCCESS -> {
                log.info("Task {} succeeded in {} ms", task.id(), elapsed);
                eventBus.publish(WorkflowEvent.of(WorkflowEvent.TASK_COMPLETED, workflowId, task.id(),
                        Map.of("elapsedMs", elapsed)));
            }
            case FAILED_SAFE -> {
                log.warn("Task {} failed safely: {}", task.id(), result.error());
                eventBus.publish(WorkflowEvent.of(WorkflowEvent.TASK_WARNING, workflowId, task.id(),
                        Map.of("error", String.valueOf(result.error()), "elapsedMs", elapsed)));
            }
            case ERROR -> {
                log.error("Task {} failed: {}", task.id(), result.error());
                eventBus.publish(WorkflowEvent.of(WorkflowEvent.TASK_FAILED, workflowId, task.id(),
                        Map.of("error", String.valueOf(result.error()), "elapsedMs", elapsed)));
            }
        }
    }

    private static ThreadFactory workerThreads(String workflowId, int layerIndex) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "layer-" + layerIndex + "-" + shortId(workflowId) + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static String shortId(String workflowId) {
        return workflowId.length() > 8 ? workflowId.substring(0, 8) : workflowId;
    }
}
