package com.strata.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for workflow execution events.
 * <p>
 * Subscribers either follow one workflow or receive every event. Safe for concurrent
 * publish and subscribe; a throwing subscriber never affects the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<WorkflowEvent>>> workflowSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<WorkflowEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(WorkflowEvent event) {
        log.debug("Publishing {} for workflow {}", event.eventType(), event.workflowId());

        List<Consumer<WorkflowEvent>> subs = workflowSubscribers.get(event.workflowId());
        if (subs != null) {
            for (Consumer<WorkflowEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<WorkflowEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a single workflow.
     *
     * @param workflowId the workflow to follow
     * @param consumer   callback invoked for each event
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String workflowId, Consumer<WorkflowEvent> consumer) {
        workflowSubscribers.computeIfAbsent(workflowId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<WorkflowEvent>> subs = workflowSubscribers.get(workflowId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    workflowSubscribers.remove(workflowId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<WorkflowEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<WorkflowEvent> subscriber, WorkflowEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
