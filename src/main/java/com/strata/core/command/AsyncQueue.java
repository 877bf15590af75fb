package com.strata.core.command;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Unbounded FIFO queue whose consumers wait without polling.
 * <p>
 * {@link #dequeue()} returns a future that is already complete when an item is queued,
 * otherwise it is parked and completed by a later {@link #enqueue}. Parked consumers are
 * served in the order they arrived. A parked future that is completed from elsewhere
 * (for example by a timeout) gives up its turn and never swallows an item.
 *
 * @param <T> item type; null items are not allowed
 */
public class AsyncQueue<T> {

    private final Object lock = new Object();
    private final Deque<T> items = new ArrayDeque<>();
    private final Deque<CompletableFuture<T>> waiters = new ArrayDeque<>();

    public void enqueue(T item) {
        Objects.requireNonNull(item, "item must not be null");
        while (true) {
            CompletableFuture<T> waiter;
            synchronized (lock) {
                waiter = pollLiveWaiter();
                if (waiter == null) {
                    items.addLast(item);
                    return;
                }
            }
            // completed outside the lock so dependent stages never run while holding it
            if (waiter.complete(item)) {
                return;
            }
        }
    }

    public CompletableFuture<T> dequeue() {
        synchronized (lock) {
            T item = items.pollFirst();
            if (item != null) {
                return CompletableFuture.completedFuture(item);
            }
            var waiter = new CompletableFuture<T>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    /**
     * Blocks until an item is available.
     */
    public T take() throws InterruptedException {
        try {
            return dequeue().get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Queue consumer completed exceptionally", e.getCause());
        }
    }

    /**
     * Waits up to {@code timeout} for the next item.
     *
     * @return the item, or {@code null} if none arrived in time
     */
    public T poll(Duration timeout) throws InterruptedException {
        CompletableFuture<T> next = dequeue();
        try {
            return next.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (next.complete(null)) {
                return null;
            }
            // an item was handed over between the timeout and our completion
            return next.join();
        } catch (InterruptedException e) {
            if (!next.complete(null)) {
                // keep the handed-over item instead of losing it
                T delivered = next.join();
                synchronized (lock) {
                    items.addFirst(delivered);
                }
            }
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Queue consumer completed exceptionally", e.getCause());
        }
    }

    /**
     * Removes and returns everything queued right now. Never waits.
     */
    public List<T> drainSync() {
        synchronized (lock) {
            var drained = new ArrayList<>(items);
            items.clear();
            return drained;
        }
    }

    /**
     * Removes and returns the queued items accepted by {@code filter}; the others stay
     * queued in their original relative order.
     */
    public List<T> drainMatching(Predicate<? super T> filter) {
        synchronized (lock) {
            var matched = new ArrayList<T>();
            Iterator<T> it = items.iterator();
            while (it.hasNext()) {
                T item = it.next();
                if (filter.test(item)) {
                    matched.add(item);
                    it.remove();
                }
            }
            return matched;
        }
    }

    /**
     * Drops queued items. Parked consumers keep waiting for the next enqueue.
     */
    public void clear() {
        synchronized (lock) {
            items.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return items.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Number of consumers currently parked. */
    int waitingConsumers() {
        synchronized (lock) {
            waiters.removeIf(CompletableFuture::isDone);
            return waiters.size();
        }
    }

    private CompletableFuture<T> pollLiveWaiter() {
        CompletableFuture<T> waiter;
        while ((waiter = waiters.pollFirst()) != null) {
            if (!waiter.isDone()) {
                return waiter;
            }
        }
        return null;
    }
}
