package io.feedloom.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Hands events from any thread to the single consumer thread.
 *
 * <p>Producers call {@link #publish(BridgeEvent)} from any thread. Exactly one thread binds itself
 * as the consumer and drains the queue with {@link #dispatchPending()} or
 * {@link #awaitAndDispatch(Duration)}; subscribers therefore always run on that thread. The queue is
 * a single FIFO, so events for one key arrive in the order they were published.
 *
 * <p>While no consumer is bound only events that report {@link BridgeEvent#retainedWithoutConsumer()}
 * are queued; the rest are counted and dropped. A bound consumer is expected to keep draining.
 */
public final class EventBridge {
    private static final Logger log = LoggerFactory.getLogger(EventBridge.class);

    private final LinkedBlockingQueue<BridgeEvent> queue = new LinkedBlockingQueue<>();
    private final Map<EventKey, List<Consumer<BridgeEvent>>> keyed = new ConcurrentHashMap<>();
    private final List<Consumer<BridgeEvent>> catchAll = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private volatile Thread consumer;

    public void publish(BridgeEvent event) {
        Objects.requireNonNull(event, "event");
        if (consumer == null && !event.retainedWithoutConsumer()) {
            dropped.incrementAndGet();
            log.trace("No consumer bound, dropping {}", event.key());
            return;
        }
        queue.add(event);
    }

    /**
     * Binds the calling thread as the consumer. Re-binding from the same thread is a no-op.
     *
     * @throws IllegalStateException if another live thread is already bound
     */
    public synchronized void bindConsumer() {
        Thread current = Thread.currentThread();
        Thread bound = consumer;
        if (bound != null && bound != current && bound.isAlive()) {
            throw new IllegalStateException("EventBridge already bound to " + bound.getName());
        }
        consumer = current;
    }

    public synchronized void unbindConsumer() {
        if (consumer == Thread.currentThread()) {
            consumer = null;
        }
    }

    public boolean isConsumerThread() {
        return consumer == Thread.currentThread();
    }

    public Subscription subscribe(EventKey key, Consumer<BridgeEvent> listener) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(listener, "listener");
        List<Consumer<BridgeEvent>> listeners = keyed.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>());
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public Subscription subscribeAll(Consumer<BridgeEvent> listener) {
        Objects.requireNonNull(listener, "listener");
        catchAll.add(listener);
        return () -> catchAll.remove(listener);
    }

    /**
     * Delivers every event queued so far without waiting.
     *
     * @return number of events delivered
     */
    public int dispatchPending() {
        checkConsumerThread();
        int delivered = 0;
        BridgeEvent event;
        while ((event = queue.poll()) != null) {
            deliver(event);
            delivered++;
        }
        return delivered;
    }

    /**
     * Waits up to {@code timeout} for the first event, then drains whatever else is queued.
     *
     * @return number of events delivered, zero if the wait timed out
     */
    public int awaitAndDispatch(Duration timeout) throws InterruptedException {
        checkConsumerThread();
        BridgeEvent first = queue.poll(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        if (first == null) {
            return 0;
        }
        deliver(first);
        return 1 + dispatchPending();
    }

    public int pendingCount() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    private void deliver(BridgeEvent event) {
        List<Consumer<BridgeEvent>> listeners = keyed.get(event.key());
        if (listeners != null) {
            for (Consumer<BridgeEvent> listener : listeners) {
                invoke(listener, event);
            }
        }
        for (Consumer<BridgeEvent> listener : catchAll) {
            invoke(listener, event);
        }
    }

    private void invoke(Consumer<BridgeEvent> listener, BridgeEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on event {} ({})", event.key(), event.getClass().getSimpleName(), e);
        }
    }

    private void checkConsumerThread() {
        Thread bound = consumer;
        if (bound != Thread.currentThread()) {
            throw new IllegalStateException("Events may only be dispatched on the bound consumer thread, current="
                    + Thread.currentThread().getName() + ", bound=" + (bound == null ? "none" : bound.getName()));
        }
    }
}
