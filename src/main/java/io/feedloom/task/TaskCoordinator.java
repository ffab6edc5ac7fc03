package io.feedloom.task;

import io.feedloom.event.EventBridge;
import io.feedloom.event.TaskEvent;
import io.feedloom.model.TaskKey;
import io.feedloom.model.TaskKind;
import io.feedloom.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Runs background work on a fixed worker pool with one in-flight task per {@link TaskKey}.
 *
 * <p>State machine: PENDING, then RUNNING, then one of DONE, FAILED or CANCELED. CANCELED is only
 * reachable from PENDING. The terminal transition happens under {@link #lock}, is published to the
 * {@link EventBridge} exactly once and removes the task from the in-flight table; anything a worker
 * reports after that is dropped.
 *
 * <p>Each task gets a deadline measured from the moment it starts running. The deadline covers the
 * single retry granted to a transient failure.
 */
public final class TaskCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);
    private static final int MAX_ATTEMPTS = 2;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<TaskKey, TaskRecord> inFlight = new HashMap<>();
    private final ThreadPoolExecutor workers;
    private final ScheduledThreadPoolExecutor watchdog;
    private final EventBridge bridge;
    private final LongSupplier clock;
    private boolean closed;

    public TaskCoordinator(int poolSize, EventBridge bridge) {
        this(poolSize, bridge, System::currentTimeMillis);
    }

    public TaskCoordinator(int poolSize, EventBridge bridge, LongSupplier clock) {
        int size = Math.max(1, poolSize);
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.clock = clock;
        this.workers = new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), daemonThreads("feedloom-worker-"));
        this.watchdog = new ScheduledThreadPoolExecutor(1, daemonThreads("feedloom-task-watchdog-"));
        this.watchdog.setRemoveOnCancelPolicy(true);
    }

    public TaskHandle submit(TaskKind kind, String id, Duration timeout, TaskWork work) {
        return submit(new TaskKey(kind, id), timeout, work);
    }

    /**
     * Queues {@code work} unless a task with the same key is pending or running, in which case the
     * returned handle is attached to that task and {@code work} is ignored.
     */
    public TaskHandle submit(TaskKey key, Duration timeout, TaskWork work) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(work, "work");
        long timeoutMs = Math.max(1L, timeout == null ? 0L : timeout.toMillis());
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("TaskCoordinator is shut down");
            }
            TaskRecord existing = inFlight.get(key);
            if (existing != null) {
                log.debug("Attaching to in-flight task {} ({})", key, existing.status);
                return new TaskHandle(key, true, existing.future, this);
            }
            TaskRecord record = new TaskRecord(key, work, timeoutMs, clock.getAsLong());
            inFlight.put(key, record);
            try {
                workers.execute(() -> run(record));
            } catch (RejectedExecutionException e) {
                inFlight.remove(key);
                throw new IllegalStateException("Worker pool rejected task " + key, e);
            }
            log.debug("Queued task {} (timeout {} ms)", key, timeoutMs);
            return new TaskHandle(key, false, record.future, this);
        } finally {
            lock.unlock();
        }
    }

    public boolean cancel(TaskKind kind, String id) {
        return cancel(new TaskKey(kind, id));
    }

    /**
     * Cancels a task that has not started yet.
     *
     * @return false if no such task is in flight or it is already running
     */
    public boolean cancel(TaskKey key) {
        TaskRecord record;
        TaskOutcome outcome;
        lock.lock();
        try {
            record = inFlight.get(key);
            if (record == null || record.status != TaskStatus.PENDING) {
                return false;
            }
            outcome = terminate(record, TaskStatus.CANCELED, null, null);
        } finally {
            lock.unlock();
        }
        log.debug("Canceled pending task {}", key);
        record.future.complete(outcome);
        return true;
    }

    public Optional<TaskStatus> status(TaskKey key) {
        lock.lock();
        try {
            TaskRecord record = inFlight.get(key);
            return record == null ? Optional.empty() : Optional.of(record.status);
        } finally {
            lock.unlock();
        }
    }

    public List<TaskView> inFlight() {
        List<TaskView> out = new ArrayList<>();
        lock.lock();
        try {
            for (TaskRecord record : inFlight.values()) {
                out.add(new TaskView(record.key, record.status, record.attempts, record.submittedAtMs, record.startedAtMs));
            }
        } finally {
            lock.unlock();
        }
        out.sort(Comparator.comparingLong(TaskView::submittedAtMs));
        return out;
    }

    private void run(TaskRecord record) {
        lock.lock();
        try {
            if (record.status != TaskStatus.PENDING) {
                return;
            }
            record.status = TaskStatus.RUNNING;
            record.startedAtMs = clock.getAsLong();
            record.runner = Thread.currentThread();
            record.deadline = watchdog.schedule(() -> expire(record), record.timeoutMs, TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
        log.debug("Running task {}", record.key);
        try {
            execute(record);
        } finally {
            // a timeout interrupt must not leak into the next task on this worker
            Thread.interrupted();
        }
    }

    private void execute(TaskRecord record) {
        while (true) {
            record.attempts++;
            TaskFailure failure;
            try {
                String result = record.work.run(record.signal);
                finish(record, TaskStatus.DONE, result, null);
                return;
            } catch (Exception e) {
                failure = TaskFailure.classify(e);
            } catch (Error e) {
                finish(record, TaskStatus.FAILED, null, TaskFailure.of(TaskFailure.Reason.INTERNAL, String.valueOf(e)));
                throw e;
            }
            if (failure.transientFailure() && record.attempts < MAX_ATTEMPTS && !record.signal.isCancelled()) {
                log.info("Task {} failed transiently ({}), retrying once", record.key, failure.message());
                continue;
            }
            finish(record, TaskStatus.FAILED, null, failure);
            return;
        }
    }

    private void expire(TaskRecord record) {
        if (!record.signal.cancel()) {
            // result already being committed; the worker reports it momentarily
            return;
        }
        TaskOutcome outcome;
        lock.lock();
        try {
            if (record.status != TaskStatus.RUNNING) {
                return;
            }
            Thread runner = record.runner;
            outcome = terminate(record, TaskStatus.FAILED, null,
                    TaskFailure.of(TaskFailure.Reason.TIMEOUT, "timed out after " + record.timeoutMs + " ms"));
            if (runner != null) {
                runner.interrupt();
            }
        } finally {
            lock.unlock();
        }
        log.warn("Task {} timed out after {} ms", record.key, record.timeoutMs);
        record.future.complete(outcome);
    }

    private void finish(TaskRecord record, TaskStatus status, String result, TaskFailure failure) {
        TaskOutcome outcome;
        lock.lock();
        try {
            if (record.status.terminal()) {
                log.info("Discarding late {} result of task {} (already {})", status, record.key, record.status);
                return;
            }
            outcome = terminate(record, status, result, failure);
        } finally {
            lock.unlock();
        }
        if (failure == null) {
            log.debug("Task {} done after {} attempt(s)", record.key, record.attempts);
        } else {
            log.info("Task {} failed: {} {}", record.key, failure.reason(), failure.message());
        }
        record.future.complete(outcome);
    }

    // caller holds lock
    private TaskOutcome terminate(TaskRecord record, TaskStatus status, String result, TaskFailure failure) {
        record.status = status;
        record.runner = null;
        if (record.deadline != null) {
            record.deadline.cancel(false);
        }
        TaskOutcome outcome = new TaskOutcome(record.key, status, result, failure, record.attempts,
                record.submittedAtMs, record.startedAtMs, clock.getAsLong());
        bridge.publish(new TaskEvent(outcome));
        inFlight.remove(record.key, record);
        return outcome;
    }

    /**
     * Cancels pending tasks, stops running ones and releases the worker threads.
     */
    public void shutdown() {
        List<TaskRecord> stopped = new ArrayList<>();
        List<TaskOutcome> outcomes = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (TaskRecord record : new ArrayList<>(inFlight.values())) {
                TaskOutcome outcome;
                if (record.status == TaskStatus.PENDING) {
                    outcome = terminate(record, TaskStatus.CANCELED, null, null);
                } else {
                    Thread runner = record.runner;
                    outcome = terminate(record, TaskStatus.FAILED, null,
                            TaskFailure.of(TaskFailure.Reason.INTERRUPTED, "coordinator shut down"));
                    if (runner != null) {
                        runner.interrupt();
                    }
                }
                stopped.add(record);
                outcomes.add(outcome);
            }
        } finally {
            lock.unlock();
        }
        for (int i = 0; i < stopped.size(); i++) {
            stopped.get(i).signal.cancel();
            stopped.get(i).future.complete(outcomes.get(i));
        }
        workers.shutdownNow();
        watchdog.shutdownNow();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Worker threads still busy after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger(0);
        return runnable -> {
            Thread t = new Thread(runnable, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class TaskRecord {
        private final TaskKey key;
        private final TaskWork work;
        private final long timeoutMs;
        private final long submittedAtMs;
        private final CancellationSignal signal = new CancellationSignal();
        private final CompletableFuture<TaskOutcome> future = new CompletableFuture<>();
        private TaskStatus status = TaskStatus.PENDING;
        private volatile int attempts;
        private Long startedAtMs;
        private Thread runner;
        private ScheduledFuture<?> deadline;

        private TaskRecord(TaskKey key, TaskWork work, long timeoutMs, long submittedAtMs) {
            this.key = key;
            this.work = work;
            this.timeoutMs = timeoutMs;
            this.submittedAtMs = submittedAtMs;
        }
    }
}
