package io.feedloom.task;

import io.feedloom.model.TaskKey;
import io.feedloom.model.TaskStatus;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller's view of a submitted task. Callers that attached to an already running task share the
 * same outcome.
 */
public final class TaskHandle {
    private final TaskKey key;
    private final boolean attached;
    private final CompletableFuture<TaskOutcome> outcome;
    private final TaskCoordinator coordinator;

    TaskHandle(TaskKey key, boolean attached, CompletableFuture<TaskOutcome> outcome, TaskCoordinator coordinator) {
        this.key = key;
        this.attached = attached;
        this.outcome = outcome;
        this.coordinator = coordinator;
    }

    public TaskKey key() {
        return key;
    }

    /**
     * True if this submission joined a task that was already pending or running.
     */
    public boolean attached() {
        return attached;
    }

    public TaskStatus status() {
        TaskOutcome done = outcome.getNow(null);
        if (done != null) {
            return done.status();
        }
        return coordinator.status(key).orElse(TaskStatus.PENDING);
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    public Optional<TaskOutcome> outcome() {
        return Optional.ofNullable(outcome.getNow(null));
    }

    /**
     * Blocks for the terminal outcome. Not meant for the consumer thread, which should wait for the
     * outcome event instead.
     */
    public Optional<TaskOutcome> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(outcome.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("task outcome future failed: " + key, e.getCause());
        }
    }

    public CompletableFuture<TaskOutcome> future() {
        return outcome.copy();
    }

    public boolean cancel() {
        return coordinator.cancel(key);
    }
}
