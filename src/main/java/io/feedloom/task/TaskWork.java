package io.feedloom.task;

/**
 * Body of a background task. Runs on a worker thread and may be invoked a second time after a
 * transient failure. Long waits should observe {@code signal} or thread interruption.
 */
@FunctionalInterface
public interface TaskWork {
    String run(CancellationSignal signal) throws Exception;
}
