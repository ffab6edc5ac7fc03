package io.feedloom.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Cooperative stop request shared between a running task and the coordinator.
 *
 * <p>Work publishes its result through {@link #commit(Supplier)}. Once a commit has started the
 * signal can no longer be cancelled, and once the signal is cancelled no commit can start, so a
 * task that ran out of time never writes a late result.
 */
public final class CancellationSignal {
    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final Object monitor = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private boolean cancelled;
    private boolean committing;

    public boolean isCancelled() {
        synchronized (monitor) {
            return cancelled;
        }
    }

    /**
     * Requests a stop.
     *
     * @return false if the work already committed its result or was cancelled before
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (monitor) {
            if (cancelled || committing) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed", e);
            }
        }
        return true;
    }

    /**
     * Registers a callback run once on cancellation, or right away if already cancelled.
     */
    public void onCancel(Runnable listener) {
        boolean runNow;
        synchronized (monitor) {
            runNow = cancelled;
            if (!runNow) {
                listeners.add(listener);
            }
        }
        if (runNow) {
            listener.run();
        }
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("task cancelled");
        }
    }

    /**
     * Runs the result-publishing step unless the task was cancelled first.
     *
     * @throws CancellationException if the signal was already cancelled
     */
    public <T> T commit(Supplier<T> action) {
        synchronized (monitor) {
            if (cancelled) {
                throw new CancellationException("task cancelled before commit");
            }
            committing = true;
            listeners.clear();
        }
        return action.get();
    }
}
