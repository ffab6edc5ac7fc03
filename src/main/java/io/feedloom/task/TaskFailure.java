package io.feedloom.task;

import io.feedloom.storage.StorageFault;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;

/**
 * Why a task ended FAILED. Only {@link Reason#TRANSIENT} failures are retried, and only once.
 */
public record TaskFailure(Reason reason, String message) {
    public enum Reason {
        TIMEOUT(false),
        TRANSIENT(true),
        UNAVAILABLE(false),
        MISSING_CREDENTIALS(false),
        REJECTED(false),
        INVALID_INPUT(false),
        STORAGE(false),
        INTERRUPTED(false),
        INTERNAL(false);

        private final boolean transientFailure;

        Reason(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        public boolean transientFailure() {
            return transientFailure;
        }
    }

    public TaskFailure {
        if (reason == null) {
            throw new IllegalArgumentException("failure reason is required");
        }
        message = message == null ? "" : message;
    }

    public static TaskFailure of(Reason reason, String message) {
        return new TaskFailure(reason, message);
    }

    public boolean transientFailure() {
        return reason.transientFailure();
    }

    static TaskFailure classify(Throwable error) {
        if (error instanceof TaskFailedException failed) {
            return failed.failure();
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        if (error instanceof StorageFault) {
            return of(Reason.STORAGE, message);
        }
        if (error instanceof IllegalArgumentException) {
            return of(Reason.INVALID_INPUT, message);
        }
        if (error instanceof InterruptedException || error instanceof CancellationException) {
            return of(Reason.INTERRUPTED, message);
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return of(Reason.TRANSIENT, message);
        }
        return of(Reason.INTERNAL, error.getClass().getSimpleName() + ": " + message);
    }
}
