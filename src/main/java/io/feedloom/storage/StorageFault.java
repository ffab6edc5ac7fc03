package io.feedloom.storage;

/**
 * A store operation could not be completed: an I/O error, or lock contention that outlived the
 * bounded retry window. The operation left no partial writes behind.
 */
public final class StorageFault extends RuntimeException {
    private final String operation;
    private final int attempts;

    public StorageFault(String operation, int attempts, Throwable cause) {
        super("Storage operation failed: " + operation + " (attempts=" + attempts + ")", cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }
}
