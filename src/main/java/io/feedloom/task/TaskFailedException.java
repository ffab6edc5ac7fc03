package io.feedloom.task;

/**
 * Thrown by task work to end the attempt with a specific failure reason.
 */
public final class TaskFailedException extends Exception {
    private final TaskFailure failure;

    public TaskFailedException(TaskFailure.Reason reason, String message) {
        super(message);
        this.failure = TaskFailure.of(reason, message);
    }

    public TaskFailure failure() {
        return failure;
    }
}
