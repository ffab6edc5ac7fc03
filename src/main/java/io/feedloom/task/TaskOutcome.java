package io.feedloom.task;

import io.feedloom.model.TaskKey;
import io.feedloom.model.TaskStatus;

/**
 * Terminal state of one task. {@code result} is set for DONE, {@code failure} for FAILED.
 */
public record TaskOutcome(
        TaskKey key,
        TaskStatus status,
        String result,
        TaskFailure failure,
        int attempts,
        long submittedAtMs,
        Long startedAtMs,
        long finishedAtMs
) {
    public boolean succeeded() {
        return status == TaskStatus.DONE;
    }
}
