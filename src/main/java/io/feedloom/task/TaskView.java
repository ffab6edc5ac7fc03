package io.feedloom.task;

import io.feedloom.model.TaskKey;
import io.feedloom.model.TaskStatus;

public record TaskView(
        TaskKey key,
        TaskStatus status,
        int attempts,
        long submittedAtMs,
        Long startedAtMs
) {
}
