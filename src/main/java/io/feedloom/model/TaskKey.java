package io.feedloom.model;

import java.util.Locale;

public record TaskKey(TaskKind kind, String id) {
    public TaskKey {
        if (kind == null) {
            throw new IllegalArgumentException("task kind is required");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task id is required");
        }
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + id;
    }
}
