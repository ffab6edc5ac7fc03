package io.feedloom.storage;

import java.util.List;

public record Migration(int version, String description, List<String> sql) {
    public Migration {
        if (version <= 0) {
            throw new IllegalArgumentException("migration version must be positive");
        }
        sql = List.copyOf(sql);
    }
}
