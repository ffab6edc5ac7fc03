package io.feedloom.model;

import java.util.List;

public record Bookmark(
        String articleId,
        String memo,
        List<String> tags,
        long bookmarkedAtMs,
        long updatedAtMs
) {
    public Bookmark {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
