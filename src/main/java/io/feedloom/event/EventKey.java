package io.feedloom.event;

import io.feedloom.model.TaskKey;

import java.util.Locale;

/**
 * Subscription key. Task outcomes use the task kind ({@code insight}, {@code digest}, ...) and the
 * task id; article notifications use {@code article} and the article id.
 */
public record EventKey(String kind, String id) {
    public static final String ARTICLE = "article";
    public static final String CACHE = "cache";

    public EventKey {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("event kind is required");
        }
        kind = kind.trim().toLowerCase(Locale.ROOT);
        id = id == null ? "" : id;
    }

    public static EventKey of(TaskKey key) {
        return new EventKey(key.kind().name(), key.id());
    }

    public static EventKey article(String articleId) {
        return new EventKey(ARTICLE, articleId);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
