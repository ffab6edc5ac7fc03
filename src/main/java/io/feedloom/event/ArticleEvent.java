package io.feedloom.event;

public record ArticleEvent(Type type, String articleId, long occurredAtMs) implements BridgeEvent {
    public enum Type {
        UPSERTED,
        READ_CHANGED,
        INSIGHT_WRITTEN,
        TRANSLATION_WRITTEN,
        BOOKMARK_ADDED,
        BOOKMARK_REMOVED,
        TAGS_CHANGED,
        MEMO_CHANGED
    }

    @Override
    public EventKey key() {
        return EventKey.article(articleId);
    }
}
