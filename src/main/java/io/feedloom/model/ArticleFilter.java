package io.feedloom.model;

public record ArticleFilter(
        String feedId,
        boolean unreadOnly,
        boolean bookmarkedOnly,
        String tag,
        String search,
        int limit
) {
    public static final int DEFAULT_LIMIT = 200;

    public ArticleFilter {
        feedId = blankToNull(feedId);
        tag = blankToNull(tag);
        search = blankToNull(search);
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public static ArticleFilter all() {
        return new ArticleFilter(null, false, false, null, null, DEFAULT_LIMIT);
    }

    public ArticleFilter withFeed(String value) {
        return new ArticleFilter(value, unreadOnly, bookmarkedOnly, tag, search, limit);
    }

    public ArticleFilter withUnreadOnly(boolean value) {
        return new ArticleFilter(feedId, value, bookmarkedOnly, tag, search, limit);
    }

    public ArticleFilter withBookmarkedOnly(boolean value) {
        return new ArticleFilter(feedId, unreadOnly, value, tag, search, limit);
    }

    public ArticleFilter withTag(String value) {
        return new ArticleFilter(feedId, unreadOnly, bookmarkedOnly, value, search, limit);
    }

    public ArticleFilter withSearch(String value) {
        return new ArticleFilter(feedId, unreadOnly, bookmarkedOnly, tag, value, limit);
    }

    public ArticleFilter withLimit(int value) {
        return new ArticleFilter(feedId, unreadOnly, bookmarkedOnly, tag, search, value);
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
