package io.feedloom.model;

import java.util.Locale;

/**
 * The set of articles a digest summarizes. {@link #key()} is the cache key and the single-flight key.
 */
public record DigestScope(Kind kind, String tag, int days, int maxArticles, boolean bookmarkedOnly) {
    public enum Kind {
        BOOKMARKS,
        TAG,
        RECENT
    }

    public DigestScope {
        if (kind == null) {
            throw new IllegalArgumentException("digest scope kind is required");
        }
        if (kind == Kind.TAG && (tag == null || tag.isBlank())) {
            throw new IllegalArgumentException("tag digest scope requires a tag");
        }
        tag = tag == null ? null : tag.trim();
        days = Math.max(0, days);
        maxArticles = Math.max(0, maxArticles);
    }

    public static DigestScope bookmarks() {
        return new DigestScope(Kind.BOOKMARKS, null, 0, 0, true);
    }

    public static DigestScope tagged(String tag) {
        return new DigestScope(Kind.TAG, tag, 0, 0, true);
    }

    public static DigestScope recent(int days, int maxArticles, boolean bookmarkedOnly) {
        return new DigestScope(Kind.RECENT, null, Math.max(1, days), Math.max(1, maxArticles), bookmarkedOnly);
    }

    public String key() {
        return switch (kind) {
            case BOOKMARKS -> "bookmarks";
            case TAG -> "bookmarks:tag:" + tag;
            case RECENT -> "recent:" + days + ":" + maxArticles + (bookmarkedOnly ? ":bookmarked" : "");
        };
    }

    public static DigestScope parse(String raw) {
        if (raw == null || raw.isBlank() || "bookmarks".equalsIgnoreCase(raw.trim())) {
            return bookmarks();
        }
        String v = raw.trim();
        if (v.startsWith("bookmarks:tag:")) {
            return tagged(v.substring("bookmarks:tag:".length()));
        }
        if (v.toLowerCase(Locale.ROOT).startsWith("recent:")) {
            String[] parts = v.split(":");
            int days = parts.length > 1 ? Integer.parseInt(parts[1]) : 7;
            int max = parts.length > 2 ? Integer.parseInt(parts[2]) : 20;
            boolean bookmarked = parts.length > 3 && "bookmarked".equalsIgnoreCase(parts[3]);
            return recent(days, max, bookmarked);
        }
        throw new IllegalArgumentException("Unknown digest scope: " + raw);
    }
}
