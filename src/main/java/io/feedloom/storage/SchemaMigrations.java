package io.feedloom.storage;

import java.util.List;

/**
 * Ordered, additive schema history. Append new versions at the end; never edit a released one, the
 * recorded checksum would no longer match.
 */
public final class SchemaMigrations {
    private SchemaMigrations() {
    }

    public static List<Migration> all() {
        return List.of(
                new Migration(1, "Create feeds, articles, bookmarks, tags and digests", List.of(
                        """
                        CREATE TABLE IF NOT EXISTS feeds (
                            id TEXT PRIMARY KEY,
                            url TEXT NOT NULL UNIQUE,
                            name TEXT NOT NULL,
                            last_fetched_at_ms INTEGER,
                            created_at_ms INTEGER NOT NULL
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS articles (
                            id TEXT PRIMARY KEY,
                            feed_id TEXT NOT NULL,
                            title TEXT NOT NULL,
                            link TEXT NOT NULL,
                            description TEXT,
                            published_at_ms INTEGER,
                            fetched_at_ms INTEGER NOT NULL,
                            fetch_seq INTEGER NOT NULL,
                            is_read INTEGER NOT NULL DEFAULT 0,
                            insight TEXT,
                            insight_lang TEXT,
                            translation TEXT,
                            updated_at_ms INTEGER NOT NULL,
                            FOREIGN KEY(feed_id) REFERENCES feeds(id)
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS bookmarks (
                            article_id TEXT PRIMARY KEY,
                            memo TEXT,
                            bookmarked_at_ms INTEGER NOT NULL,
                            updated_at_ms INTEGER NOT NULL,
                            FOREIGN KEY(article_id) REFERENCES articles(id)
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS bookmark_tags (
                            article_id TEXT NOT NULL,
                            position INTEGER NOT NULL,
                            tag TEXT NOT NULL,
                            PRIMARY KEY(article_id, tag),
                            FOREIGN KEY(article_id) REFERENCES bookmarks(article_id)
                        )
                        """,
                        """
                        CREATE TABLE IF NOT EXISTS digests (
                            scope_key TEXT PRIMARY KEY,
                            text TEXT NOT NULL,
                            source_fingerprint TEXT NOT NULL,
                            generated_at_ms INTEGER NOT NULL
                        )
                        """
                )),
                new Migration(2, "Index article listing, feed and tag access paths", List.of(
                        "CREATE INDEX IF NOT EXISTS idx_articles_order ON articles(published_at_ms DESC, fetch_seq DESC)",
                        "CREATE INDEX IF NOT EXISTS idx_articles_feed ON articles(feed_id, published_at_ms DESC)",
                        "CREATE INDEX IF NOT EXISTS idx_articles_read ON articles(is_read, published_at_ms DESC)",
                        "CREATE INDEX IF NOT EXISTS idx_bookmark_tags_tag ON bookmark_tags(tag)"
                )),
                new Migration(3, "Track translation language and digest article count", List.of(
                        "ALTER TABLE articles ADD COLUMN translation_lang TEXT",
                        "ALTER TABLE digests ADD COLUMN article_count INTEGER NOT NULL DEFAULT 0"
                ))
        );
    }
}
