package io.feedloom.storage;

import io.feedloom.config.FeedloomConfig;
import io.feedloom.model.Article;
import io.feedloom.model.ArticleFilter;
import io.feedloom.model.Bookmark;
import io.feedloom.model.DigestScope;
import io.feedloom.model.Feed;
import io.feedloom.model.RawArticle;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

final class ArticleStoreTest {
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;

    @Test
    void refetchUpdatesFetchedFieldsAndKeepsReaderState() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-upsert-");
        try {
            AtomicLong clock = new AtomicLong(10_000L);
            ArticleStore store = newStore(root, clock);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");

            ArticleStore.UpsertResult first = store.upsertArticle(feed,
                    new RawArticle("Original", "https://example.com/a", "first body", 5_000L));
            Assertions.assertTrue(first.isNew());
            String id = first.article().id();
            Assertions.assertEquals(ArticleStore.articleId(feed.id(), "https://example.com/a"), id);

            Assertions.assertTrue(store.setRead(id, true));
            Assertions.assertTrue(store.writeInsight(id, "insight one", "en"));
            Assertions.assertTrue(store.writeInsight(id, "insight two", "en"));
            Assertions.assertTrue(store.writeTranslation(id, "번역", "ko"));

            clock.set(20_000L);
            ArticleStore.UpsertResult second = store.upsertArticle(feed,
                    new RawArticle("Edited", "https://example.com/a", "second body", null));
            Assertions.assertFalse(second.isNew());

            Article stored = store.getArticle(id).orElseThrow();
            Assertions.assertEquals("Edited", stored.title());
            Assertions.assertEquals("second body", stored.description());
            Assertions.assertEquals(5_000L, stored.publishedAtMs());
            Assertions.assertEquals(20_000L, stored.fetchedAtMs());
            Assertions.assertTrue(stored.read());
            Assertions.assertEquals("insight two", stored.insight());
            Assertions.assertEquals("번역", stored.translation());
            Assertions.assertEquals("ko", stored.translationLang());
            Assertions.assertEquals(1, store.listArticles(ArticleFilter.all()).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void threeArticlesAcrossTwoRefreshesStayThreeAndUnread() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-refresh-");
        try {
            ArticleStore store = newStore(root, new AtomicLong(1_000L));
            Feed feed = store.registerFeed("https://example.com/feed.xml", null);
            List<RawArticle> batch = List.of(
                    new RawArticle("A", "https://example.com/a", null, 100L),
                    new RawArticle("B", "https://example.com/b", null, 200L),
                    new RawArticle("C", "https://example.com/c", null, 300L)
            );
            for (int cycle = 0; cycle < 2; cycle++) {
                for (RawArticle raw : batch) {
                    store.upsertArticle(feed, raw);
                }
            }
            List<Article> articles = store.listArticles(ArticleFilter.all());
            Assertions.assertEquals(3, articles.size());
            Assertions.assertTrue(articles.stream().noneMatch(Article::read));
            Assertions.assertEquals(Map.of(feed.id(), 3), store.articleCountsByFeed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unchangedRefetchDoesNotMoveUpdatedAt() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-unchanged-");
        try {
            AtomicLong clock = new AtomicLong(1_000L);
            ArticleStore store = newStore(root, clock);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            RawArticle raw = new RawArticle("Same", "https://example.com/same", "body", 500L);
            long before = store.upsertArticle(feed, raw).article().updatedAtMs();
            clock.set(9_000L);
            Article after = store.upsertArticle(feed, raw).article();
            Assertions.assertEquals(before, after.updatedAtMs());
            Assertions.assertEquals(9_000L, after.fetchedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listingOrdersByPublishDateThenFetchOrder() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-order-");
        try {
            ArticleStore store = newStore(root, new AtomicLong(1_000L));
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            String a = store.upsertArticle(feed, new RawArticle("A", "https://example.com/a", null, 100L)).article().id();
            String b = store.upsertArticle(feed, new RawArticle("B", "https://example.com/b", null, null)).article().id();
            String c = store.upsertArticle(feed, new RawArticle("C", "https://example.com/c", null, 200L)).article().id();
            String d = store.upsertArticle(feed, new RawArticle("D", "https://example.com/d", null, 100L)).article().id();

            List<String> ids = store.listArticles(ArticleFilter.all()).stream().map(Article::id).toList();
            Assertions.assertEquals(List.of(c, d, a, b), ids);

            List<Article> limited = store.listArticles(ArticleFilter.all().withLimit(2));
            Assertions.assertEquals(2, limited.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void filtersSelectByFeedReadStateBookmarkTagAndText() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-filters-");
        try {
            ArticleStore store = newStore(root, new AtomicLong(1_000L));
            Feed news = store.registerFeed("https://news.example.com/rss", "News");
            Feed blog = store.registerFeed("https://blog.example.com/atom", "Blog");
            String n1 = store.upsertArticle(news, new RawArticle("Kernel release", "https://news.example.com/1", "100% new", 3L)).article().id();
            String n2 = store.upsertArticle(news, new RawArticle("Compiler news", "https://news.example.com/2", "fast builds", 2L)).article().id();
            String b1 = store.upsertArticle(blog, new RawArticle("On testing", "https://blog.example.com/1", null, 1L)).article().id();

            store.setRead(n2, true);
            store.toggleBookmark(n1);
            store.toggleBookmark(b1);
            store.setTags(b1, List.of("java"));
            store.writeInsight(n2, "worth watching for build times", "en");

            Assertions.assertEquals(List.of(n1, n2), ids(store, ArticleFilter.all().withFeed(news.id())));
            Assertions.assertEquals(List.of(n1, b1), ids(store, ArticleFilter.all().withUnreadOnly(true)));
            Assertions.assertEquals(List.of(n1, b1), ids(store, ArticleFilter.all().withBookmarkedOnly(true)));
            Assertions.assertEquals(List.of(b1), ids(store, ArticleFilter.all().withTag("java")));
            Assertions.assertEquals(List.of(n2), ids(store, ArticleFilter.all().withSearch("build times")));
            Assertions.assertEquals(List.of(n1), ids(store, ArticleFilter.all().withSearch("100%")));
            Assertions.assertTrue(ids(store, ArticleFilter.all().withSearch("_")).isEmpty());

            Article bookmarked = store.getArticle(n1).orElseThrow();
            Assertions.assertTrue(bookmarked.bookmarked());
            Assertions.assertFalse(store.getArticle(n2).orElseThrow().bookmarked());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void bookmarkToggleCreatesAndRemovesBookmarkWithTags() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-bookmark-");
        try {
            Database db = newDatabase(root);
            ArticleStore store = new ArticleStore(db, new AtomicLong(5_000L)::get);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            String id = store.upsertArticle(feed, new RawArticle("A", "https://example.com/a", null, 1L)).article().id();

            Assertions.assertThrows(IllegalArgumentException.class, () -> store.toggleBookmark("missing"));
            Assertions.assertFalse(store.setTags(id, List.of("x")));

            Assertions.assertTrue(store.toggleBookmark(id));
            Assertions.assertTrue(store.setTags(id, List.of(" ai ", "", "java", "ai", "  ")));
            Assertions.assertTrue(store.setMemo(id, "  read later  "));
            Bookmark bookmark = store.getBookmark(id).orElseThrow();
            Assertions.assertEquals(List.of("ai", "java"), bookmark.tags());
            Assertions.assertEquals("read later", bookmark.memo());
            Assertions.assertEquals(5_000L, bookmark.bookmarkedAtMs());
            Assertions.assertEquals(List.of(new ArticleStore.TagCount("ai", 1), new ArticleStore.TagCount("java", 1)),
                    store.listTags());
            Assertions.assertEquals(List.of(bookmark), store.listBookmarks());

            Assertions.assertFalse(store.toggleBookmark(id));
            Assertions.assertTrue(store.getBookmark(id).isEmpty());
            Assertions.assertTrue(store.listTags().isEmpty());
            Assertions.assertTrue(store.listBookmarks().isEmpty());
            Assertions.assertEquals(0, countRows(db, "bookmark_tags"));
            Assertions.assertFalse(store.setMemo(id, "gone"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void mutationsOnMissingRowsReportFalseAndChangeNothing() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-missing-");
        try {
            Database db = newDatabase(root);
            ArticleStore store = new ArticleStore(db);
            Assertions.assertFalse(store.setRead("nope", true));
            Assertions.assertFalse(store.writeInsight("nope", "text", "en"));
            Assertions.assertFalse(store.writeTranslation("nope", "text", "ko"));
            Assertions.assertFalse(store.setTags("nope", List.of("a")));
            Assertions.assertFalse(store.setMemo("nope", "memo"));
            Assertions.assertTrue(store.getArticle("nope").isEmpty());
            Assertions.assertEquals(0, countRows(db, "articles"));
            Assertions.assertEquals(0, countRows(db, "bookmarks"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failureInsideBookmarkRemovalLeavesBookmarkAndTagsIntact() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-toggle-abort-");
        try {
            Database db = newDatabase(root);
            ArticleStore store = new ArticleStore(db);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            String id = store.upsertArticle(feed, new RawArticle("A", "https://example.com/a", null, 1L)).article().id();
            store.toggleBookmark(id);
            store.setTags(id, List.of("keep", "these"));

            // tags are deleted first, then the bookmark row fails
            execute(db, """
                    CREATE TRIGGER fail_bookmark_delete BEFORE DELETE ON bookmarks
                    BEGIN SELECT RAISE(ABORT, 'injected failure'); END
                    """);
            Assertions.assertThrows(StorageFault.class, () -> store.toggleBookmark(id));

            Bookmark bookmark = store.getBookmark(id).orElseThrow();
            Assertions.assertEquals(List.of("keep", "these"), bookmark.tags());
            Assertions.assertTrue(store.getArticle(id).orElseThrow().bookmarked());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failureInsideBookmarkCreationLeavesNoBookmark() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-create-abort-");
        try {
            Database db = newDatabase(root);
            ArticleStore store = new ArticleStore(db);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            String id = store.upsertArticle(feed, new RawArticle("A", "https://example.com/a", null, 1L)).article().id();

            execute(db, """
                    CREATE TRIGGER fail_bookmark_insert AFTER INSERT ON bookmarks
                    BEGIN SELECT RAISE(ABORT, 'injected failure'); END
                    """);
            Assertions.assertThrows(StorageFault.class, () -> store.toggleBookmark(id));
            Assertions.assertTrue(store.getBookmark(id).isEmpty());
            Assertions.assertEquals(0, countRows(db, "bookmarks"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failureInsideTagReplacementKeepsPreviousTags() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-tags-abort-");
        try {
            Database db = newDatabase(root);
            ArticleStore store = new ArticleStore(db);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            String id = store.upsertArticle(feed, new RawArticle("A", "https://example.com/a", null, 1L)).article().id();
            store.toggleBookmark(id);
            store.setTags(id, List.of("old", "tags"));
            long stampBefore = store.getBookmark(id).orElseThrow().updatedAtMs();

            execute(db, """
                    CREATE TRIGGER fail_bad_tag BEFORE INSERT ON bookmark_tags WHEN NEW.tag = 'boom'
                    BEGIN SELECT RAISE(ABORT, 'injected failure'); END
                    """);
            Assertions.assertThrows(StorageFault.class, () -> store.setTags(id, List.of("new", "boom")));

            Bookmark bookmark = store.getBookmark(id).orElseThrow();
            Assertions.assertEquals(List.of("old", "tags"), bookmark.tags());
            Assertions.assertEquals(stampBefore, bookmark.updatedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void digestSourcesTrackBookmarkAndArticleChanges() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-sources-");
        try {
            AtomicLong clock = new AtomicLong(50 * DAY_MS);
            ArticleStore store = newStore(root, clock);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            String x = store.upsertArticle(feed, new RawArticle("X", "https://example.com/x", null, 49 * DAY_MS)).article().id();
            String y = store.upsertArticle(feed, new RawArticle("Y", "https://example.com/y", null, 10 * DAY_MS)).article().id();

            Assertions.assertTrue(store.digestSources(DigestScope.bookmarks()).isEmpty());
            store.toggleBookmark(x);
            ArticleStore.DigestSources one = store.digestSources(DigestScope.bookmarks());
            Assertions.assertEquals(List.of(x), one.articles().stream().map(Article::id).toList());

            // same clock value: stamps must still move
            store.setMemo(x, "note");
            ArticleStore.DigestSources memo = store.digestSources(DigestScope.bookmarks());
            Assertions.assertTrue(memo.stamps().get(0).stampMs() > one.stamps().get(0).stampMs());

            store.setRead(x, true);
            Assertions.assertEquals(memo.stamps(), store.digestSources(DigestScope.bookmarks()).stamps());

            clock.addAndGet(10L);
            store.writeInsight(x, "insight", "en");
            Assertions.assertNotEquals(memo.stamps(), store.digestSources(DigestScope.bookmarks()).stamps());

            clock.addAndGet(1_000L);
            store.toggleBookmark(y);
            store.setTags(y, List.of("later"));
            Assertions.assertEquals(List.of(y, x),
                    store.digestSources(DigestScope.bookmarks()).articles().stream().map(Article::id).toList());
            Assertions.assertEquals(List.of(y),
                    store.digestSources(DigestScope.tagged("later")).articles().stream().map(Article::id).toList());

            ArticleStore.DigestSources recent = store.digestSources(DigestScope.recent(7, 20, false));
            Assertions.assertEquals(List.of(x), recent.articles().stream().map(Article::id).toList());
            ArticleStore.DigestSources wide = store.digestSources(DigestScope.recent(60, 1, false));
            Assertions.assertEquals(1, wide.articles().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void feedsAreRegisteredOnceAndKeepTheirName() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-feeds-");
        try {
            AtomicLong clock = new AtomicLong(1_000L);
            ArticleStore store = newStore(root, clock);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            Feed again = store.registerFeed("https://example.com/feed.xml", "  ");
            Assertions.assertEquals(feed.id(), again.id());
            Assertions.assertEquals("Example", again.name());
            Assertions.assertNull(again.lastFetchedAtMs());

            Feed unnamed = store.registerFeed("https://other.example.com/rss", null);
            Assertions.assertEquals("https://other.example.com/rss", unnamed.name());

            clock.set(2_000L);
            Assertions.assertTrue(store.markFeedFetched(feed.id()));
            Assertions.assertFalse(store.markFeedFetched("unknown"));
            Assertions.assertEquals(2_000L, store.getFeed(feed.id()).orElseThrow().lastFetchedAtMs());
            Assertions.assertEquals(List.of("Example", "https://other.example.com/rss"),
                    store.listFeeds().stream().map(Feed::name).toList());
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.registerFeed(" ", "x"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static List<String> ids(ArticleStore store, ArticleFilter filter) {
        return store.listArticles(filter).stream().map(Article::id).toList();
    }

    private static ArticleStore newStore(Path root, AtomicLong clock) {
        return new ArticleStore(newDatabase(root), clock::get);
    }

    private static Database newDatabase(Path root) {
        Database db = new Database(FeedloomConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }

    private static void execute(Database db, String sql) throws Exception {
        try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }

    private static int countRows(Database db, String table) throws Exception {
        try (Connection c = db.openConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(1) FROM " + table)) {
            return rs.next() ? rs.getInt(1) : -1;
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
