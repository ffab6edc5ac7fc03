package io.feedloom.storage;

import io.feedloom.model.Article;
import io.feedloom.model.ArticleFilter;
import io.feedloom.model.Bookmark;
import io.feedloom.model.DigestScope;
import io.feedloom.model.Feed;
import io.feedloom.model.RawArticle;
import io.feedloom.util.Hashing;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Articles, feeds, bookmarks and tags. Each public mutation is one transaction.
 *
 * <p>{@code updated_at_ms} on articles and bookmarks only ever moves forward, even for two writes in
 * the same millisecond, because digest fingerprints are derived from it.
 */
public final class ArticleStore {
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;
    private static final String UNTITLED = "(no title)";
    private static final String ARTICLE_COLUMNS = """
            a.id,a.feed_id,a.title,a.link,a.description,a.published_at_ms,a.fetched_at_ms,a.is_read,
            a.insight,a.insight_lang,a.translation,a.translation_lang,a.updated_at_ms,
            CASE WHEN b.article_id IS NULL THEN 0 ELSE 1 END AS is_bookmarked
            """;
    private static final String ARTICLE_ORDER =
            " ORDER BY (a.published_at_ms IS NULL), a.published_at_ms DESC, a.fetch_seq DESC";

    private final Database database;
    private final LongSupplier clock;

    public ArticleStore(Database database) {
        this(database, System::currentTimeMillis);
    }

    public ArticleStore(Database database, LongSupplier clock) {
        this.database = database;
        this.clock = clock;
    }

    public static String articleId(String feedId, String link) {
        return Hashing.shortId(feedId + ":" + link.trim());
    }

    public static String feedId(String url) {
        return Hashing.shortId(url.trim());
    }

    // --- feeds ---

    public Feed registerFeed(String url, String name) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("feed url is required");
        }
        String id = feedId(url);
        String explicitName = name == null || name.isBlank() ? null : name.trim();
        long now = clock.getAsLong();
        return database.write("register_feed", c -> {
            // a blank name keeps the stored one; a new feed falls back to its url
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO feeds(id,url,name,last_fetched_at_ms,created_at_ms) VALUES(?,?,COALESCE(?,?),NULL,?)
                    ON CONFLICT(id) DO UPDATE SET name=COALESCE(?, feeds.name)
                    """)) {
                ps.setString(1, id);
                ps.setString(2, url.trim());
                ps.setString(3, explicitName);
                ps.setString(4, url.trim());
                ps.setLong(5, now);
                ps.setString(6, explicitName);
                ps.executeUpdate();
            }
            return findFeed(c, id).orElseThrow();
        });
    }

    public Optional<Feed> getFeed(String feedId) {
        return database.read("get_feed", c -> findFeed(c, feedId));
    }

    public List<Feed> listFeeds() {
        return database.read("list_feeds", c -> {
            List<Feed> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id,url,name,last_fetched_at_ms FROM feeds ORDER BY name, url");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(feedRow(rs));
                }
            }
            return out;
        });
    }

    public boolean markFeedFetched(String feedId) {
        long now = clock.getAsLong();
        return database.write("mark_feed_fetched", c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE feeds SET last_fetched_at_ms=? WHERE id=?")) {
                ps.setLong(1, now);
                ps.setString(2, feedId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public Map<String, Integer> articleCountsByFeed() {
        return database.read("article_counts_by_feed", c -> {
            Map<String, Integer> out = new LinkedHashMap<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT feed_id, COUNT(1) AS cnt FROM articles GROUP BY feed_id ORDER BY feed_id");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("feed_id"), rs.getInt("cnt"));
                }
            }
            return out;
        });
    }

    // --- articles ---

    /**
     * Inserts a fetched entry or refreshes the fetched fields of the stored one. Read state, insight
     * and translation are never touched, and {@code updated_at_ms} only moves when title,
     * description or publish date actually changed.
     */
    public UpsertResult upsertArticle(Feed feed, RawArticle raw) {
        Objects.requireNonNull(feed, "feed");
        if (raw == null || raw.link() == null || raw.link().isBlank()) {
            throw new IllegalArgumentException("article link is required");
        }
        String id = articleId(feed.id(), raw.link());
        String title = raw.title() == null || raw.title().isBlank() ? UNTITLED : raw.title().trim();
        long now = clock.getAsLong();
        return database.write("upsert_article", c -> {
            ExistingContent existing = loadContent(c, id);
            if (existing == null) {
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT INTO articles(id,feed_id,title,link,description,published_at_ms,fetched_at_ms,fetch_seq,
                                             is_read,updated_at_ms)
                        VALUES(?,?,?,?,?,?,?,(SELECT COALESCE(MAX(fetch_seq),0)+1 FROM articles),0,?)
                        """)) {
                    ps.setString(1, id);
                    ps.setString(2, feed.id());
                    ps.setString(3, title);
                    ps.setString(4, raw.link().trim());
                    ps.setString(5, raw.description());
                    setNullableLong(ps, 6, raw.publishedAtMs());
                    ps.setLong(7, now);
                    ps.setLong(8, now);
                    ps.executeUpdate();
                }
                return new UpsertResult(findArticle(c, id).orElseThrow(), true);
            }

            Long published = raw.publishedAtMs() != null ? raw.publishedAtMs() : existing.publishedAtMs();
            boolean changed = !title.equals(existing.title())
                    || !Objects.equals(raw.description(), existing.description())
                    || !Objects.equals(published, existing.publishedAtMs());
            if (changed) {
                try (PreparedStatement ps = c.prepareStatement("""
                        UPDATE articles SET title=?,description=?,published_at_ms=?,fetched_at_ms=?,
                                            updated_at_ms=MAX(?, updated_at_ms+1)
                        WHERE id=?
                        """)) {
                    ps.setString(1, title);
                    ps.setString(2, raw.description());
                    setNullableLong(ps, 3, published);
                    ps.setLong(4, now);
                    ps.setLong(5, now);
                    ps.setString(6, id);
                    ps.executeUpdate();
                }
            } else {
                try (PreparedStatement ps = c.prepareStatement("UPDATE articles SET fetched_at_ms=? WHERE id=?")) {
                    ps.setLong(1, now);
                    ps.setString(2, id);
                    ps.executeUpdate();
                }
            }
            return new UpsertResult(findArticle(c, id).orElseThrow(), false);
        });
    }

    public Optional<Article> getArticle(String articleId) {
        return database.read("get_article", c -> findArticle(c, articleId));
    }

    public List<Article> listArticles(ArticleFilter filter) {
        ArticleFilter f = filter == null ? ArticleFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT ").append(ARTICLE_COLUMNS)
                .append(" FROM articles a LEFT JOIN bookmarks b ON b.article_id=a.id WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (f.feedId() != null) {
            sql.append(" AND a.feed_id=?");
            params.add(f.feedId());
        }
        if (f.unreadOnly()) {
            sql.append(" AND a.is_read=0");
        }
        if (f.bookmarkedOnly()) {
            sql.append(" AND b.article_id IS NOT NULL");
        }
        if (f.tag() != null) {
            sql.append(" AND EXISTS (SELECT 1 FROM bookmark_tags t WHERE t.article_id=a.id AND t.tag=?)");
            params.add(f.tag());
        }
        if (f.search() != null) {
            String pattern = "%" + escapeLike(f.search()) + "%";
            sql.append(" AND (a.title LIKE ? ESCAPE '\\' OR a.description LIKE ? ESCAPE '\\'")
                    .append(" OR a.insight LIKE ? ESCAPE '\\' OR a.translation LIKE ? ESCAPE '\\')");
            for (int i = 0; i < 4; i++) {
                params.add(pattern);
            }
        }
        sql.append(ARTICLE_ORDER).append(" LIMIT ?");
        params.add(f.limit());

        return database.read("list_articles", c -> {
            List<Article> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(articleRow(rs));
                    }
                }
            }
            return out;
        });
    }

    public boolean setRead(String articleId, boolean read) {
        return database.write("set_read", c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE articles SET is_read=? WHERE id=?")) {
                ps.setInt(1, read ? 1 : 0);
                ps.setString(2, articleId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public boolean writeInsight(String articleId, String text, String lang) {
        long now = clock.getAsLong();
        return database.write("write_insight", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE articles SET insight=?,insight_lang=?,updated_at_ms=MAX(?, updated_at_ms+1) WHERE id=?")) {
                ps.setString(1, text);
                ps.setString(2, lang);
                ps.setLong(3, now);
                ps.setString(4, articleId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public boolean writeTranslation(String articleId, String text, String lang) {
        long now = clock.getAsLong();
        return database.write("write_translation", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE articles SET translation=?,translation_lang=?,updated_at_ms=MAX(?, updated_at_ms+1) WHERE id=?")) {
                ps.setString(1, text);
                ps.setString(2, lang);
                ps.setLong(3, now);
                ps.setString(4, articleId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    // --- bookmarks ---

    /**
     * Creates the bookmark if absent, otherwise removes it together with its tags.
     *
     * @return the new bookmarked state
     * @throws IllegalArgumentException if the article does not exist
     */
    public boolean toggleBookmark(String articleId) {
        long now = clock.getAsLong();
        return database.write("toggle_bookmark", c -> {
            if (!articleExists(c, articleId)) {
                throw new IllegalArgumentException("Unknown article: " + articleId);
            }
            if (bookmarkExists(c, articleId)) {
                try (PreparedStatement tags = c.prepareStatement("DELETE FROM bookmark_tags WHERE article_id=?");
                     PreparedStatement bm = c.prepareStatement("DELETE FROM bookmarks WHERE article_id=?")) {
                    tags.setString(1, articleId);
                    tags.executeUpdate();
                    bm.setString(1, articleId);
                    bm.executeUpdate();
                }
                return false;
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO bookmarks(article_id,memo,bookmarked_at_ms,updated_at_ms) VALUES(?,NULL,?,?)")) {
                ps.setString(1, articleId);
                ps.setLong(2, now);
                ps.setLong(3, now);
                ps.executeUpdate();
            }
            return true;
        });
    }

    /**
     * Replaces the tag list of a bookmark. Tags are trimmed, blanks dropped and duplicates collapsed
     * to their first position.
     *
     * @return false if the article is not bookmarked
     */
    public boolean setTags(String articleId, List<String> tags) {
        List<String> normalized = normalizeTags(tags);
        long now = clock.getAsLong();
        return database.write("set_tags", c -> {
            if (!bookmarkExists(c, articleId)) {
                return false;
            }
            try (PreparedStatement del = c.prepareStatement("DELETE FROM bookmark_tags WHERE article_id=?");
                 PreparedStatement ins = c.prepareStatement(
                         "INSERT INTO bookmark_tags(article_id,position,tag) VALUES(?,?,?)")) {
                del.setString(1, articleId);
                del.executeUpdate();
                for (int i = 0; i < normalized.size(); i++) {
                    ins.setString(1, articleId);
                    ins.setInt(2, i);
                    ins.setString(3, normalized.get(i));
                    ins.executeUpdate();
                }
            }
            touchBookmark(c, articleId, now);
            return true;
        });
    }

    public boolean setMemo(String articleId, String memo) {
        String value = memo == null || memo.isBlank() ? null : memo.strip();
        long now = clock.getAsLong();
        return database.write("set_memo", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE bookmarks SET memo=?,updated_at_ms=MAX(?, updated_at_ms+1) WHERE article_id=?")) {
                ps.setString(1, value);
                ps.setLong(2, now);
                ps.setString(3, articleId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    public Optional<Bookmark> getBookmark(String articleId) {
        return database.read("get_bookmark", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT article_id,memo,bookmarked_at_ms,updated_at_ms FROM bookmarks WHERE article_id=?")) {
                ps.setString(1, articleId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new Bookmark(
                            rs.getString("article_id"),
                            rs.getString("memo"),
                            loadTags(c, articleId),
                            rs.getLong("bookmarked_at_ms"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
        });
    }

    /**
     * Bookmarks, most recently bookmarked first.
     */
    public List<Bookmark> listBookmarks() {
        return database.read("list_bookmarks", c -> {
            Map<String, List<String>> tagsByArticle = new LinkedHashMap<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT article_id,tag FROM bookmark_tags ORDER BY article_id, position");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tagsByArticle.computeIfAbsent(rs.getString("article_id"), k -> new ArrayList<>())
                            .add(rs.getString("tag"));
                }
            }
            List<Bookmark> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT article_id,memo,bookmarked_at_ms,updated_at_ms FROM bookmarks
                    ORDER BY bookmarked_at_ms DESC, article_id
                    """);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String articleId = rs.getString("article_id");
                    out.add(new Bookmark(
                            articleId,
                            rs.getString("memo"),
                            tagsByArticle.getOrDefault(articleId, List.of()),
                            rs.getLong("bookmarked_at_ms"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
            return out;
        });
    }

    public List<TagCount> listTags() {
        return database.read("list_tags", c -> {
            List<TagCount> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT tag, COUNT(1) AS cnt FROM bookmark_tags GROUP BY tag ORDER BY tag");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TagCount(rs.getString("tag"), rs.getInt("cnt")));
                }
            }
            return out;
        });
    }

    // --- digest inputs ---

    /**
     * Articles feeding a digest scope together with their change stamps, read in one statement so
     * the two always describe the same committed state.
     */
    public DigestSources digestSources(DigestScope scope) {
        StringBuilder sql = new StringBuilder("SELECT ").append(ARTICLE_COLUMNS)
                .append(", MAX(a.updated_at_ms, COALESCE(b.updated_at_ms, 0)) AS source_stamp")
                .append(" FROM articles a LEFT JOIN bookmarks b ON b.article_id=a.id WHERE ");
        List<Object> params = new ArrayList<>();
        switch (scope.kind()) {
            case BOOKMARKS -> sql.append("b.article_id IS NOT NULL ORDER BY b.bookmarked_at_ms DESC, a.id");
            case TAG -> {
                sql.append("b.article_id IS NOT NULL")
                        .append(" AND EXISTS (SELECT 1 FROM bookmark_tags t WHERE t.article_id=a.id AND t.tag=?)")
                        .append(" ORDER BY b.bookmarked_at_ms DESC, a.id");
                params.add(scope.tag());
            }
            case RECENT -> {
                sql.append("COALESCE(a.published_at_ms, a.fetched_at_ms) >= ?");
                params.add(clock.getAsLong() - scope.days() * DAY_MS);
                if (scope.bookmarkedOnly()) {
                    sql.append(" AND b.article_id IS NOT NULL");
                }
                sql.append(ARTICLE_ORDER).append(" LIMIT ?");
                params.add(scope.maxArticles());
            }
        }
        return database.read("digest_sources", c -> {
            List<Article> articles = new ArrayList<>();
            List<SourceStamp> stamps = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        Article article = articleRow(rs);
                        articles.add(article);
                        stamps.add(new SourceStamp(article.id(), rs.getLong("source_stamp")));
                    }
                }
            }
            return new DigestSources(scope, articles, stamps);
        });
    }

    // --- helpers ---

    static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag == null) {
                continue;
            }
            String trimmed = tag.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return List.copyOf(out);
    }

    private void touchBookmark(Connection c, String articleId, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE bookmarks SET updated_at_ms=MAX(?, updated_at_ms+1) WHERE article_id=?")) {
            ps.setLong(1, now);
            ps.setString(2, articleId);
            ps.executeUpdate();
        }
    }

    private boolean articleExists(Connection c, String articleId) throws SQLException {
        return exists(c, "SELECT 1 FROM articles WHERE id=?", articleId);
    }

    private boolean bookmarkExists(Connection c, String articleId) throws SQLException {
        return exists(c, "SELECT 1 FROM bookmarks WHERE article_id=?", articleId);
    }

    private boolean exists(Connection c, String sql, String key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private List<String> loadTags(Connection c, String articleId) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT tag FROM bookmark_tags WHERE article_id=? ORDER BY position")) {
            ps.setString(1, articleId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString("tag"));
                }
            }
        }
        return out;
    }

    private ExistingContent loadContent(Connection c, String articleId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT title,description,published_at_ms FROM articles WHERE id=?")) {
            ps.setString(1, articleId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new ExistingContent(rs.getString("title"), rs.getString("description"),
                        nullableLong(rs, "published_at_ms"));
            }
        }
    }

    private Optional<Article> findArticle(Connection c, String articleId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + ARTICLE_COLUMNS
                + " FROM articles a LEFT JOIN bookmarks b ON b.article_id=a.id WHERE a.id=?")) {
            ps.setString(1, articleId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(articleRow(rs)) : Optional.empty();
            }
        }
    }

    private Optional<Feed> findFeed(Connection c, String feedId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id,url,name,last_fetched_at_ms FROM feeds WHERE id=?")) {
            ps.setString(1, feedId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(feedRow(rs)) : Optional.empty();
            }
        }
    }

    private static Article articleRow(ResultSet rs) throws SQLException {
        return new Article(
                rs.getString("id"),
                rs.getString("feed_id"),
                rs.getString("title"),
                rs.getString("link"),
                rs.getString("description"),
                nullableLong(rs, "published_at_ms"),
                rs.getLong("fetched_at_ms"),
                rs.getInt("is_read") == 1,
                rs.getInt("is_bookmarked") == 1,
                rs.getString("insight"),
                rs.getString("insight_lang"),
                rs.getString("translation"),
                rs.getString("translation_lang"),
                rs.getLong("updated_at_ms")
        );
    }

    private static Feed feedRow(ResultSet rs) throws SQLException {
        return new Feed(
                rs.getString("id"),
                rs.getString("url"),
                rs.getString("name"),
                nullableLong(rs, "last_fetched_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            if (p instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (p instanceof Long n) {
                ps.setLong(i + 1, n);
            } else {
                ps.setString(i + 1, (String) p);
            }
        }
    }

    private static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private record ExistingContent(String title, String description, Long publishedAtMs) {
    }

    public record UpsertResult(Article article, boolean isNew) {
    }

    public record TagCount(String tag, int count) {
    }

    public record SourceStamp(String articleId, long stampMs) {
    }

    public record DigestSources(DigestScope scope, List<Article> articles, List<SourceStamp> stamps) {
        public DigestSources {
            articles = List.copyOf(articles);
            stamps = List.copyOf(stamps);
        }

        public boolean isEmpty() {
            return articles.isEmpty();
        }
    }
}
