package io.feedloom.runtime;

import io.feedloom.ai.AiFailure;
import io.feedloom.ai.AiProvider;
import io.feedloom.ai.AiProviders;
import io.feedloom.ai.AiResult;
import io.feedloom.ai.Prompts;
import io.feedloom.cache.ArtifactCache;
import io.feedloom.cache.SourceFingerprint;
import io.feedloom.config.FeedloomConfig;
import io.feedloom.config.FeedloomSettings;
import io.feedloom.event.ArticleEvent;
import io.feedloom.event.CacheInvalidatedEvent;
import io.feedloom.event.EventBridge;
import io.feedloom.model.Article;
import io.feedloom.model.ArticleFilter;
import io.feedloom.model.Bookmark;
import io.feedloom.model.DigestArtifact;
import io.feedloom.model.DigestScope;
import io.feedloom.model.Feed;
import io.feedloom.model.RawArticle;
import io.feedloom.model.TaskKind;
import io.feedloom.storage.ArticleStore;
import io.feedloom.storage.Database;
import io.feedloom.task.CancellationSignal;
import io.feedloom.task.TaskCoordinator;
import io.feedloom.task.TaskFailedException;
import io.feedloom.task.TaskFailure;
import io.feedloom.task.TaskHandle;
import io.feedloom.task.TaskView;
import io.feedloom.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Entry point for the interactive layer. Queries and mutation commands run synchronously on the
 * calling thread; AI requests and feed ingestion run on the {@link TaskCoordinator} and report
 * their outcome through the {@link EventBridge}.
 */
public final class FeedloomRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FeedloomRuntime.class);
    public static final Duration INGEST_TIMEOUT = Duration.ofSeconds(60);

    private final FeedloomConfig config;
    private final FeedloomSettings settings;
    private final LongSupplier clock;
    private final Database database;
    private final ArticleStore store;
    private final ArtifactCache cache;
    private final EventBridge bridge;
    private final TaskCoordinator coordinator;
    private final AiProvider provider;

    public FeedloomRuntime(FeedloomConfig config) {
        this(config, FeedloomSettings.load(config.settingsFile()));
    }

    public FeedloomRuntime(FeedloomConfig config, FeedloomSettings settings) {
        this(config, settings, AiProviders.fromSettings(settings.ai()));
    }

    public FeedloomRuntime(FeedloomConfig config, FeedloomSettings settings, AiProvider provider) {
        this(config, settings, provider, System::currentTimeMillis);
    }

    public FeedloomRuntime(FeedloomConfig config, FeedloomSettings settings, AiProvider provider, LongSupplier clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config, settings);
        this.store = new ArticleStore(database, clock);
        this.cache = new ArtifactCache(database, clock);
        this.bridge = new EventBridge();
        this.coordinator = new TaskCoordinator(settings.workerPoolSize(), bridge, clock);
        this.provider = provider;
    }

    public void init() {
        database.init();
        log.info("Feedloom store ready at {} (schema v{})", config.dbFile(), database.schemaVersion());
    }

    public FeedloomConfig config() {
        return config;
    }

    public FeedloomSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public ArticleStore store() {
        return store;
    }

    public ArtifactCache cache() {
        return cache;
    }

    public EventBridge bridge() {
        return bridge;
    }

    public TaskCoordinator coordinator() {
        return coordinator;
    }

    public AiProvider provider() {
        return provider;
    }

    // --- queries ---

    public List<Article> listArticles(ArticleFilter filter) {
        return store.listArticles(filter);
    }

    public Optional<Article> getArticle(String articleId) {
        return store.getArticle(articleId);
    }

    public Optional<Bookmark> getBookmark(String articleId) {
        return store.getBookmark(articleId);
    }

    public List<Bookmark> listBookmarks() {
        return store.listBookmarks();
    }

    public List<ArticleStore.TagCount> listTags() {
        return store.listTags();
    }

    public List<Feed> listFeeds() {
        return store.listFeeds();
    }

    public Optional<DigestArtifact> findDigest(DigestScope scope) {
        return cache.findDigest(digestKey(scope));
    }

    /**
     * Cached digest text for the scope, only if it still matches the current data.
     */
    public Optional<String> cachedDigest(DigestScope scope) {
        ArticleStore.DigestSources sources = store.digestSources(scope);
        return cache.getDigest(digestKey(scope), SourceFingerprint.of(sources));
    }

    public DigestScope defaultDigestScope() {
        FeedloomSettings.DigestSettings digest = settings.digest();
        return DigestScope.recent(digest.periodDays(), digest.maxArticles(), digest.bookmarkedOnly());
    }

    public List<TaskView> inFlight() {
        return coordinator.inFlight();
    }

    // --- mutations ---

    public Feed registerFeed(String url, String name) {
        return store.registerFeed(url, name);
    }

    public boolean setRead(String articleId, boolean read) {
        boolean changed = store.setRead(articleId, read);
        if (changed) {
            publish(ArticleEvent.Type.READ_CHANGED, articleId);
        }
        return changed;
    }

    public boolean toggleBookmark(String articleId) {
        boolean bookmarked = store.toggleBookmark(articleId);
        publish(bookmarked ? ArticleEvent.Type.BOOKMARK_ADDED : ArticleEvent.Type.BOOKMARK_REMOVED, articleId);
        return bookmarked;
    }

    public boolean setTags(String articleId, List<String> tags) {
        boolean changed = store.setTags(articleId, tags);
        if (changed) {
            publish(ArticleEvent.Type.TAGS_CHANGED, articleId);
        }
        return changed;
    }

    public boolean setMemo(String articleId, String memo) {
        boolean changed = store.setMemo(articleId, memo);
        if (changed) {
            publish(ArticleEvent.Type.MEMO_CHANGED, articleId);
        }
        return changed;
    }

    public int invalidateCache() {
        int removed = cache.invalidateAll();
        bridge.publish(new CacheInvalidatedEvent(removed, clock.getAsLong()));
        return removed;
    }

    // --- ingestion ---

    /**
     * Stores one fetch result for a feed, registering the feed on first sight.
     */
    public IngestReport ingest(String feedUrl, String feedName, List<RawArticle> records) {
        return ingest(feedUrl, feedName, records, null);
    }

    /**
     * With a signal, the loop stops at the next record once the signal is cancelled and only the
     * fetch stamp goes through {@link CancellationSignal#commit}. Rows stored before the stop stay;
     * a later ingest of the same records finds them again.
     */
    private IngestReport ingest(String feedUrl, String feedName, List<RawArticle> records, CancellationSignal signal) {
        Feed feed = store.registerFeed(feedUrl, feedName);
        int inserted = 0;
        int skipped = 0;
        for (RawArticle raw : records) {
            if (signal != null) {
                signal.throwIfCancelled();
            }
            if (raw == null || raw.link() == null || raw.link().isBlank()) {
                skipped++;
                continue;
            }
            ArticleStore.UpsertResult result = store.upsertArticle(feed, raw);
            if (result.isNew()) {
                inserted++;
            }
            publish(ArticleEvent.Type.UPSERTED, result.article().id());
        }
        if (signal == null) {
            store.markFeedFetched(feed.id());
        } else {
            signal.commit(() -> store.markFeedFetched(feed.id()));
        }
        log.info("Ingested {} record(s) for {} ({} new, {} skipped)", records.size(), feed.url(), inserted, skipped);
        return new IngestReport(feed.id(), records.size(), inserted, skipped);
    }

    /**
     * Hands a fetch result to a worker. Two submissions for the same feed while one is in flight
     * share one execution.
     */
    public TaskHandle submitIngest(String feedUrl, String feedName, List<RawArticle> records) {
        return submitIngest(feedUrl, feedName, records, INGEST_TIMEOUT);
    }

    public TaskHandle submitIngest(String feedUrl, String feedName, List<RawArticle> records, Duration timeout) {
        List<RawArticle> copy = new ArrayList<>(records);
        String feedId = ArticleStore.feedId(feedUrl);
        return coordinator.submit(TaskKind.INGEST, feedId, timeout, signal -> {
            IngestReport report = ingest(feedUrl, feedName, copy, signal);
            return "inserted=" + report.inserted() + " received=" + report.received();
        });
    }

    /**
     * Bulk load, for example from an OPML or vault import. Every cached digest is dropped afterwards.
     */
    public BulkImportReport bulkImport(List<FeedImport> feeds) {
        int articles = 0;
        int inserted = 0;
        for (FeedImport feed : feeds) {
            IngestReport report = ingest(feed.url(), feed.name(), feed.articles());
            articles += report.received();
            inserted += report.inserted();
        }
        int invalidated = invalidateCache();
        return new BulkImportReport(feeds.size(), articles, inserted, invalidated);
    }

    // --- AI requests ---

    public TaskHandle requestInsight(String articleId) {
        return requestInsight(articleId, false);
    }

    /**
     * Generates the insight for an article in the configured language. A stored insight in that
     * language is returned as-is unless {@code force} is set.
     */
    public TaskHandle requestInsight(String articleId, boolean force) {
        String language = settings.language();
        Duration timeout = Duration.ofMillis(settings.insightTimeoutMs());
        return coordinator.submit(TaskKind.INSIGHT, articleId, timeout, signal -> {
            Article article = requireArticle(articleId);
            if (!force && article.hasInsight() && language.equals(article.insightLang())) {
                return article.insight();
            }
            String text = generate(Prompts.insight(article, language, settings.persona()), timeout, signal);
            signal.commit(() -> store.writeInsight(articleId, text, language));
            publish(ArticleEvent.Type.INSIGHT_WRITTEN, articleId);
            return text;
        });
    }

    public TaskHandle requestTranslation(String articleId) {
        return requestTranslation(articleId, settings.language(), false);
    }

    /**
     * Translates title and description into {@code language}. English and languages without a
     * translation prompt fail with INVALID_INPUT.
     */
    public TaskHandle requestTranslation(String articleId, String language, boolean force) {
        String lang = language == null || language.isBlank() ? settings.language() : language.trim();
        Duration timeout = Duration.ofMillis(settings.translationTimeoutMs());
        return coordinator.submit(TaskKind.TRANSLATION, articleId + ":" + lang, timeout, signal -> {
            if (!Prompts.isTranslatable(lang)) {
                throw new TaskFailedException(TaskFailure.Reason.INVALID_INPUT, "language not translatable: " + lang);
            }
            Article article = requireArticle(articleId);
            if (!force && article.hasTranslation() && lang.equals(article.translationLang())) {
                return article.translation();
            }
            String output = generate(Prompts.translation(article, lang), timeout, signal);
            String text = Prompts.parseTranslation(output, article.title()).asText();
            signal.commit(() -> store.writeTranslation(articleId, text, lang));
            publish(ArticleEvent.Type.TRANSLATION_WRITTEN, articleId);
            return text;
        });
    }

    public TaskHandle requestDigest(DigestScope scope) {
        return requestDigest(scope, false);
    }

    /**
     * Serves the digest for {@code scope} from the cache when its fingerprint still matches the
     * current data, otherwise generates and caches a new one.
     *
     * <p>The fingerprint is taken before generation. If the scope changes while the AI call runs
     * the new entry is stored under the old fingerprint and the next request misses.
     */
    public TaskHandle requestDigest(DigestScope scope, boolean force) {
        String language = settings.language();
        Duration timeout = Duration.ofMillis(settings.digestTimeoutMs());
        String scopeKey = digestKey(scope);
        return coordinator.submit(TaskKind.DIGEST, scopeKey, timeout, signal -> {
            ArticleStore.DigestSources sources = store.digestSources(scope);
            if (sources.isEmpty()) {
                throw new TaskFailedException(TaskFailure.Reason.INVALID_INPUT, "no articles in digest scope " + scope.key());
            }
            String fingerprint = SourceFingerprint.of(sources);
            if (!force) {
                Optional<String> cached = cache.getDigest(scopeKey, fingerprint);
                if (cached.isPresent()) {
                    log.debug("Digest {} served from cache", scopeKey);
                    return cached.get();
                }
            }
            String prompt = scope.kind() == DigestScope.Kind.RECENT
                    ? Prompts.recentDigest(sources.articles(), scope.days(), language)
                    : Prompts.bookmarkDigest(sources.articles(), language, settings.persona());
            String text = generate(prompt, timeout, signal);
            signal.commit(() -> {
                cache.putDigest(scopeKey, fingerprint, text, sources.articles().size());
                return null;
            });
            return text;
        });
    }

    /**
     * Cache and single-flight key of a digest: the scope, the output language and, for bookmark
     * digests, a hash of the persona the prompt is written for.
     */
    String digestKey(DigestScope scope) {
        String key = scope.key() + "@" + settings.language();
        String persona = settings.persona();
        if (scope.kind() == DigestScope.Kind.RECENT || persona == null || persona.isBlank()) {
            return key;
        }
        return key + "#" + Hashing.shortId(persona);
    }

    public RuntimeStats stats() {
        Map<String, Integer> perFeed = store.articleCountsByFeed();
        int articles = perFeed.values().stream().mapToInt(Integer::intValue).sum();
        return new RuntimeStats(
                store.listFeeds().size(),
                articles,
                perFeed,
                store.listBookmarks().size(),
                store.listTags().size(),
                database.schemaVersion(),
                cache.stats(),
                coordinator.inFlight().size(),
                provider.id()
        );
    }

    @Override
    public void close() {
        coordinator.shutdown();
    }

    private Article requireArticle(String articleId) throws TaskFailedException {
        return store.getArticle(articleId)
                .orElseThrow(() -> new TaskFailedException(TaskFailure.Reason.INVALID_INPUT, "unknown article: " + articleId));
    }

    private String generate(String prompt, Duration timeout, CancellationSignal signal) throws TaskFailedException {
        AiResult result = provider.generate(prompt, timeout, signal);
        if (result.success()) {
            return result.text();
        }
        AiFailure failure = result.failure();
        throw new TaskFailedException(toReason(failure.kind()), provider.id() + ": " + failure.message());
    }

    static TaskFailure.Reason toReason(AiFailure.Kind kind) {
        return switch (kind) {
            case TRANSIENT -> TaskFailure.Reason.TRANSIENT;
            case TIMEOUT -> TaskFailure.Reason.TIMEOUT;
            case UNAVAILABLE -> TaskFailure.Reason.UNAVAILABLE;
            case MISSING_CREDENTIALS -> TaskFailure.Reason.MISSING_CREDENTIALS;
            case REJECTED -> TaskFailure.Reason.REJECTED;
            case CANCELED -> TaskFailure.Reason.INTERRUPTED;
        };
    }

    private void publish(ArticleEvent.Type type, String articleId) {
        bridge.publish(new ArticleEvent(type, articleId, clock.getAsLong()));
    }

    public record IngestReport(String feedId, int received, int inserted, int skipped) {
    }

    public record FeedImport(String url, String name, List<RawArticle> articles) {
        public FeedImport {
            articles = articles == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(articles));
        }
    }

    public record BulkImportReport(int feeds, int articles, int inserted, int digestsInvalidated) {
    }

    public record RuntimeStats(
            int feeds,
            int articles,
            Map<String, Integer> articlesByFeed,
            int bookmarks,
            int tags,
            int schemaVersion,
            ArtifactCache.Stats cache,
            int tasksInFlight,
            String aiProvider
    ) {
    }
}
