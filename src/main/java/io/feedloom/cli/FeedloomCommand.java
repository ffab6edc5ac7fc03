package io.feedloom.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import io.feedloom.config.FeedloomConfig;
import io.feedloom.event.EventBridge;
import io.feedloom.event.EventKey;
import io.feedloom.event.Subscription;
import io.feedloom.event.TaskEvent;
import io.feedloom.model.Article;
import io.feedloom.model.ArticleFilter;
import io.feedloom.model.Bookmark;
import io.feedloom.model.DigestScope;
import io.feedloom.model.RawArticle;
import io.feedloom.runtime.FeedloomRuntime;
import io.feedloom.storage.Database;
import io.feedloom.storage.SchemaFault;
import io.feedloom.storage.StorageFault;
import io.feedloom.task.TaskHandle;
import io.feedloom.task.TaskOutcome;
import io.feedloom.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

@Command(
        name = "feedloom",
        mixinStandardHelpOptions = true,
        description = "Feedloom article store, digest cache and AI task CLI",
        subcommands = {
                FeedloomCommand.InitCommand.class,
                FeedloomCommand.FeedAddCommand.class,
                FeedloomCommand.FeedsCommand.class,
                FeedloomCommand.IngestCommand.class,
                FeedloomCommand.ArticlesCommand.class,
                FeedloomCommand.ArticleCommand.class,
                FeedloomCommand.ReadCommand.class,
                FeedloomCommand.BookmarkCommand.class,
                FeedloomCommand.BookmarksCommand.class,
                FeedloomCommand.TagsCommand.class,
                FeedloomCommand.TagCommand.class,
                FeedloomCommand.MemoCommand.class,
                FeedloomCommand.InsightCommand.class,
                FeedloomCommand.TranslateCommand.class,
                FeedloomCommand.DigestCommand.class,
                FeedloomCommand.InvalidateCacheCommand.class,
                FeedloomCommand.ImportCommand.class,
                FeedloomCommand.SchemaMigrationsCommand.class,
                FeedloomCommand.StatsCommand.class
        }
)
public final class FeedloomCommand implements Runnable {
    /** Extra time the CLI waits for a task beyond its own timeout, for queueing and retry. */
    static final Duration WAIT_MARGIN = Duration.ofSeconds(5);

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | feed-add | feeds | ingest | articles | article | read | bookmark | bookmarks"
                + " | tags | tag | memo | insight | translate | digest | invalidate-cache | import | schema-migrations | stats");
    }

    /**
     * Command line with JSON error reporting: any failure prints one {@code {"error": ...}} line and
     * exits with 1.
     */
    public static CommandLine newCommandLine() {
        CommandLine cli = new CommandLine(new FeedloomCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            System.out.println(error(describe(ex)));
            return 1;
        });
        return cli;
    }

    FeedloomRuntime runtime() {
        FeedloomRuntime runtime = new FeedloomRuntime(FeedloomConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static String error(String message) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("error", message);
        try {
            return Jsons.compact().writeValueAsString(out);
        } catch (IOException e) {
            return "{\"error\":\"unprintable error\"}";
        }
    }

    private static String describe(Exception ex) {
        if (ex instanceof StorageFault || ex instanceof SchemaFault) {
            Throwable cause = ex.getCause();
            return ex.getMessage() + (cause == null ? "" : ": " + cause.getMessage());
        }
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    /**
     * Makes the calling thread the event consumer and pumps events until the task's outcome arrives.
     */
    static Optional<TaskOutcome> awaitOutcome(FeedloomRuntime runtime, TaskHandle handle, Duration maxWait)
            throws InterruptedException {
        EventBridge bridge = runtime.bridge();
        bridge.bindConsumer();
        AtomicReference<TaskOutcome> seen = new AtomicReference<>();
        try (Subscription ignored = bridge.subscribe(EventKey.of(handle.key()), event -> {
            if (event instanceof TaskEvent taskEvent) {
                seen.set(taskEvent.outcome());
            }
        })) {
            long deadline = System.nanoTime() + maxWait.toNanos();
            while (seen.get() == null) {
                long left = deadline - System.nanoTime();
                if (left <= 0L) {
                    break;
                }
                bridge.awaitAndDispatch(Duration.ofNanos(left));
            }
        } finally {
            bridge.unbindConsumer();
        }
        return Optional.ofNullable(seen.get());
    }

    static int printOutcome(FeedloomRuntime runtime, TaskHandle handle, long timeoutMs) throws InterruptedException {
        Optional<TaskOutcome> outcome = awaitOutcome(runtime, handle, Duration.ofMillis(timeoutMs).plus(WAIT_MARGIN));
        if (outcome.isEmpty()) {
            System.out.println(error("no outcome for task " + handle.key()));
            return 1;
        }
        System.out.println(Jsons.toJson(outcome.get()));
        return outcome.get().succeeded() ? 0 : 1;
    }

    @Command(name = "init", description = "Create the data root and apply schema migrations")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                System.out.println("Initialized Feedloom at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "feed-add", description = "Register a feed")
    static final class FeedAddCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Option(names = {"--url"}, required = true, description = "Feed URL")
        String url;

        @Option(names = {"--name"}, description = "Display name")
        String name;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.registerFeed(url, name)));
            }
            return 0;
        }
    }

    @Command(name = "feeds", description = "List registered feeds")
    static final class FeedsCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listFeeds()));
            }
            return 0;
        }
    }

    @Command(name = "ingest", description = "Store fetched entries (JSON array of {title, link, description, publishedAtMs})")
    static final class IngestCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Option(names = {"--feed-url"}, required = true, description = "Feed URL the entries came from")
        String feedUrl;

        @Option(names = {"--name"}, description = "Feed display name")
        String name;

        @Option(names = {"--file"}, required = true, description = "JSON file with the fetched entries")
        Path file;

        @Option(names = {"--async"}, defaultValue = "false", description = "Run on a worker and wait for its outcome")
        boolean async;

        @Override
        public Integer call() throws Exception {
            List<RawArticle> records = Jsons.mapper().readValue(file.toFile(), new TypeReference<List<RawArticle>>() {
            });
            try (FeedloomRuntime runtime = parent.runtime()) {
                if (async) {
                    TaskHandle handle = runtime.submitIngest(feedUrl, name, records);
                    return printOutcome(runtime, handle, FeedloomRuntime.INGEST_TIMEOUT.toMillis());
                }
                System.out.println(Jsons.toJson(runtime.ingest(feedUrl, name, records)));
            }
            return 0;
        }
    }

    @Command(name = "articles", description = "List articles, newest first")
    static final class ArticlesCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Option(names = {"--feed"}, description = "Only this feed id")
        String feedId;

        @Option(names = {"--unread"}, defaultValue = "false", description = "Only unread articles")
        boolean unreadOnly;

        @Option(names = {"--bookmarked"}, defaultValue = "false", description = "Only bookmarked articles")
        boolean bookmarkedOnly;

        @Option(names = {"--tag"}, description = "Only bookmarks carrying this tag")
        String tag;

        @Option(names = {"--search"}, description = "Text to look for in title, description, insight or translation")
        String search;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            ArticleFilter filter = new ArticleFilter(feedId, unreadOnly, bookmarkedOnly, tag, search, limit);
            try (FeedloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listArticles(filter)));
            }
            return 0;
        }
    }

    @Command(name = "article", description = "Show one article")
    static final class ArticleCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Parameters(index = "0", description = "Article id")
        String articleId;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                Optional<Article> article = runtime.getArticle(articleId);
                if (article.isEmpty()) {
                    System.out.println(error("article not found"));
                    return 1;
                }
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("article", article.get());
                out.put("bookmark", runtime.getBookmark(articleId).orElse(null));
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "read", description = "Mark an article read (or unread)")
    static final class ReadCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Parameters(index = "0", description = "Article id")
        String articleId;

        @Option(names = {"--unread"}, defaultValue = "false", description = "Mark unread instead")
        boolean unread;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                if (!runtime.setRead(articleId, !unread)) {
                    System.out.println(error("article not found"));
                    return 1;
                }
                System.out.println("{\"articleId\":\"" + articleId + "\",\"read\":" + !unread + "}");
            }
            return 0;
        }
    }

    @Command(name = "bookmark", description = "Toggle the bookmark of an article")
    static final class BookmarkCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Parameters(index = "0", description = "Article id")
        String articleId;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                boolean bookmarked = runtime.toggleBookmark(articleId);
                System.out.println("{\"articleId\":\"" + articleId + "\",\"bookmarked\":" + bookmarked + "}");
            }
            return 0;
        }
    }

    @Command(name = "bookmarks", description = "List bookmarks, most recent first")
    static final class BookmarksCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                List<Bookmark> bookmarks = runtime.listBookmarks();
                System.out.println(Jsons.toJson(bookmarks));
            }
            return 0;
        }
    }

    @Command(name = "tags", description = "List tags with their bookmark counts")
    static final class TagsCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listTags()));
            }
            return 0;
        }
    }

    @Command(name = "tag", description = "Replace the tags of a bookmarked article")
    static final class TagCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Parameters(index = "0", description = "Article id")
        String articleId;

        @Parameters(index = "1..*", arity = "0..*", description = "Tags (none clears them)")
        List<String> tags;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                if (!runtime.setTags(articleId, tags == null ? List.of() : tags)) {
                    System.out.println(error("article is not bookmarked"));
                    return 1;
                }
                System.out.println(Jsons.toJson(runtime.getBookmark(articleId).orElse(null)));
            }
            return 0;
        }
    }

    @Command(name = "memo", description = "Set or clear the memo of a bookmarked article")
    static final class MemoCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Parameters(index = "0", description = "Article id")
        String articleId;

        @Parameters(index = "1", arity = "0..1", description = "Memo text (omit to clear)")
        String memo;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                if (!runtime.setMemo(articleId, memo)) {
                    System.out.println(error("article is not bookmarked"));
                    return 1;
                }
                System.out.println(Jsons.toJson(runtime.getBookmark(articleId).orElse(null)));
            }
            return 0;
        }
    }

    @Command(name = "insight", description = "Generate (or show the stored) AI insight for an article")
    static final class InsightCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Parameters(index = "0", description = "Article id")
        String articleId;

        @Option(names = {"--force"}, defaultValue = "false", description = "Regenerate even if stored")
        boolean force;

        @Override
        public Integer call() throws InterruptedException {
            try (FeedloomRuntime runtime = parent.runtime()) {
                TaskHandle handle = runtime.requestInsight(articleId, force);
                return printOutcome(runtime, handle, runtime.settings().insightTimeoutMs());
            }
        }
    }

    @Command(name = "translate", description = "Translate an article's title and description")
    static final class TranslateCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Parameters(index = "0", description = "Article id")
        String articleId;

        @Option(names = {"--lang"}, description = "Target language code (ko, ja, zh-CN, es, de); defaults to settings")
        String lang;

        @Option(names = {"--force"}, defaultValue = "false", description = "Regenerate even if stored")
        boolean force;

        @Override
        public Integer call() throws InterruptedException {
            try (FeedloomRuntime runtime = parent.runtime()) {
                TaskHandle handle = runtime.requestTranslation(articleId, lang, force);
                return printOutcome(runtime, handle, runtime.settings().translationTimeoutMs());
            }
        }
    }

    @Command(name = "digest", description = "Generate or serve the cached digest of a scope")
    static final class DigestCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Option(names = {"--scope"}, description = "bookmarks | bookmarks:tag:<tag> | recent:<days>[:<max>[:bookmarked]]; defaults to settings")
        String scope;

        @Option(names = {"--force"}, defaultValue = "false", description = "Ignore a fresh cached digest")
        boolean force;

        @Override
        public Integer call() throws InterruptedException {
            try (FeedloomRuntime runtime = parent.runtime()) {
                DigestScope resolved = scope == null || scope.isBlank()
                        ? runtime.defaultDigestScope()
                        : DigestScope.parse(scope);
                TaskHandle handle = runtime.requestDigest(resolved, force);
                return printOutcome(runtime, handle, runtime.settings().digestTimeoutMs());
            }
        }
    }

    @Command(name = "invalidate-cache", description = "Drop every cached digest")
    static final class InvalidateCacheCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                System.out.println("{\"removed\":" + runtime.invalidateCache() + "}");
            }
            return 0;
        }
    }

    @Command(name = "import", description = "Bulk import feeds and entries (JSON array of {url, name, articles})")
    static final class ImportCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Option(names = {"--file"}, required = true, description = "JSON import file")
        Path file;

        @Override
        public Integer call() throws Exception {
            List<FeedloomRuntime.FeedImport> feeds = Jsons.mapper().readValue(file.toFile(),
                    new TypeReference<List<FeedloomRuntime.FeedImport>>() {
                    });
            try (FeedloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.bulkImport(feeds)));
            }
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Override
        public Integer call() {
            Database database = new Database(FeedloomConfig.fromRoot(parent.root));
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations()));
            return 0;
        }
    }

    @Command(name = "stats", description = "Store, cache and task counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        FeedloomCommand parent;

        @Override
        public Integer call() {
            try (FeedloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.stats()));
            }
            return 0;
        }
    }
}
