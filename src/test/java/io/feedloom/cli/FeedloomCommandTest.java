package io.feedloom.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.feedloom.config.FeedloomConfig;
import io.feedloom.storage.ArticleStore;
import io.feedloom.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class FeedloomCommandTest {
    private static final String FEED_URL = "https://example.com/feed.xml";

    @Test
    void ingestBookmarkAndInsightThroughTheCommandLine() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-cli-");
        try {
            Files.writeString(root.resolve(FeedloomConfig.SETTINGS_FILE_NAME), """
                    {"ai": {"provider": "script", "command": ["sh", "-c", "echo fake insight"]}}
                    """, StandardCharsets.UTF_8);
            Path entries = root.resolve("entries.json");
            Files.writeString(entries, """
                    [
                      {"title": "First", "link": "https://example.com/1", "description": "one", "publishedAtMs": 2000},
                      {"title": "Second", "link": "https://example.com/2", "publishedAtMs": 1000},
                      {"title": "Broken", "link": ""}
                    ]
                    """, StandardCharsets.UTF_8);
            String articleId = ArticleStore.articleId(ArticleStore.feedId(FEED_URL), "https://example.com/1");

            Run init = run(root, "init");
            Assertions.assertEquals(0, init.exitCode());
            Assertions.assertTrue(init.out().startsWith("Initialized Feedloom at:"));

            Run ingest = run(root, "ingest", "--feed-url", FEED_URL, "--name", "Example", "--file", entries.toString());
            Assertions.assertEquals(0, ingest.exitCode(), ingest.out());
            JsonNode report = ingest.json();
            Assertions.assertEquals(3, report.path("received").asInt());
            Assertions.assertEquals(2, report.path("inserted").asInt());
            Assertions.assertEquals(1, report.path("skipped").asInt());

            JsonNode articles = run(root, "articles", "--unread").json();
            Assertions.assertEquals(2, articles.size());
            Assertions.assertEquals(articleId, articles.get(0).path("id").asText());

            Run bookmark = run(root, "bookmark", articleId);
            Assertions.assertEquals(0, bookmark.exitCode());
            Assertions.assertTrue(bookmark.json().path("bookmarked").asBoolean());

            JsonNode tagged = run(root, "tag", articleId, "java", "ai").json();
            Assertions.assertEquals("java", tagged.path("tags").get(0).asText());
            Assertions.assertEquals(1, run(root, "articles", "--tag", "ai").json().size());

            Run insight = run(root, "insight", articleId);
            Assertions.assertEquals(0, insight.exitCode(), insight.out());
            JsonNode outcome = insight.json();
            Assertions.assertEquals("DONE", outcome.path("status").asText());
            Assertions.assertEquals("fake insight", outcome.path("result").asText());

            JsonNode shown = run(root, "article", articleId).json();
            Assertions.assertEquals("fake insight", shown.path("article").path("insight").asText());
            Assertions.assertEquals("ai", shown.path("bookmark").path("tags").get(1).asText());

            JsonNode digest = run(root, "digest", "--scope", "bookmarks").json();
            Assertions.assertEquals("fake insight", digest.path("result").asText());
            Assertions.assertEquals(1, run(root, "stats").json().path("cache").path("entries").asInt());
            Assertions.assertEquals(1, run(root, "invalidate-cache").json().path("removed").asInt());
            Assertions.assertEquals(3, run(root, "schema-migrations").json().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresArePrintedAsJsonErrors() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-cli-errors-");
        try {
            Run bookmark = run(root, "bookmark", "missing");
            Assertions.assertEquals(1, bookmark.exitCode());
            Assertions.assertEquals("Unknown article: missing", bookmark.json().path("error").asText());

            Run memo = run(root, "memo", "missing", "text");
            Assertions.assertEquals(1, memo.exitCode());
            Assertions.assertEquals("article is not bookmarked", memo.json().path("error").asText());

            Run translate = run(root, "translate", "missing", "--lang", "en");
            Assertions.assertEquals(1, translate.exitCode());
            JsonNode outcome = translate.json();
            Assertions.assertEquals("FAILED", outcome.path("status").asText());
            Assertions.assertEquals("INVALID_INPUT", outcome.path("failure").path("reason").asText());

            Run scope = run(root, "digest", "--scope", "weekly");
            Assertions.assertEquals(1, scope.exitCode());
            Assertions.assertTrue(scope.json().path("error").asText().contains("Unknown digest scope"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Run run(Path root, String... args) throws IOException {
        String[] argv = new String[args.length + 2];
        argv[0] = "--root";
        argv[1] = root.toString();
        System.arraycopy(args, 0, argv, 2, args.length);

        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int exit;
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            exit = FeedloomCommand.newCommandLine().execute(argv);
        } finally {
            System.setOut(original);
        }
        return new Run(exit, buffer.toString(StandardCharsets.UTF_8).trim());
    }

    private record Run(int exitCode, String out) {
        JsonNode json() throws IOException {
            return Jsons.mapper().readTree(out);
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
