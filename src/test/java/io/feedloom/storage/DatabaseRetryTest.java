package io.feedloom.storage;

import io.feedloom.config.FeedloomConfig;
import io.feedloom.config.FeedloomSettings;
import io.feedloom.model.Feed;
import io.feedloom.model.RawArticle;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.stream.Stream;

final class DatabaseRetryTest {

    @Test
    void writerContentionSurfacesAsStorageFaultAfterRetries() throws Exception {
        Path root = Files.createTempDirectory("feedloom-test-busy-");
        try {
            FeedloomConfig config = FeedloomConfig.fromRoot(root.toString());
            Database db = new Database(config, quickRetrySettings(3));
            db.init();
            ArticleStore store = new ArticleStore(db);
            Feed feed = store.registerFeed("https://example.com/feed.xml", "Example");
            String id = store.upsertArticle(feed, new RawArticle("One", "https://example.com/1", null, 1_000L))
                    .article().id();

            try (Connection blocker = exclusiveConnection(config)) {
                StorageFault fault = Assertions.assertThrows(StorageFault.class, () -> store.setRead(id, true));
                Assertions.assertEquals(3, fault.attempts());
                Assertions.assertEquals("set_read", fault.operation());
                Assertions.assertTrue(Database.isContention(fault.getCause()));

                // WAL readers are not blocked by the writer
                Assertions.assertTrue(store.getArticle(id).isPresent());
                Assertions.assertFalse(store.getArticle(id).get().read());
                blocker.rollback();
            }

            Assertions.assertTrue(store.setRead(id, true));
            Assertions.assertTrue(store.getArticle(id).get().read());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void contentionIsRecognizedThroughCauseChain() {
        SQLiteException busy = new SQLiteException("database is locked", SQLiteErrorCode.SQLITE_BUSY);
        Assertions.assertTrue(Database.isContention(busy));
        Assertions.assertTrue(Database.isContention(new RuntimeException(busy)));
        Assertions.assertTrue(Database.isContention(new SQLiteException("table locked", SQLiteErrorCode.SQLITE_LOCKED)));
        Assertions.assertFalse(Database.isContention(new SQLiteException("constraint", SQLiteErrorCode.SQLITE_CONSTRAINT)));
        Assertions.assertFalse(Database.isContention(new SQLException("plain")));
    }

    private static Connection exclusiveConnection(FeedloomConfig config) throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.EXCLUSIVE);
        Connection c = DriverManager.getConnection("jdbc:sqlite:" + config.dbFile(), sqlite.toProperties());
        c.setAutoCommit(false);
        return c;
    }

    private static FeedloomSettings quickRetrySettings(int attempts) {
        FeedloomSettings d = FeedloomSettings.defaults();
        return new FeedloomSettings(
                d.workerPoolSize(),
                d.insightTimeoutMs(),
                d.translationTimeoutMs(),
                d.digestTimeoutMs(),
                attempts,
                1L,
                5L,
                0L,
                d.language(),
                d.persona(),
                d.ai(),
                d.digest()
        );
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
