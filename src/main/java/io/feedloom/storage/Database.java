package io.feedloom.storage;

import io.feedloom.config.FeedloomConfig;
import io.feedloom.config.FeedloomSettings;
import io.feedloom.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns the SQLite file: schema migrations, connection settings and the bounded retry loop.
 *
 * <p>Connections are never shared. Every call opens its own connection on the calling thread, so a
 * worker and the consumer thread each talk to the file through a private handle. The file runs in
 * WAL mode: readers see the last committed state while a writer is active, and write transactions
 * begin IMMEDIATE so a writer takes the file lock before its first statement instead of failing
 * halfway through.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "feedloom.schema.migration.v1";

    private final FeedloomConfig config;
    private final String jdbcUrl;
    private final List<Migration> migrations;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final int busyTimeoutMs;
    private volatile boolean ready;

    public Database(FeedloomConfig config) {
        this(config, FeedloomSettings.defaults());
    }

    public Database(FeedloomConfig config, FeedloomSettings settings) {
        this(config, settings, SchemaMigrations.all());
    }

    Database(FeedloomConfig config, FeedloomSettings settings, List<Migration> migrations) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.migrations = List.copyOf(migrations);
        this.maxAttempts = Math.max(1, settings.storeRetryMaxAttempts());
        this.baseBackoffMs = Math.max(1L, settings.storeRetryBaseBackoffMs());
        this.maxBackoffMs = Math.max(this.baseBackoffMs, settings.storeRetryMaxBackoffMs());
        this.busyTimeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(0L, settings.busyTimeoutMs()));
    }

    /**
     * Creates the data directory, switches the file to WAL and applies pending migrations. Nothing
     * else may touch the store until this returns; a failing migration leaves the store unusable.
     */
    public synchronized void init() {
        if (ready) {
            return;
        }
        initDirectories();
        applyAndValidatePragmas();
        restrictToOwner(config.dbFile());
        migrate();
        ready = true;
    }

    public boolean ready() {
        return ready;
    }

    public Connection openConnection() throws SQLException {
        if (!ready) {
            throw new IllegalStateException("Database not initialized: " + config.dbFile());
        }
        return connect();
    }

    /**
     * Runs {@code work} on a private autocommit connection, retrying on lock contention.
     */
    public <T> T read(String operation, SqlWork<T> work) {
        return withRetry(operation, () -> {
            try (Connection c = openConnection()) {
                return work.apply(c);
            }
        });
    }

    /**
     * Runs {@code work} inside one IMMEDIATE transaction. Either everything it wrote commits or the
     * transaction rolls back; a busy file restarts the whole unit of work.
     */
    public <T> T write(String operation, SqlWork<T> work) {
        return withRetry(operation, () -> {
            try (Connection c = openConnection(); Statement tx = c.createStatement()) {
                // explicit statements: the driver's commit() would immediately begin the next transaction
                tx.execute("BEGIN IMMEDIATE");
                try {
                    T result = work.apply(c);
                    tx.execute("COMMIT");
                    return result;
                } catch (Exception e) {
                    try {
                        tx.execute("ROLLBACK");
                    } catch (SQLException rollbackError) {
                        e.addSuppressed(rollbackError);
                    }
                    throw e;
                }
            }
        });
    }

    private <T> T withRetry(String operation, SqlCall<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (SQLException e) {
                if (!isContention(e)) {
                    throw new StorageFault(operation, attempt, e);
                }
                if (attempt >= maxAttempts) {
                    log.warn("Store contention on {} outlived {} attempts", operation, attempt);
                    throw new StorageFault(operation, attempt, e);
                }
                long backoff = computeBackoffMs(attempt);
                log.debug("Store busy on {}, attempt {} of {}, retrying in {} ms", operation, attempt, maxAttempts, backoff);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StorageFault(operation, attempt, ie);
                }
            }
        }
    }

    static boolean isContention(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLiteException sqlite) {
                SQLiteErrorCode code = sqlite.getResultCode();
                int primary = code == null ? -1 : code.code & 0xFF;
                if (primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private long computeBackoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, baseBackoffMs + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    private Connection connect() throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(busyTimeoutMs);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        return DriverManager.getConnection(jdbcUrl, sqlite.toProperties());
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new StorageFault("init_directories", 1, e);
        }
    }

    /**
     * Makes the store file readable and writable by its owner only. Skipped on file systems without
     * POSIX permissions.
     */
    static void restrictToOwner(Path file) {
        if (!Files.exists(file) || Files.getFileAttributeView(file, PosixFileAttributeView.class) == null) {
            log.debug("Owner-only permissions not supported for {}", file);
            return;
        }
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (IOException e) {
            throw new StorageFault("restrict_permissions", 1, e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = connect(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new SchemaFault("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new SchemaFault("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new SchemaFault("PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual);
            }
        }
    }

    private void migrate() {
        List<Migration> ordered = new ArrayList<>(migrations);
        ordered.sort(Comparator.comparingInt(Migration::version));
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).version() == ordered.get(i - 1).version()) {
                throw new SchemaFault("Duplicate migration version " + ordered.get(i).version());
            }
        }
        int known = ordered.isEmpty() ? 0 : ordered.get(ordered.size() - 1).version();

        try (Connection conn = connect()) {
            ensureSchemaMigrationsTable(conn);
            Map<Integer, String> applied = loadAppliedChecksums(conn);
            int current = applied.keySet().stream().mapToInt(Integer::intValue).max().orElse(0);
            if (current > known) {
                throw new SchemaFault("Database schema version " + current + " is newer than supported version " + known);
            }
            for (Migration step : ordered) {
                String recorded = applied.get(step.version());
                if (recorded != null) {
                    if (!recorded.equals(checksum(step))) {
                        throw new SchemaFault("Checksum mismatch for applied migration " + step.version()
                                + " (" + step.description() + ")");
                    }
                    continue;
                }
                applyMigration(conn, step);
            }
        } catch (SQLException e) {
            throw new SchemaFault("Failed to read schema state", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version INTEGER PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL
                    )
                    """);
        }
    }

    private Map<Integer, String> loadAppliedChecksums(Connection conn) throws SQLException {
        Map<Integer, String> out = new HashMap<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT version,checksum FROM schema_migrations")) {
            while (rs.next()) {
                out.put(rs.getInt("version"), rs.getString("checksum"));
            }
        }
        return out;
    }

    private void applyMigration(Connection conn, Migration step) {
        String checksum = checksum(step);
        try {
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement();
                 PreparedStatement ps = conn.prepareStatement(
                         "INSERT INTO schema_migrations(version,description,checksum,applied_at_ms) VALUES(?,?,?,?)")) {
                for (String sql : step.sql()) {
                    st.execute(sql);
                }
                ps.setInt(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum);
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
                conn.commit();
                log.info("Applied schema migration {} ({})", step.version(), step.description());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new SchemaFault("Migration " + step.version() + " failed: " + step.description(), e);
        }
    }

    private String checksum(Migration step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Hashing.sha256Hex(sb.toString()).substring(0, 16);
    }

    public int schemaVersion() {
        return read("schema_version", c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(version),0) FROM schema_migrations")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        return read("list_schema_migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT version,description,checksum,applied_at_ms FROM schema_migrations ORDER BY version")) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getInt("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms")
                    ));
                }
            }
            return out;
        });
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection c) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T call() throws SQLException;
    }

    public record SchemaMigrationRow(int version, String description, String checksum, long appliedAtMs) {
    }
}
