package io.feedloom.cache;

import io.feedloom.model.DigestArtifact;
import io.feedloom.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Durable digest cache keyed by scope. An entry is served only while the fingerprint it was built
 * from equals the caller's current fingerprint; there is no time-based expiry.
 */
public final class ArtifactCache {
    private static final Logger log = LoggerFactory.getLogger(ArtifactCache.class);

    private final Database database;
    private final LongSupplier clock;
    private final AtomicLong hits = new AtomicLong(0L);
    private final AtomicLong misses = new AtomicLong(0L);
    private final AtomicLong invalidations = new AtomicLong(0L);

    public ArtifactCache(Database database) {
        this(database, System::currentTimeMillis);
    }

    public ArtifactCache(Database database, LongSupplier clock) {
        this.database = database;
        this.clock = clock;
    }

    public Optional<String> getDigest(String scopeKey, String currentFingerprint) {
        Optional<DigestArtifact> entry = findDigest(scopeKey);
        if (entry.isPresent() && entry.get().sourceFingerprint().equals(currentFingerprint)) {
            hits.incrementAndGet();
            return Optional.of(entry.get().text());
        }
        misses.incrementAndGet();
        if (entry.isPresent()) {
            log.debug("Digest for {} is stale", scopeKey);
        }
        return Optional.empty();
    }

    public void putDigest(String scopeKey, String fingerprint, String text, int articleCount) {
        Objects.requireNonNull(scopeKey, "scopeKey");
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(text, "text");
        long now = clock.getAsLong();
        database.write("put_digest", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT OR REPLACE INTO digests(scope_key,text,source_fingerprint,generated_at_ms,article_count)
                    VALUES(?,?,?,?,?)
                    """)) {
                ps.setString(1, scopeKey);
                ps.setString(2, text);
                ps.setString(3, fingerprint);
                ps.setLong(4, now);
                ps.setInt(5, Math.max(0, articleCount));
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Raw stored entry, fresh or not.
     */
    public Optional<DigestArtifact> findDigest(String scopeKey) {
        return database.read("find_digest", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT scope_key,text,generated_at_ms,source_fingerprint,article_count
                    FROM digests WHERE scope_key=?
                    """)) {
                ps.setString(1, scopeKey);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new DigestArtifact(
                            rs.getString("scope_key"),
                            rs.getString("text"),
                            rs.getLong("generated_at_ms"),
                            rs.getString("source_fingerprint"),
                            rs.getInt("article_count")
                    ));
                }
            }
        });
    }

    /**
     * Drops every cached digest.
     *
     * @return number of entries removed
     */
    public int invalidateAll() {
        int removed = database.write("invalidate_digests", c -> {
            try (Statement st = c.createStatement()) {
                return st.executeUpdate("DELETE FROM digests");
            }
        });
        invalidations.incrementAndGet();
        log.info("Invalidated {} cached digest(s)", removed);
        return removed;
    }

    public Stats stats() {
        int entries = database.read("count_digests", c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(1) FROM digests")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
        return new Stats(entries, hits.get(), misses.get(), invalidations.get());
    }

    public record Stats(int entries, long hits, long misses, long invalidations) {
    }
}
