package io.feedloom.cache;

import io.feedloom.storage.ArticleStore;
import io.feedloom.util.Hashing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Content fingerprint of the rows a digest was built from: SHA-256 over the sorted
 * {@code article_id:updated_at} lines. Independent of the order rows were read in.
 */
public final class SourceFingerprint {
    private SourceFingerprint() {
    }

    public static String of(Collection<ArticleStore.SourceStamp> stamps) {
        List<String> lines = new ArrayList<>(stamps.size());
        for (ArticleStore.SourceStamp stamp : stamps) {
            lines.add(stamp.articleId() + ":" + stamp.stampMs());
        }
        lines.sort(null);
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return Hashing.sha256Hex(sb.toString());
    }

    public static String of(ArticleStore.DigestSources sources) {
        return of(sources.stamps());
    }
}
