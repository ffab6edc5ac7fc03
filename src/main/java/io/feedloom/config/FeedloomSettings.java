package io.feedloom.config;

import io.feedloom.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tunables read from {@code settings.json} under the data root.
 *
 * <p>Every field of the file is optional. Missing values fall back to {@link #defaults()} and
 * present values are clamped to a sane minimum, so a hand-edited file can never produce a zero-sized
 * pool or a negative timeout.
 */
public record FeedloomSettings(
        int workerPoolSize,
        long insightTimeoutMs,
        long translationTimeoutMs,
        long digestTimeoutMs,
        int storeRetryMaxAttempts,
        long storeRetryBaseBackoffMs,
        long storeRetryMaxBackoffMs,
        long busyTimeoutMs,
        String language,
        String persona,
        AiSettings ai,
        DigestSettings digest
) {
    public static final int DEFAULT_WORKER_POOL_SIZE = 3;
    public static final long DEFAULT_INSIGHT_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_TRANSLATION_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_DIGEST_TIMEOUT_MS = 90_000L;
    public static final int DEFAULT_STORE_RETRY_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_STORE_RETRY_BASE_BACKOFF_MS = 20L;
    public static final long DEFAULT_STORE_RETRY_MAX_BACKOFF_MS = 500L;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 250L;
    public static final String DEFAULT_LANGUAGE = "en";

    private static final Pattern ENV_REF = Pattern.compile("^\\$\\{([A-Za-z_][A-Za-z0-9_]*)}$");

    public static FeedloomSettings defaults() {
        return new FeedloomSettings(
                DEFAULT_WORKER_POOL_SIZE,
                DEFAULT_INSIGHT_TIMEOUT_MS,
                DEFAULT_TRANSLATION_TIMEOUT_MS,
                DEFAULT_DIGEST_TIMEOUT_MS,
                DEFAULT_STORE_RETRY_MAX_ATTEMPTS,
                DEFAULT_STORE_RETRY_BASE_BACKOFF_MS,
                DEFAULT_STORE_RETRY_MAX_BACKOFF_MS,
                DEFAULT_BUSY_TIMEOUT_MS,
                DEFAULT_LANGUAGE,
                "",
                AiSettings.defaults(),
                DigestSettings.defaults()
        );
    }

    public static FeedloomSettings load(Path settingsFile) {
        return load(settingsFile, System.getenv());
    }

    public static FeedloomSettings load(Path settingsFile, Map<String, String> env) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults(), env);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file: " + settingsFile, e);
        }
    }

    static FeedloomSettings fromFile(SettingsFile file, FeedloomSettings defaults, Map<String, String> env) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.storeRetryBaseBackoffMs(), defaults.storeRetryBaseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.storeRetryMaxBackoffMs(), defaults.storeRetryMaxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        return new FeedloomSettings(
                sanitizeInt(file.workerPoolSize(), defaults.workerPoolSize(), 1),
                sanitizeLong(file.insightTimeoutMs(), defaults.insightTimeoutMs(), 100L),
                sanitizeLong(file.translationTimeoutMs(), defaults.translationTimeoutMs(), 100L),
                sanitizeLong(file.digestTimeoutMs(), defaults.digestTimeoutMs(), 100L),
                sanitizeInt(file.storeRetryMaxAttempts(), defaults.storeRetryMaxAttempts(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeLong(file.busyTimeoutMs(), defaults.busyTimeoutMs(), 0L),
                sanitizeText(file.language(), defaults.language()),
                file.persona() == null ? defaults.persona() : file.persona().trim(),
                AiSettings.fromFile(file.ai(), defaults.ai(), env),
                DigestSettings.fromFile(file.digest(), defaults.digest())
        );
    }

    static String resolveEnv(String raw, Map<String, String> env) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        Matcher m = ENV_REF.matcher(value);
        if (m.matches()) {
            String resolved = env == null ? null : env.get(m.group(1));
            return resolved == null ? "" : resolved;
        }
        return value;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    public record AiSettings(String provider, List<String> command, String model, String apiKey, String endpoint) {
        public static final String PROVIDER_SCRIPT = "script";
        public static final String PROVIDER_ANTHROPIC = "anthropic";
        public static final String PROVIDER_OPENAI = "openai";
        public static final String DEFAULT_ANTHROPIC_ENDPOINT = "https://api.anthropic.com/v1/messages";

        public AiSettings {
            command = command == null ? List.of() : List.copyOf(command);
        }

        static AiSettings defaults() {
            return new AiSettings(PROVIDER_SCRIPT, List.of("claude", "-p"), "", "", DEFAULT_ANTHROPIC_ENDPOINT);
        }

        static AiSettings fromFile(AiFile file, AiSettings defaults, Map<String, String> env) {
            if (file == null) {
                return defaults;
            }
            String provider = sanitizeText(file.provider(), defaults.provider()).toLowerCase(Locale.ROOT);
            List<String> command = file.command() == null || file.command().isEmpty()
                    ? defaults.command()
                    : file.command();
            String apiKey = file.apiKey() == null ? defaults.apiKey() : resolveEnv(file.apiKey(), env);
            return new AiSettings(
                    provider,
                    command,
                    file.model() == null ? defaults.model() : file.model().trim(),
                    apiKey,
                    sanitizeText(file.endpoint(), defaults.endpoint())
            );
        }
    }

    public record DigestSettings(int periodDays, int maxArticles, boolean bookmarkedOnly) {
        static DigestSettings defaults() {
            return new DigestSettings(7, 20, false);
        }

        static DigestSettings fromFile(DigestFile file, DigestSettings defaults) {
            if (file == null) {
                return defaults;
            }
            return new DigestSettings(
                    sanitizeInt(file.periodDays(), defaults.periodDays(), 1),
                    sanitizeInt(file.maxArticles(), defaults.maxArticles(), 1),
                    file.bookmarkedOnly() == null ? defaults.bookmarkedOnly() : file.bookmarkedOnly()
            );
        }
    }

    record SettingsFile(
            Integer workerPoolSize,
            Long insightTimeoutMs,
            Long translationTimeoutMs,
            Long digestTimeoutMs,
            Integer storeRetryMaxAttempts,
            Long storeRetryBaseBackoffMs,
            Long storeRetryMaxBackoffMs,
            Long busyTimeoutMs,
            String language,
            String persona,
            AiFile ai,
            DigestFile digest
    ) {
    }

    record AiFile(String provider, List<String> command, String model, String apiKey, String endpoint) {
    }

    record DigestFile(Integer periodDays, Integer maxArticles, Boolean bookmarkedOnly) {
    }
}
