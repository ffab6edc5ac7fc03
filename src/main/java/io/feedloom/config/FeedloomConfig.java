package io.feedloom.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class FeedloomConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "feedloom.db";
    public static final String SETTINGS_FILE_NAME = "settings.json";

    private final Path rootDir;

    public FeedloomConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static FeedloomConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new FeedloomConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
