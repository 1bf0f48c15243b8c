package com.shelfmark.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Deployment paths for Shelfmark.
 * Each value is resolved from a JVM system property, then the process environment,
 * then a local {@code .env} file.
 */
public final class Config {

    private static final String APP_NAME = "Shelfmark";

    private static final String DEFAULT_DB_NAME = "catalog.db";
    private static final String DEFAULT_THUMBNAIL_DIR = "thumbnails";

    private static final String ENV_DB_NAME = "SHELFMARK_DB_NAME";
    private static final String ENV_DATA_DIR = "SHELFMARK_DATA_DIR";
    private static final String ENV_THUMBNAIL_DIR = "SHELFMARK_THUMBNAIL_DIR";

    // System property overrides (tests/CI)
    private static final String PROP_DB_NAME = "shelfmark.dbName";
    private static final String PROP_DATA_DIR = "shelfmark.dataDir";
    private static final String PROP_THUMBNAIL_DIR = "shelfmark.thumbnailDir";

    // Logger must be initialized before any static initializer that may use it
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private static volatile String cachedDataDirKey;
    private static volatile Path cachedDataDir;

    private Config() {}

    public static String getDbUrl() {
        return "jdbc:sqlite:" + getDbFilePath().toAbsolutePath();
    }

    public static Path getDbFilePath() {
        return getDataDir().resolve(resolveDbFileName());
    }

    /**
     * Root of the preview image store. Relative values are resolved against the data directory.
     */
    public static Path getThumbnailDir() {
        String configured = getEnvOrDotenv(ENV_THUMBNAIL_DIR);
        if (configured == null) {
            return getDataDir().resolve(DEFAULT_THUMBNAIL_DIR);
        }
        Path p = Paths.get(configured);
        return p.isAbsolute() ? p : getDataDir().resolve(p);
    }

    public static Path getDataDir() {
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);
        String key = overrideDir == null ? "" : overrideDir;
        Path current = cachedDataDir;
        if (current != null && key.equals(cachedDataDirKey)) {
            return current;
        }

        synchronized (Config.class) {
            current = cachedDataDir;
            if (current != null && key.equals(cachedDataDirKey)) {
                return current;
            }
            Path resolved = resolveDataDir(overrideDir);
            cachedDataDirKey = key;
            cachedDataDir = resolved;
            return resolved;
        }
    }

    private static String resolveDbFileName() {
        String name = getEnvOrDotenv(ENV_DB_NAME);
        return name == null ? DEFAULT_DB_NAME : name;
    }

    /**
     * Reads a value from system properties, the environment or the .env file, in that order.
     */
    private static String getEnvOrDotenv(String key) {
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        return switch (envKey) {
            case ENV_DB_NAME -> PROP_DB_NAME;
            case ENV_DATA_DIR -> PROP_DATA_DIR;
            case ENV_THUMBNAIL_DIR -> PROP_THUMBNAIL_DIR;
            default -> null;
        };
    }

    private static Path resolveDataDir(String overrideDir) {
        if (overrideDir != null) {
            Path p = Paths.get(overrideDir);
            try {
                Files.createDirectories(p);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot create data directory: " + p, e);
            }
            logger.info("Data directory (override): {}", p.toAbsolutePath());
            return p;
        }

        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");
        Path appDataDir;

        if (os.contains("win")) {
            String appDataEnv = System.getenv("APPDATA");
            if (appDataEnv != null && !appDataEnv.isBlank()) {
                appDataDir = Paths.get(appDataEnv, APP_NAME);
            } else {
                appDataDir = Paths.get(userHome, "AppData", "Roaming", APP_NAME);
            }
        } else if (os.contains("mac")) {
            appDataDir = Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            // XDG (~/.local/share/Shelfmark)
            String xdgData = System.getenv("XDG_DATA_HOME");
            if (xdgData != null && !xdgData.isBlank()) {
                appDataDir = Paths.get(xdgData, APP_NAME);
            } else {
                appDataDir = Paths.get(userHome, ".local", "share", APP_NAME);
            }
        }

        try {
            Files.createDirectories(appDataDir);
            logger.info("Data directory: {}", appDataDir.toAbsolutePath());
            return appDataDir;
        } catch (IOException e) {
            Path localPath = Paths.get("").toAbsolutePath();
            logger.warn("Cannot use {}. Falling back to working directory: {}", appDataDir, localPath);
            return localPath;
        }
    }
}
