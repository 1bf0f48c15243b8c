package com.shelfmark.app.config;

import java.time.Duration;
import java.util.List;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed lookups with defaults over a Typesafe {@link Config}.
 * A key that is present but malformed is a configuration error, not a silent default.
 */
final class ConfigValues {

    private ConfigValues() {}

    static String get(Config cfg, String path, String def) {
        return cfg.hasPath(path) ? cfg.getString(path) : def;
    }

    static int getInt(Config cfg, String path, int def) {
        return cfg.hasPath(path) ? cfg.getInt(path) : def;
    }

    static boolean getBool(Config cfg, String path, boolean def) {
        return cfg.hasPath(path) ? cfg.getBoolean(path) : def;
    }

    static long getBytes(Config cfg, String path, long def) {
        return cfg.hasPath(path) ? cfg.getBytes(path) : def;
    }

    static Duration getDuration(Config cfg, String path, Duration def) {
        return cfg.hasPath(path) ? cfg.getDuration(path) : def;
    }

    static List<String> getList(Config cfg, String path, List<String> def) {
        return cfg.hasPath(path) ? List.copyOf(cfg.getStringList(path)) : def;
    }

    static int positive(String path, int value) {
        if (value <= 0) {
            throw new ConfigException.BadValue(path, "must be > 0, got " + value);
        }
        return value;
    }
}
