package com.shelfmark.app.config;

import java.util.List;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Scanner tunables from {@code shelfmark.scanner.*}.
 *
 * @param excludeGlobs   glob patterns (relative to the volume root) never visited
 * @param verifyFullHash confirm partial-hash matches with a full hash before merge/reject/warn
 * @param progressEvery  write scan job progress every N items
 * @param defaultPolicy  duplicate policy used when a request does not name one
 */
public record ScannerSettings(
        List<String> excludeGlobs,
        boolean verifyFullHash,
        int progressEvery,
        String defaultPolicy
) {

    private static final String PREFIX = "shelfmark.scanner.";

    public static ScannerSettings defaults() {
        return new ScannerSettings(List.of(), true, 100, "merge");
    }

    public static ScannerSettings load() {
        return from(ConfigFactory.load());
    }

    public static ScannerSettings from(Config cfg) {
        ScannerSettings d = defaults();
        return new ScannerSettings(
                ConfigValues.getList(cfg, PREFIX + "exclude", d.excludeGlobs()),
                ConfigValues.getBool(cfg, PREFIX + "verify-full-hash", d.verifyFullHash()),
                ConfigValues.positive(PREFIX + "progress-every",
                        ConfigValues.getInt(cfg, PREFIX + "progress-every", d.progressEvery())),
                ConfigValues.get(cfg, PREFIX + "duplicate-policy", d.defaultPolicy())
        );
    }
}
