package com.shelfmark.app.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Thumbnail daemon configuration from {@code shelfmark.thumbnails.*}.
 * Pool sizes are fixed for the lifetime of a daemon.
 */
public record DaemonSettings(
        int fastWorkers,
        int slowWorkers,
        int fastBatch,
        int slowBatch,
        Duration fastTimeout,
        Duration slowTimeout,
        long sizeThresholdBytes,
        Duration pollInterval,
        Path storeDir,
        RenderSettings render
) {

    private static final String PREFIX = "shelfmark.thumbnails.";

    public static final long DEFAULT_SIZE_THRESHOLD = 30L * 1024 * 1024;

    public static DaemonSettings defaults(Path storeDir) {
        return new DaemonSettings(12, 2, 100, 10,
                Duration.ofSeconds(120), Duration.ofSeconds(600),
                DEFAULT_SIZE_THRESHOLD, Duration.ofSeconds(5),
                storeDir, RenderSettings.defaults());
    }

    public static DaemonSettings load() {
        return from(ConfigFactory.load());
    }

    public static DaemonSettings from(Config cfg) {
        String dir = ConfigValues.get(cfg, PREFIX + "dir", "");
        Path storeDir = dir.isBlank() ? com.shelfmark.app.config.Config.getThumbnailDir() : Paths.get(dir);
        DaemonSettings d = defaults(storeDir);
        return new DaemonSettings(
                ConfigValues.positive(PREFIX + "fast.workers",
                        ConfigValues.getInt(cfg, PREFIX + "fast.workers", d.fastWorkers())),
                ConfigValues.positive(PREFIX + "slow.workers",
                        ConfigValues.getInt(cfg, PREFIX + "slow.workers", d.slowWorkers())),
                ConfigValues.positive(PREFIX + "fast.batch",
                        ConfigValues.getInt(cfg, PREFIX + "fast.batch", d.fastBatch())),
                ConfigValues.positive(PREFIX + "slow.batch",
                        ConfigValues.getInt(cfg, PREFIX + "slow.batch", d.slowBatch())),
                ConfigValues.getDuration(cfg, PREFIX + "fast.timeout", d.fastTimeout()),
                ConfigValues.getDuration(cfg, PREFIX + "slow.timeout", d.slowTimeout()),
                ConfigValues.getBytes(cfg, PREFIX + "size-threshold", d.sizeThresholdBytes()),
                ConfigValues.getDuration(cfg, PREFIX + "poll-interval", d.pollInterval()),
                storeDir,
                RenderSettings.from(cfg)
        );
    }

    public DaemonSettings withStoreDir(Path dir) {
        return new DaemonSettings(fastWorkers, slowWorkers, fastBatch, slowBatch, fastTimeout, slowTimeout,
                sizeThresholdBytes, pollInterval, dir, render);
    }
}
