package com.shelfmark.app.thumbnail;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.archive.ArchiveReader;
import com.shelfmark.app.archive.ArchiveWalker;
import com.shelfmark.app.config.DaemonSettings;
import com.shelfmark.app.database.AssetRow;
import com.shelfmark.app.database.Catalog;
import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.database.VolumeRow;
import com.shelfmark.app.format.FormatCapability;
import com.shelfmark.app.format.FormatRegistry;
import com.shelfmark.app.volume.VolumeResolver;

/**
 * Keeps previews current for both catalogs.
 * <p>
 * One loop thread polls the catalog for stale rows and hands them to two lanes: small files go
 * to the fast lane, files at or above the size threshold to the slow lane, so a few huge meshes
 * never hold up the bulk of the library. Workers render and publish; a failed or timed-out render
 * leaves the row untouched and it is picked up again by a later poll.
 */
public final class ThumbnailDaemon implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ThumbnailDaemon.class);

    private final Catalog catalog;
    private final FormatRegistry registry;
    private final DaemonSettings settings;
    private final ThumbnailStore store;
    private final RenderLane fastLane;
    private final RenderLane slowLane;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Semaphore wake = new Semaphore(0);
    private final AtomicLong renderedTotal = new AtomicLong();
    private final AtomicInteger updating = new AtomicInteger();
    private volatile DaemonState loopState = DaemonState.IDLE;
    private volatile Thread loopThread;

    public ThumbnailDaemon(Catalog catalog, FormatRegistry registry, DaemonSettings settings) throws IOException {
        this.catalog = catalog;
        this.registry = registry;
        this.settings = settings;
        this.store = new ThumbnailStore(settings.storeDir());
        this.fastLane = new RenderLane("fast", settings.fastWorkers(), settings.fastBatch(), settings.fastTimeout());
        this.slowLane = new RenderLane("slow", settings.slowWorkers(), settings.slowBatch(), settings.slowTimeout());
    }

    public ThumbnailStore store() {
        return store;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::loop, "shelfmark-thumbnail-daemon");
        t.setDaemon(true);
        loopThread = t;
        t.start();
        logger.info("Thumbnail daemon started (fast={}x{} slow={}x{}, threshold={} bytes, store={})",
                settings.fastWorkers(), settings.fastBatch(), settings.slowWorkers(), settings.slowBatch(),
                settings.sizeThresholdBytes(), store.root());
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        wake.release();
        Thread t = loopThread;
        if (t != null) {
            try {
                t.join(TimeUnit.SECONDS.toMillis(30));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        loopThread = null;
        logger.info("Thumbnail daemon stopped after {} previews", renderedTotal.get());
    }

    @Override
    public void close() {
        stop();
        fastLane.close();
        slowLane.close();
    }

    private void loop() {
        while (running.get()) {
            try {
                runCycle();
            } catch (RuntimeException e) {
                logger.error("Thumbnail poll failed", e);
                loopState = DaemonState.IDLE;
            }
            try {
                wake.tryAcquire(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
                wake.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * One poll: finds stale rows for both catalogs and queues them on their lane.
     *
     * @return number of assets newly queued
     */
    public int runCycle() {
        loopState = DaemonState.POLLING;
        List<AssetRow> fast = new ArrayList<>();
        List<AssetRow> slow = new ArrayList<>();
        for (CatalogKind kind : CatalogKind.values()) {
            List<String> formats = registry.renderableFormats(kind);
            if (formats.isEmpty()) {
                continue;
            }
            // rows already in a lane are still stale in the catalog, so ask for that many extra
            fast.addAll(catalog.findNeedingThumbnail(kind, formats, 0, settings.sizeThresholdBytes(),
                    settings.fastBatch() + fastLane.pending()));
            slow.addAll(catalog.findNeedingThumbnail(kind, formats, settings.sizeThresholdBytes(), Long.MAX_VALUE,
                    settings.slowBatch() + slowLane.pending()));
        }

        loopState = DaemonState.DISPATCHING;
        int queued = dispatch(fastLane, fast) + dispatch(slowLane, slow);
        loopState = DaemonState.IDLE;
        if (queued > 0) {
            logger.debug("Queued {} previews (fast pending={}, slow pending={})",
                    queued, fastLane.pending(), slowLane.pending());
        }
        return queued;
    }

    private int dispatch(RenderLane lane, List<AssetRow> rows) {
        int queued = 0;
        for (AssetRow row : rows) {
            CatalogKind kind = registry.byId(row.format()).map(FormatCapability::kind).orElse(null);
            if (kind == null) {
                continue;
            }
            AssetKey key = new AssetKey(kind, row.id());
            if (fastLane.contains(key) || slowLane.contains(key)) {
                continue;
            }
            if (lane.submit(key, () -> renderOne(key, lane))) {
                queued++;
            }
        }
        return queued;
    }

    /**
     * Marks a row for re-rendering (when {@code force}) and wakes the poll loop.
     *
     * @return false if no such row exists
     */
    public boolean requestRerender(CatalogKind kind, long assetId, boolean force) {
        boolean exists = force
                ? catalog.flagRerender(kind, assetId)
                : catalog.findAsset(kind, assetId).isPresent();
        if (exists) {
            wake.release();
        }
        return exists;
    }

    public DaemonProgress progress() {
        return new DaemonProgress(fastLane.pending(), slowLane.pending(), renderedTotal.get());
    }

    public DaemonState state() {
        DaemonState s = loopState;
        if (s != DaemonState.IDLE) {
            return s;
        }
        if (updating.get() > 0) {
            return DaemonState.UPDATING;
        }
        if (fastLane.pending() > 0 || slowLane.pending() > 0) {
            return DaemonState.RENDERING;
        }
        return DaemonState.IDLE;
    }

    // --- worker side -----------------------------------------------------------------

    private void renderOne(AssetKey key, RenderLane lane) {
        // re-read: the row may have changed or its volume gone away since the poll
        Optional<AssetRow> current = catalog.findAsset(key.kind(), key.id());
        if (current.isEmpty()) {
            return;
        }
        AssetRow row = current.get();
        Optional<VolumeRow> volume = catalog.findVolume(row.volumeId());
        if (volume.isEmpty() || !volume.get().isOnline() || !volume.get().enabled()) {
            logger.debug("Skipping {}: volume {} unavailable", key, row.volumeId());
            return;
        }
        Optional<FormatCapability> format = registry.byId(row.format());
        if (format.isEmpty() || !format.get().renderable()) {
            return;
        }

        Path extracted = null;
        Path output = null;
        try {
            Path container = VolumeResolver.absolute(volume.get(), row.relativePath());
            if (!Files.isRegularFile(container)) {
                logger.debug("Skipping {}: {} not found", key, container);
                return;
            }
            Path source = container;
            if (row.isArchiveMember()) {
                extracted = Files.createTempFile("shelfmark-member-",
                        "." + FilenameUtils.getExtension(row.archiveMember()));
                try (ArchiveReader reader = ArchiveWalker.open(container)) {
                    reader.extract(row.archiveMember(), extracted);
                }
                source = extracted;
            }

            output = store.newTempFile(key.kind(), key.id());
            RenderRequest request = new RenderRequest(source, row.format(), output,
                    settings.render().size(), lane.timeout());
            String renderer = RenderChain.render(format.get().renderers(), request);

            if (Thread.currentThread().isInterrupted()) {
                throw new RenderTimeoutException("deadline passed after " + renderer + " finished");
            }
            publish(key, row, output);
            output = null;
            logger.debug("Rendered {} with {}", key, renderer);
        } catch (RenderTimeoutException e) {
            logger.warn("Preview of {} ({}) timed out in {} lane, will retry: {}",
                    key, row.relativePath(), lane.name(), e.getMessage());
        } catch (RenderBackendException e) {
            logger.warn("Preview of {} ({}) failed: {}", key, row.relativePath(), e.getMessage());
        } catch (IOException e) {
            logger.warn("Preview of {} ({}) failed: {}", key, row.relativePath(), e.toString());
        } finally {
            deleteQuietly(extracted);
            deleteQuietly(output);
        }
    }

    private void publish(AssetKey key, AssetRow row, Path output) throws IOException {
        updating.incrementAndGet();
        try {
            boolean applied = store.publish(key.kind(), key.id(), output, () -> catalog.applyThumbnail(
                    key.kind(), key.id(), ThumbnailStore.relativePath(key.kind(), key.id()), row.fileMtime()));
            if (applied) {
                renderedTotal.incrementAndGet();
            } else {
                logger.debug("{} disappeared before its preview was recorded", key);
            }
        } finally {
            updating.decrementAndGet();
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) {
            return;
        }
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            logger.debug("Could not delete temp file {}: {}", p, e.toString());
        }
    }
}
