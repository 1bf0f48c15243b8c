package com.shelfmark.app.thumbnail;

import com.shelfmark.app.archive.ArchiveWalkerTest;
import com.shelfmark.app.config.DaemonSettings;
import com.shelfmark.app.config.RenderSettings;
import com.shelfmark.app.database.AssetRow;
import com.shelfmark.app.database.AssetWrite;
import com.shelfmark.app.database.Catalog;
import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.database.Database;
import com.shelfmark.app.format.FormatRegistry;
import com.shelfmark.app.format.FormatValidator;
import com.shelfmark.app.volume.VolumeService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class ThumbnailDaemonTest {

    private static final CatalogKind KIND = CatalogKind.MODEL;
    private static final long THRESHOLD = 1_000;

    @TempDir
    Path tmp;

    private Database db;
    private Catalog catalog;
    private VolumeService volumes;
    private Path root;
    private long jobId;
    private ThumbnailDaemon daemon;

    private final AtomicInteger renderCalls = new AtomicInteger();
    private final AtomicReference<String> lastSource = new AtomicReference<>();
    private final CountDownLatch releaseSlow = new CountDownLatch(1);
    private final AtomicInteger hangsLeft = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        db = Database.open(tmp.resolve("catalog.db"));
        catalog = new Catalog(db);
        volumes = new VolumeService(catalog);
        root = Files.createDirectories(tmp.resolve("lib"));
        volumes.register("lib", "Library", root, false);
        jobId = catalog.startJob("scan", "lib", root.toString(), true, false, "merge");
    }

    @AfterEach
    void tearDown() {
        releaseSlow.countDown();
        if (daemon != null) {
            daemon.close();
        }
        db.close();
    }

    private ThumbnailRenderer stub(String name, boolean fail) {
        return new ThumbnailRenderer() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void render(RenderRequest request) throws RenderBackendException, RenderTimeoutException {
                renderCalls.incrementAndGet();
                try {
                    lastSource.set(Files.readString(request.source()));
                    if (fail) {
                        throw new RenderBackendException(name + " cannot draw this");
                    }
                    if ("blocking".equals(name)) {
                        releaseSlow.await();
                    }
                    if ("hanging".equals(name) && hangsLeft.getAndDecrement() > 0) {
                        Thread.sleep(30_000);
                    }
                    Files.writeString(request.output(), "png:" + request.source().getFileName());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RenderTimeoutException(name + " interrupted");
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
    }

    private ThumbnailDaemon daemon(ThumbnailRenderer stlRenderer, ThumbnailRenderer bigRenderer,
                                   Duration fastTimeout, Duration pollInterval) throws IOException {
        FormatRegistry registry = new FormatRegistry()
                .register("stl", KIND, FormatValidator.ACCEPT, List.of(stlRenderer))
                .register("big", KIND, FormatValidator.ACCEPT, List.of(bigRenderer))
                .register("epub", CatalogKind.DOCUMENT, FormatValidator.ACCEPT, List.of());
        DaemonSettings settings = new DaemonSettings(4, 2, 100, 10, fastTimeout, Duration.ofSeconds(30),
                THRESHOLD, pollInterval, tmp.resolve("thumbs"), RenderSettings.defaults());
        daemon = new ThumbnailDaemon(catalog, registry, settings);
        return daemon;
    }

    private ThumbnailDaemon daemon(ThumbnailRenderer stlRenderer) throws IOException {
        return daemon(stlRenderer, stub("blocking", false), Duration.ofSeconds(30), Duration.ofSeconds(30));
    }

    private AssetRow asset(String rel, String format, long recordedSize) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, "solid " + rel);
        long mtime = Files.getLastModifiedTime(p).toMillis();
        return catalog.insertAsset(KIND, new AssetWrite("lib", rel, p.getFileName().toString(), format, rel, "",
                recordedSize, mtime, "p-" + rel, null, null, null, "a", false, null), jobId);
    }

    private static void await(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("timed out waiting for " + what);
            }
            Thread.sleep(20);
        }
    }

    private AssetRow reload(AssetRow row) {
        return catalog.findAsset(KIND, row.id()).orElseThrow();
    }

    @Test
    void successfulRenderSetsAllPreviewColumns() throws Exception {
        AssetRow row = asset("a/one.stl", "stl", 10);
        ThumbnailDaemon d = daemon(stub("mesh", false));

        assertEquals(1, d.runCycle());
        await("render", () -> d.progress().renderedTotal() == 1);

        AssetRow after = reload(row);
        assertEquals("local", after.thumbStorage());
        assertEquals("models/" + row.id() + ".png", after.thumbPath());
        assertEquals(row.fileMtime(), after.thumbSourceMtime());
        assertTrue(after.thumbRenderedAt() >= after.thumbSourceMtime());
        assertTrue(after.hasCurrentThumbnail());
        assertEquals("png:one.stl", Files.readString(d.store().resolve(after.thumbPath())));

        await("lane drained", () -> d.progress().pendingFast() == 0);
        assertEquals(0, d.runCycle(), "a current preview is not rendered again");
        assertEquals(DaemonState.IDLE, d.state());
    }

    @Test
    void failedRenderLeavesTheRowUntouched() throws Exception {
        AssetRow row = asset("a/one.stl", "stl", 10);
        ThumbnailDaemon d = daemon(stub("broken", true));

        assertEquals(1, d.runCycle());
        await("attempt", () -> renderCalls.get() == 1 && d.progress().pendingFast() == 0);

        AssetRow after = reload(row);
        assertNull(after.thumbPath());
        assertNull(after.thumbRenderedAt());
        assertNull(after.thumbSourceMtime());
        assertFalse(Files.exists(d.store().resolve(ThumbnailStore.relativePath(KIND, row.id()))));
        assertEquals(0, d.progress().renderedTotal());
        assertEquals(1, d.runCycle(), "the row is retried on the next poll");
    }

    @Test
    void largeFilesDoNotHoldUpTheFastLane() throws Exception {
        List<AssetRow> small = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            small.add(asset("small/m" + i + ".stl", "stl", 100 + i));
        }
        asset("big/huge1.big", "big", THRESHOLD * 50);
        asset("big/huge2.big", "big", THRESHOLD * 80);
        ThumbnailDaemon d = daemon(stub("mesh", false));

        assertEquals(102, d.runCycle());
        await("fast lane", () -> d.progress().pendingFast() == 0);

        for (AssetRow row : small) {
            assertNotNull(reload(row).thumbPath(), row.relativePath());
        }
        assertEquals(2, d.progress().pendingSlow(), "both slow renders are still blocked");
        assertEquals(DaemonState.RENDERING, d.state());
        assertEquals(0, d.runCycle(), "rows already in a lane are not queued twice");

        releaseSlow.countDown();
        await("slow lane", () -> d.progress().pendingSlow() == 0);
        assertEquals(102, d.progress().renderedTotal());
    }

    @Test
    void timedOutRenderIsRetriedOnTheNextPoll() throws Exception {
        AssetRow row = asset("a/one.stl", "stl", 10);
        hangsLeft.set(1);
        ThumbnailDaemon d = daemon(stub("hanging", false), stub("blocking", false),
                Duration.ofMillis(300), Duration.ofSeconds(30));

        assertEquals(1, d.runCycle());
        await("timeout", () -> renderCalls.get() == 1 && d.progress().pendingFast() == 0);
        assertNull(reload(row).thumbPath());

        assertEquals(1, d.runCycle());
        await("retry", () -> d.progress().renderedTotal() == 1);
        assertNotNull(reload(row).thumbPath());
        assertEquals(2, renderCalls.get());
    }

    @Test
    void forcedRerenderRendersACurrentPreviewAgain() throws Exception {
        AssetRow row = asset("a/one.stl", "stl", 10);
        ThumbnailDaemon d = daemon(stub("mesh", false));
        d.runCycle();
        await("first render", () -> d.progress().renderedTotal() == 1 && d.progress().pendingFast() == 0);

        assertTrue(d.requestRerender(KIND, row.id(), true));
        assertTrue(reload(row).forceRerender());
        assertFalse(reload(row).hasCurrentThumbnail());

        assertEquals(1, d.runCycle());
        await("second render", () -> d.progress().renderedTotal() == 2);
        assertFalse(reload(row).forceRerender());

        assertFalse(d.requestRerender(KIND, 9_999, true));
        assertFalse(d.requestRerender(KIND, 9_999, false));
        assertTrue(d.requestRerender(KIND, row.id(), false));
    }

    @Test
    void rowsOnUnavailableVolumesAreNotPolled() throws Exception {
        asset("a/one.stl", "stl", 10);
        ThumbnailDaemon d = daemon(stub("mesh", false));

        volumes.disable("lib");
        assertEquals(0, d.runCycle());

        volumes.enable("lib");
        assertEquals(1, d.runCycle());
    }

    @Test
    void archiveMembersAreExtractedForRendering() throws Exception {
        Files.createDirectories(root.resolve("kits"));
        Path zip = ArchiveWalkerTest.zip(root.resolve("kits/set.zip"), "models/tower.stl", "solid tower");
        AssetRow row = catalog.insertAsset(KIND, new AssetWrite("lib", "kits/set.zip::models/tower.stl", "tower.stl",
                "stl", "tower", "set", 11, Files.getLastModifiedTime(zip).toMillis(), "p", null,
                "kits/set.zip", "models/tower.stl", "kits", false, null), jobId);
        ThumbnailDaemon d = daemon(stub("mesh", false));

        d.runCycle();
        await("member render", () -> d.progress().renderedTotal() == 1);

        assertEquals("solid tower", lastSource.get());
        assertNotNull(reload(row).thumbPath());
    }

    @Test
    void backgroundLoopPicksUpNewRows() throws Exception {
        ThumbnailDaemon d = daemon(stub("mesh", false), stub("blocking", false),
                Duration.ofSeconds(30), Duration.ofMillis(50));
        d.start();

        AssetRow row = asset("a/late.stl", "stl", 10);
        await("background render", () -> reload(row).thumbPath() != null);

        d.stop();
        assertEquals(1, d.progress().renderedTotal());
    }
}
