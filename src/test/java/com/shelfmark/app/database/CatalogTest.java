package com.shelfmark.app.database;

import org.jdbi.v3.core.JdbiException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogTest {

    private static final CatalogKind KIND = CatalogKind.MODEL;
    private static final String VOL = "lib";

    @TempDir
    Path tmp;

    private Database db;
    private Catalog catalog;
    private long jobId;

    @BeforeEach
    void setUp() {
        db = Database.open(tmp.resolve("catalog.db"));
        catalog = new Catalog(db);
        catalog.insertVolume(VOL, "Library", tmp.toString(), false);
        catalog.updateVolumeStatus(VOL, VolumeStatus.ONLINE, null);
        jobId = catalog.startJob("scan", VOL, tmp.toString(), true, false, "merge");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    static AssetWrite write(String volumeId, String rel, String partial) {
        String folder = rel.contains("/") ? rel.substring(0, rel.lastIndexOf('/')) : "";
        String filename = rel.substring(rel.lastIndexOf('/') + 1);
        String title = filename.substring(0, filename.lastIndexOf('.')).replace('_', ' ');
        return new AssetWrite(volumeId, rel, filename, "stl", title, folder, 100, 1_000, partial, null,
                null, null, folder, false, null);
    }

    @Test
    void insertedRowIsReadableByPathAndFolder() {
        AssetRow row = catalog.insertAsset(KIND, write(VOL, "minis/dragon_bust.stl", "p1"), jobId);

        assertEquals(IndexStatus.INDEXED, row.indexStatus());
        assertEquals("minis", row.folderPath());
        assertEquals(jobId, row.lastSeenJobId());
        assertEquals(row.id(), catalog.findByPath(KIND, VOL, "minis/dragon_bust.stl").orElseThrow().id());
        assertEquals(1, catalog.listFolder(KIND, VOL, "minis").size());
        assertTrue(catalog.listFolder(KIND, VOL, "").isEmpty());
        assertEquals(0, catalog.countAssets(CatalogKind.DOCUMENT), "catalogs are separate tables");
    }

    @Test
    void searchMatchesPrefixes_andIgnoresQuerySyntax() {
        catalog.insertAsset(KIND, write(VOL, "minis/dragon_bust.stl", "p1"), jobId);
        catalog.insertAsset(KIND, write(VOL, "terrain/castle_wall.stl", "p2"), jobId);

        assertEquals(1, catalog.search(KIND, "drag", 10).size());
        assertEquals(1, catalog.search(KIND, "castle terr", 10).size());
        assertDoesNotThrow(() -> catalog.search(KIND, "\"unbalanced OR NEAR(", 10));
        assertTrue(catalog.search(KIND, "   ", 10).isEmpty());
    }

    @Test
    void searchIndexFollowsRelocation() {
        AssetRow row = catalog.insertAsset(KIND, write(VOL, "a/old_name.stl", "p1"), jobId);
        assertTrue(catalog.relocateAsset(KIND, row.id(), VOL, "a/old_name.stl", write(VOL, "b/new_name.stl", "p1"), jobId));

        assertTrue(catalog.search(KIND, "old", 10).isEmpty());
        assertEquals(row.id(), catalog.search(KIND, "new", 10).get(0).id());
    }

    @Test
    void secondPrimaryAtSamePathIsRejected_butDuplicateIsAllowed() {
        AssetRow first = catalog.insertAsset(KIND, write(VOL, "a/b.stl", "p1"), jobId);

        assertThrows(JdbiException.class, () -> catalog.insertAsset(KIND, write(VOL, "a/b.stl", "p1"), jobId));
        AssetRow dup = catalog.insertAsset(KIND, write(VOL, "a/b.stl", "p1").asDuplicateOf(first.id()), jobId);
        assertTrue(dup.duplicate());
        assertEquals(first.id(), catalog.findByPath(KIND, VOL, "a/b.stl").orElseThrow().id(),
                "path lookup prefers the primary");
    }

    @Test
    void relocateOnlyWhenRowIsStillWhereItWasSeen() {
        AssetRow row = catalog.insertAsset(KIND, write(VOL, "a/b.stl", "p1"), jobId);

        assertFalse(catalog.relocateAsset(KIND, row.id(), VOL, "x/elsewhere.stl", write(VOL, "c/b.stl", "p1"), jobId));
        assertTrue(catalog.relocateAsset(KIND, row.id(), VOL, "a/b.stl", write(VOL, "c/b.stl", "p1"), jobId));

        AssetRow moved = catalog.findAsset(KIND, row.id()).orElseThrow();
        assertEquals("c/b.stl", moved.relativePath());
        assertEquals("c", moved.folderPath());
    }

    @Test
    void unseenRowsAreScopedByFolder_andLikeWildcardsAreLiteral() {
        catalog.insertAsset(KIND, write(VOL, "a_b/one.stl", "p1"), jobId);
        catalog.insertAsset(KIND, write(VOL, "aXb/two.stl", "p2"), jobId);
        catalog.insertAsset(KIND, write(VOL, "a_b/deep/three.stl", "p3"), jobId);

        long next = catalog.startJob("scan", VOL, tmp.toString(), true, false, "merge");
        assertEquals(2, catalog.findUnseen(KIND, VOL, next, "a_b", true).size());
        assertEquals(1, catalog.findUnseen(KIND, VOL, next, "a_b", false).size());
        assertEquals(3, catalog.findUnseen(KIND, VOL, next, "", true).size());
    }

    @Test
    void missingRowKeepsIdentityAndIsRestored() {
        AssetRow row = catalog.insertAsset(KIND, write(VOL, "a/b.stl", "p1"), jobId);

        assertEquals(1, catalog.markMissing(KIND, List.of(row.id())));
        AssetRow missing = catalog.findAsset(KIND, row.id()).orElseThrow();
        assertEquals(IndexStatus.MISSING, missing.indexStatus());
        assertNotNull(missing.missingSince());

        catalog.touchAsset(KIND, row.id(), jobId);
        AssetRow back = catalog.findAsset(KIND, row.id()).orElseThrow();
        assertEquals(IndexStatus.INDEXED, back.indexStatus());
        assertNull(back.missingSince());
    }

    @Test
    void thumbnailColumnsChangeTogether() {
        AssetRow row = catalog.insertAsset(KIND, write(VOL, "a/b.stl", "p1"), jobId);
        List<String> formats = List.of("stl");
        assertEquals(1, catalog.findNeedingThumbnail(KIND, formats, 0, Long.MAX_VALUE, 10).size());

        long futureMtime = System.currentTimeMillis() + 3_600_000;
        assertTrue(catalog.applyThumbnail(KIND, row.id(), "models/" + row.id() + ".png", futureMtime));
        AssetRow done = catalog.findAsset(KIND, row.id()).orElseThrow();
        assertEquals(Catalog.LOCAL_STORAGE, done.thumbStorage());
        assertEquals("models/" + row.id() + ".png", done.thumbPath());
        assertEquals(futureMtime, done.thumbSourceMtime());
        assertTrue(done.thumbRenderedAt() >= done.thumbSourceMtime());
        assertFalse(done.forceRerender());

        // source mtime differs from file_mtime: still stale
        assertEquals(1, catalog.findNeedingThumbnail(KIND, formats, 0, Long.MAX_VALUE, 10).size());
        assertTrue(catalog.applyThumbnail(KIND, row.id(), "models/" + row.id() + ".png", done.fileMtime()));
        assertTrue(catalog.findNeedingThumbnail(KIND, formats, 0, Long.MAX_VALUE, 10).isEmpty());

        assertTrue(catalog.flagRerender(KIND, row.id()));
        assertEquals(1, catalog.findNeedingThumbnail(KIND, formats, 0, Long.MAX_VALUE, 10).size());
        assertTrue(catalog.findNeedingThumbnail(KIND, formats, 0, 100, 10).isEmpty(), "size window is [min, max)");

        catalog.updateVolumeStatus(VOL, VolumeStatus.OFFLINE, "unplugged");
        assertTrue(catalog.findNeedingThumbnail(KIND, formats, 0, Long.MAX_VALUE, 10).isEmpty());
    }

    @Test
    void linkingRepointsRowsThatPointedAtTheNewDuplicate() {
        AssetRow a = catalog.insertAsset(KIND, write(VOL, "a/x.stl", "p1"), jobId);
        AssetRow b = catalog.insertAsset(KIND, write(VOL, "b/x.stl", "p1"), jobId);
        AssetRow c = catalog.insertAsset(KIND, write(VOL, "c/x.stl", "p1").asDuplicateOf(b.id()), jobId);

        assertTrue(catalog.linkDuplicate(KIND, b.id(), a.id()));
        assertEquals(a.id(), catalog.findAsset(KIND, c.id()).orElseThrow().duplicateOfId());
        assertFalse(catalog.linkDuplicate(KIND, b.id(), a.id()), "already a duplicate");
    }

    @Test
    void contentChangeReleasesDuplicatesOfTheRow() {
        AssetRow a = catalog.insertAsset(KIND, write(VOL, "a/x.stl", "p1"), jobId);
        AssetRow dup = catalog.insertAsset(KIND, write(VOL, "b/x.stl", "p1").asDuplicateOf(a.id()), jobId);

        catalog.updateAsset(KIND, a.id(), write(VOL, "a/x.stl", "p-changed"), jobId, true);

        AssetRow released = catalog.findAsset(KIND, dup.id()).orElseThrow();
        assertFalse(released.duplicate());
        assertNull(released.duplicateOfId());
    }

    @Test
    void volumeWithAssetsIsNotDeleted_butJobHistorySurvivesDeletion() {
        catalog.insertVolume("spare", "Spare", tmp.resolve("spare").toString(), false);
        long spareJob = catalog.startJob("verify", "spare", null, true, false, null);
        catalog.insertAsset(KIND, write(VOL, "a/x.stl", "p1"), jobId);

        assertEquals(1, catalog.deleteVolumeIfUnreferenced(VOL));
        assertTrue(catalog.findVolume(VOL).isPresent());

        assertEquals(0, catalog.deleteVolumeIfUnreferenced("spare"));
        assertTrue(catalog.findVolume("spare").isEmpty());
        assertNull(catalog.findJob(spareJob).orElseThrow().volumeId());
    }

    @Test
    void jobBookkeeping() {
        catalog.recordJobError(jobId, "a/b.gltf", "VALIDATION", "x".repeat(5000));
        catalog.finishJob(jobId, "completed", 3, 2, 0, 1, 0, null);

        ScanJobRow job = catalog.findJob(jobId).orElseThrow();
        assertEquals("completed", job.status());
        assertEquals("done", job.phase());
        assertNotNull(job.completedAt());

        List<JobErrorRow> errors = catalog.jobErrors(jobId);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).errorMessage().length() <= 2000);
    }
}
