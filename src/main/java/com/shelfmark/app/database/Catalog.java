package com.shelfmark.app.database;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

/**
 * Transactional access to the catalog. Each mutating method is one transaction covering one
 * logical action, and writes a complete row for that action.
 */
public final class Catalog {

    public static final String LOCAL_STORAGE = "local";

    private final Jdbi jdbi;
    private final Clock clock;

    public Catalog(Database database) {
        this(database.jdbi(), Clock.systemUTC());
    }

    public Catalog(Jdbi jdbi, Clock clock) {
        this.jdbi = jdbi;
        this.clock = clock;
    }

    public long now() {
        return clock.millis();
    }

    // --- Volumes ---------------------------------------------------------------

    public void insertVolume(String id, String label, String mountPath, boolean readonly) {
        jdbi.useExtension(VolumeDao.class, dao -> dao.insert(id, label, mountPath, readonly, now()));
    }

    public Optional<VolumeRow> findVolume(String id) {
        return jdbi.withExtension(VolumeDao.class, dao -> dao.findById(id));
    }

    public List<VolumeRow> listVolumes() {
        return jdbi.withExtension(VolumeDao.class, VolumeDao::findAll);
    }

    public void updateVolumeStatus(String id, VolumeStatus status, String reason) {
        jdbi.useExtension(VolumeDao.class, dao -> dao.updateStatus(id, status.dbValue(), reason, now()));
    }

    public boolean setVolumeEnabled(String id, boolean enabled) {
        return jdbi.withExtension(VolumeDao.class, dao -> dao.setEnabled(id, enabled)) > 0;
    }

    public void markVolumeIndexed(String id) {
        jdbi.useExtension(VolumeDao.class, dao -> dao.markIndexed(id, now()));
    }

    /**
     * Deletes a volume row only when no asset references it; returns the number of referencing assets
     * otherwise (nothing deleted).
     */
    public long deleteVolumeIfUnreferenced(String id) {
        return jdbi.inTransaction(h -> {
            VolumeDao dao = h.attach(VolumeDao.class);
            long refs = dao.countReferencingAssets(id);
            if (refs == 0) {
                dao.detachJobs(id);
                dao.delete(id);
            }
            return refs;
        });
    }

    // --- Asset reads -------------------------------------------------------------

    public Optional<AssetRow> findAsset(CatalogKind kind, long id) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.findById(kind.table(), id));
    }

    public Optional<AssetRow> findByPath(CatalogKind kind, String volumeId, String relativePath) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.findByPath(kind.table(), volumeId, relativePath));
    }

    public List<AssetRow> findPartialMatches(CatalogKind kind, String partialHash, String volumeId, String relativePath) {
        return jdbi.withExtension(AssetDao.class,
                dao -> dao.findPartialMatches(kind.table(), partialHash, volumeId, relativePath));
    }

    public long countAssets(CatalogKind kind) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.countAll(kind.table()));
    }

    public long countAssetsOnVolume(CatalogKind kind, String volumeId) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.countByVolume(kind.table(), volumeId));
    }

    public List<AssetRow> listFolder(CatalogKind kind, String volumeId, String folderPath) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.listFolder(kind.table(), volumeId, folderPath));
    }

    /**
     * Full-text search over filename, title, collection, author and creator. Each whitespace-separated term is
     * matched as a quoted prefix, so user input never reaches FTS5 query syntax.
     */
    public List<AssetRow> search(CatalogKind kind, String query, int limit) {
        String match = toMatchExpression(query);
        if (match.isEmpty()) {
            return List.of();
        }
        return jdbi.withExtension(AssetDao.class, dao -> dao.search(kind.table(), match, limit));
    }

    static String toMatchExpression(String query) {
        List<String> terms = new ArrayList<>();
        for (String t : StringUtils.split(StringUtils.defaultString(query))) {
            terms.add("\"" + t.replace("\"", "\"\"") + "\"*");
        }
        return String.join(" ", terms);
    }

    // --- Scanner actions ---------------------------------------------------------

    /** NEW: inserts a row and returns it as stored. */
    public AssetRow insertAsset(CatalogKind kind, AssetWrite asset, long jobId) {
        return jdbi.inTransaction(h -> {
            AssetDao dao = h.attach(AssetDao.class);
            dao.insert(kind.table(), asset, jobId, now());
            long id = dao.lastInsertId();
            return dao.findById(kind.table(), id).orElseThrow();
        });
    }

    /**
     * UPDATE: rewrites the row in place. When the content changed, rows that were linked to it as
     * duplicates are released, since they no longer share its content.
     */
    public void updateAsset(CatalogKind kind, long id, AssetWrite asset, long jobId, boolean contentChanged) {
        jdbi.useTransaction(h -> {
            AssetDao dao = h.attach(AssetDao.class);
            dao.rewrite(kind.table(), id, asset, jobId, now());
            if (contentChanged) {
                dao.releaseDuplicatesOf(kind.table(), id);
            }
        });
    }

    /**
     * MOVED: repoints the row to a new location if it is still at {@code expectedVolumeId/expectedPath}.
     * Returns false when another writer moved it first.
     */
    public boolean relocateAsset(CatalogKind kind, long id, String expectedVolumeId, String expectedPath,
                                 AssetWrite asset, long jobId) {
        return jdbi.inTransaction(h -> h.attach(AssetDao.class)
                .relocate(kind.table(), id, expectedVolumeId, expectedPath, asset, jobId, now()) == 1);
    }

    /** UNCHANGED: confirms the row was seen by this job. */
    public void touchAsset(CatalogKind kind, long id, long jobId) {
        jdbi.useExtension(AssetDao.class, dao -> dao.touch(kind.table(), id, jobId, now()));
    }

    public void markAssetError(CatalogKind kind, long id, long jobId) {
        jdbi.useExtension(AssetDao.class, dao -> dao.markError(kind.table(), id, jobId, now()));
    }

    public void recordFullHash(CatalogKind kind, long id, String fullHash) {
        jdbi.useExtension(AssetDao.class, dao -> dao.setFullHash(kind.table(), id, fullHash));
    }

    /**
     * Rows of a volume inside a scan scope that the given job did not confirm.
     *
     * @param folder    scope folder relative to the volume root, "" for the whole volume
     * @param recursive whole subtree, or only rows whose folder_path equals {@code folder}
     */
    public List<AssetRow> findUnseen(CatalogKind kind, String volumeId, long jobId, String folder, boolean recursive) {
        return jdbi.withExtension(AssetDao.class, dao -> {
            if (!recursive) {
                return dao.findUnseenInFolder(kind.table(), volumeId, jobId, folder);
            }
            String pattern = folder.isEmpty() ? "%" : escapeLike(folder) + "/%";
            return dao.findUnseenUnder(kind.table(), volumeId, jobId, pattern);
        });
    }

    static String escapeLike(String s) {
        return s.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    public int markMissing(CatalogKind kind, List<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return jdbi.inTransaction(h -> h.attach(AssetDao.class).markMissing(kind.table(), ids, now()));
    }

    public List<AssetRow> findMissing(CatalogKind kind, String volumeId) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.findMissing(kind.table(), volumeId));
    }

    public boolean restoreAsset(CatalogKind kind, long id) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.restore(kind.table(), id, now())) == 1;
    }

    // --- Thumbnails ----------------------------------------------------------------

    public List<AssetRow> findNeedingThumbnail(CatalogKind kind, List<String> formats,
                                               long minSize, long maxSize, int limit) {
        return jdbi.withExtension(AssetDao.class,
                dao -> dao.findNeedingThumbnail(kind.table(), formats, minSize, maxSize, limit));
    }

    /**
     * Records a finished render. All preview columns change together or not at all.
     */
    public boolean applyThumbnail(CatalogKind kind, long id, String thumbPath, long sourceMtime) {
        long renderedAt = Math.max(now(), sourceMtime);
        return jdbi.inTransaction(h -> h.attach(AssetDao.class)
                .applyThumbnail(kind.table(), id, LOCAL_STORAGE, thumbPath, renderedAt, sourceMtime) == 1);
    }

    public boolean flagRerender(CatalogKind kind, long id) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.flagRerender(kind.table(), id)) == 1;
    }

    // --- Duplicate sweep -------------------------------------------------------------

    public List<String> findCollidingPartialHashes(CatalogKind kind) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.findCollidingPartialHashes(kind.table()));
    }

    public List<AssetRow> findPrimariesByPartialHash(CatalogKind kind, String partialHash) {
        return jdbi.withExtension(AssetDao.class, dao -> dao.findPrimariesByPartialHash(kind.table(), partialHash));
    }

    /**
     * Links {@code id} to {@code targetId} and re-links rows that pointed at {@code id}, so no
     * duplicate ends up pointing at another duplicate.
     */
    public boolean linkDuplicate(CatalogKind kind, long id, long targetId) {
        return jdbi.inTransaction(h -> {
            AssetDao dao = h.attach(AssetDao.class);
            int linked = dao.linkDuplicate(kind.table(), id, targetId);
            if (linked == 1) {
                relinkDuplicates(h, kind, id, targetId);
            }
            return linked == 1;
        });
    }

    private static void relinkDuplicates(Handle h, CatalogKind kind, long fromId, long toId) {
        h.createUpdate("UPDATE <table> SET duplicate_of_id = :to WHERE duplicate_of_id = :from")
                .define("table", kind.table())
                .bind("to", toId)
                .bind("from", fromId)
                .execute();
    }

    // --- Scan jobs -------------------------------------------------------------------

    public long startJob(String jobType, String volumeId, String targetPath,
                         boolean recursive, boolean force, String policy) {
        return jdbi.inTransaction(h -> {
            ScanJobDao dao = h.attach(ScanJobDao.class);
            dao.insert(jobType, volumeId, targetPath, recursive, force, policy, now());
            return dao.lastInsertId();
        });
    }

    public void updateJobProgress(long jobId, String phase, long current, String item,
                                  long processed, long skipped, long failed) {
        jdbi.useExtension(ScanJobDao.class,
                dao -> dao.updateProgress(jobId, phase, current, item, processed, skipped, failed));
    }

    public void finishJob(long jobId, String status, long total, long processed, long skipped,
                          long failed, long missing, String error) {
        jdbi.useExtension(ScanJobDao.class,
                dao -> dao.finish(jobId, status, total, processed, skipped, failed, missing, error, now()));
    }

    public void recordJobError(long jobId, String filePath, String errorType, String message) {
        jdbi.useExtension(ScanJobDao.class,
                dao -> dao.insertError(jobId, filePath, errorType, StringUtils.abbreviate(message, 2000), now()));
    }

    public Optional<ScanJobRow> findJob(long jobId) {
        return jdbi.withExtension(ScanJobDao.class, dao -> dao.findById(jobId));
    }

    public List<ScanJobRow> recentJobs(int limit) {
        return jdbi.withExtension(ScanJobDao.class, dao -> dao.recent(limit));
    }

    public List<JobErrorRow> jobErrors(long jobId) {
        return jdbi.withExtension(ScanJobDao.class, dao -> dao.errorsFor(jobId));
    }
}
