package com.shelfmark.app.inventory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.AssetRow;
import com.shelfmark.app.database.Catalog;
import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.database.VolumeRow;
import com.shelfmark.app.volume.VolumeMonitor;

/**
 * Catalog-wide duplicate pass. Rows sharing a partial hash are compared by full hash; within
 * each set of identical content the lowest id stays primary and the others are linked to it.
 */
public final class DuplicateSweeper {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateSweeper.class);

    public static final String JOB_TYPE = "dedupe";

    private final Catalog catalog;
    private final FullHashLookup fullHashes;

    public DuplicateSweeper(Catalog catalog) {
        this.catalog = catalog;
        this.fullHashes = new FullHashLookup(catalog);
    }

    /**
     * @return rows newly linked as duplicates
     */
    public int sweep(CatalogKind kind) {
        long jobId = catalog.startJob(JOB_TYPE, null, kind.table(), true, false, null);
        Map<String, VolumeRow> reachable = new HashMap<>();
        for (VolumeRow v : catalog.listVolumes()) {
            if (v.enabled() && VolumeMonitor.check(v.mountRoot()).online()) {
                reachable.put(v.id(), v);
            }
        }

        List<String> colliding = catalog.findCollidingPartialHashes(kind);
        logger.info("Dedupe #{}: {} partial-hash groups in {}", jobId, colliding.size(), kind.table());
        int examined = 0;
        int unreadable = 0;
        int linked = 0;
        try {
            for (String partial : colliding) {
                Map<String, List<AssetRow>> byContent = new LinkedHashMap<>();
                for (AssetRow row : catalog.findPrimariesByPartialHash(kind, partial)) {
                    examined++;
                    VolumeRow volume = reachable.get(row.volumeId());
                    String full = row.fullHash() != null || volume == null
                            ? row.fullHash()
                            : fullHashes.of(kind, row, volume);
                    if (full == null) {
                        unreadable++;
                        continue;
                    }
                    byContent.computeIfAbsent(full, k -> new ArrayList<>()).add(row);
                }
                for (List<AssetRow> same : byContent.values()) {
                    AssetRow primary = same.get(0);
                    for (AssetRow copy : same.subList(1, same.size())) {
                        if (catalog.linkDuplicate(kind, copy.id(), primary.id())) {
                            linked++;
                            logger.debug("Dedupe #{}: #{} ({}) duplicates #{} ({})", jobId,
                                    copy.id(), copy.relativePath(), primary.id(), primary.relativePath());
                        }
                    }
                }
                catalog.updateJobProgress(jobId, "reconciling", examined, partial, linked, unreadable, 0);
            }
        } catch (JdbiException e) {
            catalog.finishJob(jobId, "failed", examined, linked, unreadable, 0, 0, e.getMessage());
            throw e;
        }
        catalog.finishJob(jobId, "completed", examined, linked, unreadable, 0, 0, null);
        logger.info("Dedupe #{} finished: {} rows examined, {} linked, {} unreadable",
                jobId, examined, linked, unreadable);
        return linked;
    }
}
