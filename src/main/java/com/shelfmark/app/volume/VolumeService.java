package com.shelfmark.app.volume;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.AssetRow;
import com.shelfmark.app.database.Catalog;
import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.database.VolumeRow;

/**
 * Administrative volume operations. Volumes are never removed while assets reference them.
 */
public final class VolumeService {

    private static final Logger logger = LoggerFactory.getLogger(VolumeService.class);

    public record VerifyResult(long jobId, int checked, int restored) {}

    private final Catalog catalog;
    private final VolumeMonitor monitor;

    public VolumeService(Catalog catalog) {
        this.catalog = catalog;
        this.monitor = new VolumeMonitor(catalog);
    }

    public VolumeMonitor monitor() {
        return monitor;
    }

    public VolumeRow register(String id, String label, Path mountPath, boolean readonly) {
        if (StringUtils.isBlank(id)) {
            throw new IllegalArgumentException("Volume id is required");
        }
        if (catalog.findVolume(id).isPresent()) {
            throw new IllegalArgumentException("Volume already exists: " + id);
        }
        String mount = mountPath.toAbsolutePath().normalize().toString();
        catalog.insertVolume(id, StringUtils.defaultIfBlank(label, id), mount, readonly);
        logger.info("Registered volume {} at {}{}", id, mount, readonly ? " (read-only)" : "");
        return monitor.refresh(require(id));
    }

    public List<VolumeRow> list() {
        return catalog.listVolumes();
    }

    public Optional<VolumeRow> find(String id) {
        return catalog.findVolume(id);
    }

    public VolumeRow require(String id) {
        return catalog.findVolume(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown volume: " + id));
    }

    public void disable(String id) {
        require(id);
        catalog.setVolumeEnabled(id, false);
        logger.info("Volume {} disabled", id);
    }

    public void enable(String id) {
        require(id);
        catalog.setVolumeEnabled(id, true);
        logger.info("Volume {} enabled", id);
    }

    /**
     * @throws VolumeInUseException while any asset references the volume
     */
    public void delete(String id) {
        require(id);
        long refs = catalog.deleteVolumeIfUnreferenced(id);
        if (refs > 0) {
            throw new VolumeInUseException(id, refs);
        }
        logger.info("Volume {} deleted", id);
    }

    /**
     * Restores missing rows whose file is back in place with the size and mtime on record.
     * Meant for a volume that came back online after its rows were marked missing.
     */
    public VerifyResult verifyAssets(String volumeId) {
        VolumeRow volume = monitor.requireOnline(require(volumeId));
        long jobId = catalog.startJob("verify", volumeId, volume.mountPath(), true, false, null);
        int checked = 0;
        int restored = 0;
        int failed = 0;
        for (CatalogKind kind : CatalogKind.values()) {
            for (AssetRow row : catalog.findMissing(kind, volumeId)) {
                checked++;
                try {
                    if (isBackInPlace(volume, row) && catalog.restoreAsset(kind, row.id())) {
                        restored++;
                    }
                } catch (PathTraversalException e) {
                    failed++;
                    catalog.recordJobError(jobId, row.relativePath(), "PATH_TRAVERSAL", e.getMessage());
                }
            }
        }
        catalog.finishJob(jobId, "completed", checked, restored, checked - restored - failed, failed, 0, null);
        logger.info("Verified volume {}: {} missing rows checked, {} restored", volumeId, checked, restored);
        return new VerifyResult(jobId, checked, restored);
    }

    private static boolean isBackInPlace(VolumeRow volume, AssetRow row) throws PathTraversalException {
        Path p = VolumeResolver.absolute(volume, row.relativePath());
        try {
            BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
            if (!attrs.isRegularFile() || attrs.lastModifiedTime().toMillis() != row.fileMtime()) {
                return false;
            }
            // members carry their own size; the archive's mtime is theirs
            return row.isArchiveMember() || attrs.size() == row.fileSize();
        } catch (IOException e) {
            return false;
        }
    }
}
