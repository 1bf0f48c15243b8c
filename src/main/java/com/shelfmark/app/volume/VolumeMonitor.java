package com.shelfmark.app.volume;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.Catalog;
import com.shelfmark.app.database.VolumeRow;
import com.shelfmark.app.database.VolumeStatus;

/**
 * Availability checks for volume mount roots. A volume is online when its mount root exists,
 * is a directory and can be listed.
 */
public final class VolumeMonitor {

    private static final Logger logger = LoggerFactory.getLogger(VolumeMonitor.class);

    public record Availability(boolean online, String reason) {
        static Availability up() {
            return new Availability(true, null);
        }

        static Availability down(String reason) {
            return new Availability(false, reason);
        }
    }

    private final Catalog catalog;

    public VolumeMonitor(Catalog catalog) {
        this.catalog = catalog;
    }

    public static Availability check(Path mountRoot) {
        if (!Files.exists(mountRoot)) {
            return Availability.down("mount path does not exist: " + mountRoot);
        }
        if (!Files.isDirectory(mountRoot)) {
            return Availability.down("mount path is not a directory: " + mountRoot);
        }
        if (!Files.isReadable(mountRoot)) {
            return Availability.down("mount path is not readable: " + mountRoot);
        }
        // stale network mounts pass the checks above and fail on listing
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(mountRoot)) {
            ds.iterator().hasNext();
        } catch (IOException | RuntimeException e) {
            return Availability.down("mount path cannot be listed: " + e.getMessage());
        }
        return Availability.up();
    }

    /**
     * Checks one volume and stores the outcome; returns the row as now stored.
     */
    public VolumeRow refresh(VolumeRow volume) {
        Availability a = check(volume.mountRoot());
        VolumeStatus status = a.online() ? VolumeStatus.ONLINE : VolumeStatus.OFFLINE;
        if (status != volume.status()) {
            if (a.online()) {
                logger.info("Volume {} is back online", volume.id());
            } else {
                logger.warn("Volume {} is offline: {}", volume.id(), a.reason());
            }
        }
        catalog.updateVolumeStatus(volume.id(), status, a.reason());
        return catalog.findVolume(volume.id()).orElse(volume);
    }

    public List<VolumeRow> refreshAll() {
        List<VolumeRow> out = new ArrayList<>();
        for (VolumeRow v : catalog.listVolumes()) {
            out.add(refresh(v));
        }
        return out;
    }

    /**
     * The volume, freshly checked.
     *
     * @throws VolumeDisabledException if the volume was soft-disabled
     * @throws VolumeOfflineException  if the mount root is unreachable (the volume is marked offline)
     */
    public VolumeRow requireOnline(VolumeRow volume) {
        if (!volume.enabled()) {
            throw new VolumeDisabledException(volume.id());
        }
        VolumeRow current = refresh(volume);
        if (!current.isOnline()) {
            throw new VolumeOfflineException(volume.id(), current.statusReason());
        }
        return current;
    }
}
