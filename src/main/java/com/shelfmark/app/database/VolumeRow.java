package com.shelfmark.app.database;

import java.nio.file.Path;
import java.nio.file.Paths;

public record VolumeRow(
        String id,
        String label,
        String mountPath,
        boolean readonly,
        boolean enabled,
        VolumeStatus status,
        String statusReason,
        Long lastCheckedAt,
        Long lastIndexedAt,
        long createdAt
) {

    public Path mountRoot() {
        return Paths.get(mountPath);
    }

    public boolean isOnline() {
        return status == VolumeStatus.ONLINE;
    }
}
