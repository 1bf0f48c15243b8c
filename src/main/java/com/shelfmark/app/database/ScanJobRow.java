package com.shelfmark.app.database;

public record ScanJobRow(
        long id,
        String jobType,
        String volumeId,
        String targetPath,
        boolean recursive,
        boolean forceMode,
        String duplicatePolicy,
        String status,
        String phase,
        long progressCurrent,
        Long progressTotal,
        String currentItem,
        long itemsProcessed,
        long itemsSkipped,
        long itemsFailed,
        long itemsMissing,
        String errorMessage,
        long startedAt,
        Long completedAt
) {}
