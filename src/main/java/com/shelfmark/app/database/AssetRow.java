package com.shelfmark.app.database;

/**
 * One row of a documents or models catalog. Timestamps are epoch millis.
 */
public record AssetRow(
        long id,
        String volumeId,
        String relativePath,
        String filename,
        String format,
        String title,
        String collection,
        long fileSize,
        long fileMtime,
        String partialHash,
        String fullHash,
        String archivePath,
        String archiveMember,
        String folderPath,
        String author,
        String creator,
        Integer pageCount,
        String producer,
        IndexStatus indexStatus,
        Long lastSeenAt,
        Long lastSeenJobId,
        Long lastIndexedAt,
        Long missingSince,
        String thumbStorage,
        String thumbPath,
        Long thumbRenderedAt,
        Long thumbSourceMtime,
        boolean forceRerender,
        boolean duplicate,
        Long duplicateOfId,
        long createdAt
) {

    public boolean isArchiveMember() {
        return archiveMember != null;
    }

    public boolean hasCurrentThumbnail() {
        return thumbRenderedAt != null
                && thumbSourceMtime != null
                && thumbSourceMtime == fileMtime
                && thumbRenderedAt >= thumbSourceMtime
                && !forceRerender;
    }
}
