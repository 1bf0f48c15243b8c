package com.shelfmark.app.database;

/**
 * The content and location fields written together by every NEW, UPDATE and MOVED action.
 * Bound by accessor name, so each component matches a {@code :named} parameter.
 *
 * @param author    document author from embedded metadata, or null
 * @param creator   model creator taken from the folder layout, or null
 * @param pageCount document page count, or null when unknown
 * @param producer  software that wrote the document, or null
 */
public record AssetWrite(
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
        boolean duplicate,
        Long duplicateOfId,
        String author,
        String creator,
        Integer pageCount,
        String producer
) {

    /** A row with no embedded or derived metadata beyond its names. */
    public AssetWrite(String volumeId, String relativePath, String filename, String format, String title,
                      String collection, long fileSize, long fileMtime, String partialHash, String fullHash,
                      String archivePath, String archiveMember, String folderPath, boolean duplicate,
                      Long duplicateOfId) {
        this(volumeId, relativePath, filename, format, title, collection, fileSize, fileMtime, partialHash,
                fullHash, archivePath, archiveMember, folderPath, duplicate, duplicateOfId, null, null, null, null);
    }

    public AssetWrite asDuplicateOf(long targetId) {
        return new AssetWrite(volumeId, relativePath, filename, format, title, collection, fileSize, fileMtime,
                partialHash, fullHash, archivePath, archiveMember, folderPath, true, targetId,
                author, creator, pageCount, producer);
    }

    public AssetWrite withFullHash(String hash) {
        return new AssetWrite(volumeId, relativePath, filename, format, title, collection, fileSize, fileMtime,
                partialHash, hash, archivePath, archiveMember, folderPath, duplicate, duplicateOfId,
                author, creator, pageCount, producer);
    }
}
