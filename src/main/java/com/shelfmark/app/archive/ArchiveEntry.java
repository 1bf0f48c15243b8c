package com.shelfmark.app.archive;

import org.apache.commons.io.FilenameUtils;

/**
 * A file inside an archive.
 *
 * @param member path inside the archive, {@code /}-separated
 * @param size   uncompressed size in bytes
 */
public record ArchiveEntry(String member, long size) {

    public String filename() {
        return FilenameUtils.getName(member);
    }

    public String extension() {
        return FilenameUtils.getExtension(member);
    }
}
