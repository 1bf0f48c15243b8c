package com.shelfmark.app.inventory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.archive.ArchiveEntry;
import com.shelfmark.app.archive.ArchiveReader;
import com.shelfmark.app.archive.ArchiveWalker;
import com.shelfmark.app.database.AssetRow;
import com.shelfmark.app.database.Catalog;
import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.database.VolumeRow;
import com.shelfmark.app.hash.ContentHasher;
import com.shelfmark.app.volume.VolumeResolver;

/**
 * Full hashes of cataloged rows, computed on first use and stored.
 */
final class FullHashLookup {

    private static final Logger logger = LoggerFactory.getLogger(FullHashLookup.class);

    private final Catalog catalog;

    FullHashLookup(Catalog catalog) {
        this.catalog = catalog;
    }

    /**
     * The row's full hash. When none is stored it is computed from the file, provided the file
     * still has the size and mtime on record, and written back.
     *
     * @param volume the row's volume, already known to be reachable
     * @return null if the file is gone, changed or unreadable
     */
    String of(CatalogKind kind, AssetRow row, VolumeRow volume) {
        if (row.fullHash() != null) {
            return row.fullHash();
        }
        try {
            Path p = VolumeResolver.absolute(volume, row.relativePath());
            if (!Files.isRegularFile(p)) {
                return null;
            }
            BasicFileAttributes a = Files.readAttributes(p, BasicFileAttributes.class);
            if (a.lastModifiedTime().toMillis() != row.fileMtime()) {
                return null;
            }
            String hash;
            if (row.isArchiveMember()) {
                hash = memberHash(p, row.archiveMember());
            } else {
                hash = a.size() == row.fileSize() ? ContentHasher.fullHash(p) : null;
            }
            if (hash != null) {
                catalog.recordFullHash(kind, row.id(), hash);
            }
            return hash;
        } catch (IOException e) {
            logger.debug("Cannot hash #{} ({}): {}", row.id(), row.relativePath(), e.toString());
            return null;
        }
    }

    private static String memberHash(Path archive, String member) throws IOException {
        try (ArchiveReader reader = ArchiveWalker.open(archive)) {
            Optional<ArchiveEntry> entry = reader.find(member);
            if (entry.isEmpty()) {
                return null;
            }
            try (InputStream in = reader.open(entry.get())) {
                return ContentHasher.fullHash(in);
            }
        }
    }
}
