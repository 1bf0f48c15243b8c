package com.shelfmark.app.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * An opened archive. Entries are listed from the archive's directory; content is read on demand.
 */
public interface ArchiveReader extends AutoCloseable {

    /** Regular-file members worth cataloging, in archive order. */
    List<ArchiveEntry> entries() throws IOException;

    InputStream open(ArchiveEntry entry) throws IOException;

    default Optional<ArchiveEntry> find(String member) throws IOException {
        for (ArchiveEntry e : entries()) {
            if (e.member().equals(member)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * Copies a member to {@code target}, replacing it.
     */
    default void extract(String member, Path target) throws IOException {
        ArchiveEntry entry = find(member)
                .orElseThrow(() -> new IOException("No such archive member: " + member));
        try (InputStream in = open(entry)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    void close() throws IOException;
}
