package com.shelfmark.app.format;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

import org.apache.commons.io.FilenameUtils;

import com.shelfmark.app.archive.ArchiveEntry;
import com.shelfmark.app.archive.ArchiveReader;

/**
 * What a validator may look at: the file's bytes and whether a file next to it exists.
 * Works the same for plain files and archive members.
 */
public interface ValidationSource {

    String name();

    InputStream open() throws IOException;

    /**
     * @param relativeUri path relative to the directory holding this file, {@code /}-separated.
     *                    A path that cannot exist, or that leaves the source's boundary, is never found.
     */
    boolean hasCompanion(String relativeUri) throws IOException;

    static ValidationSource of(Path file) {
        return of(file, null);
    }

    /**
     * @param boundary directory companions must stay inside, usually the volume root; null for none
     */
    static ValidationSource of(Path file, Path boundary) {
        Path limit = boundary == null ? null : boundary.toAbsolutePath().normalize();
        return new ValidationSource() {
            @Override
            public String name() {
                return file.getFileName().toString();
            }

            @Override
            public InputStream open() throws IOException {
                return Files.newInputStream(file);
            }

            @Override
            public boolean hasCompanion(String relativeUri) throws IOException {
                Path target;
                try {
                    target = file.toAbsolutePath().getParent().resolve(relativeUri).normalize();
                } catch (InvalidPathException e) {
                    return false;
                }
                if (!Files.isRegularFile(target)) {
                    return false;
                }
                if (limit == null) {
                    return true;
                }
                return target.startsWith(limit) && target.toRealPath().startsWith(limit.toRealPath());
            }
        };
    }

    static ValidationSource of(ArchiveReader archive, ArchiveEntry entry) {
        return new ValidationSource() {
            @Override
            public String name() {
                return entry.member();
            }

            @Override
            public InputStream open() throws IOException {
                return archive.open(entry);
            }

            @Override
            public boolean hasCompanion(String relativeUri) throws IOException {
                if (relativeUri.indexOf('\0') >= 0) {
                    return false;
                }
                String dir = FilenameUtils.getPath(entry.member());
                String target = FilenameUtils.normalize(dir + relativeUri, true);
                return target != null && archive.find(target).isPresent();
            }
        };
    }
}
