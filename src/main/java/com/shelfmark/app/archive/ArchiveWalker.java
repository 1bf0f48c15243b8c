package com.shelfmark.app.archive;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;

/**
 * Opens zip and rar containers so their members can be cataloged like files.
 * Members under {@code __MACOSX/}, hidden members and members with {@code ..} segments are
 * never listed.
 */
public final class ArchiveWalker {

    public static final Set<String> ZIP_EXTENSIONS = Set.of("zip");
    public static final Set<String> RAR_EXTENSIONS = Set.of("rar");

    private ArchiveWalker() {}

    public static boolean isArchive(Path file) {
        return type(file).isPresent();
    }

    public static ArchiveReader open(Path archive) throws IOException {
        return switch (type(archive).orElseThrow(() -> new IOException("Not a supported archive: " + archive))) {
            case ZIP -> new ZipArchiveReader(archive);
            case RAR -> new RarArchiveReader(archive);
        };
    }

    enum Type { ZIP, RAR }

    static Optional<Type> type(Path file) {
        String ext = FilenameUtils.getExtension(file.getFileName().toString()).toLowerCase(Locale.ROOT);
        if (ZIP_EXTENSIONS.contains(ext)) return Optional.of(Type.ZIP);
        if (RAR_EXTENSIONS.contains(ext)) return Optional.of(Type.RAR);
        return Optional.empty();
    }

    /**
     * Normalized member name, or null when the member must be ignored.
     */
    static String acceptMember(String rawName) {
        if (rawName == null || rawName.isBlank()) return null;
        String name = rawName.replace('\\', '/');
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        if (name.isEmpty() || name.endsWith("/")) return null;
        for (String segment : name.split("/")) {
            if (segment.equals("__MACOSX") || segment.startsWith(".")) return null;
        }
        return name;
    }
}
