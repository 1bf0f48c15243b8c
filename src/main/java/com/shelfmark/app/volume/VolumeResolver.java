package com.shelfmark.app.volume;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.VolumeRow;

/**
 * Maps catalog paths to the filesystem and back. Relative paths are always taken against the
 * volume's mount root, use {@code /} as separator and never start with one.
 * Archive members are addressed as {@code archive_path + "::" + member}.
 */
public final class VolumeResolver {

    public static final String MEMBER_SEPARATOR = "::";

    private static final Logger logger = LoggerFactory.getLogger(VolumeResolver.class);

    private VolumeResolver() {}

    /**
     * Path relative to the volume root.
     *
     * @throws PathTraversalException if {@code path} lies outside the mount root, or its real
     *                                location does (symlinks)
     */
    public static String resolve(VolumeRow volume, Path path) throws PathTraversalException {
        Path root = root(volume);
        Path p = path.toAbsolutePath().normalize();
        if (!p.startsWith(root)) {
            throw new PathTraversalException(volume.id(), path.toString());
        }
        checkRealLocation(volume, root, p);
        return relNorm(root.relativize(p));
    }

    /**
     * Absolute location of a catalog path. For archive members this is the containing archive.
     */
    public static Path absolute(VolumeRow volume, String relativePath) throws PathTraversalException {
        String onDisk = containerPath(relativePath);
        if (onDisk.startsWith("/") || onDisk.startsWith("\\") || Path.of(onDisk).isAbsolute()) {
            throw new PathTraversalException(volume.id(), relativePath);
        }
        Path root = root(volume);
        Path p = root.resolve(onDisk).normalize();
        if (!p.startsWith(root)) {
            throw new PathTraversalException(volume.id(), relativePath);
        }
        checkRealLocation(volume, root, p);
        return p;
    }

    /**
     * Parent folder of a catalog path; "" at the volume root. The {@code ::member} part of an
     * archive path is a virtual leaf, so members live in the archive's folder.
     */
    public static String folderOf(String relativePath) {
        String onDisk = containerPath(relativePath);
        int slash = onDisk.lastIndexOf('/');
        return slash < 0 ? "" : onDisk.substring(0, slash);
    }

    public static String memberPath(String archivePath, String member) {
        return archivePath + MEMBER_SEPARATOR + member;
    }

    /** The on-disk part of a catalog path (drops any {@code ::member} suffix). */
    public static String containerPath(String relativePath) {
        int idx = relativePath.indexOf(MEMBER_SEPARATOR);
        return idx < 0 ? relativePath : relativePath.substring(0, idx);
    }

    /** The volume whose mount root is the longest prefix of {@code path}. */
    public static Optional<VolumeRow> owning(Collection<VolumeRow> volumes, Path path) {
        Path p = path.toAbsolutePath().normalize();
        return volumes.stream()
                .filter(v -> p.startsWith(root(v)))
                .max(Comparator.comparingInt(v -> root(v).getNameCount()));
    }

    static Path root(VolumeRow volume) {
        return volume.mountRoot().toAbsolutePath().normalize();
    }

    private static void checkRealLocation(VolumeRow volume, Path root, Path p) throws PathTraversalException {
        if (!Files.exists(p, LinkOption.NOFOLLOW_LINKS) || !Files.exists(root)) {
            return;
        }
        try {
            if (!p.toRealPath().startsWith(root.toRealPath())) {
                throw new PathTraversalException(volume.id(), p.toString());
            }
        } catch (PathTraversalException e) {
            throw e;
        } catch (IOException e) {
            // dangling link or raced deletion: the caller's own read reports it
            logger.debug("Real path not resolvable: {} ({})", p, e.toString());
        }
    }

    static String relNorm(Path rel) {
        return rel.toString().replace('\\', '/');
    }
}
