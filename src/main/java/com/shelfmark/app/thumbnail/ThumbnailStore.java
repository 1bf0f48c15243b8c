package com.shelfmark.app.thumbnail;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.database.CatalogKind;

/**
 * Preview images under {@code <root>/<documents|models>/<id>.png}. Images are rendered into a
 * temp file in the same directory and moved into place atomically.
 */
public final class ThumbnailStore {

    private static final Logger logger = LoggerFactory.getLogger(ThumbnailStore.class);
    private static final String TMP_DIR = ".tmp";

    private final Path root;

    public ThumbnailStore(Path root) throws IOException {
        this.root = root.toAbsolutePath().normalize();
        for (CatalogKind kind : CatalogKind.values()) {
            Files.createDirectories(this.root.resolve(kind.table()).resolve(TMP_DIR));
        }
    }

    public Path root() {
        return root;
    }

    /** Value stored in {@code thumb_path}. */
    public static String relativePath(CatalogKind kind, long id) {
        return kind.table() + "/" + id + ".png";
    }

    public Path resolve(String thumbPath) {
        return root.resolve(thumbPath).normalize();
    }

    public Path newTempFile(CatalogKind kind, long id) throws IOException {
        return Files.createTempFile(root.resolve(kind.table()).resolve(TMP_DIR), id + "-", ".png");
    }

    /**
     * Moves {@code rendered} into place, then runs {@code catalogUpdate}. If the update reports
     * failure or throws, the previous image (if any) is put back, so disk and catalog agree.
     *
     * @return whether the catalog accepted the update
     */
    public boolean publish(CatalogKind kind, long id, Path rendered, BooleanSupplier catalogUpdate) throws IOException {
        Path target = resolve(relativePath(kind, id));
        Path backup = target.resolveSibling(id + ".png.bak");
        boolean hadPrevious = Files.exists(target);
        if (hadPrevious) {
            Files.move(target, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        Files.move(rendered, target, StandardCopyOption.ATOMIC_MOVE);

        boolean accepted = false;
        try {
            accepted = catalogUpdate.getAsBoolean();
            return accepted;
        } finally {
            if (accepted) {
                Files.deleteIfExists(backup);
            } else {
                rollback(target, backup, hadPrevious);
            }
        }
    }

    private static void rollback(Path target, Path backup, boolean hadPrevious) throws IOException {
        if (hadPrevious) {
            Files.move(backup, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } else {
            Files.deleteIfExists(target);
        }
        logger.debug("Rolled back preview {}", target);
    }
}
