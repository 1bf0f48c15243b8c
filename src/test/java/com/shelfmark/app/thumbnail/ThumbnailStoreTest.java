package com.shelfmark.app.thumbnail;

import com.shelfmark.app.database.CatalogKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ThumbnailStoreTest {

    @TempDir
    Path tmp;

    @Test
    void publishMovesTheImageIntoPlace() throws Exception {
        ThumbnailStore store = new ThumbnailStore(tmp.resolve("thumbs"));
        Path rendered = store.newTempFile(CatalogKind.MODEL, 7);
        Files.writeString(rendered, "png-1");

        assertTrue(store.publish(CatalogKind.MODEL, 7, rendered, () -> true));

        assertEquals("models/7.png", ThumbnailStore.relativePath(CatalogKind.MODEL, 7));
        assertEquals("png-1", Files.readString(store.resolve("models/7.png")));
        assertFalse(Files.exists(rendered));
        assertFalse(Files.exists(store.root().resolve("models/7.png.bak")));
    }

    @Test
    void rejectedUpdateRestoresThePreviousImage() throws Exception {
        ThumbnailStore store = new ThumbnailStore(tmp.resolve("thumbs"));
        Path first = store.newTempFile(CatalogKind.DOCUMENT, 3);
        Files.writeString(first, "old");
        store.publish(CatalogKind.DOCUMENT, 3, first, () -> true);

        Path second = store.newTempFile(CatalogKind.DOCUMENT, 3);
        Files.writeString(second, "new");
        assertFalse(store.publish(CatalogKind.DOCUMENT, 3, second, () -> false));

        assertEquals("old", Files.readString(store.resolve("documents/3.png")));
    }

    @Test
    void failingUpdateLeavesNoImageBehind() throws Exception {
        ThumbnailStore store = new ThumbnailStore(tmp.resolve("thumbs"));
        Path rendered = store.newTempFile(CatalogKind.MODEL, 9);
        Files.writeString(rendered, "png");

        assertThrows(IllegalStateException.class, () -> store.publish(CatalogKind.MODEL, 9, rendered, () -> {
            throw new IllegalStateException("database is locked");
        }));

        assertFalse(Files.exists(store.resolve("models/9.png")));
    }
}
