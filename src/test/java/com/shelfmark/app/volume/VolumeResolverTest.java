package com.shelfmark.app.volume;

import com.shelfmark.app.database.VolumeRow;
import com.shelfmark.app.database.VolumeStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class VolumeResolverTest {

    @TempDir
    Path tmp;

    private VolumeRow volume(String id, Path root) {
        return new VolumeRow(id, id, root.toString(), false, true, VolumeStatus.ONLINE, null, null, null, 0);
    }

    @Test
    void pathsAreRelativeToTheMountRoot() throws Exception {
        Path root = Files.createDirectories(tmp.resolve("lib"));
        VolumeRow v = volume("lib", root);

        assertEquals("a/b.stl", VolumeResolver.resolve(v, root.resolve("a/b.stl")));
        assertEquals("", VolumeResolver.resolve(v, root));
        assertEquals(root.resolve("a/b.stl"), VolumeResolver.absolute(v, "a/b.stl"));
        assertEquals(root.resolve("kits/set.zip"), VolumeResolver.absolute(v, "kits/set.zip::models/part.stl"));
    }

    @Test
    void escapingPathsAreRejected() throws Exception {
        Path root = Files.createDirectories(tmp.resolve("lib"));
        VolumeRow v = volume("lib", root);

        assertThrows(PathTraversalException.class, () -> VolumeResolver.resolve(v, tmp.resolve("other/x.stl")));
        assertThrows(PathTraversalException.class, () -> VolumeResolver.resolve(v, root.resolve("../lib2/x.stl")));
        assertThrows(PathTraversalException.class, () -> VolumeResolver.absolute(v, "../x.stl"));
        assertThrows(PathTraversalException.class, () -> VolumeResolver.absolute(v, "/etc/passwd"));
    }

    @Test
    void symlinkLeavingTheVolumeIsRejected() throws Exception {
        Path root = Files.createDirectories(tmp.resolve("lib"));
        Path outside = Files.writeString(tmp.resolve("secret.stl"), "solid x");
        Path link = root.resolve("link.stl");
        try {
            Files.createSymbolicLink(link, outside);
        } catch (IOException | UnsupportedOperationException e) {
            assumeTrue(false, "symlinks not supported here");
        }
        assertThrows(PathTraversalException.class, () -> VolumeResolver.resolve(volume("lib", root), link));
    }

    @Test
    void folderOfTreatsArchiveMembersAsLeaves() {
        assertEquals("", VolumeResolver.folderOf("b.stl"));
        assertEquals("a", VolumeResolver.folderOf("a/b.stl"));
        assertEquals("a/c", VolumeResolver.folderOf("a/c/b.stl"));
        assertEquals("kits", VolumeResolver.folderOf("kits/set.zip::models/part.stl"));
        assertEquals("", VolumeResolver.folderOf("set.zip::part.stl"));
    }

    @Test
    void owningVolumeIsTheLongestPrefix() throws Exception {
        Path outer = Files.createDirectories(tmp.resolve("nas"));
        Path inner = Files.createDirectories(outer.resolve("models"));
        List<VolumeRow> volumes = List.of(volume("nas", outer), volume("models", inner));

        assertEquals("models", VolumeResolver.owning(volumes, inner.resolve("x/y.stl")).orElseThrow().id());
        assertEquals("nas", VolumeResolver.owning(volumes, outer.resolve("docs/y.pdf")).orElseThrow().id());
        assertTrue(VolumeResolver.owning(volumes, tmp.resolve("elsewhere")).isEmpty());
    }
}
