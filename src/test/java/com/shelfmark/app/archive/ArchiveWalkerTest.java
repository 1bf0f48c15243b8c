package com.shelfmark.app.archive;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class ArchiveWalkerTest {

    @TempDir
    Path tmp;

    public static Path zip(Path target, String... nameContentPairs) throws IOException {
        try (OutputStream os = Files.newOutputStream(target); ZipOutputStream zos = new ZipOutputStream(os)) {
            for (int i = 0; i < nameContentPairs.length; i += 2) {
                zos.putNextEntry(new ZipEntry(nameContentPairs[i]));
                if (nameContentPairs[i + 1] != null) {
                    zos.write(nameContentPairs[i + 1].getBytes(StandardCharsets.UTF_8));
                }
                zos.closeEntry();
            }
        }
        return target;
    }

    @Test
    void listsOnlyRealMembers() throws Exception {
        Path z = zip(tmp.resolve("kit.zip"),
                "models/", null,
                "models/part.stl", "solid part",
                "__MACOSX/models/._part.stl", "junk",
                ".DS_Store", "junk",
                "models/.hidden.stl", "junk",
                "readme.txt", "hello");

        try (ArchiveReader reader = ArchiveWalker.open(z)) {
            List<ArchiveEntry> entries = reader.entries();
            assertEquals(List.of("models/part.stl", "readme.txt"), entries.stream().map(ArchiveEntry::member).toList());
            assertEquals("part.stl", entries.get(0).filename());
            assertEquals("stl", entries.get(0).extension());
            assertEquals(10, entries.get(0).size());

            try (InputStream in = reader.open(entries.get(1))) {
                assertEquals("hello", new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
    }

    @Test
    void extractCopiesAMember() throws Exception {
        Path z = zip(tmp.resolve("kit.zip"), "a/b.stl", "solid b");
        Path out = tmp.resolve("out.stl");
        try (ArchiveReader reader = ArchiveWalker.open(z)) {
            reader.extract("a/b.stl", out);
            assertThrows(IOException.class, () -> reader.extract("a/missing.stl", tmp.resolve("x")));
        }
        assertEquals("solid b", Files.readString(out));
    }

    @Test
    void recognizesArchivesByExtension() throws Exception {
        assertTrue(ArchiveWalker.isArchive(Path.of("x/Set.ZIP")));
        assertTrue(ArchiveWalker.isArchive(Path.of("x/set.rar")));
        assertFalse(ArchiveWalker.isArchive(Path.of("x/set.7z")));
        assertThrows(IOException.class, () -> ArchiveWalker.open(Path.of("x/set.7z")));
    }

    @Test
    void corruptZipIsAnIoError() throws Exception {
        Path bad = Files.writeString(tmp.resolve("bad.zip"), "not a zip at all");
        assertThrows(IOException.class, () -> {
            try (ArchiveReader reader = ArchiveWalker.open(bad)) {
                reader.entries();
            }
        });
    }

    @Test
    void memberNamesAreNormalized() {
        assertEquals("a/b.stl", ArchiveWalker.acceptMember("\\a\\b.stl"));
        assertEquals("a/b.stl", ArchiveWalker.acceptMember("/a/b.stl"));
        assertNull(ArchiveWalker.acceptMember("a/"));
        assertNull(ArchiveWalker.acceptMember("x/__MACOSX/b.stl"));
        assertNull(ArchiveWalker.acceptMember(" "));
    }
}
