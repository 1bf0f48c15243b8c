package com.shelfmark.app.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

final class ZipArchiveReader implements ArchiveReader {

    private final ZipFile zip;
    private Map<String, ZipEntry> index;

    ZipArchiveReader(Path archive) throws IOException {
        try {
            this.zip = new ZipFile(archive.toFile(), StandardCharsets.UTF_8);
        } catch (ZipException e) {
            throw new IOException("Corrupt zip archive " + archive + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ArchiveEntry> entries() throws IOException {
        List<ArchiveEntry> out = new ArrayList<>();
        for (Map.Entry<String, ZipEntry> e : index().entrySet()) {
            out.add(new ArchiveEntry(e.getKey(), Math.max(0, e.getValue().getSize())));
        }
        return out;
    }

    @Override
    public InputStream open(ArchiveEntry entry) throws IOException {
        ZipEntry ze = index().get(entry.member());
        if (ze == null) {
            throw new IOException("No such archive member: " + entry.member());
        }
        return zip.getInputStream(ze);
    }

    private Map<String, ZipEntry> index() throws IOException {
        if (index == null) {
            Map<String, ZipEntry> m = new LinkedHashMap<>();
            try {
                for (ZipEntry ze : Collections.list(zip.entries())) {
                    if (ze.isDirectory()) continue;
                    String name = ArchiveWalker.acceptMember(ze.getName());
                    if (name != null) {
                        m.putIfAbsent(name, ze);
                    }
                }
            } catch (IllegalArgumentException e) {
                // malformed entry names in the central directory
                throw new IOException("Unreadable zip directory: " + e.getMessage(), e);
            }
            index = m;
        }
        return index;
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
