package com.shelfmark.app.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.junrar.Archive;
import com.github.junrar.exception.RarException;
import com.github.junrar.rarfile.FileHeader;

/**
 * RAR (v4 and earlier) through junrar. Encrypted members are not listed.
 */
final class RarArchiveReader implements ArchiveReader {

    private final Archive archive;
    private Map<String, FileHeader> index;

    RarArchiveReader(Path archive) throws IOException {
        try {
            this.archive = new Archive(archive.toFile());
        } catch (RarException e) {
            throw new IOException("Unreadable rar archive " + archive + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ArchiveEntry> entries() {
        List<ArchiveEntry> out = new ArrayList<>();
        for (Map.Entry<String, FileHeader> e : index().entrySet()) {
            out.add(new ArchiveEntry(e.getKey(), e.getValue().getFullUnpackSize()));
        }
        return out;
    }

    @Override
    public InputStream open(ArchiveEntry entry) throws IOException {
        FileHeader fh = index().get(entry.member());
        if (fh == null) {
            throw new IOException("No such archive member: " + entry.member());
        }
        return archive.getInputStream(fh);
    }

    private Map<String, FileHeader> index() {
        if (index == null) {
            Map<String, FileHeader> m = new LinkedHashMap<>();
            for (FileHeader fh : archive.getFileHeaders()) {
                if (fh.isDirectory() || fh.isEncrypted()) continue;
                String name = ArchiveWalker.acceptMember(fh.getFileName());
                if (name != null) {
                    m.putIfAbsent(name, fh);
                }
            }
            index = m;
        }
        return index;
    }

    @Override
    public void close() throws IOException {
        archive.close();
    }
}
