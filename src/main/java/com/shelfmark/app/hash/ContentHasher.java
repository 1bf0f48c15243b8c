package com.shelfmark.app.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.apache.commons.io.IOUtils;

/**
 * Content fingerprints.
 * <ul>
 *   <li>partial: MD5 over the first 64 KiB, the last 64 KiB (or what follows the head for files
 *       under 128 KiB) and the decimal size. Constant I/O per file; a pre-filter only.</li>
 *   <li>full: SHA-256 of every byte; used to confirm a partial match.</li>
 * </ul>
 * File and stream variants agree on identical bytes.
 */
public final class ContentHasher {

    public static final int CHUNK = 64 * 1024;

    private ContentHasher() {}

    public static String partialHash(Path file) throws IOException {
        MessageDigest md = md5();
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = ch.size();
            ByteBuffer buf = ByteBuffer.allocate(CHUNK);

            readFully(ch, buf, 0, (int) Math.min(CHUNK, size));
            md.update(buf.flip());

            if (size > CHUNK) {
                long tailStart = Math.max(CHUNK, size - CHUNK);
                buf.clear();
                readFully(ch, buf, tailStart, (int) (size - tailStart));
                md.update(buf.flip());
            }
            md.update(Long.toString(size).getBytes(StandardCharsets.US_ASCII));
        }
        return HexFormat.of().formatHex(md.digest());
    }

    /**
     * Partial hash of a stream of known length (archive members). Reads the whole stream; only the
     * head and a rolling tail window are kept in memory.
     */
    public static String partialHash(InputStream in, long size) throws IOException {
        MessageDigest md = md5();
        byte[] head = new byte[(int) Math.min(CHUNK, size)];
        int headLen = IOUtils.read(in, head);
        md.update(head, 0, headLen);

        long remaining = size - headLen;
        if (remaining > 0) {
            int tailLen = (int) Math.min(CHUNK, remaining);
            byte[] ring = new byte[tailLen];
            long pos = 0;
            byte[] buf = new byte[CHUNK];
            int n;
            while ((n = in.read(buf)) > 0) {
                for (int i = 0; i < n; i++) {
                    ring[(int) (pos++ % tailLen)] = buf[i];
                }
            }
            if (pos < remaining) {
                throw new IOException("Stream ended after " + (headLen + pos) + " of " + size + " bytes");
            }
            int start = (int) (pos % tailLen);
            md.update(ring, start, tailLen - start);
            md.update(ring, 0, start);
        }
        md.update(Long.toString(size).getBytes(StandardCharsets.US_ASCII));
        return HexFormat.of().formatHex(md.digest());
    }

    public static String fullHash(Path file) throws IOException {
        try (InputStream in = java.nio.file.Files.newInputStream(file)) {
            return fullHash(in);
        }
    }

    public static String fullHash(InputStream in) throws IOException {
        MessageDigest md = sha256();
        byte[] buf = new byte[CHUNK];
        int n;
        while ((n = in.read(buf)) > 0) {
            md.update(buf, 0, n);
        }
        return HexFormat.of().formatHex(md.digest());
    }

    private static void readFully(FileChannel ch, ByteBuffer buf, long position, int length) throws IOException {
        buf.limit(length);
        long pos = position;
        while (buf.hasRemaining()) {
            int n = ch.read(buf, pos);
            if (n < 0) {
                throw new IOException("File shrank while hashing");
            }
            pos += n;
        }
    }

    private static MessageDigest md5() {
        return digest("MD5");
    }

    private static MessageDigest sha256() {
        return digest("SHA-256");
    }

    private static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
