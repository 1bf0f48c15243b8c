package com.shelfmark.app.inventory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param path   directory (or single file) inside a registered volume
 * @param policy null means the configured default
 */
public record ScanRequest(Path path, boolean recursive, boolean force, DuplicatePolicy policy) {

    public ScanRequest {
        Objects.requireNonNull(path, "path");
    }

    public static ScanRequest of(Path path) {
        return new ScanRequest(path, true, false, null);
    }

    public ScanRequest withPolicy(DuplicatePolicy p) {
        return new ScanRequest(path, recursive, force, p);
    }

    public ScanRequest withRecursive(boolean r) {
        return new ScanRequest(path, r, force, policy);
    }

    public ScanRequest withForce(boolean f) {
        return new ScanRequest(path, recursive, f, policy);
    }
}
