package com.shelfmark.app.volume;

import java.io.IOException;

/**
 * A path that resolves outside its volume's mount root. Fatal to that file only.
 */
public class PathTraversalException extends IOException {

    private final String volumeId;

    public PathTraversalException(String volumeId, String path) {
        super("Path escapes mount root of volume " + volumeId + ": " + path);
        this.volumeId = volumeId;
    }

    public String volumeId() {
        return volumeId;
    }
}
