package com.shelfmark.app.inventory;

/**
 * A scan of the same volume is already running.
 */
public class ScanInProgressException extends IllegalStateException {

    private final String volumeId;

    public ScanInProgressException(String volumeId) {
        super("A scan of volume " + volumeId + " is already running");
        this.volumeId = volumeId;
    }

    public String volumeId() {
        return volumeId;
    }
}
