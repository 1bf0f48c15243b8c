package com.shelfmark.app.volume;

public class VolumeOfflineException extends VolumeUnavailableException {

    private final String reason;

    public VolumeOfflineException(String volumeId, String reason) {
        super(volumeId, "Volume " + volumeId + " is offline: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
