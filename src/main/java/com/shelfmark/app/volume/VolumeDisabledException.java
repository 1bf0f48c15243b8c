package com.shelfmark.app.volume;

public class VolumeDisabledException extends VolumeUnavailableException {

    public VolumeDisabledException(String volumeId) {
        super(volumeId, "Volume " + volumeId + " is disabled");
    }
}
