package com.shelfmark.app.volume;

public class VolumeInUseException extends IllegalStateException {

    public VolumeInUseException(String volumeId, long assetCount) {
        super("Volume " + volumeId + " is referenced by " + assetCount + " assets; disable it instead");
    }
}
