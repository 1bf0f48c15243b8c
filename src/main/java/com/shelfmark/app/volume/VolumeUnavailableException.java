package com.shelfmark.app.volume;

/**
 * Base for "this volume cannot be used right now" conditions, distinct from generic failures so
 * callers can report them as an actionable state.
 */
public abstract class VolumeUnavailableException extends IllegalStateException {

    private final String volumeId;

    protected VolumeUnavailableException(String volumeId, String message) {
        super(message);
        this.volumeId = volumeId;
    }

    public String volumeId() {
        return volumeId;
    }
}
