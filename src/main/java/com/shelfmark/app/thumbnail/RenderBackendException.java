package com.shelfmark.app.thumbnail;

/**
 * A renderer could not produce a preview. The chain moves on to the next renderer.
 */
public class RenderBackendException extends Exception {

    public RenderBackendException(String message) {
        super(message);
    }

    public RenderBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
