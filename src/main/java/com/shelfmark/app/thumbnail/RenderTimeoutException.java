package com.shelfmark.app.thumbnail;

/**
 * A render ran out of time or was interrupted. The asset is left for the next poll cycle.
 */
public class RenderTimeoutException extends Exception {

    public RenderTimeoutException(String message) {
        super(message);
    }
}
