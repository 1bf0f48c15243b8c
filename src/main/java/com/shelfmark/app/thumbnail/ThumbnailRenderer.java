package com.shelfmark.app.thumbnail;

/**
 * One preview backend. Implementations write a PNG to {@link RenderRequest#output()} or throw.
 * A renderer must give up promptly once its thread is interrupted.
 */
public interface ThumbnailRenderer {

    String name();

    void render(RenderRequest request) throws RenderBackendException, RenderTimeoutException;
}
