package com.shelfmark.app.thumbnail;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries renderers in order until one produces an image.
 */
public final class RenderChain {

    private static final Logger logger = LoggerFactory.getLogger(RenderChain.class);

    private RenderChain() {}

    /**
     * @return name of the renderer that succeeded
     * @throws RenderBackendException when every renderer failed (the individual failures are suppressed causes)
     * @throws RenderTimeoutException as soon as any renderer times out or the thread is interrupted
     */
    public static String render(List<ThumbnailRenderer> renderers, RenderRequest request)
            throws RenderBackendException, RenderTimeoutException {
        List<Exception> failures = new ArrayList<>();
        for (ThumbnailRenderer renderer : renderers) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RenderTimeoutException("interrupted before " + renderer.name());
            }
            try {
                Files.deleteIfExists(request.output());
                renderer.render(request);
                return renderer.name();
            } catch (RenderBackendException e) {
                logger.debug("{} failed for {}: {}", renderer.name(), request.source(), e.getMessage());
                failures.add(e);
            } catch (IOException | RuntimeException e) {
                logger.debug("{} crashed for {}", renderer.name(), request.source(), e);
                failures.add(e);
            }
        }
        RenderBackendException all = new RenderBackendException(
                failures.isEmpty() ? "no renderer for format " + request.format()
                        : "all " + failures.size() + " renderers failed; last: " + failures.get(failures.size() - 1).getMessage());
        failures.forEach(all::addSuppressed);
        throw all;
    }
}
