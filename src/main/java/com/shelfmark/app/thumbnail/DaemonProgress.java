package com.shelfmark.app.thumbnail;

/**
 * @param pendingFast   fast-lane items queued or rendering
 * @param pendingSlow   slow-lane items queued or rendering
 * @param renderedTotal previews published since the daemon started
 */
public record DaemonProgress(int pendingFast, int pendingSlow, long renderedTotal) {}
