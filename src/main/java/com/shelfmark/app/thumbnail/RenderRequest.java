package com.shelfmark.app.thumbnail;

import java.nio.file.Path;
import java.time.Duration;

/**
 * @param source  readable local file (archive members are extracted first)
 * @param format  format id from the registry
 * @param output  PNG to create
 * @param size    edge length in pixels
 * @param timeout budget for the whole attempt
 */
public record RenderRequest(Path source, String format, Path output, int size, Duration timeout) {}
