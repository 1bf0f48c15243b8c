package com.shelfmark.app.format;

/**
 * Descriptive fields a file carries about itself. Any component may be null.
 */
public record EmbeddedMetadata(String title, String author, Integer pageCount, String producer) {

    public static final EmbeddedMetadata NONE = new EmbeddedMetadata(null, null, null, null);
}
