package com.shelfmark.app.format;

/**
 * Reads {@link EmbeddedMetadata} from an already validated file. Best effort: a file whose
 * metadata cannot be read is still cataloged under its path-derived names.
 */
@FunctionalInterface
public interface MetadataReader {

    MetadataReader NONE = source -> EmbeddedMetadata.NONE;

    EmbeddedMetadata read(ValidationSource source);
}
