package com.shelfmark.app.format;

import java.util.List;
import java.util.Set;

import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.thumbnail.ThumbnailRenderer;

/**
 * Everything format-specific about one asset format.
 *
 * @param renderers preview backends in fallback order; empty when the format gets no preview
 * @param metadata  reader for descriptive fields the file embeds
 */
public record FormatCapability(
        String id,
        CatalogKind kind,
        Set<String> extensions,
        String defaultExtension,
        FormatValidator validator,
        List<ThumbnailRenderer> renderers,
        MetadataReader metadata
) {

    public FormatCapability(String id, CatalogKind kind, Set<String> extensions, String defaultExtension,
                            FormatValidator validator, List<ThumbnailRenderer> renderers) {
        this(id, kind, extensions, defaultExtension, validator, renderers, MetadataReader.NONE);
    }

    public boolean renderable() {
        return !renderers.isEmpty();
    }
}
