package com.shelfmark.app.format;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import org.apache.commons.io.FilenameUtils;

import com.shelfmark.app.config.RenderSettings;
import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.thumbnail.ExternalProcessRenderer;
import com.shelfmark.app.thumbnail.MeshPreviewRenderer;
import com.shelfmark.app.thumbnail.PlaceholderRenderer;
import com.shelfmark.app.thumbnail.ThumbnailRenderer;

/**
 * The single table of asset formats. Scanner, validation and the thumbnail daemon all look
 * formats up here; adding a format is one {@link #register} call.
 */
public final class FormatRegistry {

    private static final long PDF_METADATA_MEMORY = 16L * 1024 * 1024;

    private final Map<String, FormatCapability> byId = new LinkedHashMap<>();
    private final Map<String, FormatCapability> byExtension = new LinkedHashMap<>();

    public FormatRegistry register(FormatCapability capability) {
        if (byId.containsKey(capability.id())) {
            throw new IllegalArgumentException("Format already registered: " + capability.id());
        }
        for (String ext : capability.extensions()) {
            String key = ext.toLowerCase(Locale.ROOT);
            if (byExtension.containsKey(key)) {
                throw new IllegalArgumentException("Extension ." + key + " already claimed by "
                        + byExtension.get(key).id());
            }
        }
        byId.put(capability.id(), capability);
        for (String ext : capability.extensions()) {
            byExtension.put(ext.toLowerCase(Locale.ROOT), capability);
        }
        return this;
    }

    public FormatRegistry register(String id, CatalogKind kind, FormatValidator validator,
                                   List<ThumbnailRenderer> renderers) {
        return register(id, kind, validator, MetadataReader.NONE, renderers);
    }

    public FormatRegistry register(String id, CatalogKind kind, FormatValidator validator, MetadataReader metadata,
                                   List<ThumbnailRenderer> renderers) {
        return register(new FormatCapability(id, kind, Set.of(id), id, validator, List.copyOf(renderers), metadata));
    }

    public Optional<FormatCapability> forFile(Path file) {
        return forName(file.getFileName().toString());
    }

    public Optional<FormatCapability> forName(String filename) {
        return forExtension(FilenameUtils.getExtension(filename));
    }

    public Optional<FormatCapability> forExtension(String extension) {
        return Optional.ofNullable(byExtension.get(extension.toLowerCase(Locale.ROOT)));
    }

    public Optional<FormatCapability> byId(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /** Ids of the formats of a catalog that have at least one renderer. */
    public List<String> renderableFormats(CatalogKind kind) {
        List<String> out = new ArrayList<>();
        for (FormatCapability c : byId.values()) {
            if (c.kind() == kind && c.renderable()) {
                out.add(c.id());
            }
        }
        return out;
    }

    public List<FormatCapability> all() {
        return List.copyOf(byId.values());
    }

    /**
     * Built-in formats with their validators and renderer chains.
     */
    public static FormatRegistry standard(RenderSettings settings) {
        ThumbnailRenderer f3d = new ExternalProcessRenderer("f3d", settings.f3dCommand());
        ThumbnailRenderer stlThumb = new ExternalProcessRenderer("stl-thumb", settings.stlThumbCommand());
        ThumbnailRenderer pdftoppm = new ExternalProcessRenderer("pdftoppm", settings.pdfCommand());
        ThumbnailRenderer mesh = new MeshPreviewRenderer(settings);
        List<ThumbnailRenderer> last = settings.placeholderFallback()
                ? List.of(new PlaceholderRenderer(settings))
                : List.of();

        FormatValidator glb = new MagicBytesValidator("GLB", "glTF");

        return new FormatRegistry()
                // documents
                .register("pdf", CatalogKind.DOCUMENT, new MagicBytesValidator("PDF", "%PDF-"),
                        new PdfMetadataReader(PDF_METADATA_MEMORY), chain(last, pdftoppm))
                .register("epub", CatalogKind.DOCUMENT, FormatValidator.ACCEPT, chain(last))
                .register("djvu", CatalogKind.DOCUMENT, FormatValidator.ACCEPT, chain(last))
                // models
                .register("stl", CatalogKind.MODEL, FormatValidator.ACCEPT, chain(last, f3d, stlThumb, mesh))
                .register("obj", CatalogKind.MODEL, FormatValidator.ACCEPT, chain(last, f3d, stlThumb, mesh))
                .register("3mf", CatalogKind.MODEL, FormatValidator.ACCEPT, chain(last, f3d, stlThumb))
                .register("glb", CatalogKind.MODEL, glb, chain(last, f3d))
                .register("gltf", CatalogKind.MODEL, new GltfCompanionValidator(), chain(last, f3d))
                .register("ply", CatalogKind.MODEL, FormatValidator.ACCEPT, chain(last, f3d))
                .register("dae", CatalogKind.MODEL, FormatValidator.ACCEPT, chain(last, f3d))
                .register("3ds", CatalogKind.MODEL, FormatValidator.ACCEPT, chain(last, f3d))
                .register("x3d", CatalogKind.MODEL, FormatValidator.ACCEPT, chain(last, f3d));
    }

    private static List<ThumbnailRenderer> chain(List<ThumbnailRenderer> last, ThumbnailRenderer... first) {
        return Stream.concat(Stream.of(first), last.stream()).toList();
    }
}
