package com.shelfmark.app.format;

import com.shelfmark.app.config.RenderSettings;
import com.shelfmark.app.database.CatalogKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FormatRegistryTest {

    @TempDir
    Path tmp;

    @Test
    void standardRegistryKnowsBothCatalogs() {
        FormatRegistry registry = FormatRegistry.standard(RenderSettings.defaults());

        assertEquals(CatalogKind.DOCUMENT, registry.forName("Manual.PDF").orElseThrow().kind());
        assertEquals(CatalogKind.MODEL, registry.forFile(Path.of("a/b.stl")).orElseThrow().kind());
        assertTrue(registry.forName("notes.txt").isEmpty());
        assertTrue(registry.forName("no_extension").isEmpty());
        assertTrue(registry.renderableFormats(CatalogKind.MODEL).contains("stl"));
        assertTrue(registry.renderableFormats(CatalogKind.DOCUMENT).contains("pdf"));
    }

    @Test
    void extensionsCannotBeClaimedTwice() {
        FormatRegistry registry = new FormatRegistry()
                .register("stl", CatalogKind.MODEL, FormatValidator.ACCEPT, List.of());

        assertThrows(IllegalArgumentException.class,
                () -> registry.register("stl", CatalogKind.MODEL, FormatValidator.ACCEPT, List.of()));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new FormatCapability(
                "stl-ascii", CatalogKind.MODEL, Set.of("STL"), "stl", FormatValidator.ACCEPT, List.of())));
    }

    @Test
    void formatsWithoutRenderersAreNotRenderable() {
        FormatRegistry registry = new FormatRegistry()
                .register("epub", CatalogKind.DOCUMENT, FormatValidator.ACCEPT, List.of());

        assertFalse(registry.byId("epub").orElseThrow().renderable());
        assertTrue(registry.renderableFormats(CatalogKind.DOCUMENT).isEmpty());
    }

    @Test
    void magicBytesValidatorChecksTheSignature() throws Exception {
        MagicBytesValidator pdf = new MagicBytesValidator("PDF", "%PDF-");

        assertTrue(pdf.validate(ValidationSource.of(Files.writeString(tmp.resolve("ok.pdf"), "%PDF-1.7\n"))).ok());
        ValidationResult bad = pdf.validate(ValidationSource.of(Files.writeString(tmp.resolve("bad.pdf"), "hello")));
        assertFalse(bad.ok());
        assertTrue(bad.reason().contains("PDF"));
        assertFalse(pdf.validate(ValidationSource.of(Files.writeString(tmp.resolve("short.pdf"), "%P"))).ok());
    }
}
