package com.shelfmark.app.thumbnail;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExternalProcessRendererTest {

    @TempDir
    Path tmp;

    @Test
    void placeholdersAreExpanded() {
        RenderRequest request = new RenderRequest(tmp.resolve("in.pdf"), "pdf", tmp.resolve("out.png"), 256,
                Duration.ofSeconds(5));

        List<String> cmd = ExternalProcessRenderer.expand(
                List.of("pdftoppm", "-scale-to", "{size}", "{input}", "{outputBase}", "--out={output}"), request);

        assertEquals(List.of("pdftoppm", "-scale-to", "256",
                tmp.resolve("in.pdf").toAbsolutePath().toString(),
                tmp.resolve("out").toAbsolutePath().toString(),
                "--out=" + tmp.resolve("out.png").toAbsolutePath()), cmd);
    }

    @Test
    void missingExecutableIsABackendFailure() {
        ExternalProcessRenderer renderer = new ExternalProcessRenderer("nope",
                List.of("shelfmark-no-such-renderer-binary", "{input}"));
        RenderRequest request = new RenderRequest(tmp.resolve("in.stl"), "stl", tmp.resolve("out.png"), 64,
                Duration.ofSeconds(5));

        RenderBackendException e = assertThrows(RenderBackendException.class, () -> renderer.render(request));
        assertTrue(e.getMessage().contains("not installed"));
        assertThrows(IllegalArgumentException.class, () -> new ExternalProcessRenderer("empty", List.of()));
    }
}
