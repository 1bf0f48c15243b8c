package com.shelfmark.app.thumbnail;

import com.shelfmark.app.config.RenderSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class MeshPreviewRendererTest {

    private static final String ASCII_TETRA = """
            solid tetra
              facet normal 0 0 -1
                outer loop
                  vertex 0 0 0
                  vertex 1 0 0
                  vertex 0 1 0
                endloop
              endfacet
              facet normal 0 -1 0
                outer loop
                  vertex 0 0 0
                  vertex 0 0 1
                  vertex 1 0 0
                endloop
              endfacet
              facet normal -1 0 0
                outer loop
                  vertex 0 0 0
                  vertex 0 1 0
                  vertex 0 0 1
                endloop
              endfacet
              facet normal 1 1 1
                outer loop
                  vertex 1 0 0
                  vertex 0 0 1
                  vertex 0 1 0
                endloop
              endfacet
            endsolid tetra
            """;

    @TempDir
    Path tmp;

    private final MeshPreviewRenderer renderer = new MeshPreviewRenderer(RenderSettings.defaults());

    private RenderRequest request(Path source, String format) {
        return new RenderRequest(source, format, tmp.resolve("out.png"), 64, Duration.ofSeconds(10));
    }

    @Test
    void rendersAsciiStl() throws Exception {
        Path stl = Files.writeString(tmp.resolve("tetra.stl"), ASCII_TETRA);

        renderer.render(request(stl, "stl"));

        BufferedImage img = ImageIO.read(tmp.resolve("out.png").toFile());
        assertEquals(64, img.getWidth());
        assertEquals(64, img.getHeight());
        int background = img.getRGB(0, 0);
        boolean drawn = false;
        for (int y = 0; y < img.getHeight() && !drawn; y++) {
            for (int x = 0; x < img.getWidth() && !drawn; x++) {
                drawn = img.getRGB(x, y) != background;
            }
        }
        assertTrue(drawn, "some pixels show the mesh");
    }

    @Test
    void readsBinaryStl() {
        ByteBuffer buf = ByteBuffer.allocate(84 + 50).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(new byte[80]);
        buf.putInt(1);
        buf.putFloat(0).putFloat(0).putFloat(1);
        float[] vertices = {0, 0, 0, 1, 0, 0, 0, 1, 0};
        for (float v : vertices) {
            buf.putFloat(v);
        }
        buf.putShort((short) 0);

        float[] tris = MeshPreviewRenderer.readStl(buf.array());

        assertArrayEquals(vertices, tris);
    }

    @Test
    void rendersObj() throws Exception {
        Path obj = Files.writeString(tmp.resolve("quad.obj"), """
                v 0 0 0
                v 1 0 0
                v 1 1 0
                v 0 1 0
                f 1 2 3 4
                """);

        renderer.render(request(obj, "obj"));

        assertTrue(Files.size(tmp.resolve("out.png")) > 0);
    }

    @Test
    void emptyOrUnknownInputIsABackendFailure() throws Exception {
        Path empty = Files.write(tmp.resolve("empty.stl"), "solid nothing\nendsolid nothing\n".getBytes(StandardCharsets.US_ASCII));
        assertThrows(RenderBackendException.class, () -> renderer.render(request(empty, "stl")));
        assertThrows(RenderBackendException.class, () -> renderer.render(request(empty, "3mf")));
    }
}
