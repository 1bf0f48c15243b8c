package com.shelfmark.app.thumbnail;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RenderChainTest {

    @TempDir
    Path tmp;

    static ThumbnailRenderer writing(String name) {
        return new ThumbnailRenderer() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void render(RenderRequest request) {
                try {
                    Files.writeString(request.output(), name);
                } catch (java.io.IOException e) {
                    throw new java.io.UncheckedIOException(e);
                }
            }
        };
    }

    static ThumbnailRenderer failing(String name, List<String> calls) {
        return new ThumbnailRenderer() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void render(RenderRequest request) throws RenderBackendException {
                calls.add(name);
                throw new RenderBackendException(name + " is broken");
            }
        };
    }

    private RenderRequest request() {
        return new RenderRequest(tmp.resolve("in.stl"), "stl", tmp.resolve("out.png"), 64, Duration.ofSeconds(5));
    }

    @Test
    void firstWorkingRendererWins() throws Exception {
        List<String> calls = new ArrayList<>();

        String used = RenderChain.render(List.of(failing("f3d", calls), writing("mesh"), writing("placeholder")), request());

        assertEquals("mesh", used);
        assertEquals(List.of("f3d"), calls);
        assertEquals("mesh", Files.readString(tmp.resolve("out.png")));
    }

    @Test
    void crashingRendererFallsThrough() throws Exception {
        ThumbnailRenderer crashing = new ThumbnailRenderer() {
            @Override
            public String name() {
                return "crash";
            }

            @Override
            public void render(RenderRequest request) {
                throw new IllegalStateException("boom");
            }
        };

        assertEquals("mesh", RenderChain.render(List.of(crashing, writing("mesh")), request()));
    }

    @Test
    void allFailuresAreReported() {
        List<String> calls = new ArrayList<>();

        RenderBackendException e = assertThrows(RenderBackendException.class,
                () -> RenderChain.render(List.of(failing("a", calls), failing("b", calls)), request()));

        assertEquals(List.of("a", "b"), calls);
        assertEquals(2, e.getSuppressed().length);
        assertTrue(e.getMessage().contains("b is broken"));
        assertThrows(RenderBackendException.class, () -> RenderChain.render(List.of(), request()));
    }

    @Test
    void timeoutStopsTheChain() {
        List<String> calls = new ArrayList<>();
        ThumbnailRenderer slow = new ThumbnailRenderer() {
            @Override
            public String name() {
                return "slow";
            }

            @Override
            public void render(RenderRequest request) throws RenderTimeoutException {
                throw new RenderTimeoutException("slow exceeded 5s");
            }
        };

        assertThrows(RenderTimeoutException.class,
                () -> RenderChain.render(List.of(slow, failing("next", calls)), request()));
        assertTrue(calls.isEmpty());
    }

    @Test
    void interruptedThreadDoesNotStartARender() {
        List<String> calls = new ArrayList<>();
        Thread.currentThread().interrupt();
        try {
            assertThrows(RenderTimeoutException.class, () -> RenderChain.render(List.of(failing("a", calls)), request()));
        } finally {
            Thread.interrupted();
        }
        assertTrue(calls.isEmpty());
    }
}
