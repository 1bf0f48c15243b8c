package com.shelfmark.app.thumbnail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a native renderer as a subprocess. The command template may use {@code {input}},
 * {@code {output}}, {@code {outputBase}} (output without extension) and {@code {size}}.
 */
public final class ExternalProcessRenderer implements ThumbnailRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ExternalProcessRenderer.class);
    private static final Map<String, Boolean> ON_PATH = new ConcurrentHashMap<>();

    private final String name;
    private final List<String> template;

    public ExternalProcessRenderer(String name, List<String> template) {
        if (template.isEmpty()) {
            throw new IllegalArgumentException("Empty command for renderer " + name);
        }
        this.name = name;
        this.template = List.copyOf(template);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void render(RenderRequest request) throws RenderBackendException, RenderTimeoutException {
        String executable = template.get(0);
        if (!isExecutableAvailable(executable)) {
            throw new RenderBackendException(name + ": " + executable + " is not installed");
        }

        List<String> command = expand(template, request);
        Path log = null;
        Process p = null;
        try {
            log = Files.createTempFile("shelfmark-" + name + "-", ".log");
            p = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(log.toFile())
                    .start();

            if (!p.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RenderTimeoutException(name + " exceeded " + request.timeout().toSeconds() + "s");
            }
            int exit = p.exitValue();
            if (exit != 0) {
                throw new RenderBackendException(name + " exited with " + exit + ": " + tail(log));
            }
            if (!Files.isRegularFile(request.output()) || Files.size(request.output()) == 0) {
                throw new RenderBackendException(name + " produced no image");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderTimeoutException(name + " interrupted");
        } catch (IOException e) {
            throw new RenderBackendException(name + " failed: " + e.getMessage(), e);
        } finally {
            if (p != null && p.isAlive()) {
                p.destroyForcibly();
            }
            deleteQuietly(log);
        }
    }

    static List<String> expand(List<String> template, RenderRequest request) {
        String output = request.output().toAbsolutePath().toString();
        String outputBase = FilenameUtils.removeExtension(output);
        List<String> out = new ArrayList<>(template.size());
        for (String arg : template) {
            out.add(StringUtils.replaceEach(arg,
                    new String[]{"{input}", "{output}", "{outputBase}", "{size}"},
                    new String[]{request.source().toAbsolutePath().toString(), output, outputBase,
                            Integer.toString(request.size())}));
        }
        return out;
    }

    static boolean isExecutableAvailable(String executable) {
        return ON_PATH.computeIfAbsent(executable, ExternalProcessRenderer::lookup);
    }

    private static boolean lookup(String executable) {
        if (executable.contains("/") || executable.contains(File.separator)) {
            return Files.isExecutable(Paths.get(executable));
        }
        String path = StringUtils.defaultString(System.getenv("PATH"));
        for (String dir : StringUtils.split(path, File.pathSeparatorChar)) {
            if (Files.isExecutable(Paths.get(dir, executable))) {
                return true;
            }
        }
        logger.info("Renderer executable not found on PATH: {}", executable);
        return false;
    }

    private static String tail(Path log) {
        try {
            String s = Files.readString(log, StandardCharsets.UTF_8).trim();
            return StringUtils.right(s, 400);
        } catch (IOException e) {
            return "(no output)";
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            logger.debug("Could not delete {}", p, e);
        }
    }
}
