package com.shelfmark.app.config;

import java.util.List;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Preview renderer configuration from {@code shelfmark.render.*}.
 * Command templates accept {@code {input}}, {@code {output}}, {@code {outputBase}} and {@code {size}}.
 */
public record RenderSettings(
        int size,
        String background,
        List<String> f3dCommand,
        List<String> stlThumbCommand,
        List<String> pdfCommand,
        int meshMaxTriangles,
        boolean placeholderFallback
) {

    private static final String PREFIX = "shelfmark.render.";

    public static RenderSettings defaults() {
        return new RenderSettings(
                512,
                "#2a2a3e",
                List.of("xvfb-run", "-a", "f3d", "--output={output}", "--resolution={size},{size}",
                        "--up=+Z", "--no-background", "{input}"),
                List.of("stl-thumb", "-s", "{size}", "{input}", "{output}"),
                List.of("pdftoppm", "-png", "-singlefile", "-f", "1", "-scale-to", "{size}", "{input}", "{outputBase}"),
                500_000,
                true
        );
    }

    public static RenderSettings load() {
        return from(ConfigFactory.load());
    }

    public static RenderSettings from(Config cfg) {
        RenderSettings d = defaults();
        return new RenderSettings(
                ConfigValues.positive(PREFIX + "size", ConfigValues.getInt(cfg, PREFIX + "size", d.size())),
                ConfigValues.get(cfg, PREFIX + "background", d.background()),
                ConfigValues.getList(cfg, PREFIX + "commands.f3d", d.f3dCommand()),
                ConfigValues.getList(cfg, PREFIX + "commands.stl-thumb", d.stlThumbCommand()),
                ConfigValues.getList(cfg, PREFIX + "commands.pdftoppm", d.pdfCommand()),
                ConfigValues.positive(PREFIX + "mesh-max-triangles",
                        ConfigValues.getInt(cfg, PREFIX + "mesh-max-triangles", d.meshMaxTriangles())),
                ConfigValues.getBool(cfg, PREFIX + "placeholder-fallback", d.placeholderFallback())
        );
    }
}
