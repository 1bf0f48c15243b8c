package com.shelfmark.app.thumbnail;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Locale;

import javax.imageio.ImageIO;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import com.shelfmark.app.config.RenderSettings;

/**
 * Last resort: a card showing the format and file name. Never reads the source.
 */
public final class PlaceholderRenderer implements ThumbnailRenderer {

    private static final Color ACCENT = new Color(74, 158, 255);
    private static final Color TEXT = new Color(220, 220, 230);

    private final Color background;

    public PlaceholderRenderer(RenderSettings settings) {
        this.background = Color.decode(settings.background());
    }

    @Override
    public String name() {
        return "placeholder";
    }

    @Override
    public void render(RenderRequest request) throws RenderBackendException {
        int size = request.size();
        BufferedImage img = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(background);
            g.fillRect(0, 0, size, size);

            int margin = size / 8;
            g.setColor(ACCENT);
            g.fillRoundRect(margin, margin, size - 2 * margin, size - 2 * margin, size / 10, size / 10);

            g.setColor(background);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, size / 6));
            drawCentered(g, request.format().toUpperCase(Locale.ROOT), size, size / 2);

            g.setColor(TEXT);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, Math.max(10, size / 24)));
            String label = StringUtils.abbreviate(FilenameUtils.getBaseName(request.source().toString()), 28);
            drawCentered(g, label, size, size - margin / 2);
        } finally {
            g.dispose();
        }
        try {
            if (!ImageIO.write(img, "png", request.output().toFile())) {
                throw new RenderBackendException("no PNG writer available");
            }
        } catch (IOException e) {
            throw new RenderBackendException("placeholder could not write image: " + e.getMessage(), e);
        }
    }

    private static void drawCentered(Graphics2D g, String text, int width, int baseline) {
        FontMetrics fm = g.getFontMetrics();
        g.drawString(text, (width - fm.stringWidth(text)) / 2, baseline);
    }
}
