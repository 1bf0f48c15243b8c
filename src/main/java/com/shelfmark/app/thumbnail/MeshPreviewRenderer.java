package com.shelfmark.app.thumbnail;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import javax.imageio.ImageIO;

import com.shelfmark.app.config.RenderSettings;

/**
 * In-process isometric preview of triangle meshes (STL ascii/binary, OBJ), drawn far-to-near with
 * flat shading. Large meshes are decimated by taking every n-th triangle.
 */
public final class MeshPreviewRenderer implements ThumbnailRenderer {

    private static final int[] BASE_COLOR = {74, 158, 255};

    // view basis: camera direction, screen right, screen up (z is up)
    private static final double[] VIEW = normalize(1, -1, 1);
    private static final double[] RIGHT = normalize(1, 1, 0);
    private static final double[] UP = normalize(-1, 1, 2);

    private final int maxTriangles;
    private final Color background;

    public MeshPreviewRenderer(RenderSettings settings) {
        this.maxTriangles = settings.meshMaxTriangles();
        this.background = Color.decode(settings.background());
    }

    @Override
    public String name() {
        return "mesh-preview";
    }

    @Override
    public void render(RenderRequest request) throws RenderBackendException, RenderTimeoutException {
        float[] tris;
        try {
            tris = switch (request.format()) {
                case "stl" -> readStl(Files.readAllBytes(request.source()));
                case "obj" -> readObj(request);
                default -> throw new RenderBackendException("mesh-preview cannot read " + request.format());
            };
        } catch (IOException | RuntimeException e) {
            throw new RenderBackendException("mesh-preview could not parse " + request.source().getFileName()
                    + ": " + e.getMessage(), e);
        }
        if (tris.length == 0) {
            throw new RenderBackendException("mesh-preview: no triangles in " + request.source().getFileName());
        }
        checkInterrupted();

        BufferedImage img = draw(decimate(tris), request.size());
        try {
            if (!ImageIO.write(img, "png", request.output().toFile())) {
                throw new RenderBackendException("no PNG writer available");
            }
        } catch (IOException e) {
            throw new RenderBackendException("mesh-preview could not write image: " + e.getMessage(), e);
        }
    }

    BufferedImage draw(float[] tris, int size) throws RenderTimeoutException {
        int n = tris.length / 9;
        float[] sx = new float[n * 3];
        float[] sy = new float[n * 3];
        double[] depth = new double[n];
        float[] shade = new float[n];
        double minX = Double.MAX_VALUE, maxX = -Double.MAX_VALUE, minY = Double.MAX_VALUE, maxY = -Double.MAX_VALUE;

        for (int t = 0; t < n; t++) {
            if ((t & 0xFFFF) == 0) checkInterrupted();
            int o = t * 9;
            double d = 0;
            for (int v = 0; v < 3; v++) {
                double x = tris[o + v * 3], y = tris[o + v * 3 + 1], z = tris[o + v * 3 + 2];
                double px = x * RIGHT[0] + y * RIGHT[1] + z * RIGHT[2];
                double py = x * UP[0] + y * UP[1] + z * UP[2];
                d += x * VIEW[0] + y * VIEW[1] + z * VIEW[2];
                sx[t * 3 + v] = (float) px;
                sy[t * 3 + v] = (float) py;
                minX = Math.min(minX, px);
                maxX = Math.max(maxX, px);
                minY = Math.min(minY, py);
                maxY = Math.max(maxY, py);
            }
            depth[t] = d / 3;
            shade[t] = brightness(tris, o);
        }

        double extent = Math.max(maxX - minX, maxY - minY);
        double scale = extent > 0 ? size * 0.85 / extent : 1;
        double midX = (minX + maxX) / 2, midY = (minY + maxY) / 2;

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(depth[a], depth[b]));

        BufferedImage img = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(background);
            g.fillRect(0, 0, size, size);
            int[] xs = new int[3];
            int[] ys = new int[3];
            int drawn = 0;
            for (int t : order) {
                if ((++drawn & 0xFFFF) == 0) checkInterrupted();
                for (int v = 0; v < 3; v++) {
                    xs[v] = (int) Math.round(size / 2.0 + (sx[t * 3 + v] - midX) * scale);
                    ys[v] = (int) Math.round(size / 2.0 - (sy[t * 3 + v] - midY) * scale);
                }
                float b = shade[t];
                g.setColor(new Color(
                        Math.min(255, (int) (BASE_COLOR[0] * b)),
                        Math.min(255, (int) (BASE_COLOR[1] * b)),
                        Math.min(255, (int) (BASE_COLOR[2] * b))));
                g.fillPolygon(xs, ys, 3);
            }
        } finally {
            g.dispose();
        }
        return img;
    }

    private static float brightness(float[] tris, int o) {
        double ux = tris[o + 3] - tris[o], uy = tris[o + 4] - tris[o + 1], uz = tris[o + 5] - tris[o + 2];
        double vx = tris[o + 6] - tris[o], vy = tris[o + 7] - tris[o + 1], vz = tris[o + 8] - tris[o + 2];
        double nx = uy * vz - uz * vy, ny = uz * vx - ux * vz, nz = ux * vy - uy * vx;
        double len = Math.sqrt(nx * nx + ny * ny + nz * nz);
        if (len == 0) return 0.35f;
        // winding is unreliable in the wild, so light both faces
        double lambert = Math.abs((nx * VIEW[0] + ny * VIEW[1] + nz * VIEW[2]) / len);
        return (float) (0.35 + 0.65 * lambert);
    }

    private float[] decimate(float[] tris) {
        int n = tris.length / 9;
        if (n <= maxTriangles) return tris;
        int step = (n + maxTriangles - 1) / maxTriangles;
        float[] out = new float[((n + step - 1) / step) * 9];
        int k = 0;
        for (int t = 0; t < n; t += step) {
            System.arraycopy(tris, t * 9, out, k, 9);
            k += 9;
        }
        return Arrays.copyOf(out, k);
    }

    static float[] readStl(byte[] data) {
        if (data.length >= 84) {
            long count = ByteBuffer.wrap(data, 80, 4).order(ByteOrder.LITTLE_ENDIAN).getInt() & 0xFFFFFFFFL;
            if (84 + count * 50 == data.length) {
                return readBinaryStl(data, (int) count);
            }
        }
        String head = new String(data, 0, Math.min(data.length, 5), StandardCharsets.US_ASCII);
        if (!head.equalsIgnoreCase("solid")) {
            throw new IllegalArgumentException("neither binary nor ascii STL");
        }
        return readAsciiStl(new String(data, StandardCharsets.US_ASCII));
    }

    private static float[] readBinaryStl(byte[] data, int count) {
        ByteBuffer bb = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        float[] out = new float[count * 9];
        for (int t = 0; t < count; t++) {
            int base = 84 + t * 50 + 12; // skip normal
            for (int i = 0; i < 9; i++) {
                out[t * 9 + i] = bb.getFloat(base + i * 4);
            }
        }
        return out;
    }

    private static float[] readAsciiStl(String text) {
        FloatList out = new FloatList();
        for (String line : text.split("\\R")) {
            String s = line.trim();
            if (s.startsWith("vertex")) {
                String[] p = s.split("\\s+");
                out.add(Float.parseFloat(p[1]));
                out.add(Float.parseFloat(p[2]));
                out.add(Float.parseFloat(p[3]));
            }
        }
        return Arrays.copyOf(out.values(), out.size() - out.size() % 9);
    }

    private static float[] readObj(RenderRequest request) throws IOException {
        FloatList vertices = new FloatList();
        FloatList out = new FloatList();
        try (InputStream in = Files.newInputStream(request.source());
             BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                String s = line.trim();
                if (s.startsWith("v ")) {
                    String[] p = s.split("\\s+");
                    vertices.add(Float.parseFloat(p[1]));
                    vertices.add(Float.parseFloat(p[2]));
                    vertices.add(Float.parseFloat(p[3]));
                } else if (s.startsWith("f ")) {
                    String[] p = s.split("\\s+");
                    int vertexCount = vertices.size() / 3;
                    int first = objIndex(p[1], vertexCount);
                    for (int i = 2; i + 1 < p.length; i++) {
                        addVertex(out, vertices, first);
                        addVertex(out, vertices, objIndex(p[i], vertexCount));
                        addVertex(out, vertices, objIndex(p[i + 1], vertexCount));
                    }
                }
            }
        }
        return Arrays.copyOf(out.values(), out.size());
    }

    private static int objIndex(String token, int vertexCount) {
        String idx = token.contains("/") ? token.substring(0, token.indexOf('/')) : token;
        int i = Integer.parseInt(idx);
        return i < 0 ? vertexCount + i : i - 1;
    }

    private static void addVertex(FloatList out, FloatList vertices, int index) {
        float[] v = vertices.values();
        out.add(v[index * 3]);
        out.add(v[index * 3 + 1]);
        out.add(v[index * 3 + 2]);
    }

    private static void checkInterrupted() throws RenderTimeoutException {
        if (Thread.currentThread().isInterrupted()) {
            throw new RenderTimeoutException("mesh-preview interrupted");
        }
    }

    private static double[] normalize(double x, double y, double z) {
        double len = Math.sqrt(x * x + y * y + z * z);
        return new double[]{x / len, y / len, z / len};
    }

    private static final class FloatList {
        private float[] values = new float[1024];
        private int size;

        void add(float f) {
            if (size == values.length) {
                values = Arrays.copyOf(values, size * 2);
            }
            values[size++] = f;
        }

        float[] values() {
            return values;
        }

        int size() {
            return size;
        }
    }
}
