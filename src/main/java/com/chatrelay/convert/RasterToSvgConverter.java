package com.chatrelay.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Wraps a raster image in static SVG markup with a threshold-based boundary
 * scan drawn as dots. This is a preview, not a tracer.
 */
public class RasterToSvgConverter {

    private static final Logger log = LoggerFactory.getLogger(RasterToSvgConverter.class);

    public static final int DEFAULT_THRESHOLD = 128;
    private static final int MAX_POINTS = 1000;
    private static final int POINT_STRIDE = 10;

    private final HttpClient httpClient;

    public RasterToSvgConverter() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public RasterToSvgConverter(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public record Point(int x, int y) {}

    public String convert(String imageUrl, int threshold) {
        var image = download(imageUrl);
        return render(imageUrl, image, trace(image, threshold));
    }

    BufferedImage download(String imageUrl) {
        URI uri;
        try {
            uri = URI.create(imageUrl);
        } catch (IllegalArgumentException e) {
            throw new ConversionException("Invalid image URL: " + imageUrl, e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new ConversionException("Invalid image URL: " + imageUrl);
        }
        try {
            var req = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(Duration.ofSeconds(10))
                    .GET()
                    .build();
            var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() != 200) {
                throw new ConversionException("Image download failed: HTTP " + resp.statusCode());
            }
            return decode(resp.body());
        } catch (IOException e) {
            throw new ConversionException("Image download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversionException("Interrupted downloading " + imageUrl, e);
        }
    }

    static BufferedImage decode(byte[] bytes) throws IOException {
        var image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new ConversionException("Unsupported or corrupt image data");
        }
        return image;
    }

    /** Dark pixels (luma below threshold) with at least one light 4-neighbour. Borders are skipped. */
    public static List<Point> trace(BufferedImage image, int threshold) {
        int width = image.getWidth();
        int height = image.getHeight();
        var dark = new boolean[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                dark[y][x] = luma(image.getRGB(x, y)) < threshold;
            }
        }

        var points = new ArrayList<Point>();
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                if (!dark[y][x]) continue;
                if (!dark[y - 1][x] || !dark[y + 1][x] || !dark[y][x - 1] || !dark[y][x + 1]) {
                    points.add(new Point(x, y));
                }
            }
        }
        return points;
    }

    // ITU-R 601 weights, same as a PIL "L" conversion
    private static int luma(int rgb) {
        int r = (rgb >> 16) & 0xff;
        int g = (rgb >> 8) & 0xff;
        int b = rgb & 0xff;
        return (r * 299 + g * 587 + b * 114) / 1000;
    }

    static String render(String imageUrl, BufferedImage image, List<Point> points) {
        int width = image.getWidth();
        int height = image.getHeight();
        var svg = new StringBuilder();
        svg.append(String.format("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">\n",
                width, height, width, height));
        svg.append("<defs>\n")
           .append("  <filter id=\"posterize\">\n")
           .append("    <feComponentTransfer>\n")
           .append("      <feFuncR type=\"discrete\" tableValues=\"0 0.25 0.5 0.75 1\" />\n")
           .append("      <feFuncG type=\"discrete\" tableValues=\"0 0.25 0.5 0.75 1\" />\n")
           .append("      <feFuncB type=\"discrete\" tableValues=\"0 0.25 0.5 0.75 1\" />\n")
           .append("    </feComponentTransfer>\n")
           .append("  </filter>\n")
           .append("</defs>\n");
        svg.append(String.format("<image href=\"%s\" width=\"%d\" height=\"%d\" filter=\"url(#posterize)\" />\n",
                escape(imageUrl), width, height));

        svg.append("<g fill=\"none\" stroke=\"rgba(255, 75, 43, 0.5)\" stroke-width=\"1\">\n");
        int limit = Math.min(points.size(), MAX_POINTS);
        for (int i = 0; i < limit; i += POINT_STRIDE) {
            var p = points.get(i);
            svg.append(String.format("  <circle cx=\"%d\" cy=\"%d\" r=\"1\" />\n", p.x(), p.y()));
        }
        svg.append("</g>\n");

        svg.append(String.format("<rect x=\"0\" y=\"%d\" width=\"%d\" height=\"50\" fill=\"rgba(0,0,0,0.7)\" />\n",
                height - 50, width));
        svg.append(String.format(Locale.ROOT,
                "<text x=\"%.1f\" y=\"%d\" font-family=\"Arial\" font-size=\"24\" text-anchor=\"middle\" fill=\"#FF4B2B\" font-weight=\"bold\">chat-relay</text>\n",
                width / 2.0, height - 20));
        svg.append("</svg>");
        log.debug("Rendered {}x{} SVG with {} boundary points", width, height, points.size());
        return svg.toString();
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("\"", "&quot;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
