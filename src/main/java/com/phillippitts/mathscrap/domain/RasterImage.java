package com.phillippitts.mathscrap.domain;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 8-bit grayscale raster plus the path it was loaded from.
 *
 * <p>Pixel values are in [0, 255], row-major. Every transformation produces a new instance
 * through {@link #derive(int, int, int[])}; the pixel array is never exposed.
 */
public final class RasterImage {

    private final Path source;
    private final int width;
    private final int height;
    private final int[] gray;

    private RasterImage(Path source, int width, int height, int[] gray) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (gray.length != width * height) {
            throw new IllegalArgumentException("Pixel count " + gray.length + " does not match "
                    + width + "x" + height);
        }
        this.source = Objects.requireNonNull(source, "source");
        this.width = width;
        this.height = height;
        this.gray = gray;
    }

    /**
     * Creates a grayscale raster from pixel values. The array is copied and clamped to [0, 255].
     */
    public static RasterImage of(Path source, int width, int height, int[] pixels) {
        int[] copy = new int[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            copy[i] = clamp(pixels[i]);
        }
        return new RasterImage(source, width, height, copy);
    }

    /**
     * Converts any {@link BufferedImage} to grayscale using ITU-R BT.601 luminance.
     * Transparent pixels are composited over white.
     */
    public static RasterImage fromBufferedImage(Path source, BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] out = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = image.getRGB(x, y);
                int a = (argb >>> 24) & 0xFF;
                int r = (argb >> 16) & 0xFF;
                int g = (argb >> 8) & 0xFF;
                int b = argb & 0xFF;
                int lum = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
                out[y * w + x] = (lum * a + 255 * (255 - a)) / 255;
            }
        }
        return new RasterImage(source, w, h, out);
    }

    /** Returns a new image from the same source with the given pixels (copied). */
    public RasterImage derive(int newWidth, int newHeight, int[] pixels) {
        return of(source, newWidth, newHeight, pixels);
    }

    public Path source() {
        return source;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Pixel value at (x, y). */
    public int pixel(int x, int y) {
        return gray[y * width + x];
    }

    /** Copy of the row-major pixel array. */
    public int[] pixels() {
        return Arrays.copyOf(gray, gray.length);
    }

    public double meanIntensity() {
        long sum = 0;
        for (int v : gray) {
            sum += v;
        }
        return (double) sum / gray.length;
    }

    /** Renders this raster as a {@link BufferedImage#TYPE_BYTE_GRAY} image. */
    public BufferedImage toBufferedImage() {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();
        raster.setPixels(0, 0, width, height, gray);
        return img;
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }

    @Override
    public String toString() {
        return "RasterImage[" + source.getFileName() + " " + width + "x" + height + "]";
    }
}
