package com.project.image.depix.model;

import com.project.image.depix.exceptions.GeometryException;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable, random-access view over a decoded image. Origin (0,0) is the top-left pixel.
 * Pixels are kept as packed ARGB; color comparisons only ever look at the RGB part.
 */
public final class PixelGrid {
    private final int width;
    private final int height;
    private final int[] argb;
    private final boolean hasAlpha;
    private final int imageType;

    private PixelGrid(int width, int height, int[] argb, boolean hasAlpha, int imageType) {
        if (width < 1 || height < 1) {
            throw new GeometryException("Image must be at least 1x1, got " + width + "x" + height);
        }
        if (argb.length != width * height) {
            throw new GeometryException("Pixel buffer holds " + argb.length + " values, expected " + width * height);
        }
        this.width = width;
        this.height = height;
        this.argb = argb;
        this.hasAlpha = hasAlpha;
        this.imageType = imageType;
    }

    public static PixelGrid fromImage(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] data = new int[w * h];
        image.getRGB(0, 0, w, h, data, 0, w);
        return new PixelGrid(w, h, data, image.getColorModel().hasAlpha(), image.getType());
    }

    /** Opaque grid from packed {@code 0xRRGGBB} values in row-major order. */
    public static PixelGrid of(int width, int height, int[] rgb) {
        int[] data = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            data[i] = 0xFF000000 | (rgb[i] & 0xFFFFFF);
        }
        return new PixelGrid(width, height, data, false, BufferedImage.TYPE_INT_RGB);
    }

    public static PixelGrid filled(int width, int height, RgbColor color) {
        int[] data = new int[width * height];
        Arrays.fill(data, color.toRgb());
        return of(width, height, data);
    }

    static PixelGrid wrap(int width, int height, int[] argb, boolean hasAlpha, int imageType) {
        return new PixelGrid(width, height, argb, hasAlpha, imageType);
    }

    public int width() { return width; }

    public int height() { return height; }

    public boolean hasAlpha() { return hasAlpha; }

    /** AWT image type this grid was decoded from, {@link BufferedImage#TYPE_CUSTOM} when unknown. */
    public int imageType() { return imageType; }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public int rgb(int x, int y) {
        return argb(x, y) & 0xFFFFFF;
    }

    public int argb(int x, int y) {
        if (!contains(x, y)) {
            throw new GeometryException("Pixel (" + x + "," + y + ") outside " + width + "x" + height + " image");
        }
        return argb[y * width + x];
    }

    public RgbColor color(int x, int y) {
        return RgbColor.fromRgb(rgb(x, y));
    }

    /**
     * Copies the RGB values of a rectangle in row-major order.
     *
     * @throws GeometryException if any part of the rectangle lies outside this grid
     */
    public int[] extract(Region region) {
        if (region.width() < 1 || region.height() < 1
                || !contains(region.x(), region.y())
                || !contains(region.right() - 1, region.bottom() - 1)) {
            throw new GeometryException("Region " + region + " is not inside " + width + "x" + height + " image");
        }
        int[] out = new int[region.area()];
        for (int dy = 0; dy < region.height(); dy++) {
            int row = (region.y() + dy) * width + region.x();
            for (int dx = 0; dx < region.width(); dx++) {
                out[dy * region.width() + dx] = argb[row + dx] & 0xFFFFFF;
            }
        }
        return out;
    }

    /** Like {@link #extract(Region)} but pixels outside the grid read as black. */
    public int[] extractPadded(int x, int y, int w, int h) {
        int[] out = new int[w * h];
        for (int dy = 0; dy < h; dy++) {
            for (int dx = 0; dx < w; dx++) {
                int px = x + dx, py = y + dy;
                out[dy * w + dx] = contains(px, py) ? argb[py * width + px] & 0xFFFFFF : 0;
            }
        }
        return out;
    }

    int[] argbCopy() {
        return argb.clone();
    }
}
