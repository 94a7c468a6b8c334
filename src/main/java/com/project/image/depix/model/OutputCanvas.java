package com.project.image.depix.model;

import java.awt.image.BufferedImage;

/**
 * Mutable pixel surface the resolved blocks are written into. Starts as a copy of the
 * pixelated source and keeps its alpha channel and image type.
 */
public final class OutputCanvas {
    private final int width;
    private final int height;
    private final int[] argb;
    private final boolean hasAlpha;
    private final int imageType;

    private OutputCanvas(PixelGrid source) {
        this.width = source.width();
        this.height = source.height();
        this.argb = source.argbCopy();
        this.hasAlpha = source.hasAlpha();
        this.imageType = source.imageType();
    }

    public static OutputCanvas copyOf(PixelGrid source) {
        return new OutputCanvas(source);
    }

    public int width() { return width; }

    public int height() { return height; }

    public boolean hasAlpha() { return hasAlpha; }

    public int imageType() { return imageType; }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public int rgb(int x, int y) {
        return argb[y * width + x] & 0xFFFFFF;
    }

    /** Overwrites the RGB part of a pixel, the existing alpha is kept. */
    public void setRgb(int x, int y, int rgb) {
        int idx = y * width + x;
        argb[idx] = (argb[idx] & 0xFF000000) | (rgb & 0xFFFFFF);
    }

    public PixelGrid toGrid() {
        return PixelGrid.wrap(width, height, argb.clone(), hasAlpha, imageType);
    }

    /**
     * Renders the canvas into a new image of the given AWT type. Indexed and custom types
     * are not writable pixel by pixel without palette loss, so callers pick a direct type.
     */
    public BufferedImage toImage(int type) {
        BufferedImage image = new BufferedImage(width, height, type);
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }
}
