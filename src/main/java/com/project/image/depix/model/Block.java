package com.project.image.depix.model;

/**
 * A same-color rectangle found in the pixelated image.
 */
public record Block(Region geometry, RgbColor fill) {

    public static Block of(int x, int y, int width, int height, RgbColor fill) {
        return new Block(new Region(x, y, width, height), fill);
    }

    public int x() { return geometry.x(); }

    public int y() { return geometry.y(); }

    public int width() { return geometry.width(); }

    public int height() { return geometry.height(); }

    public BlockSize size() { return new BlockSize(geometry.width(), geometry.height()); }
}
