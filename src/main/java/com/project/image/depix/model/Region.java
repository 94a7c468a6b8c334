package com.project.image.depix.model;

/** Axis-aligned rectangle; {@code right()} and {@code bottom()} are exclusive. */
public record Region(int x, int y, int width, int height) {

    public static Region of(PixelGrid grid) {
        return new Region(0, 0, grid.width(), grid.height());
    }

    public int right() { return x + width; }

    public int bottom() { return y + height; }

    public int area() { return width * height; }

    public boolean contains(int px, int py) {
        return px >= x && px < right() && py >= y && py < bottom();
    }
}
