package com.project.image.depix.model;

public record BlockSize(int width, int height) {
    @Override
    public String toString() {
        return width + "x" + height;
    }
}
