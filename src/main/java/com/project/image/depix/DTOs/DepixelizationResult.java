package com.project.image.depix.DTOs;

import com.project.image.depix.model.OutputCanvas;

public record DepixelizationResult(
        OutputCanvas canvas,
        int blocksFound,        // same-color blocks in the pixelated image
        int blocksAfterFilter,  // left after dropping black, white and background
        int sizeVariants,
        int matched,
        int unmatched,          // stay pixelated in the output
        int direct,
        int averaged
) {
    public int width() { return canvas.width(); }

    public int height() { return canvas.height(); }
}
