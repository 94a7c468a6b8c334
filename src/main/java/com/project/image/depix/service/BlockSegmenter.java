package com.project.image.depix.service;

import com.project.image.depix.exceptions.GeometryException;
import com.project.image.depix.model.Block;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.Region;
import com.project.image.depix.model.RgbColor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a region of the pixelated image into same-color blocks.
 *
 * <p>The region is scanned in column bands. Inside a band every block takes its width from
 * the color run along its own top row and grows downwards while whole rows of that width keep
 * the color. The next band starts at {@code x} plus the width of the <em>last</em> block of the
 * current band. Blocks in one band can therefore have different widths, and when they do the
 * result is not a clean tiling: the next band may overlap or leave out columns of earlier
 * blocks. Callers rely on this exact scan order, so it is not corrected here.
 */
@Component
public class BlockSegmenter {

    public List<Block> segment(PixelGrid grid) {
        return segment(grid, Region.of(grid));
    }

    public List<Block> segment(PixelGrid grid, Region region) {
        if (region.width() < 1 || region.height() < 1
                || !grid.contains(region.x(), region.y())
                || !grid.contains(region.right() - 1, region.bottom() - 1)) {
            throw new GeometryException("Region " + region + " is not inside "
                    + grid.width() + "x" + grid.height() + " image");
        }

        final int maxX = region.right(), maxY = region.bottom();
        List<Block> blocks = new ArrayList<>();

        int x = region.x();
        while (x < maxX) {
            int width = 1;
            int y = region.y();
            while (y < maxY) {
                int color = grid.rgb(x, y);

                width = 1;
                while (x + width < maxX && grid.rgb(x + width, y) == color) {
                    width++;
                }

                int height = 1;
                while (y + height < maxY && rowHasColor(grid, x, y + height, width, color)) {
                    height++;
                }

                blocks.add(Block.of(x, y, width, height, RgbColor.fromRgb(color)));
                y += height;
            }
            x += width;
        }
        return blocks;
    }

    private static boolean rowHasColor(PixelGrid grid, int x, int y, int width, int color) {
        for (int dx = 0; dx < width; dx++) {
            if (grid.rgb(x + dx, y) != color) return false;
        }
        return true;
    }
}
