package com.project.image.depix.service;

import com.project.image.depix.exceptions.InvalidInputException;
import com.project.image.depix.model.Block;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.RgbColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Draws the blocks the matcher would work on over an enlarged copy of the pixelated image,
 * to check how well a pixelated area was cropped before running the full pipeline.
 */
@Service
public class BoxOverlayService {
    private static final Logger log = LoggerFactory.getLogger(BoxOverlayService.class);

    public static final int DEFAULT_ENHANCE = 3;
    private static final Color OUTLINE_COLOR = Color.RED;

    private final BlockSegmenter segmenter;
    private final BlockFilter filter;

    public BoxOverlayService() {
        this(new BlockSegmenter(), new BlockFilter());
    }

    @Autowired
    public BoxOverlayService(BlockSegmenter segmenter, BlockFilter filter) {
        this.segmenter = segmenter;
        this.filter = filter;
    }

    public BufferedImage visualize(PixelGrid pixelated, RgbColor background, int enhance) {
        List<Block> blocks = segmenter.segment(pixelated);
        log.info("Found {} same color rectangles", blocks.size());

        blocks = filter.removeMootColors(blocks, background);
        log.info("{} rectangles left after moot filter", blocks.size());

        SizeIndex index = SizeIndex.of(blocks);
        log.info("Found {} different rectangle sizes", index.sizeCount());
        if (index.hasTooManyVariants(pixelated.width() * pixelated.height())) {
            log.warn("Too many variants on block size. Re-cropping the image might help.");
        }

        log.info("Creating visualization with {}x enhancement", enhance);
        return render(pixelated, blocks, enhance);
    }

    /** Enlarges the image by {@code enhance} (nearest neighbour) and outlines every block in red. */
    public BufferedImage render(PixelGrid pixelated, List<Block> blocks, int enhance) {
        if (enhance < 1) {
            throw new InvalidInputException("Enhancement factor must be at least 1");
        }
        int w = pixelated.width() * enhance, h = pixelated.height() * enhance;
        BufferedImage enhanced = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                enhanced.setRGB(x, y, pixelated.rgb(x / enhance, y / enhance));
            }
        }

        Graphics2D graphics = enhanced.createGraphics();
        graphics.setColor(OUTLINE_COLOR);
        for (Block box : blocks) {
            int x0 = box.x() * enhance, y0 = box.y() * enhance;
            int x1 = (box.x() + box.width()) * enhance - enhance;
            int y1 = (box.y() + box.height()) * enhance - enhance;
            graphics.drawRect(x0, y0, x1 - x0, y1 - y0);
        }
        graphics.dispose();
        return enhanced;
    }
}
