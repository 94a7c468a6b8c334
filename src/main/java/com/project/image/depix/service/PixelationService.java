package com.project.image.depix.service;

import com.project.image.depix.exceptions.InvalidInputException;
import com.project.image.depix.model.PixelGrid;
import com.project.image.depix.model.PixelationMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Produces mosaic-redacted test images: every square cell of the block grid is replaced by
 * its average color. Cells on the right and bottom edge are clipped to the image.
 */
@Service
public class PixelationService {
    private static final Logger log = LoggerFactory.getLogger(PixelationService.class);

    static final int LARGE_BLOCK_SIZE = 100;
    private static final double GAMMA = 2.2;

    public PixelGrid pixelate(PixelGrid image, int blockSize, PixelationMethod method) {
        if (blockSize < 1) {
            throw new InvalidInputException("Block size must be at least 1");
        }
        if (blockSize > LARGE_BLOCK_SIZE) {
            log.warn("Block size {} is very large. Consider using smaller value.", blockSize);
        }
        log.info("Pixelating {}x{} image with block size {} using {} method",
                image.width(), image.height(), blockSize, method.name().toLowerCase(Locale.ROOT));

        final int w = image.width(), h = image.height();
        int[] out = new int[w * h];

        for (int x = 0; x < w; x += blockSize) {
            for (int y = 0; y < h; y += blockSize) {
                int maxX = Math.min(x + blockSize, w);
                int maxY = Math.min(y + blockSize, h);
                int avg = method == PixelationMethod.LINEAR
                        ? averageLinear(image, x, y, maxX, maxY)
                        : averageGamma(image, x, y, maxX, maxY);
                for (int yy = y; yy < maxY; yy++) {
                    for (int xx = x; xx < maxX; xx++) {
                        out[yy * w + xx] = avg;
                    }
                }
            }
        }

        logStatistics(w, h, blockSize);
        return PixelGrid.of(w, h, out);
    }

    private static int averageGamma(PixelGrid image, int x0, int y0, int maxX, int maxY) {
        long r = 0, g = 0, b = 0;
        int count = 0;
        for (int x = x0; x < maxX; x++) {
            for (int y = y0; y < maxY; y++) {
                int p = image.rgb(x, y);
                r += (p >> 16) & 0xFF;
                g += (p >> 8) & 0xFF;
                b += p & 0xFF;
                count++;
            }
        }
        return pack((int) (r / count), (int) (g / count), (int) (b / count));
    }

    private static int averageLinear(PixelGrid image, int x0, int y0, int maxX, int maxY) {
        double r = 0, g = 0, b = 0;
        int count = 0;
        for (int x = x0; x < maxX; x++) {
            for (int y = y0; y < maxY; y++) {
                int p = image.rgb(x, y);
                r += Math.pow(((p >> 16) & 0xFF) / 255.0, GAMMA);
                g += Math.pow(((p >> 8) & 0xFF) / 255.0, GAMMA);
                b += Math.pow((p & 0xFF) / 255.0, GAMMA);
                count++;
            }
        }
        return pack(toSrgb(r / count), toSrgb(g / count), toSrgb(b / count));
    }

    private static int toSrgb(double linear) {
        return Math.min(255, (int) (Math.pow(linear, 1 / GAMMA) * 255));
    }

    private static int pack(int r, int g, int b) {
        return (r << 16) | (g << 8) | b;
    }

    private static void logStatistics(int w, int h, int blockSize) {
        int totalPixels = w * h;
        int blocksX = (w + blockSize - 1) / blockSize;
        int blocksY = (h + blockSize - 1) / blockSize;
        int totalBlocks = blocksX * blocksY;
        log.info("Original pixels: {}", totalPixels);
        log.info("Pixelated blocks: {} ({}x{})", totalBlocks, blocksX, blocksY);
        log.info("Compression ratio: {}x", String.format("%.2f", (double) totalPixels / totalBlocks));
    }
}
