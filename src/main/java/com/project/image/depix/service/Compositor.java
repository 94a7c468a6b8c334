package com.project.image.depix.service;

import com.project.image.depix.model.Block;
import com.project.image.depix.model.OutputCanvas;
import com.project.image.depix.model.ResolvedBlock;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes resolved block pixels over the pixelated ones. Blocks are written in list order,
 * so where segmentation produced overlapping blocks the later block wins.
 */
@Component
public class Compositor {

    public void compose(OutputCanvas canvas, List<ResolvedBlock> blocks) {
        for (ResolvedBlock resolved : blocks) {
            write(canvas, resolved);
        }
    }

    public void write(OutputCanvas canvas, ResolvedBlock resolved) {
        Block block = resolved.block();
        int[] content = resolved.resolution().content();
        int w = block.width();
        for (int dy = 0; dy < block.height(); dy++) {
            for (int dx = 0; dx < w; dx++) {
                int idx = dy * w + dx;
                int x = block.x() + dx, y = block.y() + dy;
                if (idx < content.length && canvas.contains(x, y)) {
                    canvas.setRgb(x, y, content[idx]);
                }
            }
        }
    }
}
