package com.project.image.depix.service;

import com.project.image.depix.model.Block;
import com.project.image.depix.model.RgbColor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops blocks whose fill carries no information about the hidden text: pure black,
 * pure white and the editor background, when one is given.
 */
@Component
public class BlockFilter {

    public List<Block> removeMootColors(List<Block> blocks, RgbColor background) {
        Set<RgbColor> moot = new HashSet<>(List.of(RgbColor.BLACK, RgbColor.WHITE));
        if (background != null) {
            moot.add(background);
        }

        List<Block> kept = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            if (!moot.contains(block.fill())) {
                kept.add(block);
            }
        }
        return kept;
    }
}
