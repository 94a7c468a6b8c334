package com.project.image.depix.service;

import com.project.image.depix.model.Block;
import com.project.image.depix.model.BlockSize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocks grouped by (width, height), in order of first appearance, so the matcher can
 * prepare the reference once per size.
 */
public final class SizeIndex {
    private final Map<BlockSize, List<Block>> groups;

    private SizeIndex(Map<BlockSize, List<Block>> groups) {
        this.groups = groups;
    }

    public static SizeIndex of(List<Block> blocks) {
        Map<BlockSize, List<Block>> groups = new LinkedHashMap<>();
        for (Block block : blocks) {
            groups.computeIfAbsent(block.size(), k -> new ArrayList<>()).add(block);
        }
        groups.replaceAll((size, list) -> Collections.unmodifiableList(list));
        return new SizeIndex(groups);
    }

    public Map<BlockSize, List<Block>> groups() {
        return Collections.unmodifiableMap(groups);
    }

    public List<Block> blocksOfSize(BlockSize size) {
        return groups.getOrDefault(size, List.of());
    }

    public Map<BlockSize, Integer> occurrences() {
        Map<BlockSize, Integer> counts = new LinkedHashMap<>();
        groups.forEach((size, list) -> counts.put(size, list.size()));
        return counts;
    }

    public int count(BlockSize size) {
        return blocksOfSize(size).size();
    }

    public int sizeCount() {
        return groups.size();
    }

    /**
     * More distinct sizes than a cleanly cropped pixelation would produce: over ten, and over one
     * per hundred pixels of the scanned area.
     */
    public boolean hasTooManyVariants(int scannedArea) {
        return groups.size() > Math.max(10, scannedArea * 0.01);
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
