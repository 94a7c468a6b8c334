package com.project.image.depix.model;

import java.util.List;

/** A block together with its equally best candidates; the list may be empty. */
public record BlockMatch(Block block, List<Candidate> candidates) {

    public BlockMatch {
        candidates = List.copyOf(candidates);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
