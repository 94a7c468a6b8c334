package com.project.image.depix.service;

import com.project.image.depix.model.BlockMatch;
import com.project.image.depix.model.Candidate;
import com.project.image.depix.model.Resolution;
import com.project.image.depix.model.ResolvedBlock;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns candidate sets into final block pixels. A block whose candidates all carry the same
 * pixels is copied directly; otherwise every pixel gets the per-channel mean of the candidates,
 * truncated to an integer.
 */
@Component
public class MatchResolver {

    /** Resolves every non-empty match, blocks without candidates are left out. */
    public List<ResolvedBlock> resolveAll(List<BlockMatch> matches) {
        List<ResolvedBlock> resolved = new ArrayList<>(matches.size());
        for (BlockMatch match : matches) {
            if (!match.isEmpty()) {
                resolved.add(new ResolvedBlock(match.block(), resolve(match.candidates())));
            }
        }
        return resolved;
    }

    public Resolution resolve(List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Cannot resolve a block without candidates");
        }
        Candidate first = candidates.get(0);
        if (allSameContent(candidates)) {
            return Resolution.direct(first.content().clone());
        }
        return Resolution.averaged(average(candidates));
    }

    public boolean isAmbiguous(List<Candidate> candidates) {
        return !allSameContent(candidates);
    }

    private static boolean allSameContent(List<Candidate> candidates) {
        Candidate first = candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            if (!first.sameContentAs(candidates.get(i))) return false;
        }
        return true;
    }

    static int[] average(List<Candidate> candidates) {
        int length = candidates.get(0).content().length;
        int[] red = new int[length], green = new int[length], blue = new int[length];

        for (Candidate candidate : candidates) {
            int[] content = candidate.content();
            if (content.length != length) {
                throw new IllegalArgumentException("Candidate at (" + candidate.mx() + "," + candidate.my()
                        + ") holds " + content.length + " pixels, expected " + length);
            }
            for (int i = 0; i < length; i++) {
                red[i] += (content[i] >> 16) & 0xFF;
                green[i] += (content[i] >> 8) & 0xFF;
                blue[i] += content[i] & 0xFF;
            }
        }

        int n = candidates.size();
        int[] out = new int[length];
        for (int i = 0; i < length; i++) {
            out[i] = ((red[i] / n) << 16) | ((green[i] / n) << 8) | (blue[i] / n);
        }
        return out;
    }
}
