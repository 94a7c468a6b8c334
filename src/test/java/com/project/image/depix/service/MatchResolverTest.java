package com.project.image.depix.service;

import com.project.image.depix.model.Block;
import com.project.image.depix.model.BlockMatch;
import com.project.image.depix.model.Candidate;
import com.project.image.depix.model.Resolution;
import com.project.image.depix.model.ResolvedBlock;
import com.project.image.depix.model.RgbColor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MatchResolverTest {
    private final MatchResolver resolver = new MatchResolver();

    private static final int[] X = {new RgbColor(30, 60, 90).toRgb(), new RgbColor(10, 10, 10).toRgb()};
    private static final int[] Y = {RgbColor.BLACK.toRgb(), RgbColor.WHITE.toRgb()};

    @Test
    void resolve_identicalCandidates_isDirect() {
        List<Candidate> candidates = List.of(new Candidate(0, 0, 0.0, X.clone()), new Candidate(7, 3, 0.0, X.clone()));

        Resolution resolution = resolver.resolve(candidates);

        assertThat(resolution.kind()).isEqualTo(Resolution.Kind.DIRECT);
        assertThat(resolution.content()).containsExactly(X);
        assertThat(resolver.isAmbiguous(candidates)).isFalse();
    }

    @Test
    void resolve_differingCandidates_averagesPerChannel() {
        List<Candidate> candidates = List.of(
                new Candidate(0, 0, 0.0, X.clone()),
                new Candidate(2, 0, 0.0, X.clone()),
                new Candidate(4, 0, 0.0, Y.clone()));

        Resolution resolution = resolver.resolve(candidates);

        assertThat(resolution.kind()).isEqualTo(Resolution.Kind.AVERAGED);
        assertThat(resolution.content()).containsExactly(
                new RgbColor(20, 40, 60).toRgb(),
                new RgbColor(91, 91, 91).toRgb());
        assertThat(resolver.isAmbiguous(candidates)).isTrue();
    }

    @Test
    void resolveAll_skipsBlocksWithoutCandidates() {
        Block found = Block.of(0, 0, 2, 1, new RgbColor(1, 1, 1));
        Block missing = Block.of(2, 0, 2, 1, new RgbColor(2, 2, 2));

        List<ResolvedBlock> resolved = resolver.resolveAll(List.of(
                new BlockMatch(found, List.of(new Candidate(0, 0, 0.0, X.clone()))),
                new BlockMatch(missing, List.of())));

        assertThat(resolved).extracting(ResolvedBlock::block).containsExactly(found);
    }

    @Test
    void resolve_emptyOrMismatchedCandidates_isRejected() {
        assertThatThrownBy(() -> resolver.resolve(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve(List.of(
                new Candidate(0, 0, 0.0, X.clone()), new Candidate(1, 0, 0.0, new int[]{0}))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
