package com.project.image.depix.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CandidateTest {

    @Test
    void equality_comparesPixelContent() {
        Candidate a = new Candidate(3, 7, 0.0, new int[]{1, 2, 3});
        Candidate b = new Candidate(3, 7, 0.0, new int[]{1, 2, 3});
        Candidate other = new Candidate(3, 7, 0.0, new int[]{1, 2, 4});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(other);
        assertThat(a.sameContentAs(b)).isTrue();
        assertThat(new Candidate(4, 7, 0.0, new int[]{1, 2, 3})).isNotEqualTo(a);
    }
}
