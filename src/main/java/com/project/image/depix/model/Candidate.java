package com.project.image.depix.model;

import java.util.Arrays;

/**
 * A location in the reference image and the pixels found there.
 *
 * @param mx      left edge of the window in the reference image
 * @param my      top edge of the window in the reference image
 * @param score   normalized squared difference, lower is better, 0 is exact
 * @param content row-major packed RGB of the window, black where it leaves the reference
 */
public record Candidate(int mx, int my, double score, int[] content) {

    public boolean sameContentAs(Candidate other) {
        return Arrays.equals(content, other.content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Candidate other)) return false;
        return mx == other.mx && my == other.my
                && Double.compare(score, other.score) == 0
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        int result = 31 * mx + my;
        result = 31 * result + Double.hashCode(score);
        return 31 * result + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "Candidate(" + mx + "," + my + ", score=" + score + ")";
    }
}
