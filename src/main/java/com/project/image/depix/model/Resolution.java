package com.project.image.depix.model;

/**
 * Final pixels for one block.
 */
public record Resolution(Kind kind, int[] content) {

    public enum Kind {
        /** All candidates agreed, content copied from the first one. */
        DIRECT,
        /** Candidates disagreed, content is their per-channel mean. */
        AVERAGED
    }

    public static Resolution direct(int[] content) {
        return new Resolution(Kind.DIRECT, content);
    }

    public static Resolution averaged(int[] content) {
        return new Resolution(Kind.AVERAGED, content);
    }
}
