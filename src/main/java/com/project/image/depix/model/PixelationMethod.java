package com.project.image.depix.model;

import com.project.image.depix.exceptions.InvalidInputException;

import java.util.Locale;

/** Averaging used when generating a pixelated test image. */
public enum PixelationMethod {
    GAMMA,
    LINEAR;

    public static PixelationMethod fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidInputException("Unknown pixelation method '" + name + "', expected gamma or linear", e);
        }
    }
}
