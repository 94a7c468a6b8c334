package com.project.image.depix.model;

import com.project.image.depix.exceptions.InvalidInputException;

import java.util.Locale;

/** How the pixelation tool averaged colors, selected once per run. */
public enum AveragingMode {
    /** Compare in gamma-encoded [0,1] space. */
    GAMMA_CORRECTED("gammacorrected"),
    /** Raise channels to the power 2.2 before comparing. */
    LINEAR("linear");

    private final String cliName;

    AveragingMode(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public static AveragingMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Averaging type is required, expected gammacorrected or linear");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AveragingMode mode : values()) {
            if (mode.cliName.equals(normalized) || mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new InvalidInputException("Unknown averaging type '" + name + "', expected gammacorrected or linear");
    }
}
