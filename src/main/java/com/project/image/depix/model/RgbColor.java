package com.project.image.depix.model;

import com.project.image.depix.exceptions.InvalidInputException;

/**
 * An 8-bit per channel RGB triple. Equality is exact per channel.
 */
public record RgbColor(int red, int green, int blue) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor WHITE = new RgbColor(255, 255, 255);

    private static final double DEFAULT_SIMILARITY_THRESHOLD = 10.0;

    public RgbColor {
        checkChannel(red);
        checkChannel(green);
        checkChannel(blue);
    }

    public static RgbColor fromRgb(int rgb) {
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    /**
     * Parses a color given as {@code r,g,b}. Whitespace around the fields is ignored.
     *
     * @throws InvalidInputException when the field count is not three or a channel is not an integer in 0..255
     */
    public static RgbColor parse(String text) {
        if (text == null) {
            throw new InvalidInputException("Color must be formatted as 'r,g,b'.");
        }
        String[] parts = text.split(",", -1);
        if (parts.length != 3) {
            throw new InvalidInputException("Color must be formatted as 'r,g,b' (received: '" + text + "').");
        }
        int[] channels = new int[3];
        for (int i = 0; i < 3; i++) {
            try {
                channels[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Invalid color format '" + text + "': " + e.getMessage(), e);
            }
            if (channels[i] < 0 || channels[i] > 255) {
                throw new InvalidInputException("Invalid color format '" + text + "': channel value "
                        + channels[i] + " out of range 0-255");
            }
        }
        return new RgbColor(channels[0], channels[1], channels[2]);
    }

    /** Accepts {@code #rrggbb} or {@code rrggbb}. */
    public static RgbColor fromHex(String hex) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6) {
            throw new InvalidInputException("Invalid hex color: " + hex);
        }
        try {
            return fromRgb(Integer.parseInt(digits, 16));
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Invalid hex color: " + hex, e);
        }
    }

    public int toRgb() {
        return (red << 16) | (green << 8) | blue;
    }

    public String toHex() {
        return String.format("#%02x%02x%02x", red, green, blue);
    }

    public double distanceTo(RgbColor other) {
        int dr = red - other.red, dg = green - other.green, db = blue - other.blue;
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    public boolean isSimilarTo(RgbColor other) {
        return isSimilarTo(other, DEFAULT_SIMILARITY_THRESHOLD);
    }

    public boolean isSimilarTo(RgbColor other, double threshold) {
        return distanceTo(other) <= threshold;
    }

    @Override
    public String toString() {
        return "(" + red + "," + green + "," + blue + ")";
    }

    private static void checkChannel(int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Channel value " + value + " out of range 0-255");
        }
    }
}
