package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;
import java.util.regex.Pattern;

/** 8-bit RGB triple. Serialized as {@code #RRGGBB}. */
public record RgbColor(int red, int green, int blue) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor WHITE = new RgbColor(255, 255, 255);

    private static final Pattern HEX = Pattern.compile("#?([0-9a-fA-F]{6}|[0-9a-fA-F]{3})");

    public RgbColor {
        if (!inRange(red) || !inRange(green) || !inRange(blue)) {
            throw new IllegalArgumentException(
                    "Color channels must be within [0, 255]: (%d, %d, %d)".formatted(red, green, blue));
        }
    }

    /** Builds a color from arbitrary channel values, clamping each into [0, 255]. */
    public static RgbColor clamped(long red, long green, long blue) {
        return new RgbColor(clamp(red), clamp(green), clamp(blue));
    }

    /** Parses {@code #RRGGBB}, {@code RRGGBB} or the short {@code #RGB} form. */
    public static Optional<RgbColor> fromHex(String value) {
        if (value == null) return Optional.empty();
        String v = value.strip();
        if (!HEX.matcher(v).matches()) return Optional.empty();
        String digits = v.startsWith("#") ? v.substring(1) : v;
        if (digits.length() == 3) {
            digits = "" + digits.charAt(0) + digits.charAt(0)
                    + digits.charAt(1) + digits.charAt(1)
                    + digits.charAt(2) + digits.charAt(2);
        }
        int rgb = Integer.parseInt(digits, 16);
        return Optional.of(new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF));
    }

    @JsonValue
    public String toHex() {
        return "#%02X%02X%02X".formatted(red, green, blue);
    }

    private static boolean inRange(int channel) {
        return channel >= 0 && channel <= 255;
    }

    private static int clamp(long channel) {
        return (int) Math.max(0, Math.min(255, channel));
    }
}
