package com.slidemaker.orchestrator.model;

/**
 * Text styling. Size is in points and is kept within [1, 200] by the parser.
 */
public record FontStyle(String family, int size, RgbColor color, boolean bold, boolean italic, boolean underline) {

    public static final String DEFAULT_FAMILY = "Arial";
    public static final int    DEFAULT_SIZE   = 18;
    public static final int    MIN_SIZE       = 1;
    public static final int    MAX_SIZE       = 200;

    public static final FontStyle DEFAULT =
            new FontStyle(DEFAULT_FAMILY, DEFAULT_SIZE, RgbColor.BLACK, false, false, false);

    public FontStyle {
        if (family == null || family.isBlank()) family = DEFAULT_FAMILY;
        if (color == null) color = RgbColor.BLACK;
    }
}
