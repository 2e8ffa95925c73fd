package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** Supported deck aspect ratios and their canonical pixel spaces. */
public enum SlideSize {
    WIDESCREEN_16_9("16:9", 1920, 1080),
    STANDARD_4_3("4:3", 1024, 768);

    private final String          label;
    private final CoordinateSpace space;

    SlideSize(String label, int width, int height) {
        this.label = label;
        this.space = new CoordinateSpace(width, height);
    }

    public static Optional<SlideSize> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String trimmed = label.strip();
        for (SlideSize size : values()) {
            if (size.label.equals(trimmed)) return Optional.of(size);
        }
        return Optional.empty();
    }

    @JsonValue
    public String label() { return label; }

    public CoordinateSpace space() { return space; }
}
