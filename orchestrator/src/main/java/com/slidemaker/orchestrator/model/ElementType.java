package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ElementType {
    TEXT,
    IMAGE;

    /** Maps a free-text type tag to a known element type; anything else is empty. */
    public static Optional<ElementType> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return switch (tag.strip().toLowerCase(Locale.ROOT)) {
            case "text", "textbox", "title" -> Optional.of(TEXT);
            case "image", "picture"         -> Optional.of(IMAGE);
            default                         -> Optional.empty();
        };
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
