package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY;

    public static Optional<Alignment> fromValue(String value) {
        if (value == null) return Optional.empty();
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "left"             -> Optional.of(LEFT);
            case "center", "centre" -> Optional.of(CENTER);
            case "right"            -> Optional.of(RIGHT);
            case "justify"          -> Optional.of(JUSTIFY);
            default                 -> Optional.empty();
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
