package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** How an image is fitted into its element box. */
public enum FitMode {
    CONTAIN,
    COVER,
    FILL;

    public static Optional<FitMode> fromValue(String value) {
        if (value == null) return Optional.empty();
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "contain"           -> Optional.of(CONTAIN);
            case "cover"             -> Optional.of(COVER);
            case "fill", "stretch"   -> Optional.of(FILL);
            default                  -> Optional.empty();
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
