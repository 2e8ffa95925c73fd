package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Page background: a solid color, an image reference, or nothing.
 * An image reference is rewritten by the assembler like any image element.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Background(Kind kind, RgbColor color, @JsonProperty("image_ref") String imageRef) {

    public enum Kind { COLOR, IMAGE, NONE }

    public static final Background WHITE = color(RgbColor.WHITE);
    public static final Background NONE  = new Background(Kind.NONE, null, null);

    public static Background color(RgbColor color) {
        return new Background(Kind.COLOR, color, null);
    }

    public static Background image(String imageRef) {
        return new Background(Kind.IMAGE, null, imageRef);
    }
}
