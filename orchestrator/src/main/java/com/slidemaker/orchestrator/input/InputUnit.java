package com.slidemaker.orchestrator.input;

import com.slidemaker.orchestrator.model.CoordinateSpace;

import java.nio.charset.StandardCharsets;

/**
 * One ordered unit of raw input: the outline text, or one rasterized page.
 *
 * @param id        stable within a run ({@code outline}, {@code page-1}, ...)
 * @param index     0-based position in the source
 * @param content   raw bytes; UTF-8 text for outlines, encoded image otherwise
 * @param mediaType MIME type of {@code content}
 * @param space     pixel space of a raster unit; the deck space for text
 */
public record InputUnit(String id, int index, byte[] content, String mediaType, CoordinateSpace space) {

    public boolean isImage() {
        return mediaType != null && mediaType.startsWith("image/");
    }

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
