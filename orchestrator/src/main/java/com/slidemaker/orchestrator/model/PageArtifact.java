package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of the deck. Owned by exactly one pipeline stage at a time:
 * the normalizer rescales it, the assembler rewrites its asset references,
 * the renderer reads it.
 *
 * {@code space} always names the coordinate space the element geometry is
 * currently expressed in.
 */
@JsonPropertyOrder({"page_number", "title", "notes", "background", "elements"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageArtifact {

    private final int                 pageNumber;
    private final String              title;
    private final String              notes;
    private final List<ElementRecord> elements;
    private Background                background;
    private CoordinateSpace           space;

    public PageArtifact(int pageNumber, String title, String notes,
                        List<? extends ElementRecord> elements, Background background, CoordinateSpace space) {
        this.pageNumber = pageNumber;
        this.title      = title == null ? "" : title;
        this.notes      = notes;
        this.elements   = new ArrayList<>(elements);
        this.background = background == null ? Background.WHITE : background;
        this.space      = space;
    }

    @JsonProperty("page_number")
    public int getPageNumber()              { return pageNumber; }

    public String getTitle()                { return title; }
    public String getNotes()                { return notes; }
    public List<ElementRecord> getElements() { return Collections.unmodifiableList(elements); }
    public Background getBackground()       { return background; }

    @JsonIgnore
    public CoordinateSpace getSpace()       { return space; }

    public void setBackground(Background background) { this.background = background; }
    public void setSpace(CoordinateSpace space)      { this.space = space; }

    public List<ImageElement> imageElements() {
        List<ImageElement> images = new ArrayList<>();
        for (ElementRecord element : elements) {
            if (element instanceof ImageElement image) images.add(image);
        }
        return images;
    }
}
