package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One placed element on a page.
 *
 * Position and size are mutable so the normalizer can rescale a page in
 * place; everything else is fixed at parse time.
 */
@JsonPropertyOrder({"type", "position", "size", "z_index", "opacity"})
public abstract class ElementRecord {

    private final ElementType type;
    private final int         zIndex;
    private final double      opacity;
    private Position          position;
    private Size              size;

    protected ElementRecord(ElementType type, Position position, Size size, int zIndex, double opacity) {
        this.type     = type;
        this.position = position;
        this.size     = size;
        this.zIndex   = zIndex;
        this.opacity  = opacity;
    }

    public ElementType getType()   { return type; }
    public Position getPosition()  { return position; }
    public Size getSize()          { return size; }

    @JsonProperty("z_index")
    public int getZIndex()         { return zIndex; }

    public double getOpacity()     { return opacity; }

    public void setPosition(Position position) { this.position = position; }
    public void setSize(Size size)             { this.size = size; }
}
