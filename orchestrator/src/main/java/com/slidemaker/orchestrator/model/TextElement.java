package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class TextElement extends ElementRecord {

    public static final double DEFAULT_LINE_SPACING = 1.0;

    private final String    content;
    private final FontStyle font;
    private final Alignment alignment;
    private final double    lineSpacing;

    public TextElement(Position position, Size size, int zIndex, double opacity,
                       String content, FontStyle font, Alignment alignment, double lineSpacing) {
        super(ElementType.TEXT, position, size, zIndex, opacity);
        this.content     = content == null ? "" : content;
        this.font        = font == null ? FontStyle.DEFAULT : font;
        this.alignment   = alignment == null ? Alignment.LEFT : alignment;
        this.lineSpacing = lineSpacing;
    }

    public String getContent()      { return content; }
    public FontStyle getFont()      { return font; }
    public Alignment getAlignment() { return alignment; }

    @JsonProperty("line_spacing")
    public double getLineSpacing()  { return lineSpacing; }
}
