package com.slidemaker.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An image slot. {@code assetId} is the key the assembler matches on;
 * {@code source} starts as whatever the model supplied and is rewritten to
 * the stored asset's location once one exists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImageElement extends ElementRecord {

    private final String  assetId;
    private final FitMode fitMode;
    private final String  altText;
    private final String  generationPrompt;
    private String        source;

    public ImageElement(Position position, Size size, int zIndex, double opacity,
                        String assetId, String source, FitMode fitMode, String altText, String generationPrompt) {
        super(ElementType.IMAGE, position, size, zIndex, opacity);
        this.assetId          = assetId;
        this.source           = source == null ? "" : source;
        this.fitMode          = fitMode == null ? FitMode.CONTAIN : fitMode;
        this.altText          = altText == null ? "" : altText;
        this.generationPrompt = generationPrompt;
    }

    @JsonProperty("asset_id")
    public String getAssetId()  { return assetId; }

    public String getSource()   { return source; }

    @JsonProperty("fit_mode")
    public FitMode getFitMode() { return fitMode; }

    @JsonProperty("alt_text")
    public String getAltText()  { return altText; }

    @JsonIgnore
    public String getGenerationPrompt() { return generationPrompt; }

    /** True when the model asked for this image to be generated rather than extracted. */
    @JsonIgnore
    public boolean requestsGeneration() {
        return generationPrompt != null && !generationPrompt.isBlank();
    }

    public void setSource(String source) { this.source = source; }
}
