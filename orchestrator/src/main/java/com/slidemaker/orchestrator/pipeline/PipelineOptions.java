package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.model.SlideSize;

/**
 * Per-run knobs chosen by the caller.
 *
 * @param concurrency    fan-out bound; 0 means the configured default
 * @param generateImages create only: generate images the composition asks for
 * @param extractImages  convert only: crop picture regions out of the source pages
 * @param theme          deck theme hint
 * @param slideSize      target aspect ratio
 */
public record PipelineOptions(int concurrency, boolean generateImages, boolean extractImages,
                              String theme, SlideSize slideSize) {

    public PipelineOptions {
        if (concurrency < 0) {
            throw new IllegalArgumentException("concurrency must be >= 0, got " + concurrency);
        }
        if (slideSize == null) slideSize = SlideSize.WIDESCREEN_16_9;
    }

    public static PipelineOptions defaults() {
        return new PipelineOptions(0, false, true, null, SlideSize.WIDESCREEN_16_9);
    }

    public PipelineOptions withConcurrency(int value) {
        return new PipelineOptions(value, generateImages, extractImages, theme, slideSize);
    }

    public PipelineOptions withGenerateImages(boolean value) {
        return new PipelineOptions(concurrency, value, extractImages, theme, slideSize);
    }

    public PipelineOptions withExtractImages(boolean value) {
        return new PipelineOptions(concurrency, generateImages, value, theme, slideSize);
    }

    public PipelineOptions withTheme(String value) {
        return new PipelineOptions(concurrency, generateImages, extractImages, value, slideSize);
    }

    public PipelineOptions withSlideSize(SlideSize value) {
        return new PipelineOptions(concurrency, generateImages, extractImages, theme, value);
    }
}
