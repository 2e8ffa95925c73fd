package com.slidemaker.orchestrator.gateway;

/**
 * @param assetId which asset the generated image will become; used for logging
 * @param prompt  description of the image
 * @param size    provider size hint such as {@code 1024x1024}
 */
public record ImageRequest(String assetId, String prompt, String size) {

    public static final String DEFAULT_SIZE = "1024x1024";

    public ImageRequest {
        if (size == null || size.isBlank()) size = DEFAULT_SIZE;
    }
}
