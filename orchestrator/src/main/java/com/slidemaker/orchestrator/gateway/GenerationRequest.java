package com.slidemaker.orchestrator.gateway;

/**
 * A single-turn text generation call, optionally with one image attached.
 *
 * @param systemPrompt may be null
 * @param prompt       the user turn
 * @param image        may be null
 */
public record GenerationRequest(String systemPrompt, String prompt, ImageAttachment image) {

    public GenerationRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
    }

    public static GenerationRequest text(String systemPrompt, String prompt) {
        return new GenerationRequest(systemPrompt, prompt, null);
    }

    public static GenerationRequest withImage(String systemPrompt, String prompt, byte[] data, String mediaType) {
        return new GenerationRequest(systemPrompt, prompt, new ImageAttachment(data, mediaType));
    }

    public boolean hasImage() {
        return image != null;
    }

    public record ImageAttachment(byte[] data, String mediaType) {}
}
