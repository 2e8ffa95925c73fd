package com.slidemaker.orchestrator.gateway;

/**
 * Opaque access to an external model provider.
 *
 * Implementations block until the provider answers and report every failure
 * as a {@link GatewayException}. Retrying is the caller's job.
 */
public interface ModelGateway {

    /** Returns the raw text the model produced for the request. */
    String generate(GenerationRequest request);

    /** Returns encoded image bytes (PNG unless the provider says otherwise). */
    byte[] generateImage(ImageRequest request);
}
