package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.runner.RetryPolicy;

import java.nio.file.Path;

/**
 * Deployment-wide pipeline settings, bound from configuration.
 *
 * @param defaultConcurrency fan-out bound when a run does not set one
 * @param stagePolicy        retry policy for whole stages
 * @param taskPolicy         retry policy for each external call inside a stage
 * @param finalizePolicy     retry policy for rendering the document
 * @param outputRoot         every output document must resolve inside this directory
 */
public record PipelinePolicies(int defaultConcurrency, RetryPolicy stagePolicy, RetryPolicy taskPolicy,
                               RetryPolicy finalizePolicy, Path outputRoot) {

    public PipelinePolicies {
        if (defaultConcurrency < 1) {
            throw new IllegalArgumentException("defaultConcurrency must be >= 1, got " + defaultConcurrency);
        }
        outputRoot = outputRoot.toAbsolutePath().normalize();
    }
}
