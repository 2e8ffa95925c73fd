package com.slidemaker.orchestrator.pipeline;

/**
 * RUNNING → COMPLETED, or RUNNING → FAILED. Both end states are final.
 */
public enum PipelineState {
    RUNNING,
    COMPLETED,
    FAILED
}
