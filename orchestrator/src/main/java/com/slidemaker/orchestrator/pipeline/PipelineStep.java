package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.runner.RetryPolicy;

/**
 * One stage bound to its operation and retry policy. Built once when the
 * pipeline is constructed.
 */
public record PipelineStep(PipelineStage stage, StageOperation operation, RetryPolicy retryPolicy) {

    public String name() {
        return stage.stepName();
    }
}
