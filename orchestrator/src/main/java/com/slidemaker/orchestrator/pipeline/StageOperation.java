package com.slidemaker.orchestrator.pipeline;

/** Body of one stage. Reads from and writes to the run's context. */
@FunctionalInterface
public interface StageOperation {

    void apply(PipelineContext context) throws Exception;
}
