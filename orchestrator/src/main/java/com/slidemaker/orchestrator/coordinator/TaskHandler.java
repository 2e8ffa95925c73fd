package com.slidemaker.orchestrator.coordinator;

/** The body of a fan-out task. Any exception marks only that task as failed. */
@FunctionalInterface
public interface TaskHandler<P, R> {

    R handle(TaskRequest<P> task) throws Exception;
}
