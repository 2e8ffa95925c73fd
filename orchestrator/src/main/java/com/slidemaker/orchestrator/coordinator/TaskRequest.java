package com.slidemaker.orchestrator.coordinator;

/**
 * One independent unit of fan-out work.
 *
 * @param id      unique within a single {@code runAll} call
 * @param payload whatever the handler needs
 */
public record TaskRequest<P>(String id, P payload) {

    public TaskRequest {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
    }
}
