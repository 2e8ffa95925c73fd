package com.slidemaker.orchestrator.pipeline;

import java.util.Locale;

/**
 * Stages every pipeline runs through, in this order:
 *   INGEST → DESCRIBE → ENRICH → MERGE → FINALIZE
 *
 * A stage that exhausts its retries fails the whole run.
 */
public enum PipelineStage {
    INGEST,
    DESCRIBE,
    ENRICH,
    MERGE,
    FINALIZE;

    /** Step name used in logs, metrics and error records. */
    public String stepName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
