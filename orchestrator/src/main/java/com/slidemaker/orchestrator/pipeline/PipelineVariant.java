package com.slidemaker.orchestrator.pipeline;

import java.util.Locale;

public enum PipelineVariant {
    /** Outline text in, composed deck out. */
    CREATE,
    /** PDF or slide images in, editable deck out. */
    CONVERT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
