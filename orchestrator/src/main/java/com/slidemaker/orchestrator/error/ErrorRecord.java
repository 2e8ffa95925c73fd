package com.slidemaker.orchestrator.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What went wrong, where, and after how many tries.
 *
 * Attached to failures only; a successful step never produces one.
 *
 * @param stepName name the step was run under (stage name or sub-task step name)
 * @param attempt  attempts actually made, 1-based
 * @param cause    the last underlying failure
 * @param context  free-form details (retryability, task ids, ...)
 */
public record ErrorRecord(String stepName, int attempt, Throwable cause, Map<String, Object> context) {

    public ErrorRecord {
        context = Collections.unmodifiableMap(new LinkedHashMap<>(context == null ? Map.of() : context));
    }
}
