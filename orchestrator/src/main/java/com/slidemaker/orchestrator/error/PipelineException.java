package com.slidemaker.orchestrator.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The single failure type of the orchestration core.
 *
 * Unchecked, tagged with a {@link Kind} and a free-form context map instead of
 * one subclass per module. A {@code STEP_EXHAUSTED} failure also carries the
 * {@link ErrorRecord} describing the step that gave up.
 *
 * A fatal exception is never retried by the step runner, whatever the
 * remaining attempt budget.
 */
public class PipelineException extends RuntimeException {

    public enum Kind { VALIDATION, STEP_EXHAUSTED, AGGREGATE_TASK, INVALID_DIMENSION, RESOURCE_BOUNDARY }

    private final Kind                kind;
    private final Map<String, Object> context;
    private final ErrorRecord         errorRecord;
    private final boolean             fatal;

    public PipelineException(Kind kind, String message) {
        this(kind, message, Map.of(), null, false, null);
    }

    public PipelineException(Kind kind, String message, Throwable cause) {
        this(kind, message, Map.of(), null, false, cause);
    }

    public PipelineException(Kind kind, String message, Map<String, ?> context) {
        this(kind, message, context, null, false, null);
    }

    public PipelineException(Kind kind, String message, Map<String, ?> context, Throwable cause) {
        this(kind, message, context, null, false, cause);
    }

    private PipelineException(Kind kind, String message, Map<String, ?> context,
                              ErrorRecord errorRecord, boolean fatal, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind        = kind;
        this.context     = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.errorRecord = errorRecord;
        this.fatal       = fatal;
    }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    /** A step ran out of attempts (or hit a non-retryable failure). */
    public static PipelineException stepExhausted(ErrorRecord record) {
        String message = "Step '%s' failed after %d attempt(s): %s".formatted(
                record.stepName(), record.attempt(), describe(record.cause()));
        return new PipelineException(Kind.STEP_EXHAUSTED, message, record.context(),
                record, false, record.cause());
    }

    /** Rejected input that no amount of retrying will fix (missing file, bad extension, ...). */
    public static PipelineException invalidInput(String message, Map<String, ?> context) {
        return new PipelineException(Kind.VALIDATION, message, context, null, true, null);
    }

    /**
     * A fan-out stage whose run was cancelled by a failure no retry can fix.
     * Whatever the sibling tasks achieved, the stage cannot complete.
     */
    public static PipelineException runCancelled(String reason, Throwable cause) {
        return new PipelineException(Kind.AGGREGATE_TASK, "Run cancelled: " + reason,
                Map.of("reason", reason), null, true, cause);
    }

    public static String describe(Throwable t) {
        if (t == null) return "unknown cause";
        String msg = t.getMessage();
        return t.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public Kind getKind()                     { return kind; }
    public Map<String, Object> getContext()   { return context; }
    public Optional<ErrorRecord> errorRecord() { return Optional.ofNullable(errorRecord); }

    /** INVALID_DIMENSION and RESOURCE_BOUNDARY are deterministic, so always fatal. */
    public boolean isFatal() {
        return fatal || kind == Kind.INVALID_DIMENSION || kind == Kind.RESOURCE_BOUNDARY;
    }
}
