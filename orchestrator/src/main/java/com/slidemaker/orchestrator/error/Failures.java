package com.slidemaker.orchestrator.error;

import com.slidemaker.orchestrator.gateway.GatewayException;

import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Classifies failures by walking their cause chain.
 */
public final class Failures {

    private Failures() {}

    /**
     * True when retrying cannot help: a fatal {@link PipelineException}, a
     * non-retryable {@link GatewayException}, an interrupt or a cancellation
     * appears anywhere in the chain. A cancelled run stays cancelled.
     */
    public static boolean isFatal(Throwable failure) {
        for (Throwable t = failure; t != null; t = nextCause(t)) {
            if (t instanceof PipelineException pe && pe.isFatal()) return true;
            if (t instanceof GatewayException ge && !ge.isRetryable()) return true;
            if (t instanceof InterruptedException) return true;
            if (t instanceof CancellationException) return true;
        }
        return false;
    }

    /** The first non-retryable gateway failure in the chain, if any. */
    public static Optional<GatewayException> fatalGatewayFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = nextCause(t)) {
            if (t instanceof GatewayException ge && !ge.isRetryable()) return Optional.of(ge);
        }
        return Optional.empty();
    }

    private static Throwable nextCause(Throwable t) {
        Throwable cause = t.getCause();
        return cause == t ? null : cause;
    }
}
