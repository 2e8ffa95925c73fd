package com.slidemaker.orchestrator.coordinator;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-scoped, cooperative stop flag. Once raised it stays raised; the first
 * reason (and cause, if any) wins. Tasks already running are left to finish.
 */
public class CancellationSignal {

    private record Raised(String reason, Throwable cause) {}

    private final AtomicReference<Raised> raised = new AtomicReference<>();

    public void cancel(String why) {
        cancel(why, null);
    }

    /** Raises the signal, remembering the failure that made the run hopeless. */
    public void cancel(String why, Throwable cause) {
        raised.compareAndSet(null, new Raised(why == null ? "cancelled" : why, cause));
    }

    public boolean isCancelled() {
        return raised.get() != null;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(raised.get()).map(Raised::reason);
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(raised.get()).map(Raised::cause);
    }
}
