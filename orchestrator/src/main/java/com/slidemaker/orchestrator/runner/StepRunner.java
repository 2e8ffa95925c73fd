package com.slidemaker.orchestrator.runner;

import com.slidemaker.orchestrator.error.ErrorRecord;
import com.slidemaker.orchestrator.error.PipelineException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one named unit of work under a {@link RetryPolicy}.
 *
 * For each attempt:
 *   1. Tag the log context with the step name and attempt number
 *   2. Invoke the operation, on a helper thread when the policy has a timeout
 *   3. On success, return the value; the attempt count is only in the logs
 *   4. On failure, stop at once if the failure is fatal, otherwise back off
 *      and try again until the budget is spent
 *
 * The caller sees exactly one outcome: the value, or a
 * {@code STEP_EXHAUSTED} {@link PipelineException} whose {@link ErrorRecord}
 * names the step, the attempts made and the last cause.
 *
 * A timed-out attempt is abandoned, not killed: the helper thread is
 * interrupted and left to wind down on its own.
 *
 * Metrics:
 * <pre>
 *   slidemaker.step.attempts{step, status="success|failure"}
 *   slidemaker.step.duration{step, outcome="success|exhausted"}
 * </pre>
 */
@Component
public class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final MeterRegistry   meterRegistry;
    private final Sleeper         sleeper;
    private final ExecutorService attemptThreads;

    @Autowired
    public StepRunner(MeterRegistry meterRegistry) {
        this(meterRegistry, Sleeper.SYSTEM);
    }

    public StepRunner(MeterRegistry meterRegistry, Sleeper sleeper) {
        this.meterRegistry  = meterRegistry;
        this.sleeper        = sleeper;
        this.attemptThreads = Executors.newCachedThreadPool(daemonThreads());
    }

    @PreDestroy
    public void shutdown() {
        attemptThreads.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    public <T> T run(String stepName, Callable<T> operation, RetryPolicy policy) {
        String outerStep    = MDC.get("step");
        String outerAttempt = MDC.get("attempt");
        MDC.put("step", stepName);

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "exhausted";
        try {
            for (int attempt = 1; ; attempt++) {
                MDC.put("attempt", String.valueOf(attempt));
                try {
                    T result = invoke(operation, policy.timeout());
                    countAttempt(stepName, "success");
                    outcome = "success";
                    if (attempt > 1) {
                        log.info("Step '{}' succeeded on attempt {}/{}", stepName, attempt, policy.maxAttempts());
                    }
                    return result;
                } catch (Exception e) {
                    countAttempt(stepName, "failure");
                    Throwable cause = unwrap(e);
                    boolean retryable = policy.isRetryable(cause);

                    if (!retryable || attempt >= policy.maxAttempts()) {
                        log.error("Step '{}' gave up after attempt {}/{} ({}): {}",
                                stepName, attempt, policy.maxAttempts(),
                                retryable ? "budget spent" : "not retryable",
                                PipelineException.describe(cause));
                        throw exhausted(stepName, attempt, cause, retryable, policy);
                    }

                    Duration delay = policy.delayAfter(attempt);
                    log.warn("Step '{}' failed on attempt {}/{}, retrying in {} ms: {}",
                            stepName, attempt, policy.maxAttempts(), delay.toMillis(),
                            PipelineException.describe(cause));
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw exhausted(stepName, attempt, ie, false, policy);
                    }
                }
            }
        } finally {
            sample.stop(meterRegistry.timer("slidemaker.step.duration", "step", stepName, "outcome", outcome));
            restore("step", outerStep);
            restore("attempt", outerAttempt);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <T> T invoke(Callable<T> operation, Duration timeout) throws Exception {
        if (timeout == null) {
            return operation.call();
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = attemptThreads.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return operation.call();
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Attempt exceeded " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static Throwable unwrap(Throwable t) {
        if (t instanceof ExecutionException && t.getCause() != null) {
            return t.getCause();
        }
        return t;
    }

    private static PipelineException exhausted(String stepName, int attempt, Throwable cause,
                                               boolean retryable, RetryPolicy policy) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("maxAttempts", policy.maxAttempts());
        context.put("retryable", retryable);
        return PipelineException.stepExhausted(new ErrorRecord(stepName, attempt, cause, context));
    }

    private void countAttempt(String stepName, String status) {
        meterRegistry.counter("slidemaker.step.attempts", "step", stepName, "status", status).increment();
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "step-attempt-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
