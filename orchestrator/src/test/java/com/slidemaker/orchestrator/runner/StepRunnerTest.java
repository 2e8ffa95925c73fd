package com.slidemaker.orchestrator.runner;

import com.slidemaker.orchestrator.error.ErrorRecord;
import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.gateway.GatewayException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for StepRunner. Backoff pauses are recorded instead of slept.
 */
class StepRunnerTest {

    SimpleMeterRegistry meters;
    List<Duration> pauses;
    StepRunner runner;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        pauses = new ArrayList<>();
        runner = new StepRunner(meters, pauses::add);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    // ------------------------------------------------------------------
    // Success paths
    // ------------------------------------------------------------------

    @Test
    void run_succeedsFirstTime_returnsValueWithoutPausing() {
        String result = runner.run("describe", () -> "ok", RetryPolicy.defaults());

        assertThat(result).isEqualTo("ok");
        assertThat(pauses).isEmpty();
        assertThat(meters.counter("slidemaker.step.attempts", "step", "describe", "status", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void run_failsTwiceThenSucceeds_makesThreeAttemptsWithBackoff() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(100), 2.0);

        String result = runner.run("describe", () -> {
            if (calls.incrementAndGet() <= 2) throw new IOException("connection reset");
            return "ok";
        }, policy);

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(pauses).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        assertThat(meters.counter("slidemaker.step.attempts", "step", "describe", "status", "failure").count())
                .isEqualTo(2.0);
    }

    // ------------------------------------------------------------------
    // Failure paths
    // ------------------------------------------------------------------

    @Test
    void run_alwaysFails_throwsStepExhaustedAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        IOException last = new IOException("still down");

        PipelineException e = catchThrowableOfType(() -> runner.run("enrich", () -> {
            calls.incrementAndGet();
            throw last;
        }, RetryPolicy.of(3, Duration.ofMillis(10), 2.0)), PipelineException.class);

        assertThat(e.getKind()).isEqualTo(PipelineException.Kind.STEP_EXHAUSTED);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(pauses).hasSize(2);   // no pause after the last attempt

        ErrorRecord record = e.errorRecord().orElseThrow();
        assertThat(record.stepName()).isEqualTo("enrich");
        assertThat(record.attempt()).isEqualTo(3);
        assertThat(record.cause()).isSameAs(last);
        assertThat(record.context()).containsEntry("retryable", true);
    }

    @Test
    void run_authenticationFailure_stopsAfterFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();

        PipelineException e = catchThrowableOfType(() -> runner.run("describe", () -> {
            calls.incrementAndGet();
            throw new GatewayException(GatewayException.Kind.AUTHENTICATION, 401, "invalid x-api-key", null);
        }, RetryPolicy.defaults()), PipelineException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(pauses).isEmpty();
        assertThat(e.errorRecord().orElseThrow().attempt()).isEqualTo(1);
        assertThat(e.errorRecord().orElseThrow().context()).containsEntry("retryable", false);
    }

    @Test
    void run_singleAttemptPolicy_neverRetries() {
        AtomicInteger calls = new AtomicInteger();

        catchThrowableOfType(() -> runner.run("finalize", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("disk full");
        }, RetryPolicy.noRetry()), PipelineException.class);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void run_attemptExceedsTimeout_isAbandonedAndRetried() {
        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.of(2, Duration.ZERO, 1.0).withTimeout(Duration.ofMillis(50));

        String result = runner.run("describe.page", () -> {
            if (calls.incrementAndGet() == 1) {
                never.await(10, TimeUnit.SECONDS);
            }
            return "second try";
        }, policy);

        assertThat(result).isEqualTo("second try");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void run_everyAttemptTimesOut_recordsTimeoutAsCause() {
        RetryPolicy policy = RetryPolicy.of(2, Duration.ZERO, 1.0).withTimeout(Duration.ofMillis(20));

        PipelineException e = catchThrowableOfType(() -> runner.run("describe.page", () -> {
            Thread.sleep(5_000);
            return "late";
        }, policy), PipelineException.class);

        assertThat(e.errorRecord().orElseThrow().cause()).isInstanceOf(TimeoutException.class);
        assertThat(e.errorRecord().orElseThrow().attempt()).isEqualTo(2);
    }
}
