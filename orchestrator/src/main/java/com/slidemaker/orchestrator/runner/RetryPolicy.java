package com.slidemaker.orchestrator.runner;

import com.slidemaker.orchestrator.error.Failures;

import java.time.Duration;

/**
 * Attempt budget and backoff schedule for one step.
 *
 * The pause after failed attempt {@code k} (1-based) is
 * {@code baseDelay * multiplier^(k-1)}, so with the defaults a step waits
 * 1s, then 2s, before its third and last attempt.
 *
 * @param maxAttempts total attempts, at least 1
 * @param baseDelay   pause after the first failure
 * @param multiplier  growth factor per further failure, at least 1.0
 * @param timeout     per-attempt deadline, or null for none
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration timeout) {

    public static final int      DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY   = Duration.ofSeconds(1);
    public static final double   DEFAULT_MULTIPLIER   = 2.0;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be a non-negative duration");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive when set");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MULTIPLIER, null);
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, double multiplier) {
        return new RetryPolicy(maxAttempts, baseDelay, multiplier, null);
    }

    /** One attempt, no backoff. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, null);
    }

    public RetryPolicy withTimeout(Duration newTimeout) {
        return new RetryPolicy(maxAttempts, baseDelay, multiplier, newTimeout);
    }

    public RetryPolicy withMaxAttempts(int newMaxAttempts) {
        return new RetryPolicy(newMaxAttempts, baseDelay, multiplier, timeout);
    }

    /** Pause before the attempt following failed attempt {@code failedAttempt}. */
    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt is 1-based, got " + failedAttempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        return Duration.ofMillis((long) Math.min(millis, Long.MAX_VALUE));
    }

    public boolean isRetryable(Throwable failure) {
        return !Failures.isFatal(failure);
    }
}
