package com.slidemaker.orchestrator.runner;

import java.time.Duration;

/** Backoff pause. Swapped out in tests so retries run instantly. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
