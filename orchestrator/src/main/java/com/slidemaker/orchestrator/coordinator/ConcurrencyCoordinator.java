package com.slidemaker.orchestrator.coordinator;

import com.slidemaker.orchestrator.error.PipelineException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded fan-out of independent tasks.
 *
 * Each {@link #runAll} call gets its own semaphore and its own fixed pool,
 * so the bound holds per call even when several pipeline runs share this
 * bean. Tasks are dispatched in input order as permits free up; results
 * come back keyed by id, in input order, regardless of completion order.
 *
 * A task failure never escapes on its own. Only when every task fails does
 * the call raise {@code AGGREGATE_TASK}. Once the cancellation signal is
 * raised no further task is started; those left undispatched are reported
 * as failed with a {@link CancellationException}.
 *
 * Metrics:
 * <pre>
 *   slidemaker.coordinator.tasks{status="success|failed"}
 * </pre>
 */
@Component
public class ConcurrencyCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyCoordinator.class);

    public static final int DEFAULT_BOUND = 3;

    private final MeterRegistry meterRegistry;

    public ConcurrencyCoordinator(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    public <P, R> Map<String, TaskResult<R>> runAll(List<TaskRequest<P>> tasks, TaskHandler<P, R> handler, int bound) {
        return runAll(tasks, handler, bound, new CancellationSignal());
    }

    public <P, R> Map<String, TaskResult<R>> runAll(List<TaskRequest<P>> tasks, TaskHandler<P, R> handler,
                                                    int bound, CancellationSignal cancellation) {
        validate(tasks, bound);
        if (tasks.isEmpty()) {
            return new LinkedHashMap<>();
        }

        Map<String, TaskResult<R>> results = new ConcurrentHashMap<>();
        Map<String, Future<?>> inFlight = new LinkedHashMap<>();
        Semaphore permits = new Semaphore(bound);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(bound, tasks.size()), workerThreads());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        boolean interrupted = false;

        log.info("Dispatching {} task(s) with concurrency bound {}", tasks.size(), bound);
        try {
            for (TaskRequest<P> task : tasks) {
                results.put(task.id(), TaskResult.pending(task.id()));

                boolean acquired = false;
                if (!cancellation.isCancelled()) {
                    try {
                        permits.acquire();
                        acquired = true;
                    } catch (InterruptedException e) {
                        interrupted = true;
                        cancellation.cancel("interrupted while dispatching");
                    }
                }
                if (cancellation.isCancelled()) {
                    if (acquired) permits.release();
                    String why = cancellation.reason().orElse("cancelled");
                    results.put(task.id(), TaskResult.failed(task.id(),
                            new CancellationException("Not started: " + why)));
                    continue;
                }

                inFlight.put(task.id(), pool.submit(() -> runOne(task, handler, results, permits, mdc)));
            }

            interrupted |= awaitAll(inFlight, results);
        } finally {
            pool.shutdown();
            if (interrupted) Thread.currentThread().interrupt();
        }

        Map<String, TaskResult<R>> ordered = new LinkedHashMap<>();
        for (TaskRequest<P> task : tasks) {
            ordered.put(task.id(), results.get(task.id()));
        }
        return summarize(ordered);
    }

    /** Values of the successful tasks, in input order. */
    public static <R> Map<String, R> successfulValues(Map<String, TaskResult<R>> results) {
        Map<String, R> values = new LinkedHashMap<>();
        results.forEach((id, result) -> {
            if (result.isSuccess()) values.put(id, result.value());
        });
        return values;
    }

    /** Ids of the failed tasks, in input order. */
    public static List<String> failedIds(Map<String, ? extends TaskResult<?>> results) {
        List<String> ids = new ArrayList<>();
        results.forEach((id, result) -> {
            if (result.status() == TaskStatus.FAILED) ids.add(id);
        });
        return ids;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <P, R> void runOne(TaskRequest<P> task, TaskHandler<P, R> handler,
                               Map<String, TaskResult<R>> results, Semaphore permits,
                               Map<String, String> mdc) {
        if (mdc != null) MDC.setContextMap(mdc);
        MDC.put("taskId", task.id());
        try {
            R value = handler.handle(task);
            results.put(task.id(), TaskResult.success(task.id(), value));
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            log.warn("Task '{}' failed: {}", task.id(), PipelineException.describe(e));
            results.put(task.id(), TaskResult.failed(task.id(), e));
        } finally {
            permits.release();
            MDC.clear();
        }
    }

    /** Waits for every dispatched task; returns whether the caller was interrupted meanwhile. */
    private <R> boolean awaitAll(Map<String, Future<?>> inFlight, Map<String, TaskResult<R>> results) {
        boolean interrupted = false;
        for (Map.Entry<String, Future<?>> entry : inFlight.entrySet()) {
            while (true) {
                try {
                    entry.getValue().get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    // runOne catches Exception, so this is an Error escaping the task body
                    results.put(entry.getKey(), TaskResult.failed(entry.getKey(), e.getCause()));
                    break;
                }
            }
        }
        return interrupted;
    }

    private <R> Map<String, TaskResult<R>> summarize(Map<String, TaskResult<R>> ordered) {
        List<String> failed = failedIds(ordered);
        int succeeded = ordered.size() - failed.size();
        meterRegistry.counter("slidemaker.coordinator.tasks", "status", "success").increment(succeeded);
        meterRegistry.counter("slidemaker.coordinator.tasks", "status", "failed").increment(failed.size());

        if (succeeded == 0) {
            Throwable first = ordered.get(failed.get(0)).error();
            log.error("All {} task(s) failed; first failure from '{}': {}",
                    failed.size(), failed.get(0), PipelineException.describe(first));
            throw new PipelineException(PipelineException.Kind.AGGREGATE_TASK,
                    "All %d task(s) failed".formatted(failed.size()),
                    Map.of("failedTaskIds", List.copyOf(failed)), first);
        }
        if (!failed.isEmpty()) {
            log.warn("{} of {} task(s) failed: {}", failed.size(), ordered.size(), failed);
        } else {
            log.info("All {} task(s) succeeded", succeeded);
        }
        return ordered;
    }

    private static void validate(List<? extends TaskRequest<?>> tasks, int bound) {
        if (bound < 1) {
            throw new IllegalArgumentException("Concurrency bound must be >= 1, got " + bound);
        }
        Set<String> seen = new HashSet<>();
        for (TaskRequest<?> task : tasks) {
            if (!seen.add(task.id())) {
                throw new IllegalArgumentException("Duplicate task id '" + task.id() + "'");
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "fanout-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
