package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.asset.AssetStore;
import com.slidemaker.orchestrator.coordinator.CancellationSignal;
import com.slidemaker.orchestrator.coordinator.TaskHandler;
import com.slidemaker.orchestrator.coordinator.TaskRequest;
import com.slidemaker.orchestrator.coordinator.TaskResult;
import com.slidemaker.orchestrator.error.Failures;
import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.render.RenderedDocument;
import com.slidemaker.orchestrator.runner.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Shared skeleton of the create and convert pipelines.
 *
 * A run:
 *   1. Opens a staging area under {@code <staging-root>/<runId>}
 *   2. Runs INGEST, DESCRIBE, ENRICH, MERGE, FINALIZE in order, each through
 *      the step runner with its own retry policy
 *   3. Returns a COMPLETED run holding the rendered document, or a FAILED run
 *      naming the stage that gave up; the staging area is discarded on failure
 *
 * Variants supply INGEST, DESCRIBE and ENRICH. MERGE (asset references into
 * pages) and FINALIZE (render) are the same for both.
 *
 * Once a sub-task hits a failure no retry can fix (bad credentials, an
 * unsupported operation), the run's cancellation signal is raised so no
 * further sub-task is started, and the fan-out stage fails on the spot
 * with that failure as its cause, even if sibling tasks succeeded.
 *
 * Metrics:
 * <pre>
 *   slidemaker.pipeline.runs{pipeline="create|convert", state="completed|failed"}
 * </pre>
 */
public abstract class AbstractPipeline {

    private static final Logger log = LoggerFactory.getLogger(AbstractPipeline.class);

    protected final PipelineComponents components;
    protected final PipelinePolicies   policies;

    private final PipelineVariant    variant;
    private final List<PipelineStep> steps;

    /**
     * @param describePolicy retry policy of the DESCRIBE stage; a variant that
     *                       calls the model directly from that stage passes the
     *                       per-call policy, one that fans out passes the stage policy
     */
    protected AbstractPipeline(PipelineVariant variant, PipelineComponents components,
                               PipelinePolicies policies, RetryPolicy describePolicy) {
        this.variant    = variant;
        this.components = components;
        this.policies   = policies;
        this.steps = List.of(
                new PipelineStep(PipelineStage.INGEST,   this::ingestStage,      policies.stagePolicy()),
                new PipelineStep(PipelineStage.DESCRIBE, this::describe,         describePolicy),
                new PipelineStep(PipelineStage.ENRICH,   this::enrich,           policies.stagePolicy()),
                new PipelineStep(PipelineStage.MERGE,    this::merge,            RetryPolicy.noRetry()),
                new PipelineStep(PipelineStage.FINALIZE, this::finalizeDocument, policies.finalizePolicy()));
    }

    // ------------------------------------------------------------------
    // Variant hooks
    // ------------------------------------------------------------------

    /** Validates the input file and loads its units into the context. */
    protected abstract void ingest(PipelineContext context) throws Exception;

    /** Produces pages in canonical space, plus the asset requests they imply. */
    protected abstract void describe(PipelineContext context) throws Exception;

    /** Produces stored assets for the pending asset requests. */
    protected abstract void enrich(PipelineContext context) throws Exception;

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Runs the pipeline to completion. Never throws for a pipeline failure;
     * inspect the returned run, or call {@link PipelineRun#documentOrThrow()}.
     *
     * @param output document path; relative paths resolve against the output root
     */
    public PipelineRun execute(Path input, Path output, PipelineOptions options) {
        String runId = UUID.randomUUID().toString();
        PipelineRun run = new PipelineRun(runId, variant);
        MDC.put("runId", runId);
        MDC.put("pipeline", variant.label());

        int concurrency = options.concurrency() > 0 ? options.concurrency() : policies.defaultConcurrency();
        AssetStore staging = components.assetStores().open(runId);
        PipelineContext context = new PipelineContext(runId, input, output, options, concurrency, staging);
        log.info("Run {} ({}) started: input={}, output={}, concurrency={}",
                runId, variant.label(), input, output, concurrency);

        try {
            for (PipelineStep step : steps) {
                run.enter(step.stage());
                MDC.put("stage", step.name());
                log.info("Run {} entering stage {}", runId, step.stage());
                components.stepRunner().run(step.name(), () -> {
                    step.operation().apply(context);
                    return null;
                }, step.retryPolicy());
            }

            RenderedDocument document = context.getDocument()
                    .orElseThrow(() -> new IllegalStateException("FINALIZE finished without a document"));
            run.complete(document, context.getPages(), context.getDegraded());
            log.info("Run {} COMPLETED in {} ms: {} page(s) -> {}{}",
                    runId, run.elapsed().toMillis(), document.pageCount(), document.path(),
                    context.getDegraded().isEmpty() ? "" : " (degraded: " + context.getDegraded() + ")");
        } catch (PipelineException e) {
            context.getCancellation().cancel("run failed at stage " + run.getStage());
            run.fail(e, context.getDegraded());
            log.error("Run {} FAILED at stage {}: {}", runId, run.getStage(), e.getMessage());
            discardStaging(staging);
        } finally {
            components.meterRegistry().counter("slidemaker.pipeline.runs",
                    "pipeline", variant.label(),
                    "state", run.getState().name().toLowerCase(Locale.ROOT)).increment();
            MDC.remove("stage");
            MDC.remove("pipeline");
            MDC.remove("runId");
        }
        return run;
    }

    public PipelineVariant variant() {
        return variant;
    }

    public List<PipelineStep> steps() {
        return steps;
    }

    // ------------------------------------------------------------------
    // Helpers for variants
    // ------------------------------------------------------------------

    /**
     * One external call inside a fan-out task, retried under the per-call
     * policy. A failure that can never succeed raises the run's cancellation
     * signal before propagating.
     */
    protected <T> T callExternal(PipelineContext context, String stepName, Callable<T> call) {
        try {
            return components.stepRunner().run(stepName, call, policies.taskPolicy());
        } catch (PipelineException e) {
            Failures.fatalGatewayFailure(e).ifPresent(fatal -> {
                log.error("Cancelling remaining tasks of run {}: {}", context.getRunId(), fatal.getMessage());
                context.getCancellation().cancel("fatal gateway failure: " + fatal.getKind(), fatal);
            });
            throw e;
        }
    }

    /**
     * Runs one batch of sub-tasks under the run's concurrency bound and
     * cancellation signal. A raised signal fails the stage as non-retryable,
     * whether or not some tasks succeeded.
     */
    protected <P, R> Map<String, TaskResult<R>> fanOut(PipelineContext context, List<TaskRequest<P>> tasks,
                                                       TaskHandler<P, R> handler) {
        CancellationSignal cancellation = context.getCancellation();
        Map<String, TaskResult<R>> results;
        try {
            results = components.coordinator().runAll(tasks, handler, context.getConcurrency(), cancellation);
        } catch (PipelineException e) {
            if (!cancellation.isCancelled()) throw e;
            throw cancelled(cancellation, e);
        }
        if (cancellation.isCancelled()) {
            throw cancelled(cancellation, null);
        }
        return results;
    }

    private static PipelineException cancelled(CancellationSignal cancellation, PipelineException aggregate) {
        Throwable cause = cancellation.cause().orElse(aggregate);
        PipelineException failure = PipelineException.runCancelled(
                cancellation.reason().orElse("cancelled"), cause);
        if (aggregate != null && aggregate != cause) failure.addSuppressed(aggregate);
        return failure;
    }

    // ------------------------------------------------------------------
    // Shared stages
    // ------------------------------------------------------------------

    private void ingestStage(PipelineContext context) throws Exception {
        context.setOutput(resolveOutput(context.getOutput()));
        ingest(context);
        log.info("Ingested {} unit(s) from {}", context.getUnits().size(), context.getInput());
    }

    private void merge(PipelineContext context) {
        context.setPages(components.assembler().assemble(context.getPages(), context.getAssets()));
    }

    private void finalizeDocument(PipelineContext context) {
        context.setDocument(components.renderer().render(context.getPages(), context.getSettings(), context.getOutput()));
    }

    private Path resolveOutput(Path requested) {
        Path root = policies.outputRoot();
        if (requested == null) {
            throw PipelineException.invalidInput("No output path given", Map.of("outputRoot", root.toString()));
        }
        Path resolved = (requested.isAbsolute() ? requested : root.resolve(requested)).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw PipelineException.invalidInput(
                    "Output path %s is outside the output root %s".formatted(resolved, root),
                    Map.of("output", requested.toString(), "outputRoot", root.toString()));
        }
        return resolved;
    }

    private void discardStaging(AssetStore staging) {
        try {
            staging.discard();
        } catch (UncheckedIOException e) {
            log.warn("Could not fully remove staging area {}: {}", staging.root(), e.getMessage());
        }
    }
}
