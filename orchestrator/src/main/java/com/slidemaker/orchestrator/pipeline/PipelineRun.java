package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.error.ErrorRecord;
import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.model.PageArtifact;
import com.slidemaker.orchestrator.render.RenderedDocument;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one pipeline execution, and its progress while running.
 *
 * Transitions:
 *   RUNNING → COMPLETED   every stage succeeded, a document exists
 *   RUNNING → FAILED      a stage gave up; {@link #getStage()} names it
 *
 * Degraded ids list sub-tasks that failed without failing the run, prefixed
 * with the stage that dropped them ({@code describe:page-2}).
 */
public class PipelineRun {

    private final String          runId;
    private final PipelineVariant variant;
    private final Instant         startedAt = Instant.now();

    private PipelineState      state = PipelineState.RUNNING;
    private PipelineStage      stage = PipelineStage.INGEST;
    private Instant            finishedAt;
    private RenderedDocument   document;
    private List<PageArtifact> pages    = List.of();
    private List<String>       degraded = List.of();
    private PipelineException  failure;

    public PipelineRun(String runId, PipelineVariant variant) {
        this.runId   = runId;
        this.variant = variant;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    void enter(PipelineStage next) {
        requireRunning();
        this.stage = next;
    }

    void complete(RenderedDocument document, List<PageArtifact> pages, List<String> degraded) {
        requireRunning();
        this.state      = PipelineState.COMPLETED;
        this.document   = document;
        this.pages      = List.copyOf(pages);
        this.degraded   = List.copyOf(degraded);
        this.finishedAt = Instant.now();
    }

    void fail(PipelineException failure, List<String> degraded) {
        requireRunning();
        this.state      = PipelineState.FAILED;
        this.failure    = failure;
        this.degraded   = List.copyOf(degraded);
        this.finishedAt = Instant.now();
    }

    private void requireRunning() {
        if (state != PipelineState.RUNNING) {
            throw new IllegalStateException("Run " + runId + " already " + state);
        }
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public String          getRunId()     { return runId; }
    public PipelineVariant getVariant()   { return variant; }
    public PipelineState   getState()     { return state; }
    public PipelineStage   getStage()     { return stage; }
    public Instant         getStartedAt() { return startedAt; }
    public List<PageArtifact> getPages()  { return pages; }
    public List<String>    getDegraded()  { return degraded; }

    public Optional<Instant> getFinishedAt()        { return Optional.ofNullable(finishedAt); }
    public Optional<RenderedDocument> getDocument() { return Optional.ofNullable(document); }
    public Optional<PipelineException> getFailure() { return Optional.ofNullable(failure); }

    public Optional<ErrorRecord> getErrorRecord() {
        return getFailure().flatMap(PipelineException::errorRecord);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt == null ? Instant.now() : finishedAt);
    }

    public boolean isCompleted() {
        return state == PipelineState.COMPLETED;
    }

    /** The rendered document, or the failure that prevented it. */
    public RenderedDocument documentOrThrow() {
        if (state == PipelineState.COMPLETED) return document;
        if (failure != null) throw failure;
        throw new IllegalStateException("Run " + runId + " is still " + state);
    }
}
