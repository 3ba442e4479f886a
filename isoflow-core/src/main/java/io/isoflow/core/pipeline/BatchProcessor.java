package io.isoflow.core.pipeline;

import io.isoflow.core.detect.CrossReferenceResolver;
import io.isoflow.core.detect.WorkflowCandidate;
import io.isoflow.core.extract.ExtractionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Processes every workflow of a document in parallel.
///
/// Each candidate runs its full pipeline as one task on the shared executor. Rendering
/// is gated by a fair {@link Semaphore}, so at most `renderConcurrency` backends run at
/// once however large the pool is. Outcomes come back in document order.
///
/// ### Failure handling
/// - A candidate without steps becomes {@link BatchOutcome.Failed} with its
///   {@link ExtractionException}
/// - A candidate still running `candidateTimeout` after its submission is cancelled,
///   which kills a running engine process, and becomes {@link BatchOutcome.Failed} with
///   a {@link TimeoutException}. Every deadline counts from submission, not from the
///   moment the previous outcome was collected.
/// - Other candidates are unaffected by either
///
/// @implNote Thread-safe. The executor is owned by the caller and not shut down here.
public class BatchProcessor {

    private static final Logger logger = Logger.getLogger(BatchProcessor.class.getName());

    public static final int DEFAULT_RENDER_CONCURRENCY = 3;
    public static final Duration DEFAULT_CANDIDATE_TIMEOUT = Duration.ofMinutes(5);

    private final FlowchartPipeline pipeline;
    private final ExecutorService executorService;
    private final Semaphore renderPermits;
    private final Duration candidateTimeout;

    public BatchProcessor(FlowchartPipeline pipeline, ExecutorService executorService) {
        this(pipeline, executorService, DEFAULT_RENDER_CONCURRENCY, DEFAULT_CANDIDATE_TIMEOUT);
    }

    public BatchProcessor(
            FlowchartPipeline pipeline,
            ExecutorService executorService,
            int renderConcurrency,
            Duration candidateTimeout) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        if (renderConcurrency < 1) {
            throw new IllegalArgumentException(
                    "renderConcurrency must be positive: " + renderConcurrency);
        }
        this.renderPermits = new Semaphore(renderConcurrency, true);
        this.candidateTimeout =
                Objects.requireNonNull(candidateTimeout, "candidateTimeout must not be null");
    }

    /// Detects, extracts, builds and validates every workflow, without rendering.
    ///
    /// @param document document text, not null
    /// @return one outcome per candidate in document order, never null
    /// @throws InterruptedException if interrupted while waiting; pending tasks are cancelled
    public List<BatchOutcome> analyze(String document) throws InterruptedException {
        return run(document, null);
    }

    /// Processes and renders every workflow.
    ///
    /// @param document document text, not null
    /// @param options render settings, not null
    /// @return one outcome per candidate in document order, never null
    /// @throws InterruptedException if interrupted while waiting; pending tasks are cancelled
    public List<BatchOutcome> process(String document, RenderOptions options)
            throws InterruptedException {
        Objects.requireNonNull(options, "options must not be null");
        return run(document, options);
    }

    /// Returns the number of renders that may start right now.
    public int availableRenderPermits() {
        return renderPermits.availablePermits();
    }

    private List<BatchOutcome> run(String document, RenderOptions options)
            throws InterruptedException {
        Objects.requireNonNull(document, "document must not be null");
        List<WorkflowCandidate> candidates = pipeline.detect(document);
        CrossReferenceResolver resolver = new CrossReferenceResolver(candidates);
        logger.info("Processing " + candidates.size() + " workflow(s)");

        List<Future<BatchOutcome>> futures = new ArrayList<>();
        long[] deadlines = new long[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            WorkflowCandidate candidate = candidates.get(i);
            deadlines[i] = System.nanoTime() + candidateTimeout.toNanos();
            futures.add(executorService.submit(() -> processOne(candidate, resolver, options)));
        }

        List<BatchOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Future<BatchOutcome> future = futures.get(i);
            WorkflowCandidate candidate = candidates.get(i);
            try {
                long remaining = Math.max(0L, deadlines[i] - System.nanoTime());
                outcomes.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                logger.warning(
                        "Workflow timed out after "
                                + candidateTimeout.toSeconds()
                                + "s: "
                                + candidate.title());
                future.cancel(true);
                outcomes.add(
                        new BatchOutcome.Failed(
                                candidate,
                                new TimeoutException(
                                        "Timed out after " + candidateTimeout.toSeconds() + "s")));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                logger.warning("Workflow '" + candidate.title() + "' failed: " + cause);
                outcomes.add(
                        new BatchOutcome.Failed(
                                candidate, cause instanceof Exception ex ? ex : e));
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw e;
            }
        }
        return outcomes;
    }

    private BatchOutcome processOne(
            WorkflowCandidate candidate, CrossReferenceResolver resolver, RenderOptions options)
            throws InterruptedException {
        CandidateResult analysed;
        try {
            analysed = pipeline.analyze(candidate, resolver);
        } catch (ExtractionException e) {
            logger.warning(e.getMessage());
            return new BatchOutcome.Failed(candidate, e);
        }
        if (options == null) {
            return new BatchOutcome.Processed(analysed);
        }

        renderPermits.acquire();
        try {
            return new BatchOutcome.Processed(pipeline.render(analysed, options));
        } finally {
            renderPermits.release();
        }
    }
}
