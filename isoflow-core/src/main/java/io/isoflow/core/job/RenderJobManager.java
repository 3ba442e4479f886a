package io.isoflow.core.job;

import io.isoflow.core.render.AllBackendsExhaustedException;
import io.isoflow.core.render.RenderDispatcher;
import io.isoflow.core.render.RenderRequest;
import io.isoflow.core.render.RenderResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs renders in the background, tracked by opaque job ids.
///
/// ### Contracts
/// - {@link #submit(RenderRequest)} returns at once with a new id
/// - {@link #status(String)} never blocks
/// - {@link #cancel(String)} interrupts the worker; a running engine process is killed
///   by {@link io.isoflow.core.render.backend.ProcessRunner} rather than left to finish
/// - At most `maxConcurrent` jobs render at once; the rest wait as PENDING
/// - Finished jobs are forgotten `ttl` after their last status change, on the next
///   access or on {@link #evictExpired()}
///
/// @implNote Thread-safe. Status changes are made under the job's own monitor, which is
/// never held while rendering.
public class RenderJobManager {

    private static final Logger logger = Logger.getLogger(RenderJobManager.class.getName());

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);
    public static final int DEFAULT_MAX_CONCURRENT = 3;

    private final RenderDispatcher dispatcher;
    private final ExecutorService executorService;
    private final Semaphore slots;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    public RenderJobManager(RenderDispatcher dispatcher, ExecutorService executorService) {
        this(dispatcher, executorService, DEFAULT_MAX_CONCURRENT, DEFAULT_TTL, Clock.systemUTC());
    }

    public RenderJobManager(
            RenderDispatcher dispatcher,
            ExecutorService executorService,
            int maxConcurrent,
            Duration ttl,
            Clock clock) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        this.slots = new Semaphore(maxConcurrent, true);
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Queues a render.
    ///
    /// @param request the render request, not null
    /// @return the new job id, never null
    public String submit(RenderRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        evictExpired();

        String id = UUID.randomUUID().toString();
        Job job = new Job(id, clock.instant());
        jobs.put(id, job);
        job.future = executorService.submit(() -> run(job, request));
        logger.info(
                "Render job " + id + " submitted for '" + request.getFlowchart().getTitle() + "'");
        return id;
    }

    /// Returns the current view of a job.
    ///
    /// @param id job id, not null
    /// @return the snapshot, or empty for an unknown or evicted id
    public Optional<JobSnapshot> status(String id) {
        Objects.requireNonNull(id, "id must not be null");
        evictExpired();
        Job job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.of(job.snapshot());
    }

    /// Cancels a job that has not finished.
    ///
    /// @param id job id, not null
    /// @return true if the job was pending or running and is now CANCELLED
    public boolean cancel(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Job job = jobs.get(id);
        if (job == null) {
            return false;
        }
        if (!job.finish(JobStatus.CANCELLED, "Cancelled", null, null, clock.instant())) {
            return false;
        }
        Future<?> future = job.future;
        if (future != null) {
            future.cancel(true);
        }
        logger.info("Render job " + id + " cancelled");
        return true;
    }

    /// Cancels every job that has not finished.
    ///
    /// @return the number of jobs cancelled
    public int cancelAll() {
        int cancelled = 0;
        for (String id : jobs.keySet()) {
            if (cancel(id)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /// Forgets finished jobs whose TTL has passed.
    ///
    /// @return the number of jobs removed
    public int evictExpired() {
        Instant now = clock.instant();
        int before = jobs.size();
        jobs.values().removeIf(job -> job.isExpired(now, ttl));
        int evicted = before - jobs.size();
        if (evicted > 0) {
            logger.fine("Evicted " + evicted + " expired render job(s)");
        }
        return evicted;
    }

    /// Returns the number of tracked jobs, finished ones included.
    public int size() {
        return jobs.size();
    }

    private void run(Job job, RenderRequest request) {
        try {
            job.progress("Waiting for a render slot", clock.instant());
            slots.acquire();
            try {
                if (!job.start(clock.instant())) {
                    return;
                }
                RenderResult result = dispatcher.dispatch(request);
                job.finish(
                        JobStatus.COMPLETED,
                        "Rendered with " + result.resolvedBackend().getName(),
                        result,
                        null,
                        clock.instant());
            } finally {
                slots.release();
            }
        } catch (AllBackendsExhaustedException e) {
            job.finish(JobStatus.FAILED, "Render failed", null, e.getMessage(), clock.instant());
        } catch (InterruptedException e) {
            job.finish(JobStatus.CANCELLED, "Cancelled", null, null, clock.instant());
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Render job " + job.id + " crashed", e);
            job.finish(JobStatus.FAILED, "Render failed", null, e.toString(), clock.instant());
        }
    }

    // -- Job state -----------------------------------------------------------

    private static final class Job {
        private final String id;
        private final Instant createdAt;
        private JobStatus status = JobStatus.PENDING;
        private String progress = "Queued";
        private RenderResult result;
        private String error;
        private Instant updatedAt;
        private volatile Future<?> future;

        Job(String id, Instant createdAt) {
            this.id = id;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        synchronized void progress(String message, Instant now) {
            if (!status.isTerminal()) {
                progress = message;
                updatedAt = now;
            }
        }

        synchronized boolean start(Instant now) {
            if (status != JobStatus.PENDING) {
                return false;
            }
            status = JobStatus.RUNNING;
            progress = "Rendering";
            updatedAt = now;
            return true;
        }

        /// Moves to a terminal status unless one was already reached.
        synchronized boolean finish(
                JobStatus terminal, String message, RenderResult value, String failure, Instant now) {
            if (status.isTerminal()) {
                return false;
            }
            status = terminal;
            progress = message;
            result = value;
            error = failure;
            updatedAt = now;
            return true;
        }

        synchronized boolean isExpired(Instant now, Duration ttl) {
            return status.isTerminal() && !now.isBefore(updatedAt.plus(ttl));
        }

        synchronized JobSnapshot snapshot() {
            return new JobSnapshot(id, status, progress, result, error, createdAt, updatedAt);
        }
    }
}
