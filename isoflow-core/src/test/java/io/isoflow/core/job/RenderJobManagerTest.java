package io.isoflow.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.isoflow.core.model.Connection;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import io.isoflow.core.render.BackendAdapter;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.DefaultBackendRegistry;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.QualityMode;
import io.isoflow.core.render.RenderDispatcher;
import io.isoflow.core.render.RenderRequest;
import io.isoflow.core.render.RenderedArtifact;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RenderJobManagerTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private ExecutorService executor;
    private MutableClock clock;
    private DefaultBackendRegistry registry;
    private Flowchart flowchart;

    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicInteger interrupted = new AtomicInteger();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        registry = new DefaultBackendRegistry();
        registry.register(blockingGraphviz());
        flowchart = new Flowchart("Job").addNode(Node.start()).addNode(Node.end());
        flowchart.addConnection(Connection.sequential(Node.START_ID, Node.END_ID));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /// Graphviz adapter that blocks until interrupted.
    private BackendAdapter blockingGraphviz() {
        return new BackendAdapter() {
            @Override
            public BackendId id() {
                return BackendId.GRAPHVIZ;
            }

            @Override
            public Set<OutputFormat> supportedFormats() {
                return EnumSet.of(OutputFormat.SVG);
            }

            @Override
            public RenderedArtifact render(
                    Flowchart flowchart, OutputFormat format, Duration timeout)
                    throws InterruptedException {
                started.countDown();
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    interrupted.incrementAndGet();
                    throw e;
                }
                return new RenderedArtifact("<svg/>".getBytes(StandardCharsets.UTF_8), format);
            }
        };
    }

    private RenderJobManager manager(Set<BackendId> available, int maxConcurrent) {
        RenderDispatcher dispatcher = new RenderDispatcher(registry, () -> available);
        return new RenderJobManager(dispatcher, executor, maxConcurrent, TTL, clock);
    }

    private RenderRequest htmlRequest() {
        return RenderRequest.builder(flowchart).build();
    }

    private RenderRequest graphvizRequest() {
        return RenderRequest.builder(flowchart).preferredBackend(BackendId.GRAPHVIZ).build();
    }

    private static JobSnapshot awaitStatus(RenderJobManager manager, String id, JobStatus status)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            JobSnapshot snapshot = manager.status(id).orElseThrow();
            if (snapshot.status() == status) {
                return snapshot;
            }
            Thread.sleep(10);
        }
        throw new AssertionError(
                "Job " + id + " did not reach " + status + ": " + manager.status(id));
    }

    @Nested
    class Lifecycle {

        @Test
        void shouldCompleteWithResult() throws Exception {
            RenderJobManager manager = manager(EnumSet.of(BackendId.HTML), 2);

            String id = manager.submit(htmlRequest());
            JobSnapshot snapshot = awaitStatus(manager, id, JobStatus.COMPLETED);

            assertThat(snapshot.getResult()).get()
                    .satisfies(r -> assertThat(r.resolvedBackend()).isEqualTo(BackendId.HTML));
            assertThat(snapshot.progress()).isEqualTo("Rendered with html");
            assertThat(snapshot.getError()).isEmpty();
            assertThat(snapshot.createdAt()).isEqualTo(clock.instant());
        }

        @Test
        void shouldFailWhenChainIsExhausted() throws Exception {
            RenderJobManager manager = manager(EnumSet.of(BackendId.HTML), 2);

            String id =
                    manager.submit(
                            RenderRequest.builder(flowchart)
                                    .qualityMode(QualityMode.CERTIFIED_ONLY)
                                    .build());
            JobSnapshot snapshot = awaitStatus(manager, id, JobStatus.FAILED);

            assertThat(snapshot.getResult()).isEmpty();
            assertThat(snapshot.getError()).isPresent();
        }

        @Test
        void shouldGiveEveryJobItsOwnId() {
            RenderJobManager manager = manager(EnumSet.of(BackendId.HTML), 2);

            assertThat(manager.submit(htmlRequest())).isNotEqualTo(manager.submit(htmlRequest()));
            assertThat(manager.size()).isEqualTo(2);
        }

        @Test
        void shouldReturnEmptyForUnknownJob() {
            RenderJobManager manager = manager(EnumSet.of(BackendId.HTML), 2);

            assertThat(manager.status("missing")).isEmpty();
            assertThat(manager.cancel("missing")).isFalse();
        }

        @Test
        void shouldRejectNonPositiveConcurrency() {
            assertThatThrownBy(() -> manager(EnumSet.of(BackendId.HTML), 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Cancellation {

        @Test
        void shouldInterruptRunningRender() throws Exception {
            RenderJobManager manager = manager(EnumSet.allOf(BackendId.class), 2);

            String id = manager.submit(graphvizRequest());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(manager.status(id).orElseThrow().status()).isEqualTo(JobStatus.RUNNING);

            assertThat(manager.cancel(id)).isTrue();

            assertThat(manager.status(id).orElseThrow().status()).isEqualTo(JobStatus.CANCELLED);
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            assertThat(interrupted.get()).isEqualTo(1);
            assertThat(manager.status(id).orElseThrow().status()).isEqualTo(JobStatus.CANCELLED);
        }

        @Test
        void shouldNotCancelFinishedJob() throws Exception {
            RenderJobManager manager = manager(EnumSet.of(BackendId.HTML), 2);
            String id = manager.submit(htmlRequest());
            awaitStatus(manager, id, JobStatus.COMPLETED);

            assertThat(manager.cancel(id)).isFalse();
            assertThat(manager.status(id).orElseThrow().status()).isEqualTo(JobStatus.COMPLETED);
        }

        @Test
        void shouldQueueBeyondConcurrencyLimit() throws Exception {
            RenderJobManager manager = manager(EnumSet.allOf(BackendId.class), 1);

            String running = manager.submit(graphvizRequest());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            String queued = manager.submit(graphvizRequest());
            Thread.sleep(100);

            JobSnapshot waiting = manager.status(queued).orElseThrow();
            assertThat(waiting.status()).isEqualTo(JobStatus.PENDING);
            assertThat(waiting.progress()).isEqualTo("Waiting for a render slot");

            assertThat(manager.cancelAll()).isEqualTo(2);
            assertThat(manager.status(running).orElseThrow().status())
                    .isEqualTo(JobStatus.CANCELLED);
            assertThat(manager.status(queued).orElseThrow().status())
                    .isEqualTo(JobStatus.CANCELLED);
        }
    }

    @Nested
    class Expiry {

        @Test
        void shouldForgetFinishedJobAfterTtl() throws Exception {
            RenderJobManager manager = manager(EnumSet.of(BackendId.HTML), 2);
            String id = manager.submit(htmlRequest());
            awaitStatus(manager, id, JobStatus.COMPLETED);

            clock.advance(TTL.minusSeconds(1));
            assertThat(manager.status(id)).isPresent();

            clock.advance(Duration.ofSeconds(1));
            assertThat(manager.status(id)).isEmpty();
            assertThat(manager.size()).isZero();
        }

        @Test
        void shouldKeepRunningJobPastTtl() throws Exception {
            RenderJobManager manager = manager(EnumSet.allOf(BackendId.class), 2);
            String id = manager.submit(graphvizRequest());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            clock.advance(TTL.multipliedBy(3));

            assertThat(manager.evictExpired()).isZero();
            assertThat(manager.status(id).orElseThrow().status()).isEqualTo(JobStatus.RUNNING);
            manager.cancel(id);
        }
    }

    static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
