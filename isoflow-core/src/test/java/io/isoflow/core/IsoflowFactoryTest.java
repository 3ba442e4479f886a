package io.isoflow.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.isoflow.core.extract.HeuristicStepExtractor;
import io.isoflow.core.extract.StepExtractor;
import io.isoflow.core.job.JobSnapshot;
import io.isoflow.core.job.JobStatus;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.pipeline.BatchOutcome;
import io.isoflow.core.pipeline.RenderOptions;
import io.isoflow.core.render.BackendAdapter;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.QualityMode;
import io.isoflow.core.render.RenderRequest;
import io.isoflow.core.render.SystemCapabilityDetector;
import io.isoflow.core.render.backend.GraphvizBackend;
import io.isoflow.core.render.backend.HtmlFallbackBackend;
import io.isoflow.core.render.backend.KrokiBackend;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class IsoflowFactoryTest {

    private static final String DOCUMENT =
            """
            ## Approval Procedure

            1. Receive the request
            2. Review the request
            3. Archive the request
            """;

    @Test
    void shouldRegisterEveryBuiltInBackend() {
        var registry = IsoflowFactory.createBackendRegistry(new IsoflowConfig().getEngines());

        assertThat(registry.registered()).containsExactlyInAnyOrder(BackendId.values());
        assertThat(registry.get(BackendId.GRAPHVIZ)).get().isInstanceOf(GraphvizBackend.class);
        assertThat(registry.get(BackendId.KROKI)).get().isInstanceOf(KrokiBackend.class);
    }

    @Test
    void shouldUseConfiguredRenderOptions() {
        IsoflowConfig config =
                IsoflowConfig.builder()
                        .qualityMode(QualityMode.CERTIFIED_ONLY)
                        .outputFormat(OutputFormat.PNG)
                        .build();

        try (IsoflowEnvironment env =
                IsoflowFactory.builder()
                        .config(config)
                        .capabilityDetector(() -> EnumSet.of(BackendId.HTML))
                        .build()) {
            RenderOptions options = env.defaultRenderOptions();

            assertThat(options.preferredBackend()).isNull();
            assertThat(options.qualityMode()).isEqualTo(QualityMode.CERTIFIED_ONLY);
            assertThat(options.format()).isEqualTo(OutputFormat.PNG);
            assertThat(env.getConfig()).isSameAs(config);
        }
    }

    @Test
    void shouldProcessDocumentEndToEnd() throws Exception {
        try (IsoflowEnvironment env =
                IsoflowFactory.builder()
                        .capabilityDetector(() -> EnumSet.of(BackendId.HTML))
                        .build()) {
            List<BatchOutcome> outcomes =
                    env.getBatchProcessor().process(DOCUMENT, env.defaultRenderOptions());

            assertThat(outcomes)
                    .singleElement()
                    .isInstanceOfSatisfying(
                            BatchOutcome.Processed.class,
                            p ->
                                    assertThat(p.result().getRender().orElseThrow().format())
                                            .isEqualTo(OutputFormat.HTML));
        }
    }

    @Test
    void shouldWireCustomExtractorAndAdapter() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        StepExtractor heuristic = new HeuristicStepExtractor();
        StepExtractor counting =
                text -> {
                    calls.incrementAndGet();
                    return heuristic.extract(text);
                };
        BackendAdapter html = new HtmlFallbackBackend();

        try (IsoflowEnvironment env =
                IsoflowFactory.builder()
                        .stepExtractor(counting)
                        .backendAdapter(html)
                        .capabilityDetector(() -> EnumSet.of(BackendId.HTML))
                        .build()) {
            env.getBatchProcessor().analyze(DOCUMENT);

            assertThat(calls.get()).isEqualTo(1);
            assertThat(env.getBackendRegistry().get(BackendId.HTML)).containsSame(html);
        }
    }

    @Test
    void shouldCancelJobsAndShutDownPoolOnClose() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        IsoflowEnvironment env =
                IsoflowFactory.builder()
                        .executorService(executor)
                        .capabilityDetector(() -> EnumSet.of(BackendId.HTML))
                        .build();
        Flowchart flowchart = env.getPipeline().toFlowchart("1. Start\n2. Stop", "Close");
        String id = env.getJobManager().submit(RenderRequest.builder(flowchart).build());

        env.close();

        assertThat(executor.isShutdown()).isTrue();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        JobSnapshot snapshot = env.getJobManager().status(id).orElseThrow();
        assertThat(snapshot.status()).isIn(JobStatus.COMPLETED, JobStatus.CANCELLED);
    }

    @Test
    void shouldCreateDetectorWithConfiguredTtl() {
        IsoflowConfig config = IsoflowConfig.builder().capabilityTtl(Duration.ofSeconds(1)).build();

        try (IsoflowEnvironment env = IsoflowFactory.createEnvironment(config)) {
            assertThat(env.getCapabilityDetector())
                    .isInstanceOf(SystemCapabilityDetector.class);
            assertThat(env.getDocumentExtractor()).isNotNull();
        }
    }
}
