package io.isoflow.core;

import io.isoflow.core.build.GraphBuilder;
import io.isoflow.core.detect.WorkflowBoundaryDetector;
import io.isoflow.core.extract.HeuristicStepExtractor;
import io.isoflow.core.extract.StepExtractor;
import io.isoflow.core.ingest.DocumentTextExtractor;
import io.isoflow.core.ingest.PlainTextDocumentExtractor;
import io.isoflow.core.job.RenderJobManager;
import io.isoflow.core.pipeline.BatchProcessor;
import io.isoflow.core.pipeline.FlowchartPipeline;
import io.isoflow.core.quality.QualityGate;
import io.isoflow.core.render.ArtifactIntegrityChecker;
import io.isoflow.core.render.BackendAdapter;
import io.isoflow.core.render.BackendRegistry;
import io.isoflow.core.render.CapabilityDetector;
import io.isoflow.core.render.DefaultBackendRegistry;
import io.isoflow.core.render.RenderDispatcher;
import io.isoflow.core.render.SystemCapabilityDetector;
import io.isoflow.core.render.backend.D2Backend;
import io.isoflow.core.render.backend.EngineLocations;
import io.isoflow.core.render.backend.GraphvizBackend;
import io.isoflow.core.render.backend.KrokiBackend;
import io.isoflow.core.render.backend.MermaidCliBackend;
import io.isoflow.core.render.backend.ProcessRunner;
import io.isoflow.core.validate.FlowchartValidator;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Creates and wires {@link IsoflowEnvironment} instances.
///
/// ### Usage
/// {@snippet :
/// try (var env = IsoflowFactory.createEnvironment()) {
///     List<BatchOutcome> outcomes =
///             env.getBatchProcessor().process(text, env.defaultRenderOptions());
/// }
/// }
///
/// The {@link Builder} replaces individual collaborators, for example a model-backed
/// {@link StepExtractor} or a fixed {@link CapabilityDetector} in tests.
public final class IsoflowFactory {

    private IsoflowFactory() {}

    /// Creates an environment with default configuration.
    public static IsoflowEnvironment createEnvironment() {
        return createEnvironment(new IsoflowConfig());
    }

    /// Creates an environment with the given configuration and built-in collaborators.
    public static IsoflowEnvironment createEnvironment(IsoflowConfig config) {
        return builder().config(config).build();
    }

    /// Creates a registry holding every built-in adapter for the given engine locations.
    public static BackendRegistry createBackendRegistry(EngineLocations engines) {
        ProcessRunner runner = new ProcessRunner();
        BackendRegistry registry = new DefaultBackendRegistry();
        registry.register(new GraphvizBackend(engines.dot(), runner));
        registry.register(new D2Backend(engines.d2(), runner));
        registry.register(new MermaidCliBackend(engines.mmdc(), runner));
        registry.register(new KrokiBackend(engines.kroki()));
        return registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link IsoflowEnvironment}.
    ///
    /// Unset collaborators are created from the configuration.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static class Builder {
        private IsoflowConfig config = new IsoflowConfig();
        private StepExtractor stepExtractor;
        private CapabilityDetector capabilityDetector;
        private BackendRegistry backendRegistry;
        private final List<BackendAdapter> extraAdapters = new ArrayList<>();
        private DocumentTextExtractor documentExtractor;
        private ExecutorService executorService;

        private Builder() {}

        public Builder config(IsoflowConfig config) {
            this.config = config;
            return this;
        }

        public Builder stepExtractor(StepExtractor stepExtractor) {
            this.stepExtractor = stepExtractor;
            return this;
        }

        public Builder capabilityDetector(CapabilityDetector capabilityDetector) {
            this.capabilityDetector = capabilityDetector;
            return this;
        }

        public Builder backendRegistry(BackendRegistry backendRegistry) {
            this.backendRegistry = backendRegistry;
            return this;
        }

        /// Registers an adapter on top of the registry, replacing a built-in one with the
        /// same id.
        public Builder backendAdapter(BackendAdapter adapter) {
            this.extraAdapters.add(adapter);
            return this;
        }

        public Builder documentExtractor(DocumentTextExtractor documentExtractor) {
            this.documentExtractor = documentExtractor;
            return this;
        }

        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public IsoflowEnvironment build() {
            BackendRegistry registry =
                    backendRegistry != null
                            ? backendRegistry
                            : createBackendRegistry(config.getEngines());
            extraAdapters.forEach(registry::register);

            CapabilityDetector detector =
                    capabilityDetector != null
                            ? capabilityDetector
                            : new SystemCapabilityDetector(
                                    config.getEngines(), config.getCapabilityTtl());

            ExecutorService executor =
                    executorService != null
                            ? executorService
                            : Executors.newFixedThreadPool(config.getThreadPoolSize());

            RenderDispatcher dispatcher =
                    new RenderDispatcher(
                            registry,
                            detector,
                            new ArtifactIntegrityChecker(),
                            config.getRenderTimeout(),
                            config.isStrictArtifactChecks());

            FlowchartPipeline pipeline =
                    new FlowchartPipeline(
                            new WorkflowBoundaryDetector(config.getMinCandidateConfidence()),
                            stepExtractor != null ? stepExtractor : new HeuristicStepExtractor(),
                            new GraphBuilder(),
                            new FlowchartValidator(),
                            dispatcher,
                            new QualityGate());

            BatchProcessor batchProcessor =
                    new BatchProcessor(
                            pipeline,
                            executor,
                            config.getRenderConcurrency(),
                            config.getCandidateTimeout());

            RenderJobManager jobManager =
                    new RenderJobManager(
                            dispatcher,
                            executor,
                            config.getMaxConcurrentJobs(),
                            config.getJobTtl(),
                            Clock.systemUTC());

            return new IsoflowEnvironment(
                    config,
                    pipeline,
                    batchProcessor,
                    dispatcher,
                    registry,
                    detector,
                    jobManager,
                    documentExtractor != null
                            ? documentExtractor
                            : new PlainTextDocumentExtractor(),
                    executor);
        }
    }
}
