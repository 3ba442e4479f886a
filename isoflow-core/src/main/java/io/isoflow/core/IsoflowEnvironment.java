package io.isoflow.core;

import io.isoflow.core.ingest.DocumentTextExtractor;
import io.isoflow.core.job.RenderJobManager;
import io.isoflow.core.pipeline.BatchProcessor;
import io.isoflow.core.pipeline.FlowchartPipeline;
import io.isoflow.core.pipeline.RenderOptions;
import io.isoflow.core.render.BackendRegistry;
import io.isoflow.core.render.CapabilityDetector;
import io.isoflow.core.render.RenderDispatcher;
import java.util.concurrent.ExecutorService;

/// Container holding the wired isoflow components.
///
/// Implements {@link AutoCloseable}: closing cancels unfinished render jobs and shuts
/// the worker pool down.
///
/// @implNote All fields are final and set at construction. The contained components
/// carry their own thread-safety guarantees.
///
/// @apiNote Create instances via {@link IsoflowFactory} rather than directly.
public final class IsoflowEnvironment implements AutoCloseable {

    private final IsoflowConfig config;
    private final FlowchartPipeline pipeline;
    private final BatchProcessor batchProcessor;
    private final RenderDispatcher renderDispatcher;
    private final BackendRegistry backendRegistry;
    private final CapabilityDetector capabilityDetector;
    private final RenderJobManager jobManager;
    private final DocumentTextExtractor documentExtractor;
    private final ExecutorService executorService;

    public IsoflowEnvironment(
            IsoflowConfig config,
            FlowchartPipeline pipeline,
            BatchProcessor batchProcessor,
            RenderDispatcher renderDispatcher,
            BackendRegistry backendRegistry,
            CapabilityDetector capabilityDetector,
            RenderJobManager jobManager,
            DocumentTextExtractor documentExtractor,
            ExecutorService executorService) {
        this.config = config;
        this.pipeline = pipeline;
        this.batchProcessor = batchProcessor;
        this.renderDispatcher = renderDispatcher;
        this.backendRegistry = backendRegistry;
        this.capabilityDetector = capabilityDetector;
        this.jobManager = jobManager;
        this.documentExtractor = documentExtractor;
        this.executorService = executorService;
    }

    public IsoflowConfig getConfig() {
        return config;
    }

    public FlowchartPipeline getPipeline() {
        return pipeline;
    }

    public BatchProcessor getBatchProcessor() {
        return batchProcessor;
    }

    public RenderDispatcher getRenderDispatcher() {
        return renderDispatcher;
    }

    public BackendRegistry getBackendRegistry() {
        return backendRegistry;
    }

    public CapabilityDetector getCapabilityDetector() {
        return capabilityDetector;
    }

    public RenderJobManager getJobManager() {
        return jobManager;
    }

    public DocumentTextExtractor getDocumentExtractor() {
        return documentExtractor;
    }

    /// Returns render options built from the configured policy, quality mode and format,
    /// with automatic backend selection.
    public RenderOptions defaultRenderOptions() {
        return new RenderOptions(
                null, config.getFallbackPolicy(), config.getQualityMode(), config.getOutputFormat());
    }

    /// Cancels unfinished render jobs and shuts the worker pool down.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not block.
    @Override
    public void close() {
        jobManager.cancelAll();
        executorService.shutdown();
    }
}
