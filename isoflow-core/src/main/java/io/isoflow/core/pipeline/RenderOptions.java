package io.isoflow.core.pipeline;

import io.isoflow.core.model.Flowchart;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.FallbackPolicy;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.QualityMode;
import io.isoflow.core.render.RenderRequest;
import java.util.List;
import java.util.Objects;

/// Render settings applied to every flowchart of a pipeline run.
///
/// @param preferredBackend explicitly requested backend, null for auto
/// @param fallbackPolicy backend priority, not null
/// @param qualityMode whether degrading to a draft backend is allowed, not null
/// @param format requested artifact format, not null
public record RenderOptions(
        BackendId preferredBackend,
        FallbackPolicy fallbackPolicy,
        QualityMode qualityMode,
        OutputFormat format) {

    public RenderOptions {
        Objects.requireNonNull(fallbackPolicy, "fallbackPolicy must not be null");
        Objects.requireNonNull(qualityMode, "qualityMode must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }

    /// Returns auto backend selection over the default policy, draft allowed, SVG.
    public static RenderOptions defaults() {
        return new RenderOptions(
                null, FallbackPolicy.defaults(), QualityMode.DRAFT_ALLOWED, OutputFormat.SVG);
    }

    public RenderOptions withPreferredBackend(BackendId backend) {
        return new RenderOptions(backend, fallbackPolicy, qualityMode, format);
    }

    public RenderOptions withQualityMode(QualityMode mode) {
        return new RenderOptions(preferredBackend, fallbackPolicy, mode, format);
    }

    public RenderOptions withFormat(OutputFormat outputFormat) {
        return new RenderOptions(preferredBackend, fallbackPolicy, qualityMode, outputFormat);
    }

    /// Builds the dispatcher request for one flowchart.
    public RenderRequest toRequest(Flowchart flowchart, List<String> warnings) {
        return RenderRequest.builder(flowchart)
                .preferredBackend(preferredBackend)
                .fallbackPolicy(fallbackPolicy)
                .qualityMode(qualityMode)
                .format(format)
                .warnings(warnings)
                .build();
    }
}
