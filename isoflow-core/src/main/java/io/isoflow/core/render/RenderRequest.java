package io.isoflow.core.render;

import io.isoflow.core.model.Flowchart;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Input to {@link RenderDispatcher#dispatch(RenderRequest)}.
///
/// A request without a preferred backend is an "auto" request: the dispatcher renders
/// with the first available backend of the fallback policy.
public final class RenderRequest {

    private final Flowchart flowchart;
    private final BackendId preferredBackend;
    private final FallbackPolicy fallbackPolicy;
    private final QualityMode qualityMode;
    private final OutputFormat format;
    private final List<String> warnings;

    private RenderRequest(Builder builder) {
        this.flowchart = Objects.requireNonNull(builder.flowchart, "Flowchart required");
        this.preferredBackend = builder.preferredBackend;
        this.fallbackPolicy = builder.fallbackPolicy;
        this.qualityMode = builder.qualityMode;
        this.format = builder.format;
        this.warnings = List.copyOf(builder.warnings);
    }

    public static Builder builder(Flowchart flowchart) {
        return new Builder().flowchart(flowchart);
    }

    public Flowchart getFlowchart() {
        return flowchart;
    }

    /// Returns the explicitly requested backend, empty for auto.
    public Optional<BackendId> getPreferredBackend() {
        return Optional.ofNullable(preferredBackend);
    }

    public boolean isAuto() {
        return preferredBackend == null;
    }

    public FallbackPolicy getFallbackPolicy() {
        return fallbackPolicy;
    }

    public QualityMode getQualityMode() {
        return qualityMode;
    }

    public OutputFormat getFormat() {
        return format;
    }

    /// Returns warnings raised before rendering, such as validation warnings. They are
    /// carried into the {@link RenderResult}.
    public List<String> getWarnings() {
        return warnings;
    }

    public static final class Builder {
        private Flowchart flowchart;
        private BackendId preferredBackend;
        private FallbackPolicy fallbackPolicy = FallbackPolicy.defaults();
        private QualityMode qualityMode = QualityMode.DRAFT_ALLOWED;
        private OutputFormat format = OutputFormat.SVG;
        private final List<String> warnings = new ArrayList<>();

        private Builder() {}

        public Builder flowchart(Flowchart flowchart) {
            this.flowchart = flowchart;
            return this;
        }

        /// Sets the preferred backend; null means auto.
        public Builder preferredBackend(BackendId preferredBackend) {
            this.preferredBackend = preferredBackend;
            return this;
        }

        public Builder fallbackPolicy(FallbackPolicy fallbackPolicy) {
            this.fallbackPolicy =
                    Objects.requireNonNull(fallbackPolicy, "fallbackPolicy must not be null");
            return this;
        }

        public Builder qualityMode(QualityMode qualityMode) {
            this.qualityMode = Objects.requireNonNull(qualityMode, "qualityMode must not be null");
            return this;
        }

        public Builder format(OutputFormat format) {
            this.format = Objects.requireNonNull(format, "format must not be null");
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public RenderRequest build() {
            return new RenderRequest(this);
        }
    }
}
