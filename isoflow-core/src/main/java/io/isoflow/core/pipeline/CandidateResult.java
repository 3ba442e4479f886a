package io.isoflow.core.pipeline;

import io.isoflow.core.detect.CrossReference;
import io.isoflow.core.detect.WorkflowCandidate;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.WorkflowStep;
import io.isoflow.core.quality.QualityAssessment;
import io.isoflow.core.render.RenderResult;
import io.isoflow.core.validate.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Everything the pipeline produced for one workflow candidate.
///
/// A result always carries the flowchart, its validation and its warnings. The render
/// part is present only when rendering was requested: either a {@link RenderResult} or
/// the failure that prevented one, never both.
public final class CandidateResult {

    private final WorkflowCandidate candidate;
    private final List<WorkflowStep> steps;
    private final Flowchart flowchart;
    private final ValidationResult validation;
    private final List<CrossReference> crossReferences;
    private final List<String> warnings;
    private final QualityAssessment quality;
    private final RenderResult render;
    private final Exception renderFailure;

    private CandidateResult(Builder builder) {
        this.candidate = Objects.requireNonNull(builder.candidate, "Candidate required");
        this.steps = List.copyOf(builder.steps);
        this.flowchart = Objects.requireNonNull(builder.flowchart, "Flowchart required");
        this.validation = Objects.requireNonNull(builder.validation, "Validation required");
        this.crossReferences = List.copyOf(builder.crossReferences);
        this.warnings = List.copyOf(builder.warnings);
        this.quality = Objects.requireNonNull(builder.quality, "Quality required");
        this.render = builder.render;
        this.renderFailure = builder.renderFailure;
        if (render != null && renderFailure != null) {
            throw new IllegalStateException("A result cannot carry both a render and a failure");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .candidate(candidate)
                .steps(steps)
                .flowchart(flowchart)
                .validation(validation)
                .crossReferences(crossReferences)
                .warnings(warnings)
                .quality(quality)
                .render(render)
                .renderFailure(renderFailure);
    }

    public WorkflowCandidate getCandidate() {
        return candidate;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public Flowchart getFlowchart() {
        return flowchart;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    public List<CrossReference> getCrossReferences() {
        return crossReferences;
    }

    /// Returns candidate, cross-reference and validation warnings, in that order.
    public List<String> getWarnings() {
        return warnings;
    }

    public QualityAssessment getQuality() {
        return quality;
    }

    public Optional<RenderResult> getRender() {
        return Optional.ofNullable(render);
    }

    /// Returns why rendering did not happen: a
    /// {@link io.isoflow.core.validate.ValidationException} or an
    /// {@link io.isoflow.core.render.AllBackendsExhaustedException}.
    public Optional<Exception> getRenderFailure() {
        return Optional.ofNullable(renderFailure);
    }

    public boolean isRendered() {
        return render != null;
    }

    @Override
    public String toString() {
        return "CandidateResult{"
                + candidate.title()
                + ", nodes="
                + flowchart.nodeCount()
                + ", valid="
                + validation.isValid()
                + ", rendered="
                + isRendered()
                + "}";
    }

    public static final class Builder {
        private WorkflowCandidate candidate;
        private List<WorkflowStep> steps = List.of();
        private Flowchart flowchart;
        private ValidationResult validation;
        private List<CrossReference> crossReferences = List.of();
        private final List<String> warnings = new ArrayList<>();
        private QualityAssessment quality;
        private RenderResult render;
        private Exception renderFailure;

        private Builder() {}

        public Builder candidate(WorkflowCandidate candidate) {
            this.candidate = candidate;
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = steps;
            return this;
        }

        public Builder flowchart(Flowchart flowchart) {
            this.flowchart = flowchart;
            return this;
        }

        public Builder validation(ValidationResult validation) {
            this.validation = validation;
            return this;
        }

        public Builder crossReferences(List<CrossReference> crossReferences) {
            this.crossReferences = crossReferences;
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.clear();
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder quality(QualityAssessment quality) {
            this.quality = quality;
            return this;
        }

        public Builder render(RenderResult render) {
            this.render = render;
            return this;
        }

        public Builder renderFailure(Exception renderFailure) {
            this.renderFailure = renderFailure;
            return this;
        }

        public CandidateResult build() {
            return new CandidateResult(this);
        }
    }
}
