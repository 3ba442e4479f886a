package io.isoflow.core.quality;

import io.isoflow.core.render.FidelityTier;
import io.isoflow.core.render.RenderException;
import io.isoflow.core.render.RenderResult;
import io.isoflow.core.validate.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Grades a flowchart artifact as draft or certified.
///
/// ### Rules
/// - Detection score below the draft threshold: blocker
/// - Detection score below the certified threshold: warning
/// - Every validation error: blocker; every validation warning: warning
/// - Failed render or empty artifact: blocker
/// - Artifact from a draft-tier backend: warning, and never certified
///
/// An artifact is certified when there is no blocker, the score reaches the certified
/// threshold and, if rendered, a certified-tier backend produced it.
///
/// @implNote Stateless and thread-safe.
public final class QualityGate {

    private final QualityThresholds thresholds;

    public QualityGate() {
        this(QualityThresholds.defaults());
    }

    public QualityGate(QualityThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    /// Grades a flowchart that was not rendered.
    public QualityAssessment evaluate(double detectionConfidence, ValidationResult validation) {
        return grade(detectionConfidence, validation, null, null);
    }

    /// Grades a rendered flowchart.
    public QualityAssessment evaluate(
            double detectionConfidence, ValidationResult validation, RenderResult render) {
        Objects.requireNonNull(render, "render must not be null");
        return grade(detectionConfidence, validation, render, null);
    }

    /// Grades a flowchart whose render failed.
    public QualityAssessment evaluateFailedRender(
            double detectionConfidence, ValidationResult validation, RenderException failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return grade(detectionConfidence, validation, null, failure);
    }

    private QualityAssessment grade(
            double detectionConfidence,
            ValidationResult validation,
            RenderResult render,
            RenderException failure) {
        Objects.requireNonNull(validation, "validation must not be null");
        double score = Math.max(0.0, Math.min(1.0, detectionConfidence));
        List<String> blockers = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (score < thresholds.draft()) {
            blockers.add(
                    "Detection confidence "
                            + format(score)
                            + " below draft threshold "
                            + format(thresholds.draft()));
        } else if (score < thresholds.certified()) {
            warnings.add(
                    "Detection confidence "
                            + format(score)
                            + " below certified threshold "
                            + format(thresholds.certified()));
        }

        validation.errorMessages().forEach(e -> blockers.add("Validation error: " + e));
        validation.warningMessages().forEach(w -> warnings.add("Validation warning: " + w));

        boolean certifiedBackend = true;
        if (failure != null) {
            blockers.add("Render failed: " + failure.getMessage());
        }
        if (render != null) {
            if (render.artifactBytes().length == 0) {
                blockers.add("Render artifact is empty");
            }
            if (render.resolvedBackend().getTier() != FidelityTier.CERTIFIED) {
                certifiedBackend = false;
                warnings.add("Rendered with draft backend " + render.resolvedBackend().getName());
            }
        }

        boolean certified =
                blockers.isEmpty() && score >= thresholds.certified() && certifiedBackend;
        return new QualityAssessment(
                certified ? FidelityTier.CERTIFIED : FidelityTier.DRAFT, score, blockers, warnings);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
