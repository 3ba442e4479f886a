package io.isoflow.core.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.isoflow.core.render.BackendFailureException;
import io.isoflow.core.render.BackendId;
import io.isoflow.core.render.FidelityTier;
import io.isoflow.core.render.OutputFormat;
import io.isoflow.core.render.RenderResult;
import io.isoflow.core.validate.IssueKind;
import io.isoflow.core.validate.ValidationIssue;
import io.isoflow.core.validate.ValidationResult;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QualityGateTest {

    private static final ValidationResult CLEAN = new ValidationResult(List.of(), List.of());

    private final QualityGate gate = new QualityGate();

    private static RenderResult rendered(BackendId backend, byte[] bytes) {
        return new RenderResult(
                bytes, backend, OutputFormat.SVG, List.of(backend), true, List.of(), List.of());
    }

    @Nested
    class DetectionScore {

        @ParameterizedTest
        @CsvSource({"0.9, CERTIFIED", "0.65, CERTIFIED", "0.5, DRAFT", "0.25, DRAFT"})
        void shouldTierByScore(double score, FidelityTier expected) {
            QualityAssessment assessment = gate.evaluate(score, CLEAN);

            assertThat(assessment.tier()).isEqualTo(expected);
            assertThat(assessment.isBlocked()).isFalse();
        }

        @Test
        void shouldBlockBelowDraftThreshold() {
            QualityAssessment assessment = gate.evaluate(0.1, CLEAN);

            assertThat(assessment.isBlocked()).isTrue();
            assertThat(assessment.blockers())
                    .containsExactly("Detection confidence 0.10 below draft threshold 0.25");
        }

        @Test
        void shouldWarnBetweenThresholds() {
            assertThat(gate.evaluate(0.5, CLEAN).warnings())
                    .containsExactly("Detection confidence 0.50 below certified threshold 0.65");
        }

        @Test
        void shouldClampScore() {
            assertThat(gate.evaluate(1.7, CLEAN).score()).isEqualTo(1.0);
        }

        @Test
        void shouldHonourCustomThresholds() {
            QualityGate strict = new QualityGate(new QualityThresholds(0.95, 0.8));

            assertThat(strict.evaluate(0.9, CLEAN).tier()).isEqualTo(FidelityTier.DRAFT);
            assertThat(strict.evaluate(0.7, CLEAN).isBlocked()).isTrue();
        }

        @Test
        void shouldRejectDraftAboveCertified() {
            assertThatThrownBy(() -> new QualityThresholds(0.5, 0.6))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldBlockOnValidationErrors() {
            ValidationResult broken =
                    ValidationResult.of(
                            List.of(
                                    ValidationIssue.of(
                                            IssueKind.UNREACHABLE_NODE,
                                            "STEP_3",
                                            "Node STEP_3 is unreachable from start")));

            QualityAssessment assessment = gate.evaluate(0.9, broken);

            assertThat(assessment.tier()).isEqualTo(FidelityTier.DRAFT);
            assertThat(assessment.blockers())
                    .containsExactly("Validation error: Node STEP_3 is unreachable from start");
        }

        @Test
        void shouldCarryValidationWarningsWithoutBlocking() {
            ValidationResult warned =
                    ValidationResult.of(
                            List.of(
                                    ValidationIssue.of(
                                            IssueKind.ORPHAN_NODE, "STEP_2", "Orphan STEP_2")));

            QualityAssessment assessment = gate.evaluate(0.9, warned);

            assertThat(assessment.isCertified()).isTrue();
            assertThat(assessment.warnings()).containsExactly("Validation warning: Orphan STEP_2");
        }
    }

    @Nested
    class Render {

        @Test
        void shouldCertifyCertifiedBackendArtifact() {
            QualityAssessment assessment =
                    gate.evaluate(0.9, CLEAN, rendered(BackendId.GRAPHVIZ, new byte[] {1}));

            assertThat(assessment.isCertified()).isTrue();
        }

        @Test
        void shouldNeverCertifyDraftBackendArtifact() {
            QualityAssessment assessment =
                    gate.evaluate(0.9, CLEAN, rendered(BackendId.HTML, new byte[] {1}));

            assertThat(assessment.tier()).isEqualTo(FidelityTier.DRAFT);
            assertThat(assessment.isBlocked()).isFalse();
            assertThat(assessment.warnings()).containsExactly("Rendered with draft backend html");
        }

        @Test
        void shouldBlockEmptyArtifact() {
            QualityAssessment assessment =
                    gate.evaluate(0.9, CLEAN, rendered(BackendId.D2, new byte[0]));

            assertThat(assessment.blockers()).containsExactly("Render artifact is empty");
        }

        @Test
        void shouldBlockFailedRender() {
            QualityAssessment assessment =
                    gate.evaluateFailedRender(
                            0.9, CLEAN, new BackendFailureException(BackendId.D2, "d2 crashed"));

            assertThat(assessment.blockers()).containsExactly("Render failed: d2 crashed");
            assertThat(assessment.tier()).isEqualTo(FidelityTier.DRAFT);
        }
    }
}
