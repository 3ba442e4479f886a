package io.isoflow.core.quality;

/// Detection-confidence thresholds of the {@link QualityGate}.
///
/// @param certified minimum score for a certified artifact, in `[0, 1]`
/// @param draft minimum score below which the artifact is blocked, in `[0, certified]`
public record QualityThresholds(double certified, double draft) {

    public static final double DEFAULT_CERTIFIED = 0.65;
    public static final double DEFAULT_DRAFT = 0.25;

    public QualityThresholds {
        if (certified < 0.0 || certified > 1.0) {
            throw new IllegalArgumentException("certified out of range: " + certified);
        }
        if (draft < 0.0 || draft > certified) {
            throw new IllegalArgumentException("draft must be in [0, certified]: " + draft);
        }
    }

    public static QualityThresholds defaults() {
        return new QualityThresholds(DEFAULT_CERTIFIED, DEFAULT_DRAFT);
    }
}
