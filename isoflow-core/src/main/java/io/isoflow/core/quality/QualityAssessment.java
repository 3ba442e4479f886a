package io.isoflow.core.quality;

import io.isoflow.core.render.FidelityTier;
import java.util.List;
import java.util.Objects;

/// Verdict of the {@link QualityGate} on one flowchart artifact.
///
/// @param tier CERTIFIED only when nothing blocks and every certified condition holds
/// @param score detection score in `[0, 1]`
/// @param blockers reasons the artifact must not ship, not null
/// @param warnings reasons the artifact is not certified or deserves a look, not null
public record QualityAssessment(
        FidelityTier tier, double score, List<String> blockers, List<String> warnings) {

    public QualityAssessment {
        Objects.requireNonNull(tier, "tier must not be null");
        blockers = List.copyOf(blockers);
        warnings = List.copyOf(warnings);
    }

    public boolean isCertified() {
        return tier == FidelityTier.CERTIFIED;
    }

    public boolean isBlocked() {
        return !blockers.isEmpty();
    }
}
