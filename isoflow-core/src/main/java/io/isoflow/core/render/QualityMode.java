package io.isoflow.core.render;

/// Whether a render may degrade to a draft-tier backend.
public enum QualityMode {
    /// Any backend in the policy may produce the artifact.
    DRAFT_ALLOWED(FidelityTier.DRAFT),
    /// Only certified-tier backends; the chain stops rather than degrade.
    CERTIFIED_ONLY(FidelityTier.CERTIFIED);

    private final FidelityTier minimumTier;

    QualityMode(FidelityTier minimumTier) {
        this.minimumTier = minimumTier;
    }

    public FidelityTier getMinimumTier() {
        return minimumTier;
    }

    public boolean permits(BackendId backend) {
        return backend.getTier().isAtLeast(minimumTier);
    }
}
