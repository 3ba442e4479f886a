package io.isoflow.core.render;

/// Output fidelity of a rendering backend, lowest first.
public enum FidelityTier {
    /// Browser-rendered preview; layout depends on the viewer.
    DRAFT,
    /// Engine-rendered artifact with a deterministic layout.
    CERTIFIED;

    public boolean isAtLeast(FidelityTier other) {
        return compareTo(other) >= 0;
    }
}
