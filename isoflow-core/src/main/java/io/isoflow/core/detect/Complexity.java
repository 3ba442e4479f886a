package io.isoflow.core.detect;

/// Size class of a workflow candidate, by step count.
public enum Complexity {
    /// Up to 10 steps.
    LOW,
    /// 11 to 20 steps.
    MEDIUM,
    /// More than 20 steps. Candidates of this class carry a splitting warning.
    HIGH;

    public static Complexity of(int stepCount) {
        if (stepCount <= 10) {
            return LOW;
        }
        return stepCount <= 20 ? MEDIUM : HIGH;
    }
}
