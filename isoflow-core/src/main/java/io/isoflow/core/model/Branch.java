package io.isoflow.core.model;

import java.util.Objects;

/// One exit of a decision step.
///
/// @param label short branch label such as `Yes`, `No` or condition text, not null, may be empty
/// @param text the branch line as written, without its bullet marker, not null
/// @param target where the branch leads, not null
public record Branch(String label, String text, StepTarget target) {

    public Branch {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    /// Creates a branch that falls through to the next step.
    public static Branch implicit(String label, String text) {
        return new Branch(label, text, StepTarget.next());
    }

    /// Returns whether the branch falls through to the next sequential step.
    public boolean isImplicit() {
        return !target.isExplicit();
    }
}
