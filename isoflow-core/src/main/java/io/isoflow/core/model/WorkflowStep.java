package io.isoflow.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// One extracted step of a workflow, mapped to its ISO-5807 intent.
///
/// Instances are produced by a {@code StepExtractor} once per logical step and are
/// immutable afterwards. Branches are owned by the step and kept in source order.
///
/// ### Contracts
/// - `index` is 1-based, as written in the source text or inferred from position
/// - `confidence` lies in `[0.0, 1.0]`
/// - `jumpTarget` is {@link StepTarget.Next} when the step carries no jump phrase
///
/// @see Branch
/// @see io.isoflow.core.build.GraphBuilder for the consumer
public final class WorkflowStep {

    private final int index;
    private final String rawText;
    private final String text;
    private final NodeCategory category;
    private final double confidence;
    private final List<Branch> branches;
    private final StepTarget jumpTarget;

    private WorkflowStep(Builder builder) {
        this.index = builder.index;
        this.rawText = builder.rawText;
        this.text = builder.text != null ? builder.text : builder.rawText;
        this.category = builder.category;
        this.confidence = builder.confidence;
        this.branches = List.copyOf(builder.branches);
        this.jumpTarget = builder.jumpTarget;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getIndex() {
        return index;
    }

    /// Returns the step text exactly as collected from the source lines.
    public String getRawText() {
        return rawText;
    }

    /// Returns the normalised label text (numbering stripped, whitespace collapsed).
    public String getText() {
        return text;
    }

    public NodeCategory getCategory() {
        return category;
    }

    public double getConfidence() {
        return confidence;
    }

    /// Returns the step's branches in source order.
    ///
    /// @return unmodifiable list, never null, may be empty
    public List<Branch> getBranches() {
        return branches;
    }

    /// Returns the jump carried by the step's own text.
    ///
    /// @return the jump target, {@link StepTarget.Next} when there is none; never null
    public StepTarget getJumpTarget() {
        return jumpTarget;
    }

    public boolean hasBranches() {
        return !branches.isEmpty();
    }

    public boolean isDecision() {
        return category == NodeCategory.DECISION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowStep other)) return false;
        return index == other.index
                && Double.compare(confidence, other.confidence) == 0
                && rawText.equals(other.rawText)
                && text.equals(other.text)
                && category == other.category
                && branches.equals(other.branches)
                && jumpTarget.equals(other.jumpTarget);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, rawText, text, category, confidence, branches, jumpTarget);
    }

    @Override
    public String toString() {
        return "WorkflowStep{"
                + index
                + ", "
                + category
                + ", '"
                + text
                + "', confidence="
                + confidence
                + ", branches="
                + branches.size()
                + '}';
    }

    public static final class Builder {
        private int index;
        private String rawText;
        private String text;
        private NodeCategory category = NodeCategory.PROCESS;
        private double confidence = 0.5;
        private final List<Branch> branches = new ArrayList<>();
        private StepTarget jumpTarget = StepTarget.next();

        private Builder() {}

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder category(NodeCategory category) {
            this.category = category;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder branch(Branch branch) {
            this.branches.add(Objects.requireNonNull(branch, "branch must not be null"));
            return this;
        }

        public Builder branches(List<Branch> branches) {
            this.branches.clear();
            branches.forEach(this::branch);
            return this;
        }

        public Builder jumpTarget(StepTarget jumpTarget) {
            this.jumpTarget = jumpTarget;
            return this;
        }

        /// Builds the step.
        ///
        /// @return the immutable step, never null
        /// @throws NullPointerException if rawText, category or jumpTarget is null
        /// @throws IllegalArgumentException if index is not positive or confidence is
        ///     outside `[0, 1]`
        public WorkflowStep build() {
            Objects.requireNonNull(rawText, "Raw text required");
            Objects.requireNonNull(category, "Category required");
            Objects.requireNonNull(jumpTarget, "Jump target required");
            if (index < 1) {
                throw new IllegalArgumentException("Step index must be positive: " + index);
            }
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("Confidence out of range: " + confidence);
            }
            return new WorkflowStep(this);
        }
    }
}
