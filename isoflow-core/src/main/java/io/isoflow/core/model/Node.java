package io.isoflow.core.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/// A flowchart vertex.
///
/// Id, label and confidence are fixed at construction. The category may be changed
/// through {@link #reclassify(NodeCategory)} so that a caller can correct a
/// classification before validating again.
///
/// @implNote **Not thread-safe** for reclassification. Builders and validators treat
/// a node as read-only.
public final class Node {

    /// Id given to the start terminator.
    public static final String START_ID = "START";

    /// Id given to the end terminator.
    public static final String END_ID = "END";

    private static final Set<String> START_WORDS = Set.of("start", "begin");

    private final String id;
    private volatile NodeCategory category;
    private final String label;
    private final double confidence;

    public Node(String id, NodeCategory category, String label, double confidence) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        this.confidence = confidence;
    }

    /// Creates the synthesized start terminator.
    public static Node start() {
        return new Node(START_ID, NodeCategory.TERMINATOR, "Start", 1.0);
    }

    /// Creates the synthesized end terminator.
    public static Node end() {
        return new Node(END_ID, NodeCategory.TERMINATOR, "End", 1.0);
    }

    public String getId() {
        return id;
    }

    public NodeCategory getCategory() {
        return category;
    }

    public String getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    /// Replaces the node category. Validation results computed before the call are stale.
    ///
    /// @param category the new category, not null
    public void reclassify(NodeCategory category) {
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    public boolean isTerminator() {
        return category == NodeCategory.TERMINATOR;
    }

    /// Returns whether this node plays the start role: a terminator whose id is
    /// {@value #START_ID} or whose label is a start word.
    public boolean isStartTerminator() {
        if (!isTerminator()) {
            return false;
        }
        return START_ID.equals(id) || START_WORDS.contains(label.trim().toLowerCase(Locale.ROOT));
    }

    /// Returns whether this node plays the end role: any terminator that is not a start.
    public boolean isEndTerminator() {
        return isTerminator() && !isStartTerminator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node other)) return false;
        return id.equals(other.id)
                && category == other.category
                && label.equals(other.label)
                && Double.compare(confidence, other.confidence) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, category, label, confidence);
    }

    @Override
    public String toString() {
        return "Node{" + id + ", " + category + ", '" + label + "'}";
    }
}
