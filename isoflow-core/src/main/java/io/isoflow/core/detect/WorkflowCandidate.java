package io.isoflow.core.detect;

import java.util.List;
import java.util.Objects;

/// A document segment provisionally holding one independent workflow.
///
/// Candidates exist only for the duration of one document pass; the extractor consumes
/// {@link #text()} and the candidate is discarded with the pass result.
///
/// @param title section title, not null
/// @param headingLevel nesting level of the heading, `0` for a document without headings
/// @param stepCount lines in the slice that carry a step marker
/// @param decisionCount lines in the slice that carry a decision marker
/// @param confidence workflow-ness score in `[0, 1]`
/// @param complexity size class derived from `stepCount`, not null
/// @param warnings human-readable warnings, not null
/// @param text the slice body without its heading line, not null
/// @param startLine 0-based index of the first body line in the source document
/// @param endLine 0-based exclusive end of the slice
public record WorkflowCandidate(
        String title,
        int headingLevel,
        int stepCount,
        int decisionCount,
        double confidence,
        Complexity complexity,
        List<String> warnings,
        String text,
        int startLine,
        int endLine) {

    public WorkflowCandidate {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(complexity, "complexity must not be null");
        Objects.requireNonNull(text, "text must not be null");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
    }
}
