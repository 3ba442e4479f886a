package io.isoflow.core.validate;

import java.util.List;
import java.util.Objects;

/// One structural finding.
///
/// @param kind the rule that produced the finding, not null
/// @param nodeIds the offending node ids, in flowchart order; not null
/// @param message human-readable description, not null
public record ValidationIssue(IssueKind kind, List<String> nodeIds, String message) {

    public ValidationIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        nodeIds = nodeIds != null ? List.copyOf(nodeIds) : List.of();
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationIssue of(IssueKind kind, String nodeId, String message) {
        return new ValidationIssue(kind, List.of(nodeId), message);
    }

    public Severity severity() {
        return kind.getSeverity();
    }

    public boolean isError() {
        return severity() == Severity.ERROR;
    }
}
