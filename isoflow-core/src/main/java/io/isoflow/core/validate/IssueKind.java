package io.isoflow.core.validate;

/// Tag identifying the rule behind a {@link ValidationIssue}.
public enum IssueKind {
    MISSING_START(Severity.ERROR),
    MISSING_END(Severity.ERROR),
    UNREACHABLE_NODE(Severity.ERROR),
    END_HAS_OUTGOING(Severity.WARNING),
    DECISION_TOO_FEW_BRANCHES(Severity.WARNING),
    DECISION_TOO_MANY_BRANCHES(Severity.WARNING),
    UNLABELED_BRANCH(Severity.WARNING),
    CONVERGING_BRANCHES(Severity.WARNING),
    ORPHAN_NODE(Severity.WARNING),
    UNEXPECTED_CYCLE(Severity.WARNING),
    LABEL_TOO_LONG(Severity.WARNING),
    LOW_CONFIDENCE(Severity.WARNING);

    private final Severity severity;

    IssueKind(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
