package io.isoflow.core.validate;

import java.util.ArrayList;
import java.util.List;

/// Outcome of one validation pass. Immutable.
///
/// @param errors blocking findings, not null
/// @param warnings non-blocking findings, not null
public record ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /// Splits issues by severity, keeping their order.
    public static ValidationResult of(List<ValidationIssue> issues) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            (issue.isError() ? errors : warnings).add(issue);
        }
        return new ValidationResult(errors, warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean has(IssueKind kind) {
        return errors.stream().anyMatch(i -> i.kind() == kind)
                || warnings.stream().anyMatch(i -> i.kind() == kind);
    }

    /// Returns the warning messages, in order.
    public List<String> warningMessages() {
        return warnings.stream().map(ValidationIssue::message).toList();
    }

    /// Returns the error messages, in order.
    public List<String> errorMessages() {
        return errors.stream().map(ValidationIssue::message).toList();
    }
}
