package io.isoflow.core.validate;

/// Whether a validation finding blocks rendering.
public enum Severity {
    ERROR,
    WARNING
}
