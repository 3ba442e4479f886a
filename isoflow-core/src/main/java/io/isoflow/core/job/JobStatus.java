package io.isoflow.core.job;

/// Lifecycle of an asynchronous render job.
///
/// ```
/// PENDING -> RUNNING -> COMPLETED | FAILED
///    \           \
///     +-----------+--> CANCELLED
/// ```
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
