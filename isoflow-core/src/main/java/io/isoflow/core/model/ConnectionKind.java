package io.isoflow.core.model;

/// Edge roles in a {@link Flowchart}.
///
/// - `SEQUENTIAL`: fall-through to the next step, or a bare forward jump
/// - `BRANCH`: one labeled exit of a step with branches
/// - `LOOPBACK`: target precedes source in step order (retry, repeat)
public enum ConnectionKind {
    SEQUENTIAL,
    BRANCH,
    LOOPBACK
}
