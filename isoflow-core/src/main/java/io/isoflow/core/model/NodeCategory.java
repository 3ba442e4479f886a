package io.isoflow.core.model;

/// ISO-5807 symbol roles a flowchart node can take.
///
/// Renderers map every constant to a concrete shape, so adding a category is a
/// compile-time change at each consumer. {@link #CONNECTOR} is never produced by
/// text classification; it exists for external reclassification and page links.
public enum NodeCategory {
    TERMINATOR,
    PROCESS,
    DECISION,
    INPUT_OUTPUT,
    DATABASE,
    DISPLAY,
    DOCUMENT,
    PREDEFINED_PROCESS,
    MANUAL_OPERATION,
    CONNECTOR
}
