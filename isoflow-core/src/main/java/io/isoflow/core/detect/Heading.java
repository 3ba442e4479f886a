package io.isoflow.core.detect;

/// A heading found in a document.
///
/// @param line 0-based index of the heading's first line
/// @param bodyStart 0-based index of the first line after the heading (after its
///     underline for underlined headings)
/// @param title heading text without markers, not null
/// @param level nesting level, `1` is outermost
record Heading(int line, int bodyStart, String title, int level) {}
