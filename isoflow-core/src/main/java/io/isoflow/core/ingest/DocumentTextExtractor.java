package io.isoflow.core.ingest;

import java.nio.file.Path;

/// Turns a document file into plain text for the boundary detector.
///
/// The output is opaque text; no structure beyond line breaks is promised.
public interface DocumentTextExtractor {

    /// Returns whether this extractor handles the file, judged by its name.
    boolean supports(Path file);

    /// Reads the file as plain text.
    ///
    /// @param file document to read, not null
    /// @return the text with `\n` line endings, never null
    /// @throws UnsupportedFormatException if {@link #supports(Path)} is false for `file`
    /// @throws ExtractionFailedException if the file cannot be read
    String extractPlainText(Path file) throws UnsupportedFormatException, ExtractionFailedException;
}
