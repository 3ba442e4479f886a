package io.isoflow.core.render.source;

import io.isoflow.core.model.Flowchart;

/// Generates diagram source text in one engine's language.
///
/// @implNote Implementations are stateless and thread-safe. Output depends only on the
/// flowchart, in node and connection insertion order.
public interface DiagramSource {

    /// Returns the language name, e.g. `dot`.
    String getName();

    /// Returns the file extension engines expect for this language, without the dot.
    String getExtension();

    /// Generates source text for the flowchart.
    ///
    /// @param flowchart the flowchart to describe, not null
    /// @return source text, never null
    String generate(Flowchart flowchart);
}
