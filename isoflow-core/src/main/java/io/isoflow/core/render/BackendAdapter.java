package io.isoflow.core.render;

import io.isoflow.core.model.Flowchart;
import java.time.Duration;
import java.util.Set;

/// Uniform contract for one rendering engine.
///
/// ### Contracts
/// - `render` must return or fail within `timeout`; external processes are killed when
///   it elapses
/// - `render` must not hold a lock shared with other adapters while it blocks
/// - A format outside {@link #supportedFormats()} fails with
///   {@link BackendFailureException}
///
/// @see RenderDispatcher for the caller
/// @see io.isoflow.core.render.backend for the built-in adapters
public interface BackendAdapter {

    /// Returns the engine this adapter drives.
    BackendId id();

    /// Returns the formats this adapter can produce.
    Set<OutputFormat> supportedFormats();

    /// Renders the flowchart.
    ///
    /// @param flowchart validated flowchart, not null
    /// @param format requested format, not null
    /// @param timeout upper bound for the whole call, not null
    /// @return the artifact, never null
    /// @throws BackendTimeoutException if the engine exceeds `timeout`
    /// @throws BackendFailureException if the engine fails or the format is unsupported
    /// @throws BackendUnavailableException if the engine cannot be started or reached
    /// @throws InterruptedException if the calling thread is interrupted while waiting
    RenderedArtifact render(Flowchart flowchart, OutputFormat format, Duration timeout)
            throws RenderException, InterruptedException;
}
