package io.isoflow.core.render;

import java.io.Serial;

/// Base type of rendering failures.
///
/// Attempt-level subclasses ({@link BackendUnavailableException},
/// {@link BackendTimeoutException}, {@link BackendFailureException},
/// {@link ArtifactIntegrityException}) are absorbed by the {@link RenderDispatcher},
/// which moves on to the next backend. {@link AllBackendsExhaustedException} is terminal.
public class RenderException extends Exception {

    @Serial private static final long serialVersionUID = 6254031187795146003L;

    private final BackendId backend;

    public RenderException(BackendId backend, String message) {
        super(message);
        this.backend = backend;
    }

    public RenderException(BackendId backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    /// Returns the backend the failure belongs to.
    ///
    /// @return the backend, may be null for failures not tied to one backend
    public BackendId getBackend() {
        return backend;
    }
}
