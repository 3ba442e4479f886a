package io.isoflow.core.render;

import java.io.Serial;

/// Requested backend is not installed, not reachable, or not registered.
public class BackendUnavailableException extends RenderException {

    @Serial private static final long serialVersionUID = -2241805934027717318L;

    public BackendUnavailableException(BackendId backend, String message) {
        super(backend, message);
    }

    public BackendUnavailableException(BackendId backend, String message, Throwable cause) {
        super(backend, message, cause);
    }
}
