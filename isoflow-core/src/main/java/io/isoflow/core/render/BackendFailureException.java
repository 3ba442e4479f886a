package io.isoflow.core.render;

import java.io.Serial;

/// Backend exited with an error or threw.
public class BackendFailureException extends RenderException {

    @Serial private static final long serialVersionUID = -5027712846693904416L;

    public BackendFailureException(BackendId backend, String message) {
        super(backend, message);
    }

    public BackendFailureException(BackendId backend, String message, Throwable cause) {
        super(backend, message, cause);
    }
}
