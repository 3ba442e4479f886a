package io.isoflow.core.render;

import java.io.Serial;

/// Backend did not finish within its timeout; the external process has been killed.
public class BackendTimeoutException extends RenderException {

    @Serial private static final long serialVersionUID = 8391760042816722011L;

    public BackendTimeoutException(BackendId backend, String message) {
        super(backend, message);
    }

    public BackendTimeoutException(BackendId backend, String message, Throwable cause) {
        super(backend, message, cause);
    }
}
