package io.isoflow.core.render;

import java.io.Serial;

/// Backend reported success but its artifact failed the format check.
public class ArtifactIntegrityException extends RenderException {

    @Serial private static final long serialVersionUID = 3650925551092847781L;

    public ArtifactIntegrityException(BackendId backend, String message) {
        super(backend, message);
    }

    public ArtifactIntegrityException(BackendId backend, String message, Throwable cause) {
        super(backend, message, cause);
    }
}
