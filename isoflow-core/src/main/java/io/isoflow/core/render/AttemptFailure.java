package io.isoflow.core.render;

import java.util.Objects;

/// Record of one failed backend attempt.
///
/// @param backend the backend that failed, not null
/// @param errorType simple class name of the failure, e.g. `BackendTimeoutException`
/// @param message failure message, not null
public record AttemptFailure(BackendId backend, String errorType, String message) {

    public AttemptFailure {
        Objects.requireNonNull(backend, "backend must not be null");
        Objects.requireNonNull(errorType, "errorType must not be null");
        message = message != null ? message : "";
    }

    public static AttemptFailure of(BackendId backend, Exception error) {
        return new AttemptFailure(backend, error.getClass().getSimpleName(), error.getMessage());
    }

    @Override
    public String toString() {
        return backend.getName() + ": " + errorType + " (" + message + ")";
    }
}
