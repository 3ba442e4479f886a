package io.isoflow.core.extract;

import java.io.Serial;

/// Raised when text yields nothing to build or an extractor's output is unusable.
///
/// Recoverable: the caller reports it and continues with the next workflow.
public class ExtractionException extends Exception {

    @Serial private static final long serialVersionUID = 4127736028114309951L;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
