package io.isoflow.core.ingest;

import java.io.Serial;
import java.nio.file.Path;

/// The file type is supported but its text could not be read.
public class ExtractionFailedException extends IngestionException {

    @Serial private static final long serialVersionUID = 2873340316930857766L;

    public ExtractionFailedException(Path file, String message, Throwable cause) {
        super(file, message, cause);
    }
}
