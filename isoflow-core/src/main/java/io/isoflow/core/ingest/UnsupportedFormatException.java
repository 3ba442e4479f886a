package io.isoflow.core.ingest;

import java.io.Serial;
import java.nio.file.Path;

/// The file type is not handled by the extractor.
public class UnsupportedFormatException extends IngestionException {

    @Serial private static final long serialVersionUID = -6019392468727740812L;

    public UnsupportedFormatException(Path file, String message) {
        super(file, message);
    }
}
