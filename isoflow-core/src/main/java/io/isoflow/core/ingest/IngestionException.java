package io.isoflow.core.ingest;

import java.io.Serial;
import java.nio.file.Path;

/// Base type of document ingestion failures.
public class IngestionException extends Exception {

    @Serial private static final long serialVersionUID = 4412780951536127290L;

    private final transient Path file;

    public IngestionException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public IngestionException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
