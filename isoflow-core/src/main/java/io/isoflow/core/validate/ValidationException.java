package io.isoflow.core.validate;

import java.io.Serial;

/// Raised when a flowchart has blocking structural defects and rendering is refused.
public class ValidationException extends Exception {

    @Serial private static final long serialVersionUID = -3190553876472109274L;

    private final transient ValidationResult result;

    public ValidationException(String title, ValidationResult result) {
        super(
                "Flowchart '"
                        + title
                        + "' failed validation: "
                        + String.join("; ", result.errorMessages()));
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
