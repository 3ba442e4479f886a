package io.isoflow.core.detect;

import java.util.Objects;
import java.util.Optional;

/// A "see section N" style reference found in step text.
///
/// @param sourceText the text containing the reference, not null
/// @param section the referenced section number or name, not null
/// @param targetTitle title of the matching candidate, null when unresolved
public record CrossReference(String sourceText, String section, String targetTitle) {

    public CrossReference {
        Objects.requireNonNull(sourceText, "sourceText must not be null");
        Objects.requireNonNull(section, "section must not be null");
    }

    public boolean isResolved() {
        return targetTitle != null;
    }

    public Optional<String> target() {
        return Optional.ofNullable(targetTitle);
    }
}
