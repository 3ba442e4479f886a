package io.isoflow.core.render;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/// Format-specific sanity checks on rendered bytes.
///
/// | Format | Accepted when                                   |
/// |--------|-------------------------------------------------|
/// | SVG    | contains `<svg`                                 |
/// | PNG    | starts with `89 50 4E 47`                       |
/// | PDF    | starts with `%PDF`                              |
/// | HTML   | contains `<html` (case-insensitive)             |
/// | SOURCE | not blank                                       |
///
/// Every format must also be non-empty.
///
/// @implNote Stateless and thread-safe.
public class ArtifactIntegrityChecker {

    private static final byte[] PNG_MAGIC = {(byte) 0x89, 0x50, 0x4E, 0x47};
    private static final byte[] PDF_MAGIC = {0x25, 0x50, 0x44, 0x46};

    /// Checks an artifact against its declared format.
    ///
    /// @param backend backend that produced the artifact, used in the error, not null
    /// @param artifact artifact to check, not null
    /// @throws ArtifactIntegrityException if the bytes do not look like the format
    public void check(BackendId backend, RenderedArtifact artifact)
            throws ArtifactIntegrityException {
        byte[] bytes = artifact.bytes();
        if (bytes.length == 0) {
            throw new ArtifactIntegrityException(backend, "Empty " + artifact.format() + " artifact");
        }

        boolean valid =
                switch (artifact.format()) {
                    case SVG -> text(bytes).contains("<svg");
                    case PNG -> startsWith(bytes, PNG_MAGIC);
                    case PDF -> startsWith(bytes, PDF_MAGIC);
                    case HTML -> text(bytes).toLowerCase(Locale.ROOT).contains("<html");
                    case SOURCE -> !text(bytes).isBlank();
                };

        if (!valid) {
            throw new ArtifactIntegrityException(
                    backend,
                    "Artifact from " + backend.getName() + " is not valid " + artifact.format());
        }
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static boolean startsWith(byte[] bytes, byte[] magic) {
        if (bytes.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (bytes[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
