package io.isoflow.core.render;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Successful dispatch outcome.
///
/// @param artifactBytes rendered bytes, not null
/// @param resolvedBackend backend that produced them, not null
/// @param format actual format of the bytes, not null
/// @param fallbackChainTried every backend attempted, in order, ending with
///     `resolvedBackend`
/// @param integrityChecked whether integrity checks accepted the bytes
/// @param warnings request warnings followed by one warning per fallback step
/// @param failures one entry per failed attempt, in order
public record RenderResult(
        byte[] artifactBytes,
        BackendId resolvedBackend,
        OutputFormat format,
        List<BackendId> fallbackChainTried,
        boolean integrityChecked,
        List<String> warnings,
        List<AttemptFailure> failures) {

    public RenderResult {
        Objects.requireNonNull(artifactBytes, "artifactBytes must not be null");
        Objects.requireNonNull(resolvedBackend, "resolvedBackend must not be null");
        Objects.requireNonNull(format, "format must not be null");
        artifactBytes = artifactBytes.clone();
        fallbackChainTried = List.copyOf(fallbackChainTried);
        warnings = List.copyOf(warnings);
        failures = List.copyOf(failures);
    }

    @Override
    public byte[] artifactBytes() {
        return artifactBytes.clone();
    }

    /// Returns true when a backend other than the first attempted one produced the result.
    public boolean isDegraded() {
        return !failures.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenderResult other)) return false;
        return integrityChecked == other.integrityChecked
                && Arrays.equals(artifactBytes, other.artifactBytes)
                && resolvedBackend == other.resolvedBackend
                && format == other.format
                && fallbackChainTried.equals(other.fallbackChainTried)
                && warnings.equals(other.warnings)
                && failures.equals(other.failures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                        resolvedBackend,
                        format,
                        fallbackChainTried,
                        integrityChecked,
                        warnings,
                        failures)
                * 31
                + Arrays.hashCode(artifactBytes);
    }

    @Override
    public String toString() {
        return "RenderResult{"
                + resolvedBackend.getName()
                + ", "
                + format
                + ", "
                + artifactBytes.length
                + " bytes, tried "
                + fallbackChainTried
                + "}";
    }
}
