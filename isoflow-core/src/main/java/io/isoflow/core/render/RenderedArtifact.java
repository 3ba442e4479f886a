package io.isoflow.core.render;

import java.util.Arrays;
import java.util.Objects;

/// Bytes produced by a backend, with the format they are actually in.
///
/// The format can differ from the requested one: the HTML fallback always answers with
/// {@link OutputFormat#HTML}.
///
/// @param bytes artifact content, not null
/// @param format format of `bytes`, not null
public record RenderedArtifact(byte[] bytes, OutputFormat format) {

    public RenderedArtifact {
        Objects.requireNonNull(bytes, "bytes must not be null");
        Objects.requireNonNull(format, "format must not be null");
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenderedArtifact other)) return false;
        return format == other.format && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + format.hashCode();
    }

    @Override
    public String toString() {
        return "RenderedArtifact{" + format + ", " + bytes.length + " bytes}";
    }
}
