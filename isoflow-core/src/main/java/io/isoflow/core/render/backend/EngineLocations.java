package io.isoflow.core.render.backend;

import java.net.URI;
import java.util.Objects;

/// Where the external engines live.
///
/// @param dot Graphviz `dot` executable, a bare name is looked up on `PATH`; not null
/// @param d2 D2 executable, not null
/// @param mmdc Mermaid CLI executable, not null
/// @param kroki base URL of a Kroki server, not null
public record EngineLocations(String dot, String d2, String mmdc, URI kroki) {

    public static final URI DEFAULT_KROKI = URI.create("https://kroki.io");

    public EngineLocations {
        Objects.requireNonNull(dot, "dot must not be null");
        Objects.requireNonNull(d2, "d2 must not be null");
        Objects.requireNonNull(mmdc, "mmdc must not be null");
        Objects.requireNonNull(kroki, "kroki must not be null");
    }

    /// Returns bare executable names and the public Kroki service.
    public static EngineLocations defaults() {
        return new EngineLocations("dot", "d2", "mmdc", DEFAULT_KROKI);
    }
}
