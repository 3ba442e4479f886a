package io.isoflow.core.render;

import java.util.Locale;

/// Rendering engines known to the dispatcher.
///
/// Every consumer switches exhaustively over these constants, so adding an engine is a
/// compile-checked change.
public enum BackendId {
    /// Native graph layout engine (`dot`).
    GRAPHVIZ("graphviz", FidelityTier.CERTIFIED),
    /// Modern declarative diagram engine (`d2`).
    D2("d2", FidelityTier.CERTIFIED),
    /// Universal markup engine, local CLI (`mmdc`).
    MERMAID("mermaid", FidelityTier.CERTIFIED),
    /// Universal markup engine, remote rendering service.
    KROKI("kroki", FidelityTier.CERTIFIED),
    /// Zero-dependency fallback: markup plus an embedded browser viewer.
    HTML("html", FidelityTier.DRAFT);

    private final String key;
    private final FidelityTier tier;

    BackendId(String key, FidelityTier tier) {
        this.key = key;
        this.tier = tier;
    }

    public String getName() {
        return key;
    }

    public FidelityTier getTier() {
        return tier;
    }

    /// Looks up a backend by its name, case-insensitively.
    ///
    /// @param name backend name such as `graphviz`, not null
    /// @return the backend, never null
    /// @throws IllegalArgumentException if no backend has that name
    public static BackendId fromName(String name) {
        String lower = name.strip().toLowerCase(Locale.ROOT);
        for (BackendId id : values()) {
            if (id.key.equals(lower)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + name);
    }
}
