package io.isoflow.core.render;

import java.util.Optional;
import java.util.Set;

/// Registry of {@link BackendAdapter}s keyed by {@link BackendId}.
///
/// @see DefaultBackendRegistry
public interface BackendRegistry {

    Optional<BackendAdapter> get(BackendId id);

    /// Registers an adapter, replacing any adapter with the same id.
    ///
    /// @param adapter the adapter, not null
    void register(BackendAdapter adapter);

    /// Returns the ids with a registered adapter.
    Set<BackendId> registered();
}
