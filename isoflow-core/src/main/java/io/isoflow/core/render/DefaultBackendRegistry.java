package io.isoflow.core.render;

import io.isoflow.core.render.backend.HtmlFallbackBackend;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// {@link BackendRegistry} backed by a concurrent map.
///
/// The HTML fallback is registered on construction so that a policy ending in
/// {@link BackendId#HTML} always has an adapter to reach.
///
/// @implNote Thread-safe.
public class DefaultBackendRegistry implements BackendRegistry {

    private final Map<BackendId, BackendAdapter> adapters = new ConcurrentHashMap<>();

    public DefaultBackendRegistry() {
        register(new HtmlFallbackBackend());
    }

    @Override
    public Optional<BackendAdapter> get(BackendId id) {
        return Optional.ofNullable(adapters.get(id));
    }

    @Override
    public void register(BackendAdapter adapter) {
        Objects.requireNonNull(adapter, "adapter must not be null");
        adapters.put(adapter.id(), adapter);
    }

    @Override
    public Set<BackendId> registered() {
        Set<BackendId> ids = EnumSet.noneOf(BackendId.class);
        ids.addAll(adapters.keySet());
        return ids;
    }
}
