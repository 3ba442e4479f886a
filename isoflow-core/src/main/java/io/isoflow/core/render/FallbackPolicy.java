package io.isoflow.core.render;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/// Ordered backend priority used when the preferred backend fails or is absent.
///
/// Policies made with {@link #of(BackendId...)} always end with {@link BackendId#HTML},
/// which cannot fail, so a dispatch in draft mode always terminates with an artifact.
/// {@link #withoutFallback(BackendId...)} builds a policy that may exhaust.
///
/// @param order backends in priority order without duplicates, not null, not empty
public record FallbackPolicy(List<BackendId> order) {

    public FallbackPolicy {
        Objects.requireNonNull(order, "order must not be null");
        if (order.isEmpty()) {
            throw new IllegalArgumentException("Fallback policy must name at least one backend");
        }
        order = List.copyOf(new LinkedHashSet<>(order));
    }

    /// Returns GRAPHVIZ, D2, MERMAID, KROKI, HTML.
    public static FallbackPolicy defaults() {
        return new FallbackPolicy(List.of(BackendId.values()));
    }

    /// Builds a policy from the given order, appending HTML when it is missing.
    public static FallbackPolicy of(BackendId... backends) {
        List<BackendId> order = new ArrayList<>(List.of(backends));
        if (!order.contains(BackendId.HTML)) {
            order.add(BackendId.HTML);
        }
        return new FallbackPolicy(order);
    }

    /// Builds a policy from exactly the given order.
    public static FallbackPolicy withoutFallback(BackendId... backends) {
        return new FallbackPolicy(List.of(backends));
    }

    /// Parses a comma-separated list of backend names, such as `"d2, graphviz"`.
    ///
    /// @throws IllegalArgumentException on an unknown name
    public static FallbackPolicy parse(String names) {
        List<BackendId> order = new ArrayList<>();
        for (String name : names.split(",")) {
            if (!name.isBlank()) {
                order.add(BackendId.fromName(name));
            }
        }
        return of(order.toArray(new BackendId[0]));
    }

    public boolean endsWithFallback() {
        return order.get(order.size() - 1) == BackendId.HTML;
    }
}
