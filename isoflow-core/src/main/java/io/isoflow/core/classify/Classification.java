package io.isoflow.core.classify;

import io.isoflow.core.model.NodeCategory;
import java.util.Objects;

/// Result of classifying one line of text.
///
/// @param category the ISO-5807 category, not null
/// @param confidence base confidence of the winning pattern, in `[0, 1]`
/// @param matched the substring that triggered the match, empty for the default
public record Classification(NodeCategory category, double confidence, String matched) {

    public Classification {
        Objects.requireNonNull(category, "category must not be null");
        matched = matched != null ? matched : "";
    }

    /// Returns whether no pattern matched and the default category was used.
    public boolean isDefault() {
        return matched.isEmpty();
    }
}
