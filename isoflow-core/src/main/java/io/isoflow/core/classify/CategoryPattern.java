package io.isoflow.core.classify;

import io.isoflow.core.model.NodeCategory;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// One row of the classification table: a regex and the category it votes for.
///
/// Patterns run against lower-cased, whitespace-collapsed text.
///
/// @param category category produced on a match, not null
/// @param pattern compiled pattern, not null
/// @param confidence base confidence of a match
record CategoryPattern(NodeCategory category, Pattern pattern, double confidence) {

    CategoryPattern {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    static CategoryPattern of(NodeCategory category, String regex, double confidence) {
        return new CategoryPattern(category, Pattern.compile(regex), confidence);
    }

    /// Returns the matched substring, or null when the pattern does not match.
    String find(String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }
}
