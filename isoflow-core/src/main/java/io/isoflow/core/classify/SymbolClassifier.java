package io.isoflow.core.classify;

import io.isoflow.core.model.NodeCategory;
import java.util.Locale;
import java.util.regex.Pattern;

/// Maps a line of process text to an ISO-5807 {@link NodeCategory} with a confidence.
///
/// ### Evaluation
/// 1. Terminator phrases ("start", "end of procedure") short-circuit with a fixed
///    confidence.
/// 2. Decision exclusions ("enter the key when prompted", "check current settings")
///    disable every decision pattern for the line.
/// 3. Every remaining row of {@link ClassificationPatterns#TABLE} is tried. The match
///    with the highest base confidence wins; ties go to the longer matched substring,
///    then to table order.
/// 4. A line matching nothing is a {@link NodeCategory#PROCESS} with
///    {@link #DEFAULT_CONFIDENCE}.
///
/// @implNote Stateless and thread-safe. All patterns are compiled once.
///
/// @see io.isoflow.core.extract.HeuristicStepExtractor for the primary caller
public final class SymbolClassifier {

    /// Confidence reported when no pattern matches.
    public static final double DEFAULT_CONFIDENCE = 0.4;

    private static final Pattern STEP_MARKER = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /// Classifies one line.
    ///
    /// @param line raw text, may carry a leading step number or bullet; not null
    /// @return the classification, never null
    public Classification classify(String line) {
        String text = normalize(line);
        if (text.isEmpty()) {
            return new Classification(NodeCategory.PROCESS, DEFAULT_CONFIDENCE, "");
        }

        if (ClassificationPatterns.TERMINATOR.matcher(text).find()
                || ClassificationPatterns.TERMINATOR_PHRASE.matcher(text).find()) {
            return new Classification(
                    NodeCategory.TERMINATOR, ClassificationPatterns.TERMINATOR_CONFIDENCE, text);
        }

        boolean decisionExcluded =
                ClassificationPatterns.DECISION_EXCLUSIONS.stream()
                        .anyMatch(p -> p.matcher(text).find());

        CategoryPattern best = null;
        String bestMatch = null;
        for (CategoryPattern candidate : ClassificationPatterns.TABLE) {
            if (decisionExcluded && candidate.category() == NodeCategory.DECISION) {
                continue;
            }
            String matched = candidate.find(text);
            if (matched == null) {
                continue;
            }
            if (best == null || beats(candidate, matched, best, bestMatch)) {
                best = candidate;
                bestMatch = matched;
            }
        }

        if (best == null) {
            return new Classification(NodeCategory.PROCESS, DEFAULT_CONFIDENCE, "");
        }
        return new Classification(best.category(), best.confidence(), bestMatch);
    }

    /// Returns whether the line is a terminator phrase on its own.
    ///
    /// @param line raw text, not null
    public boolean isTerminator(String line) {
        return classify(line).category() == NodeCategory.TERMINATOR;
    }

    static String normalize(String line) {
        String stripped = STEP_MARKER.matcher(line).replaceFirst("");
        return WHITESPACE.matcher(stripped.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    private static boolean beats(
            CategoryPattern candidate, String matched, CategoryPattern best, String bestMatch) {
        int byConfidence = Double.compare(candidate.confidence(), best.confidence());
        if (byConfidence != 0) {
            return byConfidence > 0;
        }
        return matched.length() > bestMatch.length();
    }
}
