package io.isoflow.core.detect;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Resolves references between workflows detected in the same document.
///
/// Section numbers and normalised titles of the candidates are indexed once; each
/// reference found in step text is then looked up against that index.
///
/// {@snippet :
/// var resolver = new CrossReferenceResolver(candidates);
/// List<CrossReference> refs = resolver.resolveAll("Configure the adapter, see section 7.1");
/// }
///
/// @implNote Immutable after construction; thread-safe.
public final class CrossReferenceResolver {

    private static final List<Pattern> REFERENCE_PATTERNS =
            List.of(
                    Pattern.compile(
                            "(?:see|refer\\s+to)\\s+(?:section|step|procedure)\\s+(\\d+(?:\\.\\d+)*)",
                            Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "(?:as\\s+described\\s+in|according\\s+to|per|follow)\\s+section\\s+(\\d+(?:\\.\\d+)*)",
                            Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "detailed\\s+(?:in|steps?\\s+in)\\s+section\\s+(\\d+(?:\\.\\d+)*)",
                            Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "(?:follow|see)\\s+(?:the\\s+)?[\"']([^\"']{3,60})[\"']\\s+(?:procedure|section)",
                            Pattern.CASE_INSENSITIVE));

    private static final Pattern TITLE_NUMBER =
            Pattern.compile("(?:section\\s+)?(\\d+(?:\\.\\d+)*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_NUMBERING =
            Pattern.compile("^(?:section\\s+)?\\d+(?:\\.\\d+)*[:.\\s-]*", Pattern.CASE_INSENSITIVE);

    private final Map<String, String> sections;

    public CrossReferenceResolver(List<WorkflowCandidate> candidates) {
        Map<String, String> index = new HashMap<>();
        for (WorkflowCandidate candidate : candidates) {
            String title = candidate.title();
            Matcher number = TITLE_NUMBER.matcher(title);
            if (number.lookingAt()) {
                index.putIfAbsent(number.group(1), title);
            }
            String clean = cleanTitle(title);
            if (!clean.isEmpty()) {
                index.putIfAbsent(clean, title);
            }
        }
        this.sections = Map.copyOf(index);
    }

    /// Finds and resolves every reference in the text.
    ///
    /// @param text step text, not null
    /// @return references in pattern order, never null, may be empty
    public List<CrossReference> resolveAll(String text) {
        List<CrossReference> references = new ArrayList<>();
        for (Pattern pattern : REFERENCE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String section = matcher.group(1);
                String key = Character.isDigit(section.charAt(0)) ? section : cleanTitle(section);
                references.add(new CrossReference(text, section, sections.get(key)));
            }
        }
        return references;
    }

    /// Returns the number of indexed section keys.
    public int size() {
        return sections.size();
    }

    private static String cleanTitle(String title) {
        return TITLE_NUMBERING.matcher(title.strip()).replaceFirst("").strip().toLowerCase(Locale.ROOT);
    }
}
