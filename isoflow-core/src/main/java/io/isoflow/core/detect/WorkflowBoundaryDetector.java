package io.isoflow.core.detect;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Splits a document into independent workflow candidates.
///
/// ### Headings
/// Four pattern families contribute headings:
/// - markdown `#` to `######`, level = number of hashes
/// - numbered `2.1 Title`, `Section 3: Title`, and `4. Title` when the next line
///   restarts step numbering; level = dot depth + 1
/// - all-caps lines, level 1
/// - underlined lines, `===` level 1 and `---` level 2
///
/// A section runs from its heading to the next heading of equal or higher rank.
///
/// ### Scoring
/// | Signal                          | Contribution                 |
/// |---------------------------------|------------------------------|
/// | workflow words in the title     | 0.15 each, at most 0.4       |
/// | step markers                    | ≥5: 0.35, ≥3: 0.25, ≥1: 0.15 |
/// | workflow vocabulary in the body | 0.02 each, at most 0.2       |
/// | two or more subsections         | 0.1                          |
/// | 200+ non-blank characters       | 0.1                          |
///
/// Denylisted titles (glossary, references, appendix, contents...) are dropped
/// whatever their score. Candidates below the confidence threshold are omitted
/// silently. When a section and some of its subsections both qualify, the section is
/// reduced to the text before its first subsection so each step is built once.
///
/// @implNote Stateless apart from the immutable threshold; thread-safe.
public final class WorkflowBoundaryDetector {

    private static final Logger logger =
            Logger.getLogger(WorkflowBoundaryDetector.class.getName());

    public static final double DEFAULT_MIN_CONFIDENCE = 0.3;

    static final String FALLBACK_TITLE = "Complete Workflow";
    static final double FALLBACK_MIN_CONFIDENCE = 0.5;

    private static final Pattern MARKDOWN = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*#*$");
    private static final Pattern SECTION =
            Pattern.compile(
                    "^section\\s+(\\d+(?:\\.\\d+)*)\\s*[:.\\-]?\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern MULTI_LEVEL_NUMBER =
            Pattern.compile("^(\\d+(?:\\.\\d+)+)\\.?\\s+([A-Z].{2,80})$");
    private static final Pattern SINGLE_LEVEL_NUMBER =
            Pattern.compile("^(\\d+)\\.\\s+([A-Z][A-Za-z0-9&/' -]{2,60})$");
    private static final Pattern ALL_CAPS = Pattern.compile("^[A-Z][A-Z &/,'()-]{7,}$");
    private static final Pattern UNDERLINE_1 = Pattern.compile("^={3,}\\s*$");
    private static final Pattern UNDERLINE_2 = Pattern.compile("^-{3,}\\s*$");

    private static final Pattern STEP_MARKER =
            Pattern.compile(
                    "^\\s*(?:\\d{1,3}[.)]\\s+\\S|\\*\\*\\d{1,3}\\*\\*|step\\s+\\d{1,3}\\b)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern FIRST_STEP = Pattern.compile("^\\s*(?:1[.)]\\s+\\S|\\d+\\.1\\b)");
    private static final Pattern DECISION_MARKER =
            Pattern.compile(
                    "\\b(?:if|whether|choose|option|alternative|otherwise)\\b|\\?\\s*$",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern TERMINATOR_WORD =
            Pattern.compile("^(?:START|BEGIN|END|FINISH|STOP|DONE|COMPLETE)[.!]?$");

    private static final List<String> TITLE_INDICATORS =
            List.of(
                    "procedure", "process", "workflow", "steps", "setup", "set up", "install",
                    "configuration", "configure", "how to", "guide", "instructions",
                    "troubleshooting", "checklist", "onboarding");
    private static final Pattern VOCABULARY =
            Pattern.compile(
                    "\\b(?:start|begin|end|finish|process|check|if|validate|verify|click|enter"
                            + "|select|open|close|install|configure|run|save|submit|review"
                            + "|approve|continue|return|repeat|confirm|send|receive)\\b",
                    Pattern.CASE_INSENSITIVE);
    private static final List<String> DENYLIST_CONTAINS =
            List.of(
                    "table of contents",
                    "glossary",
                    "quick reference",
                    "hardware requirements",
                    "system requirements",
                    "revision history");
    private static final List<String> DENYLIST_EXACT = List.of("contents", "references", "index");
    private static final Pattern TITLE_NUMBERING =
            Pattern.compile("^(?:section\\s+)?\\d+(?:\\.\\d+)*[:.\\s-]*", Pattern.CASE_INSENSITIVE);

    private final double minConfidence;

    public WorkflowBoundaryDetector() {
        this(DEFAULT_MIN_CONFIDENCE);
    }

    /// @param minConfidence candidates scoring below this are omitted, in `[0, 1]`
    public WorkflowBoundaryDetector(double minConfidence) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence out of range: " + minConfidence);
        }
        this.minConfidence = minConfidence;
    }

    /// Detects workflow candidates in document order.
    ///
    /// @param document plain document text, not null
    /// @return candidates at or above the threshold, never null, may be empty
    public List<WorkflowCandidate> detect(String document) {
        String[] lines = document.split("\\R", -1);
        List<Heading> headings = findHeadings(lines);

        if (headings.isEmpty()) {
            return fallback(lines);
        }

        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < headings.size(); i++) {
            Heading heading = headings.get(i);
            int end = lines.length;
            int subsections = 0;
            int firstChild = -1;
            for (int j = i + 1; j < headings.size(); j++) {
                Heading next = headings.get(j);
                if (next.level() <= heading.level()) {
                    end = next.line();
                    break;
                }
                subsections++;
                if (firstChild < 0) {
                    firstChild = next.line();
                }
            }
            sections.add(new Section(heading, end, subsections, firstChild));
        }

        List<WorkflowCandidate> result = new ArrayList<>();
        for (Section section : sections) {
            if (isDenied(section.heading.title())) {
                logger.fine("Skipping denylisted section: " + section.heading.title());
                continue;
            }
            boolean childQualifies = false;
            for (Section other : sections) {
                if (other != section && section.contains(other) && qualifies(other, lines)) {
                    childQualifies = true;
                    break;
                }
            }
            int from = section.heading.bodyStart();
            WorkflowCandidate candidate =
                    childQualifies
                            ? score(section.heading, lines, from, section.firstChild, 0)
                            : score(section.heading, lines, from, section.end, section.subsections);
            if (candidate.stepCount() == 0 || candidate.confidence() < minConfidence) {
                logger.fine(
                        "Section '"
                                + section.heading.title()
                                + "' below threshold: "
                                + candidate.confidence());
                continue;
            }
            result.add(candidate);
        }

        logger.info(
                "Detected "
                        + result.size()
                        + " workflow candidates in "
                        + headings.size()
                        + " sections");
        return List.copyOf(result);
    }

    // -----------------------------------------------------------------------
    // Headings
    // -----------------------------------------------------------------------

    List<Heading> findHeadings(String[] lines) {
        List<Heading> headings = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }

            Matcher m = MARKDOWN.matcher(line);
            if (m.matches()) {
                headings.add(new Heading(i, i + 1, m.group(2).strip(), m.group(1).length()));
                continue;
            }

            if (i + 1 < lines.length && !STEP_MARKER.matcher(line).find()) {
                String next = lines[i + 1];
                if (UNDERLINE_1.matcher(next).matches()) {
                    headings.add(new Heading(i, i + 2, line, 1));
                    i++;
                    continue;
                }
                if (UNDERLINE_2.matcher(next).matches()) {
                    headings.add(new Heading(i, i + 2, line, 2));
                    i++;
                    continue;
                }
            }

            m = SECTION.matcher(line);
            if (m.matches()) {
                headings.add(new Heading(i, i + 1, line, depth(m.group(1))));
                continue;
            }

            m = MULTI_LEVEL_NUMBER.matcher(line);
            if (m.matches() && !line.endsWith(".")) {
                headings.add(new Heading(i, i + 1, line, depth(m.group(1))));
                continue;
            }

            m = SINGLE_LEVEL_NUMBER.matcher(line);
            if (m.matches() && isTitleCase(m.group(2)) && nextRestartsNumbering(lines, i)) {
                headings.add(new Heading(i, i + 1, line, 1));
                continue;
            }

            if (ALL_CAPS.matcher(line).matches() && !TERMINATOR_WORD.matcher(line).matches()) {
                headings.add(new Heading(i, i + 1, line, 1));
            }
        }
        return headings;
    }

    private static int depth(String number) {
        int dots = 0;
        for (int i = 0; i < number.length(); i++) {
            if (number.charAt(i) == '.') {
                dots++;
            }
        }
        return dots + 1;
    }

    private static boolean isTitleCase(String text) {
        String[] words = text.strip().split("\\s+");
        if (words.length > 6) {
            return false;
        }
        for (String word : words) {
            if (word.length() >= 4 && !Character.isUpperCase(word.charAt(0))) {
                return false;
            }
        }
        return true;
    }

    private static boolean nextRestartsNumbering(String[] lines, int index) {
        for (int i = index + 1; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                return FIRST_STEP.matcher(lines[i]).find();
            }
        }
        return false;
    }

    // -----------------------------------------------------------------------
    // Scoring
    // -----------------------------------------------------------------------

    private boolean qualifies(Section section, String[] lines) {
        if (isDenied(section.heading.title())) {
            return false;
        }
        WorkflowCandidate own =
                score(
                        section.heading,
                        lines,
                        section.heading.bodyStart(),
                        section.end,
                        section.subsections);
        return own.stepCount() > 0 && own.confidence() >= minConfidence;
    }

    WorkflowCandidate score(Heading heading, String[] lines, int from, int to, int subsections) {
        int steps = 0;
        int decisions = 0;
        int vocabulary = 0;
        int meaningful = 0;
        StringBuilder body = new StringBuilder();

        for (int i = from; i < to; i++) {
            String line = lines[i];
            body.append(line).append('\n');
            if (line.isBlank()) {
                continue;
            }
            if (STEP_MARKER.matcher(line).find()) {
                steps++;
            }
            if (DECISION_MARKER.matcher(line).find()) {
                decisions++;
            }
            Matcher words = VOCABULARY.matcher(line);
            while (words.find()) {
                vocabulary++;
            }
            for (int c = 0; c < line.length(); c++) {
                if (!Character.isWhitespace(line.charAt(c))) {
                    meaningful++;
                }
            }
        }

        double confidence = titleScore(heading.title());
        if (steps >= 5) {
            confidence += 0.35;
        } else if (steps >= 3) {
            confidence += 0.25;
        } else if (steps >= 1) {
            confidence += 0.15;
        }
        confidence += Math.min(0.2, vocabulary * 0.02);
        if (subsections >= 2) {
            confidence += 0.1;
        }
        if (meaningful >= 200) {
            confidence += 0.1;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        Complexity complexity = Complexity.of(steps);
        List<String> warnings = new ArrayList<>();
        if (complexity == Complexity.HIGH) {
            warnings.add("High complexity (" + steps + " steps), consider splitting");
        }

        return new WorkflowCandidate(
                heading.title(),
                heading.level(),
                steps,
                decisions,
                confidence,
                complexity,
                warnings,
                body.toString().strip(),
                from,
                to);
    }

    private static double titleScore(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String indicator : TITLE_INDICATORS) {
            if (lower.contains(indicator)) {
                hits++;
            }
        }
        return Math.min(0.4, hits * 0.15);
    }

    static boolean isDenied(String title) {
        String clean =
                TITLE_NUMBERING
                        .matcher(title.strip())
                        .replaceFirst("")
                        .toLowerCase(Locale.ROOT)
                        .strip();
        if (DENYLIST_EXACT.contains(clean) || clean.startsWith("appendix")) {
            return true;
        }
        return DENYLIST_CONTAINS.stream().anyMatch(clean::contains);
    }

    private List<WorkflowCandidate> fallback(String[] lines) {
        Heading whole = new Heading(-1, 0, FALLBACK_TITLE, 0);
        WorkflowCandidate scored = score(whole, lines, 0, lines.length, 0);
        if (scored.stepCount() == 0) {
            logger.fine("No headings and no step markers; nothing detected");
            return List.of();
        }
        double confidence = Math.max(scored.confidence(), FALLBACK_MIN_CONFIDENCE);
        return List.of(
                new WorkflowCandidate(
                        FALLBACK_TITLE,
                        0,
                        scored.stepCount(),
                        scored.decisionCount(),
                        confidence,
                        scored.complexity(),
                        scored.warnings(),
                        scored.text(),
                        0,
                        lines.length));
    }

    private static final class Section {
        final Heading heading;
        final int end;
        final int subsections;
        final int firstChild;

        Section(Heading heading, int end, int subsections, int firstChild) {
            this.heading = heading;
            this.end = end;
            this.subsections = subsections;
            this.firstChild = firstChild;
        }

        boolean contains(Section other) {
            return other.heading.line() > heading.line() && other.heading.line() < end;
        }
    }
}
