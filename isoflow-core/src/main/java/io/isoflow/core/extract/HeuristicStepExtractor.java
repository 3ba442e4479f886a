package io.isoflow.core.extract;

import io.isoflow.core.classify.Classification;
import io.isoflow.core.classify.SymbolClassifier;
import io.isoflow.core.model.Branch;
import io.isoflow.core.model.NodeCategory;
import io.isoflow.core.model.StepTarget;
import io.isoflow.core.model.WorkflowStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Pattern-based {@link StepExtractor}.
///
/// ### Algorithm
/// 1. Split into physical lines, drop blank lines, parenthesised annotations and short
///    all-caps headings.
/// 2. A numbered line (`1.`, `2)`) opens a step. Unmarked lines continue the current
///    step. When the text carries no numbering at all, each unmarked line is a step.
/// 3. Bulleted (`-`, `*`, `•`, `a.`) or indented lines are nested under the current step.
/// 4. The primary text is classified. For a decision, every nested line becomes a
///    {@link Branch}; for any other step, nested lines are folded into the step text,
///    except that nested lines with a yes/no label turn the step into a decision.
///
/// Decisions with a single branch are kept as-is; no inverse branch is synthesized.
///
/// A list numbered from `0` is shifted up by one, together with its "go to step N"
/// references, so step indices stay 1-based.
///
/// @implNote Stateless and thread-safe; a single instance may serve every worker.
public final class HeuristicStepExtractor implements StepExtractor {

    private static final Logger logger = Logger.getLogger(HeuristicStepExtractor.class.getName());

    /// All-caps lines shorter than this are treated as section headings.
    static final int HEADER_MAX_LENGTH = 60;

    /// Confidence given to a step promoted to decision by its yes/no sub-lines.
    static final double PROMOTED_DECISION_CONFIDENCE = 0.7;

    private static final Pattern NUMBERED = Pattern.compile("^(\\d{1,6})[.)](?:\\s+|$)(.*)$");
    private static final Pattern BULLET = Pattern.compile("^(?:[-*•]|[a-z][.)])\\s+(.*)$");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+[.)]\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern POLAR_LABEL =
            Pattern.compile(
                    "^(?:if\\s+)?(yes|no|true|false)\\b[\\s:,.\\-]*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROMOTING_LABEL =
            Pattern.compile(
                    "^(?:if\\s+(?:yes|no|true|false)\\b|(?:yes|no|true|false)\\s*[:\\-]).*$",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern OUTCOME_LABEL =
            Pattern.compile(
                    "^(valid|invalid|success|failure|pass|fail|approved|rejected|correct|incorrect)"
                            + "\\s*:\\s*(.*)$",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern OTHERWISE_LABEL =
            Pattern.compile("^(otherwise|else)\\b[\\s:,]*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONDITION_LABEL =
            Pattern.compile("^if\\s+(.+?)\\s*[:,]\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COLON_LABEL = Pattern.compile("^([^:]{1,40}):\\s*(.*)$");

    private final SymbolClassifier classifier;

    public HeuristicStepExtractor() {
        this(new SymbolClassifier());
    }

    public HeuristicStepExtractor(SymbolClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public List<WorkflowStep> extract(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isBlank()) {
            return List.of();
        }

        List<String> lines = meaningfulLines(text);
        boolean numbered = lines.stream().anyMatch(l -> NUMBERED.matcher(l.strip()).matches());
        int offset = startsAtZero(lines) ? 1 : 0;

        List<StepDraft> drafts = new ArrayList<>();
        StepDraft current = null;
        int lastIndex = 0;

        for (String line : lines) {
            String stripped = line.strip();
            int indent = indentOf(line);

            Matcher numberedLine = NUMBERED.matcher(stripped);
            Matcher bullet = BULLET.matcher(stripped);

            if (numberedLine.matches() && (indent < 2 || current == null)) {
                int index = Integer.parseInt(numberedLine.group(1)) + offset;
                current = new StepDraft(index, numberedLine.group(2));
                drafts.add(current);
                lastIndex = Math.max(lastIndex, index);
            } else if (current != null && (bullet.matches() || indent >= 2)) {
                current.nested.add(bullet.matches() ? bullet.group(1).strip() : stripped);
            } else if (current == null || !numbered) {
                String body = bullet.matches() ? bullet.group(1).strip() : stripped;
                current = new StepDraft(++lastIndex, body);
                drafts.add(current);
            } else {
                current.text.add(stripped);
            }
        }

        List<WorkflowStep> steps = new ArrayList<>(drafts.size());
        for (StepDraft draft : drafts) {
            steps.add(finish(draft, offset));
        }
        logger.fine("Extracted " + steps.size() + " steps from " + lines.size() + " lines");
        return List.copyOf(steps);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static boolean startsAtZero(List<String> lines) {
        for (String line : lines) {
            Matcher m = NUMBERED.matcher(line.strip());
            if (m.matches() && indentOf(line) < 2 && Integer.parseInt(m.group(1)) == 0) {
                return true;
            }
        }
        return false;
    }

    private List<String> meaningfulLines(String text) {
        List<String> result = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("(")) {
                continue;
            }
            if (isHeading(stripped)) {
                logger.fine("Skipping heading line: " + stripped);
                continue;
            }
            result.add(line);
        }
        return result;
    }

    private boolean isHeading(String stripped) {
        if (stripped.length() >= HEADER_MAX_LENGTH) {
            return false;
        }
        boolean hasLetter = false;
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            if (Character.isDigit(c) || Character.isLowerCase(c)) {
                return false;
            }
            hasLetter |= Character.isLetter(c);
        }
        return hasLetter && !classifier.isTerminator(stripped);
    }

    private static int indentOf(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width;
    }

    private WorkflowStep finish(StepDraft draft, int offset) {
        String primary = String.join(" ", draft.text);
        Classification classification = classifier.classify(primary);
        NodeCategory category = classification.category();
        double confidence = classification.confidence();
        StepTarget jump = JumpReferences.find(primary, offset);

        List<Branch> branches = new ArrayList<>();
        List<String> details = new ArrayList<>();

        if (category == NodeCategory.DECISION) {
            for (String nested : draft.nested) {
                branches.add(toBranch(nested, offset));
            }
        } else {
            for (String nested : draft.nested) {
                if (PROMOTING_LABEL.matcher(nested).matches()) {
                    branches.add(toBranch(nested, offset));
                } else {
                    details.add(nested);
                    if (!jump.isExplicit()) {
                        jump = JumpReferences.find(nested, offset);
                    }
                }
            }
            if (!branches.isEmpty() && category != NodeCategory.TERMINATOR) {
                category = NodeCategory.DECISION;
                confidence = PROMOTED_DECISION_CONFIDENCE;
            } else if (!branches.isEmpty()) {
                branches.forEach(b -> details.add(b.text()));
                branches.clear();
            }
        }

        String raw = details.isEmpty() ? primary : primary + " " + String.join(" ", details);

        return WorkflowStep.builder()
                .index(draft.index)
                .rawText(raw)
                .text(normalizeText(raw))
                .category(category)
                .confidence(confidence)
                .branches(branches)
                .jumpTarget(branches.isEmpty() ? jump : StepTarget.next())
                .build();
    }

    /// Splits a nested line into label and action, then resolves its jump target.
    static Branch toBranch(String line) {
        return toBranch(line, 0);
    }

    static Branch toBranch(String line, int offset) {
        String label = "";
        String action = line;

        Matcher m;
        if ((m = POLAR_LABEL.matcher(line)).matches()
                || (m = OUTCOME_LABEL.matcher(line)).matches()
                || (m = OTHERWISE_LABEL.matcher(line)).matches()
                || (m = CONDITION_LABEL.matcher(line)).matches()
                || (m = COLON_LABEL.matcher(line)).matches()) {
            label = capitalize(m.group(1).strip());
            action = m.group(2).strip();
        }

        String text = action.isEmpty() ? line : action;
        return new Branch(label, text, JumpReferences.find(text, offset));
    }

    /// Strips a leading step number, collapses whitespace and capitalises the first letter.
    static String normalizeText(String text) {
        String stripped = LEADING_NUMBER.matcher(text.strip()).replaceFirst("");
        return capitalize(WHITESPACE.matcher(stripped).replaceAll(" ").strip());
    }

    private static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
    }

    private static final class StepDraft {
        final int index;
        final List<String> text = new ArrayList<>();
        final List<String> nested = new ArrayList<>();

        StepDraft(int index, String firstLine) {
            this.index = index;
            if (!firstLine.isBlank()) {
                text.add(firstLine.strip());
            }
        }
    }
}
