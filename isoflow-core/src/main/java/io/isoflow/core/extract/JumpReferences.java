package io.isoflow.core.extract;

import io.isoflow.core.model.StepTarget;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Recognises "go to step N" style references in step and branch text.
///
/// Loop phrases (return, repeat, retry, restart) are tried before skip phrases
/// (skip, jump, proceed) so that "go back to step 2" is not read as "go to step 2".
/// Both yield {@link StepTarget.Step}; the graph builder derives the edge kind from
/// the relative step order.
public final class JumpReferences {

    private static final List<Pattern> LOOP_PATTERNS =
            List.of(
                    Pattern.compile(
                            "(?:return|go back|repeat from)\\s+(?:to\\s+)?step\\s+(\\d{1,6})\\b",
                            Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "(?:loop|repeat)\\s+(?:back\\s+)?(?:to\\s+)?step\\s+(\\d{1,6})\\b",
                            Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "(?:restart|resume)\\s+(?:at|from)\\s+step\\s+(\\d{1,6})\\b",
                            Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "(?:retry|redo)\\s+(?:from\\s+)?step\\s+(\\d{1,6})\\b",
                            Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> SKIP_PATTERNS =
            List.of(
                    Pattern.compile(
                            "(?:skip|jump|go)\\s+(?:to\\s+)?step\\s+(\\d{1,6})\\b",
                            Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "continue\\s+(?:to|with|at)\\s+step\\s+(\\d{1,6})\\b",
                            Pattern.CASE_INSENSITIVE),
                    Pattern.compile(
                            "proceed\\s+(?:to\\s+)?step\\s+(\\d{1,6})\\b",
                            Pattern.CASE_INSENSITIVE));

    private static final Pattern GO_TO_END =
            Pattern.compile(
                    "\\b(?:go|skip|jump|proceed)\\s+to\\s+(?:the\\s+)?end\\b",
                    Pattern.CASE_INSENSITIVE);

    private JumpReferences() {}

    /// Finds the jump referenced by the text.
    ///
    /// @param text step or branch text, not null
    /// @return the referenced target, {@link StepTarget.Next} when there is none; never null
    public static StepTarget find(String text) {
        return find(text, 0);
    }

    /// Finds the jump referenced by the text, adding `offset` to the written step number.
    ///
    /// Zero-based lists pass an offset of 1 so that "go to step 0" names the first step.
    ///
    /// @param text step or branch text, not null
    /// @param offset added to every referenced step number
    /// @return the referenced target, {@link StepTarget.Next} when there is none or the
    ///     shifted number is not positive; never null
    public static StepTarget find(String text, int offset) {
        Integer loop = firstIndex(LOOP_PATTERNS, text, offset);
        if (loop != null) {
            return StepTarget.step(loop);
        }
        if (GO_TO_END.matcher(text).find()) {
            return StepTarget.end();
        }
        Integer skip = firstIndex(SKIP_PATTERNS, text, offset);
        if (skip != null) {
            return StepTarget.step(skip);
        }
        return StepTarget.next();
    }

    private static Integer firstIndex(List<Pattern> patterns, String text, int offset) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                int index = Integer.parseInt(matcher.group(1)) + offset;
                if (index > 0) {
                    return index;
                }
            }
        }
        return null;
    }
}
