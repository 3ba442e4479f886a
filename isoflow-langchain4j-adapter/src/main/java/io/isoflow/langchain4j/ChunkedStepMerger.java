package io.isoflow.langchain4j;

import io.isoflow.core.model.Branch;
import io.isoflow.core.model.StepTarget;
import io.isoflow.core.model.WorkflowStep;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Joins the steps extracted from overlapping windows into one numbered list.
///
/// A step whose text matches a step of the previous window is the overlap seen twice
/// and is dropped; references to it point at the copy already kept. Kept steps are
/// renumbered from 1, and the "go to step N" targets of each window are rewritten
/// through that window's own numbering. A target that names no step of its window
/// becomes a fall-through.
final class ChunkedStepMerger {

    private static final Logger logger = Logger.getLogger(ChunkedStepMerger.class.getName());

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<WorkflowStep> merged = new ArrayList<>();
    private Set<String> previousWindow = Set.of();
    private Map<String, Integer> indexByText = new HashMap<>();

    /// Adds the steps of the next window.
    ///
    /// @param window steps in the numbering the model used for this window, not null
    void add(List<WorkflowStep> window) {
        Map<Integer, Integer> renumbered = new HashMap<>();
        List<WorkflowStep> kept = new ArrayList<>();
        Map<String, Integer> current = new HashMap<>();
        int next = merged.size() + 1;

        for (WorkflowStep step : window) {
            String key = key(step);
            Integer existing = previousWindow.contains(key) ? indexByText.get(key) : null;
            if (existing != null) {
                renumbered.putIfAbsent(step.getIndex(), existing);
                current.put(key, existing);
                continue;
            }
            int index = next + kept.size();
            renumbered.putIfAbsent(step.getIndex(), index);
            current.put(key, index);
            kept.add(step);
        }

        for (WorkflowStep step : kept) {
            merged.add(renumber(step, renumbered.get(step.getIndex()), renumbered));
        }
        if (kept.size() < window.size()) {
            logger.fine("Dropped " + (window.size() - kept.size()) + " overlapping steps");
        }
        indexByText.putAll(current);
        previousWindow = new HashSet<>(current.keySet());
    }

    /// Returns the merged steps.
    List<WorkflowStep> steps() {
        return List.copyOf(merged);
    }

    private static WorkflowStep renumber(
            WorkflowStep step, int index, Map<Integer, Integer> renumbered) {
        List<Branch> branches = new ArrayList<>();
        for (Branch branch : step.getBranches()) {
            StepTarget target = retarget(branch.target(), renumbered);
            branches.add(new Branch(branch.label(), branch.text(), target));
        }
        return WorkflowStep.builder()
                .index(index)
                .rawText(step.getRawText())
                .text(step.getText())
                .category(step.getCategory())
                .confidence(step.getConfidence())
                .branches(branches)
                .jumpTarget(retarget(step.getJumpTarget(), renumbered))
                .build();
    }

    private static StepTarget retarget(StepTarget target, Map<Integer, Integer> renumbered) {
        if (target instanceof StepTarget.Step jump) {
            Integer index = renumbered.get(jump.index());
            if (index == null) {
                logger.fine("Dropping jump to step " + jump.index() + " outside its window");
                return StepTarget.next();
            }
            return StepTarget.step(index);
        }
        return target;
    }

    private static String key(WorkflowStep step) {
        return WHITESPACE.matcher(step.getText().strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
