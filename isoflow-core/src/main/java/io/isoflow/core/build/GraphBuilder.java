package io.isoflow.core.build;

import io.isoflow.core.model.Branch;
import io.isoflow.core.model.Connection;
import io.isoflow.core.model.ConnectionKind;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import io.isoflow.core.model.NodeCategory;
import io.isoflow.core.model.StepTarget;
import io.isoflow.core.model.WorkflowStep;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds a {@link Flowchart} from an ordered step list.
///
/// ### Algorithm
/// 1. A leading terminator step becomes the `START` node and a trailing one the `END`
///    node; whichever is missing is synthesized.
/// 2. Every other step becomes a node with id `STEP_<index>`, its category, its label
///    (decisions end in `?`) and its confidence.
/// 3. A step with branches gets one edge per branch, labeled with the branch label
///    (or the branch text when the label is missing). A
///    step with a bare jump gets one unlabeled edge to the jump target. Any other step
///    falls through to the next node, except a terminator, which ends its path.
/// 4. Edges whose target does not come after their source are tagged
///    {@link ConnectionKind#LOOPBACK}.
///
/// The builder never rejects its input. A jump to a step that does not exist falls
/// through to the next node, and duplicate step numbers get suffixed ids. Structural
/// judgement is left to the validator.
///
/// @implNote Stateless and thread-safe.
///
/// @see io.isoflow.core.validate.FlowchartValidator
public final class GraphBuilder {

    private static final Logger logger = Logger.getLogger(GraphBuilder.class.getName());

    static final String STEP_PREFIX = "STEP_";
    static final int MAX_DERIVED_LABEL = 30;

    /// Builds the flowchart.
    ///
    /// @param steps ordered steps, not null, may be empty
    /// @param title flowchart title, not null
    /// @return a new flowchart, never null
    public Flowchart build(List<WorkflowStep> steps, String title) {
        Objects.requireNonNull(steps, "steps must not be null");
        Objects.requireNonNull(title, "title must not be null");

        Flowchart flowchart = new Flowchart(title);
        List<String> order = new ArrayList<>();
        Map<Integer, String> idByIndex = new HashMap<>();
        Map<String, WorkflowStep> stepById = new HashMap<>();

        boolean leadingTerminator =
                !steps.isEmpty() && steps.get(0).getCategory() == NodeCategory.TERMINATOR;
        boolean trailingTerminator =
                steps.size() > 1
                        && steps.get(steps.size() - 1).getCategory() == NodeCategory.TERMINATOR;

        if (!leadingTerminator) {
            flowchart.addNode(Node.start());
            order.add(Node.START_ID);
        }

        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            String id;
            if (i == 0 && leadingTerminator) {
                id = Node.START_ID;
            } else if (i == steps.size() - 1 && trailingTerminator) {
                id = Node.END_ID;
            } else {
                id = uniqueId(flowchart, STEP_PREFIX + step.getIndex());
            }
            flowchart.addNode(new Node(id, step.getCategory(), label(step), step.getConfidence()));
            order.add(id);
            idByIndex.putIfAbsent(step.getIndex(), id);
            stepById.put(id, step);
        }

        if (!trailingTerminator) {
            flowchart.addNode(Node.end());
            order.add(Node.END_ID);
        }

        Map<String, Integer> position = new HashMap<>();
        for (int p = 0; p < order.size(); p++) {
            position.put(order.get(p), p);
        }

        for (int p = 0; p < order.size() - 1; p++) {
            String id = order.get(p);
            WorkflowStep step = stepById.get(id);

            if (step == null) {
                flowchart.addConnection(Connection.sequential(id, order.get(p + 1)));
            } else if (step.hasBranches()) {
                List<Branch> branches = step.getBranches();
                for (int b = 0; b < branches.size(); b++) {
                    Branch branch = branches.get(b);
                    String target = resolve(branch.target(), p, order, idByIndex);
                    ConnectionKind kind =
                            position.get(target) <= p
                                    ? ConnectionKind.LOOPBACK
                                    : ConnectionKind.BRANCH;
                    flowchart.addConnection(
                            new Connection(id, target, branchLabel(branch, b), kind));
                }
            } else if (step.getJumpTarget().isExplicit()) {
                String target = resolve(step.getJumpTarget(), p, order, idByIndex);
                ConnectionKind kind =
                        position.get(target) <= p
                                ? ConnectionKind.LOOPBACK
                                : ConnectionKind.SEQUENTIAL;
                flowchart.addConnection(new Connection(id, target, "", kind));
                // The last step keeps its exit to END so that END stays reachable.
                if (kind == ConnectionKind.LOOPBACK && p == order.size() - 2) {
                    flowchart.addConnection(Connection.sequential(id, order.get(p + 1)));
                }
            } else if (step.getCategory() != NodeCategory.TERMINATOR || p == 0) {
                flowchart.addConnection(Connection.sequential(id, order.get(p + 1)));
            }
        }

        logger.fine(
                "Built flowchart '"
                        + title
                        + "': "
                        + flowchart.nodeCount()
                        + " nodes, "
                        + flowchart.getConnections().size()
                        + " connections");
        return flowchart;
    }

    private static String resolve(
            StepTarget target, int position, List<String> order, Map<Integer, String> idByIndex) {
        if (target instanceof StepTarget.End) {
            return order.get(order.size() - 1);
        }
        if (target instanceof StepTarget.Step jump) {
            String id = idByIndex.get(jump.index());
            if (id != null) {
                return id;
            }
            logger.fine("Jump to missing step " + jump.index() + ", falling through");
        }
        return order.get(position + 1);
    }

    /// Unlabeled branches are named after their text, or by position when the text is
    /// empty, so that every decision exit carries a label.
    static String branchLabel(Branch branch, int ordinal) {
        if (!branch.label().isBlank()) {
            return branch.label();
        }
        String text = branch.text().strip();
        if (text.isEmpty()) {
            return "Option " + (ordinal + 1);
        }
        return text.length() <= MAX_DERIVED_LABEL
                ? text
                : text.substring(0, MAX_DERIVED_LABEL - 3).strip() + "...";
    }

    private static String uniqueId(Flowchart flowchart, String base) {
        String id = base;
        int suffix = 2;
        while (flowchart.containsNode(id)) {
            id = base + "_" + suffix++;
        }
        return id;
    }

    private static String label(WorkflowStep step) {
        String text = step.getText().strip();
        if (step.getCategory() != NodeCategory.DECISION || text.endsWith("?")) {
            return text;
        }
        while (!text.isEmpty() && (text.endsWith(".") || text.endsWith(":"))) {
            text = text.substring(0, text.length() - 1).strip();
        }
        return text + "?";
    }
}
