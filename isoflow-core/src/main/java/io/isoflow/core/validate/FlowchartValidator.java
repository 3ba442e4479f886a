package io.isoflow.core.validate;

import io.isoflow.core.model.Connection;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import io.isoflow.core.model.NodeCategory;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Checks a {@link Flowchart} against ISO-5807 structural rules.
///
/// | Rule                                   | Severity |
/// |----------------------------------------|----------|
/// | a start terminator with no incoming    | error    |
/// | an end terminator                      | error    |
/// | every node reachable from a start      | error    |
/// | end terminator with outgoing edges     | warning  |
/// | decision with < 2 or > 3 exits         | warning  |
/// | decision exit without a label          | warning  |
/// | decision exits converging on one node  | warning  |
/// | node with no incoming or no outgoing   | warning  |
/// | cycle not explained by a loopback edge | warning  |
/// | label longer than 100 characters      | warning  |
/// | confidence below 0.5                   | warning  |
///
/// Reachability and cycle detection ignore {@link io.isoflow.core.model.ConnectionKind#LOOPBACK}
/// edges, so intentional retries are never reported as defects.
///
/// @implNote Pure function of its input: the same flowchart always gives an equal result.
/// Thread-safe.
public final class FlowchartValidator {

    private static final Logger logger = Logger.getLogger(FlowchartValidator.class.getName());

    static final int MAX_LABEL_LENGTH = 100;
    static final int MAX_DECISION_BRANCHES = 3;
    static final double LOW_CONFIDENCE_THRESHOLD = 0.5;

    /// Validates a flowchart.
    ///
    /// @param flowchart the graph to check, not null
    /// @return the findings, never null
    public ValidationResult validate(Flowchart flowchart) {
        List<ValidationIssue> issues = new ArrayList<>();
        Graph graph = new Graph(flowchart);

        List<String> roots = checkTerminators(flowchart, graph, issues);
        checkReachability(flowchart, graph, roots, issues);
        checkEndOutgoing(flowchart, graph, issues);
        checkDecisions(flowchart, graph, issues);
        checkOrphans(flowchart, graph, issues);
        checkCycles(flowchart, graph, issues);
        checkLabelsAndConfidence(flowchart, issues);

        ValidationResult result = ValidationResult.of(issues);
        logger.fine(
                "Validated '"
                        + flowchart.getTitle()
                        + "': "
                        + result.errors().size()
                        + " errors, "
                        + result.warnings().size()
                        + " warnings");
        return result;
    }

    // -----------------------------------------------------------------------
    // Rules
    // -----------------------------------------------------------------------

    private List<String> checkTerminators(
            Flowchart flowchart, Graph graph, List<ValidationIssue> issues) {
        List<String> roots = new ArrayList<>();
        boolean anyEnd = false;
        for (Node node : flowchart.getNodes()) {
            if (node.isStartTerminator() && graph.incoming(node.getId()).isEmpty()) {
                roots.add(node.getId());
            }
            anyEnd |= node.isEndTerminator();
        }
        if (roots.isEmpty()) {
            issues.add(
                    new ValidationIssue(
                            IssueKind.MISSING_START,
                            List.of(),
                            "No start terminator without incoming connections"));
        }
        if (!anyEnd) {
            issues.add(
                    new ValidationIssue(IssueKind.MISSING_END, List.of(), "No end terminator"));
        }
        return roots;
    }

    private void checkReachability(
            Flowchart flowchart, Graph graph, List<String> roots, List<ValidationIssue> issues) {
        if (roots.isEmpty()) {
            return;
        }
        Set<String> reached = new HashSet<>(roots);
        Deque<String> queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            for (String next : graph.forward(queue.poll())) {
                if (reached.add(next)) {
                    queue.add(next);
                }
            }
        }
        for (Node node : flowchart.getNodes()) {
            if (!reached.contains(node.getId())) {
                issues.add(
                        ValidationIssue.of(
                                IssueKind.UNREACHABLE_NODE,
                                node.getId(),
                                "Node '" + node.getLabel() + "' is not reachable from start"));
            }
        }
    }

    private void checkEndOutgoing(Flowchart flowchart, Graph graph, List<ValidationIssue> issues) {
        for (Node node : flowchart.getNodes()) {
            if (node.isEndTerminator() && !graph.outgoing(node.getId()).isEmpty()) {
                issues.add(
                        ValidationIssue.of(
                                IssueKind.END_HAS_OUTGOING,
                                node.getId(),
                                "End terminator '" + node.getLabel() + "' has outgoing connections"));
            }
        }
    }

    private void checkDecisions(Flowchart flowchart, Graph graph, List<ValidationIssue> issues) {
        for (Node node : flowchart.getNodes()) {
            if (node.getCategory() != NodeCategory.DECISION) {
                continue;
            }
            String id = node.getId();
            List<Connection> exits = graph.outgoing(id);

            if (exits.size() < 2) {
                issues.add(
                        ValidationIssue.of(
                                IssueKind.DECISION_TOO_FEW_BRANCHES,
                                id,
                                "Decision '" + node.getLabel() + "' has fewer than 2 branches"));
            } else if (exits.size() > MAX_DECISION_BRANCHES) {
                issues.add(
                        ValidationIssue.of(
                                IssueKind.DECISION_TOO_MANY_BRANCHES,
                                id,
                                "Decision '"
                                        + node.getLabel()
                                        + "' has "
                                        + exits.size()
                                        + " branches"));
            }

            if (exits.size() >= 2 && exits.stream().anyMatch(c -> !c.hasLabel())) {
                issues.add(
                        ValidationIssue.of(
                                IssueKind.UNLABELED_BRANCH,
                                id,
                                "Decision '" + node.getLabel() + "' has an unlabeled branch"));
            }

            Set<String> targets = new HashSet<>();
            for (Connection exit : exits) {
                boolean terminal =
                        flowchart.getNode(exit.toId()).map(Node::isTerminator).orElse(false);
                if (!targets.add(exit.toId()) && !terminal) {
                    issues.add(
                            new ValidationIssue(
                                    IssueKind.CONVERGING_BRANCHES,
                                    List.of(id, exit.toId()),
                                    "Branches of decision '"
                                            + node.getLabel()
                                            + "' lead to the same node "
                                            + exit.toId()));
                    break;
                }
            }
        }
    }

    private void checkOrphans(Flowchart flowchart, Graph graph, List<ValidationIssue> issues) {
        Set<String> loopbackTargets = new HashSet<>();
        for (Connection connection : flowchart.getConnections()) {
            if (connection.isLoopback()) {
                loopbackTargets.add(connection.toId());
            }
        }
        for (Node node : flowchart.getNodes()) {
            if (node.isTerminator()) {
                continue;
            }
            String id = node.getId();
            boolean noIncoming = graph.incoming(id).isEmpty();
            boolean noOutgoing = graph.outgoing(id).isEmpty() && !loopbackTargets.contains(id);
            if (noIncoming || noOutgoing) {
                issues.add(
                        ValidationIssue.of(
                                IssueKind.ORPHAN_NODE,
                                id,
                                "Node '"
                                        + node.getLabel()
                                        + "' has no "
                                        + (noIncoming ? "incoming" : "outgoing")
                                        + " connections"));
            }
        }
    }

    /// Depth-first search over forward edges. Each back edge closes one cycle, reported
    /// with the nodes on the current path from the back edge target.
    private void checkCycles(Flowchart flowchart, Graph graph, List<ValidationIssue> issues) {
        Map<String, Integer> state = new HashMap<>();
        Set<List<String>> reported = new LinkedHashSet<>();

        for (String start : flowchart.getNodeIds()) {
            if (state.containsKey(start)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(start, graph.forward(start)));
            state.put(start, ON_PATH);
            path.add(start);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.successors.size()) {
                    String succ = frame.successors.get(frame.next++);
                    Integer s = state.get(succ);
                    if (s == null) {
                        state.put(succ, ON_PATH);
                        path.add(succ);
                        stack.push(new Frame(succ, graph.forward(succ)));
                    } else if (s == ON_PATH) {
                        List<String> cycle = List.copyOf(path.subList(path.indexOf(succ), path.size()));
                        if (reported.add(cycle)) {
                            issues.add(
                                    new ValidationIssue(
                                            IssueKind.UNEXPECTED_CYCLE,
                                            cycle,
                                            "Cycle without a loopback edge: "
                                                    + String.join(" -> ", cycle)
                                                    + " -> "
                                                    + succ));
                        }
                    }
                } else {
                    stack.pop();
                    state.put(frame.id, DONE);
                    path.remove(path.size() - 1);
                }
            }
        }
    }

    private void checkLabelsAndConfidence(Flowchart flowchart, List<ValidationIssue> issues) {
        for (Node node : flowchart.getNodes()) {
            if (node.getLabel().length() > MAX_LABEL_LENGTH) {
                issues.add(
                        ValidationIssue.of(
                                IssueKind.LABEL_TOO_LONG,
                                node.getId(),
                                "Label of node "
                                        + node.getId()
                                        + " exceeds "
                                        + MAX_LABEL_LENGTH
                                        + " characters"));
            }
            if (node.getConfidence() < LOW_CONFIDENCE_THRESHOLD) {
                issues.add(
                        ValidationIssue.of(
                                IssueKind.LOW_CONFIDENCE,
                                node.getId(),
                                "Low classification confidence for '"
                                        + node.getLabel()
                                        + "' ("
                                        + node.getConfidence()
                                        + ")"));
            }
        }
    }

    // -----------------------------------------------------------------------
    // Adjacency
    // -----------------------------------------------------------------------

    private static final int ON_PATH = 1;
    private static final int DONE = 2;

    private static final class Frame {
        final String id;
        final List<String> successors;
        int next;

        Frame(String id, List<String> successors) {
            this.id = id;
            this.successors = successors;
        }
    }

    /// Adjacency lists built once per validation pass, in connection order.
    private static final class Graph {
        private final Map<String, List<Connection>> outgoing = new LinkedHashMap<>();
        private final Map<String, List<Connection>> incoming = new LinkedHashMap<>();

        Graph(Flowchart flowchart) {
            for (Connection connection : flowchart.getConnections()) {
                outgoing.computeIfAbsent(connection.fromId(), k -> new ArrayList<>()).add(connection);
                incoming.computeIfAbsent(connection.toId(), k -> new ArrayList<>()).add(connection);
            }
        }

        List<Connection> outgoing(String id) {
            return outgoing.getOrDefault(id, List.of());
        }

        List<Connection> incoming(String id) {
            return incoming.getOrDefault(id, List.of());
        }

        /// Successors over sequential and branch edges only.
        List<String> forward(String id) {
            List<String> result = new ArrayList<>();
            for (Connection connection : outgoing(id)) {
                if (!connection.isLoopback()) {
                    result.add(connection.toId());
                }
            }
            return result;
        }
    }
}
