package io.isoflow.core.render.source;

import io.isoflow.core.model.Connection;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import java.util.Locale;

/// Mermaid flowchart generator.
///
/// Output is plain Mermaid (no markdown fence) so it can be passed to `mmdc`, Kroki or
/// the embedded browser viewer unchanged.
///
/// ### Node Shape Mapping
/// - **TERMINATOR**: stadium `([..])`
/// - **PROCESS**: rectangle `[..]`
/// - **DECISION**: rhombus `{..}`
/// - **INPUT_OUTPUT**: parallelogram `[/../]`
/// - **DATABASE**: cylinder `[(..)]`
/// - **DISPLAY**: hexagon `{{..}}`
/// - **DOCUMENT**: asymmetric flag `>..]`
/// - **PREDEFINED_PROCESS**: subroutine `[[..]]`
/// - **MANUAL_OPERATION**: trapezoid `[/..\]`
/// - **CONNECTOR**: circle `((..))`
///
/// ### Edge Styles
/// - **Solid arrow** (`-->`) for sequential and branch edges
/// - **Dashed arrow** (`-.->`) for loopback edges
///
/// @implNote Thread-safe. Stateless rendering.
public final class MermaidSource implements DiagramSource {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String getExtension() {
        return "mmd";
    }

    @Override
    public String generate(Flowchart flowchart) {
        StringBuilder sb = new StringBuilder();
        sb.append("---\n");
        sb.append("title: ").append(escape(flowchart.getTitle())).append('\n');
        sb.append("---\n");
        sb.append("flowchart TD\n");

        for (Node node : flowchart.getNodes()) {
            renderNode(sb, node);
        }
        sb.append('\n');
        for (Connection connection : flowchart.getConnections()) {
            renderEdge(sb, connection);
        }

        boolean uncertain = false;
        for (Node node : flowchart.getNodes()) {
            if (node.getConfidence() < Labels.UNCERTAIN_BELOW) {
                sb.append("  class ").append(sanitizeId(node.getId())).append(" uncertain\n");
                uncertain = true;
            }
        }
        if (uncertain) {
            sb.append("  classDef uncertain stroke:#FF9800,stroke-dasharray:4 3\n");
        }
        return sb.toString();
    }

    private void renderNode(StringBuilder sb, Node node) {
        String id = sanitizeId(node.getId());
        String label =
                "\"" + escape(String.join("<br/>", Labels.wrap(node.getLabel(), Labels.WRAP_WIDTH))) + "\"";

        String shape =
                switch (node.getCategory()) {
                    case TERMINATOR -> id + "([" + label + "])";
                    case PROCESS -> id + "[" + label + "]";
                    case DECISION -> id + "{" + label + "}";
                    case INPUT_OUTPUT -> id + "[/" + label + "/]";
                    case DATABASE -> id + "[(" + label + ")]";
                    case DISPLAY -> id + "{{" + label + "}}";
                    case DOCUMENT -> id + ">" + label + "]";
                    case PREDEFINED_PROCESS -> id + "[[" + label + "]]";
                    case MANUAL_OPERATION -> id + "[/" + label + "\\]";
                    case CONNECTOR -> id + "((" + label + "))";
                };

        sb.append("  ").append(shape).append('\n');
    }

    private void renderEdge(StringBuilder sb, Connection connection) {
        String arrow = connection.isLoopback() ? " -.->" : " -->";
        sb.append("  ").append(sanitizeId(connection.fromId())).append(arrow);
        if (connection.hasLabel()) {
            sb.append("|\"").append(escape(connection.label())).append("\"|");
        }
        sb.append(' ').append(sanitizeId(connection.toId())).append('\n');
    }

    static String escape(String text) {
        return text.replace("\"", "#quot;").replace("\n", " ");
    }

    static String sanitizeId(String id) {
        String sanitized = id.replaceAll("[^a-zA-Z0-9_]", "_");
        // Prefix reserved Mermaid keywords
        if (isReservedKeyword(sanitized)) {
            return "node_" + sanitized;
        }
        return sanitized;
    }

    private static boolean isReservedKeyword(String id) {
        return switch (id.toLowerCase(Locale.ROOT)) {
            case "end",
                    "subgraph",
                    "graph",
                    "flowchart",
                    "direction",
                    "click",
                    "style",
                    "classdef",
                    "class",
                    "linkstyle" ->
                    true;
            default -> false;
        };
    }
}
