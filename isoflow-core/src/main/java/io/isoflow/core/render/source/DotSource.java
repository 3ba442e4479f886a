package io.isoflow.core.render.source;

import io.isoflow.core.model.Connection;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import io.isoflow.core.model.NodeCategory;

/// Graphviz DOT generator.
///
/// ### Shape mapping
/// | Category           | Shape         |
/// |--------------------|---------------|
/// | TERMINATOR         | oval          |
/// | PROCESS            | box           |
/// | DECISION           | diamond       |
/// | INPUT_OUTPUT       | parallelogram |
/// | DATABASE           | cylinder      |
/// | DISPLAY            | hexagon       |
/// | DOCUMENT           | note          |
/// | PREDEFINED_PROCESS | box, doubled  |
/// | MANUAL_OPERATION   | trapezium     |
/// | CONNECTOR          | circle        |
///
/// Loopback edges are dashed purple and do not constrain ranking. Nodes with confidence
/// below 0.7 get a dashed orange border.
public final class DotSource implements DiagramSource {

    @Override
    public String getName() {
        return "dot";
    }

    @Override
    public String getExtension() {
        return "dot";
    }

    @Override
    public String generate(Flowchart flowchart) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph flowchart {\n");
        sb.append("  label=\"").append(escape(flowchart.getTitle())).append("\";\n");
        sb.append("  labelloc=t;\n");
        sb.append("  rankdir=TB;\n");
        sb.append("  bgcolor=white;\n");
        sb.append("  node [fontname=\"Helvetica\", fontsize=11, style=filled,")
                .append(" fillcolor=\"#FFFFFF\", color=\"#333333\"];\n");
        sb.append("  edge [fontname=\"Helvetica\", fontsize=10, color=\"#555555\"];\n\n");

        for (Node node : flowchart.getNodes()) {
            renderNode(sb, node);
        }
        sb.append('\n');
        for (Connection connection : flowchart.getConnections()) {
            renderEdge(sb, connection);
        }
        sb.append("}\n");
        return sb.toString();
    }

    private void renderNode(StringBuilder sb, Node node) {
        sb.append("  \"")
                .append(escape(node.getId()))
                .append("\" [label=\"")
                .append(escape(String.join("\n", Labels.wrap(node.getLabel(), Labels.WRAP_WIDTH))))
                .append("\", shape=")
                .append(shape(node.getCategory()))
                .append(", fillcolor=\"")
                .append(fill(node.getCategory()))
                .append('"');
        if (node.getCategory() == NodeCategory.PREDEFINED_PROCESS) {
            sb.append(", peripheries=2");
        }
        if (node.getConfidence() < Labels.UNCERTAIN_BELOW) {
            sb.append(", style=\"filled,dashed\", color=\"#FF9800\"");
        }
        sb.append("];\n");
    }

    private void renderEdge(StringBuilder sb, Connection connection) {
        sb.append("  \"")
                .append(escape(connection.fromId()))
                .append("\" -> \"")
                .append(escape(connection.toId()))
                .append('"');
        StringBuilder attrs = new StringBuilder();
        if (connection.hasLabel()) {
            attrs.append("label=\"").append(escape(connection.label())).append('"');
        }
        if (connection.isLoopback()) {
            if (attrs.length() > 0) {
                attrs.append(", ");
            }
            attrs.append("style=dashed, color=\"#9C27B0\", constraint=false");
        }
        if (attrs.length() > 0) {
            sb.append(" [").append(attrs).append(']');
        }
        sb.append(";\n");
    }

    static String shape(NodeCategory category) {
        return switch (category) {
            case TERMINATOR -> "oval";
            case PROCESS, PREDEFINED_PROCESS -> "box";
            case DECISION -> "diamond";
            case INPUT_OUTPUT -> "parallelogram";
            case DATABASE -> "cylinder";
            case DISPLAY -> "hexagon";
            case DOCUMENT -> "note";
            case MANUAL_OPERATION -> "trapezium";
            case CONNECTOR -> "circle";
        };
    }

    static String fill(NodeCategory category) {
        return switch (category) {
            case TERMINATOR -> "#90EE90";
            case DECISION -> "#FFE4B5";
            case PREDEFINED_PROCESS -> "#B0E0E6";
            case DATABASE -> "#E8E8E8";
            case DOCUMENT -> "#FAFAD2";
            case INPUT_OUTPUT -> "#E0E0FF";
            case MANUAL_OPERATION -> "#FFE4E1";
            case DISPLAY -> "#E0FFE0";
            case PROCESS, CONNECTOR -> "#FFFFFF";
        };
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
