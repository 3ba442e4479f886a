package io.isoflow.core.render.source;

import io.isoflow.core.model.Connection;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import io.isoflow.core.model.NodeCategory;

/// D2 generator.
///
/// Predefined processes are rectangles with a double border; manual operations use the
/// `queue` shape, the closest D2 has to a trapezium. Loopback edges are dashed.
public final class D2Source implements DiagramSource {

    @Override
    public String getName() {
        return "d2";
    }

    @Override
    public String getExtension() {
        return "d2";
    }

    @Override
    public String generate(Flowchart flowchart) {
        StringBuilder sb = new StringBuilder();
        sb.append("direction: down\n");
        sb.append("title: ").append(quote(flowchart.getTitle())).append(" {\n");
        sb.append("  shape: text\n");
        sb.append("  near: top-center\n");
        sb.append("}\n\n");

        for (Node node : flowchart.getNodes()) {
            sb.append(node.getId())
                    .append(": ")
                    .append(quote(String.join("\n", Labels.wrap(node.getLabel(), Labels.WRAP_WIDTH))))
                    .append(" {\n");
            sb.append("  shape: ").append(shape(node.getCategory())).append('\n');
            if (node.getCategory() == NodeCategory.PREDEFINED_PROCESS) {
                sb.append("  style.double-border: true\n");
            }
            if (node.getConfidence() < Labels.UNCERTAIN_BELOW) {
                sb.append("  style.stroke: \"#FF9800\"\n");
                sb.append("  style.stroke-dash: 3\n");
            }
            sb.append("}\n");
        }
        sb.append('\n');

        for (Connection connection : flowchart.getConnections()) {
            sb.append(connection.fromId()).append(" -> ").append(connection.toId());
            if (connection.hasLabel()) {
                sb.append(": ").append(quote(connection.label()));
            }
            if (connection.isLoopback()) {
                sb.append(" {\n  style.stroke-dash: 5\n  style.stroke: \"#9C27B0\"\n}");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String shape(NodeCategory category) {
        return switch (category) {
            case TERMINATOR -> "oval";
            case PROCESS, PREDEFINED_PROCESS -> "rectangle";
            case DECISION -> "diamond";
            case INPUT_OUTPUT -> "parallelogram";
            case DATABASE -> "cylinder";
            case DISPLAY -> "hexagon";
            case DOCUMENT -> "document";
            case MANUAL_OPERATION -> "queue";
            case CONNECTOR -> "circle";
        };
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
