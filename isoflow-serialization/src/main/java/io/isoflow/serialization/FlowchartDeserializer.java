package io.isoflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.isoflow.core.model.Connection;
import io.isoflow.core.model.ConnectionKind;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import io.isoflow.core.model.NodeCategory;
import java.io.IOException;
import java.io.Serial;

/// Reads the JSON written by {@link FlowchartSerializer} back into a {@link Flowchart}.
///
/// Nodes are added before connections, so connection order does not matter. A
/// connection naming an unknown node, a duplicate node id or an unknown enum constant
/// fails the whole read.
///
/// @implNote Package-private. Registered by {@link IsoflowJacksonModule}.
class FlowchartDeserializer extends StdDeserializer<Flowchart> {

    @Serial private static final long serialVersionUID = -5062347826019138154L;

    FlowchartDeserializer() {
        super(Flowchart.class);
    }

    @Override
    public Flowchart deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        Flowchart flowchart = new Flowchart(required(p, root, "title").asText());

        try {
            for (JsonNode node : root.path("nodes")) {
                flowchart.addNode(
                        new Node(
                                required(p, node, "id").asText(),
                                NodeCategory.valueOf(required(p, node, "category").asText()),
                                node.path("label").asText(""),
                                node.path("confidence").asDouble(1.0)));
            }
            for (JsonNode connection : root.path("connections")) {
                flowchart.addConnection(
                        new Connection(
                                required(p, connection, "from").asText(),
                                required(p, connection, "to").asText(),
                                connection.path("label").asText(""),
                                ConnectionKind.valueOf(
                                        connection.path("kind").asText("SEQUENTIAL"))));
            }
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid flowchart: " + e.getMessage(), e);
        }
        return flowchart;
    }

    private static JsonNode required(JsonParser p, JsonNode parent, String field)
            throws JsonMappingException {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            throw JsonMappingException.from(p, "Missing required field '" + field + "'");
        }
        return value;
    }
}
