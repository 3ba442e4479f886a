package io.isoflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.isoflow.core.model.Connection;
import io.isoflow.core.model.Flowchart;
import io.isoflow.core.model.Node;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link Flowchart} as title, node list and connection list.
///
/// ```json
/// {
///   "title": "Order intake",
///   "nodes": [{"id": "START", "category": "TERMINATOR", "label": "Start", "confidence": 1.0}],
///   "connections": [{"from": "START", "to": "STEP_1", "label": "", "kind": "SEQUENTIAL"}]
/// }
/// ```
///
/// Nodes and connections keep insertion order.
///
/// @implNote Package-private. Registered by {@link IsoflowJacksonModule}.
/// @see FlowchartDeserializer for the inverse operation
class FlowchartSerializer extends StdSerializer<Flowchart> {

    @Serial private static final long serialVersionUID = 3319205732470628416L;

    FlowchartSerializer() {
        super(Flowchart.class);
    }

    @Override
    public void serialize(Flowchart flowchart, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("title", flowchart.getTitle());

        gen.writeArrayFieldStart("nodes");
        for (Node node : flowchart.getNodes()) {
            gen.writeStartObject();
            gen.writeStringField("id", node.getId());
            gen.writeStringField("category", node.getCategory().name());
            gen.writeStringField("label", node.getLabel());
            gen.writeNumberField("confidence", node.getConfidence());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("connections");
        for (Connection connection : flowchart.getConnections()) {
            gen.writeStartObject();
            gen.writeStringField("from", connection.fromId());
            gen.writeStringField("to", connection.toId());
            gen.writeStringField("label", connection.label());
            gen.writeStringField("kind", connection.kind().name());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }
}
