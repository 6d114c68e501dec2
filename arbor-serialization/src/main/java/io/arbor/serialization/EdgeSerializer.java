package io.arbor.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.arbor.core.workflow.Edge;
import java.io.IOException;
import java.io.Serial;

/// Writes edges as `{id, from, to, label}`, omitting a null label.
class EdgeSerializer extends StdSerializer<Edge> {

    @Serial private static final long serialVersionUID = 4417508312865523870L;

    EdgeSerializer() {
        super(Edge.class);
    }

    @Override
    public void serialize(Edge edge, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", edge.id());
        gen.writeStringField("from", edge.from());
        gen.writeStringField("to", edge.to());
        if (edge.label() != null) {
            gen.writeStringField("label", edge.label());
        }
        gen.writeEndObject();
    }
}
