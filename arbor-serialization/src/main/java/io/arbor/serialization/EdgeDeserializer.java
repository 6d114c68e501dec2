package io.arbor.serialization;

import static io.arbor.serialization.JsonValues.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.arbor.core.workflow.Edge;
import java.io.IOException;
import java.io.Serial;

/// Reads edges, accepting `source`/`target` as aliases of `from`/`to`.
///
/// Dangling endpoints are kept; the validator reports them.
class EdgeDeserializer extends StdDeserializer<Edge> {

    @Serial private static final long serialVersionUID = -8830447120617361902L;

    EdgeDeserializer() {
        super(Edge.class);
    }

    @Override
    public Edge deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Edge must be a JSON object");
        }
        return new Edge(
                textOrNull(root, "id"),
                textOrNull(root, "from", "source"),
                textOrNull(root, "to", "target"),
                textOrNull(root, "label"));
    }
}
