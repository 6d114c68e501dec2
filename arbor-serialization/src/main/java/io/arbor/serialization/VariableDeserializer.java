package io.arbor.serialization;

import static io.arbor.serialization.JsonValues.doubleOrNull;
import static io.arbor.serialization.JsonValues.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.arbor.core.workflow.ValueRange;
import io.arbor.core.workflow.Variable;
import io.arbor.core.workflow.VariableSource;
import io.arbor.core.workflow.VariableType;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads variable declarations.
///
/// `type` is required and must name a known variable type; `source` defaults to `input`
/// when absent. `min`/`max` are accepted at the top level as well as inside `range`.
class VariableDeserializer extends StdDeserializer<Variable> {

    @Serial private static final long serialVersionUID = -5518047436300178251L;

    VariableDeserializer() {
        super(Variable.class);
    }

    @Override
    public Variable deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Variable must be a JSON object");
        }

        String id = textOrNull(root, "id");
        String rawType = textOrNull(root, "type");
        VariableType type = VariableType.fromWireName(rawType)
                .orElseThrow(() -> JsonMappingException.from(
                        p, "Variable '" + id + "' has unknown type: " + rawType));

        Variable.Builder builder = Variable.builder()
                .id(id)
                .name(textOrNull(root, "name"))
                .type(type)
                .description(textOrNull(root, "description"));

        JsonNode range = root.hasNonNull("range") ? root.get("range") : root;
        Double min = doubleOrNull(range, "min");
        Double max = doubleOrNull(range, "max");
        if (min != null || max != null) {
            builder.range(new ValueRange(min, max));
        }

        JsonNode enumValues = root.get("enum_values");
        if (enumValues != null && enumValues.isArray()) {
            List<String> values = new ArrayList<>();
            enumValues.forEach(value -> values.add(value.asText()));
            builder.enumValues(values);
        }

        String rawSource = textOrNull(root, "source");
        if (rawSource != null) {
            builder.source(VariableSource.fromWireName(rawSource)
                    .orElseThrow(() -> JsonMappingException.from(
                            p, "Variable '" + id + "' has unknown source: " + rawSource)));
        }

        try {
            return builder.build();
        } catch (IllegalStateException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
