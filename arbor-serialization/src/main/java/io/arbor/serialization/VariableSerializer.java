package io.arbor.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.arbor.core.workflow.ValueRange;
import io.arbor.core.workflow.Variable;
import java.io.IOException;
import java.io.Serial;

/// Writes variables with wire-format type and source names.
class VariableSerializer extends StdSerializer<Variable> {

    @Serial private static final long serialVersionUID = 2291860053178244417L;

    VariableSerializer() {
        super(Variable.class);
    }

    @Override
    public void serialize(Variable variable, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", variable.getId());
        if (variable.getName() != null) {
            gen.writeStringField("name", variable.getName());
        }
        gen.writeStringField("type", variable.getType().wireName());

        ValueRange range = variable.getRange();
        if (range != null && (range.min() != null || range.max() != null)) {
            gen.writeObjectFieldStart("range");
            if (range.min() != null) {
                gen.writeNumberField("min", range.min());
            }
            if (range.max() != null) {
                gen.writeNumberField("max", range.max());
            }
            gen.writeEndObject();
        }
        if (!variable.getEnumValues().isEmpty()) {
            gen.writeArrayFieldStart("enum_values");
            for (String value : variable.getEnumValues()) {
                gen.writeString(value);
            }
            gen.writeEndArray();
        }
        gen.writeStringField("source", variable.getSource().wireName());
        if (variable.getDescription() != null) {
            gen.writeStringField("description", variable.getDescription());
        }
        gen.writeEndObject();
    }
}
