package io.arbor.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.arbor.core.calculation.Calculation;
import io.arbor.core.calculation.Operand;
import io.arbor.core.condition.Condition;
import io.arbor.core.workflow.node.CalculationNode;
import io.arbor.core.workflow.node.DecisionNode;
import io.arbor.core.workflow.node.EndNode;
import io.arbor.core.workflow.node.Node;
import io.arbor.core.workflow.node.SubprocessNode;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes `Node` subtypes to flat JSON objects with a `"type"` discriminator.
///
/// Null fields are omitted. Unrecognized nodes are written back with their original
/// type string so a load/save cycle does not lose information.
///
/// @implNote Package-private. Registered by {@link ArborJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = -3124680017329946615L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        writeStringIfPresent(gen, "id", node.getId());
        writeStringIfPresent(gen, "type", node.getTypeName());
        writeStringIfPresent(gen, "label", node.getLabel());
        if (node.getX() != null) {
            gen.writeNumberField("x", node.getX());
        }
        if (node.getY() != null) {
            gen.writeNumberField("y", node.getY());
        }

        if (node instanceof DecisionNode decision) {
            writeCondition(gen, provider, decision.getCondition());
        } else if (node instanceof CalculationNode calculation) {
            writeCalculation(gen, calculation.getCalculation());
        } else if (node instanceof SubprocessNode subprocess) {
            writeStringIfPresent(gen, "subworkflow_id", subprocess.getSubworkflowId());
            if (!subprocess.getInputMapping().isEmpty()) {
                gen.writeObjectFieldStart("input_mapping");
                for (Map.Entry<String, String> entry : subprocess.getInputMapping().entrySet()) {
                    gen.writeStringField(entry.getKey(), entry.getValue());
                }
                gen.writeEndObject();
            }
            writeStringIfPresent(gen, "output_variable", subprocess.getOutputVariable());
        } else if (node instanceof EndNode end) {
            writeStringIfPresent(gen, "output_type", end.getOutputType());
            writeStringIfPresent(gen, "output_template", end.getOutputTemplate());
            if (end.getOutputValue() != null) {
                gen.writeFieldName("output_value");
                provider.defaultSerializeValue(end.getOutputValue(), gen);
            }
        }
        gen.writeEndObject();
    }

    private static void writeCondition(
            JsonGenerator gen, SerializerProvider provider, Condition.Structured condition)
            throws IOException {
        if (condition == null) {
            return;
        }
        gen.writeObjectFieldStart("condition");
        writeStringIfPresent(gen, "input_id", condition.inputId());
        writeStringIfPresent(gen, "comparator", condition.comparator());
        if (condition.value() != null) {
            gen.writeFieldName("value");
            provider.defaultSerializeValue(condition.value(), gen);
        }
        if (condition.value2() != null) {
            gen.writeFieldName("value2");
            provider.defaultSerializeValue(condition.value2(), gen);
        }
        gen.writeEndObject();
    }

    private static void writeCalculation(JsonGenerator gen, Calculation calculation)
            throws IOException {
        if (calculation == null) {
            return;
        }
        gen.writeObjectFieldStart("calculation");
        if (calculation.outputName() != null) {
            gen.writeObjectFieldStart("output");
            gen.writeStringField("name", calculation.outputName());
            gen.writeEndObject();
        }
        writeStringIfPresent(gen, "operator", calculation.operator());
        gen.writeArrayFieldStart("operands");
        for (Operand operand : calculation.operands()) {
            gen.writeStartObject();
            if (operand instanceof Operand.Literal literal) {
                gen.writeStringField("kind", "literal");
                gen.writeNumberField("value", literal.value());
            } else if (operand instanceof Operand.Reference reference) {
                gen.writeStringField("kind", "variable");
                gen.writeStringField("ref", reference.ref());
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeStringIfPresent(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
