package io.arbor.serialization;

import static io.arbor.serialization.JsonValues.doubleOrNull;
import static io.arbor.serialization.JsonValues.plain;
import static io.arbor.serialization.JsonValues.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.arbor.core.calculation.Calculation;
import io.arbor.core.calculation.Operand;
import io.arbor.core.condition.Condition;
import io.arbor.core.workflow.node.CalculationNode;
import io.arbor.core.workflow.node.DecisionNode;
import io.arbor.core.workflow.node.EndNode;
import io.arbor.core.workflow.node.Node;
import io.arbor.core.workflow.node.NodeType;
import io.arbor.core.workflow.node.ProcessNode;
import io.arbor.core.workflow.node.StartNode;
import io.arbor.core.workflow.node.SubprocessNode;
import io.arbor.core.workflow.node.UnrecognizedNode;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Deserializes JSON to the appropriate `Node` subtype using the `"type"` discriminator.
///
/// A missing or unknown `type` yields an {@link UnrecognizedNode} so the validator can
/// report it; the document as a whole is still readable. Missing common fields are left
/// null for the same reason.
///
/// ### Rejected input
/// - `input_mapping` that is not an object
/// - a `calculation` or `condition` that is not an object
/// - an operand that is neither `{kind: literal, value}` nor `{kind: variable, ref}`
///
/// @implNote Package-private. Registered by {@link ArborJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = 6021137785064425510L;

    NodeDeserializer() {
        super(Node.class);
    }

    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Node must be a JSON object");
        }

        String rawType = textOrNull(root, "type");
        Optional<NodeType> nodeType = NodeType.fromWireName(rawType);
        if (nodeType.isEmpty()) {
            return common(UnrecognizedNode.builder().rawType(rawType), root).build();
        }

        return switch (nodeType.get()) {
            case START -> common(StartNode.builder(), root).build();
            case PROCESS -> common(ProcessNode.builder(), root).build();
            case DECISION -> common(DecisionNode.builder(), root)
                    .condition(condition(p, mapper, root))
                    .build();
            case CALCULATION -> common(CalculationNode.builder(), root)
                    .calculation(calculation(p, mapper, root))
                    .build();
            case SUBPROCESS -> common(SubprocessNode.builder(), root)
                    .subworkflowId(textOrNull(root, "subworkflow_id"))
                    .inputMapping(inputMapping(p, root))
                    .outputVariable(textOrNull(root, "output_variable"))
                    .build();
            case END -> common(EndNode.builder(), root)
                    .outputType(textOrNull(root, "output_type"))
                    .outputTemplate(textOrNull(root, "output_template"))
                    .outputValue(plain(mapper, root.get("output_value")))
                    .build();
            case UNRECOGNIZED -> common(UnrecognizedNode.builder().rawType(rawType), root).build();
        };
    }

    private static <N extends Node, B extends Node.Builder<N, B>> B common(B builder, JsonNode root) {
        return builder.id(textOrNull(root, "id"))
                .label(textOrNull(root, "label"))
                .position(doubleOrNull(root, "x"), doubleOrNull(root, "y"));
    }

    private static Condition.Structured condition(JsonParser p, ObjectMapper mapper, JsonNode root)
            throws IOException {
        if (!root.hasNonNull("condition")) {
            return null;
        }
        JsonNode condition = root.get("condition");
        if (!condition.isObject()) {
            throw JsonMappingException.from(
                    p, "Node '" + textOrNull(root, "id") + "': condition must be an object");
        }
        return new Condition.Structured(
                textOrNull(condition, "input_id"),
                textOrNull(condition, "comparator"),
                plain(mapper, condition.get("value")),
                plain(mapper, condition.get("value2")));
    }

    private static Calculation calculation(JsonParser p, ObjectMapper mapper, JsonNode root)
            throws IOException {
        if (!root.hasNonNull("calculation")) {
            return null;
        }
        String nodeId = textOrNull(root, "id");
        JsonNode calculation = root.get("calculation");
        if (!calculation.isObject()) {
            throw JsonMappingException.from(
                    p, "Node '" + nodeId + "': calculation must be an object");
        }

        String outputName = null;
        JsonNode output = calculation.get("output");
        if (output != null && output.isObject()) {
            outputName = textOrNull(output, "name");
        } else if (output != null && output.isTextual()) {
            outputName = output.asText();
        }

        List<Operand> operands = new ArrayList<>();
        JsonNode array = calculation.get("operands");
        if (array != null && !array.isNull()) {
            if (!array.isArray()) {
                throw JsonMappingException.from(
                        p, "Node '" + nodeId + "': calculation operands must be an array");
            }
            for (JsonNode operand : array) {
                operands.add(operand(p, mapper, nodeId, operand));
            }
        }
        return new Calculation(outputName, textOrNull(calculation, "operator"), operands);
    }

    private static Operand operand(JsonParser p, ObjectMapper mapper, String nodeId, JsonNode operand)
            throws IOException {
        if (operand.isNumber()) {
            return new Operand.Literal(operand.doubleValue());
        }
        String kind = textOrNull(operand, "kind");
        if ("literal".equalsIgnoreCase(kind)) {
            Object value = plain(mapper, operand.get("value"));
            if (value instanceof Number number) {
                return new Operand.Literal(number.doubleValue());
            }
            if (value instanceof String text) {
                try {
                    return new Operand.Literal(Double.parseDouble(text.trim()));
                } catch (NumberFormatException e) {
                    throw JsonMappingException.from(
                            p, "Node '" + nodeId + "': literal operand '" + text + "' is not a number", e);
                }
            }
            throw JsonMappingException.from(
                    p, "Node '" + nodeId + "': literal operand needs a numeric value");
        }
        String ref = textOrNull(operand, "ref");
        if (ref != null && (kind == null || "variable".equalsIgnoreCase(kind))) {
            return new Operand.Reference(ref);
        }
        throw JsonMappingException.from(
                p, "Node '" + nodeId + "': unsupported operand " + operand);
    }

    private static Map<String, String> inputMapping(JsonParser p, JsonNode root) throws IOException {
        if (!root.hasNonNull("input_mapping")) {
            return Map.of();
        }
        JsonNode mapping = root.get("input_mapping");
        if (!mapping.isObject()) {
            throw JsonMappingException.from(
                    p,
                    "Node '" + textOrNull(root, "id") + "': input_mapping must be an object, got "
                            + mapping.getNodeType().name().toLowerCase());
        }
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), field.getValue().isNull() ? null : field.getValue().asText());
        }
        return result;
    }
}
