package io.arbor.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/// Tree-reading helpers shared by the deserializers.
final class JsonValues {

    private JsonValues() {}

    static String textOrNull(JsonNode root, String field) {
        return root.hasNonNull(field) ? root.get(field).asText() : null;
    }

    /// Returns the first present field among the given names as text.
    static String textOrNull(JsonNode root, String field, String alias) {
        String value = textOrNull(root, field);
        return value != null ? value : textOrNull(root, alias);
    }

    static Double doubleOrNull(JsonNode root, String field) {
        if (!root.hasNonNull(field)) {
            return null;
        }
        JsonNode value = root.get(field);
        if (value.isNumber()) {
            return value.doubleValue();
        }
        String text = value.asText().trim();
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /// Converts a JSON value to a plain Java value.
    ///
    /// Integral numbers become `Long`, other numbers `Double`; objects and arrays become
    /// `Map` and `List`.
    static Object plain(ObjectMapper mapper, JsonNode value) throws IOException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        return mapper.treeToValue(value, Object.class);
    }
}
