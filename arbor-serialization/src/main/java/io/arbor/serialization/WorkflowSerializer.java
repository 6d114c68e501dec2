package io.arbor.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.arbor.core.workflow.Workflow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Utility class for serializing and deserializing Arbor workflows to/from JSON.
///
/// ### Usage
/// {@snippet :
/// // Serialize
/// String json = WorkflowSerializer.toJson(workflow);
///
/// // Deserialize
/// Workflow restored = WorkflowSerializer.fromJson(json);
///
/// // Custom ObjectMapper
/// ObjectMapper mapper = WorkflowSerializer.createMapper();
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see ArborJacksonModule for the registered type handlers
public final class WorkflowSerializer {

    private WorkflowSerializer() {}

    /// Serializes a workflow to pretty-printed JSON.
    ///
    /// @param workflow the workflow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Workflow workflow) {
        try {
            return createMapper().writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow: " + e.getMessage(), e);
        }
    }

    /// Deserializes a workflow from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized workflow, never null
    /// @throws IllegalArgumentException if the document is malformed
    public static Workflow fromJson(String json) {
        try {
            return createMapper().readValue(json, Workflow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow: " + e.getOriginalMessage(), e);
        }
    }

    /// Reads a workflow document from a file.
    ///
    /// @param file path to a JSON document, not null
    /// @return deserialized workflow, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the document is malformed
    public static Workflow read(Path file) throws IOException {
        return fromJson(Files.readString(file));
    }

    /// Creates an ObjectMapper configured for Arbor workflow documents.
    ///
    /// Registers:
    /// - `ArborJacksonModule` for the workflow model
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled, so editor-only fields are ignored
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ArborJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
