package io.arbor.core.validation;

import java.util.Objects;

/// A single validation finding.
///
/// @param code the rule that failed, not null
/// @param message human-readable description, not null
/// @param nodeId offending node, may be null
/// @param edgeId offending edge, may be null
public record ValidationError(ValidationCode code, String message, String nodeId, String edgeId) {

    public ValidationError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationError forNode(ValidationCode code, String message, String nodeId) {
        return new ValidationError(code, message, nodeId, null);
    }

    public static ValidationError forEdge(ValidationCode code, String message, String edgeId) {
        return new ValidationError(code, message, null, edgeId);
    }

    public static ValidationError global(ValidationCode code, String message) {
        return new ValidationError(code, message, null, null);
    }

    /// Formats the error as a bullet line with its location suffix.
    ///
    /// @return `  • message (node: id)`, `(edge: id)` or no suffix, never null
    public String formatLine() {
        String location = "";
        if (nodeId != null && !nodeId.isEmpty()) {
            location = " (node: " + nodeId + ")";
        } else if (edgeId != null && !edgeId.isEmpty()) {
            location = " (edge: " + edgeId + ")";
        }
        return "  • " + message + location;
    }
}
