package io.arbor.core.workflow;

import java.util.Locale;
import java.util.Optional;

/// Origin of a workflow variable.
public enum VariableSource {
    /// Supplied by the caller at execution time.
    INPUT("input"),
    /// Produced by a calculation node.
    CALCULATED("calculated"),
    /// Produced by a sub-workflow call.
    SUBPROCESS("subprocess");

    private final String wireName;

    VariableSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Looks up a source by wire name, case-insensitively. `subflow` is accepted as an
    /// alias of `subprocess`.
    ///
    /// @param name the wire name, may be null
    /// @return the matching source, or empty if unknown
    public static Optional<VariableSource> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("subflow")) {
            return Optional.of(SUBPROCESS);
        }
        for (VariableSource source : values()) {
            if (source.wireName.equals(normalized)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
