package io.arbor.core.workflow.node;

import java.util.Locale;
import java.util.Optional;

/// Node kinds understood by the engine.
///
/// `action` is accepted as an alias of {@link #PROCESS} and `output` as an alias of
/// {@link #END}. {@link #UNRECOGNIZED} marks nodes whose type string matched nothing.
public enum NodeType {
    START("start"),
    PROCESS("process"),
    DECISION("decision"),
    CALCULATION("calculation"),
    SUBPROCESS("subprocess"),
    END("end"),
    UNRECOGNIZED("unrecognized");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a document type string, accepting aliases.
    ///
    /// @param name the type string, may be null
    /// @return the known type, or empty for null or unrecognized strings
    public static Optional<NodeType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "start" -> Optional.of(START);
            case "process", "action" -> Optional.of(PROCESS);
            case "decision" -> Optional.of(DECISION);
            case "calculation" -> Optional.of(CALCULATION);
            case "subprocess" -> Optional.of(SUBPROCESS);
            case "end", "output" -> Optional.of(END);
            default -> Optional.empty();
        };
    }
}
