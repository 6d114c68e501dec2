package io.arbor.core.validation;

/// Machine-readable validation error codes.
///
/// Codes flagged {@code structural} are reported in every {@link ValidationMode}; the rest
/// only in {@link ValidationMode#STRICT}.
public enum ValidationCode {
    INCOMPLETE_NODE(true),
    INVALID_NODE_TYPE(true),
    DUPLICATE_NODE_ID(true),
    DUPLICATE_EDGE_ID(true),
    INVALID_EDGE_SOURCE(true),
    INVALID_EDGE_TARGET(true),
    MULTIPLE_START_NODES(true),
    SELF_LOOP_DETECTED(true),
    CYCLE_DETECTED(true),

    NO_START_NODE(false),
    MISSING_OUTGOING_EDGE(false),
    END_HAS_OUTGOING(false),
    DECISION_NEEDS_BRANCHES(false),
    DECISION_MISSING_LABELS(false),
    UNREACHABLE_NODE(false),
    MISSING_CONDITION(false),
    MISSING_CONDITION_INPUT_ID(false),
    MISSING_CONDITION_COMPARATOR(false),
    INVALID_CONDITION_INPUT_ID(false),
    INVALID_COMPARATOR(false),
    INVALID_COMPARATOR_FOR_TYPE(false),
    MISSING_CONDITION_VALUE2(false),
    INVALID_INPUT_REF(false),
    MISSING_SUBWORKFLOW_ID(false),
    MISSING_OUTPUT_VARIABLE(false),
    INVALID_OUTPUT_VARIABLE(false),
    INVALID_INPUT_MAPPING(false),
    MISSING_CALCULATION_OUTPUT(false),
    INVALID_OPERATOR(false),
    INVALID_OPERAND_COUNT(false),
    INVALID_OPERAND_REF(false),
    INVALID_TEMPLATE_VARIABLE(false),
    INVALID_LABEL_VARIABLE(false),
    OUTPUT_TYPE_MISMATCH(false);

    private final boolean structural;

    ValidationCode(boolean structural) {
        this.structural = structural;
    }

    /// @return `true` if the rule runs in lenient mode too
    public boolean isStructural() {
        return structural;
    }
}
