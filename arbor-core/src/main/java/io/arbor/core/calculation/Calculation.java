package io.arbor.core.calculation;

import io.arbor.core.workflow.Identifiers;
import java.util.List;

/// Arithmetic carried by a calculation node.
///
/// The result is stored under the derived id `var_calc_{slug}_number` (see
/// {@link #derivedVariableId()}) and is visible to later nodes by its output name.
///
/// @param outputName friendly name of the result, may be null in partially-built workflows
/// @param operator operator wire name, may be null or unknown; checked at validation time
/// @param operands operand list in application order, never null
public record Calculation(String outputName, String operator, List<Operand> operands) {

    public Calculation {
        operands = operands != null ? List.copyOf(operands) : List.of();
    }

    /// Returns the derived variable id for the result.
    ///
    /// @return `var_calc_{slug}_number`, never null
    public String derivedVariableId() {
        return Identifiers.calculationVariableId(outputName);
    }
}
