package io.arbor.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Record of one sub-workflow call made during an execution.
///
/// @param nodeId the calling subprocess node, not null
/// @param subworkflowId id of the called workflow, not null
/// @param subworkflowName display name of the called workflow, may be null
/// @param inputs values passed in, keyed by the sub-workflow's input ids, not null
/// @param outputVariable name the output was exposed under in the caller
/// @param success whether the sub-workflow reached an end node
/// @param output the sub-workflow output, null on failure
/// @param error the failure message, null on success
public record SubflowResult(
        String nodeId,
        String subworkflowId,
        String subworkflowName,
        Map<String, Object> inputs,
        String outputVariable,
        boolean success,
        Object output,
        String error) {

    public SubflowResult {
        inputs =
                inputs != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs))
                        : Map.of();
    }
}
