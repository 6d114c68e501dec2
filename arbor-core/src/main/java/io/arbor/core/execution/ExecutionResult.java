package io.arbor.core.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Outcome of interpreting a workflow.
///
/// Exactly one of three shapes:
/// - success: `success=true`, `output` set
/// - failure: `success=false`, `error` set, `path` holds the nodes visited before failing
/// - stopped: `stopped=true`, the run was cancelled or stopped at a step boundary
///
/// @param success whether an end node was reached
/// @param output the end node output, may be null
/// @param path visited node ids in order, never null
/// @param context variable values keyed by id at the end of the run, never null
/// @param error failure message, null unless failed
/// @param subflowResults every sub-workflow call made, never null
/// @param stopped whether execution was stopped before completing
public record ExecutionResult(
        boolean success,
        Object output,
        List<String> path,
        Map<String, Object> context,
        String error,
        List<SubflowResult> subflowResults,
        boolean stopped) {

    public ExecutionResult {
        path = path != null ? Collections.unmodifiableList(new ArrayList<>(path)) : List.of();
        context =
                context != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                        : Map.of();
        subflowResults = subflowResults != null ? List.copyOf(subflowResults) : List.of();
    }

    public static ExecutionResult success(
            Object output,
            List<String> path,
            Map<String, Object> context,
            List<SubflowResult> subflowResults) {
        return new ExecutionResult(true, output, path, context, null, subflowResults, false);
    }

    public static ExecutionResult failure(
            String error,
            List<String> path,
            Map<String, Object> context,
            List<SubflowResult> subflowResults) {
        return new ExecutionResult(false, null, path, context, error, subflowResults, false);
    }

    public static ExecutionResult stopped(
            String reason,
            List<String> path,
            Map<String, Object> context,
            List<SubflowResult> subflowResults) {
        return new ExecutionResult(false, null, path, context, reason, subflowResults, true);
    }
}
