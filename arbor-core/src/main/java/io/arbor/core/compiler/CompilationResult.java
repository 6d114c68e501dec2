package io.arbor.core.compiler;

import java.util.List;

/// Outcome of compiling a workflow to Java source.
///
/// A successful result may still carry warnings for nodes that were lowered to fallback
/// code. A failed result has no code.
///
/// @param success whether source was produced
/// @param code the generated compilation unit, null on failure
/// @param error the structural failure, null on success
/// @param warnings node-level issues in discovery order, never null
public record CompilationResult(
        boolean success, String code, String error, List<String> warnings) {

    public CompilationResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static CompilationResult success(String code, List<String> warnings) {
        return new CompilationResult(true, code, null, warnings);
    }

    public static CompilationResult failure(String error) {
        return new CompilationResult(false, null, error, List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
