package io.arbor.core.validation;

import java.util.List;

/// Outcome of validating a workflow.
///
/// @param valid `true` when no errors were found
/// @param errors every error found, in rule order, never null
public record ValidationResult(boolean valid, List<ValidationError> errors) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ValidationResult of(List<ValidationError> errors) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors);
    }

    /// Returns whether any error carries the given code.
    ///
    /// @param code the code to look for, not null
    /// @return `true` if at least one error matches
    public boolean hasError(ValidationCode code) {
        return errors.stream().anyMatch(e -> e.code() == code);
    }

    /// Returns the errors carrying the given code.
    ///
    /// @param code the code to filter on, not null
    /// @return matching errors, never null
    public List<ValidationError> errorsWithCode(ValidationCode code) {
        return errors.stream().filter(e -> e.code() == code).toList();
    }

    /// Renders the errors for humans.
    ///
    /// @return `Workflow validation failed:` followed by one bullet line per error, or an
    /// empty string when valid
    public String format() {
        if (errors.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Workflow validation failed:");
        for (ValidationError error : errors) {
            sb.append('\n').append(error.formatLine());
        }
        return sb.toString();
    }
}
