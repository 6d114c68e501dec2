package io.arbor.core.template;

import io.arbor.core.exception.EvaluationException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Resolves `{Name}` placeholders in output templates. Pure utility, no dependencies.
public interface TemplateResolver {

    /// Substitutes every placeholder with its value from the context.
    ///
    /// @param template the template text, may be null
    /// @param context placeholder name to value, not null
    /// @return the rendered text, never null (empty for a null template)
    /// @throws EvaluationException if a placeholder has no entry in the context
    String resolve(String template, Map<String, Object> context) throws EvaluationException;

    /// Lists the placeholder names in order of appearance.
    ///
    /// @param template the template text, may be null
    /// @return trimmed placeholder names, never null
    List<String> placeholders(String template);

    /// Returns the placeholder name when the whole template is exactly one placeholder.
    ///
    /// @param template the template text, may be null
    /// @return the name for templates like `{BMI}`, otherwise empty
    Optional<String> singlePlaceholder(String template);
}
