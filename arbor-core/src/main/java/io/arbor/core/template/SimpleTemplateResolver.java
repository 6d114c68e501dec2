package io.arbor.core.template;

import io.arbor.core.exception.EvaluationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Simple template resolver using regex.
///
/// Values render with `String.valueOf`, so a `Double` prints as `72.0` and a `Long` as `72`.
public class SimpleTemplateResolver implements TemplateResolver {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{([^}]+)}");

    @Override
    public String resolve(String template, Map<String, Object> context)
            throws EvaluationException {
        if (template == null) {
            return "";
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String variable = matcher.group(1).trim();
            if (!context.containsKey(variable)) {
                throw new EvaluationException(
                        "Output template references unknown variable '" + variable + "'");
            }
            String replacement = String.valueOf(context.get(variable));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public List<String> placeholders(String template) {
        List<String> names = new ArrayList<>();
        if (template == null) {
            return names;
        }
        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1).trim());
        }
        return names;
    }

    @Override
    public Optional<String> singlePlaceholder(String template) {
        if (template == null) {
            return Optional.empty();
        }
        Matcher matcher = TEMPLATE_PATTERN.matcher(template.trim());
        return matcher.matches() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }
}
