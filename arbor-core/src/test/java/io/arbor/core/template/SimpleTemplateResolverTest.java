package io.arbor.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.exception.EvaluationException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleTemplateResolverTest {

    private final TemplateResolver resolver = new SimpleTemplateResolver();

    @Test
    void shouldSubstitutePlaceholders() throws Exception {
        // Given
        Map<String, Object> context = Map.of("Name", "Ada", "Score", 72L, "Ratio", 0.5);

        // When
        String result = resolver.resolve("{Name} scored { Score } ({Ratio})", context);

        // Then
        assertThat(result).isEqualTo("Ada scored 72 (0.5)");
    }

    @Test
    void shouldKeepRegexCharactersInValuesLiteral() throws Exception {
        assertThat(resolver.resolve("Cost: {Price}", Map.of("Price", "$5\\each")))
                .isEqualTo("Cost: $5\\each");
    }

    @Test
    void shouldFailOnUnknownPlaceholder() throws Exception {
        assertThatThrownBy(() -> resolver.resolve("Hi {Missing}", Map.of()))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Output template references unknown variable 'Missing'");
    }

    @Test
    void shouldRenderNullTemplateAsEmpty() throws Exception {
        assertThat(resolver.resolve(null, Map.of())).isEmpty();
        assertThat(resolver.placeholders(null)).isEmpty();
    }

    @Test
    void shouldListPlaceholdersInOrder() throws Exception {
        assertThat(resolver.placeholders("{B} then {A} then {B}")).containsExactly("B", "A", "B");
    }

    @Test
    void shouldDetectSinglePlaceholderTemplates() throws Exception {
        assertThat(resolver.singlePlaceholder(" {BMI} ")).contains("BMI");
        assertThat(resolver.singlePlaceholder("BMI: {BMI}")).isEmpty();
        assertThat(resolver.singlePlaceholder("{A}{B}")).isEmpty();
        assertThat(resolver.singlePlaceholder(null)).isEmpty();
    }
}
