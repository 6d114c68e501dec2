package io.arbor.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.exception.EvaluationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private boolean eval(String condition, Map<String, Object> context) throws Exception {
        return evaluator.evaluate(ConditionParser.parse(condition), context);
    }

    @Test
    void shouldEvaluateNumericRange() throws Exception {
        assertThat(eval("BMI >= 18.5 AND BMI < 25", Map.of("BMI", 22.0))).isTrue();
        assertThat(eval("BMI >= 18.5 AND BMI < 25", Map.of("BMI", 25L))).isFalse();
    }

    @Test
    void shouldCompareIntegralAndDecimalByValue() throws Exception {
        assertThat(eval("x == 3", Map.of("x", 3.0))).isTrue();
        assertThat(eval("x != 3.5", Map.of("x", 3L))).isTrue();
    }

    @Test
    void shouldCompareStringsLexicographically() throws Exception {
        assertThat(eval("Name < 'bob'", Map.of("Name", "alice"))).isTrue();
        assertThat(eval("Name == \"alice\"", Map.of("Name", "alice"))).isTrue();
    }

    @Test
    void shouldOrderBooleansFalseBeforeTrue() throws Exception {
        assertThat(eval("Flag > false", Map.of("Flag", true))).isTrue();
    }

    @Test
    void shouldShortCircuitAndBeforeMissingVariable() throws Exception {
        // Given a context without "Missing"
        Map<String, Object> context = Map.of("Enabled", false);

        // When / Then
        assertThat(eval("Enabled AND Missing > 1", context)).isFalse();
        assertThat(eval("NOT Enabled OR Missing > 1", context)).isTrue();
    }

    @Test
    void shouldApplyTruthinessToBareValues() throws Exception {
        Map<String, Object> context = new HashMap<>();
        context.put("Zero", 0L);
        context.put("Empty", "");
        context.put("Nothing", null);
        context.put("Items", List.of());

        assertThat(eval("Zero", context)).isFalse();
        assertThat(eval("Empty", context)).isFalse();
        assertThat(eval("Nothing", context)).isFalse();
        assertThat(eval("Items", context)).isTrue();
        assertThat(eval("NOT Zero", context)).isTrue();
    }

    @Test
    void shouldFailOnMissingVariable() {
        assertThatThrownBy(() -> eval("Age > 18", Map.of()))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Variable 'Age' not found in context");
    }

    @Test
    void shouldFailOnMixedTypeOrdering() {
        assertThatThrownBy(() -> eval("Age > 'old'", Map.of("Age", 30L)))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Cannot compare Long and String with operator '>'");
    }

    @Test
    void shouldTreatMixedTypeEqualityAsFalse() throws Exception {
        assertThat(eval("Age == '30'", Map.of("Age", 30L))).isFalse();
    }

    @Test
    void shouldBeDeterministicAcrossCalls() throws Exception {
        // Given
        Expr expr = ConditionParser.parse("a > 1 OR b == 'x'");
        Map<String, Object> context = Map.of("a", 0L, "b", "x");

        // When / Then
        for (int i = 0; i < 5; i++) {
            assertThat(evaluator.evaluate(expr, context)).isTrue();
        }
    }
}
