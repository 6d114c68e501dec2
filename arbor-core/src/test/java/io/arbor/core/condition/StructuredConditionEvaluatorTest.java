package io.arbor.core.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.exception.EvaluationException;
import java.time.LocalDateTime;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StructuredConditionEvaluatorTest {

    private final StructuredConditionEvaluator evaluator = new StructuredConditionEvaluator();

    @Nested
    @DisplayName("numeric comparators")
    class Numeric {

        @Test
        void shouldMatchBmiBelowSixteen() throws Exception {
            // Given
            Condition.Structured condition = Condition.Structured.of("var_bmi_float", "lt", 16);

            // When / Then
            assertThat(evaluator.evaluate(condition, Map.of("var_bmi_float", 15.2))).isTrue();
            assertThat(evaluator.evaluate(condition, Map.of("var_bmi_float", 16.0))).isFalse();
        }

        @ParameterizedTest
        @CsvSource({"10, true", "15, true", "20, true", "9.99, false", "20.01, false"})
        void shouldIncludeBothBoundsOfRange(double value, boolean expected) throws Exception {
            // Given
            Condition.Structured condition =
                    Condition.Structured.between("x", "within_range", 10, 20);

            // When / Then
            assertThat(evaluator.evaluate(condition, Map.of("x", value))).isEqualTo(expected);
        }

        @Test
        void shouldParseNumericStrings() throws Exception {
            assertThat(evaluator.evaluate(Condition.Structured.of("x", "gte", "5"), Map.of("x", " 7 ")))
                    .isTrue();
        }

        @Test
        void shouldRejectBooleanOperand() {
            assertThatThrownBy(
                            () -> evaluator.evaluate(
                                    Condition.Structured.of("x", "eq", 1), Map.of("x", true)))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessageContaining("cannot be applied to a boolean value");
        }

        @Test
        void shouldRequireSecondValueForRange() {
            assertThatThrownBy(
                            () -> evaluator.evaluate(
                                    Condition.Structured.of("x", "within_range", 1), Map.of("x", 2)))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("Comparator 'within_range' requires value2");
        }
    }

    @Nested
    @DisplayName("boolean comparators")
    class Bool {

        @Test
        void shouldEvaluateIsTrueAndIsFalse() throws Exception {
            Map<String, Object> context = Map.of("flag", true);

            assertThat(evaluator.evaluate(Condition.Structured.of("flag", "is_true", null), context))
                    .isTrue();
            assertThat(evaluator.evaluate(Condition.Structured.of("flag", "is_false", null), context))
                    .isFalse();
        }

        @Test
        void shouldRejectNonBoolean() {
            assertThatThrownBy(
                            () -> evaluator.evaluate(
                                    Condition.Structured.of("flag", "is_true", null),
                                    Map.of("flag", "yes")))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessageContaining("requires a boolean value, got String");
        }
    }

    @Nested
    @DisplayName("text comparators")
    class Text {

        @Test
        void shouldIgnoreCase() throws Exception {
            Map<String, Object> context = Map.of("status", "Gold Member");

            assertThat(evaluate("str_eq", "gold member", context)).isTrue();
            assertThat(evaluate("str_contains", "MEMBER", context)).isTrue();
            assertThat(evaluate("str_starts_with", "gold", context)).isTrue();
            assertThat(evaluate("str_ends_with", "gold", context)).isFalse();
            assertThat(evaluate("enum_neq", "silver", context)).isTrue();
        }

        private boolean evaluate(String comparator, Object value, Map<String, Object> context)
                throws EvaluationException {
            return evaluator.evaluate(Condition.Structured.of("status", comparator, value), context);
        }
    }

    @Nested
    @DisplayName("date comparators")
    class Dates {

        @Test
        void shouldTreatPlainDateAsMidnight() throws Exception {
            assertThat(evaluator.evaluate(
                            Condition.Structured.of("d", "date_eq", "2024-03-01"),
                            Map.of("d", "2024-03-01T00:00:00")))
                    .isTrue();
        }

        @Test
        void shouldIncludeBothBoundsOfDateBetween() throws Exception {
            Condition.Structured condition =
                    Condition.Structured.between("d", "date_between", "2024-01-01", "2024-12-31");

            assertThat(evaluator.evaluate(condition, Map.of("d", "2024-12-31"))).isTrue();
            assertThat(evaluator.evaluate(condition, Map.of("d", "2025-01-01"))).isFalse();
        }

        @Test
        void shouldAcceptOffsetDateTimes() throws Exception {
            assertThat(StructuredConditionEvaluator.toDateTime("2024-05-06T07:08:09+02:00"))
                    .isEqualTo(LocalDateTime.of(2024, 5, 6, 7, 8, 9));
        }

        @Test
        void shouldRejectMalformedDate() {
            assertThatThrownBy(
                            () -> evaluator.evaluate(
                                    Condition.Structured.of("d", "date_before", "tomorrow"),
                                    Map.of("d", "2024-01-01")))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("Invalid ISO-8601 date: 'tomorrow'");
        }
    }

    @Test
    void shouldFailWhenVariableMissing() {
        assertThatThrownBy(
                        () -> evaluator.evaluate(Condition.Structured.of("x", "eq", 1), Map.of()))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Variable 'x' not found in context");
    }

    @Test
    void shouldFailOnUnknownComparator() {
        assertThatThrownBy(
                        () -> evaluator.evaluate(
                                Condition.Structured.of("x", "approx", 1), Map.of("x", 1)))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Unknown comparator: 'approx'");
    }
}
