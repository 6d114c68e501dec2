package io.arbor.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.exception.EvaluationException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class OutputTypesTest {

    @Test
    void shouldCastTextToDeclaredType() throws Exception {
        assertThat(OutputTypes.cast("int", " 42 ", null)).isEqualTo(42L);
        assertThat(OutputTypes.cast("float", "2.5", null)).isEqualTo(2.5);
        assertThat(OutputTypes.cast("NUMBER", 3L, null)).isEqualTo(3.0);
        assertThat(OutputTypes.cast("string", 16.0, null)).isEqualTo("16.0");
        assertThat(OutputTypes.cast(null, null, null)).isEqualTo("");
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "1", "YES", " on "})
    void shouldCastTruthyTextToTrue(String text) throws Exception {
        assertThat(OutputTypes.cast("bool", text, null)).isEqualTo(Boolean.TRUE);
    }

    @Test
    void shouldCastOtherTextToFalse() throws Exception {
        assertThat(OutputTypes.cast("bool", "nope", null)).isEqualTo(Boolean.FALSE);
    }

    @Test
    void shouldRejectNonNumericText() throws Exception {
        assertThatThrownBy(() -> OutputTypes.cast("float", "abc", null))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("Cannot cast output 'abc' to number");
    }

    @Test
    void shouldKeepJsonTextWithoutDecoder() throws Exception {
        assertThat(OutputTypes.cast("json", "[1]", null)).isEqualTo("[1]");
        assertThat(OutputTypes.cast("json", "[1]", text -> List.of(1L))).isEqualTo(List.of(1L));
    }

    @Test
    void shouldCoerceRawValuesWithoutText() throws Exception {
        assertThat(OutputTypes.coerceRaw("int", 5.9, null)).isEqualTo(5L);
        assertThat(OutputTypes.coerceRaw("float", 5L, null)).isEqualTo(5.0);
        assertThat(OutputTypes.coerceRaw("bool", false, null)).isEqualTo(Boolean.FALSE);
        assertThat(OutputTypes.coerceRaw("json", List.of("a"), null)).isEqualTo(List.of("a"));
    }

    @Test
    void shouldKeepRawValueOnlyForTypedOutputs() throws Exception {
        assertThat(OutputTypes.keepsRawValue("int")).isTrue();
        assertThat(OutputTypes.keepsRawValue("json")).isTrue();
        assertThat(OutputTypes.keepsRawValue("string")).isFalse();
        assertThat(OutputTypes.keepsRawValue(null)).isFalse();
    }

    @Test
    void shouldPreferWorkflowOutputType() throws Exception {
        assertThat(OutputTypes.effectiveType("int", "string")).isEqualTo("int");
        assertThat(OutputTypes.effectiveType(" ", "bool")).isEqualTo("bool");
    }
}
