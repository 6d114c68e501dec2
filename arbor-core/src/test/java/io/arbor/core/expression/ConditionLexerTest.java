package io.arbor.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.exception.ConditionSyntaxException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConditionLexerTest {

    @Test
    void shouldTokenizeComparisonWithKeywords() throws Exception {
        // When
        List<Token> tokens = new ConditionLexer("Age >= 18 and not Smoker == True").tokenize();

        // Then
        assertThat(tokens)
                .extracting(Token::type)
                .containsExactly(
                        TokenType.IDENTIFIER,
                        TokenType.GTE,
                        TokenType.NUMBER,
                        TokenType.AND,
                        TokenType.NOT,
                        TokenType.IDENTIFIER,
                        TokenType.EQ,
                        TokenType.BOOL,
                        TokenType.EOF);
        assertThat(tokens.get(2).value()).isEqualTo(18L);
        assertThat(tokens.get(7).value()).isEqualTo(Boolean.TRUE);
    }

    @Test
    void shouldDecodeIntegersAsLongAndDecimalsAsDouble() throws Exception {
        // When
        List<Token> tokens = new ConditionLexer("42 18.5").tokenize();

        // Then
        assertThat(tokens.get(0).value()).isInstanceOf(Long.class).isEqualTo(42L);
        assertThat(tokens.get(1).value()).isInstanceOf(Double.class).isEqualTo(18.5);
    }

    @Test
    void shouldReadBothQuoteStylesWithoutEscapes() throws Exception {
        // When
        List<Token> tokens = new ConditionLexer("'single' \"dou\\ble\"").tokenize();

        // Then
        assertThat(tokens.get(0)).isEqualTo(new Token(TokenType.STRING, "single", 0));
        assertThat(tokens.get(1).value()).isEqualTo("dou\\ble");
    }

    @Test
    void shouldRecordTokenPositions() throws Exception {
        // When
        List<Token> tokens = new ConditionLexer("  x != 3").tokenize();

        // Then
        assertThat(tokens).extracting(Token::position).containsExactly(2, 4, 7, 8);
    }

    @Test
    void shouldEndEmptyInputWithEof() throws Exception {
        assertThat(new ConditionLexer(null).tokenize())
                .containsExactly(new Token(TokenType.EOF, null, 0));
    }

    @Test
    void shouldRejectUnexpectedCharacter() {
        assertThatThrownBy(() -> new ConditionLexer("a & b").tokenize())
                .isInstanceOf(ConditionSyntaxException.class)
                .hasMessageContaining("Unexpected character '&'")
                .extracting(e -> ((ConditionSyntaxException) e).getPosition())
                .isEqualTo(2);
    }

    @Test
    void shouldRejectLoneExclamationMark() {
        assertThatThrownBy(() -> new ConditionLexer("!x").tokenize())
                .isInstanceOf(ConditionSyntaxException.class);
    }

    @Test
    void shouldRejectNumberWithTwoDecimalPoints() {
        assertThatThrownBy(() -> new ConditionLexer("1.2.3").tokenize())
                .isInstanceOf(ConditionSyntaxException.class)
                .hasMessageContaining("Invalid number format");
    }

    @Test
    void shouldRejectUnclosedString() {
        assertThatThrownBy(() -> new ConditionLexer("Name == 'bob").tokenize())
                .isInstanceOf(ConditionSyntaxException.class)
                .hasMessageContaining("Unclosed string");
    }
}
