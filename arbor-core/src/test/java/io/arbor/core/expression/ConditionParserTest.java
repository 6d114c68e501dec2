package io.arbor.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.arbor.core.exception.ConditionSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConditionParserTest {

    @Nested
    @DisplayName("precedence")
    class Precedence {

        @Test
        void shouldBindAndTighterThanOr() throws Exception {
            // When
            Expr expr = ConditionParser.parse("a OR b AND c");

            // Then
            assertThat(expr)
                    .isEqualTo(
                            new Expr.BinaryOp(
                                    new Expr.VariableRef("a"),
                                    ExpressionOperator.OR,
                                    new Expr.BinaryOp(
                                            new Expr.VariableRef("b"),
                                            ExpressionOperator.AND,
                                            new Expr.VariableRef("c"))));
        }

        @Test
        void shouldApplyNotToComparison() throws Exception {
            // When
            Expr expr = ConditionParser.parse("NOT x > 3");

            // Then
            assertThat(expr)
                    .isEqualTo(
                            new Expr.UnaryOp(
                                    ExpressionOperator.NOT,
                                    new Expr.BinaryOp(
                                            new Expr.VariableRef("x"),
                                            ExpressionOperator.GT,
                                            new Expr.Literal(3L))));
        }

        @Test
        void shouldNestNotRightAssociatively() throws Exception {
            // When
            Expr expr = ConditionParser.parse("NOT NOT flag");

            // Then
            assertThat(expr)
                    .isEqualTo(
                            new Expr.UnaryOp(
                                    ExpressionOperator.NOT,
                                    new Expr.UnaryOp(
                                            ExpressionOperator.NOT, new Expr.VariableRef("flag"))));
        }

        @Test
        void shouldLetParenthesesOverridePrecedence() throws Exception {
            // When
            Expr expr = ConditionParser.parse("(a OR b) AND c");

            // Then
            assertThat(expr).isInstanceOf(Expr.BinaryOp.class);
            assertThat(((Expr.BinaryOp) expr).operator()).isEqualTo(ExpressionOperator.AND);
        }

        @Test
        void shouldFoldLeftForRepeatedOr() throws Exception {
            // When
            Expr expr = ConditionParser.parse("a OR b OR c");

            // Then
            Expr.BinaryOp root = (Expr.BinaryOp) expr;
            assertThat(root.right()).isEqualTo(new Expr.VariableRef("c"));
            assertThat(root.left()).isInstanceOf(Expr.BinaryOp.class);
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        void shouldRejectBlankCondition(String text) {
            assertThatThrownBy(() -> ConditionParser.parse(text))
                    .isInstanceOf(ConditionSyntaxException.class)
                    .hasMessage("Empty condition string");
        }

        @Test
        void shouldRejectNullCondition() {
            assertThatThrownBy(() -> ConditionParser.parse(null))
                    .isInstanceOf(ConditionSyntaxException.class);
        }

        @Test
        void shouldRejectMissingOperand() {
            assertThatThrownBy(() -> ConditionParser.parse("Age >="))
                    .isInstanceOf(ConditionSyntaxException.class)
                    .hasMessageContaining("Expected operand");
        }

        @Test
        void shouldRejectUnclosedParenthesis() {
            assertThatThrownBy(() -> ConditionParser.parse("(a AND b"))
                    .isInstanceOf(ConditionSyntaxException.class)
                    .hasMessageContaining("Expected RPAREN");
        }

        @Test
        void shouldRejectTrailingTokens() {
            assertThatThrownBy(() -> ConditionParser.parse("a b"))
                    .isInstanceOf(ConditionSyntaxException.class)
                    .hasMessageContaining("Unexpected token IDENTIFIER at position 2");
        }

        @Test
        void shouldRejectChainedComparison() {
            assertThatThrownBy(() -> ConditionParser.parse("1 < x < 3"))
                    .isInstanceOf(ConditionSyntaxException.class);
        }
    }

    @Test
    void shouldCollectReferencedNamesInOrderWithoutDuplicates() throws Exception {
        // Given
        Expr expr = ConditionParser.parse("BMI >= 18.5 AND (BMI < 25 OR NOT Athlete)");

        // When / Then
        assertThat(ConditionParser.referencedNames(expr)).containsExactly("BMI", "Athlete");
    }
}
