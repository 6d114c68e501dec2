package io.arbor.core.expression;

import java.util.Objects;

/// Immutable AST for legacy condition expressions.
///
/// Produced once per parse by {@link ConditionParser} and never mutated. Carries no type
/// information; type checking happens in {@link ExpressionEvaluator}.
///
/// ### Permitted Subtypes
/// - {@link BinaryOp} - logical (`AND`, `OR`) or comparison operation
/// - {@link UnaryOp} - logical negation
/// - {@link VariableRef} - reference to a variable by friendly name
/// - {@link Literal} - number, string or boolean constant
public sealed interface Expr {

    /// Binary operation over two sub-expressions.
    ///
    /// @param left left operand, not null
    /// @param operator AND, OR or a comparison, not null
    /// @param right right operand, not null
    record BinaryOp(Expr left, ExpressionOperator operator, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    /// Unary operation. Only `NOT` is produced by the parser.
    ///
    /// @param operator the operator, not null
    /// @param operand the negated expression, not null
    record UnaryOp(ExpressionOperator operator, Expr operand) implements Expr {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /// Reference to a variable, resolved against the evaluation context by name.
    ///
    /// @param name the identifier as written, not null
    record VariableRef(String name) implements Expr {
        public VariableRef {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /// Constant value.
    ///
    /// @param value `Long`, `Double`, `String` or `Boolean`, not null
    record Literal(Object value) implements Expr {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
