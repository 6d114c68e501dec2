package io.arbor.core.condition;

import java.util.Objects;

/// Predicate attached to a decision node.
///
/// ### Permitted Subtypes
/// - {@link Structured} - typed `{input_id, comparator, value[, value2]}` condition
/// - {@link Expression} - legacy condition text parsed at evaluation time
///
/// Resolution order lives in one place:
/// {@link io.arbor.core.workflow.node.DecisionNode#effectiveCondition()} prefers the
/// structured condition and falls back to the node label.
public sealed interface Condition {

    /// Typed condition evaluated by {@link StructuredConditionEvaluator}.
    ///
    /// @param inputId id of the referenced variable, may be null in partially-built workflows
    /// @param comparator comparator wire name (e.g. `gte`, `str_eq`), may be null
    /// @param value comparison value, may be null
    /// @param value2 upper bound for `within_range`/`date_between`, may be null
    record Structured(String inputId, String comparator, Object value, Object value2)
            implements Condition {

        /// Creates a single-value condition.
        ///
        /// @param inputId referenced variable id, not null
        /// @param comparator comparator wire name, not null
        /// @param value comparison value, may be null
        /// @return new condition, never null
        public static Structured of(String inputId, String comparator, Object value) {
            return new Structured(inputId, comparator, value, null);
        }

        /// Creates a range condition.
        ///
        /// @param inputId referenced variable id, not null
        /// @param comparator `within_range` or `date_between`, not null
        /// @param from lower bound, not null
        /// @param to upper bound, not null
        /// @return new condition, never null
        public static Structured between(String inputId, String comparator, Object from, Object to) {
            return new Structured(inputId, comparator, from, to);
        }
    }

    /// Legacy condition text, e.g. `Age >= 18 AND Smoker == False`.
    ///
    /// @param text the expression source, not null
    record Expression(String text) implements Condition {
        public Expression {
            Objects.requireNonNull(text, "text must not be null");
        }
    }
}
