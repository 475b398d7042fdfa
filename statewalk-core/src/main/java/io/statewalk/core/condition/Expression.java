package io.statewalk.core.condition;

import java.util.List;
import java.util.Objects;

/// Parsed form of a condition expression.
///
/// ### Permitted Implementations
/// - {@link Literal} - number, string, boolean or null constant
/// - {@link Reference} - attribute reference, bare (`count`) or qualified (`ctx.count`)
/// - {@link Not} - logical negation
/// - {@link Binary} - comparison or logical connective
///
/// @see ConditionParser for the grammar
public sealed interface Expression
        permits Expression.Literal, Expression.Reference, Expression.Not, Expression.Binary {

    /// Constant value.
    ///
    /// @param value `BigDecimal`, `String`, `Boolean` or null
    record Literal(Object value) implements Expression {}

    /// Attribute reference split on dots.
    ///
    /// @param parts identifier parts, at least one
    record Reference(List<String> parts) implements Expression {

        public Reference {
            parts = List.copyOf(parts);
            if (parts.isEmpty()) {
                throw new IllegalArgumentException("reference must have at least one part");
            }
        }

        public boolean isBare() {
            return parts.size() == 1;
        }

        /// Returns the reference as written.
        ///
        /// @return dotted text
        public String text() {
            return String.join(".", parts);
        }
    }

    record Not(Expression operand) implements Expression {

        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /// @param operator the operator, not null
    /// @param left left operand, not null
    /// @param right right operand, not null
    record Binary(Operator operator, Expression left, Expression right) implements Expression {

        public Binary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    enum Operator {
        AND,
        OR,
        EQ,
        NE,
        LT,
        LE,
        GT,
        GE
    }
}
