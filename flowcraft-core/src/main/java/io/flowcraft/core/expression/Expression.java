package io.flowcraft.core.expression;

/// Abstract syntax tree of the predicate language.
///
/// ### Permitted Subtypes
/// - {@link Literal} - number, string, boolean or null
/// - {@link PathRef} - dot-path into inputs or state
/// - {@link Unary} - `not` and numeric negation
/// - {@link Binary} - comparison, boolean and arithmetic operators
public sealed interface Expression {

    record Literal(Object value) implements Expression {}

    record PathRef(String path) implements Expression {}

    record Unary(Operator operator, Expression operand) implements Expression {}

    record Binary(Operator operator, Expression left, Expression right) implements Expression {}

    enum Operator {
        AND("and"),
        OR("or"),
        NOT("not"),
        NEGATE("-"),
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        boolean isComparison() {
            return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
        }
    }
}
