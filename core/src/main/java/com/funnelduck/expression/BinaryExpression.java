package com.funnelduck.expression;

import java.util.Objects;

/**
 * Infix operation {@code left op right}.
 *
 * <p>Each operator knows its binding strength, so the compiler only adds
 * parentheses where ClickHouse would otherwise regroup the operands:
 * <pre>
 *   OR &lt; AND &lt; NOT &lt; comparisons and LIKE &lt; + - &lt; * / %
 * </pre>
 * Chains of one logical operator are printed flat.
 */
public final class BinaryExpression implements Expression {

    public enum Operator {
        OR("OR", 1, true),
        AND("AND", 2, true),

        EQUAL("=", 4, false),
        NOT_EQUAL("!=", 4, false),
        LESS_THAN("<", 4, false),
        LESS_THAN_OR_EQUAL("<=", 4, false),
        GREATER_THAN(">", 4, false),
        GREATER_THAN_OR_EQUAL(">=", 4, false),
        LIKE("LIKE", 4, false),
        NOT_LIKE("NOT LIKE", 4, false),

        ADD("+", 5, true),
        SUBTRACT("-", 5, false),
        MULTIPLY("*", 6, true),
        DIVIDE("/", 6, false),
        MODULO("%", 6, false);

        /** Binding strength of a prefix {@code NOT}, between AND and the comparisons. */
        public static final int NOT_PRECEDENCE = 3;

        private final String symbol;
        private final int precedence;
        private final boolean associative;

        Operator(String symbol, int precedence, boolean associative) {
            this.symbol = symbol;
            this.precedence = precedence;
            this.associative = associative;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        /**
         * Whether {@code a op (b op c)} equals {@code (a op b) op c}, so the
         * right operand needs no parentheses at equal precedence.
         */
        public boolean associative() {
            return associative;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public static BinaryExpression of(Expression left, Operator operator, Expression right) {
        return new BinaryExpression(left, operator, right);
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
