package com.funnelduck.expression;

import java.util.Objects;

/**
 * Logical negation, rendered as {@code NOT expr}.
 */
public final class NotExpression implements Expression {

    private final Expression operand;

    public NotExpression(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NotExpression)) return false;
        return operand.equals(((NotExpression) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash("NOT", operand);
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
