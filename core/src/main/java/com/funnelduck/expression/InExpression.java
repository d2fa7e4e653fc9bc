package com.funnelduck.expression;

import java.util.Objects;

/**
 * Membership test, rendered as {@code expr [NOT] IN target}.
 *
 * <p>The target is usually a {@link SubqueryExpression}, a {@link TupleExpression}
 * of candidate values, or an array-typed parameter.
 */
public final class InExpression implements Expression {

    private final Expression operand;
    private final Expression target;
    private final boolean negated;

    public InExpression(Expression operand, Expression target, boolean negated) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.negated = negated;
    }

    public Expression operand() {
        return operand;
    }

    public Expression target() {
        return target;
    }

    public boolean negated() {
        return negated;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return negated == that.negated && operand.equals(that.operand) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand, target, negated);
    }

    @Override
    public String toString() {
        return operand + (negated ? " NOT IN " : " IN ") + target;
    }
}
