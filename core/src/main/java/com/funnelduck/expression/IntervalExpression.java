package com.funnelduck.expression;

import java.util.Objects;

/**
 * Interval literal such as {@code INTERVAL 7 DAY}.
 *
 * <p>The amount is itself an expression so that it can be a parameter.
 */
public final class IntervalExpression implements Expression {

    /**
     * Interval units understood by ClickHouse.
     */
    public enum Unit {
        SECOND, MINUTE, HOUR, DAY, WEEK, MONTH, QUARTER, YEAR
    }

    private final Expression amount;
    private final Unit unit;

    public IntervalExpression(Expression amount, Unit unit) {
        this.amount = Objects.requireNonNull(amount, "amount must not be null");
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
    }

    public Expression amount() {
        return amount;
    }

    public Unit unit() {
        return unit;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntervalExpression)) return false;
        IntervalExpression that = (IntervalExpression) obj;
        return unit == that.unit && amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, unit);
    }

    @Override
    public String toString() {
        return "INTERVAL " + amount + " " + unit;
    }
}
