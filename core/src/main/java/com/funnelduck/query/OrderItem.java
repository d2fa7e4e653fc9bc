package com.funnelduck.query;

import com.funnelduck.expression.Expression;
import java.util.Objects;

/**
 * One ORDER BY entry.
 */
public final class OrderItem {

    public enum Direction {
        ASC, DESC
    }

    private final Expression expression;
    private final Direction direction;

    public OrderItem(Expression expression, Direction direction) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public Direction direction() {
        return direction;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof OrderItem)) return false;
        OrderItem that = (OrderItem) obj;
        return direction == that.direction && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, direction);
    }
}
