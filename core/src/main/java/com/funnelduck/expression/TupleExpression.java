package com.funnelduck.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parenthesized list of expressions: {@code (project_id, distinct_id)}.
 */
public final class TupleExpression implements Expression {

    private final List<Expression> elements;

    public TupleExpression(List<Expression> elements) {
        this.elements = new ArrayList<>(Objects.requireNonNull(elements, "elements must not be null"));
    }

    public List<Expression> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TupleExpression)) return false;
        return elements.equals(((TupleExpression) obj).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "Tuple" + elements;
    }
}
