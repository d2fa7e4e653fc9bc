package com.funnelduck.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Array constructor: {@code [a, b, c]}.
 */
public final class ArrayLiteral implements Expression {

    private final List<Expression> elements;

    public ArrayLiteral(List<Expression> elements) {
        this.elements = new ArrayList<>(Objects.requireNonNull(elements, "elements must not be null"));
    }

    public List<Expression> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayLiteral)) return false;
        return elements.equals(((ArrayLiteral) obj).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash("array", elements);
    }

    @Override
    public String toString() {
        return "Array" + elements;
    }
}
