package com.funnelduck.expression;

import java.util.Objects;

/**
 * Expression referencing a column, CTE output or lambda parameter by name.
 *
 * <p>The name is emitted verbatim. Callers only build column references from
 * identifiers owned by the query builders, never from request input.
 */
public final class ColumnReference implements Expression {

    private final String name;

    public ColumnReference(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Column(" + name + ")";
    }
}
