package com.funnelduck.expression;

import java.util.Objects;

/**
 * Expression representing a constant rendered inline.
 *
 * <p>Only booleans, numbers and strings are accepted. Booleans render as
 * {@code 1}/{@code 0}; strings are single-quoted with backslash escaping.
 *
 * <p>Literals are for values chosen by the engine itself (JSON path keys that
 * passed validation, sentinel values, numeric offsets). Request values belong in
 * parameter nodes.
 */
public final class Literal implements Expression {

    private final Object value;

    private Literal(Object value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException(
                "Unsupported literal type: " + value.getClass().getSimpleName());
        }
    }

    // ==================== Factory Methods ====================

    public static Literal of(String value) {
        return new Literal(value);
    }

    public static Literal of(long value) {
        return new Literal(value);
    }

    public static Literal of(double value) {
        return new Literal(value);
    }

    public static Literal of(boolean value) {
        return new Literal(value);
    }

    public Object value() {
        return value;
    }

    public boolean isString() {
        return value instanceof String;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Literal(" + value + ")";
    }
}
