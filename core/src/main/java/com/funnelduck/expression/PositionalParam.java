package com.funnelduck.expression;

import java.util.Objects;

/**
 * Parameter whose name is assigned by the compiler.
 *
 * <p>Positional parameters are numbered {@code p_0, p_1, ...} in pre-order
 * traversal order, so the same tree always compiles to the same names.
 */
public final class PositionalParam implements Expression {

    private final String chType;
    private final Object value;

    /**
     * Creates a positional parameter.
     *
     * @param chType the ClickHouse type used in the placeholder, e.g. {@code String}
     * @param value the bound value
     */
    public PositionalParam(String chType, Object value) {
        this.chType = Objects.requireNonNull(chType, "chType must not be null");
        this.value = value;
    }

    public String chType() {
        return chType;
    }

    public Object value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PositionalParam)) return false;
        PositionalParam that = (PositionalParam) obj;
        return chType.equals(that.chType) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chType, value);
    }

    @Override
    public String toString() {
        return "Param(" + chType + ", " + value + ")";
    }
}
