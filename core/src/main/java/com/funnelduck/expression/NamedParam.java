package com.funnelduck.expression;

import java.util.Objects;

/**
 * Parameter with a caller-chosen name.
 *
 * <p>Fragments built independently (a step condition and an exclusion
 * condition, say) share a value by using the same name. Two different values
 * under one name within a compilation are rejected by the compiler.
 */
public final class NamedParam implements Expression {

    private final String name;
    private final String chType;
    private final Object value;

    public NamedParam(String name, String chType, Object value) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.chType = Objects.requireNonNull(chType, "chType must not be null");
        this.value = value;
    }

    public String name() {
        return name;
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
        if (!(obj instanceof NamedParam)) return false;
        NamedParam that = (NamedParam) obj;
        return name.equals(that.name) && chType.equals(that.chType)
            && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, chType, value);
    }

    @Override
    public String toString() {
        return "NamedParam(" + name + ":" + chType + " = " + value + ")";
    }
}
