package com.funnelduck.cohort;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * AND/OR group of cohort conditions. Groups nest.
 */
public final class ConditionGroup implements CohortCondition {

    /**
     * How the members of a group combine.
     */
    public enum Type {
        AND,
        OR
    }

    private final Type type;
    private final List<CohortCondition> values;

    @JsonCreator
    public ConditionGroup(@JsonProperty("type") Type type,
                          @JsonProperty("values") List<CohortCondition> values) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    // ==================== Factory Methods ====================

    public static ConditionGroup and(CohortCondition... values) {
        return new ConditionGroup(Type.AND, List.of(values));
    }

    public static ConditionGroup or(CohortCondition... values) {
        return new ConditionGroup(Type.OR, List.of(values));
    }

    public Type type() {
        return type;
    }

    public List<CohortCondition> values() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ConditionGroup)) return false;
        ConditionGroup that = (ConditionGroup) obj;
        return type == that.type && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, values);
    }

    @Override
    public String toString() {
        return type + values.toString();
    }
}
