package com.funnelduck.helpers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * One property condition: {@code property operator value}.
 *
 * <p>{@code value} is used by single-value operators, {@code values} by
 * {@code in}, {@code not_in}, {@code between}, {@code not_between} and the
 * multi-contains operators.
 */
public final class PropertyFilter {

    private final String property;
    private final FilterOperator operator;
    private final String value;
    private final List<String> values;

    @JsonCreator
    public PropertyFilter(@JsonProperty("property") String property,
                          @JsonProperty("operator") FilterOperator operator,
                          @JsonProperty("value") String value,
                          @JsonProperty("values") List<String> values) {
        this.property = Objects.requireNonNull(property, "property must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = value;
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    // ==================== Factory Methods ====================

    public static PropertyFilter of(String property, FilterOperator operator, String value) {
        return new PropertyFilter(property, operator, value, null);
    }

    public static PropertyFilter of(String property, FilterOperator operator) {
        return new PropertyFilter(property, operator, null, null);
    }

    public static PropertyFilter ofValues(String property, FilterOperator operator, List<String> values) {
        return new PropertyFilter(property, operator, null, values);
    }

    public String property() {
        return property;
    }

    public FilterOperator operator() {
        return operator;
    }

    /**
     * Returns the single value, or an empty string when absent.
     */
    public String value() {
        return value == null ? "" : value;
    }

    public List<String> values() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PropertyFilter)) return false;
        PropertyFilter that = (PropertyFilter) obj;
        return property.equals(that.property) && operator == that.operator
            && Objects.equals(value, that.value) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, operator, value, values);
    }

    @Override
    public String toString() {
        return property + " " + operator.wireName() + " " + (values.isEmpty() ? value() : values);
    }
}
