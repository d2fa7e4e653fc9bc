package com.funnelduck.cohort;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.funnelduck.helpers.FilterOperator;
import java.util.List;
import java.util.Objects;

/**
 * Matches persons whose latest value of a property satisfies an operator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PersonPropertyCondition implements CohortCondition {

    private final String property;
    private final FilterOperator operator;
    private final String value;
    private final List<String> values;

    @JsonCreator
    public PersonPropertyCondition(@JsonProperty("property") String property,
                                   @JsonProperty("operator") FilterOperator operator,
                                   @JsonProperty("value") String value,
                                   @JsonProperty("values") List<String> values) {
        this.property = Objects.requireNonNull(property, "property must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = value == null ? "" : value;
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    public PersonPropertyCondition(String property, FilterOperator operator, String value) {
        this(property, operator, value, null);
    }

    public String property() {
        return property;
    }

    public FilterOperator operator() {
        return operator;
    }

    public String value() {
        return value;
    }

    public List<String> values() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PersonPropertyCondition)) return false;
        PersonPropertyCondition that = (PersonPropertyCondition) obj;
        return property.equals(that.property) && operator == that.operator
            && value.equals(that.value) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, operator, value, values);
    }

    @Override
    public String toString() {
        return "person_property(" + property + " " + operator.wireName() + " " + value + ")";
    }
}
